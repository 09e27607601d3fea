package qti1to2;

public enum Severity
{
    ERROR,
    WARNING
}
