package qti1to2;

public enum RenderKind
{
    CHOICE,
    HOTSPOT,
    SLIDER,
    FIB,
    EXTENSION
}
