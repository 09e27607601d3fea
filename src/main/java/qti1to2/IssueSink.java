package qti1to2;

/**
 * Receives migration diagnostics.
 */
public interface IssueSink
{
    /** Discards everything; used for speculative work such as overlap testing. */
    IssueSink NONE = (severity, message) -> { };

    void add(Severity severity, String message);

    default void warn(String message)
    {
        add(Severity.WARNING, message);
    }

    default void error(String message)
    {
        add(Severity.ERROR, message);
    }
}
