package qti1to2;

import java.util.Objects;

/**
 * One entry of an item's migration log. The path names the legacy element being migrated when
 * the entry was made.
 */
public final class MigrationIssue
{
    public final Severity severity;
    public final String path;
    public final String message;

    public MigrationIssue(Severity severity, String path, String message)
    {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.path = Objects.requireNonNull(path, "path");
        this.message = Objects.requireNonNull(message, "message");
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof MigrationIssue))
        {
            return false;
        }
        MigrationIssue other = (MigrationIssue) o;
        return severity == other.severity && path.equals(other.path) && message.equals(other.message);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(severity, path, message);
    }

    /** The form written into item metadata: "Warning: ..." or "Error: ...". */
    @Override
    public String toString()
    {
        return (severity == Severity.ERROR ? "Error: " : "Warning: ") + message;
    }
}
