package qti1to2;

/**
 * Raised when a legacy document cannot be read or a converted document cannot be written.
 * Problems inside an item never raise this; they go to the item's migration log.
 */
public class MigrationException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public MigrationException(String message)
    {
        super(message);
    }

    public MigrationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
