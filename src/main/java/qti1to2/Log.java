package qti1to2;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Console logging for the converter: INFO to stdout, everything else to stderr, and every line
 * mirrored to an optional log file.
 */
public final class Log implements Closeable
{
    public static final String DEBUG_PROPERTY = "qti1to2.debug";

    private final PrintStream out;
    private final PrintStream err;
    private final PrintStream file;
    private final boolean debug;

    public static Log open(Path logPath, boolean debug) throws IOException
    {
        PrintStream f = null;
        if (logPath != null)
        {
            Path parent = logPath.toAbsolutePath().getParent();
            if (parent != null)
            {
                Files.createDirectories(parent);
            }
            f = new PrintStream(Files.newOutputStream(logPath, StandardOpenOption.CREATE, StandardOpenOption.APPEND),
                true, StandardCharsets.UTF_8);
        }
        return new Log(System.out, System.err, f, debug || Boolean.getBoolean(DEBUG_PROPERTY));
    }

    /** A log that writes nowhere, for library use without a console. */
    public static Log quiet()
    {
        PrintStream nowhere = new PrintStream(OutputStream.nullOutputStream());
        return new Log(nowhere, nowhere, null, false);
    }

    Log(PrintStream out, PrintStream err, PrintStream file, boolean debug)
    {
        this.out = out;
        this.err = err;
        this.file = file;
        this.debug = debug;
    }

    PrintStream err()
    {
        return err;
    }

    public boolean isDebug()
    {
        return debug;
    }

    public void info(String msg)
    {
        println(out, "INFO ", msg);
    }

    public void warn(String msg)
    {
        println(err, "WARN ", msg);
    }

    public void error(String msg)
    {
        println(err, "ERROR", msg);
    }

    public void debug(String msg)
    {
        if (!debug)
        {
            return;
        }
        println(err, "DEBUG", msg);
    }

    private void println(PrintStream ps, String level, String msg)
    {
        String line = level + " " + msg;
        ps.println(line);
        if (file != null)
        {
            file.println(line);
        }
    }

    @Override
    public void close()
    {
        if (file != null)
        {
            file.close();
        }
    }
}
