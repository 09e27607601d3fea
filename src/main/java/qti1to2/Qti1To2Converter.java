package qti1to2;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts a directory tree of QTI 1.2 documents into QTI 2.1 items.
 *
 * Every .xml file under the input directory is read as a questestinterop document and each item
 * it holds is written to {@code <out>/<relative dir>/<file stem>/<item id>.xml}, with its LOM
 * metadata next to it as {@code <item id>_md.xml}. Any other file (images, stylesheets) is copied
 * across unchanged so relative references keep working.
 */
public final class Qti1To2Converter
{
    // ---------------- CLI / options ----------------

    static final class Options
    {
        Path inPath;
        Path outDir;

        boolean debug = false;
        boolean validate = false;
        boolean strict = false;
        boolean pretty = false;

        Path contentModelPath = null;
        Path reportPath = null;
        Path logPath = null;
    }

    public static void main(String[] args) throws IOException
    {
        Options opts;
        try
        {
            opts = parseArgs(args);
        }
        catch (IllegalArgumentException ex)
        {
            die(ex.getMessage());
            return;
        }

        int status;
        try (Log log = Log.open(opts.logPath, opts.debug))
        {
            status = run(opts, log);
        }
        System.exit(status);
    }

    static Options parseArgs(String[] args)
    {
        if (args.length < 2)
        {
            throw new IllegalArgumentException("Missing <input> and <outputDir>");
        }

        Options o = new Options();
        o.inPath = Paths.get(args[0]);
        o.outDir = Paths.get(args[1]);

        for (int i = 2; i < args.length; i++)
        {
            String a = args[i];
            switch (a)
            {
                case "--debug":
                case "-v":
                    o.debug = true;
                    break;

                case "--validate":
                    o.validate = true;
                    break;

                case "--strict":
                    o.validate = true;
                    o.strict = true;
                    break;

                case "--pretty":
                    o.pretty = true;
                    break;

                case "--content-model":
                    o.contentModelPath = Paths.get(value(args, ++i, a));
                    break;

                case "--report":
                    o.reportPath = Paths.get(value(args, ++i, a));
                    break;

                case "--log":
                    o.logPath = Paths.get(value(args, ++i, a));
                    break;

                default:
                    throw new IllegalArgumentException("Unknown argument: " + a);
            }
        }
        return o;
    }

    private static String value(String[] args, int i, String flag)
    {
        if (i >= args.length)
        {
            throw new IllegalArgumentException("Missing value after " + flag);
        }
        return args[i];
    }

    private static void usage()
    {
        System.err.println("Usage: java -jar qti1to2.jar <input> <outputDir> [--debug] [--validate] [--strict] [--pretty] [--content-model <path>] [--report <file>] [--log <file>]");
        System.err.println("  <input>                 A QTI 1.2 file, or a directory searched for *.xml");
        System.err.println("  --validate              Check converted items against the QTI 2.1 content model");
        System.err.println("  --strict                Validate, and fail the run on any validation finding");
        System.err.println("  --pretty                Indent the output");
        System.err.println("  --content-model <path>  qti21-content-model.json, or a directory containing it (default: classpath)");
        System.err.println("  --report <file>         Write a JSON report of the run");
        System.err.println("  --log <file>            Also write all converter output to this log file");
    }

    private static void die(String msg)
    {
        System.err.println(msg);
        usage();
        System.exit(2);
    }

    // ---------------- conversion ----------------

    /**
     * Runs a conversion.
     *
     * @return the exit status: 0 when everything converted, 1 when a file or an item failed (or,
     *         with --strict, when validation found anything), 2 when the run could not start
     */
    static int run(Options opts, Log log) throws IOException
    {
        if (!Files.exists(opts.inPath))
        {
            log.error("Input not found: " + opts.inPath);
            return 2;
        }

        ContentModel model;
        try
        {
            model = ContentModel.locate(opts.contentModelPath);
            log.debug("Loaded content model: " + model.getSourceDescription());
        }
        catch (MigrationException ex)
        {
            log.error(ex.getMessage());
            return 2;
        }

        Run run = new Run(opts, log, model);
        Files.createDirectories(opts.outDir);
        if (Files.isDirectory(opts.inPath))
        {
            run.convertTree();
        }
        else
        {
            run.convertFile(opts.inPath, opts.inPath.getFileName());
        }

        MigrationReport report = run.report;
        log.info("Done. Items converted=" + report.getConverted() + " failed=" + report.getFailedItems()
            + " files failed=" + report.getFailedFiles() + " warnings=" + report.getWarnings()
            + " errors=" + report.getErrors()
            + (opts.validate ? " validation issues=" + report.getValidationIssues() : ""));

        if (opts.reportPath != null)
        {
            report.write(opts.reportPath);
            log.info("Report written to " + opts.reportPath);
        }

        if (report.getFailedFiles() > 0 || report.getFailedItems() > 0)
        {
            return 1;
        }
        if (opts.strict && report.getValidationIssues() > 0)
        {
            log.error("Strict mode: validation reported " + report.getValidationIssues() + " issue(s)");
            return 1;
        }
        return 0;
    }

    private static final class Run
    {
        final Options opts;
        final Log log;
        final LegacyDocumentReader reader;
        final ItemMigrator migrator;
        final ItemValidator validator;
        final MigrationReport report = new MigrationReport();

        Run(Options opts, Log log, ContentModel model)
        {
            this.opts = opts;
            this.log = log;
            this.reader = new LegacyDocumentReader(log);
            this.migrator = new ItemMigrator(model);
            this.validator = opts.validate ? new ItemValidator(model) : null;
        }

        void convertTree() throws IOException
        {
            Path inDir = opts.inPath;
            Path outDir = opts.outDir.toAbsolutePath().normalize();
            List<Path> inputs = new ArrayList<>();

            Files.walkFileTree(inDir, new SimpleFileVisitor<Path>()
            {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
                {
                    // the output may live inside the input tree
                    return dir.toAbsolutePath().normalize().equals(outDir)
                        ? FileVisitResult.SKIP_SUBTREE
                        : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException
                {
                    if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xml"))
                    {
                        inputs.add(file);
                    }
                    else
                    {
                        Path target = opts.outDir.resolve(inDir.relativize(file).toString());
                        Files.createDirectories(target.getParent());
                        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
                        log.debug("Copied: " + inDir.relativize(file));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });

            inputs.sort(null);
            log.info("Found " + inputs.size() + " .xml files under " + inDir.toAbsolutePath());
            for (Path file : inputs)
            {
                convertFile(file, inDir.relativize(file));
            }
        }

        void convertFile(Path file, Path rel) throws IOException
        {
            log.info("Converting: " + rel);
            ObjectNode entry = report.file(rel.toString().replace('\\', '/'));

            LegacyDocument doc;
            try
            {
                doc = reader.read(file);
            }
            catch (MigrationException ex)
            {
                log.error(rel + ": " + ex.getMessage());
                report.fileFailed(entry, ex.getMessage());
                return;
            }

            String stem = stem(rel.getFileName().toString());
            Path dir = rel.getParent() == null ? opts.outDir.resolve(stem) : opts.outDir.resolve(rel.getParent().toString()).resolve(stem);
            Set<String> names = new HashSet<>();

            for (ItemOutcome outcome : migrator.migrate(doc))
            {
                for (MigrationIssue issue : outcome.getLog())
                {
                    String line = rel + " " + issue.path + ": " + issue.message;
                    if (issue.severity == Severity.ERROR)
                    {
                        log.error(line);
                    }
                    else
                    {
                        log.warn(line);
                    }
                }

                if (!outcome.isConverted())
                {
                    log.error(rel + ": item " + outcome.getLegacyIdent() + " not converted: " + outcome.getFailure());
                    report.item(entry, outcome, null);
                    continue;
                }

                String name = uniqueName(outcome.getIdentifier(), names);
                Files.createDirectories(dir);
                Path itemFile = dir.resolve(name + ".xml");
                try (OutputStream out = Files.newOutputStream(itemFile))
                {
                    outcome.getDocument().write(out, opts.pretty);
                }
                try (OutputStream out = Files.newOutputStream(dir.resolve(name + "_md.xml")))
                {
                    MetadataWriter.write(outcome.getMetadata(), out, opts.pretty);
                }
                log.debug("Wrote " + itemFile);

                ObjectNode item = report.item(entry, outcome, opts.outDir.relativize(itemFile).toString().replace('\\', '/'));
                if (validator != null)
                {
                    ItemValidator.ValidationResult vr = validator.validate(outcome.getDocument().dom(), opts.strict);
                    for (MigrationIssue issue : vr.getIssues())
                    {
                        String line = "[VALIDATE] " + rel + " " + name + " " + issue.path + ": " + issue.message;
                        if (issue.severity == Severity.ERROR)
                        {
                            log.error(line);
                        }
                        else
                        {
                            log.warn(line);
                        }
                    }
                    report.validation(item, vr);
                }
            }
        }
    }

    static String stem(String fileName)
    {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /** Items of one file share a directory; a repeated identifier gets a numeric suffix. */
    static String uniqueName(String identifier, Set<String> used)
    {
        String name = identifier;
        int n = 1;
        while (!used.add(name))
        {
            n++;
            name = identifier + "-" + n;
        }
        return name;
    }
}
