package qti1to2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A JSON summary of a conversion run: one entry per input file, one per item, with the item
 * logs and validation findings, plus totals.
 */
public final class MigrationReport
{
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ObjectNode root = mapper.createObjectNode();
    private final ArrayNode files = root.putArray("files");

    private int fileCount;
    private int failedFiles;
    private int converted;
    private int failedItems;
    private int warnings;
    private int errors;
    private int validationIssues;

    /** Starts the entry for an input file. */
    public ObjectNode file(String relativePath)
    {
        fileCount++;
        ObjectNode f = files.addObject();
        f.put("path", relativePath);
        f.putArray("items");
        return f;
    }

    public void fileFailed(ObjectNode file, String reason)
    {
        failedFiles++;
        file.put("error", reason);
    }

    public ObjectNode item(ObjectNode file, ItemOutcome outcome, String output)
    {
        ObjectNode i = ((ArrayNode) file.get("items")).addObject();
        i.put("ident", outcome.getLegacyIdent());
        i.put("identifier", outcome.getIdentifier());
        i.put("status", outcome.getStatus().name());
        if (output != null)
        {
            i.put("output", output);
        }
        if (outcome.getFailure() != null)
        {
            i.put("failure", outcome.getFailure().toString());
        }
        issues(i.putArray("log"), outcome.getLog());
        if (!outcome.getFixups().isEmpty())
        {
            ObjectNode fx = i.putObject("fixups");
            outcome.getFixups().forEach((base, ids) ->
            {
                ArrayNode a = fx.putArray(base);
                ids.forEach(a::add);
            });
        }

        if (outcome.isConverted())
        {
            converted++;
        }
        else
        {
            failedItems++;
        }
        warnings += outcome.count(Severity.WARNING);
        errors += outcome.count(Severity.ERROR);
        return i;
    }

    public void validation(ObjectNode item, ItemValidator.ValidationResult vr)
    {
        issues(item.putArray("validation"), vr.getIssues());
        validationIssues += vr.getIssues().size();
    }

    private static void issues(ArrayNode out, List<MigrationIssue> issues)
    {
        for (MigrationIssue issue : issues)
        {
            ObjectNode o = out.addObject();
            o.put("severity", issue.severity.name());
            o.put("path", issue.path);
            o.put("message", issue.message);
        }
    }

    public int getFailedFiles()
    {
        return failedFiles;
    }

    public int getFailedItems()
    {
        return failedItems;
    }

    public int getConverted()
    {
        return converted;
    }

    public int getWarnings()
    {
        return warnings;
    }

    public int getErrors()
    {
        return errors;
    }

    public int getValidationIssues()
    {
        return validationIssues;
    }

    public ObjectNode toJson()
    {
        ObjectNode totals = root.putObject("totals");
        totals.put("files", fileCount);
        totals.put("failedFiles", failedFiles);
        totals.put("convertedItems", converted);
        totals.put("failedItems", failedItems);
        totals.put("warnings", warnings);
        totals.put("errors", errors);
        totals.put("validationIssues", validationIssues);
        return root;
    }

    public void write(Path path) throws IOException
    {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
        {
            Files.createDirectories(parent);
        }
        mapper.writeValue(path.toFile(), toJson());
    }
}
