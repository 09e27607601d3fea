package qti1to2;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The result of migrating one legacy item: either a converted QTI 2.1 item with its metadata, or
 * the unsupported combination that stopped it. The diagnostic log is kept either way.
 */
public final class ItemOutcome
{
    public enum Status
    {
        CONVERTED,
        FAILED
    }

    private final Status status;
    private final String legacyIdent;
    private final String identifier;
    private final QtiV2Document document;
    private final MetadataRecord metadata;
    private final List<MigrationIssue> log;
    private final Map<String, List<String>> fixups;
    private final UnsupportedCombination failure;

    private ItemOutcome(Status status, String legacyIdent, String identifier, QtiV2Document document,
        MetadataRecord metadata, List<MigrationIssue> log, Map<String, List<String>> fixups,
        UnsupportedCombination failure)
    {
        this.status = status;
        this.legacyIdent = legacyIdent;
        this.identifier = identifier;
        this.document = document;
        this.metadata = metadata;
        this.log = log;
        this.fixups = fixups;
        this.failure = failure;
    }

    static ItemOutcome converted(String legacyIdent, String identifier, QtiV2Document document,
        MetadataRecord metadata, MigrationContext ctx)
    {
        return new ItemOutcome(Status.CONVERTED, legacyIdent, identifier, document, metadata, ctx.getLog(),
            ctx.getFixups(), null);
    }

    static ItemOutcome failed(String legacyIdent, String identifier, MigrationContext ctx)
    {
        return new ItemOutcome(Status.FAILED, legacyIdent, identifier, null, null, ctx.getLog(),
            Collections.<String, List<String>>emptyMap(), ctx.getFailure());
    }

    public Status getStatus()
    {
        return status;
    }

    public boolean isConverted()
    {
        return status == Status.CONVERTED;
    }

    public String getLegacyIdent()
    {
        return legacyIdent;
    }

    /** The repaired identifier of the target item; also the output file stem. */
    public String getIdentifier()
    {
        return identifier;
    }

    /** The converted item, null when failed. */
    public QtiV2Document getDocument()
    {
        return document;
    }

    public MetadataRecord getMetadata()
    {
        return metadata;
    }

    public List<MigrationIssue> getLog()
    {
        return log;
    }

    /** Base identifier to the identifiers of the interactions it was split into. */
    public Map<String, List<String>> getFixups()
    {
        return fixups;
    }

    public UnsupportedCombination getFailure()
    {
        return failure;
    }

    public int count(Severity severity)
    {
        int c = 0;
        for (MigrationIssue i : log)
        {
            if (i.severity == severity)
            {
                c++;
            }
        }
        return c;
    }

    @Override
    public String toString()
    {
        return status + " " + legacyIdent + (failure != null ? " (" + failure + ")" : "");
    }
}
