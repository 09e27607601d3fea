package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descriptive metadata carried over from a legacy item: its comment, qti metadata fields and the
 * migration log, which is kept as an annotation.
 */
public final class MetadataRecord
{
    /** Source of values drawn from the LOM vocabularies. */
    public static final String LOM_SOURCE = "LOMv1.0";
    /** Source of the status values only QTI 1 defines. */
    public static final String QTI_SOURCE = "QTIv1";
    public static final String UNKNOWN_SOURCE = "None";

    private final String identifier;
    private String title;
    private String lang;
    private final List<String> descriptions = new ArrayList<>();
    private final List<String> educationalDescriptions = new ArrayList<>();
    private final List<String> keywords = new ArrayList<>();
    private final List<String> annotations = new ArrayList<>();
    private Vocabulary status;
    private final List<Contribution> contributions = new ArrayList<>();
    private final List<Vocabulary> contexts = new ArrayList<>();
    private final List<Vocabulary> difficulties = new ArrayList<>();
    private final List<String> toolVendors = new ArrayList<>();

    public MetadataRecord(String identifier)
    {
        this.identifier = identifier;
    }

    public String getIdentifier()
    {
        return identifier;
    }

    public String getTitle()
    {
        return title;
    }

    public MetadataRecord withTitle(String title)
    {
        this.title = ContentNode.blankToNull(title);
        return this;
    }

    public String getLang()
    {
        return lang;
    }

    public MetadataRecord withLang(String lang)
    {
        this.lang = ContentNode.blankToNull(lang);
        return this;
    }

    public MetadataRecord addDescription(String text)
    {
        addIfPresent(descriptions, text);
        return this;
    }

    public MetadataRecord addEducationalDescription(String text)
    {
        addIfPresent(educationalDescriptions, text);
        return this;
    }

    public MetadataRecord addKeyword(String keyword)
    {
        addIfPresent(keywords, keyword);
        return this;
    }

    public MetadataRecord addAnnotation(String text)
    {
        addIfPresent(annotations, text);
        return this;
    }

    public MetadataRecord withStatus(Vocabulary status)
    {
        this.status = status;
        return this;
    }

    public MetadataRecord addContribution(Contribution contribution)
    {
        contributions.add(contribution);
        return this;
    }

    public MetadataRecord addContext(Vocabulary context)
    {
        contexts.add(context);
        return this;
    }

    public MetadataRecord addDifficulty(Vocabulary difficulty)
    {
        difficulties.add(difficulty);
        return this;
    }

    public MetadataRecord addToolVendor(String vendor)
    {
        addIfPresent(toolVendors, vendor);
        return this;
    }

    private static void addIfPresent(List<String> list, String text)
    {
        String t = ContentNode.blankToNull(text);
        if (t != null)
        {
            list.add(t);
        }
    }

    public List<String> getDescriptions()
    {
        return Collections.unmodifiableList(descriptions);
    }

    public List<String> getEducationalDescriptions()
    {
        return Collections.unmodifiableList(educationalDescriptions);
    }

    public List<String> getKeywords()
    {
        return Collections.unmodifiableList(keywords);
    }

    public List<String> getAnnotations()
    {
        return Collections.unmodifiableList(annotations);
    }

    /** The lifecycle status, or null. */
    public Vocabulary getStatus()
    {
        return status;
    }

    public List<Contribution> getContributions()
    {
        return Collections.unmodifiableList(contributions);
    }

    public List<Vocabulary> getContexts()
    {
        return Collections.unmodifiableList(contexts);
    }

    public List<Vocabulary> getDifficulties()
    {
        return Collections.unmodifiableList(difficulties);
    }

    public List<String> getToolVendors()
    {
        return Collections.unmodifiableList(toolVendors);
    }

    /** A vocabulary value and the vocabulary it is taken from. */
    public static final class Vocabulary
    {
        public final String source;
        public final String value;

        public Vocabulary(String source, String value)
        {
            this.source = source;
            this.value = value;
        }

        @Override
        public String toString()
        {
            return source + ":" + value;
        }
    }

    /** A lifecycle contribution: a role and the vCards of the people or bodies that filled it. */
    public static final class Contribution
    {
        public final Vocabulary role;
        public final List<String> entities;

        public Contribution(String role, List<String> entities)
        {
            this.role = new Vocabulary(LOM_SOURCE, role);
            this.entities = Collections.unmodifiableList(new ArrayList<>(entities));
        }
    }

    /**
     * A minimal vCard 3.0 for a contributor name. Organizations also get an ORG line.
     */
    static String vCard(String name, boolean organization)
    {
        String n = name.trim().replace("\\", "\\\\").replace(";", "\\;").replace(",", "\\,");
        StringBuilder sb = new StringBuilder();
        sb.append("BEGIN:VCARD\n");
        sb.append("VERSION:3.0\n");
        sb.append("N:").append(n).append(";;;;\n");
        sb.append("FN:").append(n).append('\n');
        if (organization)
        {
            sb.append("ORG:").append(n).append('\n');
        }
        sb.append("END:VCARD\n");
        return sb.toString();
    }
}
