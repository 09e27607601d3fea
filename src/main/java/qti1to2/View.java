package qti1to2;

import java.util.Locale;

/**
 * The legacy view attribute of objectives, rubric and itemfeedback, with its QTI 2.1 mapping.
 */
public enum View
{
    ALL("All", null, false),
    ADMINISTRATOR("Administrator", "proctor", true),
    ADMIN_AUTHORITY("AdminAuthority", "proctor", true),
    ASSESSOR("Assessor", "scorer", true),
    AUTHOR("Author", "author", false),
    CANDIDATE("Candidate", "candidate", false),
    INVIGILATOR_PROCTOR("InvigilatorProctor", "proctor", false),
    PSYCHOMETRICIAN("Psychometrician", "testConstructor", true),
    SCORER("Scorer", "scorer", false),
    TUTOR("Tutor", "tutor", false);

    /** Every view QTI 2.1 knows, used when a legacy block is shown to all. */
    public static final String ALL_V2_VIEWS = "author candidate proctor scorer testConstructor tutor";

    private final String legacyName;
    private final String v2Name;
    private final boolean approximate;

    View(String legacyName, String v2Name, boolean approximate)
    {
        this.legacyName = legacyName;
        this.v2Name = v2Name;
        this.approximate = approximate;
    }

    public String legacyName()
    {
        return legacyName;
    }

    /** The QTI 2.1 view list this view becomes. */
    public String v2Views()
    {
        return this == ALL ? ALL_V2_VIEWS : v2Name;
    }

    /** True when the mapping loses information and deserves a warning. */
    public boolean isApproximate()
    {
        return approximate;
    }

    static View fromLegacy(String view)
    {
        if (view == null || view.trim().isEmpty())
        {
            return ALL;
        }
        String v = view.trim().toLowerCase(Locale.ROOT);
        for (View candidate : values())
        {
            if (candidate.legacyName.toLowerCase(Locale.ROOT).equals(v))
            {
                return candidate;
            }
        }
        if ("proctor".equals(v) || "invigilator".equals(v))
        {
            return INVIGILATOR_PROCTOR;
        }
        return ALL;
    }
}
