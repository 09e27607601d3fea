package qti1to2;

import java.util.Locale;

public enum Cardinality
{
    SINGLE("single"),
    MULTIPLE("multiple"),
    ORDERED("ordered");

    private final String qtiName;

    Cardinality(String qtiName)
    {
        this.qtiName = qtiName;
    }

    public String qtiName()
    {
        return qtiName;
    }

    /** Parses the rcardinality attribute, defaulting to Single. */
    static Cardinality fromLegacy(String rcardinality)
    {
        if (rcardinality == null || rcardinality.trim().isEmpty())
        {
            return SINGLE;
        }
        switch (rcardinality.trim().toLowerCase(Locale.ROOT))
        {
            case "multiple":
                return MULTIPLE;
            case "ordered":
                return ORDERED;
            default:
                return SINGLE;
        }
    }
}
