package qti1to2;

import java.util.Locale;

/** The numtype of a response_num. */
public enum NumType
{
    INTEGER,
    DECIMAL,
    SCIENTIFIC;

    static NumType fromLegacy(String numtype)
    {
        if (numtype == null)
        {
            return INTEGER;
        }
        switch (numtype.trim().toLowerCase(Locale.ROOT))
        {
            case "decimal":
                return DECIMAL;
            case "scientific":
                return SCIENTIFIC;
            default:
                return INTEGER;
        }
    }
}
