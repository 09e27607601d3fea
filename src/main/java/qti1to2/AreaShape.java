package qti1to2;

import java.util.Locale;

/** The rarea attribute of a response_label. */
public enum AreaShape
{
    ELLIPSE,
    RECTANGLE,
    BOUNDED;

    static AreaShape fromLegacy(String rarea)
    {
        if (rarea == null)
        {
            return ELLIPSE;
        }
        switch (rarea.trim().toLowerCase(Locale.ROOT))
        {
            case "rectangle":
                return RECTANGLE;
            case "bounded":
                return BOUNDED;
            default:
                return ELLIPSE;
        }
    }
}
