package qti1to2;

import java.util.Locale;

public enum TextType
{
    PLAIN,
    HTML,
    RTF;

    static TextType fromMimeType(String texttype)
    {
        if (texttype == null)
        {
            return PLAIN;
        }
        String t = texttype.trim().toLowerCase(Locale.ROOT);
        if ("text/html".equals(t) || "text/xhtml".equals(t))
        {
            return HTML;
        }
        if ("text/rtf".equals(t))
        {
            return RTF;
        }
        return PLAIN;
    }
}
