package qti1to2;

/**
 * Repairs legacy identifiers into XML NCNames, which QTI 2.1 requires for every identifier.
 */
public final class Identifiers
{
    private Identifiers()
    {
    }

    public static String toNcName(String value)
    {
        return toNcName(value, "_");
    }

    /**
     * Returns value as an NCName. A value that does not begin with a name start character gets
     * the prefix, colons become hyphens and any other illegal character becomes an underscore.
     * An empty value yields the prefix alone.
     */
    public static String toNcName(String value, String prefix)
    {
        if (value == null || value.isEmpty())
        {
            return prefix;
        }
        StringBuilder sb = new StringBuilder(value.length() + prefix.length());
        int first = value.codePointAt(0);
        if (first == ':' || !isNameStartChar(first))
        {
            sb.append(prefix);
        }
        for (int i = 0; i < value.length(); )
        {
            int cp = value.codePointAt(i);
            if (cp == ':')
            {
                sb.append('-');
            }
            else if (isNameChar(cp))
            {
                sb.appendCodePoint(cp);
            }
            else
            {
                sb.append('_');
            }
            i += Character.charCount(cp);
        }
        return sb.toString();
    }

    public static boolean isNcName(String value)
    {
        return value != null && !value.isEmpty() && value.equals(toNcName(value, "_"));
    }

    static boolean isNameStartChar(int c)
    {
        return c == ':' || c == '_'
            || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')
            || (c >= 0xC0 && c <= 0xD6) || (c >= 0xD8 && c <= 0xF6) || (c >= 0xF8 && c <= 0x2FF)
            || (c >= 0x370 && c <= 0x37D) || (c >= 0x37F && c <= 0x1FFF)
            || (c >= 0x200C && c <= 0x200D) || (c >= 0x2070 && c <= 0x218F)
            || (c >= 0x2C00 && c <= 0x2FEF) || (c >= 0x3001 && c <= 0xD7FF)
            || (c >= 0xF900 && c <= 0xFDCF) || (c >= 0xFDF0 && c <= 0xFFFD)
            || (c >= 0x10000 && c <= 0xEFFFF);
    }

    static boolean isNameChar(int c)
    {
        return isNameStartChar(c) || c == '-' || c == '.' || (c >= '0' && c <= '9') || c == 0xB7
            || (c >= 0x300 && c <= 0x36F) || (c >= 0x203F && c <= 0x2040);
    }
}
