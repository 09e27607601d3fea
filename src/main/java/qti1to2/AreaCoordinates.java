package qti1to2;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Translates legacy area coordinates (a response_label's rarea plus its character data) into
 * QTI 2.1 shapes, and provides the geometry used for hotspot image matching.
 */
public final class AreaCoordinates
{
    /** The stage assumed when a shape has no extent of its own. */
    private static final int[] DEFAULT_BOUNDS = {0, 0, 1024, 768};

    private AreaCoordinates()
    {
    }

    /** A QTI 2.1 shape keyword. */
    public enum TargetShape
    {
        RECT("rect"),
        CIRCLE("circle"),
        ELLIPSE("ellipse"),
        POLY("poly"),
        DEFAULT("default");

        private final String qtiName;

        TargetShape(String qtiName)
        {
            this.qtiName = qtiName;
        }

        public String qtiName()
        {
            return qtiName;
        }
    }

    /** A translated shape. */
    public static final class Shape
    {
        public final TargetShape shape;
        private final int[] coords;

        public Shape(TargetShape shape, int[] coords)
        {
            this.shape = shape;
            this.coords = coords.clone();
        }

        public int[] coords()
        {
            return coords.clone();
        }

        /** The coords attribute value. */
        public String coordsText()
        {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < coords.length; i++)
            {
                if (i > 0)
                {
                    sb.append(',');
                }
                sb.append(coords[i]);
            }
            return sb.toString();
        }

        @Override
        public String toString()
        {
            return shape.qtiName() + Arrays.toString(coords);
        }
    }

    /**
     * Splits raw coordinate text into integers. Digits and one decimal point form a token and
     * any other character separates tokens; each token's value is truncated to an integer.
     */
    public static List<Integer> tokenize(String raw)
    {
        List<Integer> values = new ArrayList<>();
        if (raw == null)
        {
            return values;
        }
        StringBuilder token = new StringBuilder();
        boolean point = false;
        for (int i = 0; i < raw.length(); i++)
        {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9')
            {
                token.append(c);
            }
            else if (c == '.' && !point)
            {
                token.append(c);
                point = true;
            }
            else
            {
                flushToken(token, values);
                point = false;
                if (c == '.')
                {
                    // a second point starts a new token
                    token.append(c);
                    point = true;
                }
            }
        }
        flushToken(token, values);
        return values;
    }

    private static void flushToken(StringBuilder token, List<Integer> values)
    {
        if (token.length() == 0)
        {
            return;
        }
        String t = token.toString();
        token.setLength(0);
        if (".".equals(t))
        {
            return;
        }
        values.add((int) Double.parseDouble(t));
    }

    /**
     * Translates a legacy area into a QTI 2.1 shape.
     *
     * Rectangles are given as x, y, height, width and become opposite corners. Ellipses are given
     * as centre plus the two diameters; equal diameters make a circle, anything else makes the
     * deprecated ellipse. Short coordinate lists are padded, with a warning, never rejected.
     */
    public static Shape translate(AreaShape area, String raw, IssueSink log)
    {
        List<Integer> c = tokenize(raw);
        if (area == AreaShape.RECTANGLE)
        {
            if (c.size() < 4)
            {
                log.warn("not enough coordinates for rectangle, padding with zeros");
                pad(c, 4);
            }
            int x = c.get(0);
            int y = c.get(1);
            long right = (long) x + c.get(3) - 1;
            long bottom = (long) y + c.get(2) - 1;
            if (right != (int) right || bottom != (int) bottom)
            {
                log.warn("rectangle extends beyond the coordinate range, clamping");
            }
            return new Shape(TargetShape.RECT, new int[] {x, y, saturate(right), saturate(bottom)});
        }
        if (area == AreaShape.ELLIPSE)
        {
            if (c.size() < 2)
            {
                log.warn("not enough coordinates to locate ellipse, padding with zero");
                pad(c, 2);
            }
            if (c.size() == 2)
            {
                log.warn("ellipse has no radius, treating as circle radius 4");
                c.add(8);
                c.add(8);
            }
            else if (c.size() == 3)
            {
                log.warn("only one radius given for ellipse, assuming circular");
                c.add(c.get(2));
            }
            int x = c.get(0);
            int y = c.get(1);
            if (c.get(2).equals(c.get(3)))
            {
                return new Shape(TargetShape.CIRCLE, new int[] {x, y, c.get(2) / 2});
            }
            log.warn("ellipse shape is deprecated in version 2");
            return new Shape(TargetShape.ELLIPSE, new int[] {x, y, c.get(2) / 2, c.get(3) / 2});
        }
        return new Shape(TargetShape.POLY, toArray(c));
    }

    /**
     * The bounding box of a shape as x1, y1, x2, y2. A shape without usable coordinates covers
     * the default stage.
     */
    public static int[] bounds(Shape s)
    {
        int[] c = s.coords;
        switch (s.shape)
        {
            case CIRCLE:
                if (c.length >= 3)
                {
                    return new int[] {c[0] - c[2], c[1] - c[2], c[0] + c[2], c[1] + c[2]};
                }
                break;
            case ELLIPSE:
                if (c.length >= 4)
                {
                    return new int[] {c[0] - c[2], c[1] - c[3], c[0] + c[2], c[1] + c[3]};
                }
                break;
            case POLY:
                if (c.length >= 2)
                {
                    int[] b = {c[0], c[1], c[0], c[1]};
                    for (int i = 2; i + 1 < c.length; i += 2)
                    {
                        b[0] = Math.min(b[0], c[i]);
                        b[1] = Math.min(b[1], c[i + 1]);
                        b[2] = Math.max(b[2], c[i]);
                        b[3] = Math.max(b[3], c[i + 1]);
                    }
                    return b;
                }
                break;
            case RECT:
                if (c.length >= 4)
                {
                    return new int[] {c[0], c[1], c[2], c[3]};
                }
                break;
            default:
                break;
        }
        return DEFAULT_BOUNDS.clone();
    }

    /**
     * Moves a shape by (-dx, -dy), expressing stage coordinates relative to an image placed at
     * (dx, dy). Radii are left alone.
     */
    public static Shape offset(Shape s, int dx, int dy)
    {
        int[] c = s.coords.clone();
        switch (s.shape)
        {
            case CIRCLE:
            case ELLIPSE:
                if (c.length >= 2)
                {
                    c[0] -= dx;
                    c[1] -= dy;
                }
                break;
            case RECT:
                if (c.length >= 4)
                {
                    c[0] -= dx;
                    c[1] -= dy;
                    c[2] -= dx;
                    c[3] -= dy;
                }
                break;
            case POLY:
                for (int i = 0; i + 1 < c.length; i += 2)
                {
                    c[i] -= dx;
                    c[i + 1] -= dy;
                }
                break;
            default:
                break;
        }
        return new Shape(s.shape, c);
    }

    /**
     * True if the bounding box of a shape, in stage coordinates, overlaps the rectangle of a
     * positioned image. Images without a complete position never match.
     */
    public static boolean overlaps(Shape s, PositionRect image)
    {
        if (image == null || !image.isComplete())
        {
            return false;
        }
        int[] b = bounds(s);
        if (b[0] > image.x0 + image.width || b[2] < image.x0)
        {
            return false;
        }
        return !(b[1] > image.y0 + image.height || b[3] < image.y0);
    }

    private static int saturate(long v)
    {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, v));
    }

    private static void pad(List<Integer> c, int size)
    {
        while (c.size() < size)
        {
            c.add(0);
        }
    }

    private static int[] toArray(List<Integer> c)
    {
        int[] out = new int[c.size()];
        for (int i = 0; i < out.length; i++)
        {
            out[i] = c.get(i);
        }
        return out;
    }
}
