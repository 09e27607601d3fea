package qti1to2;

/**
 * The optional x0, y0, width, height attributes of a legacy content element.
 */
public final class PositionRect
{
    public final Integer x0;
    public final Integer y0;
    public final Integer width;
    public final Integer height;

    public PositionRect(Integer x0, Integer y0, Integer width, Integer height)
    {
        this.x0 = x0;
        this.y0 = y0;
        this.width = width;
        this.height = height;
    }

    public boolean isEmpty()
    {
        return x0 == null && y0 == null && width == null && height == null;
    }

    /** True when all four values are present, the requirement for overlap testing. */
    public boolean isComplete()
    {
        return x0 != null && y0 != null && width != null && height != null;
    }

    public int xOffset()
    {
        return x0 == null ? 0 : x0;
    }

    public int yOffset()
    {
        return y0 == null ? 0 : y0;
    }

    @Override
    public String toString()
    {
        return "(" + x0 + "," + y0 + " " + width + "x" + height + ")";
    }
}
