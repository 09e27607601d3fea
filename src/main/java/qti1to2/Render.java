package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A legacy render_choice, render_hotspot, render_slider, render_fib or render_extension.
 *
 * Only the attributes of the matching render kind are meaningful; the others stay null.
 */
public final class Render
{
    private final RenderKind kind;
    private final List<ContentNode> children = new ArrayList<>();

    boolean shuffle;
    Integer minNumber;
    Integer maxNumber;

    // render_hotspot
    boolean showDraw;

    // render_slider
    Integer lowerBound;
    Integer upperBound;
    Integer step;
    Integer startVal;
    String orientation;

    // render_fib
    Integer rows;
    Integer columns;
    Integer maxChars;
    String fibType;

    public Render(RenderKind kind)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Render add(ContentNode... nodes)
    {
        for (ContentNode n : nodes)
        {
            children.add(Objects.requireNonNull(n, "child"));
            n.attachTo(this);
        }
        return this;
    }

    public RenderKind getKind()
    {
        return kind;
    }

    public List<ContentNode> getChildren()
    {
        return Collections.unmodifiableList(children);
    }

    /** The render's content with flow_label wrappers flattened away. */
    public List<ContentNode> getLabelContent()
    {
        List<ContentNode> out = new ArrayList<>();
        flatten(children, out);
        return out;
    }

    private static void flatten(List<ContentNode> nodes, List<ContentNode> out)
    {
        for (ContentNode n : nodes)
        {
            if (n.getKind() == ContentKind.FLOW_LABEL)
            {
                flatten(n.getChildren(), out);
            }
            else
            {
                out.add(n);
            }
        }
    }

    /** Every response_label, depth first. */
    public List<ContentNode> getLabels()
    {
        List<ContentNode> out = new ArrayList<>();
        for (ContentNode n : getLabelContent())
        {
            if (n.getKind() == ContentKind.RESPONSE_LABEL)
            {
                out.add(n);
            }
        }
        return out;
    }

    /**
     * A fill-in-blank is "mixed" when content follows a label, or when it has no content at
     * all; its labels are then spliced into the surrounding text. Content followed only by
     * labels is a prompt plus a block of blanks instead.
     */
    public boolean isMixedModel()
    {
        boolean foundLabel = false;
        boolean foundContent = false;
        for (ContentNode n : getLabelContent())
        {
            if (n.getKind() == ContentKind.RESPONSE_LABEL)
            {
                foundLabel = true;
            }
            else if (foundLabel)
            {
                return true;
            }
            else
            {
                foundContent = true;
            }
        }
        return !foundContent;
    }

    /** True for a fill-in-blank whose blanks are single line. */
    public boolean isInlineFibLabel()
    {
        return rows == null || rows == 1;
    }

    // ---------------- fluent attributes ----------------

    public Render withShuffle(boolean shuffle)
    {
        this.shuffle = shuffle;
        return this;
    }

    public Render withMinNumber(Integer minNumber)
    {
        this.minNumber = minNumber;
        return this;
    }

    public Render withMaxNumber(Integer maxNumber)
    {
        this.maxNumber = maxNumber;
        return this;
    }

    public Render withShowDraw(boolean showDraw)
    {
        this.showDraw = showDraw;
        return this;
    }

    public Render withBounds(Integer lowerBound, Integer upperBound)
    {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        return this;
    }

    public Render withStep(Integer step)
    {
        this.step = step;
        return this;
    }

    public Render withStartVal(Integer startVal)
    {
        this.startVal = startVal;
        return this;
    }

    public Render withOrientation(String orientation)
    {
        this.orientation = orientation;
        return this;
    }

    public Render withRows(Integer rows)
    {
        this.rows = rows;
        return this;
    }

    public Render withColumns(Integer columns)
    {
        this.columns = columns;
        return this;
    }

    public Render withMaxChars(Integer maxChars)
    {
        this.maxChars = maxChars;
        return this;
    }

    public Render withFibType(String fibType)
    {
        this.fibType = fibType;
        return this;
    }

    // ---------------- accessors ----------------

    public boolean isShuffle()
    {
        return shuffle;
    }

    public Integer getMinNumber()
    {
        return minNumber;
    }

    public Integer getMaxNumber()
    {
        return maxNumber;
    }

    public boolean isShowDraw()
    {
        return showDraw;
    }

    public Integer getLowerBound()
    {
        return lowerBound;
    }

    public Integer getUpperBound()
    {
        return upperBound;
    }

    public Integer getStep()
    {
        return step;
    }

    public Integer getStartVal()
    {
        return startVal;
    }

    public String getOrientation()
    {
        return orientation;
    }

    public Integer getRows()
    {
        return rows;
    }

    public Integer getColumns()
    {
        return columns;
    }

    public Integer getMaxChars()
    {
        return maxChars;
    }

    public String getFibType()
    {
        return fibType;
    }
}
