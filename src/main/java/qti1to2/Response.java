package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A legacy response_lid, response_xy, response_str, response_num or response_grp: optional
 * intro material, exactly one render and optional outro material.
 */
public final class Response
{
    private final ResponseKind kind;
    private final String ident;
    private Cardinality cardinality = Cardinality.SINGLE;
    private boolean timing;
    private NumType numType = NumType.INTEGER;
    private final List<ContentNode> intro = new ArrayList<>();
    private final List<ContentNode> outro = new ArrayList<>();
    private Render render;

    public Response(ResponseKind kind, String ident)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.ident = ident == null ? "" : ident;
    }

    public Response withCardinality(Cardinality cardinality)
    {
        this.cardinality = cardinality == null ? Cardinality.SINGLE : cardinality;
        return this;
    }

    public Response withTiming(boolean timing)
    {
        this.timing = timing;
        return this;
    }

    public Response withNumType(NumType numType)
    {
        this.numType = numType == null ? NumType.INTEGER : numType;
        return this;
    }

    public Response intro(ContentNode... nodes)
    {
        Collections.addAll(intro, nodes);
        return this;
    }

    public Response outro(ContentNode... nodes)
    {
        Collections.addAll(outro, nodes);
        return this;
    }

    public Response withRender(Render render)
    {
        this.render = render;
        return this;
    }

    public ResponseKind getKind()
    {
        return kind;
    }

    public String getIdent()
    {
        return ident;
    }

    public Cardinality getCardinality()
    {
        return cardinality;
    }

    public boolean isTiming()
    {
        return timing;
    }

    public NumType getNumType()
    {
        return numType;
    }

    public List<ContentNode> getIntro()
    {
        return Collections.unmodifiableList(intro);
    }

    public List<ContentNode> getOutro()
    {
        return Collections.unmodifiableList(outro);
    }

    public Render getRender()
    {
        return render;
    }

    private boolean mixedFib()
    {
        return render != null && render.getKind() == RenderKind.FIB && render.isMixedModel();
    }

    /**
     * The prompt: the intro plus the render's content up to its first label. For a mixed
     * fill-in-blank it is just the intro.
     */
    public List<ContentNode> getPrompt()
    {
        if (render == null || mixedFib())
        {
            return getIntro();
        }
        List<ContentNode> prompt = new ArrayList<>();
        List<ContentNode> all = new ArrayList<>(intro);
        all.addAll(render.getLabelContent());
        for (ContentNode n : all)
        {
            if (n.getKind() == ContentKind.RESPONSE_LABEL)
            {
                break;
            }
            prompt.add(n);
        }
        return prompt;
    }

    /**
     * The footer: whatever follows the last label in the render and outro. For a mixed
     * fill-in-blank it is just the outro.
     */
    public List<ContentNode> getFooter()
    {
        if (render == null)
        {
            return Collections.emptyList();
        }
        if (mixedFib())
        {
            return getOutro();
        }
        List<ContentNode> footer = new ArrayList<>();
        List<ContentNode> all = new ArrayList<>(render.getLabelContent());
        all.addAll(outro);
        boolean foundLabel = false;
        for (ContentNode n : all)
        {
            if (n.getKind() == ContentKind.RESPONSE_LABEL)
            {
                footer.clear();
                foundLabel = true;
            }
            else if (foundLabel)
            {
                footer.add(n);
            }
        }
        return footer;
    }

    @Override
    public String toString()
    {
        return "response_" + kind.name().toLowerCase(Locale.ROOT) + "[" + ident + "]";
    }
}
