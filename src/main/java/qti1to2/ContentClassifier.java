package qti1to2;

import java.util.List;
import java.util.Objects;

import org.jsoup.nodes.Node;
import org.w3c.dom.Element;

/**
 * Decides whether legacy content can sit in an inline run.
 *
 * The answer depends only on the structure of the subtree, so nothing is cached: callers may
 * ask again at any time and get the same result.
 */
public final class ContentClassifier
{
    private final ContentModel model;

    public ContentClassifier(ContentModel model)
    {
        this.model = Objects.requireNonNull(model, "model");
    }

    public boolean isInline(ContentNode node)
    {
        switch (node.getKind())
        {
            case BREAK:
            case IMAGE:
            case AUDIO:
            case VIDEO:
            case APPLET:
            case APPLICATION:
            case EXTENSION:
            case DATA:
                return true;

            case TEXT:
                return node.getTextType() != TextType.HTML || isInlineMarkup(node);

            case REFERENCE:
            {
                ContentNode target = node.resolve();
                return target == null || isInline(target);
            }

            case MATERIAL:
                return allInline(node.getChildren());

            case FLOW:
            case FLOW_MAT:
            case FLOW_LABEL:
                return node.getFlowClass() == null && allInline(node.getChildren());

            case RESPONSE:
                return isInline(node.getResponse());

            case RESPONSE_LABEL:
                return isInlineLabel(node);

            default:
                return false;
        }
    }

    public boolean allInline(List<ContentNode> nodes)
    {
        for (ContentNode n : nodes)
        {
            if (!isInline(n))
            {
                return false;
            }
        }
        return true;
    }

    /** A response is inline when its prompt, its render and its footer all are. */
    public boolean isInline(Response response)
    {
        return allInline(response.getPrompt()) && isInline(response.getRender()) && allInline(response.getFooter());
    }

    public boolean isInline(Render render)
    {
        if (render == null)
        {
            return true;
        }
        if (render.getKind() == RenderKind.FIB)
        {
            return render.isMixedModel() && allInline(render.getLabelContent());
        }
        return false;
    }

    private boolean isInlineLabel(ContentNode label)
    {
        Render render = label.getRender();
        if (render == null)
        {
            return allInline(label.getChildren());
        }
        switch (render.getKind())
        {
            case CHOICE:
            case SLIDER:
                return false;
            case HOTSPOT:
                return true;
            case FIB:
                return render.isInlineFibLabel();
            default:
                return allInline(label.getChildren());
        }
    }

    /** True if every top level node of a text/html mattext is text or an inline element. */
    public boolean isInlineMarkup(ContentNode html)
    {
        if (html.getHtml() == null)
        {
            return true;
        }
        for (Node n : html.getHtml().childNodes())
        {
            if (HtmlFragments.isElement(n) && !model.isInline(HtmlFragments.tagName(n)))
            {
                return false;
            }
        }
        return true;
    }

    /** Target nodes are classified by the vocabulary. */
    public boolean isInline(Element target)
    {
        return model.isInline(QtiV2Document.localName(target));
    }
}
