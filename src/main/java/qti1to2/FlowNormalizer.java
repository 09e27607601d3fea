package qti1to2;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jsoup.nodes.Node;
import org.w3c.dom.Element;

/**
 * Re-flows legacy content into QTI 2.1 paragraphs and line breaks.
 *
 * Legacy presentations freely mix text, media, nested flows and response constructs. QTI 2.1
 * only allows inline content inside a p and block content directly inside itemBody, so runs of
 * inline content are gathered into paragraphs, and the boundaries of nested flows are kept as
 * br elements.
 */
public final class FlowNormalizer
{
    private final ContentModel model;
    private final ContentClassifier classifier;
    private final ResponseDispatcher dispatcher;

    public FlowNormalizer(ContentModel model)
    {
        this.model = Objects.requireNonNull(model, "model");
        this.classifier = new ContentClassifier(model);
        this.dispatcher = new ResponseDispatcher(this, classifier, new HotspotResolver());
    }

    public ContentModel getModel()
    {
        return model;
    }

    public ContentClassifier getClassifier()
    {
        return classifier;
    }

    public ResponseDispatcher getDispatcher()
    {
        return dispatcher;
    }

    /**
     * Migrates nodes, in order, into parent.
     *
     * In an inline context, or a flow context where every node is inline, the nodes are emitted
     * as one inline run. Otherwise consecutive inline nodes share a p, and each block node closes
     * the open p and goes straight into parent. A flow element adjacent to other content is set
     * off by a br, but never as the first or last thing emitted.
     */
    public void normalize(List<ContentNode> nodes, Element parent, TargetContext context, MigrationContext ctx)
    {
        if (context == TargetContext.INLINE || (context == TargetContext.FLOW && classifier.allInline(nodes)))
        {
            boolean brBefore = false;
            boolean brAfter = false;
            boolean first = true;
            for (ContentNode node : nodes)
            {
                if (ctx.hasFailed())
                {
                    return;
                }
                if (node.isFlowMarked())
                {
                    brBefore = !first;
                    brAfter = true;
                }
                else if (brAfter)
                {
                    // only a flow followed by something other than a flow gets a trailing break
                    ctx.target().add(parent, "br");
                    brAfter = false;
                }
                if (brBefore)
                {
                    ctx.target().add(parent, "br");
                    brBefore = false;
                }
                migrate(node, parent, TargetContext.INLINE, ctx);
                first = false;
            }
            return;
        }

        Element p = null;
        boolean brBefore = false;
        boolean brAfter = false;
        for (ContentNode node : nodes)
        {
            if (ctx.hasFailed())
            {
                return;
            }
            if (classifier.isInline(node))
            {
                if (brAfter)
                {
                    ctx.target().add(p, "br");
                    brAfter = false;
                }
                if (node.isFlowMarked())
                {
                    brBefore = true;
                    brAfter = true;
                }
                if (p == null)
                {
                    p = ctx.target().add(parent, "p");
                    brBefore = false;
                }
                if (brBefore)
                {
                    ctx.target().add(p, "br");
                    brBefore = false;
                }
                migrate(node, p, TargetContext.INLINE, ctx);
            }
            else
            {
                p = null;
                brBefore = false;
                brAfter = false;
                migrate(node, parent, TargetContext.BLOCK, ctx);
            }
        }
    }

    /** Migrates a single node into parent. */
    public void migrate(ContentNode node, Element parent, TargetContext context, MigrationContext ctx)
    {
        if (ctx.hasFailed())
        {
            return;
        }
        switch (node.getKind())
        {
            case TEXT:
                migrateText(node, parent, context, ctx);
                break;

            case DATA:
                addPlainText(node.getText(), null, null, false, parent, context, ctx);
                break;

            case BREAK:
                if (context != TargetContext.BLOCK)
                {
                    ctx.target().add(parent, "br");
                }
                break;

            case IMAGE:
                migrateImage(node, parent, context, ctx);
                break;

            case AUDIO:
            case VIDEO:
                migrateObject(node, parent, context, ctx);
                break;

            case APPLET:
            case APPLICATION:
                ctx.warn("<mat" + node.getKind().name().toLowerCase(Locale.ROOT)
                    + "> migrated to a plain <object>, runtime behaviour is not preserved");
                migrateObject(node, parent, context, ctx);
                break;

            case EXTENSION:
                ctx.warn("ignoring <mat_extension>");
                break;

            case REFERENCE:
            {
                ContentNode target = node.resolve();
                if (target == null)
                {
                    ctx.warn("unresolved reference to \"" + node.getRefId() + "\" ignored");
                }
                else
                {
                    migrate(target, parent, context, ctx);
                }
                break;
            }

            case MATERIAL:
                normalize(node.getChildren(), parent, context, ctx);
                break;

            case FLOW:
            case FLOW_MAT:
            case FLOW_LABEL:
                if (node.getFlowClass() != null)
                {
                    Element div = ctx.target().add(parent, "div");
                    div.setAttribute("class", node.getFlowClass());
                    normalize(node.getChildren(), div, TargetContext.FLOW, ctx);
                }
                else
                {
                    normalize(node.getChildren(), parent, context, ctx);
                }
                break;

            case RESPONSE:
            {
                Response r = node.getResponse();
                ctx.enter(r.toString());
                try
                {
                    dispatcher.migrate(r, parent, context, ctx);
                }
                finally
                {
                    ctx.leave();
                }
                break;
            }

            case RESPONSE_LABEL:
                if (node.getRender() != null && node.getRender().getKind() == RenderKind.FIB)
                {
                    dispatcher.migrateFibLabel(node, parent, context, ctx);
                }
                else
                {
                    ctx.warn("ignoring <response_label> \"" + node.getIdent() + "\" outside its interaction");
                }
                break;

            default:
                throw new IllegalStateException("Unhandled content kind " + node.getKind());
        }
    }

    // ---------------- leaves ----------------

    private void migrateText(ContentNode node, Element parent, TargetContext context, MigrationContext ctx)
    {
        if (node.getTextType() == TextType.HTML && node.getHtml() != null)
        {
            migrateMarkup(node, parent, context, ctx);
            return;
        }
        if (node.getTextType() == TextType.RTF)
        {
            ctx.warn("text/rtf content emitted as plain text");
        }
        addPlainText(node.getText(), node.getLang(), node.getLabel(), node.isEmphasis(), parent, context, ctx);
    }

    private void addPlainText(String text, String lang, String label, boolean emphasis, Element parent,
        TargetContext context, MigrationContext ctx)
    {
        if (text == null || text.isEmpty())
        {
            return;
        }
        Element host = parent;
        if (context == TargetContext.BLOCK)
        {
            if (text.trim().isEmpty())
            {
                return;
            }
            host = ctx.target().add(parent, "p");
        }
        if (emphasis || lang != null || label != null)
        {
            Element span = ctx.target().add(host, emphasis ? "em" : "span");
            QtiV2Document.setLang(span, lang);
            if (label != null)
            {
                span.setAttribute("label", label);
            }
            host = span;
        }
        ctx.target().addText(host, text);
    }

    private void migrateMarkup(ContentNode node, Element parent, TargetContext context, MigrationContext ctx)
    {
        Element host = parent;
        if (node.getLang() != null || node.getLabel() != null || node.isEmphasis())
        {
            String wrapper = context == TargetContext.INLINE ? (node.isEmphasis() ? "em" : "span") : "div";
            host = ctx.target().add(parent, wrapper);
            QtiV2Document.setLang(host, node.getLang());
            if (node.getLabel() != null)
            {
                host.setAttribute("label", node.getLabel());
            }
            if (wrapper.equals("div"))
            {
                context = TargetContext.FLOW;
            }
        }

        if (context == TargetContext.INLINE
            || (context == TargetContext.FLOW && classifier.isInlineMarkup(node)))
        {
            ctx.target().importMarkup(node.getHtml(), host);
            return;
        }

        // inline runs need a p of their own
        Element p = null;
        for (Node n : node.getHtml().childNodes())
        {
            boolean inline = !HtmlFragments.isElement(n) || model.isInline(HtmlFragments.tagName(n));
            if (inline)
            {
                if (p == null && HtmlFragments.isBlank(n))
                {
                    continue;
                }
                if (p == null)
                {
                    p = ctx.target().add(host, "p");
                }
                ctx.target().importNode(n, p);
            }
            else
            {
                p = null;
                ctx.target().importNode(n, host);
            }
        }
    }

    private void migrateImage(ContentNode node, Element parent, TargetContext context, MigrationContext ctx)
    {
        if (node.getUri() == null)
        {
            ctx.warn("omitting <matimage> with no uri");
            return;
        }
        Element host = context == TargetContext.BLOCK ? ctx.target().add(parent, "p") : parent;
        Element img = ctx.target().add(host, "img");
        img.setAttribute("src", node.getUri());
        img.setAttribute("alt", node.getLabel() == null ? "" : node.getLabel());
        PositionRect pos = node.getPosition();
        if (pos != null)
        {
            if (pos.width != null)
            {
                img.setAttribute("width", String.valueOf(pos.width));
            }
            if (pos.height != null)
            {
                img.setAttribute("height", String.valueOf(pos.height));
            }
        }
    }

    private void migrateObject(ContentNode node, Element parent, TargetContext context, MigrationContext ctx)
    {
        if (node.getUri() == null)
        {
            ctx.warn("omitting <mat" + node.getKind().name().toLowerCase(Locale.ROOT) + "> with no uri");
            return;
        }
        Element host = context == TargetContext.BLOCK ? ctx.target().add(parent, "p") : parent;
        Element obj = ctx.target().add(host, "object");
        obj.setAttribute("data", node.getUri());
        obj.setAttribute("type", node.getMimeType() == null ? "application/octet-stream" : node.getMimeType());
        PositionRect pos = node.getPosition();
        if (pos != null)
        {
            if (pos.width != null)
            {
                obj.setAttribute("width", String.valueOf(pos.width));
            }
            if (pos.height != null)
            {
                obj.setAttribute("height", String.valueOf(pos.height));
            }
        }
    }
}
