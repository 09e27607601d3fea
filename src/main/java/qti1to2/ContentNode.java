package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jsoup.nodes.Element;

/**
 * One legacy content element.
 *
 * Every element kind shares this class; which optional fields are meaningful depends on
 * {@link #getKind()}. Capability checks (does it carry a position, a flow class, children?) are
 * plain field presence checks.
 */
public final class ContentNode
{
    private final ContentKind kind;
    private final List<ContentNode> children = new ArrayList<>();

    private String comment;

    // TEXT and DATA
    private String text;
    private TextType textType = TextType.PLAIN;
    private boolean emphasis;
    private Element html;

    private String lang;
    private String label;

    // IMAGE, AUDIO, VIDEO, APPLET, APPLICATION
    private String uri;
    private String mimeType;
    private PositionRect position;

    // FLOW, FLOW_MAT, FLOW_LABEL
    private String flowClass;

    // REFERENCE
    private String refId;
    private ReferenceScope refScope;
    private LegacyDocument document;

    // RESPONSE
    private Response response;

    // RESPONSE_LABEL
    private String ident;
    private boolean shuffle = true;
    private AreaShape area = AreaShape.ELLIPSE;
    private Render render;

    private ContentNode(ContentKind kind)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    // ---------------- factories ----------------

    public static ContentNode text(String text)
    {
        ContentNode n = new ContentNode(ContentKind.TEXT);
        n.text = text == null ? "" : text;
        return n;
    }

    public static ContentNode emphasis(String text)
    {
        ContentNode n = text(text);
        n.emphasis = true;
        return n;
    }

    /** A text/html mattext. The markup is parsed immediately and the raw text kept alongside. */
    public static ContentNode html(String markup)
    {
        ContentNode n = text(markup);
        n.textType = TextType.HTML;
        n.html = HtmlFragments.parse(n.text);
        return n;
    }

    public static ContentNode rtf(String text)
    {
        ContentNode n = text(text);
        n.textType = TextType.RTF;
        return n;
    }

    public static ContentNode image(String uri)
    {
        ContentNode n = new ContentNode(ContentKind.IMAGE);
        n.uri = uri;
        return n;
    }

    public static ContentNode audio(String uri)
    {
        ContentNode n = new ContentNode(ContentKind.AUDIO);
        n.uri = uri;
        return n;
    }

    public static ContentNode video(String uri)
    {
        ContentNode n = new ContentNode(ContentKind.VIDEO);
        n.uri = uri;
        return n;
    }

    public static ContentNode applet(String uri)
    {
        ContentNode n = new ContentNode(ContentKind.APPLET);
        n.uri = uri;
        return n;
    }

    public static ContentNode application(String uri)
    {
        ContentNode n = new ContentNode(ContentKind.APPLICATION);
        n.uri = uri;
        return n;
    }

    public static ContentNode lineBreak()
    {
        return new ContentNode(ContentKind.BREAK);
    }

    public static ContentNode extension()
    {
        return new ContentNode(ContentKind.EXTENSION);
    }

    public static ContentNode matref(String id, LegacyDocument document)
    {
        return reference(ReferenceScope.MAT_THING, id, document);
    }

    public static ContentNode materialRef(String id, LegacyDocument document)
    {
        return reference(ReferenceScope.MATERIAL, id, document);
    }

    private static ContentNode reference(ReferenceScope scope, String id, LegacyDocument document)
    {
        ContentNode n = new ContentNode(ContentKind.REFERENCE);
        n.refScope = scope;
        n.refId = id;
        n.document = document;
        return n;
    }

    public static ContentNode material(ContentNode... children)
    {
        return new ContentNode(ContentKind.MATERIAL).add(children);
    }

    public static ContentNode flowMat(String flowClass, ContentNode... children)
    {
        ContentNode n = new ContentNode(ContentKind.FLOW_MAT);
        n.flowClass = blankToNull(flowClass);
        return n.add(children);
    }

    public static ContentNode flow(String flowClass, ContentNode... children)
    {
        ContentNode n = new ContentNode(ContentKind.FLOW);
        n.flowClass = blankToNull(flowClass);
        return n.add(children);
    }

    public static ContentNode flowLabel(String flowClass, ContentNode... children)
    {
        ContentNode n = new ContentNode(ContentKind.FLOW_LABEL);
        n.flowClass = blankToNull(flowClass);
        return n.add(children);
    }

    public static ContentNode response(Response response)
    {
        ContentNode n = new ContentNode(ContentKind.RESPONSE);
        n.response = Objects.requireNonNull(response, "response");
        return n;
    }

    public static ContentNode responseLabel(String ident, ContentNode... children)
    {
        ContentNode n = new ContentNode(ContentKind.RESPONSE_LABEL);
        n.ident = ident == null ? "" : ident;
        return n.add(children);
    }

    public static ContentNode data(String text)
    {
        ContentNode n = new ContentNode(ContentKind.DATA);
        n.text = text == null ? "" : text;
        return n;
    }

    // ---------------- structure ----------------

    public ContentNode add(ContentNode... nodes)
    {
        for (ContentNode c : nodes)
        {
            children.add(Objects.requireNonNull(c, "child"));
            if (render != null)
            {
                c.attachTo(render);
            }
        }
        return this;
    }

    /** Records the render owning this label (and any label nested in a flow_label). */
    void attachTo(Render owner)
    {
        if (kind == ContentKind.RESPONSE_LABEL || kind == ContentKind.FLOW_LABEL)
        {
            this.render = owner;
            for (ContentNode c : children)
            {
                c.attachTo(owner);
            }
        }
    }

    /** The ordered children, in the order the legacy DTD declares them. */
    public List<ContentNode> getChildren()
    {
        return Collections.unmodifiableList(children);
    }

    public boolean isFlowMarked()
    {
        return kind == ContentKind.FLOW || kind == ContentKind.FLOW_MAT || kind == ContentKind.FLOW_LABEL;
    }

    public boolean isComposite()
    {
        return kind == ContentKind.MATERIAL || isFlowMarked();
    }

    /**
     * Resolves a reference through the owning document.
     *
     * @return the referenced node, or null when nothing carries the label
     */
    public ContentNode resolve()
    {
        if (kind != ContentKind.REFERENCE || document == null)
        {
            return null;
        }
        return document.resolve(refScope, refId);
    }

    /**
     * A plain text synopsis of this content: text is kept, markup and media are dropped, and
     * the parts are joined with single spaces.
     */
    public String extractText()
    {
        switch (kind)
        {
            case TEXT:
                return (html != null ? html.text() : text).trim();
            case DATA:
                return text.trim();
            case REFERENCE:
            {
                ContentNode target = resolve();
                return target == null ? "" : target.extractText();
            }
            default:
                return joinText(children);
        }
    }

    static String joinText(List<ContentNode> nodes)
    {
        StringBuilder sb = new StringBuilder();
        for (ContentNode c : nodes)
        {
            String t = c.extractText();
            if (!t.isEmpty())
            {
                if (sb.length() > 0)
                {
                    sb.append(' ');
                }
                sb.append(t);
            }
        }
        return sb.toString();
    }

    /** This node's language, else the first language found in its content. */
    public String findLang()
    {
        if (lang != null)
        {
            return lang;
        }
        if (kind == ContentKind.REFERENCE)
        {
            ContentNode target = resolve();
            return target == null ? null : target.findLang();
        }
        for (ContentNode c : children)
        {
            String l = c.findLang();
            if (l != null)
            {
                return l;
            }
        }
        return null;
    }

    // ---------------- fluent attributes ----------------

    public ContentNode withLang(String lang)
    {
        this.lang = blankToNull(lang);
        return this;
    }

    public ContentNode withLabel(String label)
    {
        this.label = blankToNull(label);
        return this;
    }

    public ContentNode withMimeType(String mimeType)
    {
        this.mimeType = blankToNull(mimeType);
        return this;
    }

    public ContentNode withPosition(PositionRect position)
    {
        this.position = position == null || position.isEmpty() ? null : position;
        return this;
    }

    public ContentNode withComment(String comment)
    {
        this.comment = blankToNull(comment);
        return this;
    }

    public ContentNode withShuffle(boolean shuffle)
    {
        this.shuffle = shuffle;
        return this;
    }

    public ContentNode withArea(AreaShape area)
    {
        this.area = area == null ? AreaShape.ELLIPSE : area;
        return this;
    }

    // ---------------- accessors ----------------

    public ContentKind getKind()
    {
        return kind;
    }

    public String getComment()
    {
        return comment;
    }

    public String getText()
    {
        return text;
    }

    public TextType getTextType()
    {
        return textType;
    }

    public boolean isEmphasis()
    {
        return emphasis;
    }

    /** The body element holding the parsed text/html markup, or null for other text types. */
    public Element getHtml()
    {
        return html;
    }

    public String getLang()
    {
        return lang;
    }

    public String getLabel()
    {
        return label;
    }

    public String getUri()
    {
        return uri;
    }

    public String getMimeType()
    {
        return mimeType;
    }

    public PositionRect getPosition()
    {
        return position;
    }

    public String getFlowClass()
    {
        return flowClass;
    }

    public String getRefId()
    {
        return refId;
    }

    public ReferenceScope getRefScope()
    {
        return refScope;
    }

    public Response getResponse()
    {
        return response;
    }

    public String getIdent()
    {
        return ident;
    }

    public boolean isShuffle()
    {
        return shuffle;
    }

    public AreaShape getArea()
    {
        return area;
    }

    /** The render owning a response_label or flow_label, null elsewhere. */
    public Render getRender()
    {
        return render;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(kind.name());
        if (ident != null)
        {
            sb.append('[').append(ident).append(']');
        }
        if (refId != null)
        {
            sb.append("->").append(refId);
        }
        if (flowClass != null)
        {
            sb.append('.').append(flowClass);
        }
        return sb.toString();
    }

    static String blankToNull(String s)
    {
        return s == null || s.trim().isEmpty() ? null : s.trim();
    }
}
