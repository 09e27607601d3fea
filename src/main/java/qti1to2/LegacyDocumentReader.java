package qti1to2;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Reads a QTI 1.2 questestinterop document into the legacy tree.
 *
 * Elements are matched by local name, so both the DTD based and the namespaced flavours of the
 * format are accepted. External DTDs are never fetched. Elements outside the subset this tool
 * migrates are skipped with a debug message.
 */
public final class LegacyDocumentReader
{
    private static final Map<String, String> FIELD_SYNONYMS = new HashMap<>();

    static
    {
        FIELD_SYNONYMS.put("marks", "maximumscore");
        FIELD_SYNONYMS.put("name", "title");
        FIELD_SYNONYMS.put("syllabusarea", "topic");
        FIELD_SYNONYMS.put("item type", "itemtype");
        FIELD_SYNONYMS.put("question type", "itemtype");
        FIELD_SYNONYMS.put("layoutstatus", "status");
    }

    private final Log log;

    public LegacyDocumentReader(Log log)
    {
        this.log = Objects.requireNonNull(log, "log");
    }

    public LegacyDocument read(Path file)
    {
        try (InputStream in = Files.newInputStream(file))
        {
            return read(in, file.getFileName().toString());
        }
        catch (IOException ex)
        {
            throw new MigrationException("Unable to read " + file + ": " + ex.getMessage(), ex);
        }
    }

    public LegacyDocument read(InputStream in, String name)
    {
        Document dom = parseXml(in, name);
        Element root = dom.getDocumentElement();
        if (!"questestinterop".equals(QtiV2Document.localName(root)))
        {
            throw new MigrationException(name + ": expected <questestinterop>, found <"
                + QtiV2Document.localName(root) + ">");
        }
        LegacyDocument doc = new LegacyDocument(name);
        for (Element c : QtiV2Document.childElements(root))
        {
            switch (QtiV2Document.localName(c))
            {
                case "qticomment":
                    doc.setComment(text(c));
                    break;
                case "objectbank":
                    doc.setObjectBank(true);
                    readEntries(c, doc, doc::add);
                    break;
                case "assessment":
                    doc.setAssessment(readAssessment(c, doc));
                    break;
                case "section":
                    doc.add(readSection(c, doc));
                    break;
                case "item":
                    doc.add(readItem(c, doc));
                    break;
                default:
                    skip(c);
                    break;
            }
        }
        return doc;
    }

    static Document parseXml(InputStream in, String name)
    {
        try
        {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setExpandEntityReferences(false);
            f.setFeature("http://xml.org/sax/features/external-general-entities", false);
            f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            DocumentBuilder b = f.newDocumentBuilder();
            // never fetch the ims_qtiasiv1p2.dtd
            b.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
            b.setErrorHandler(new DefaultHandler()
            {
                @Override
                public void fatalError(SAXParseException e) throws SAXException
                {
                    throw e;
                }
            });
            return b.parse(in);
        }
        catch (ParserConfigurationException | SAXException | IOException ex)
        {
            throw new MigrationException(name + ": not well formed XML: " + ex.getMessage(), ex);
        }
    }

    // ---------------- assessment structure ----------------

    private interface EntrySink
    {
        void add(SectionEntry entry);
    }

    private void readEntries(Element parent, LegacyDocument doc, EntrySink sink)
    {
        for (Element c : QtiV2Document.childElements(parent))
        {
            switch (QtiV2Document.localName(c))
            {
                case "section":
                    sink.add(readSection(c, doc));
                    break;
                case "item":
                    sink.add(readItem(c, doc));
                    break;
                default:
                    break;
            }
        }
    }

    private LegacyAssessment readAssessment(Element el, LegacyDocument doc)
    {
        LegacyAssessment a = new LegacyAssessment(attr(el, "ident"), attr(el, "title"));
        for (Element c : QtiV2Document.childElements(el))
        {
            String name = QtiV2Document.localName(c);
            if ("section".equals(name))
            {
                a.add(readSection(c, doc));
            }
            else if ("sectionref".equals(name))
            {
                log.debug(doc.getName() + ": assessment " + a.getIdent() + " sectionref to "
                    + attr(c, "linkrefid") + " not followed");
            }
        }
        return a;
    }

    private LegacySection readSection(Element el, LegacyDocument doc)
    {
        LegacySection s = new LegacySection(attr(el, "ident"), attr(el, "title"));
        for (Element c : QtiV2Document.childElements(el))
        {
            switch (QtiV2Document.localName(c))
            {
                case "section":
                    s.add(readSection(c, doc));
                    break;
                case "item":
                    s.add(readItem(c, doc));
                    break;
                case "itemref":
                case "sectionref":
                    s.addReference(attr(c, "linkrefid"));
                    break;
                default:
                    break;
            }
        }
        return s;
    }

    // ---------------- item ----------------

    private LegacyItem readItem(Element el, LegacyDocument doc)
    {
        LegacyItem item = new LegacyItem(el.getAttribute("ident"))
            .withTitle(attr(el, "title"))
            .withLabel(attr(el, "label"))
            .withLang(lang(el))
            .withMaxAttempts(attr(el, "maxattempts"));

        for (Element c : QtiV2Document.childElements(el))
        {
            String name = QtiV2Document.localName(c);
            switch (name)
            {
                case "qticomment":
                    item.withComment(text(c));
                    break;
                case "duration":
                    item.withDuration(text(c));
                    break;
                case "itemmetadata":
                    readMetadata(c, item);
                    break;
                case "objectives":
                    item.addObjectives(new LegacyItem.ViewContent(View.fromLegacy(attr(c, "view")),
                        readFlowMatContent(c, doc)));
                    break;
                case "itemcontrol":
                    item.withItemControl(true);
                    break;
                case "rubric":
                case "itemrubric":
                    item.addRubric(new LegacyItem.ViewContent(View.fromLegacy(attr(c, "view")),
                        readFlowMatContent(c, doc)));
                    break;
                case "presentation":
                    item.withPresentation(readPresentation(c, doc));
                    break;
                case "resprocessing":
                    readResProcessing(c, item);
                    break;
                case "itemfeedback":
                    item.addFeedback(new LegacyItem.Feedback(attr(c, "ident"), attr(c, "title"),
                        View.fromLegacy(attr(c, "view")), readFlowMatContent(c, doc)));
                    break;
                default:
                    skip(c);
                    break;
            }
        }
        return item;
    }

    private void readMetadata(Element el, LegacyItem item)
    {
        for (Element c : QtiV2Document.childElements(el))
        {
            String name = QtiV2Document.localName(c);
            if ("qtimetadata".equals(name))
            {
                for (Element field : QtiV2Document.childElements(c))
                {
                    if ("qtimetadatafield".equals(QtiV2Document.localName(field)))
                    {
                        Element label = QtiV2Document.firstChildElement(field, "fieldlabel");
                        Element entry = QtiV2Document.firstChildElement(field, "fieldentry");
                        if (label != null && entry != null)
                        {
                            item.addMetadata(fieldLabel(text(label)), text(entry));
                        }
                    }
                }
            }
            else if (name.startsWith("qmd_"))
            {
                item.addMetadata(fieldLabel(name), text(c));
            }
        }
    }

    /** Lower cases a metadata field label, strips any qmd_ prefix and folds synonyms. */
    static String fieldLabel(String label)
    {
        String l = label.trim().toLowerCase(Locale.ROOT);
        if (l.startsWith("qmd_"))
        {
            l = l.substring(4);
        }
        String synonym = FIELD_SYNONYMS.get(l);
        return synonym != null ? synonym : l;
    }

    private void readResProcessing(Element el, LegacyItem item)
    {
        int conditions = 0;
        for (Element c : QtiV2Document.childElements(el))
        {
            String name = QtiV2Document.localName(c);
            if ("respcondition".equals(name))
            {
                conditions++;
            }
            else if ("outcomes".equals(name))
            {
                for (Element d : QtiV2Document.childElements(c))
                {
                    if ("decvar".equals(QtiV2Document.localName(d)))
                    {
                        item.addOutcome(new LegacyItem.DecVar(attr(d, "varname"), attr(d, "vartype"),
                            attr(d, "defaultval"), attr(d, "minvalue"), attr(d, "maxvalue"), attr(d, "cutvalue"),
                            attr(d, "members")));
                    }
                }
            }
        }
        item.addResProcessing(conditions);
    }

    private LegacyItem.Presentation readPresentation(Element el, LegacyDocument doc)
    {
        LegacyItem.Presentation p = new LegacyItem.Presentation()
            .withLabel(attr(el, "label"))
            .withLang(lang(el))
            .withPosition(position(el));
        for (ContentNode n : readFlowContent(el, doc))
        {
            p.add(n);
        }
        return p;
    }

    // ---------------- content ----------------

    /** The content of presentation and flow: flows, materials and responses. */
    private List<ContentNode> readFlowContent(Element parent, LegacyDocument doc)
    {
        List<ContentNode> out = new ArrayList<>();
        for (Element c : QtiV2Document.childElements(parent))
        {
            String name = QtiV2Document.localName(c);
            switch (name)
            {
                case "flow":
                    out.add(ContentNode.flow(attr(c, "class"), array(readFlowContent(c, doc))));
                    break;
                case "material":
                    out.add(readMaterial(c, doc));
                    break;
                case "material_ref":
                    out.add(ContentNode.materialRef(attr(c, "linkrefid"), doc));
                    break;
                case "response_lid":
                case "response_xy":
                case "response_str":
                case "response_num":
                case "response_grp":
                    out.add(ContentNode.response(readResponse(c, doc)));
                    break;
                default:
                    skip(c);
                    break;
            }
        }
        return out;
    }

    /** The content of objectives, rubric, itemfeedback and flow_mat. */
    private List<ContentNode> readFlowMatContent(Element parent, LegacyDocument doc)
    {
        List<ContentNode> out = new ArrayList<>();
        for (Element c : QtiV2Document.childElements(parent))
        {
            switch (QtiV2Document.localName(c))
            {
                case "flow_mat":
                    out.add(ContentNode.flowMat(attr(c, "class"), array(readFlowMatContent(c, doc))));
                    break;
                case "material":
                    out.add(readMaterial(c, doc));
                    break;
                case "material_ref":
                    out.add(ContentNode.materialRef(attr(c, "linkrefid"), doc));
                    break;
                case "qticomment":
                    break;
                default:
                    skip(c);
                    break;
            }
        }
        return out;
    }

    private ContentNode readMaterial(Element el, LegacyDocument doc)
    {
        ContentNode m = ContentNode.material().withLabel(attr(el, "label")).withLang(lang(el));
        for (Element c : QtiV2Document.childElements(el))
        {
            String name = QtiV2Document.localName(c);
            ContentNode leaf;
            switch (name)
            {
                case "mattext":
                    leaf = readText(c, false);
                    break;
                case "matemtext":
                    leaf = readText(c, true);
                    break;
                case "matimage":
                    leaf = ContentNode.image(attr(c, "uri")).withMimeType(attr(c, "imagtype"));
                    break;
                case "mataudio":
                    leaf = ContentNode.audio(attr(c, "uri")).withMimeType(attr(c, "audiotype"));
                    break;
                case "matvideo":
                    leaf = ContentNode.video(attr(c, "uri")).withMimeType(attr(c, "videotype"));
                    break;
                case "matapplet":
                    leaf = ContentNode.applet(attr(c, "uri"));
                    break;
                case "matapplication":
                    leaf = ContentNode.application(attr(c, "uri")).withMimeType(attr(c, "apptype"));
                    break;
                case "matref":
                    leaf = ContentNode.matref(attr(c, "linkrefid"), doc);
                    break;
                case "matbreak":
                    leaf = ContentNode.lineBreak();
                    break;
                case "mat_extension":
                    leaf = ContentNode.extension();
                    break;
                case "qticomment":
                    m.withComment(text(c));
                    continue;
                default:
                    skip(c);
                    continue;
            }
            leaf.withLabel(attr(c, "label")).withPosition(position(c));
            if (leaf.getLang() == null)
            {
                leaf.withLang(lang(c));
            }
            doc.registerMatThing(leaf.getLabel(), leaf);
            m.add(leaf);
        }
        doc.registerMaterial(m.getLabel(), m);
        return m;
    }

    private static ContentNode readText(Element el, boolean emphasis)
    {
        String value = el.getTextContent();
        ContentNode n;
        switch (TextType.fromMimeType(attr(el, "texttype")))
        {
            case HTML:
                n = ContentNode.html(value);
                break;
            case RTF:
                n = ContentNode.rtf(value);
                break;
            default:
                n = emphasis ? ContentNode.emphasis(value) : ContentNode.text(value);
                break;
        }
        return n.withLang(lang(el));
    }

    // ---------------- responses ----------------

    private Response readResponse(Element el, LegacyDocument doc)
    {
        String name = QtiV2Document.localName(el);
        ResponseKind kind = ResponseKind.valueOf(name.substring("response_".length()).toUpperCase(Locale.ROOT));
        Response r = new Response(kind, el.getAttribute("ident"))
            .withCardinality(Cardinality.fromLegacy(attr(el, "rcardinality")))
            .withTiming("yes".equalsIgnoreCase(attr(el, "rtiming")))
            .withNumType(NumType.fromLegacy(attr(el, "numtype")));

        boolean afterRender = false;
        for (Element c : QtiV2Document.childElements(el))
        {
            String cn = QtiV2Document.localName(c);
            ContentNode material = null;
            if ("material".equals(cn))
            {
                material = readMaterial(c, doc);
            }
            else if ("material_ref".equals(cn))
            {
                material = ContentNode.materialRef(attr(c, "linkrefid"), doc);
            }
            else if (cn.startsWith("render_"))
            {
                r.withRender(readRender(c, cn, doc));
                afterRender = true;
            }
            else
            {
                skip(c);
            }
            if (material != null)
            {
                if (afterRender)
                {
                    r.outro(material);
                }
                else
                {
                    r.intro(material);
                }
            }
        }
        return r;
    }

    private Render readRender(Element el, String name, LegacyDocument doc)
    {
        RenderKind kind;
        switch (name)
        {
            case "render_choice":
                kind = RenderKind.CHOICE;
                break;
            case "render_hotspot":
                kind = RenderKind.HOTSPOT;
                break;
            case "render_slider":
                kind = RenderKind.SLIDER;
                break;
            case "render_fib":
                kind = RenderKind.FIB;
                break;
            default:
                kind = RenderKind.EXTENSION;
                break;
        }
        Render render = new Render(kind)
            .withShuffle("yes".equalsIgnoreCase(attr(el, "shuffle")))
            .withMinNumber(integer(el, "minnumber"))
            .withMaxNumber(integer(el, "maxnumber"))
            .withShowDraw("yes".equalsIgnoreCase(attr(el, "showdraw")))
            .withBounds(integer(el, "lowerbound"), integer(el, "upperbound"))
            .withStep(integer(el, "step"))
            .withStartVal(integer(el, "startval"))
            .withOrientation(attr(el, "orientation"))
            .withRows(integer(el, "rows"))
            .withColumns(integer(el, "columns"))
            .withMaxChars(integer(el, "maxchars"))
            .withFibType(attr(el, "fibtype"));
        if (kind == RenderKind.EXTENSION)
        {
            return render;
        }
        for (ContentNode n : readRenderContent(el, doc))
        {
            render.add(n);
        }
        return render;
    }

    /** The content of a render or flow_label: materials, labels and nested flow_labels. */
    private List<ContentNode> readRenderContent(Element parent, LegacyDocument doc)
    {
        List<ContentNode> out = new ArrayList<>();
        for (Element c : QtiV2Document.childElements(parent))
        {
            switch (QtiV2Document.localName(c))
            {
                case "material":
                    out.add(readMaterial(c, doc));
                    break;
                case "material_ref":
                    out.add(ContentNode.materialRef(attr(c, "linkrefid"), doc));
                    break;
                case "flow_label":
                    out.add(ContentNode.flowLabel(attr(c, "class"), array(readRenderContent(c, doc))));
                    break;
                case "response_label":
                    out.add(readLabel(c, doc));
                    break;
                default:
                    skip(c);
                    break;
            }
        }
        return out;
    }

    private ContentNode readLabel(Element el, LegacyDocument doc)
    {
        ContentNode label = ContentNode.responseLabel(el.getAttribute("ident"))
            .withShuffle(!"no".equalsIgnoreCase(attr(el, "rshuffle")))
            .withArea(AreaShape.fromLegacy(attr(el, "rarea")));
        for (Node c = el.getFirstChild(); c != null; c = c.getNextSibling())
        {
            if (c.getNodeType() == Node.TEXT_NODE || c.getNodeType() == Node.CDATA_SECTION_NODE)
            {
                if (!c.getNodeValue().trim().isEmpty())
                {
                    label.add(ContentNode.data(c.getNodeValue()));
                }
                continue;
            }
            if (c.getNodeType() != Node.ELEMENT_NODE)
            {
                continue;
            }
            Element e = (Element) c;
            switch (QtiV2Document.localName(e))
            {
                case "material":
                    label.add(readMaterial(e, doc));
                    break;
                case "material_ref":
                    label.add(ContentNode.materialRef(attr(e, "linkrefid"), doc));
                    break;
                case "flow_mat":
                    label.add(ContentNode.flowMat(attr(e, "class"), array(readFlowMatContent(e, doc))));
                    break;
                case "qticomment":
                    break;
                default:
                    skip(e);
                    break;
            }
        }
        return label;
    }

    // ---------------- attribute helpers ----------------

    private void skip(Element el)
    {
        log.debug("skipping <" + QtiV2Document.localName(el) + ">");
    }

    private static ContentNode[] array(List<ContentNode> nodes)
    {
        return nodes.toArray(new ContentNode[0]);
    }

    static String attr(Element el, String name)
    {
        return el.hasAttribute(name) ? ContentNode.blankToNull(el.getAttribute(name)) : null;
    }

    static String lang(Element el)
    {
        String l = attr(el, "xml:lang");
        if (l == null && el.hasAttributeNS(XMLConstants.XML_NS_URI, "lang"))
        {
            l = ContentNode.blankToNull(el.getAttributeNS(XMLConstants.XML_NS_URI, "lang"));
        }
        return l;
    }

    /** Integer attributes are read leniently: a decimal is truncated and anything else is absent. */
    static Integer integer(Element el, String name)
    {
        String v = attr(el, name);
        if (v == null)
        {
            return null;
        }
        try
        {
            return Integer.valueOf(v);
        }
        catch (NumberFormatException ex)
        {
            try
            {
                return (int) Double.parseDouble(v);
            }
            catch (NumberFormatException ex2)
            {
                return null;
            }
        }
    }

    private static PositionRect position(Element el)
    {
        return new PositionRect(integer(el, "x0"), integer(el, "y0"), integer(el, "width"), integer(el, "height"));
    }

    private static String text(Element el)
    {
        return ContentNode.blankToNull(el.getTextContent());
    }
}
