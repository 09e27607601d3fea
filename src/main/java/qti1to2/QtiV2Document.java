package qti1to2;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.TextNode;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * The QTI 2.1 tree for one item, with the element factory the migration builds it through.
 */
public final class QtiV2Document
{
    public static final String QTI_NS = "http://www.imsglobal.org/xsd/imsqti_v2p1";
    public static final String XSI_NS = XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;
    public static final String SCHEMA_LOCATION =
        QTI_NS + " http://www.imsglobal.org/xsd/qti/qtiv2p1/imsqti_v2p1.xsd";

    private final Document doc;
    private final Element root;

    private QtiV2Document(Document doc, Element root)
    {
        this.doc = doc;
        this.root = root;
    }

    /** A new document holding an empty assessmentItem. */
    public static QtiV2Document newItem()
    {
        Document doc = newDocument();
        Element root = doc.createElementNS(QTI_NS, "assessmentItem");
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", QTI_NS);
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:xsi", XSI_NS);
        root.setAttributeNS(XSI_NS, "xsi:schemaLocation", SCHEMA_LOCATION);
        doc.appendChild(root);
        return new QtiV2Document(doc, root);
    }

    static Document newDocument()
    {
        try
        {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            return dbf.newDocumentBuilder().newDocument();
        }
        catch (ParserConfigurationException ex)
        {
            throw new MigrationException("No XML document builder available", ex);
        }
    }

    public Document dom()
    {
        return doc;
    }

    public Element root()
    {
        return root;
    }

    /** Creates a QTI element that is not yet attached anywhere. */
    public Element create(String localName)
    {
        return doc.createElementNS(QTI_NS, localName);
    }

    /** Creates a QTI element and appends it to parent. */
    public Element add(Node parent, String localName)
    {
        Element el = create(localName);
        parent.appendChild(el);
        return el;
    }

    public void addText(Node parent, String text)
    {
        if (text != null && !text.isEmpty())
        {
            parent.appendChild(doc.createTextNode(text));
        }
    }

    public static void setLang(Element el, String lang)
    {
        if (lang != null)
        {
            el.setAttributeNS(XMLConstants.XML_NS_URI, "xml:lang", lang);
        }
    }

    public static String getLang(Element el)
    {
        return el.hasAttributeNS(XMLConstants.XML_NS_URI, "lang")
            ? el.getAttributeNS(XMLConstants.XML_NS_URI, "lang")
            : null;
    }

    /**
     * Copies the children of parsed HTML markup into parent, moving every element into the QTI
     * namespace. Comments and other non-content nodes are dropped, and an element whose name
     * cannot be written as a plain XML name is replaced by its children.
     */
    public void importMarkup(org.jsoup.nodes.Element source, Node parent)
    {
        for (org.jsoup.nodes.Node n : source.childNodes())
        {
            importNode(n, parent);
        }
    }

    /** Copies one markup node (element or character data) into parent. */
    public void importNode(org.jsoup.nodes.Node n, Node parent)
    {
        if (n instanceof TextNode)
        {
            parent.appendChild(doc.createTextNode(((TextNode) n).getWholeText()));
        }
        else if (n instanceof org.jsoup.nodes.Element)
        {
            org.jsoup.nodes.Element src = (org.jsoup.nodes.Element) n;
            if (!HtmlFragments.isXmlName(src.tagName()))
            {
                importMarkup(src, parent);
                return;
            }
            Element copy = add(parent, src.tagName());
            copyAttributes(src, copy);
            importMarkup(src, copy);
        }
    }

    private static void copyAttributes(org.jsoup.nodes.Element from, Element to)
    {
        for (Attribute a : from.attributes())
        {
            String name = a.getKey();
            if ("xmlns".equals(name))
            {
                continue;
            }
            if ("xml:lang".equals(name) || "lang".equals(name))
            {
                setLang(to, a.getValue());
            }
            else if (HtmlFragments.isXmlName(name))
            {
                to.setAttribute(name, a.getValue());
            }
        }
    }

    static String localName(Node n)
    {
        return n.getLocalName() != null ? n.getLocalName() : n.getNodeName();
    }

    // ---------------- navigation ----------------

    public static Element firstChildElement(Element parent, String localName)
    {
        for (Node c = parent.getFirstChild(); c != null; c = c.getNextSibling())
        {
            if (c.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(c)))
            {
                return (Element) c;
            }
        }
        return null;
    }

    public static List<Element> childElements(Element parent)
    {
        List<Element> out = new ArrayList<>();
        for (Node c = parent.getFirstChild(); c != null; c = c.getNextSibling())
        {
            if (c.getNodeType() == Node.ELEMENT_NODE)
            {
                out.add((Element) c);
            }
        }
        return out;
    }

    /** Every descendant element with the given local name, in document order. */
    public static List<Element> descendants(Node root, String localName)
    {
        List<Element> out = new ArrayList<>();
        collect(root, localName, out);
        return out;
    }

    private static void collect(Node n, String localName, List<Element> out)
    {
        for (Node c = n.getFirstChild(); c != null; c = c.getNextSibling())
        {
            if (c.getNodeType() == Node.ELEMENT_NODE)
            {
                if (localName.equals(localName(c)))
                {
                    out.add((Element) c);
                }
                collect(c, localName, out);
            }
        }
    }

    // ---------------- output ----------------

    public void write(OutputStream out, boolean pretty)
    {
        write(doc, out, pretty);
    }

    public String toXml(boolean pretty)
    {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        write(bos, pretty);
        return new String(bos.toByteArray(), StandardCharsets.UTF_8);
    }

    static void write(Document doc, OutputStream out, boolean pretty)
    {
        try
        {
            TransformerFactory tf = TransformerFactory.newInstance();
            Transformer transformer = tf.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            if (pretty)
            {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            }
            transformer.transform(new DOMSource(doc), new StreamResult(out));
        }
        catch (TransformerException ex)
        {
            throw new MigrationException("Failed to serialize document: " + ex.getMessage(), ex);
        }
    }
}
