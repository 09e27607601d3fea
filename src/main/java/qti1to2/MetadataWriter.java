package qti1to2;

import java.io.OutputStream;

import javax.xml.XMLConstants;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Writes a {@link MetadataRecord} as an IEEE LOM record, the metadata format QTI 2.1 content
 * packages use.
 */
public final class MetadataWriter
{
    public static final String LOM_NS = "http://ltsc.ieee.org/xsd/LOM";
    /** QTI specific metadata, written as an extension of the LOM record. */
    public static final String QTI_METADATA_NS = "http://www.imsglobal.org/xsd/imsqti_metadata_v2p1";

    private MetadataWriter()
    {
    }

    public static Document toDocument(MetadataRecord md)
    {
        Document doc = QtiV2Document.newDocument();
        Element lom = doc.createElementNS(LOM_NS, "lom");
        lom.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", LOM_NS);
        doc.appendChild(lom);

        Element general = add(doc, lom, "general");
        Element id = add(doc, general, "identifier");
        text(doc, add(doc, id, "catalog"), "qtiv2p1");
        text(doc, add(doc, id, "entry"), md.getIdentifier());
        if (md.getTitle() != null)
        {
            langString(doc, add(doc, general, "title"), md.getTitle(), md.getLang());
        }
        if (md.getLang() != null)
        {
            text(doc, add(doc, general, "language"), md.getLang());
        }
        for (String d : md.getDescriptions())
        {
            langString(doc, add(doc, general, "description"), d, md.getLang());
        }
        for (String k : md.getKeywords())
        {
            langString(doc, add(doc, general, "keyword"), k, md.getLang());
        }

        if (md.getStatus() != null || !md.getContributions().isEmpty())
        {
            Element lifeCycle = add(doc, lom, "lifeCycle");
            if (md.getStatus() != null)
            {
                vocabulary(doc, add(doc, lifeCycle, "status"), md.getStatus());
            }
            for (MetadataRecord.Contribution c : md.getContributions())
            {
                Element contribute = add(doc, lifeCycle, "contribute");
                vocabulary(doc, add(doc, contribute, "role"), c.role);
                for (String vcard : c.entities)
                {
                    text(doc, add(doc, contribute, "entity"), vcard);
                }
            }
        }

        if (!md.getContexts().isEmpty() || !md.getDifficulties().isEmpty()
            || !md.getEducationalDescriptions().isEmpty())
        {
            Element educational = add(doc, lom, "educational");
            for (MetadataRecord.Vocabulary c : md.getContexts())
            {
                vocabulary(doc, add(doc, educational, "context"), c);
            }
            for (MetadataRecord.Vocabulary d : md.getDifficulties())
            {
                vocabulary(doc, add(doc, educational, "difficulty"), d);
            }
            for (String d : md.getEducationalDescriptions())
            {
                langString(doc, add(doc, educational, "description"), d, md.getLang());
            }
        }

        if (!md.getAnnotations().isEmpty())
        {
            Element annotation = add(doc, lom, "annotation");
            Element description = add(doc, annotation, "description");
            for (String a : md.getAnnotations())
            {
                langString(doc, description, a, null);
            }
        }

        if (!md.getToolVendors().isEmpty())
        {
            Element qti = doc.createElementNS(QTI_METADATA_NS, "qtiMetadata");
            qti.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", QTI_METADATA_NS);
            lom.appendChild(qti);
            for (String vendor : md.getToolVendors())
            {
                Element v = doc.createElementNS(QTI_METADATA_NS, "toolVendor");
                v.appendChild(doc.createTextNode(vendor));
                qti.appendChild(v);
            }
        }
        return doc;
    }

    public static void write(MetadataRecord md, OutputStream out, boolean pretty)
    {
        QtiV2Document.write(toDocument(md), out, pretty);
    }

    private static Element add(Document doc, Element parent, String name)
    {
        Element el = doc.createElementNS(LOM_NS, name);
        parent.appendChild(el);
        return el;
    }

    private static void text(Document doc, Element el, String value)
    {
        el.appendChild(doc.createTextNode(value));
    }

    private static void vocabulary(Document doc, Element parent, MetadataRecord.Vocabulary v)
    {
        text(doc, add(doc, parent, "source"), v.source);
        text(doc, add(doc, parent, "value"), v.value);
    }

    private static void langString(Document doc, Element parent, String value, String lang)
    {
        Element s = add(doc, parent, "string");
        if (lang != null)
        {
            s.setAttribute("language", lang);
        }
        text(doc, s, value);
    }
}
