package qti1to2;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

/**
 * Checks a migrated item against the QTI 2.1 content model: every element must be known, carry
 * only attributes its kind allows and only contain children its kind allows. Interactions and
 * feedback must refer to declared variables.
 */
public final class ItemValidator
{
    public static final class ValidationResult
    {
        private final List<MigrationIssue> issues = new ArrayList<>();

        void add(Severity severity, String path, String message)
        {
            issues.add(new MigrationIssue(severity, path, message));
        }

        public List<MigrationIssue> getIssues()
        {
            return Collections.unmodifiableList(issues);
        }

        public boolean isClean()
        {
            return issues.isEmpty();
        }

        public int countErrors()
        {
            return count(Severity.ERROR);
        }

        public int countWarnings()
        {
            return count(Severity.WARNING);
        }

        private int count(Severity severity)
        {
            int c = 0;
            for (MigrationIssue i : issues)
            {
                if (i.severity == severity)
                {
                    c++;
                }
            }
            return c;
        }
    }

    private final ContentModel model;

    public ItemValidator(ContentModel model)
    {
        this.model = Objects.requireNonNull(model, "model");
    }

    /**
     * @param strict report content model violations as errors rather than warnings
     */
    public ValidationResult validate(Document doc, boolean strict)
    {
        ValidationResult vr = new ValidationResult();
        Element root = doc.getDocumentElement();
        if (root == null)
        {
            vr.add(Severity.ERROR, "/", "No root element");
            return vr;
        }
        Severity level = strict ? Severity.ERROR : Severity.WARNING;
        if (!model.getNamespace().equals(root.getNamespaceURI()))
        {
            vr.add(Severity.ERROR, "/", "Root element is not in the " + model.getNamespace() + " namespace");
        }

        Set<String> variables = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, "/" + QtiV2Document.localName(root)));
        List<Frame> references = new ArrayList<>();

        while (!stack.isEmpty())
        {
            Frame f = stack.pop();
            Element el = f.element;
            String tag = QtiV2Document.localName(el);

            ContentModel.TagSpec spec = model.getTagSpec(tag);
            if (spec == null)
            {
                vr.add(Severity.ERROR, f.path, "Unknown tag <" + tag + "> (not in the QTI 2.1 content model)");
            }
            else
            {
                NamedNodeMap attrs = el.getAttributes();
                for (int i = 0; i < attrs.getLength(); i++)
                {
                    String an = ((Attr) attrs.item(i)).getName();
                    if (an.equals("xmlns") || an.startsWith("xmlns:") || an.startsWith("xsi:"))
                    {
                        continue;
                    }
                    if (!spec.attributes.contains(an))
                    {
                        vr.add(level, f.path, "Unknown attribute '" + an + "' on <" + tag + ">");
                    }
                }
            }

            if ("responseDeclaration".equals(tag) || "outcomeDeclaration".equals(tag))
            {
                variables.add(el.getAttribute("identifier"));
            }
            if (el.hasAttribute("responseIdentifier") || "modalFeedback".equals(tag))
            {
                references.add(f);
            }

            // children are pushed in reverse so the walk stays in document order
            List<Element> children = QtiV2Document.childElements(el);
            for (int i = children.size() - 1; i >= 0; i--)
            {
                Element c = children.get(i);
                String cn = QtiV2Document.localName(c);
                if (spec != null && !spec.children.contains(cn))
                {
                    vr.add(level, f.path, "Unexpected child <" + cn + "> inside <" + tag + ">");
                }
                stack.push(new Frame(c, f.path + "/" + cn + "[" + i + "]"));
            }
            if (hasBlockText(el, tag))
            {
                vr.add(level, f.path, "Text directly inside block container <" + tag + ">");
            }
        }

        for (Frame f : references)
        {
            String ref = f.element.hasAttribute("responseIdentifier")
                ? f.element.getAttribute("responseIdentifier")
                : f.element.getAttribute("outcomeIdentifier");
            if (!variables.contains(ref))
            {
                vr.add(Severity.ERROR, f.path, "<" + QtiV2Document.localName(f.element) + "> refers to undeclared variable '"
                    + ref + "'");
            }
        }
        return vr;
    }

    /** True for non-blank text in an element that only admits block children. */
    private boolean hasBlockText(Element el, String tag)
    {
        if (!"itemBody".equals(tag) && !"rubricBlock".equals(tag))
        {
            return false;
        }
        for (Node c = el.getFirstChild(); c != null; c = c.getNextSibling())
        {
            if (c.getNodeType() == Node.TEXT_NODE && !c.getNodeValue().trim().isEmpty())
            {
                return true;
            }
        }
        return false;
    }

    private static final class Frame
    {
        final Element element;
        final String path;

        Frame(Element element, String path)
        {
            this.element = element;
            this.path = path;
        }
    }
}
