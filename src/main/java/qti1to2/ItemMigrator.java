package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Walks a legacy document depth first (assessment, sections, nested sections, items) and migrates
 * every item it meets into its own QTI 2.1 assessmentItem.
 *
 * Each item gets a fresh {@link MigrationContext}. An unsupported combination fails the item it
 * occurs in; the walk carries on with the next one.
 */
public final class ItemMigrator
{
    static final String FEEDBACK = "FEEDBACK";

    private final FlowNormalizer normalizer;

    public ItemMigrator(ContentModel model)
    {
        this.normalizer = new FlowNormalizer(Objects.requireNonNull(model, "model"));
    }

    public FlowNormalizer getNormalizer()
    {
        return normalizer;
    }

    /** Migrates every item of the document, in document order. */
    public List<ItemOutcome> migrate(LegacyDocument doc)
    {
        List<ItemOutcome> out = new ArrayList<>();
        if (doc.getAssessment() != null)
        {
            for (LegacySection s : doc.getAssessment().getSections())
            {
                walk(s, out);
            }
        }
        for (SectionEntry e : doc.getEntries())
        {
            walk(e, out);
        }
        return out;
    }

    private void walk(SectionEntry entry, List<ItemOutcome> out)
    {
        if (entry instanceof LegacyItem)
        {
            out.add(migrateItem((LegacyItem) entry));
        }
        else
        {
            for (SectionEntry child : ((LegacySection) entry).getEntries())
            {
                walk(child, out);
            }
        }
    }

    /** Migrates one item; never throws for content problems, which end up in the outcome's log. */
    public ItemOutcome migrateItem(LegacyItem item)
    {
        QtiV2Document target = QtiV2Document.newItem();
        MigrationContext ctx = new MigrationContext(target, item.getIdent());
        Element root = target.root();

        String identifier = Identifiers.toNcName(item.getIdent());
        if (!identifier.equals(item.getIdent()))
        {
            ctx.warn("illegal NCName for ident \"" + item.getIdent() + "\", replaced with \"" + identifier + "\"");
        }
        MetadataRecord md = header(item, identifier, root, ctx);

        Element body = target.add(root, "itemBody");
        objectives(item, body, md, ctx);
        if (item.hasItemControl())
        {
            ctx.warn("itemcontrol is currently outside the scope of version 2");
        }
        rubrics(item, body, ctx);
        presentation(item, body, ctx);
        if (ctx.hasFailed())
        {
            return ItemOutcome.failed(item.getIdent(), identifier, ctx);
        }
        removeHotspotBackgrounds(body);
        root.setAttribute("timeDependent", ctx.isTimeDependent() ? "true" : "false");

        outcomes(item, ctx);
        Element rp = ResponseProcessingFixups.build(ctx);
        if (rp != null)
        {
            root.appendChild(rp);
        }
        feedback(item, root, ctx);

        for (Element d : ctx.getResponseDeclarations())
        {
            root.insertBefore(d, body);
        }
        for (Element d : ctx.getOutcomeDeclarations())
        {
            root.insertBefore(d, body);
        }

        for (MigrationIssue issue : ctx.getLog())
        {
            md.addAnnotation(issue.toString());
        }
        return ItemOutcome.converted(item.getIdent(), identifier, target, md, ctx);
    }

    // ---------------- header and metadata ----------------

    private static MetadataRecord header(LegacyItem item, String identifier, Element root, MigrationContext ctx)
    {
        List<String> mdTitles = item.getMetadata().get("title");
        String title = item.getTitle();
        if (title == null && mdTitles != null && !mdTitles.isEmpty())
        {
            title = mdTitles.get(0);
        }
        if (title == null)
        {
            title = item.getIdent();
        }

        root.setAttribute("identifier", identifier);
        root.setAttribute("title", title);
        if (item.getLabel() != null)
        {
            root.setAttribute("label", item.getLabel());
        }
        QtiV2Document.setLang(root, item.getLang());
        root.setAttribute("adaptive", "false");

        if (item.getMaxAttempts() != null)
        {
            ctx.warn("maxattempts can not be controlled at item level, ignored: maxattempts='"
                + item.getMaxAttempts() + "'");
        }
        if (item.getDuration() != null)
        {
            ctx.warn("duration is currently outside the scope of version 2: ignored " + item.getDuration());
        }

        MetadataRecord md = new MetadataRecord(item.getIdent()).withTitle(title).withLang(item.getLang());
        if (mdTitles != null)
        {
            // qmd_title only names the item when the title attribute is missing
            int first = item.getTitle() == null ? 1 : 0;
            for (int i = first; i < mdTitles.size(); i++)
            {
                md.addDescription(mdTitles.get(i));
            }
        }
        md.addDescription(item.getComment());
        itemMetadata(item.getMetadata(), md, ctx);
        return md;
    }

    /** Maps qti metadata fields onto the LOM record; fields with no LOM counterpart are skipped. */
    static void itemMetadata(Map<String, List<String>> fields, MetadataRecord md, IssueSink log)
    {
        if (fields.containsKey("itemtype"))
        {
            log.warn("item type metadata ignored, the interaction types now describe the item");
        }
        for (String v : values(fields, "levelofdifficulty"))
        {
            levelOfDifficulty(v, md);
        }
        for (String v : values(fields, "status"))
        {
            if (md.getStatus() != null)
            {
                log.warn("lifecycle status \"" + v.trim() + "\" ignored, only one status can be recorded");
                continue;
            }
            md.withStatus(status(v));
        }
        for (String v : values(fields, "toolvendor"))
        {
            md.addToolVendor(v.trim());
        }
        for (String v : values(fields, "topic"))
        {
            md.addEducationalDescription(v.trim());
        }
        contributors(values(fields, "author"), "author", md);
        contributors(values(fields, "creator"), "initiator", md);
        contributors(values(fields, "owner"), "publisher", md);
        for (String v : values(fields, "description"))
        {
            md.addDescription(v);
        }
        List<String> domains = values(fields, "domain");
        if (!domains.isEmpty())
        {
            log.warn("domain metadata is not part of LOM, added as keywords");
            for (String v : domains)
            {
                md.addKeyword(v);
            }
        }
        for (String key : new String[] {"keywords", "keyword"})
        {
            for (String v : values(fields, key))
            {
                for (String k : v.split(","))
                {
                    md.addKeyword(k);
                }
            }
        }
        for (String v : values(fields, "organization"))
        {
            if (!v.trim().isEmpty())
            {
                md.addContribution(new MetadataRecord.Contribution("unknown",
                    Collections.singletonList(MetadataRecord.vCard(v, true))));
            }
        }
    }

    private static List<String> values(Map<String, List<String>> fields, String key)
    {
        List<String> v = fields.get(key);
        return v == null ? Collections.<String>emptyList() : v;
    }

    /**
     * The levels QTI 1 names are educational contexts; anything else is taken to be a
     * difficulty, which is how the field is mostly used.
     */
    static void levelOfDifficulty(String value, MetadataRecord md)
    {
        String v = value.trim();
        switch (v.toLowerCase(Locale.ROOT))
        {
            case "pre-school":
                md.addContext(new MetadataRecord.Vocabulary(MetadataRecord.UNKNOWN_SOURCE, "pre-school"));
                return;
            case "school":
                md.addContext(new MetadataRecord.Vocabulary(MetadataRecord.LOM_SOURCE, "school"));
                return;
            case "he/fe":
                md.addContext(new MetadataRecord.Vocabulary(MetadataRecord.LOM_SOURCE, "higher education"));
                return;
            case "vocational":
                md.addContext(new MetadataRecord.Vocabulary(MetadataRecord.UNKNOWN_SOURCE, "vocational"));
                return;
            case "professional development":
                md.addContext(new MetadataRecord.Vocabulary(MetadataRecord.LOM_SOURCE, "training"));
                return;
            case "very easy":
            case "easy":
            case "medium":
            case "difficult":
            case "very difficult":
                md.addDifficulty(new MetadataRecord.Vocabulary(MetadataRecord.LOM_SOURCE, v));
                return;
            default:
                md.addDifficulty(new MetadataRecord.Vocabulary(MetadataRecord.UNKNOWN_SOURCE, v));
        }
    }

    static MetadataRecord.Vocabulary status(String value)
    {
        String v = value.trim().toLowerCase(Locale.ROOT);
        switch (v)
        {
            case "draft":
            case "final":
            case "revised":
            case "unavailable":
                return new MetadataRecord.Vocabulary(MetadataRecord.LOM_SOURCE, v);
            case "experimental":
            case "normal":
            case "retired":
                return new MetadataRecord.Vocabulary(MetadataRecord.QTI_SOURCE, v);
            default:
                return new MetadataRecord.Vocabulary(MetadataRecord.UNKNOWN_SOURCE, v);
        }
    }

    /** Each entry is a comma separated list of names; every name becomes its own vCard. */
    private static void contributors(List<String> entries, String role, MetadataRecord md)
    {
        for (String entry : entries)
        {
            List<String> cards = new ArrayList<>();
            for (String name : entry.split(","))
            {
                if (!name.trim().isEmpty())
                {
                    cards.add(MetadataRecord.vCard(name, false));
                }
            }
            if (!cards.isEmpty())
            {
                md.addContribution(new MetadataRecord.Contribution(role, cards));
            }
        }
    }

    // ---------------- objectives and rubric ----------------

    private void objectives(LegacyItem item, Element body, MetadataRecord md, MigrationContext ctx)
    {
        for (LegacyItem.ViewContent objective : item.getObjectives())
        {
            if (objective.view == View.ALL)
            {
                md.addEducationalDescription(ContentNode.joinText(objective.content));
                continue;
            }
            ctx.enter("objectives");
            try
            {
                Element rubric = ctx.target().add(body, "rubricBlock");
                rubric.setAttribute("view", migrateView(objective.view, ctx));
                normalizer.normalize(objective.content, rubric, TargetContext.BLOCK, ctx);
            }
            finally
            {
                ctx.leave();
            }
        }
    }

    private void rubrics(LegacyItem item, Element body, MigrationContext ctx)
    {
        for (LegacyItem.ViewContent r : item.getRubrics())
        {
            ctx.enter("rubric");
            try
            {
                Element rubric;
                if (r.view == View.ALL)
                {
                    ctx.warn("rubric with view=\"All\" replaced by <div> with class=\"rubric\"");
                    rubric = ctx.target().add(body, "div");
                    rubric.setAttribute("class", "rubric");
                }
                else
                {
                    rubric = ctx.target().add(body, "rubricBlock");
                    rubric.setAttribute("view", migrateView(r.view, ctx));
                }
                normalizer.normalize(r.content, rubric, TargetContext.BLOCK, ctx);
            }
            finally
            {
                ctx.leave();
            }
        }
    }

    static String migrateView(View view, MigrationContext ctx)
    {
        if (view.isApproximate())
        {
            ctx.warn("view=\"" + view.legacyName() + "\" migrated to view=\"" + view.v2Views() + "\"");
        }
        return view.v2Views();
    }

    // ---------------- presentation ----------------

    private void presentation(LegacyItem item, Element body, MigrationContext ctx)
    {
        LegacyItem.Presentation pres = item.getPresentation();
        if (pres == null)
        {
            return;
        }
        ctx.enter("presentation");
        try
        {
            List<ContentNode> nodes = pres.getChildren();
            ctx.setStageImages(HotspotResolver.collectImages(nodes));
            if (pres.getPosition() != null)
            {
                ctx.warn("discarding positioning information on presentation " + pres.getPosition());
            }
            if (normalizer.getClassifier().allInline(nodes))
            {
                Element p = ctx.target().add(body, "p");
                if (pres.getLabel() != null)
                {
                    p.setAttribute("label", pres.getLabel());
                }
                QtiV2Document.setLang(p, pres.getLang());
                normalizer.normalize(nodes, p, TargetContext.INLINE, ctx);
            }
            else if (pres.getLabel() != null || pres.getLang() != null)
            {
                Element div = ctx.target().add(body, "div");
                if (pres.getLabel() != null)
                {
                    div.setAttribute("label", pres.getLabel());
                }
                QtiV2Document.setLang(div, pres.getLang());
                normalizer.normalize(nodes, div, TargetContext.BLOCK, ctx);
            }
            else
            {
                normalizer.normalize(nodes, body, TargetContext.BLOCK, ctx);
            }
        }
        finally
        {
            ctx.leave();
        }
    }

    /**
     * A hotspot background may also have been emitted as an ordinary img. Those copies are
     * removed, along with any p or prompt they leave empty.
     */
    static void removeHotspotBackgrounds(Element body)
    {
        List<String> backgrounds = new ArrayList<>();
        for (String name : new String[] {"hotspotInteraction", "selectPointInteraction"})
        {
            for (Element interaction : QtiV2Document.descendants(body, name))
            {
                Element object = QtiV2Document.firstChildElement(interaction, "object");
                if (object != null)
                {
                    backgrounds.add(object.getAttribute("data"));
                }
            }
        }
        if (backgrounds.isEmpty())
        {
            return;
        }
        for (Element img : QtiV2Document.descendants(body, "img"))
        {
            if (!backgrounds.contains(img.getAttribute("src")))
            {
                continue;
            }
            Node parent = img.getParentNode();
            parent.removeChild(img);
            String pn = QtiV2Document.localName(parent);
            if (("p".equals(pn) || "prompt".equals(pn)) && isEmpty(parent))
            {
                parent.getParentNode().removeChild(parent);
            }
        }
    }

    private static boolean isEmpty(Node n)
    {
        for (Node c = n.getFirstChild(); c != null; c = c.getNextSibling())
        {
            if (c.getNodeType() == Node.ELEMENT_NODE)
            {
                return false;
            }
            if (c.getNodeType() == Node.TEXT_NODE && !c.getNodeValue().trim().isEmpty())
            {
                return false;
            }
        }
        return true;
    }

    // ---------------- response processing ----------------

    private static void outcomes(LegacyItem item, MigrationContext ctx)
    {
        if (item.getResProcessingCount() > 1)
        {
            ctx.warn("multiple <resprocessing> not supported, declarations merged and conditions ignored");
        }
        if (item.getConditionCount() > 0)
        {
            ctx.warn("response processing is not migrated, " + item.getConditionCount()
                + " <respcondition> ignored");
        }
        String maximumScore = maximumScore(item, ctx);
        for (LegacyItem.DecVar v : item.getOutcomes())
        {
            String id = Identifiers.toNcName(v.varName);
            if (!ctx.declare(id))
            {
                ctx.warn("duplicate declaration of \"" + id + "\" ignored");
                continue;
            }
            Element d = ctx.target().create("outcomeDeclaration");
            d.setAttribute("identifier", id);
            d.setAttribute("cardinality", "single");
            d.setAttribute("baseType", outcomeBaseType(v, ctx));
            if (v.members != null)
            {
                ctx.warn("decvar members ignored: " + v.members);
            }
            if (v.minValue != null)
            {
                d.setAttribute("normalMinimum", v.minValue);
            }
            if (v.maxValue != null)
            {
                d.setAttribute("normalMaximum", v.maxValue);
            }
            else if (maximumScore != null && "SCORE".equals(v.varName))
            {
                d.setAttribute("normalMaximum", maximumScore);
            }
            if (v.cutValue != null)
            {
                d.setAttribute("masteryValue", v.cutValue);
            }
            if (v.defaultValue != null)
            {
                Element value = ctx.target().add(ctx.target().add(d, "defaultValue"), "value");
                ctx.target().addText(value, v.defaultValue);
            }
            ctx.addOutcomeDeclaration(null, d);
        }
    }

    /** The maximumscore metadata field, which bounds SCORE when its decvar does not. */
    private static String maximumScore(LegacyItem item, MigrationContext ctx)
    {
        String v = ContentNode.blankToNull(item.firstMetadata("maximumscore"));
        if (v == null)
        {
            return null;
        }
        try
        {
            Double.parseDouble(v.trim());
            return v.trim();
        }
        catch (NumberFormatException ex)
        {
            ctx.warn("maximumscore metadata is not a number, ignored: " + v);
            return null;
        }
    }

    static String outcomeBaseType(LegacyItem.DecVar v, IssueSink log)
    {
        switch (v.varType.toLowerCase(Locale.ROOT))
        {
            case "integer":
                return "integer";
            case "decimal":
            case "scientific":
                return "float";
            case "boolean":
                return "boolean";
            case "string":
                return "string";
            case "enumerated":
                return "identifier";
            case "set":
                log.warn("treating vartype=\"Set\" as equivalent to \"Enumerated\"");
                return "identifier";
            default:
                log.error("bad vartype for decvar \"" + v.varName + "\"; defaulting to integer");
                return "integer";
        }
    }

    // ---------------- feedback ----------------

    private void feedback(LegacyItem item, Element root, MigrationContext ctx)
    {
        for (LegacyItem.Feedback fb : item.getFeedback())
        {
            ctx.enter("itemfeedback[" + fb.ident + "]");
            try
            {
                if (fb.view != View.ALL && fb.view != View.CANDIDATE)
                {
                    ctx.warn("itemfeedback view=\"" + fb.view.legacyName() + "\" ignored, modal feedback is shown to the candidate");
                }
                if (ctx.declare(FEEDBACK))
                {
                    Element d = ctx.target().create("outcomeDeclaration");
                    d.setAttribute("identifier", FEEDBACK);
                    d.setAttribute("cardinality", "multiple");
                    d.setAttribute("baseType", "identifier");
                    ctx.addOutcomeDeclaration(null, d);
                }
                Element mf = ctx.target().add(root, "modalFeedback");
                mf.setAttribute("outcomeIdentifier", FEEDBACK);
                mf.setAttribute("showHide", "show");
                mf.setAttribute("identifier", Identifiers.toNcName(fb.ident, "FEEDBACK_"));
                if (fb.title != null)
                {
                    mf.setAttribute("title", fb.title);
                }
                normalizer.normalize(fb.content, mf, TargetContext.FLOW, ctx);
            }
            finally
            {
                ctx.leave();
            }
        }
    }
}
