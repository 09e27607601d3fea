package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Turns a legacy response and its render into QTI 2.1 interactions and the variables that
 * capture them.
 */
public final class ResponseDispatcher
{
    private final FlowNormalizer normalizer;
    private final ContentClassifier classifier;
    private final HotspotResolver hotspots;

    ResponseDispatcher(FlowNormalizer normalizer, ContentClassifier classifier, HotspotResolver hotspots)
    {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.hotspots = Objects.requireNonNull(hotspots, "hotspots");
    }

    /**
     * Migrates a response into parent: its prompt, its interaction(s), then its footer.
     *
     * @return the interactions that were kept, each with its responseIdentifier set
     */
    public List<Element> migrate(Response response, Element parent, TargetContext context, MigrationContext ctx)
    {
        if (response.isTiming())
        {
            ctx.markTimeDependent();
        }

        Render render = response.getRender();
        InteractionTable.Selection sel = InteractionTable.select(
            response.getKind(), render == null ? null : render.getKind(), response.getCardinality());
        if (!sel.isSupported())
        {
            ctx.fail(sel.unsupported);
            return Collections.emptyList();
        }

        if (sel.variant == InteractionTable.Variant.TEXT_ENTRY)
        {
            return migrateFib(response, parent, context, ctx);
        }

        if (context == TargetContext.INLINE)
        {
            ctx.error("unable to place a block interaction in inline content, omitting " + response);
            return Collections.emptyList();
        }

        List<ContentNode> prompt = response.getPrompt();
        List<ContentNode> interactionPrompt = null;
        Element promptImage = null;
        boolean graphic = sel.variant == InteractionTable.Variant.HOTSPOT
            || sel.variant == InteractionTable.Variant.SELECT_POINT;

        if (classifier.allInline(prompt))
        {
            interactionPrompt = prompt;
        }
        else if (graphic)
        {
            Element div = ctx.target().add(parent, "div");
            normalizer.normalize(prompt, div, TargetContext.FLOW, ctx);
            List<Element> imgs = QtiV2Document.descendants(div, "img");
            promptImage = imgs.isEmpty() ? null : imgs.get(0);
        }
        else
        {
            normalizer.normalize(prompt, parent, context, ctx);
        }

        List<Element> interactions;
        switch (sel.variant)
        {
            case CHOICE:
                interactions = choice(response, parent, interactionPrompt, ctx);
                break;
            case CHOICE_SLIDER:
                interactions = choiceSlider(response, parent, interactionPrompt, ctx);
                break;
            case SLIDER:
                interactions = slider(response, parent, interactionPrompt, ctx);
                break;
            case HOTSPOT:
            case SELECT_POINT:
                interactions = graphic(sel.variant, response, parent, interactionPrompt, promptImage, ctx);
                break;
            default:
                throw new IllegalStateException("Unhandled variant " + sel.variant);
        }

        if (ctx.hasFailed())
        {
            return Collections.emptyList();
        }
        interactions = declare(response, interactions, ctx);

        // the footer has nowhere better to go than after the interaction
        normalizer.normalize(response.getFooter(), parent, context, ctx);
        return interactions;
    }

    // ---------------- identifiers and declarations ----------------

    /**
     * Applies the cardinality rule, allocates response identifiers and creates the declarations.
     */
    private List<Element> declare(Response response, List<Element> interactions, MigrationContext ctx)
    {
        if (interactions.isEmpty())
        {
            return interactions;
        }
        if (interactions.size() > 1 && response.getCardinality() == Cardinality.SINGLE)
        {
            ctx.error("unable to migrate a response with Single cardinality to a single interaction: "
                + response.getIdent());
            for (Element el : interactions)
            {
                Node p = el.getParentNode();
                if (p != null)
                {
                    p.removeChild(el);
                }
            }
            return Collections.emptyList();
        }

        String base = Identifiers.toNcName(response.getIdent());
        List<String> ids = new ArrayList<>();
        if (interactions.size() > 1)
        {
            for (int i = 0; i < interactions.size(); i++)
            {
                ids.add(ctx.allocateSuffixed(base));
            }
        }
        else if (ctx.declare(base))
        {
            ids.add(base);
        }
        else
        {
            String id = ctx.allocateSuffixed(base);
            ctx.warn("identifier \"" + base + "\" is already declared, response renamed to \"" + id + "\"");
            ids.add(id);
        }

        String baseType = InteractionTable.baseType(response.getKind(), response.getNumType());
        String cardinality = response.getCardinality().qtiName();
        for (int i = 0; i < interactions.size(); i++)
        {
            Element interaction = interactions.get(i);
            interaction.setAttribute("responseIdentifier", ids.get(i));

            Element d = ctx.target().create("responseDeclaration");
            d.setAttribute("identifier", ids.get(i));
            d.setAttribute("cardinality", cardinality);
            d.setAttribute("baseType", baseType);
            if ("sliderInteraction".equals(QtiV2Document.localName(interaction))
                && response.getRender().getStartVal() != null)
            {
                Element value = ctx.target().add(ctx.target().add(d, "defaultValue"), "value");
                int start = response.getRender().getStartVal();
                ctx.target().addText(value, "integer".equals(baseType) ? String.valueOf(start) : String.valueOf((double) start));
            }
            ctx.addResponseDeclaration(response.getIdent(), d);
        }

        if (ids.size() > 1)
        {
            if (ctx.declare(base))
            {
                Element d = ctx.target().create("outcomeDeclaration");
                d.setAttribute("identifier", base);
                d.setAttribute("cardinality", cardinality);
                d.setAttribute("baseType", baseType);
                ctx.addOutcomeDeclaration(response.getIdent(), d);
            }
            else
            {
                ctx.warn("identifier \"" + base + "\" is already declared, no outcome collects the values of "
                    + String.join(", ", ids));
            }
            ctx.addFixup(base, ids);
        }
        return interactions;
    }

    // ---------------- choice ----------------

    private List<Element> choice(Response response, Element parent, List<ContentNode> prompt, MigrationContext ctx)
    {
        Render render = response.getRender();
        Element interaction = ctx.target().add(parent, "choiceInteraction");
        addPrompt(interaction, prompt, ctx);
        interaction.setAttribute("shuffle", render.isShuffle() ? "true" : "false");
        if (render.getMaxNumber() != null)
        {
            interaction.setAttribute("maxChoices", String.valueOf(render.getMaxNumber()));
        }
        else
        {
            interaction.setAttribute("maxChoices", response.getCardinality() == Cardinality.SINGLE ? "1" : "0");
        }
        if (render.getMinNumber() != null)
        {
            interaction.setAttribute("minChoices", String.valueOf(render.getMinNumber()));
        }
        for (ContentNode label : render.getLabels())
        {
            simpleChoice(interaction, label, render.isShuffle(), ctx);
        }
        return single(interaction);
    }

    private List<Element> choiceSlider(Response response, Element parent, List<ContentNode> prompt,
        MigrationContext ctx)
    {
        Render render = response.getRender();
        List<ContentNode> labels = render.getLabels();
        int maxChoices = render.getMaxNumber() != null ? render.getMaxNumber() : labels.size();

        Element interaction = ctx.target().add(parent, "choiceInteraction");
        addPrompt(interaction, prompt, ctx);
        interaction.setAttribute("class", "slider");
        interaction.setAttribute("shuffle", "false");
        if (response.getCardinality() == Cardinality.SINGLE)
        {
            ctx.warn("choice-slider replaced with choiceInteraction.slider");
            interaction.setAttribute("maxChoices", "1");
            interaction.setAttribute("minChoices", "1");
        }
        else
        {
            ctx.error("multiple-slider replaced with choiceInteraction.slider");
            interaction.setAttribute("maxChoices", String.valueOf(maxChoices));
            interaction.setAttribute("minChoices",
                String.valueOf(render.getMinNumber() != null ? render.getMinNumber() : maxChoices));
        }
        for (ContentNode label : labels)
        {
            simpleChoice(interaction, label, false, ctx);
        }
        return single(interaction);
    }

    private void simpleChoice(Element interaction, ContentNode label, boolean shuffle, MigrationContext ctx)
    {
        Element choice = ctx.target().add(interaction, "simpleChoice");
        choice.setAttribute("identifier", Identifiers.toNcName(label.getIdent()));
        if (shuffle)
        {
            choice.setAttribute("fixed", label.isShuffle() ? "false" : "true");
        }

        List<String> data = new ArrayList<>();
        List<ContentNode> content = new ArrayList<>();
        for (ContentNode c : label.getChildren())
        {
            if (c.getKind() == ContentKind.DATA)
            {
                if (!c.getText().trim().isEmpty())
                {
                    data.add(c.getText());
                }
            }
            else
            {
                content.add(c);
            }
        }
        if (!data.isEmpty() && !content.isEmpty())
        {
            ctx.warn("ignoring PCDATA in <response_label>, \"" + String.join(" ", data).trim() + "\"");
        }
        if (content.isEmpty())
        {
            for (String d : data)
            {
                ctx.target().addText(choice, d);
            }
        }
        else
        {
            normalizer.normalize(content, choice, TargetContext.FLOW, ctx);
        }
    }

    // ---------------- slider ----------------

    private List<Element> slider(Response response, Element parent, List<ContentNode> prompt, MigrationContext ctx)
    {
        Render render = response.getRender();
        Element interaction = ctx.target().add(parent, "sliderInteraction");
        addPrompt(interaction, prompt, ctx);
        if (render.getLowerBound() == null || render.getUpperBound() == null)
        {
            ctx.warn("render_slider without lowerbound and upperbound, missing bounds set to 0");
        }
        interaction.setAttribute("lowerBound", decimal(render.getLowerBound()));
        interaction.setAttribute("upperBound", decimal(render.getUpperBound()));
        if (render.getStep() != null)
        {
            interaction.setAttribute("step", String.valueOf(render.getStep()));
        }
        if (render.getOrientation() != null)
        {
            interaction.setAttribute("orientation", render.getOrientation().toLowerCase(Locale.ROOT));
        }
        return single(interaction);
    }

    private static String decimal(Integer v)
    {
        return String.valueOf(v == null ? 0.0 : (double) v);
    }

    // ---------------- hotspot and select point ----------------

    private List<Element> graphic(InteractionTable.Variant variant, Response response, Element parent,
        List<ContentNode> prompt, Element promptImage, MigrationContext ctx)
    {
        Render render = response.getRender();
        String name = variant == InteractionTable.Variant.HOTSPOT ? "hotspotInteraction" : "selectPointInteraction";
        if (render.isShowDraw())
        {
            ctx.warn("ignoring showdraw=\"Yes\", no QTI 2.1 equivalent");
        }
        List<ContentNode> labels = render.getLabels();

        Element interaction = ctx.target().add(parent, name);
        setChoiceBounds(interaction, response, render.getMinNumber(), render.getMaxNumber());

        if (prompt != null && !prompt.isEmpty())
        {
            ContentNode image = hotspots.singleImage(prompt);
            if (image != null)
            {
                addImageObject(interaction, image, ctx);
                addHotspotChoices(interaction, labels, 0, 0, ctx);
                return single(interaction);
            }
            Element promptEl = addPrompt(interaction, prompt, ctx);
            List<Element> imgs = QtiV2Document.descendants(promptEl, "img");
            promptImage = imgs.isEmpty() ? null : imgs.get(0);
        }

        if (promptImage != null)
        {
            Element object = ctx.target().add(interaction, "object");
            object.setAttribute("data", promptImage.getAttribute("src"));
            object.setAttribute("type", imageType(promptImage.getAttribute("src"), ctx));
            copyIfPresent(promptImage, object, "width");
            copyIfPresent(promptImage, object, "height");
            addHotspotChoices(interaction, labels, 0, 0, ctx);
            return single(interaction);
        }

        List<HotspotResolver.Association> found = hotspots.associate(labels, ctx.getStageImages(), ctx);
        if (found.isEmpty())
        {
            parent.removeChild(interaction);
            return Collections.emptyList();
        }
        if (found.size() == 1)
        {
            HotspotResolver.Association a = found.get(0);
            addImageObject(interaction, a.image, ctx);
            addHotspotChoices(interaction, a.labels, offsetX(a.image), offsetY(a.image), ctx);
            return single(interaction);
        }

        // one interaction per image; selection limits no longer span the whole construct
        if (render.getMaxNumber() != null)
        {
            ctx.warn("multi-image hotspot maps to multiple interactions, maxChoices can no longer be enforced");
        }
        if (render.getMinNumber() != null)
        {
            ctx.warn("multi-image hotspot maps to multiple interactions, minChoices dropped");
        }
        List<Element> out = new ArrayList<>();
        for (HotspotResolver.Association a : found)
        {
            Element split = out.isEmpty() ? interaction : ctx.target().add(parent, name);
            Integer max = render.getMaxNumber();
            if (max != null && max >= a.labels.size())
            {
                max = null;
            }
            split.removeAttribute("minChoices");
            split.setAttribute("maxChoices", max == null ? "0" : String.valueOf(max));
            addImageObject(split, a.image, ctx);
            addHotspotChoices(split, a.labels, offsetX(a.image), offsetY(a.image), ctx);
            out.add(split);
        }
        return out;
    }

    private static void setChoiceBounds(Element interaction, Response response, Integer min, Integer max)
    {
        if (max != null)
        {
            interaction.setAttribute("maxChoices", String.valueOf(max));
        }
        else
        {
            interaction.setAttribute("maxChoices", response.getCardinality() == Cardinality.SINGLE ? "1" : "0");
        }
        if (min != null)
        {
            interaction.setAttribute("minChoices", String.valueOf(min));
        }
    }

    private void addImageObject(Element interaction, ContentNode image, MigrationContext ctx)
    {
        Element object = ctx.target().add(interaction, "object");
        object.setAttribute("data", image.getUri());
        object.setAttribute("type", image.getMimeType() != null ? image.getMimeType() : imageType(image.getUri(), ctx));
        PositionRect pos = image.getPosition();
        if (pos != null && pos.width != null)
        {
            object.setAttribute("width", String.valueOf(pos.width));
        }
        if (pos != null && pos.height != null)
        {
            object.setAttribute("height", String.valueOf(pos.height));
        }
    }

    /**
     * The type of a background image. An img has no type of its own, so it is taken from the
     * matimage with the same uri, else guessed from the file extension.
     */
    private static String imageType(String src, MigrationContext ctx)
    {
        for (ContentNode img : ctx.getStageImages())
        {
            if (src.equals(img.getUri()) && img.getMimeType() != null)
            {
                return img.getMimeType();
            }
        }
        String s = src.toLowerCase(Locale.ROOT);
        if (s.endsWith(".png"))
        {
            return "image/png";
        }
        if (s.endsWith(".gif"))
        {
            return "image/gif";
        }
        if (s.endsWith(".svg"))
        {
            return "image/svg+xml";
        }
        return "image/jpeg";
    }

    private static void copyIfPresent(Element from, Element to, String attr)
    {
        if (from.hasAttribute(attr))
        {
            to.setAttribute(attr, from.getAttribute(attr));
        }
    }

    private static int offsetX(ContentNode image)
    {
        return image.getPosition() == null ? 0 : image.getPosition().xOffset();
    }

    private static int offsetY(ContentNode image)
    {
        return image.getPosition() == null ? 0 : image.getPosition().yOffset();
    }

    private void addHotspotChoices(Element interaction, List<ContentNode> labels, int dx, int dy, MigrationContext ctx)
    {
        boolean selectPoint = "selectPointInteraction".equals(QtiV2Document.localName(interaction));
        for (ContentNode label : labels)
        {
            if (selectPoint)
            {
                ctx.warn("ignoring response_label in selectPointInteraction (" + label.getIdent() + ")");
                continue;
            }
            Element choice = ctx.target().add(interaction, "hotspotChoice");
            choice.setAttribute("identifier", Identifiers.toNcName(label.getIdent()));
            HotspotResolver.LabelValue value = HotspotResolver.parseLabel(label);
            AreaCoordinates.Shape shape = AreaCoordinates.translate(label.getArea(), value.coords, ctx);
            if (dx != 0 || dy != 0)
            {
                shape = AreaCoordinates.offset(shape, dx, dy);
            }
            choice.setAttribute("shape", shape.shape.qtiName());
            choice.setAttribute("coords", shape.coordsText());
            QtiV2Document.setLang(choice, value.lang);
            if (!value.label.isEmpty())
            {
                choice.setAttribute("hotspotLabel", value.label);
            }
        }
    }

    // ---------------- fill-in-blank ----------------

    /**
     * A fill-in-blank is migrated as one run: its intro, its render content (where every label
     * becomes a text entry) and its outro.
     */
    private List<Element> migrateFib(Response response, Element parent, TargetContext context, MigrationContext ctx)
    {
        Render render = response.getRender();
        List<ContentNode> run = new ArrayList<>(response.getIntro());
        run.addAll(render.getChildren());
        run.addAll(response.getOutro());

        ctx.beginFib();
        List<Element> interactions;
        try
        {
            normalizer.normalize(run, parent, context, ctx);
        }
        finally
        {
            interactions = ctx.endFib();
        }
        if (ctx.hasFailed())
        {
            return Collections.emptyList();
        }

        if (response.getCardinality() == Cardinality.SINGLE && interactions.size() > 1)
        {
            ctx.warn("single response fib ignoring all but last <response_label>");
            for (Element el : interactions.subList(0, interactions.size() - 1))
            {
                el.getParentNode().removeChild(el);
            }
            interactions = new ArrayList<>(interactions.subList(interactions.size() - 1, interactions.size()));
        }

        for (Element interaction : interactions)
        {
            if (render.getMaxChars() != null)
            {
                interaction.setAttribute("expectedLength", String.valueOf(render.getMaxChars()));
            }
            else if (render.getRows() != null && render.getColumns() != null)
            {
                interaction.setAttribute("expectedLength", String.valueOf(render.getRows() * render.getColumns()));
            }
            if ("extendedTextInteraction".equals(QtiV2Document.localName(interaction)) && render.getRows() != null)
            {
                interaction.setAttribute("expectedLines", String.valueOf(render.getRows()));
            }
        }
        return declare(response, interactions, ctx);
    }

    /**
     * Emits the text entry for one fill-in-blank label. Single line blanks, and any blank in
     * inline content, become textEntryInteraction; others become extendedTextInteraction.
     */
    void migrateFibLabel(ContentNode label, Element parent, TargetContext context, MigrationContext ctx)
    {
        Render render = label.getRender();
        String name = render.isInlineFibLabel() || context == TargetContext.INLINE
            ? "textEntryInteraction"
            : "extendedTextInteraction";
        Element interaction = ctx.target().add(parent, name);
        if (!label.getChildren().isEmpty())
        {
            ctx.warn("ignoring content in render_fib.response_label");
        }
        ctx.fibInteraction(interaction);
    }

    // ---------------- helpers ----------------

    private Element addPrompt(Element interaction, List<ContentNode> prompt, MigrationContext ctx)
    {
        if (prompt == null || prompt.isEmpty())
        {
            return null;
        }
        Element p = ctx.target().add(interaction, "prompt");
        normalizer.normalize(prompt, p, TargetContext.INLINE, ctx);
        return p;
    }

    private static List<Element> single(Element interaction)
    {
        List<Element> out = new ArrayList<>();
        out.add(interaction);
        return out;
    }
}
