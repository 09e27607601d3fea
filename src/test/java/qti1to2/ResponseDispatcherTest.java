package qti1to2;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

class ResponseDispatcherTest
{
    private final FlowNormalizer normalizer = new FlowNormalizer(ContentModel.loadDefault());
    private final ResponseDispatcher dispatcher = normalizer.getDispatcher();

    private MigrationContext ctx;
    private Element body;

    @BeforeEach
    void setUp()
    {
        ctx = new MigrationContext(QtiV2Document.newItem(), "item1");
        body = ctx.target().add(ctx.target().root(), "itemBody");
    }

    private static ContentNode rect(String ident, String coords)
    {
        return ContentNode.responseLabel(ident, ContentNode.data(coords)).withArea(AreaShape.RECTANGLE);
    }

    private static ContentNode positionedImage(String uri, int x0)
    {
        return ContentNode.image(uri).withPosition(new PositionRect(x0, 0, 100, 100));
    }

    /** Two labels, one on each of two side by side stage images. */
    private Response twoImageHotspot(String ident, Cardinality cardinality)
    {
        ctx.setStageImages(Arrays.asList(positionedImage("left.png", 0), positionedImage("right.png", 200)));
        return new Response(ResponseKind.LID, ident)
            .withCardinality(cardinality)
            .withRender(new Render(RenderKind.HOTSPOT).add(rect("A", "10,10,20,20"), rect("B", "210,10,20,20")));
    }

    private Response choice(String ident)
    {
        return new Response(ResponseKind.LID, ident)
            .intro(ContentNode.material(ContentNode.text("Pick one")))
            .withRender(new Render(RenderKind.CHOICE).add(
                ContentNode.responseLabel("A", ContentNode.data("red")),
                ContentNode.responseLabel("B", ContentNode.data("green")),
                ContentNode.responseLabel("C", ContentNode.data("blue"))));
    }

    @Test
    void choiceGetsOneSimpleChoicePerLabelAndAnInlinePrompt()
    {
        List<Element> out = dispatcher.migrate(choice("R"), body, TargetContext.BLOCK, ctx);

        assertEquals(1, out.size());
        Element interaction = out.get(0);
        assertEquals("choiceInteraction", QtiV2Document.localName(interaction));
        assertEquals("R", interaction.getAttribute("responseIdentifier"));
        assertEquals("1", interaction.getAttribute("maxChoices"));
        assertEquals("false", interaction.getAttribute("shuffle"));
        assertEquals("Pick one", QtiV2Document.firstChildElement(interaction, "prompt").getTextContent());

        List<Element> choices = QtiV2Document.descendants(interaction, "simpleChoice");
        assertEquals(3, choices.size());
        assertEquals("B", choices.get(1).getAttribute("identifier"));
        assertEquals("green", choices.get(1).getTextContent());

        assertEquals(1, ctx.getResponseDeclarations().size());
        Element decl = ctx.getResponseDeclarations().get(0);
        assertEquals("R", decl.getAttribute("identifier"));
        assertEquals("single", decl.getAttribute("cardinality"));
        assertEquals("identifier", decl.getAttribute("baseType"));
        assertTrue(ctx.getLog().isEmpty());
    }

    @Test
    void hotspotWithoutAnyImageIsOmittedWithOneError()
    {
        Response r = new Response(ResponseKind.LID, "H")
            .withRender(new Render(RenderKind.HOTSPOT).add(rect("A", "10,10,20,20")));

        List<Element> out = dispatcher.migrate(r, body, TargetContext.BLOCK, ctx);

        assertTrue(out.isEmpty());
        assertTrue(QtiV2Document.descendants(body, "hotspotInteraction").isEmpty());
        assertTrue(ctx.getResponseDeclarations().isEmpty());
        assertEquals(1, ctx.count(Severity.ERROR));
        assertTrue(ctx.getLog().get(0).message.contains("no hotspot image"));
        assertFalse(ctx.hasFailed());
    }

    @Test
    void singleCardinalitySplitIsDroppedButLaterResponsesStillMigrate()
    {
        List<Element> out = dispatcher.migrate(twoImageHotspot("H", Cardinality.SINGLE), body, TargetContext.BLOCK, ctx);

        assertTrue(out.isEmpty());
        assertTrue(QtiV2Document.descendants(body, "hotspotInteraction").isEmpty());
        assertTrue(ctx.getResponseDeclarations().isEmpty());
        assertEquals(1, ctx.count(Severity.ERROR));
        assertEquals(0, ctx.count(Severity.WARNING));

        List<Element> next = dispatcher.migrate(choice("R"), body, TargetContext.BLOCK, ctx);
        assertEquals(1, next.size());
        assertEquals(1, ctx.getResponseDeclarations().size());
    }

    @Test
    void multiImageHotspotSplitsPerImageWithOffsetCoordinates()
    {
        List<Element> out = dispatcher.migrate(twoImageHotspot("Q1", Cardinality.MULTIPLE), body, TargetContext.BLOCK, ctx);

        assertEquals(2, out.size());
        assertEquals("Q1_01", out.get(0).getAttribute("responseIdentifier"));
        assertEquals("Q1_02", out.get(1).getAttribute("responseIdentifier"));
        assertEquals("left.png", QtiV2Document.firstChildElement(out.get(0), "object").getAttribute("data"));
        assertEquals("right.png", QtiV2Document.firstChildElement(out.get(1), "object").getAttribute("data"));
        assertEquals("image/png", QtiV2Document.firstChildElement(out.get(1), "object").getAttribute("type"));

        Element a = QtiV2Document.firstChildElement(out.get(0), "hotspotChoice");
        Element b = QtiV2Document.firstChildElement(out.get(1), "hotspotChoice");
        assertEquals("rect", a.getAttribute("shape"));
        assertEquals("10,10,29,29", a.getAttribute("coords"));
        assertEquals("10,10,29,29", b.getAttribute("coords"));
        assertEquals("0", out.get(1).getAttribute("maxChoices"));

        // the base identifier collects the split values
        assertEquals(1, ctx.getOutcomeDeclarations().size());
        Element outcome = ctx.getOutcomeDeclarations().get(0);
        assertEquals("Q1", outcome.getAttribute("identifier"));
        assertEquals("multiple", outcome.getAttribute("cardinality"));
        assertEquals(Arrays.asList("Q1_01", "Q1_02"), ctx.getFixups().get("Q1"));
        assertEquals(3, ctx.declarationsFor("Q1").size());
    }

    @Test
    void multiImageSplitDropsTheMinimumWithOneWarning()
    {
        Response r = twoImageHotspot("Q1", Cardinality.MULTIPLE);
        r.getRender().withMinNumber(1);

        List<Element> out = dispatcher.migrate(r, body, TargetContext.BLOCK, ctx);

        assertEquals(2, out.size());
        for (Element split : out)
        {
            assertFalse(split.hasAttribute("minChoices"));
            assertEquals("0", split.getAttribute("maxChoices"));
        }
        assertEquals(1, ctx.count(Severity.WARNING));
        assertTrue(ctx.getLog().get(0).message.contains("minChoices dropped"));
    }

    @Test
    void splitOfAnAlreadyDeclaredIdentifierStillGetsSuffixedIdentifiers()
    {
        assertTrue(ctx.declare("Q1"));

        List<Element> out = dispatcher.migrate(twoImageHotspot("Q1", Cardinality.MULTIPLE), body, TargetContext.BLOCK, ctx);

        assertEquals(2, out.size());
        assertEquals("Q1_01", out.get(0).getAttribute("responseIdentifier"));
        assertEquals("Q1_02", out.get(1).getAttribute("responseIdentifier"));
        assertTrue(ctx.getOutcomeDeclarations().isEmpty());
        assertEquals(1, ctx.count(Severity.WARNING));
        assertEquals(Arrays.asList("Q1_01", "Q1_02"), ctx.getFixups().get("Q1"));
    }

    @Test
    void repeatedResponseIdentifierIsRenamed()
    {
        dispatcher.migrate(choice("R"), body, TargetContext.BLOCK, ctx);
        List<Element> second = dispatcher.migrate(choice("R"), body, TargetContext.BLOCK, ctx);

        assertEquals("R_01", second.get(0).getAttribute("responseIdentifier"));
        assertEquals(1, ctx.count(Severity.WARNING));
    }

    @Test
    void promptThatIsJustAnImageBecomesTheBackgroundObject()
    {
        Response r = new Response(ResponseKind.LID, "H")
            .intro(ContentNode.material(ContentNode.image("map.gif").withMimeType("image/gif")))
            .withRender(new Render(RenderKind.HOTSPOT).add(rect("A", "5,5,10,10")));

        List<Element> out = dispatcher.migrate(r, body, TargetContext.BLOCK, ctx);

        assertEquals(1, out.size());
        Element object = QtiV2Document.firstChildElement(out.get(0), "object");
        assertEquals("map.gif", object.getAttribute("data"));
        assertEquals("image/gif", object.getAttribute("type"));
        assertNull(QtiV2Document.firstChildElement(out.get(0), "prompt"));
        assertEquals("5,5,14,14", QtiV2Document.firstChildElement(out.get(0), "hotspotChoice").getAttribute("coords"));
    }

    @Test
    void xyResponseOnAnImageBecomesSelectPointWithoutChoices()
    {
        Response r = new Response(ResponseKind.XY, "P")
            .intro(ContentNode.material(ContentNode.image("map.gif").withMimeType("image/gif")))
            .withRender(new Render(RenderKind.HOTSPOT).withMaxNumber(1).add(rect("A", "5,5,10,10")));

        List<Element> out = dispatcher.migrate(r, body, TargetContext.BLOCK, ctx);

        assertEquals(1, out.size());
        Element interaction = out.get(0);
        assertEquals("selectPointInteraction", QtiV2Document.localName(interaction));
        assertEquals("1", interaction.getAttribute("maxChoices"));
        assertEquals("map.gif", QtiV2Document.firstChildElement(interaction, "object").getAttribute("data"));
        assertTrue(QtiV2Document.descendants(interaction, "hotspotChoice").isEmpty());

        Element decl = ctx.getResponseDeclarations().get(0);
        assertEquals("P", decl.getAttribute("identifier"));
        assertEquals("point", decl.getAttribute("baseType"));
        assertEquals(1, ctx.count(Severity.WARNING));
        assertEquals("ignoring response_label in selectPointInteraction (A)", ctx.getLog().get(0).message);
    }

    private static Response choiceSlider(Cardinality cardinality)
    {
        return new Response(ResponseKind.LID, "CS")
            .withCardinality(cardinality)
            .withRender(new Render(RenderKind.SLIDER).withMaxNumber(2).add(
                ContentNode.responseLabel("LOW", ContentNode.data("low")),
                ContentNode.responseLabel("MID", ContentNode.data("mid")),
                ContentNode.responseLabel("HIGH", ContentNode.data("high"))));
    }

    @Test
    void singleChoiceSliderBecomesAChoiceInteractionWithSliderClass()
    {
        List<Element> out = dispatcher.migrate(choiceSlider(Cardinality.SINGLE), body, TargetContext.BLOCK, ctx);

        Element interaction = out.get(0);
        assertEquals("choiceInteraction", QtiV2Document.localName(interaction));
        assertEquals("slider", interaction.getAttribute("class"));
        assertEquals("false", interaction.getAttribute("shuffle"));
        assertEquals("1", interaction.getAttribute("maxChoices"));
        assertEquals("1", interaction.getAttribute("minChoices"));
        assertEquals(3, QtiV2Document.descendants(interaction, "simpleChoice").size());

        assertEquals("single", ctx.getResponseDeclarations().get(0).getAttribute("cardinality"));
        assertEquals(1, ctx.count(Severity.WARNING));
        assertEquals(0, ctx.count(Severity.ERROR));
        assertEquals("choice-slider replaced with choiceInteraction.slider", ctx.getLog().get(0).message);
    }

    @Test
    void multipleChoiceSliderIsAnErrorButStillMigrates()
    {
        List<Element> out = dispatcher.migrate(choiceSlider(Cardinality.MULTIPLE), body, TargetContext.BLOCK, ctx);

        Element interaction = out.get(0);
        assertEquals("slider", interaction.getAttribute("class"));
        assertEquals("2", interaction.getAttribute("maxChoices"));
        assertEquals("2", interaction.getAttribute("minChoices"));

        assertEquals("multiple", ctx.getResponseDeclarations().get(0).getAttribute("cardinality"));
        assertEquals(1, ctx.count(Severity.ERROR));
        assertEquals("multiple-slider replaced with choiceInteraction.slider", ctx.getLog().get(0).message);
        assertFalse(ctx.hasFailed());
    }

    @Test
    void multiLineBlankInBlockContentBecomesExtendedText()
    {
        Response r = new Response(ResponseKind.STR, "E")
            .intro(ContentNode.material(ContentNode.text("Describe the water cycle.")))
            .withRender(new Render(RenderKind.FIB).withRows(3).withColumns(40).add(ContentNode.responseLabel("L1")));

        List<Element> out = dispatcher.migrate(r, body, TargetContext.BLOCK, ctx);

        assertEquals(1, out.size());
        Element interaction = out.get(0);
        assertEquals("extendedTextInteraction", QtiV2Document.localName(interaction));
        assertSame(body, interaction.getParentNode());
        assertEquals("E", interaction.getAttribute("responseIdentifier"));
        assertEquals("120", interaction.getAttribute("expectedLength"));
        assertEquals("3", interaction.getAttribute("expectedLines"));
        assertTrue(QtiV2Document.descendants(body, "textEntryInteraction").isEmpty());
        assertTrue(ctx.getLog().isEmpty(), ctx.getLog().toString());
    }

    private static Response fib(Cardinality cardinality)
    {
        return new Response(ResponseKind.STR, "F")
            .withCardinality(cardinality)
            .withRender(new Render(RenderKind.FIB).withMaxChars(12).add(
                ContentNode.material(ContentNode.text("Paris is the capital of ")),
                ContentNode.responseLabel("L1"),
                ContentNode.material(ContentNode.text(" and Rome of ")),
                ContentNode.responseLabel("L2"),
                ContentNode.material(ContentNode.text("."))));
    }

    @Test
    void singleCardinalityFillInBlankKeepsOnlyTheLastBlank()
    {
        List<Element> out = dispatcher.migrate(fib(Cardinality.SINGLE), body, TargetContext.BLOCK, ctx);

        assertEquals(1, out.size());
        assertEquals(1, QtiV2Document.descendants(body, "textEntryInteraction").size());
        assertEquals("F", out.get(0).getAttribute("responseIdentifier"));
        assertEquals("12", out.get(0).getAttribute("expectedLength"));
        assertEquals(1, ctx.count(Severity.WARNING));
        assertEquals("string", ctx.getResponseDeclarations().get(0).getAttribute("baseType"));

        // the surrounding text stays in one paragraph with the blank
        List<Element> ps = QtiV2Document.descendants(body, "p");
        assertEquals(1, ps.size());
        assertTrue(ps.get(0).getTextContent().startsWith("Paris is the capital of"));
    }

    @Test
    void multipleCardinalityFillInBlankDeclaresEveryBlank()
    {
        List<Element> out = dispatcher.migrate(fib(Cardinality.MULTIPLE), body, TargetContext.BLOCK, ctx);

        assertEquals(2, out.size());
        assertEquals("F_01", out.get(0).getAttribute("responseIdentifier"));
        assertEquals("F_02", out.get(1).getAttribute("responseIdentifier"));
        assertEquals(2, ctx.getResponseDeclarations().size());
        assertEquals("F", ctx.getOutcomeDeclarations().get(0).getAttribute("identifier"));
    }

    @Test
    void numericSliderCarriesBoundsAndStartValue()
    {
        Response r = new Response(ResponseKind.NUM, "S")
            .withRender(new Render(RenderKind.SLIDER).withBounds(0, 10).withStep(1).withStartVal(5));

        List<Element> out = dispatcher.migrate(r, body, TargetContext.BLOCK, ctx);

        Element slider = out.get(0);
        assertEquals("sliderInteraction", QtiV2Document.localName(slider));
        assertEquals("0.0", slider.getAttribute("lowerBound"));
        assertEquals("10.0", slider.getAttribute("upperBound"));
        assertEquals("1", slider.getAttribute("step"));

        Element decl = ctx.getResponseDeclarations().get(0);
        assertEquals("integer", decl.getAttribute("baseType"));
        assertEquals("5", QtiV2Document.descendants(decl, "value").get(0).getTextContent());
    }

    @Test
    void blockInteractionInInlineContentIsOmitted()
    {
        Element p = ctx.target().add(body, "p");

        List<Element> out = dispatcher.migrate(choice("R"), p, TargetContext.INLINE, ctx);

        assertTrue(out.isEmpty());
        assertFalse(p.hasChildNodes());
        assertEquals(1, ctx.count(Severity.ERROR));
        assertFalse(ctx.hasFailed());
    }

    @Test
    void unsupportedCombinationFailsTheItem()
    {
        Response r = new Response(ResponseKind.LID, "O")
            .withCardinality(Cardinality.ORDERED)
            .withRender(new Render(RenderKind.CHOICE).add(ContentNode.responseLabel("A", ContentNode.data("a"))));

        List<Element> out = dispatcher.migrate(r, body, TargetContext.BLOCK, ctx);

        assertTrue(out.isEmpty());
        assertTrue(ctx.hasFailed());
        assertEquals(Cardinality.ORDERED, ctx.getFailure().cardinality);
        assertFalse(body.hasChildNodes());
    }

    @Test
    void timedResponseMakesTheItemTimeDependent()
    {
        dispatcher.migrate(choice("R").withTiming(true), body, TargetContext.BLOCK, ctx);

        assertTrue(ctx.isTimeDependent());
    }
}
