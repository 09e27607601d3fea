package qti1to2;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class LegacyDocumentReaderTest
{
    private final LegacyDocumentReader reader = new LegacyDocumentReader(Log.quiet());

    static LegacyDocument readResource(String name)
    {
        try (InputStream in = LegacyDocumentReaderTest.class.getResourceAsStream("/items/" + name))
        {
            assertNotNull(in, "missing test resource " + name);
            return new LegacyDocumentReader(Log.quiet()).read(in, name);
        }
        catch (IOException ex)
        {
            throw new AssertionError(ex);
        }
    }

    private LegacyDocument read(String xml)
    {
        return reader.read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "inline.xml");
    }

    @Test
    void readsItemHeaderMetadataAndResponseProcessing()
    {
        LegacyDocument doc = readResource("colours.xml");

        assertEquals("Art department bank", doc.getComment());
        assertEquals(1, doc.getEntries().size());
        LegacyItem item = (LegacyItem) doc.getEntries().get(0);
        assertEquals("CHOICE1", item.getIdent());
        assertEquals("Colours", item.getTitle());
        assertEquals("en", item.getLang());
        assertEquals("3", item.getMaxAttempts());
        assertEquals("A simple multiple choice question", item.getComment());

        assertEquals("2", item.firstMetadata("maximumscore"));
        assertEquals("colour, primary", item.firstMetadata("keywords"));
        assertEquals("Art", item.firstMetadata("topic"));

        assertEquals(1, item.getObjectives().size());
        assertEquals(View.ALL, item.getObjectives().get(0).view);
        assertEquals(View.CANDIDATE, item.getRubrics().get(0).view);

        assertEquals(1, item.getResProcessingCount());
        assertEquals(1, item.getConditionCount());
        LegacyItem.DecVar score = item.getOutcomes().get(0);
        assertEquals("SCORE", score.varName);
        assertEquals("2", score.maxValue);
        assertNull(score.cutValue);

        LegacyItem.Feedback fb = item.getFeedback().get(0);
        assertEquals("right", fb.ident);
        assertEquals(View.CANDIDATE, fb.view);
    }

    @Test
    void readsResponsesAndLabels()
    {
        LegacyItem item = (LegacyItem) readResource("colours.xml").getEntries().get(0);

        List<ContentNode> pres = item.getPresentation().getChildren();
        assertEquals(2, pres.size());
        assertEquals("stem", pres.get(0).getLabel());

        Response r = pres.get(1).getResponse();
        assertEquals(ResponseKind.LID, r.getKind());
        assertEquals("RESPONSE", r.getIdent());
        assertEquals(Cardinality.SINGLE, r.getCardinality());
        assertEquals(RenderKind.CHOICE, r.getRender().getKind());
        assertTrue(r.getRender().isShuffle());

        List<ContentNode> labels = r.getRender().getLabels();
        assertEquals(3, labels.size());
        assertTrue(labels.get(0).isShuffle());
        assertFalse(labels.get(1).isShuffle());
        ContentNode orange = labels.get(2).getChildren().get(0).getChildren().get(0);
        assertEquals(TextType.HTML, orange.getTextType());
        assertNotNull(orange.getHtml());
    }

    @Test
    void readsAssessmentSectionsDepthFirst()
    {
        LegacyDocument doc = readResource("geography.xml");

        LegacyAssessment a = doc.getAssessment();
        assertEquals("A1", a.getIdent());
        assertEquals(2, a.getSections().size());
        LegacySection maps = a.getSections().get(0);
        assertEquals(Arrays.asList("ELSEWHERE"), maps.getReferences());
        assertEquals("MAP1", maps.getEntries().get(0).getIdent());
        assertEquals("S1a", maps.getEntries().get(1).getIdent());

        LegacyItem map = (LegacyItem) maps.getEntries().get(0);
        ContentNode image = map.getPresentation().getChildren().get(1).getChildren().get(0);
        assertEquals(ContentKind.IMAGE, image.getKind());
        assertEquals("image/png", image.getMimeType());
        assertEquals(Integer.valueOf(200), image.getPosition().width);

        ContentNode paris = map.getPresentation().getChildren().get(2).getResponse().getRender().getLabels().get(0);
        assertEquals(AreaShape.RECTANGLE, paris.getArea());
        assertEquals("50,40,10,10", HotspotResolver.parseLabel(paris).coords);
    }

    @Test
    void materialsAfterTheRenderAreTheOutro()
    {
        LegacyDocument doc = read(
            "<questestinterop><item ident=\"I\"><presentation>"
                + "<response_num ident=\"N\" numtype=\"Decimal\" rtiming=\"Yes\">"
                + "<material><mattext>Before</mattext></material>"
                + "<render_slider lowerbound=\"1.5\" upperbound=\"x\"/>"
                + "<material><mattext>After</mattext></material>"
                + "</response_num></presentation></item></questestinterop>");

        Response r = ((LegacyItem) doc.getEntries().get(0)).getPresentation().getChildren().get(0).getResponse();
        assertEquals(NumType.DECIMAL, r.getNumType());
        assertTrue(r.isTiming());
        assertEquals("Before", r.getIntro().get(0).extractText());
        assertEquals("After", r.getOutro().get(0).extractText());
        assertEquals(Integer.valueOf(1), r.getRender().getLowerBound());
        assertNull(r.getRender().getUpperBound());
    }

    @Test
    void labelledMaterialsResolveThroughReferences()
    {
        LegacyDocument doc = read(
            "<questestinterop><item ident=\"I\"><presentation>"
                + "<material label=\"shared\"><mattext label=\"t\">Hello</mattext></material>"
                + "<material_ref linkrefid=\"shared\"/>"
                + "<material><matref linkrefid=\"t\"/></material>"
                + "</presentation></item></questestinterop>");

        List<ContentNode> pres = ((LegacyItem) doc.getEntries().get(0)).getPresentation().getChildren();
        assertSame(pres.get(0), pres.get(1).resolve());
        assertEquals("Hello", pres.get(2).extractText());
    }

    @Test
    void metadataFieldLabelsAreFolded()
    {
        assertEquals("maximumscore", LegacyDocumentReader.fieldLabel("qmd_Marks"));
        assertEquals("title", LegacyDocumentReader.fieldLabel(" name "));
        assertEquals("itemtype", LegacyDocumentReader.fieldLabel("Question Type"));
        assertEquals("difficulty", LegacyDocumentReader.fieldLabel("qmd_difficulty"));
    }

    @Test
    void wrongRootAndMalformedXmlAreRejected()
    {
        MigrationException wrongRoot = assertThrows(MigrationException.class, () -> read("<assessmentItem/>"));
        assertTrue(wrongRoot.getMessage().contains("questestinterop"));

        assertThrows(MigrationException.class, () -> read("<questestinterop><item>"));
    }
}
