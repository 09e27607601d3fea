package qti1to2;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContentModelTest
{
    private static ContentModel parse(String json)
    {
        return ContentModel.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "test");
    }

    @Test
    void bundledModelKnowsTheQtiVocabulary()
    {
        ContentModel model = ContentModel.loadDefault();

        assertEquals(QtiV2Document.QTI_NS, model.getNamespace());
        assertTrue(model.isInline("textEntryInteraction"));
        assertFalse(model.isInline("choiceInteraction"));
        assertFalse(model.isInline("marquee"));
        assertTrue(model.getTagSpec("choiceInteraction").attributes.contains("responseIdentifier"));
        assertTrue(model.getTagSpec("p").children.contains("em"));
    }

    @Test
    void groupsExpandRecursively()
    {
        ContentModel model = parse("{\"groups\": {\"a\": [\"x\", \"@b\"], \"b\": [\"y\"]},"
            + " \"tags\": {\"t\": {\"inline\": true, \"attributes\": [\"@a\"], \"children\": []}}}");

        assertTrue(model.isInline("t"));
        assertEquals(2, model.getTagSpec("t").attributes.size());
        assertTrue(model.getTagSpec("t").attributes.contains("y"));
    }

    @Test
    void brokenModelsAreRejected()
    {
        assertThrows(MigrationException.class, () -> parse("[]"));
        assertThrows(MigrationException.class, () -> parse("{\"tags\": {\"t\": {\"children\": [\"@missing\"]}}}"));
        assertThrows(MigrationException.class,
            () -> parse("{\"groups\": {\"a\": [\"@b\"], \"b\": [\"@a\"]}, \"tags\": {\"t\": {\"children\": [\"@a\"]}}}"));
    }

    @Test
    void explicitDirectoryIsSearchedForTheModelFile(@TempDir Path dir) throws IOException
    {
        Files.write(dir.resolve(ContentModel.RESOURCE),
            "{\"namespace\": \"urn:test\", \"tags\": {}}".getBytes(StandardCharsets.UTF_8));

        ContentModel model = ContentModel.locate(dir);

        assertEquals("urn:test", model.getNamespace());
        assertTrue(model.getSourceDescription().endsWith(ContentModel.RESOURCE));
        assertThrows(MigrationException.class, () -> ContentModel.locate(dir.resolve("absent.json")));
    }
}
