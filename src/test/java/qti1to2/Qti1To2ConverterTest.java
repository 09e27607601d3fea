package qti1to2;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class Qti1To2ConverterTest
{
    @TempDir
    Path tmp;

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();
    private final Log log = new Log(new PrintStream(console, true, StandardCharsets.UTF_8),
        new PrintStream(console, true, StandardCharsets.UTF_8), null, false);

    private void copyResource(String name, Path target) throws IOException
    {
        Files.createDirectories(target.getParent());
        try (InputStream in = getClass().getResourceAsStream("/items/" + name))
        {
            Files.copy(in, target);
        }
    }

    private String console()
    {
        return new String(console.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void parsesOptions()
    {
        Qti1To2Converter.Options o = Qti1To2Converter.parseArgs(new String[] {
            "in", "out", "--strict", "--pretty", "--report", "r.json", "-v"});

        assertTrue(o.validate);
        assertTrue(o.strict);
        assertTrue(o.pretty);
        assertTrue(o.debug);
        assertEquals("r.json", o.reportPath.toString());
        assertNull(o.logPath);

        assertThrows(IllegalArgumentException.class, () -> Qti1To2Converter.parseArgs(new String[] {"in"}));
        assertThrows(IllegalArgumentException.class, () -> Qti1To2Converter.parseArgs(new String[] {"in", "out", "--nope"}));
        assertThrows(IllegalArgumentException.class, () -> Qti1To2Converter.parseArgs(new String[] {"in", "out", "--log"}));
    }

    @Test
    void convertsATreeAndReportsFailures() throws IOException
    {
        Path in = tmp.resolve("in");
        Path out = tmp.resolve("out");
        copyResource("colours.xml", in.resolve("colours.xml"));
        copyResource("geography.xml", in.resolve("banks/geography.xml"));
        Files.write(in.resolve("banks/map.png"), new byte[] {1, 2, 3});
        Files.write(in.resolve("broken.xml"), "<questestinterop><item>".getBytes(StandardCharsets.UTF_8));

        Qti1To2Converter.Options o = Qti1To2Converter.parseArgs(new String[] {
            in.toString(), out.toString(), "--validate", "--report", tmp.resolve("report.json").toString()});
        int status = Qti1To2Converter.run(o, log);

        assertEquals(1, status, console());
        assertTrue(Files.isRegularFile(out.resolve("colours/CHOICE1.xml")));
        assertTrue(Files.isRegularFile(out.resolve("colours/CHOICE1_md.xml")));
        assertTrue(Files.isRegularFile(out.resolve("banks/geography/MAP1.xml")));
        assertTrue(Files.isRegularFile(out.resolve("banks/geography/_2_FIB.xml")));
        assertFalse(Files.exists(out.resolve("banks/geography/ORDER1.xml")));
        assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(out.resolve("banks/map.png")));

        String item = new String(Files.readAllBytes(out.resolve("colours/CHOICE1.xml")), StandardCharsets.UTF_8);
        assertTrue(item.contains("http://www.imsglobal.org/xsd/imsqti_v2p1"));
        assertTrue(item.contains("choiceInteraction"));

        JsonNode report = new ObjectMapper().readTree(tmp.resolve("report.json").toFile());
        JsonNode totals = report.get("totals");
        assertEquals(3, totals.get("files").asInt());
        assertEquals(1, totals.get("failedFiles").asInt());
        assertEquals(3, totals.get("convertedItems").asInt());
        assertEquals(1, totals.get("failedItems").asInt());
        assertEquals(0, totals.get("validationIssues").asInt());
        assertEquals("banks/geography.xml", report.get("files").get(0).get("path").asText());
        assertEquals("FAILED", report.get("files").get(0).get("items").get(1).get("status").asText());
        assertTrue(report.get("files").get(1).has("error"));

        assertTrue(console().contains("ORDER1 not converted"));
    }

    @Test
    void cleanRunExitsZeroAndSkipsItsOwnOutput() throws IOException
    {
        Path in = tmp.resolve("in");
        Path out = in.resolve("converted");
        copyResource("colours.xml", in.resolve("colours.xml"));

        Qti1To2Converter.Options o = Qti1To2Converter.parseArgs(new String[] {in.toString(), out.toString(), "--strict"});
        assertEquals(0, Qti1To2Converter.run(o, log), console());

        // a second run must not pick up the first run's output
        assertEquals(0, Qti1To2Converter.run(o, log), console());
        assertFalse(Files.exists(out.resolve("converted")));
        assertTrue(console().contains("Found 1 .xml files"));
    }

    @Test
    void singleFileInput() throws IOException
    {
        Path file = tmp.resolve("colours.xml");
        copyResource("colours.xml", file);

        Qti1To2Converter.Options o = Qti1To2Converter.parseArgs(new String[] {file.toString(), tmp.resolve("o").toString()});

        assertEquals(0, Qti1To2Converter.run(o, log));
        assertTrue(Files.isRegularFile(tmp.resolve("o/colours/CHOICE1.xml")));
    }

    @Test
    void missingInputCannotStart()
    {
        Qti1To2Converter.Options o = Qti1To2Converter.parseArgs(new String[] {
            tmp.resolve("absent").toString(), tmp.resolve("o").toString()});

        assertDoesNotThrow(() -> assertEquals(2, Qti1To2Converter.run(o, log)));
        assertTrue(console().contains("Input not found"));
    }

    @Test
    void repeatedIdentifiersGetNumberedFileNames()
    {
        Set<String> used = new HashSet<>();
        assertEquals("Q", Qti1To2Converter.uniqueName("Q", used));
        assertEquals("Q-2", Qti1To2Converter.uniqueName("Q", used));
        assertEquals("Q-3", Qti1To2Converter.uniqueName("Q", used));
        assertEquals("bank.v1", Qti1To2Converter.stem("bank.v1.xml"));
        assertEquals(".hidden", Qti1To2Converter.stem(".hidden"));
    }
}
