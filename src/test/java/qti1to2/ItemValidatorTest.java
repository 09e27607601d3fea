package qti1to2;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

class ItemValidatorTest
{
    private final ItemValidator validator = new ItemValidator(ContentModel.loadDefault());

    private static QtiV2Document itemWithChoice(String responseIdentifier, boolean declare)
    {
        QtiV2Document doc = QtiV2Document.newItem();
        Element root = doc.root();
        root.setAttribute("identifier", "I");
        if (declare)
        {
            Element d = doc.add(root, "responseDeclaration");
            d.setAttribute("identifier", "R");
        }
        Element body = doc.add(root, "itemBody");
        Element choice = doc.add(body, "choiceInteraction");
        choice.setAttribute("responseIdentifier", responseIdentifier);
        doc.addText(doc.add(choice, "simpleChoice"), "Yes");
        return doc;
    }

    @Test
    void wellFormedItemIsClean()
    {
        ItemValidator.ValidationResult vr = validator.validate(itemWithChoice("R", true).dom(), true);

        assertTrue(vr.isClean(), vr.getIssues().toString());
    }

    @Test
    void undeclaredResponseIsAnError()
    {
        ItemValidator.ValidationResult vr = validator.validate(itemWithChoice("R", false).dom(), false);

        assertEquals(1, vr.countErrors());
        assertTrue(vr.getIssues().get(0).message.contains("'R'"));
    }

    @Test
    void contentModelViolationsAreWarningsUnlessStrict()
    {
        QtiV2Document doc = itemWithChoice("R", true);
        Element body = QtiV2Document.firstChildElement(doc.root(), "itemBody");
        body.setAttribute("bogus", "1");
        doc.addText(body, "stray text");
        doc.add(QtiV2Document.firstChildElement(body, "choiceInteraction"), "p");

        ItemValidator.ValidationResult lenient = validator.validate(doc.dom(), false);
        assertEquals(3, lenient.countWarnings());
        assertEquals(0, lenient.countErrors());

        ItemValidator.ValidationResult strict = validator.validate(doc.dom(), true);
        assertEquals(3, strict.countErrors());
    }

    @Test
    void unknownElementsAndForeignRootsAreErrors()
    {
        QtiV2Document doc = itemWithChoice("R", true);
        doc.add(QtiV2Document.firstChildElement(doc.root(), "itemBody"), "marquee");

        ItemValidator.ValidationResult vr = validator.validate(doc.dom(), false);
        assertEquals(1, vr.countErrors());
        // the unexpected child is reported against itemBody too
        assertEquals(1, vr.countWarnings());

        Document foreign = QtiV2Document.newDocument();
        foreign.appendChild(foreign.createElementNS("urn:other", "assessmentItem"));
        assertEquals(1, validator.validate(foreign, false).countErrors());
    }
}
