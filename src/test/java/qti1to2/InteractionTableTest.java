package qti1to2;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class InteractionTableTest
{
    @Test
    void supportedCombinations()
    {
        assertEquals(InteractionTable.Variant.CHOICE,
            InteractionTable.select(ResponseKind.LID, RenderKind.CHOICE, Cardinality.MULTIPLE).variant);
        assertEquals(InteractionTable.Variant.HOTSPOT,
            InteractionTable.select(ResponseKind.LID, RenderKind.HOTSPOT, Cardinality.SINGLE).variant);
        assertEquals(InteractionTable.Variant.SELECT_POINT,
            InteractionTable.select(ResponseKind.XY, RenderKind.HOTSPOT, Cardinality.MULTIPLE).variant);
        assertEquals(InteractionTable.Variant.CHOICE_SLIDER,
            InteractionTable.select(ResponseKind.LID, RenderKind.SLIDER, Cardinality.SINGLE).variant);
        assertEquals(InteractionTable.Variant.SLIDER,
            InteractionTable.select(ResponseKind.NUM, RenderKind.SLIDER, Cardinality.SINGLE).variant);
        for (ResponseKind kind : new ResponseKind[] {ResponseKind.LID, ResponseKind.STR, ResponseKind.NUM})
        {
            assertEquals(InteractionTable.Variant.TEXT_ENTRY,
                InteractionTable.select(kind, RenderKind.FIB, Cardinality.ORDERED).variant);
        }
    }

    @Test
    void everythingElseIsUnsupported()
    {
        InteractionTable.Selection ordered = InteractionTable.select(ResponseKind.LID, RenderKind.CHOICE, Cardinality.ORDERED);
        assertFalse(ordered.isSupported());
        assertEquals(RenderKind.CHOICE, ordered.unsupported.renderKind);

        assertFalse(InteractionTable.select(ResponseKind.NUM, RenderKind.SLIDER, Cardinality.MULTIPLE).isSupported());
        assertFalse(InteractionTable.select(ResponseKind.STR, RenderKind.CHOICE, Cardinality.SINGLE).isSupported());
        assertFalse(InteractionTable.select(ResponseKind.XY, RenderKind.HOTSPOT, Cardinality.ORDERED).isSupported());
        assertFalse(InteractionTable.select(ResponseKind.LID, RenderKind.EXTENSION, Cardinality.SINGLE).isSupported());
        assertFalse(InteractionTable.select(ResponseKind.GRP, RenderKind.CHOICE, Cardinality.SINGLE).isSupported());

        InteractionTable.Selection noRender = InteractionTable.select(ResponseKind.LID, null, Cardinality.SINGLE);
        assertFalse(noRender.isSupported());
        assertNull(noRender.unsupported.renderKind);
    }

    @Test
    void baseTypeFollowsResponseKindAndNumericType()
    {
        assertEquals("identifier", InteractionTable.baseType(ResponseKind.LID, NumType.INTEGER));
        assertEquals("point", InteractionTable.baseType(ResponseKind.XY, NumType.INTEGER));
        assertEquals("string", InteractionTable.baseType(ResponseKind.STR, NumType.DECIMAL));
        assertEquals("integer", InteractionTable.baseType(ResponseKind.NUM, NumType.INTEGER));
        assertEquals("float", InteractionTable.baseType(ResponseKind.NUM, NumType.DECIMAL));
        assertEquals("float", InteractionTable.baseType(ResponseKind.NUM, NumType.SCIENTIFIC));
        assertThrows(IllegalArgumentException.class, () -> InteractionTable.baseType(ResponseKind.GRP, NumType.INTEGER));
    }
}
