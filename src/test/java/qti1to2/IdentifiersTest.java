package qti1to2;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class IdentifiersTest
{
    @Test
    void validNamesAreUnchanged()
    {
        assertEquals("Q1", Identifiers.toNcName("Q1"));
        assertEquals("item-1.a_b", Identifiers.toNcName("item-1.a_b"));
        assertTrue(Identifiers.isNcName("ChoiceA"));
    }

    @Test
    void illegalCharactersAreRepaired()
    {
        assertEquals("_1", Identifiers.toNcName("1"));
        assertEquals("a_b", Identifiers.toNcName("a b"));
        assertEquals("ns-local", Identifiers.toNcName("ns:local"));
        assertEquals("_-x", Identifiers.toNcName(":x"));
        assertEquals("FEEDBACK_3", Identifiers.toNcName("3", "FEEDBACK_"));
        assertFalse(Identifiers.isNcName("1abc"));
        assertFalse(Identifiers.isNcName("a:b"));
    }

    @Test
    void emptyValueYieldsThePrefix()
    {
        assertEquals("_", Identifiers.toNcName(""));
        assertEquals("_", Identifiers.toNcName(null));
        assertFalse(Identifiers.isNcName(""));
    }
}
