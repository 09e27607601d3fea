package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A legacy section. Nested sections and items are kept in document order; sectionref and itemref
 * entries are recorded but have no QTI 2.1 item counterpart.
 */
public final class LegacySection implements SectionEntry
{
    private final String ident;
    private final String title;
    private final List<SectionEntry> entries = new ArrayList<>();
    private final List<String> references = new ArrayList<>();

    public LegacySection(String ident, String title)
    {
        this.ident = ident;
        this.title = title;
    }

    public LegacySection add(SectionEntry entry)
    {
        entries.add(entry);
        return this;
    }

    void addReference(String ref)
    {
        references.add(ref);
    }

    @Override
    public String getIdent()
    {
        return ident;
    }

    public String getTitle()
    {
        return title;
    }

    public List<SectionEntry> getEntries()
    {
        return Collections.unmodifiableList(entries);
    }

    public List<String> getReferences()
    {
        return Collections.unmodifiableList(references);
    }
}
