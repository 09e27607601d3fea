package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class LegacyAssessment
{
    private final String ident;
    private final String title;
    private final List<LegacySection> sections = new ArrayList<>();

    public LegacyAssessment(String ident, String title)
    {
        this.ident = ident;
        this.title = title;
    }

    public LegacyAssessment add(LegacySection section)
    {
        sections.add(section);
        return this;
    }

    public String getIdent()
    {
        return ident;
    }

    public String getTitle()
    {
        return title;
    }

    public List<LegacySection> getSections()
    {
        return Collections.unmodifiableList(sections);
    }
}
