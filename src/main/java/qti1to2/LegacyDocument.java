package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed questestinterop document: an object bank, an assessment, or a run of sections and
 * items. It also owns the registry that matref and material_ref resolve against.
 */
public final class LegacyDocument
{
    private final String name;
    private String comment;
    private boolean objectBank;
    private LegacyAssessment assessment;
    private final List<SectionEntry> entries = new ArrayList<>();

    private final Map<String, ContentNode> materials = new LinkedHashMap<>();
    private final Map<String, ContentNode> matThings = new LinkedHashMap<>();

    public LegacyDocument(String name)
    {
        this.name = name;
    }

    public String getName()
    {
        return name;
    }

    public String getComment()
    {
        return comment;
    }

    void setComment(String comment)
    {
        this.comment = comment;
    }

    public boolean isObjectBank()
    {
        return objectBank;
    }

    void setObjectBank(boolean objectBank)
    {
        this.objectBank = objectBank;
    }

    public LegacyAssessment getAssessment()
    {
        return assessment;
    }

    public LegacyDocument setAssessment(LegacyAssessment assessment)
    {
        this.assessment = assessment;
        return this;
    }

    public LegacyDocument add(SectionEntry entry)
    {
        entries.add(entry);
        return this;
    }

    /** Top level sections and items (or the object bank's), in document order. */
    public List<SectionEntry> getEntries()
    {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Registers a labelled material. The first registration of a label wins, so later duplicates
     * cannot change what earlier references see.
     */
    public void registerMaterial(String label, ContentNode material)
    {
        if (label != null && material.getKind() == ContentKind.MATERIAL)
        {
            materials.putIfAbsent(label, material);
        }
    }

    /** Registers labelled leaf content (mattext, matimage...). Composites are refused. */
    public void registerMatThing(String label, ContentNode leaf)
    {
        if (label != null && !leaf.isComposite() && leaf.getKind() != ContentKind.REFERENCE)
        {
            matThings.putIfAbsent(label, leaf);
        }
    }

    ContentNode resolve(ReferenceScope scope, String id)
    {
        if (id == null)
        {
            return null;
        }
        if (scope == ReferenceScope.MATERIAL)
        {
            ContentNode m = materials.get(id);
            if (m != null)
            {
                return m;
            }
        }
        return matThings.get(id);
    }
}
