package qti1to2;

/** Something a section (or a document) contains, in document order: a section or an item. */
public interface SectionEntry
{
    String getIdent();
}
