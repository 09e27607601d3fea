package qti1to2;

/** What the target parent of a normalized run accepts. */
public enum TargetContext
{
    /** inline content only, e.g. a p, span or prompt */
    INLINE,
    /** block content only, e.g. itemBody or rubricBlock */
    BLOCK,
    /** either, e.g. div, simpleChoice or modalFeedback */
    FLOW
}
