package qti1to2;

/**
 * The legacy content elements that can appear in a presentation, a material or a response label.
 */
public enum ContentKind
{
    /** mattext or matemtext */
    TEXT,
    IMAGE,
    AUDIO,
    VIDEO,
    APPLET,
    APPLICATION,
    /** matbreak */
    BREAK,
    /** mat_extension */
    EXTENSION,
    /** matref or material_ref, see {@link ReferenceScope} */
    REFERENCE,
    MATERIAL,
    FLOW_MAT,
    FLOW,
    /** response_lid, response_xy, response_str, response_num or response_grp */
    RESPONSE,
    RESPONSE_LABEL,
    FLOW_LABEL,
    /** character data inside a response_label */
    DATA
}
