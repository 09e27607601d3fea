package qti1to2;

public enum ResponseKind
{
    /** response_lid */
    LID,
    /** response_xy */
    XY,
    /** response_str */
    STR,
    /** response_num */
    NUM,
    /** response_grp */
    GRP
}
