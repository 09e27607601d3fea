package qti1to2;

/**
 * Which part of the document registry a reference is resolved against.
 *
 * A matref only ever names labelled leaf content (mattext, matimage...). A material_ref names a
 * labelled material, or a leaf when no material carries the label. Leaves have no children and
 * materials can only hold leaves and matrefs, so a resolution chain never revisits a node.
 */
public enum ReferenceScope
{
    MAT_THING,
    MATERIAL
}
