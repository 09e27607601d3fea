package qti1to2;

import java.util.Objects;

/**
 * A response and render pairing (or cardinality) that has no QTI 2.1 interaction. It fails the
 * item it occurs in and nothing else.
 */
public final class UnsupportedCombination
{
    public final ResponseKind responseKind;
    public final RenderKind renderKind;
    public final Cardinality cardinality;
    public final String reason;

    public UnsupportedCombination(ResponseKind responseKind, RenderKind renderKind, Cardinality cardinality,
        String reason)
    {
        this.responseKind = responseKind;
        this.renderKind = renderKind;
        this.cardinality = cardinality;
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    @Override
    public String toString()
    {
        return "unsupported combination " + responseKind + " x " + renderKind + " (" + cardinality + "): " + reason;
    }
}
