package qti1to2;

import java.util.Locale;

/**
 * The closed mapping from a legacy (response, render, cardinality) triple to the QTI 2.1
 * interaction that replaces it. Anything the table does not cover comes back as an
 * {@link UnsupportedCombination}.
 */
public final class InteractionTable
{
    private InteractionTable()
    {
    }

    public enum Variant
    {
        /** choiceInteraction */
        CHOICE,
        /** one or more hotspotInteraction */
        HOTSPOT,
        /** selectPointInteraction */
        SELECT_POINT,
        /** choiceInteraction with class="slider" */
        CHOICE_SLIDER,
        /** sliderInteraction */
        SLIDER,
        /** textEntryInteraction or extendedTextInteraction, one per blank */
        TEXT_ENTRY
    }

    public static final class Selection
    {
        public final Variant variant;
        public final UnsupportedCombination unsupported;

        private Selection(Variant variant, UnsupportedCombination unsupported)
        {
            this.variant = variant;
            this.unsupported = unsupported;
        }

        public boolean isSupported()
        {
            return variant != null;
        }
    }

    public static Selection select(ResponseKind response, RenderKind render, Cardinality cardinality)
    {
        if (response == ResponseKind.GRP)
        {
            return unsupported(response, render, cardinality, "response_grp has no QTI 2.1 interaction");
        }
        if (render == null)
        {
            return unsupported(response, null, cardinality, "response has no render");
        }
        boolean ordered = cardinality == Cardinality.ORDERED;

        switch (render)
        {
            case CHOICE:
                if (response == ResponseKind.LID)
                {
                    return ordered
                        ? unsupported(response, render, cardinality, "orderInteraction")
                        : supported(Variant.CHOICE);
                }
                break;

            case HOTSPOT:
                if (response == ResponseKind.LID)
                {
                    return ordered
                        ? unsupported(response, render, cardinality, "graphicOrderInteraction")
                        : supported(Variant.HOTSPOT);
                }
                if (response == ResponseKind.XY)
                {
                    return ordered
                        ? unsupported(response, render, cardinality, "ordered response_xy x render_hotspot")
                        : supported(Variant.SELECT_POINT);
                }
                break;

            case SLIDER:
                if (response == ResponseKind.LID)
                {
                    return ordered
                        ? unsupported(response, render, cardinality, "ordered slider needs orderInteraction")
                        : supported(Variant.CHOICE_SLIDER);
                }
                if (response == ResponseKind.NUM)
                {
                    return cardinality == Cardinality.SINGLE
                        ? supported(Variant.SLIDER)
                        : unsupported(response, render, cardinality, "multiple or ordered sliderInteraction");
                }
                break;

            case FIB:
                if (response == ResponseKind.LID || response == ResponseKind.STR || response == ResponseKind.NUM)
                {
                    return supported(Variant.TEXT_ENTRY);
                }
                break;

            default:
                break;
        }
        return unsupported(response, render, cardinality,
            "response_" + response.name().toLowerCase(Locale.ROOT) + " x render_"
                + render.name().toLowerCase(Locale.ROOT));
    }

    /**
     * The base type of the variables declared for a response. It depends on the response kind and,
     * for numeric responses, on the numeric type, never on the content.
     */
    public static String baseType(ResponseKind response, NumType numType)
    {
        switch (response)
        {
            case LID:
                return "identifier";
            case XY:
                return "point";
            case STR:
                return "string";
            case NUM:
                return numType == NumType.INTEGER ? "integer" : "float";
            default:
                throw new IllegalArgumentException("No base type for " + response);
        }
    }

    private static Selection supported(Variant variant)
    {
        return new Selection(variant, null);
    }

    private static Selection unsupported(ResponseKind response, RenderKind render, Cardinality cardinality,
        String reason)
    {
        return new Selection(null, new UnsupportedCombination(response, render, cardinality, reason));
    }
}
