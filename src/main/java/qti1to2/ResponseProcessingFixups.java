package qti1to2;

import java.util.List;
import java.util.Map;

import org.w3c.dom.Element;

/**
 * Writes the responseProcessing that gathers split responses back under their legacy identifier.
 *
 * For every fix-up entry whose base identifier has an outcome declaration, one
 * {@code setOutcomeValue} collects the generated response variables into a multiple (or ordered)
 * container, so scoring written against the legacy identifier still sees a single value.
 */
public final class ResponseProcessingFixups
{
    private ResponseProcessingFixups()
    {
    }

    /**
     * @return the responseProcessing element, or null when no fix-up applies
     */
    public static Element build(MigrationContext ctx)
    {
        Map<String, List<String>> fixups = ctx.getFixups();
        Element rp = null;
        for (Map.Entry<String, List<String>> e : fixups.entrySet())
        {
            Element outcome = outcomeFor(ctx, e.getKey());
            if (outcome == null)
            {
                continue;
            }
            if (rp == null)
            {
                rp = ctx.target().create("responseProcessing");
            }
            Element set = ctx.target().add(rp, "setOutcomeValue");
            set.setAttribute("identifier", e.getKey());
            String container = "ordered".equals(outcome.getAttribute("cardinality")) ? "ordered" : "multiple";
            Element c = ctx.target().add(set, container);
            for (String id : e.getValue())
            {
                ctx.target().add(c, "variable").setAttribute("identifier", id);
            }
        }
        return rp;
    }

    private static Element outcomeFor(MigrationContext ctx, String identifier)
    {
        for (Element d : ctx.getOutcomeDeclarations())
        {
            if (identifier.equals(d.getAttribute("identifier")))
            {
                return d;
            }
        }
        return null;
    }
}
