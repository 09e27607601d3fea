package qti1to2;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.w3c.dom.Element;

/**
 * Per-item migration state. It is created for one legacy item, filled during the walk of that
 * item and discarded afterwards; nothing in it is shared between items.
 */
public final class MigrationContext implements IssueSink
{
    private final QtiV2Document target;
    private final List<MigrationIssue> log = new ArrayList<>();
    private final Set<String> identifiers = new HashSet<>();
    private final Map<String, List<Element>> declarationsByResponse = new LinkedHashMap<>();
    private final List<Element> responseDeclarations = new ArrayList<>();
    private final List<Element> outcomeDeclarations = new ArrayList<>();
    private final Map<String, List<String>> fixups = new LinkedHashMap<>();
    private final Deque<String> path = new ArrayDeque<>();
    private final Deque<List<Element>> fibSinks = new ArrayDeque<>();
    private UnsupportedCombination failure;
    private boolean timeDependent;
    private List<ContentNode> stageImages = Collections.emptyList();

    public MigrationContext(QtiV2Document target, String itemIdent)
    {
        this.target = Objects.requireNonNull(target, "target");
        this.path.push("/item[" + itemIdent + "]");
    }

    public QtiV2Document target()
    {
        return target;
    }

    // ---------------- log ----------------

    @Override
    public void add(Severity severity, String message)
    {
        log.add(new MigrationIssue(severity, currentPath(), message));
    }

    public List<MigrationIssue> getLog()
    {
        return Collections.unmodifiableList(log);
    }

    public int count(Severity severity)
    {
        int c = 0;
        for (MigrationIssue i : log)
        {
            if (i.severity == severity)
            {
                c++;
            }
        }
        return c;
    }

    /** Descends into a legacy element; diagnostics made until {@link #leave()} carry its path. */
    public void enter(String segment)
    {
        path.push(path.peek() + "/" + segment);
    }

    public void leave()
    {
        if (path.size() > 1)
        {
            path.pop();
        }
    }

    public String currentPath()
    {
        return path.peek();
    }

    // ---------------- identifiers ----------------

    public boolean isDeclared(String identifier)
    {
        return identifiers.contains(identifier);
    }

    /**
     * Reserves an identifier.
     *
     * @return false if it was already taken
     */
    public boolean declare(String identifier)
    {
        return identifiers.add(identifier);
    }

    /**
     * Reserves the first free {@code <base>_<NN>} identifier, counting from 01, and returns it.
     */
    public String allocateSuffixed(String base)
    {
        int i = 1;
        String candidate = String.format("%s_%02d", base, i);
        while (!declare(candidate))
        {
            i++;
            candidate = String.format("%s_%02d", base, i);
        }
        return candidate;
    }

    // ---------------- presentation images ----------------

    /** The images of the presentation being migrated, candidates for hotspot backgrounds. */
    public void setStageImages(List<ContentNode> images)
    {
        stageImages = Collections.unmodifiableList(new ArrayList<>(images));
    }

    public List<ContentNode> getStageImages()
    {
        return stageImages;
    }

    // ---------------- declarations ----------------

    public void addResponseDeclaration(String legacyResponseId, Element declaration)
    {
        responseDeclarations.add(declaration);
        declarationsByResponse.computeIfAbsent(legacyResponseId, k -> new ArrayList<>()).add(declaration);
    }

    public void addOutcomeDeclaration(String legacyResponseId, Element declaration)
    {
        outcomeDeclarations.add(declaration);
        if (legacyResponseId != null)
        {
            declarationsByResponse.computeIfAbsent(legacyResponseId, k -> new ArrayList<>()).add(declaration);
        }
    }

    public List<Element> getResponseDeclarations()
    {
        return Collections.unmodifiableList(responseDeclarations);
    }

    public List<Element> getOutcomeDeclarations()
    {
        return Collections.unmodifiableList(outcomeDeclarations);
    }

    /** The declarations generated for a legacy response identifier, in creation order. */
    public List<Element> declarationsFor(String legacyResponseId)
    {
        List<Element> d = declarationsByResponse.get(legacyResponseId);
        return d == null ? Collections.<Element>emptyList() : Collections.unmodifiableList(d);
    }

    public void addFixup(String baseIdentifier, List<String> generated)
    {
        fixups.put(baseIdentifier, Collections.unmodifiableList(new ArrayList<>(generated)));
    }

    /** Base identifier to the ordered identifiers it was split into. */
    public Map<String, List<String>> getFixups()
    {
        return Collections.unmodifiableMap(fixups);
    }

    // ---------------- fill-in-blank collection ----------------

    void beginFib()
    {
        fibSinks.push(new ArrayList<>());
    }

    /** Records an interaction created for a fill-in-blank label, if one is being collected. */
    void fibInteraction(Element interaction)
    {
        List<Element> sink = fibSinks.peek();
        if (sink != null)
        {
            sink.add(interaction);
        }
    }

    List<Element> endFib()
    {
        return fibSinks.isEmpty() ? new ArrayList<>() : fibSinks.pop();
    }

    // ---------------- item state ----------------

    public void markTimeDependent()
    {
        timeDependent = true;
    }

    public boolean isTimeDependent()
    {
        return timeDependent;
    }

    /** Records the item-fatal condition; only the first one is kept. */
    public void fail(UnsupportedCombination condition)
    {
        if (failure == null)
        {
            failure = Objects.requireNonNull(condition, "condition");
            error(condition.toString());
        }
    }

    public boolean hasFailed()
    {
        return failure != null;
    }

    public UnsupportedCombination getFailure()
    {
        return failure;
    }
}
