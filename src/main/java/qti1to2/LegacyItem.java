package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A legacy item with everything the migration reads from it.
 */
public final class LegacyItem implements SectionEntry
{
    private final String ident;
    private String title;
    private String label;
    private String lang;
    private String maxAttempts;
    private String comment;
    private String duration;
    private boolean itemControl;
    private final Map<String, List<String>> metadata = new LinkedHashMap<>();
    private final List<ViewContent> objectives = new ArrayList<>();
    private final List<ViewContent> rubrics = new ArrayList<>();
    private Presentation presentation;
    private int resProcessingCount;
    private int conditionCount;
    private final List<DecVar> outcomes = new ArrayList<>();
    private final List<Feedback> feedback = new ArrayList<>();

    public LegacyItem(String ident)
    {
        this.ident = ident == null ? "" : ident;
    }

    @Override
    public String getIdent()
    {
        return ident;
    }

    public String getTitle()
    {
        return title;
    }

    public LegacyItem withTitle(String title)
    {
        this.title = ContentNode.blankToNull(title);
        return this;
    }

    public String getLabel()
    {
        return label;
    }

    public LegacyItem withLabel(String label)
    {
        this.label = ContentNode.blankToNull(label);
        return this;
    }

    public String getLang()
    {
        return lang;
    }

    public LegacyItem withLang(String lang)
    {
        this.lang = ContentNode.blankToNull(lang);
        return this;
    }

    public String getMaxAttempts()
    {
        return maxAttempts;
    }

    public LegacyItem withMaxAttempts(String maxAttempts)
    {
        this.maxAttempts = ContentNode.blankToNull(maxAttempts);
        return this;
    }

    public String getComment()
    {
        return comment;
    }

    public LegacyItem withComment(String comment)
    {
        this.comment = ContentNode.blankToNull(comment);
        return this;
    }

    public String getDuration()
    {
        return duration;
    }

    public LegacyItem withDuration(String duration)
    {
        this.duration = ContentNode.blankToNull(duration);
        return this;
    }

    public boolean hasItemControl()
    {
        return itemControl;
    }

    public LegacyItem withItemControl(boolean itemControl)
    {
        this.itemControl = itemControl;
        return this;
    }

    /** qtimetadata fields keyed by lower-cased fieldlabel, values in document order. */
    public Map<String, List<String>> getMetadata()
    {
        return Collections.unmodifiableMap(metadata);
    }

    public LegacyItem addMetadata(String fieldLabel, String entry)
    {
        metadata.computeIfAbsent(fieldLabel, k -> new ArrayList<>()).add(entry);
        return this;
    }

    public String firstMetadata(String fieldLabel)
    {
        List<String> v = metadata.get(fieldLabel);
        return v == null || v.isEmpty() ? null : v.get(0);
    }

    public List<ViewContent> getObjectives()
    {
        return Collections.unmodifiableList(objectives);
    }

    public LegacyItem addObjectives(ViewContent objective)
    {
        objectives.add(objective);
        return this;
    }

    public List<ViewContent> getRubrics()
    {
        return Collections.unmodifiableList(rubrics);
    }

    public LegacyItem addRubric(ViewContent rubric)
    {
        rubrics.add(rubric);
        return this;
    }

    public Presentation getPresentation()
    {
        return presentation;
    }

    public LegacyItem withPresentation(Presentation presentation)
    {
        this.presentation = presentation;
        return this;
    }

    public int getResProcessingCount()
    {
        return resProcessingCount;
    }

    /** Counts a resprocessing block and the respconditions it held. */
    public LegacyItem addResProcessing(int conditions)
    {
        resProcessingCount++;
        conditionCount += conditions;
        return this;
    }

    public int getConditionCount()
    {
        return conditionCount;
    }

    public List<DecVar> getOutcomes()
    {
        return Collections.unmodifiableList(outcomes);
    }

    public LegacyItem addOutcome(DecVar decvar)
    {
        outcomes.add(decvar);
        return this;
    }

    public List<Feedback> getFeedback()
    {
        return Collections.unmodifiableList(feedback);
    }

    public LegacyItem addFeedback(Feedback fb)
    {
        feedback.add(fb);
        return this;
    }

    // ---------------------------------------------------------------------

    /** The presentation element: its content plus the few attributes that survive. */
    public static final class Presentation
    {
        private final List<ContentNode> children = new ArrayList<>();
        private String label;
        private String lang;
        private PositionRect position;

        public Presentation(ContentNode... children)
        {
            Collections.addAll(this.children, children);
        }

        public Presentation add(ContentNode node)
        {
            children.add(node);
            return this;
        }

        public List<ContentNode> getChildren()
        {
            return Collections.unmodifiableList(children);
        }

        public String getLabel()
        {
            return label;
        }

        public Presentation withLabel(String label)
        {
            this.label = ContentNode.blankToNull(label);
            return this;
        }

        public String getLang()
        {
            return lang;
        }

        public Presentation withLang(String lang)
        {
            this.lang = ContentNode.blankToNull(lang);
            return this;
        }

        public PositionRect getPosition()
        {
            return position;
        }

        public Presentation withPosition(PositionRect position)
        {
            this.position = position == null || position.isEmpty() ? null : position;
            return this;
        }
    }

    /** objectives or rubric: content addressed to a view. */
    public static final class ViewContent
    {
        public final View view;
        public final List<ContentNode> content;

        public ViewContent(View view, List<ContentNode> content)
        {
            this.view = view == null ? View.ALL : view;
            this.content = Collections.unmodifiableList(new ArrayList<>(content));
        }
    }

    /** itemfeedback */
    public static final class Feedback
    {
        public final String ident;
        public final String title;
        public final View view;
        public final List<ContentNode> content;

        public Feedback(String ident, String title, View view, List<ContentNode> content)
        {
            this.ident = ident == null ? "" : ident;
            this.title = ContentNode.blankToNull(title);
            this.view = view == null ? View.ALL : view;
            this.content = Collections.unmodifiableList(new ArrayList<>(content));
        }
    }

    /** decvar: an outcome variable declaration. */
    public static final class DecVar
    {
        public final String varName;
        public final String varType;
        public final String defaultValue;
        public final String minValue;
        public final String maxValue;
        public final String cutValue;
        public final String members;

        public DecVar(String varName, String varType, String defaultValue, String minValue, String maxValue,
            String cutValue, String members)
        {
            this.varName = ContentNode.blankToNull(varName) == null ? "SCORE" : varName.trim();
            this.varType = ContentNode.blankToNull(varType) == null ? "Integer" : varType.trim();
            this.defaultValue = ContentNode.blankToNull(defaultValue);
            this.minValue = ContentNode.blankToNull(minValue);
            this.maxValue = ContentNode.blankToNull(maxValue);
            this.cutValue = ContentNode.blankToNull(cutValue);
            this.members = ContentNode.blankToNull(members);
        }
    }
}
