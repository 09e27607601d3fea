package qti1to2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds the background image(s) of a legacy render_hotspot.
 *
 * A legacy hotspot does not have to name its image: the labels carry regions on a notional stage
 * and the presentation may hold any number of images. Each label is associated with the images
 * its region overlaps; the number of images that end up with labels is the number of
 * hotspotInteractions the render becomes.
 */
public final class HotspotResolver
{
    /** An image and the labels drawn on it. */
    public static final class Association
    {
        public final ContentNode image;
        public final List<ContentNode> labels;

        Association(ContentNode image, List<ContentNode> labels)
        {
            this.image = image;
            this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
        }
    }

    /** The content of a response_label split into coordinate data and label text. */
    public static final class LabelValue
    {
        public final String lang;
        public final String label;
        public final String coords;

        LabelValue(String lang, String label, String coords)
        {
            this.lang = lang;
            this.label = label;
            this.coords = coords;
        }
    }

    /**
     * Character data in a hotspot label is its region; element content is its visible label.
     */
    public static LabelValue parseLabel(ContentNode label)
    {
        List<String> values = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        String lang = null;
        for (ContentNode c : label.getChildren())
        {
            if (c.getKind() == ContentKind.DATA)
            {
                values.add(c.getText());
            }
            else
            {
                if (lang == null)
                {
                    lang = c.findLang();
                }
                String t = c.extractText();
                if (!t.isEmpty())
                {
                    texts.add(t);
                }
            }
        }
        return new LabelValue(lang, String.join(" ", texts), String.join(" ", values));
    }

    /** The label's region in stage coordinates. */
    public AreaCoordinates.Shape shapeOf(ContentNode label, IssueSink log)
    {
        return AreaCoordinates.translate(label.getArea(), parseLabel(label).coords, log);
    }

    /**
     * If a prompt amounts to nothing but one image, returns that image. Materials, unclassed
     * flows and references are looked through and blank text is ignored.
     */
    public ContentNode singleImage(List<ContentNode> prompt)
    {
        List<ContentNode> leaves = new ArrayList<>();
        reduce(prompt, leaves);
        if (leaves.size() == 1 && leaves.get(0).getKind() == ContentKind.IMAGE && leaves.get(0).getUri() != null)
        {
            return leaves.get(0);
        }
        return null;
    }

    private static void reduce(List<ContentNode> nodes, List<ContentNode> leaves)
    {
        for (ContentNode n : nodes)
        {
            switch (n.getKind())
            {
                case MATERIAL:
                    reduce(n.getChildren(), leaves);
                    break;
                case FLOW:
                case FLOW_MAT:
                case FLOW_LABEL:
                    if (n.getFlowClass() == null)
                    {
                        reduce(n.getChildren(), leaves);
                    }
                    else
                    {
                        leaves.add(n);
                    }
                    break;
                case REFERENCE:
                {
                    ContentNode target = n.resolve();
                    if (target != null)
                    {
                        reduce(Collections.singletonList(target), leaves);
                    }
                    break;
                }
                case TEXT:
                case DATA:
                    if (n.getTextType() != TextType.PLAIN || !n.getText().trim().isEmpty())
                    {
                        leaves.add(n);
                    }
                    break;
                default:
                    leaves.add(n);
                    break;
            }
        }
    }

    /** Every distinct image in the content, depth first, including those inside responses. */
    public static List<ContentNode> collectImages(List<ContentNode> nodes)
    {
        List<ContentNode> out = new ArrayList<>();
        collect(nodes, out);
        return out;
    }

    private static void collect(List<ContentNode> nodes, List<ContentNode> out)
    {
        for (ContentNode n : nodes)
        {
            switch (n.getKind())
            {
                case IMAGE:
                    if (!containsInstance(out, n))
                    {
                        out.add(n);
                    }
                    break;
                case REFERENCE:
                {
                    ContentNode target = n.resolve();
                    if (target != null)
                    {
                        collect(Collections.singletonList(target), out);
                    }
                    break;
                }
                case RESPONSE:
                {
                    Response r = n.getResponse();
                    collect(r.getIntro(), out);
                    if (r.getRender() != null)
                    {
                        collect(r.getRender().getChildren(), out);
                    }
                    collect(r.getOutro(), out);
                    break;
                }
                default:
                    collect(n.getChildren(), out);
                    break;
            }
        }
    }

    private static boolean containsInstance(List<ContentNode> list, ContentNode n)
    {
        for (ContentNode x : list)
        {
            if (x == n)
            {
                return true;
            }
        }
        return false;
    }

    /**
     * Associates labels with images.
     *
     * A sole image takes every label. Failing that, a sole positioned image takes every label.
     * Otherwise each positioned image takes the labels whose bounding box overlaps it, and images
     * no label overlaps are dropped.
     *
     * @return one association per interaction to emit; empty (with an error logged) when no
     *         image qualifies
     */
    public List<Association> associate(List<ContentNode> labels, List<ContentNode> images, IssueSink log)
    {
        List<Association> out = new ArrayList<>();
        if (images.size() == 1)
        {
            out.add(new Association(images.get(0), labels));
            return out;
        }

        List<ContentNode> positioned = new ArrayList<>();
        for (ContentNode img : images)
        {
            if (img.getPosition() != null && img.getPosition().isComplete())
            {
                positioned.add(img);
            }
        }

        if (positioned.size() == 1)
        {
            out.add(new Association(positioned.get(0), labels));
        }
        else
        {
            for (ContentNode img : positioned)
            {
                List<ContentNode> hits = new ArrayList<>();
                for (ContentNode label : labels)
                {
                    if (AreaCoordinates.overlaps(shapeOf(label, IssueSink.NONE), img.getPosition()))
                    {
                        hits.add(label);
                    }
                }
                if (!hits.isEmpty())
                {
                    out.add(new Association(img, hits));
                }
            }
        }

        if (out.isEmpty())
        {
            log.error("omitting render_hotspot with no hotspot image");
        }
        return out;
    }
}
