package qti1to2;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The QTI 2.1 element vocabulary: which elements exist, whether each is inline, and which
 * attributes and children each accepts. Loaded from {@code qti21-content-model.json}.
 *
 * Entries in an "attributes" or "children" list that start with '@' name a group from the
 * "groups" object; groups may themselves refer to other groups.
 */
public final class ContentModel
{
    public static final String RESOURCE = "qti21-content-model.json";
    public static final String PROPERTY = "qti1to2.contentModel";

    private final String sourceDescription;
    private final String namespace;
    private final Map<String, TagSpec> tags = new HashMap<>();

    private ContentModel(String sourceDescription, String namespace)
    {
        this.sourceDescription = sourceDescription;
        this.namespace = namespace;
    }

    public String getSourceDescription()
    {
        return sourceDescription;
    }

    public String getNamespace()
    {
        return namespace;
    }

    public boolean isKnown(String localName)
    {
        return tags.containsKey(localName);
    }

    /** True if the element may appear in inline content. Unknown elements are block. */
    public boolean isInline(String localName)
    {
        TagSpec spec = tags.get(localName);
        return spec != null && spec.inline;
    }

    public TagSpec getTagSpec(String localName)
    {
        return tags.get(localName);
    }

    /**
     * Locates the model: an explicit path, then the {@value #PROPERTY} system property, then a
     * file in the working directory, then the classpath resource.
     *
     * @throws MigrationException if none can be read
     */
    public static ContentModel locate(Path explicit)
    {
        if (explicit != null)
        {
            return load(explicit);
        }

        String sys = System.getProperty(PROPERTY);
        if (sys != null && !sys.trim().isEmpty())
        {
            return load(Paths.get(sys.trim()));
        }

        Path wd = Paths.get("").toAbsolutePath().resolve(RESOURCE);
        if (Files.isRegularFile(wd))
        {
            return load(wd);
        }

        return loadDefault();
    }

    /** The model bundled on the classpath. */
    public static ContentModel loadDefault()
    {
        try (InputStream in = ContentModel.class.getClassLoader().getResourceAsStream(RESOURCE))
        {
            if (in == null)
            {
                throw new MigrationException("Content model resource not found on classpath: " + RESOURCE);
            }
            return load(in, "classpath:" + RESOURCE);
        }
        catch (IOException ex)
        {
            throw new MigrationException("Failed to read content model resource " + RESOURCE, ex);
        }
    }

    public static ContentModel load(Path path)
    {
        Path p = Files.isDirectory(path) ? path.resolve(RESOURCE) : path;
        try (InputStream in = Files.newInputStream(p))
        {
            return load(in, p.toAbsolutePath().toString());
        }
        catch (IOException ex)
        {
            throw new MigrationException("Failed to read content model at " + p + ": " + ex.getMessage(), ex);
        }
    }

    public static ContentModel load(InputStream in, String sourceDescription)
    {
        JsonNode root;
        try
        {
            root = new ObjectMapper().readTree(in);
        }
        catch (IOException ex)
        {
            throw new MigrationException("Failed to parse content model (" + sourceDescription + "): " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject())
        {
            throw new MigrationException("Content model (" + sourceDescription + ") is not a JSON object");
        }

        ContentModel cm = new ContentModel(sourceDescription, root.path("namespace").asText(QtiV2Document.QTI_NS));

        Map<String, JsonNode> groups = new HashMap<>();
        JsonNode groupsNode = root.get("groups");
        if (groupsNode != null && groupsNode.isObject())
        {
            groupsNode.fieldNames().forEachRemaining(name -> groups.put(name, groupsNode.get(name)));
        }

        JsonNode tagsNode = root.get("tags");
        if (tagsNode != null && tagsNode.isObject())
        {
            tagsNode.fieldNames().forEachRemaining(name ->
            {
                JsonNode t = tagsNode.get(name);
                cm.tags.put(name, TagSpec.fromJson(t, groups));
            });
        }
        return cm;
    }

    // ---------------------------------------------------------------------

    public static final class TagSpec
    {
        public final boolean inline;
        public final Set<String> attributes;
        public final Set<String> children;

        private TagSpec(boolean inline, Set<String> attributes, Set<String> children)
        {
            this.inline = inline;
            this.attributes = Collections.unmodifiableSet(attributes);
            this.children = Collections.unmodifiableSet(children);
        }

        static TagSpec fromJson(JsonNode node, Map<String, JsonNode> groups)
        {
            if (node == null || !node.isObject())
            {
                return new TagSpec(false, new LinkedHashSet<>(), new LinkedHashSet<>());
            }

            Set<String> attributes = new LinkedHashSet<>();
            expand(node.get("attributes"), groups, attributes, 0);

            JsonNode c = node.get("child_elements");
            if (c == null)
            {
                c = node.get("children");
            }
            Set<String> children = new LinkedHashSet<>();
            expand(c, groups, children, 0);

            return new TagSpec(node.path("inline").asBoolean(false), attributes, children);
        }

        private static void expand(JsonNode list, Map<String, JsonNode> groups, Set<String> out, int depth)
        {
            if (list == null || !list.isArray())
            {
                return;
            }
            if (depth > groups.size())
            {
                throw new MigrationException("Content model groups refer to each other in a loop");
            }
            for (JsonNode x : list)
            {
                if (!x.isTextual())
                {
                    continue;
                }
                String name = x.asText();
                if (name.startsWith("@"))
                {
                    JsonNode group = groups.get(name.substring(1));
                    if (group == null)
                    {
                        throw new MigrationException("Content model refers to unknown group " + name);
                    }
                    expand(group, groups, out, depth + 1);
                }
                else
                {
                    out.add(name);
                }
            }
        }
    }
}
