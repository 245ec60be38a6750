package work.lcod.lgx.manifest;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import work.lcod.lgx.shared.PathNormalizer;
import work.lcod.lgx.shared.ValidationResult;

/**
 * Package metadata stored as {@code manifest.json}.
 *
 * <p>Serialization is canonical: fixed field order, two-space indentation, LF line
 * endings and {@code main} keys in lexicographic order, so a manifest always
 * encodes to the same bytes regardless of how it was parsed or edited.
 */
public final class Manifest {
    public static final String CURRENT_VERSION = "0.1.0";

    private static final ObjectMapper JSON = JsonMapper.builder()
        .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();
    private static final ObjectWriter CANONICAL_WRITER = JSON.writer(new CanonicalPrettyPrinter());

    private String manifestVersion = CURRENT_VERSION;
    private String name = "";
    private String version = "";
    private String description = "";
    private String author = "";
    private String type = "";
    private String category = "";
    private String icon = "";
    private List<String> dependencies = new ArrayList<>();
    private SortedMap<String, String> main = new TreeMap<>();

    public Manifest() {}

    public Manifest copy() {
        Manifest copy = new Manifest();
        copy.manifestVersion = manifestVersion;
        copy.name = name;
        copy.version = version;
        copy.description = description;
        copy.author = author;
        copy.type = type;
        copy.category = category;
        copy.icon = icon;
        copy.dependencies = new ArrayList<>(dependencies);
        copy.main = new TreeMap<>(main);
        return copy;
    }

    public static Manifest parse(String jsonText) {
        JsonNode root;
        try {
            root = JSON.readTree(jsonText);
        } catch (JsonProcessingException ex) {
            throw new ManifestParseException("JSON parse error: " + ex.getOriginalMessage(), null, ex);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestParseException("Manifest must be a JSON object");
        }

        Manifest manifest = new Manifest();
        manifest.manifestVersion = requireString(root, "manifestVersion");
        manifest.name = requireString(root, "name");
        manifest.version = requireString(root, "version");
        manifest.description = requireString(root, "description");
        manifest.author = requireString(root, "author");
        manifest.type = requireString(root, "type");
        manifest.category = requireString(root, "category");

        JsonNode icon = root.get("icon");
        if (icon != null && !icon.isNull()) {
            if (!icon.isTextual()) {
                throw new ManifestParseException("Invalid 'icon' field (not a string)", "icon");
            }
            manifest.icon = icon.textValue();
        }

        JsonNode dependencies = root.get("dependencies");
        if (dependencies == null || !dependencies.isArray()) {
            throw new ManifestParseException("Missing or invalid 'dependencies' field", "dependencies");
        }
        for (JsonNode dependency : dependencies) {
            if (!dependency.isTextual()) {
                throw new ManifestParseException("Invalid dependency entry (not a string)", "dependencies");
            }
            manifest.dependencies.add(dependency.textValue());
        }

        JsonNode main = root.get("main");
        if (main == null || !main.isObject()) {
            throw new ManifestParseException("Missing or invalid 'main' field", "main");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = main.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new ManifestParseException("Invalid main entry for '" + field.getKey() + "' (not a string)", "main");
            }
            String key = normalizeKey(field.getKey())
                .orElseThrow(() -> new ManifestParseException("Invalid main key '" + field.getKey() + "'", "main"));
            if (manifest.main.putIfAbsent(key, field.getValue().textValue()) != null) {
                throw new ManifestParseException("Duplicate main entry for '" + key + "'", "main");
            }
        }
        return manifest;
    }

    public String toJson() {
        ObjectNode root = JSON.createObjectNode();
        root.put("manifestVersion", manifestVersion);
        root.put("name", name);
        root.put("version", version);
        root.put("description", description);
        root.put("author", author);
        root.put("type", type);
        root.put("category", category);
        root.put("icon", icon);
        ArrayNode deps = root.putArray("dependencies");
        dependencies.forEach(deps::add);
        ObjectNode mainNode = root.putObject("main");
        main.forEach(mainNode::put);
        try {
            return CANONICAL_WRITER.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize manifest", ex);
        }
    }

    /**
     * Field-level rules: supported manifest version, non-empty name and version,
     * lowercase {@code main} keys and safe {@code main} paths.
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        if (!isVersionSupported(manifestVersion)) {
            errors.add("Unsupported manifest version: " + manifestVersion);
        }
        if (name.isEmpty()) {
            errors.add("'name' field is empty");
        }
        if (version.isEmpty()) {
            errors.add("'version' field is empty");
        }
        main.forEach((variant, path) -> {
            if (!variant.equals(PathNormalizer.toLowercase(variant))) {
                errors.add("Variant key '" + variant + "' is not lowercase");
            }
            PathNormalizer.validateArchivePath(path).ifPresent(violation ->
                errors.add("Invalid main path for '" + variant + "': " + violation.message()));
        });
        return new ValidationResult(errors, List.of());
    }

    /**
     * Every {@code main} key needs a variant directory and every variant directory
     * needs a {@code main} key. Both sides are lowercased before comparing.
     */
    public ValidationResult validateCompleteness(Set<String> existingVariants) {
        SortedSet<String> declared = new TreeSet<>();
        for (String key : main.keySet()) {
            declared.add(PathNormalizer.toLowercase(key));
        }
        SortedSet<String> present = new TreeSet<>();
        for (String variant : existingVariants) {
            present.add(PathNormalizer.toLowercase(variant));
        }

        List<String> errors = new ArrayList<>();
        for (String variant : declared) {
            if (!present.contains(variant)) {
                errors.add("main[" + variant + "] has no corresponding variant directory");
            }
        }
        for (String variant : present) {
            if (!declared.contains(variant)) {
                errors.add("Variant '" + variant + "' has no main entry");
            }
        }
        return new ValidationResult(errors, List.of());
    }

    /**
     * Only major version 0 is understood.
     */
    public static boolean isVersionSupported(String version) {
        if (version == null) {
            return false;
        }
        int dot = version.indexOf('.');
        return dot > 0 && "0".equals(version.substring(0, dot));
    }

    public void setMain(String variant, String path) {
        Objects.requireNonNull(path, "path");
        main.put(PathNormalizer.toLowercase(variant), path);
    }

    public void removeMain(String variant) {
        main.remove(PathNormalizer.toLowercase(variant));
    }

    public Optional<String> getMain(String variant) {
        return Optional.ofNullable(main.get(PathNormalizer.toLowercase(variant)));
    }

    public SortedSet<String> variants() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(main.keySet()));
    }

    public SortedMap<String, String> main() {
        return Collections.unmodifiableSortedMap(main);
    }

    /**
     * Replaces {@code main} verbatim, keys included; see {@link #normalizeVariantKeys()}.
     */
    public void setMainEntries(Map<String, String> entries) {
        main = new TreeMap<>(entries);
    }

    public void normalizeName() {
        name = PathNormalizer.toLowercase(name);
    }

    /**
     * Folds every {@code main} key to lowercase NFC; on collision the entry whose
     * original key sorts last wins.
     */
    public void normalizeVariantKeys() {
        SortedMap<String, String> normalized = new TreeMap<>();
        main.forEach((key, value) -> normalized.put(normalizeKey(key).orElse(PathNormalizer.toLowercase(key)), value));
        main = normalized;
    }

    public String manifestVersion() {
        return manifestVersion;
    }

    public void setManifestVersion(String manifestVersion) {
        this.manifestVersion = Objects.requireNonNull(manifestVersion, "manifestVersion");
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String version() {
        return version;
    }

    public void setVersion(String version) {
        this.version = Objects.requireNonNull(version, "version");
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = Objects.requireNonNull(description, "description");
    }

    public String author() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = Objects.requireNonNull(author, "author");
    }

    public String type() {
        return type;
    }

    public void setType(String type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public String category() {
        return category;
    }

    public void setCategory(String category) {
        this.category = Objects.requireNonNull(category, "category");
    }

    public String icon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = Objects.requireNonNull(icon, "icon");
    }

    public List<String> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = new ArrayList<>(dependencies);
    }

    private static String requireString(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new ManifestParseException("Missing or invalid '" + field + "' field", field);
        }
        return node.textValue();
    }

    private static Optional<String> normalizeKey(String key) {
        return PathNormalizer.toNfc(key).map(PathNormalizer::toLowercase);
    }

    /**
     * Jackson's default printer with {@code ": "} separators and LF indentation for
     * both objects and arrays, independent of the platform line separator.
     */
    private static final class CanonicalPrettyPrinter extends DefaultPrettyPrinter {
        CanonicalPrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        CanonicalPrettyPrinter(CanonicalPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new CanonicalPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }
    }
}
