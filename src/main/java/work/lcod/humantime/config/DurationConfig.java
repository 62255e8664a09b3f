package work.lcod.humantime.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.humantime.api.DurationParseException;
import work.lcod.humantime.api.HumanDuration;
import work.lcod.humantime.api.ParseReport;
import work.lcod.humantime.shared.DurationParser;

/**
 * Duration settings read from a TOML, YAML or JSON file.
 *
 * <p>Nested tables are flattened to dotted keys ({@code [http] timeout = "30s"} becomes
 * {@code http.timeout}). Only string values are kept; numbers, booleans and arrays are not
 * duration candidates.
 */
public final class DurationConfig {
    private static final Logger LOG = LoggerFactory.getLogger(DurationConfig.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final String source;
    private final Map<String, String> entries;

    private DurationConfig(String source, Map<String, String> entries) {
        this.source = source;
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static DurationConfig load(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read config: " + path, ex);
        }
        DurationConfig config;
        if (name.endsWith(".toml")) {
            config = parseToml(path.toString(), text);
        } else if (name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json")) {
            config = parseYaml(path.toString(), text);
        } else {
            throw new IllegalArgumentException("Unsupported config format (expected .toml, .yaml, .yml or .json): " + path);
        }
        LOG.debug("Loaded {} duration entries from {}", config.entries.size(), path);
        return config;
    }

    public static DurationConfig fromToml(String text) {
        return parseToml("<toml>", text);
    }

    /**
     * Reads YAML text; JSON is accepted too since it is a subset.
     */
    public static DurationConfig fromYaml(String text) {
        return parseYaml("<yaml>", text);
    }

    public String source() {
        return source;
    }

    public Map<String, String> entries() {
        return entries;
    }

    /**
     * Parsed value for {@code key}, empty when the key is absent or blank.
     *
     * @throws IllegalArgumentException naming the key when the value is not a valid duration
     */
    public Optional<HumanDuration> find(String key) {
        String raw = entries.get(key);
        try {
            return DurationParser.parseOptional(raw);
        } catch (DurationParseException ex) {
            throw new IllegalArgumentException("Invalid duration for " + key + " in " + source + ": " + ex.getMessage(), ex);
        }
    }

    public HumanDuration require(String key) {
        return find(key).orElseThrow(() ->
            new IllegalArgumentException("Missing duration " + key + " in " + source)
        );
    }

    /**
     * Parses every entry whose key starts with {@code prefix} (all entries for a blank prefix).
     */
    public List<ParseReport> check(String prefix) {
        List<ParseReport> reports = new ArrayList<>();
        for (var entry : entries.entrySet()) {
            if (matchesPrefix(entry.getKey(), prefix)) {
                reports.add(ParseReport.of(entry.getKey(), entry.getValue()));
            }
        }
        LOG.debug("Checked {} entries under '{}' in {}", reports.size(), prefix == null ? "" : prefix, source);
        return reports;
    }

    private static boolean matchesPrefix(String key, String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return true;
        }
        return key.equals(prefix) || key.startsWith(prefix + ".");
    }

    private static DurationConfig parseToml(String source, String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("toml parse error in " + source + ": " + result.errors().get(0).toString());
        }
        Map<String, String> entries = new LinkedHashMap<>();
        flattenToml(result, "", entries);
        return new DurationConfig(source, entries);
    }

    private static void flattenToml(TomlTable table, String prefix, Map<String, String> entries) {
        for (String key : table.keySet()) {
            Object value = table.get(List.of(key));
            String path = prefix.isEmpty() ? key : prefix + "." + key;
            if (value instanceof TomlTable nested) {
                flattenToml(nested, path, entries);
            } else if (value instanceof String str) {
                entries.put(path, str);
            } else {
                LOG.trace("Skipping non-string entry {}", path);
            }
        }
    }

    private static DurationConfig parseYaml(String source, String text) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(text);
        } catch (IOException ex) {
            throw new IllegalArgumentException("yaml parse error in " + source + ": " + ex.getMessage(), ex);
        }
        Map<String, String> entries = new LinkedHashMap<>();
        if (root != null && root.isObject()) {
            flattenNode(root, "", entries);
        }
        return new DurationConfig(source, entries);
    }

    private static void flattenNode(JsonNode node, String prefix, Map<String, String> entries) {
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            String path = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                flattenNode(value, path, entries);
            } else if (value.isTextual()) {
                entries.put(path, value.asText());
            } else {
                LOG.trace("Skipping non-string entry {}", path);
            }
        }
    }
}
