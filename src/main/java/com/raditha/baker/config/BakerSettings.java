package com.raditha.baker.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads bake configuration from a YAML file (baker.yml) with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > baker.yml > defaults
 *
 * <pre>
 * baker:
 *   namespace: Vendor\Package
 *   strip_open_tag: false
 *   exclude_patterns: ["**&#47;vendor/**"]
 *   extensions: [php]
 *   catalogue:
 *     replace: false
 *     add:
 *       hrtime: ~
 *       date_create: 1
 *     remove: [curl_exec]
 * </pre>
 */
public class BakerSettings {

    private static final Logger logger = LoggerFactory.getLogger(BakerSettings.class);

    private static final String CONFIG_KEY = "baker";
    private static final String DEFAULT_CONFIG_FILE = "baker.yml";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private BakerSettings() {
    }

    /**
     * Read the raw YAML tree from a file.
     *
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public static Map<String, Object> readYaml(Path configFile) throws IOException {
        try (InputStream in = Files.newInputStream(configFile)) {
            JsonNode tree = YAML_MAPPER.readTree(in);
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                return Map.of();
            }
            return YAML_MAPPER.convertValue(tree, new TypeReference<Map<String, Object>>() {
            });
        }
    }

    /**
     * Load configuration, looking for baker.yml in the working directory when
     * no explicit file is given.
     *
     * @param configFile   explicit config file or null
     * @param namespaceCLI CLI namespace (null = use YAML/default)
     * @param stripCLI     CLI strip flag (null = use YAML/default)
     * @return complete configuration
     * @throws IOException if an existing config file cannot be read
     */
    public static BakerConfig loadConfig(Path configFile, String namespaceCLI, Boolean stripCLI)
            throws IOException {
        Path file = configFile;
        if (file == null) {
            Path candidate = Path.of(DEFAULT_CONFIG_FILE);
            if (Files.isRegularFile(candidate)) {
                file = candidate;
            }
        }
        Map<String, Object> yaml = Map.of();
        if (file != null) {
            logger.debug("Loading configuration from {}", file);
            yaml = readYaml(file);
        }
        return loadConfig(yaml, namespaceCLI, stripCLI);
    }

    /**
     * Build configuration from an already parsed YAML tree.
     */
    public static BakerConfig loadConfig(Map<String, Object> yaml, String namespaceCLI, Boolean stripCLI) {
        Object section = yaml.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            return applyOverrides(BakerConfig.defaults(), namespaceCLI, stripCLI);
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        BakerConfig defaults = BakerConfig.defaults();

        String namespace = namespaceCLI != null ? namespaceCLI : getString(config, "namespace", "");
        boolean strip = stripCLI != null ? stripCLI : getBoolean(config, "strip_open_tag", false);

        List<String> excludePatterns = getListString(config, "exclude_patterns");
        if (excludePatterns.isEmpty()) {
            excludePatterns = defaults.excludePatterns();
        }
        List<String> extensions = getListString(config, "extensions");

        return new BakerConfig(
                buildCatalogue(config),
                namespace,
                strip,
                excludePatterns,
                extensions);
    }

    private static BakerConfig applyOverrides(BakerConfig config, String namespaceCLI, Boolean stripCLI) {
        BakerConfig result = config;
        if (namespaceCLI != null) {
            result = result.withNamespace(namespaceCLI);
        }
        if (stripCLI != null) {
            result = result.withStripOpenTag(stripCLI);
        }
        return result;
    }

    private static DeterminismCatalogue buildCatalogue(Map<String, Object> config) {
        Object catalogueObj = config.get("catalogue");
        if (!(catalogueObj instanceof Map)) {
            return DeterminismCatalogue.defaults();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> catalogueMap = (Map<String, Object>) catalogueObj;

        DeterminismCatalogue.Builder builder = DeterminismCatalogue.defaults().toBuilder();
        if (getBoolean(catalogueMap, "replace", false)) {
            builder.clear();
        }

        for (String name : getListString(catalogueMap, "remove")) {
            builder.remove(name);
        }

        Object addObj = catalogueMap.get("add");
        if (addObj instanceof Map<?, ?> additions) {
            for (Map.Entry<?, ?> entry : additions.entrySet()) {
                String name = String.valueOf(entry.getKey());
                Object threshold = entry.getValue();
                if (threshold == null) {
                    builder.always(name);
                } else if (threshold instanceof Number number) {
                    builder.unlessArguments(name, number.intValue());
                } else {
                    throw new IllegalArgumentException(
                            "Catalogue threshold for '" + name + "' must be a number or ~, got: " + threshold);
                }
            }
        }

        DeterminismCatalogue catalogue = builder.build();
        logger.debug("Catalogue configured with {} functions", catalogue.size());
        return catalogue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
