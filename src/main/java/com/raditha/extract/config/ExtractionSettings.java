package com.raditha.extract.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads extraction thresholds from YAML with CLI overrides.
 *
 * Configuration priority: CLI arguments > extract-analyzer.yml > defaults
 */
public class ExtractionSettings {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionSettings.class);

    public static final String DEFAULT_RESOURCE = "extract-analyzer.yml";
    private static final String CONFIG_KEY = "extract_function";

    private ExtractionSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration.
     *
     * @param configFile           YAML file to read, null to use {@value #DEFAULT_RESOURCE} from the classpath
     * @param presetCLI            CLI preset name (null = use YAML/default)
     * @param maxComplexityCLI     CLI complexity threshold (0 = use YAML/default)
     * @return complete configuration
     * @throws IllegalArgumentException if the file cannot be read or holds invalid values
     */
    public static ExtractionConfig loadConfig(Path configFile, String presetCLI, int maxComplexityCLI) {
        Map<String, Object> config = section(configFile == null ? readDefault() : read(configFile));

        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        ExtractionConfig base = preset != null ? ExtractionConfig.forPreset(preset) : ExtractionConfig.moderate();

        int maxComplexity = maxComplexityCLI != 0
                ? maxComplexityCLI
                : getInt(config, "max_cyclomatic_complexity", base.maxCyclomaticComplexity());

        return new ExtractionConfig(
                maxComplexity,
                getInt(config, "max_variable_complexity", base.maxVariableComplexity()),
                getInt(config, "max_external_variables", base.maxExternalVariables()),
                getInt(config, "max_modified_variables", base.maxModifiedVariables()),
                getInt(config, "max_tuple_size", base.maxTupleSize()));
    }

    private static Object readDefault() {
        try (InputStream in = ExtractionSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", DEFAULT_RESOURCE);
                return null;
            }
            return new Yaml().load(in);
        } catch (IOException | YAMLException e) {
            throw new IllegalArgumentException("Could not read " + DEFAULT_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    private static Object read(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile);
        }
        try (InputStream in = Files.newInputStream(configFile)) {
            return new Yaml().load(in);
        } catch (IOException | YAMLException e) {
            throw new IllegalArgumentException("Could not read " + configFile + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Object yaml) {
        if (yaml instanceof Map<?, ?> root && root.get(CONFIG_KEY) instanceof Map<?, ?> section) {
            return (Map<String, Object>) section;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalArgumentException(key + " must be a whole number, got '" + value + "'");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
