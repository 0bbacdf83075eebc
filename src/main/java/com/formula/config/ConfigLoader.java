package com.formula.config;

import com.formula.exception.ConfigurationException;
import com.formula.parse.ScanMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads engine configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String ROOT_KEY = "formula";
    private static final Set<String> KNOWN_KEYS = Set.of(
            "name", "builtins", "cycle-detection", "scan-mode", "constants");

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static FormulaConfig load(String path) {
        log.info("Loading formula configuration from: {}", path);

        Resource resource = Resources.resolve(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Load configuration from YAML text.
     */
    public static FormulaConfig parse(String yamlText) {
        Yaml yaml = new Yaml();
        Object root = yaml.load(yamlText);
        return build(root);
    }

    private static FormulaConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object root = yaml.load(inputStream);
        return build(root);
    }

    @SuppressWarnings("unchecked")
    private static FormulaConfig build(Object document) {
        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException("Configuration must be a mapping, got: " + document.getClass().getSimpleName());
        }
        Map<String, Object> root = (Map<String, Object>) document;

        // settings live at the root or under the 'formula' key
        Object section = root.containsKey(ROOT_KEY) ? root.get(ROOT_KEY) : root;
        if (!(section instanceof Map)) {
            throw new ConfigurationException("'" + ROOT_KEY + "' must be a mapping");
        }
        Map<String, Object> formula = (Map<String, Object>) section;

        for (String key : formula.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                log.warn("Ignoring unknown configuration key: {}", key);
            }
        }

        String name = getString(formula, "name", "default-engine");
        boolean builtins = getBoolean(formula, "builtins", true);
        boolean cycleDetection = getBoolean(formula, "cycle-detection", true);
        ScanMode scanMode = parseScanMode(formula);
        Map<String, Object> constants = parseConstants(formula.get("constants"));

        FormulaConfig config = new FormulaConfig(name, builtins, cycleDetection, scanMode, constants);

        log.info("Loaded formula configuration: {} with builtins: {}, cycle detection: {}, scan mode: {}, {} constants",
                name, builtins, cycleDetection, scanMode, constants.size());

        return config;
    }

    private static ScanMode parseScanMode(Map<String, Object> map) {
        String value = getString(map, "scan-mode", ScanMode.FORMULA.name());
        try {
            return ScanMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid scan-mode: " + value + ". Expected FORMULA or SCRIPT", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parseConstants(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'constants' must be a mapping of names to values");
        }
        Map<String, Object> constants = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
            Object constant = entry.getValue();
            if (constant instanceof Number || constant instanceof String || constant instanceof Boolean) {
                constants.put(entry.getKey(), constant);
                log.debug("Parsed constant: {}={}", entry.getKey(), constant);
            } else {
                log.warn("Ignoring constant {}: unsupported value {}", entry.getKey(), constant);
            }
        }
        return constants;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
