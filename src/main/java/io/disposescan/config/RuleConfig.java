package io.disposescan.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Names the disposal-guard rule works with, loaded from YAML.
 * <p>
 * The bundled defaults target {@code java.lang.AutoCloseable}; a project file may override
 * any key. Scalars in the override win, lists replace the default list.
 */
public class RuleConfig {

    private static final String DEFAULT_CONFIG = "/dispose-scan-defaults.yaml";

    static final String LIFECYCLE_INTERFACE = "lifecycleInterface";
    static final String GUARD_EXCEPTION = "guardException";
    static final String DISPOSE_METHOD = "disposeMethod";
    static final String GUARD_HELPER_FRAGMENTS = "guardHelperFragments";
    static final String EXCLUDE_CLASSES = "excludeClasses";

    private final String lifecycleInterface;
    private final String guardException;
    private final String disposeMethod;
    private final List<String> guardHelperFragments;
    private final List<String> excludeClasses;

    private RuleConfig(Map<String, Object> config) {
        this.lifecycleInterface = getString(config, LIFECYCLE_INTERFACE);
        this.guardException = getString(config, GUARD_EXCEPTION);
        this.disposeMethod = getString(config, DISPOSE_METHOD);
        this.guardHelperFragments = getStringList(config, GUARD_HELPER_FRAGMENTS);
        this.excludeClasses = getStringList(config, EXCLUDE_CLASSES);
    }

    private static String getString(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException("'" + key + "' must be a non-empty string, got: " + value);
        }
        return s.trim();
    }

    private static List<String> getStringList(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' must be a list, got: " + value);
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof String s && !s.isBlank()) {
                result.add(s.trim());
            }
        }
        return List.copyOf(result);
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static RuleConfig loadDefault() {
        try (InputStream is = RuleConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     *
     * @throws IOException if the file cannot be read, is empty or is not a YAML mapping
     */
    public static RuleConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            Map<String, Object> data = parse(is);
            if (data == null) {
                throw new IOException("Empty or invalid config file: " + path);
            }
            return new RuleConfig(data);
        } catch (YAMLException | ClassCastException | IllegalArgumentException e) {
            throw new IOException("Invalid config file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream. An empty document yields an empty configuration.
     */
    public static RuleConfig load(InputStream is) {
        Map<String, Object> data = parse(is);
        return new RuleConfig(data != null ? data : Map.of());
    }

    private static Map<String, Object> parse(InputStream is) {
        Yaml yaml = new Yaml();
        return yaml.load(is);
    }

    /**
     * Builds a configuration from already-parsed values; unspecified keys stay unset.
     */
    public static RuleConfig of(Map<String, Object> values) {
        return new RuleConfig(values);
    }

    /**
     * Merges this configuration with another, with the other taking precedence.
     */
    public RuleConfig merge(RuleConfig other) {
        Map<String, Object> merged = new HashMap<>();
        put(merged, LIFECYCLE_INTERFACE, other.lifecycleInterface, lifecycleInterface);
        put(merged, GUARD_EXCEPTION, other.guardException, guardException);
        put(merged, DISPOSE_METHOD, other.disposeMethod, disposeMethod);
        put(merged, GUARD_HELPER_FRAGMENTS, other.guardHelperFragments, guardHelperFragments);
        put(merged, EXCLUDE_CLASSES, other.excludeClasses, excludeClasses);
        return new RuleConfig(merged);
    }

    private static void put(Map<String, Object> target, String key, Object preferred, Object fallback) {
        Object value = preferred != null ? preferred : fallback;
        if (value != null) {
            target.put(key, value);
        }
    }

    /**
     * FQN of the interface that marks a type as closeable.
     */
    public String lifecycleInterface() {
        return lifecycleInterface;
    }

    /**
     * FQN of the exception public methods should throw once the object is closed.
     */
    public String guardException() {
        return guardException;
    }

    /**
     * Name of the method that closes the object.
     */
    public String disposeMethod() {
        return disposeMethod;
    }

    /**
     * Substrings that together mark a callee as a helper performing the closed check.
     */
    public List<String> guardHelperFragments() {
        return guardHelperFragments != null ? guardHelperFragments : List.of();
    }

    /**
     * Glob patterns of classes the scanner skips.
     */
    public List<String> excludeClasses() {
        return excludeClasses != null ? excludeClasses : List.of();
    }

    /**
     * Returns true if a callee name contains every guard helper fragment (case-sensitive).
     * An empty fragment list matches nothing.
     */
    public boolean isGuardHelperName(String methodName) {
        List<String> fragments = guardHelperFragments();
        if (fragments.isEmpty() || methodName == null) {
            return false;
        }
        for (String fragment : fragments) {
            if (!methodName.contains(fragment)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks that the names the rule cannot work without are present.
     *
     * @throws IllegalStateException naming the first missing key
     */
    public RuleConfig requireComplete() {
        if (lifecycleInterface == null) {
            throw new IllegalStateException("Missing '" + LIFECYCLE_INTERFACE + "'");
        }
        if (guardException == null) {
            throw new IllegalStateException("Missing '" + GUARD_EXCEPTION + "'");
        }
        if (disposeMethod == null) {
            throw new IllegalStateException("Missing '" + DISPOSE_METHOD + "'");
        }
        return this;
    }
}
