package com.lambdacalc.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lambdacalc.debug.Debug;
import com.lambdacalc.engine.format.PrintOptions;
import com.lambdacalc.engine.reduce.Definitions;

/**
 * Evaluator settings:
 * - defaults in the field initializers
 * - load() binds a JSON file over them
 * - applyFlags() overrides single fields from --key=value arguments
 * - validate() normalizes values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EvaluatorConfig {

    private static final String TAG = Debug.CONFIG;

    /** Reduction steps before the driver gives up; {@code <= 0} means no limit. */
    public int maxSteps = 10_000;

    public boolean compact = true;
    public boolean colorParens = true;
    public boolean colorDiff = false;
    public boolean showStepType = true;
    public boolean abstractNumerals = true;

    /** Stack size of the CLI evaluation thread. */
    public int stackSizeMb = 512;

    /** Extra definitions layered over the built-in table, name → source. */
    public Map<String, String> definitions = new LinkedHashMap<>();

    public static EvaluatorConfig defaults() {
        EvaluatorConfig cfg = new EvaluatorConfig();
        cfg.validate();
        return cfg;
    }

    public static EvaluatorConfig load(Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json = Files.readString(configFile, StandardCharsets.UTF_8);
        if (json.isBlank()) {
            Debug.get().w(TAG, "Config file " + configFile + " is empty. Falling back to defaults.");
            return defaults();
        }

        JsonNode root = mapper.readTree(json);
        if (root == null || root.isNull()) {
            Debug.get().w(TAG, "Config file " + configFile + " is null. Falling back to defaults.");
            return defaults();
        }
        if (!root.isObject()) {
            throw new IllegalStateException("Config root must be a JSON object: " + configFile);
        }

        EvaluatorConfig cfg = mapper.treeToValue(root, EvaluatorConfig.class);
        if (cfg == null) cfg = new EvaluatorConfig();
        cfg.validate();
        Debug.get().i(TAG, "Loaded config from " + configFile);
        return cfg;
    }

    /** Applies every flag of {@code flags} in iteration order, then validates. */
    public EvaluatorConfig applyFlags(Map<String, String> flags) {
        for (Map.Entry<String, String> e : flags.entrySet()) {
            applyFlag(e.getKey(), e.getValue());
        }
        validate();
        return this;
    }

    /**
     * Applies one {@code key=value} override (the leading "--" already stripped).
     * {@code define} may be given repeatedly, each time as {@code name=source}.
     *
     * @throws IllegalArgumentException for unknown keys or unparsable values
     */
    public void applyFlag(String key, String value) {
        switch (key) {
            case "maxSteps": maxSteps = parseInt(key, value); break;
            case "compact": compact = parseBool(key, value); break;
            case "colorParens": colorParens = parseBool(key, value); break;
            case "colorDiff": colorDiff = parseBool(key, value); break;
            case "showStepType": showStepType = parseBool(key, value); break;
            case "abstractNumerals": abstractNumerals = parseBool(key, value); break;
            case "stackSizeMb": stackSizeMb = parseInt(key, value); break;
            case "define": {
                int eq = value == null ? -1 : value.indexOf('=');
                if (eq <= 0) throw new IllegalArgumentException("--define expects name=source, got: " + value);
                definitions.put(value.substring(0, eq).trim(), value.substring(eq + 1));
                break;
            }
            default:
                throw new IllegalArgumentException("Unknown option: --" + key);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " expects an integer, got: " + value, e);
        }
    }

    // a bare flag (--colorDiff) means true
    private static boolean parseBool(String key, String value) {
        if (value == null || value.isEmpty()) return true;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true": case "yes": case "on": case "1": return true;
            case "false": case "no": case "off": case "0": return false;
            default: throw new IllegalArgumentException("--" + key + " expects true/false, got: " + value);
        }
    }

    public void validate() {
        if (maxSteps < 0) maxSteps = 0;
        if (stackSizeMb < 1) stackSizeMb = 1;
        if (definitions == null) definitions = new LinkedHashMap<>();
    }

    public PrintOptions printOptions() {
        return new PrintOptions(compact, colorParens, colorDiff, showStepType);
    }

    /** Built-in table plus {@link #definitions}. */
    public Definitions buildDefinitions() {
        return Definitions.defaults().extend(definitions);
    }
}
