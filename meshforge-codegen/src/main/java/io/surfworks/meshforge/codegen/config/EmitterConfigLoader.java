package io.surfworks.meshforge.codegen.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves {@link EmitterConfig} as JSON.
 *
 * <p>Example file:
 * <pre>{@code
 * {
 *   "lineTimer": true,
 *   "timerFunction": "nnscaler.runtime.function.print_time",
 *   "reducerPrefix": "self.wreducer",
 *   "discardName": "_",
 *   "intermediatePrefix": "im_output"
 * }
 * }</pre>
 *
 * <p>Missing fields keep their defaults.
 */
public final class EmitterConfigLoader {

    private static final Logger LOG = Logger.getLogger(EmitterConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    /** Classpath resource consulted by {@link #loadDefault()} */
    public static final String RESOURCE = "meshforge-emitter.json";

    private EmitterConfigLoader() {
    }

    /**
     * Loads configuration from a specific file.
     *
     * <p>If the file doesn't exist, returns defaults. If it can't be parsed, logs a
     * warning and returns defaults.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static EmitterConfig load(Path configFile) {
        EmitterConfig base = EmitterConfig.defaults();
        if (!Files.exists(configFile)) {
            return base;
        }
        try {
            return fromJson(JSON.readTree(configFile.toFile()), base);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Cannot read emitter config " + configFile + ", using defaults", e);
            return base;
        }
    }

    /**
     * Loads configuration from the {@value #RESOURCE} classpath resource, or defaults
     * if there is none.
     */
    public static EmitterConfig loadDefault() {
        EmitterConfig base = EmitterConfig.defaults();
        try (InputStream in = EmitterConfigLoader.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return base;
            }
            return fromJson(JSON.readTree(in), base);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Cannot read emitter config resource " + RESOURCE + ", using defaults", e);
            return base;
        }
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(EmitterConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("lineTimer", config.lineTimer());
        root.put("timerFunction", config.timerFunction());
        root.put("reducerPrefix", config.reducerPrefix());
        root.put("discardName", config.discardName());
        root.put("intermediatePrefix", config.intermediatePrefix());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static EmitterConfig fromJson(JsonNode root, EmitterConfig base) {
        if (root == null || !root.isObject()) {
            LOG.warning("Emitter config is not a JSON object, using defaults");
            return base;
        }

        boolean lineTimer = root.has("lineTimer") ? root.get("lineTimer").asBoolean() : base.lineTimer();

        EmitterConfig config = base
                .withLineTimer(lineTimer)
                .withTimerFunction(getStringOrDefault(root, "timerFunction", base.timerFunction()))
                .withReducerPrefix(getStringOrDefault(root, "reducerPrefix", base.reducerPrefix()))
                .withDiscardName(getStringOrDefault(root, "discardName", base.discardName()))
                .withIntermediatePrefix(getStringOrDefault(root, "intermediatePrefix", base.intermediatePrefix()));

        LOG.fine("Loaded emitter config: " + config);
        return config;
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.has(field)) {
            return node.get(field).asText();
        }
        return defaultValue;
    }
}
