package io.dynaform.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link StandaloneConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>Supports two invocation patterns:
 *
 * <ul>
 *   <li>Default: loads {@code dynaform.yaml} from the current directory
 *   <li>{@code --config /path/to/config.yaml}: loads from the specified path
 * </ul>
 *
 * <p>Every key can be overridden by an environment variable; env vars take precedence over YAML
 * values. An env var counts as "set" only if it is defined AND its trimmed value is non-empty.
 *
 * <pre>
 * form.metadata         DYNAFORM_METADATA
 * form.dialect          DYNAFORM_DIALECT
 * form.fallback-section DYNAFORM_FALLBACK_SECTION
 * output.pretty         DYNAFORM_OUTPUT_PRETTY
 * logging.format        DYNAFORM_LOG_FORMAT
 * logging.level         DYNAFORM_LOG_LEVEL
 * </pre>
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "dynaform.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file, applying overrides from {@link
     * System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or lacks a required
     *     value
     */
    public static StandaloneConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link StandaloneConfig} from the given YAML file, applying overrides from the
     * supplied lookup. A lookup result of {@code null} means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing, contains invalid YAML or lacks a required
     *     value
     */
    public static StandaloneConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            StandaloneConfig config = mapToConfig(root == null ? YAML_MAPPER.missingNode() : root, envLookup);
            return resolveMetadataPath(config, configPath);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static StandaloneConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        StandaloneConfig.Builder builder = StandaloneConfig.builder();

        // --- YAML mapping ---

        JsonNode form = root.path("form");
        if (form.has("metadata")) builder.metadataPath(form.get("metadata").asText());
        if (form.has("dialect")) builder.dialect(form.get("dialect").asText());
        if (form.has("fallback-section"))
            builder.fallbackSection(form.get("fallback-section").asText());

        JsonNode output = root.path("output");
        if (output.has("pretty")) builder.outputPretty(output.get("pretty").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "DYNAFORM_METADATA", builder::metadataPath);
        envString(envLookup, "DYNAFORM_DIALECT", builder::dialect);
        envString(envLookup, "DYNAFORM_FALLBACK_SECTION", builder::fallbackSection);
        envString(envLookup, "DYNAFORM_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "DYNAFORM_LOG_LEVEL", builder::loggingLevel);
        envBool(envLookup, "DYNAFORM_OUTPUT_PRETTY", builder::outputPretty);

        return builder.build();
    }

    /** Relative metadata paths are resolved against the directory holding the config file. */
    private static StandaloneConfig resolveMetadataPath(StandaloneConfig config, Path configPath) {
        Path metadata = Path.of(config.metadataPath());
        if (metadata.isAbsolute()) {
            return config;
        }
        Path base = configPath.toAbsolutePath().getParent();
        return new StandaloneConfig(
                base.resolve(metadata).normalize().toString(),
                config.dialect(),
                config.fallbackSection(),
                config.outputPretty(),
                config.loggingFormat(),
                config.loggingLevel());
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies a boolean env var override if set. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
