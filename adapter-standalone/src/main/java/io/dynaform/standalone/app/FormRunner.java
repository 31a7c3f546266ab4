package io.dynaform.standalone.app;

import io.dynaform.core.engine.FormController;
import io.dynaform.core.engine.ReviewPayloadMapper;
import io.dynaform.standalone.adapter.FieldEdit;
import io.dynaform.standalone.adapter.FileMetadataSource;
import io.dynaform.standalone.config.ConfigLoader;
import io.dynaform.standalone.config.StandaloneConfig;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the standalone runner: load config, configure logging, build the form from
 * the metadata document, replay its edits and print the review payload as JSON.
 */
public final class FormRunner {

    private static final Logger LOG = LoggerFactory.getLogger(FormRunner.class);

    /** Exit code when the form was built and printed. */
    public static final int EXIT_OK = 0;

    /** Exit code when the metadata source reported an error. */
    public static final int EXIT_UPSTREAM_ERROR = 2;

    private FormRunner() {}

    /**
     * Runs the full startup sequence.
     *
     * @param args      command-line arguments ({@code --config <path>})
     * @param envLookup environment variable lookup
     * @param out       stream the review payload is written to
     * @return the process exit code
     * @throws io.dynaform.standalone.config.ConfigLoadException if the configuration is invalid
     * @throws io.dynaform.core.error.UnknownDialectException if the configured dialect is unknown
     */
    public static int start(String[] args, Function<String, String> envLookup, PrintStream out) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        StandaloneConfig config = ConfigLoader.load(configPath, envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Loaded configuration from {} (dialect={}, metadata={})",
                configPath, config.dialect(), config.metadataPath());
        return run(config, out);
    }

    /**
     * Builds the form described by the configuration and prints its review payload.
     *
     * @param config the loaded configuration
     * @param out    stream the review payload is written to
     * @return {@link #EXIT_OK}, or {@link #EXIT_UPSTREAM_ERROR} if the metadata could not be loaded
     */
    public static int run(StandaloneConfig config, PrintStream out) {
        FormController controller = new FormController(config.engineOptions());
        FileMetadataSource source = new FileMetadataSource(Path.of(config.metadataPath()));

        controller.load(source);
        Optional<String> error = controller.schemaError();
        if (error.isPresent()) {
            LOG.error("Form '{}' could not be loaded: {}", source.formId(), error.get());
            return EXIT_UPSTREAM_ERROR;
        }

        for (FieldEdit edit : source.edits()) {
            int matched = edit.value() instanceof Boolean checked
                    ? controller.applyEdit(edit.fieldApiName(), checked)
                    : controller.applyEdit(edit.fieldApiName(), (String) edit.value());
            LOG.debug("Applied edit {}={} ({} fields)", edit.fieldApiName(), edit.value(), matched);
        }

        out.println(ReviewPayloadMapper.toJson(controller.reviewPayload(), config.outputPretty()));
        return EXIT_OK;
    }
}
