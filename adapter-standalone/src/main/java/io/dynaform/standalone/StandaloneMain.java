package io.dynaform.standalone;

import io.dynaform.standalone.app.FormRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone form runner.
 *
 * <p>Delegates to {@link FormRunner#start} for the full startup sequence. On failure, logs the
 * error and exits with a non-zero status code.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/dynaform.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = FormRunner.start(args, System::getenv, System.out);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
        if (exitCode != FormRunner.EXIT_OK) {
            System.exit(exitCode);
        }
    }
}
