package io.defcheck.cli;

import io.defcheck.cli.app.CheckerApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the defcheck command line tool.
 *
 * <p>
 * Delegates to {@link CheckerApp#run(String[])} and exits with its status. Any
 * failure outside the per-schema handling (bad arguments, unreadable
 * configuration, no documents) is logged and exits with status 1.
 */
public final class DefcheckMain {

    private static final Logger LOG = LoggerFactory.getLogger(DefcheckMain.class);

    private DefcheckMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments, see {@link CliArguments}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = CheckerApp.run(args);
        } catch (Exception e) {
            LOG.error("defcheck failed: {}", e.getMessage(), e);
            status = 1;
        }
        System.exit(status);
    }
}
