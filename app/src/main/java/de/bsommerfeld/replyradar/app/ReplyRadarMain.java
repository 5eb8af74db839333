package de.bsommerfeld.replyradar.app;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.replyradar.app.config.AppModule;
import de.bsommerfeld.replyradar.app.config.MissingConfigurationException;
import de.bsommerfeld.replyradar.app.config.StartupCheck;
import de.bsommerfeld.replyradar.app.triage.RunReport;
import de.bsommerfeld.replyradar.app.triage.TriageOrchestrator;
import de.bsommerfeld.replyradar.core.config.ApplicationMode;
import de.bsommerfeld.replyradar.core.config.Credentials;
import de.bsommerfeld.replyradar.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point. Performs a single triage run and exits; scheduling is left
 * to cron or CI.
 *
 * <p>
 * Exit status is 0 after a run, including runs with skipped chunks, and 1
 * when a startup precondition is missing.
 */
public final class ReplyRadarMain {

    static {
        // Initialize Logging Directory via StorageUtils
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReplyRadarMain.class);

    private ReplyRadarMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        ApplicationMode mode = ApplicationMode.resolve(args);
        Credentials credentials = Credentials.fromEnvironment();
        LOG.info("Reply Radar starting in {} mode ({})", mode, credentials);

        try {
            StartupCheck.verify(mode, credentials);
        } catch (MissingConfigurationException e) {
            LOG.error("Startup aborted: {}", e.getMessage());
            return 1;
        }

        Injector injector;
        try {
            injector = Guice.createInjector(new AppModule(mode,
                    StorageUtils.getAppDataDir(StorageUtils.APP_NAME), credentials));
        } catch (CreationException e) {
            LOG.error("Startup aborted: could not wire the application", e);
            return 1;
        }

        RunReport report = injector.getInstance(TriageOrchestrator.class).run();
        LOG.info("Run finished: {}", report);
        return 0;
    }
}
