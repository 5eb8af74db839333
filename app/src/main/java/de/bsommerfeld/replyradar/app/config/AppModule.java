package de.bsommerfeld.replyradar.app.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Names;
import de.bsommerfeld.replyradar.agent.ClassifierBackends;
import de.bsommerfeld.replyradar.app.triage.RunEventLogger;
import de.bsommerfeld.replyradar.core.config.ApplicationMode;
import de.bsommerfeld.replyradar.core.config.ClassifierConfig;
import de.bsommerfeld.replyradar.core.config.ConfigLoader;
import de.bsommerfeld.replyradar.core.config.Credentials;
import de.bsommerfeld.replyradar.core.config.FilterConfig;
import de.bsommerfeld.replyradar.core.config.GlobalConfig;
import de.bsommerfeld.replyradar.core.config.NotifierConfig;
import de.bsommerfeld.replyradar.core.config.QueueConfig;
import de.bsommerfeld.replyradar.core.config.RedditConfig;
import de.bsommerfeld.replyradar.core.util.Sleeper;
import de.bsommerfeld.replyradar.core.util.StorageUtils;
import de.bsommerfeld.replyradar.notifier.FeishuNotifier;
import de.bsommerfeld.replyradar.notifier.LoggingNotifier;
import de.bsommerfeld.replyradar.notifier.Notifier;
import de.bsommerfeld.replyradar.reddit.ContentSource;
import de.bsommerfeld.replyradar.reddit.RedditContentSource;
import de.bsommerfeld.replyradar.reddit.TestContentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice module wiring configuration, stores and the mode dependent
 * collaborators.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final ApplicationMode mode;
    private final Path appDataDir;
    private final Credentials credentials;

    public AppModule(ApplicationMode mode) {
        this(mode, StorageUtils.getAppDataDir(StorageUtils.APP_NAME), Credentials.fromEnvironment());
    }

    public AppModule(ApplicationMode mode, Path appDataDir, Credentials credentials) {
        this.mode = mode;
        this.appDataDir = appDataDir;
        this.credentials = credentials;
    }

    @Override
    protected void configure() {
        // Load Configuration
        try {
            if (!Files.exists(appDataDir)) {
                Files.createDirectories(appDataDir);
            }
            Path configPath = appDataDir.resolve("config.toml");
            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());

            GlobalConfig config = ConfigLoader.load(configPath);

            bind(GlobalConfig.class).toInstance(config);
            bind(RedditConfig.class).toInstance(config.getReddit());
            bind(FilterConfig.class).toInstance(config.getFilter());
            bind(QueueConfig.class).toInstance(config.getQueue());
            bind(ClassifierConfig.class).toInstance(config.getClassifier());
            bind(NotifierConfig.class).toInstance(config.getNotifier());

            bind(Path.class).annotatedWith(Names.named("data-dir")).toInstance(resolveDataDir(config.getQueue()));
        } catch (Exception e) {
            throw new RuntimeException("Failed to load Application Configuration", e);
        }

        bind(ApplicationMode.class).toInstance(mode);
        bind(Credentials.class).toInstance(credentials);
        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(Sleeper.class).toInstance(Sleeper.system());

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            // Offline: no Reddit, no model calls, no webhook
            bind(ContentSource.class).to(TestContentSource.class);
            bind(Notifier.class).to(LoggingNotifier.class);
        } else {
            bind(ContentSource.class).to(RedditContentSource.class);
            bind(Notifier.class).to(FeishuNotifier.class);
        }

        bind(RunEventLogger.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    ClassifierBackends provideClassifierBackends(ClassifierConfig config) {
        if (mode.isTest()) {
            return ClassifierBackends.offline();
        }
        return ClassifierBackends.fromCredentials(config, credentials);
    }

    /**
     * TEST mode keeps its queue apart from real data unless a directory is
     * configured explicitly.
     */
    private Path resolveDataDir(QueueConfig queueConfig) {
        if (mode.isTest() && queueConfig.getDataDir().isBlank()) {
            return appDataDir.resolve("test-data");
        }
        return queueConfig.resolveDataDir(appDataDir);
    }
}
