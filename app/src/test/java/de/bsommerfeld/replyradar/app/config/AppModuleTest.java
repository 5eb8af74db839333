package de.bsommerfeld.replyradar.app.config;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import com.google.inject.util.Modules;
import de.bsommerfeld.replyradar.agent.ClassifierBackends;
import de.bsommerfeld.replyradar.app.triage.RunReport;
import de.bsommerfeld.replyradar.app.triage.RunState;
import de.bsommerfeld.replyradar.app.triage.TriageOrchestrator;
import de.bsommerfeld.replyradar.core.config.ApplicationMode;
import de.bsommerfeld.replyradar.core.config.Credentials;
import de.bsommerfeld.replyradar.core.util.Sleeper;
import de.bsommerfeld.replyradar.notifier.FeishuNotifier;
import de.bsommerfeld.replyradar.notifier.LoggingNotifier;
import de.bsommerfeld.replyradar.notifier.Notifier;
import de.bsommerfeld.replyradar.reddit.ContentSource;
import de.bsommerfeld.replyradar.reddit.RedditContentSource;
import de.bsommerfeld.replyradar.reddit.TestContentSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppModuleTest {

    @TempDir
    Path appDir;

    private Injector testInjector() {
        AppModule module = new AppModule(ApplicationMode.TEST, appDir, new Credentials(null, null, null));
        return Guice.createInjector(Modules.override(module).with(new AbstractModule() {
            @Override
            protected void configure() {
                bind(Sleeper.class).toInstance(Sleeper.noop());
            }
        }));
    }

    @Test
    void testMode_shouldBindOfflineCollaboratorsAndWriteDefaultConfig() {
        Injector injector = testInjector();

        assertInstanceOf(TestContentSource.class, injector.getInstance(ContentSource.class));
        assertInstanceOf(LoggingNotifier.class, injector.getInstance(Notifier.class));
        assertEquals("test", injector.getInstance(ClassifierBackends.class).primary().orElseThrow().name());
        assertTrue(Files.exists(appDir.resolve("config.toml")));
        assertEquals(appDir.resolve("test-data"),
                injector.getInstance(Key.get(Path.class, Names.named("data-dir"))));
    }

    @Test
    void prodMode_shouldBindRealCollaborators() {
        Injector injector = Guice.createInjector(new AppModule(ApplicationMode.PROD, appDir,
                new Credentials("gemini-key", null, "http://127.0.0.1:9/hook")));

        assertInstanceOf(FeishuNotifier.class, injector.getInstance(Notifier.class));
        assertInstanceOf(RedditContentSource.class, injector.getInstance(ContentSource.class));
        assertTrue(injector.getInstance(ClassifierBackends.class).secondary().isEmpty());
        assertEquals(appDir.resolve("data"), injector.getInstance(Key.get(Path.class, Names.named("data-dir"))));
    }

    @Test
    void testMode_fullRun_shouldCompleteOffline() {
        TriageOrchestrator orchestrator = testInjector().getInstance(TriageOrchestrator.class);

        RunReport report = orchestrator.run();

        assertEquals(RunState.DONE, report.lastState);
        assertTrue(report.processed > 0);
        assertTrue(report.relevant > 0);
        assertEquals(0, report.skippedChunks);
        assertTrue(Files.exists(appDir.resolve("test-data").resolve("processed_posts.json")));
    }
}
