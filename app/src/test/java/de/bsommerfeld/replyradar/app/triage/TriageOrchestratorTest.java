package de.bsommerfeld.replyradar.app.triage;

import de.bsommerfeld.replyradar.agent.BatchClassifier;
import de.bsommerfeld.replyradar.agent.ClassifierBackend;
import de.bsommerfeld.replyradar.agent.ClassifierBackends;
import de.bsommerfeld.replyradar.core.config.ClassifierConfig;
import de.bsommerfeld.replyradar.core.config.FilterConfig;
import de.bsommerfeld.replyradar.core.config.QueueConfig;
import de.bsommerfeld.replyradar.core.domain.ClassifiedItem;
import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.domain.ItemType;
import de.bsommerfeld.replyradar.core.domain.RunSummary;
import de.bsommerfeld.replyradar.core.event.ApplicationEventBus;
import de.bsommerfeld.replyradar.notifier.Notifier;
import de.bsommerfeld.replyradar.reddit.ContentSource;
import de.bsommerfeld.replyradar.store.CheckpointStore;
import de.bsommerfeld.replyradar.store.PriorityQueueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TriageOrchestratorTest {

    private static final String ONE_RELEVANT = """
            [{"index": 3, "is_relevant": true, "reason": "beginner", "reply_draft": "hey"}]
            """;
    private static final String TWO_RELEVANT = """
            ```json
            [{"index": 0, "is_relevant": true, "reason": "no-code", "reply_draft": "a"},
             {"index": 7, "is_relevant": true, "reason": "stuck", "reply_draft": "b"},
             {"index": 8, "is_relevant": false, "reason": "showcase", "reply_draft": ""}]
            ```
            """;

    @TempDir
    Path dataDir;

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-08T12:00:00Z"), ZoneOffset.UTC);
    private final List<Duration> sleeps = new ArrayList<>();

    private ContentSource contentSource;
    private ClassifierBackend backend;
    private Notifier notifier;
    private PriorityQueueStore queueStore;
    private CheckpointStore checkpointStore;

    @BeforeEach
    void setUp() {
        contentSource = mock(ContentSource.class);
        backend = mock(ClassifierBackend.class);
        when(backend.name()).thenReturn("gemini");
        notifier = mock(Notifier.class);
        when(notifier.sendBatch(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());
        when(notifier.sendSummary(any())).thenReturn(true);

        queueStore = new PriorityQueueStore(dataDir.resolve("pending_queue.json"),
                new FilterConfig().getRelevanceKeywords(), clock);
        checkpointStore = new CheckpointStore(dataDir.resolve("processed_posts.json"), 5000, clock);
    }

    private TriageOrchestrator orchestrator() {
        ClassifierConfig classifierConfig = new ClassifierConfig();
        ApplicationEventBus eventBus = new ApplicationEventBus();
        return new TriageOrchestrator(contentSource,
                new PrefilterEngine(new FilterConfig(), clock, eventBus),
                queueStore, checkpointStore,
                new BatchClassifier(classifierConfig, new ClassifierBackends(backend, null), sleeps::add),
                notifier, new QueueConfig(), classifierConfig, sleeps::add, eventBus);
    }

    private static List<Item> items(int count) {
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(new Item("t3_q" + i, ItemType.POST, "gamedev", "Question " + i, "Some text",
                    "https://reddit.com/r/gamedev/q" + i, "user" + i));
        }
        return items;
    }

    @Test
    void run_fortyFiveItems_shouldProcessFortyAndKeepFiveQueued() throws Exception {
        when(contentSource.fetchAllNewItems()).thenReturn(items(45));
        when(backend.complete(anyString())).thenReturn(ONE_RELEVANT, TWO_RELEVANT);

        RunReport report = orchestrator().run();

        assertEquals(45, report.fetched);
        assertEquals(45, report.enqueued);
        assertEquals(40, report.processed);
        assertEquals(3, report.relevant);
        assertEquals(3, report.sent);
        assertEquals(0, report.skippedChunks);
        assertEquals(5, report.queueRemaining);
        assertTrue(report.summarySent);
        assertEquals(RunState.DONE, report.lastState);
        assertEquals("gemini", report.lastProvider);
        assertFalse(report.primaryExhausted);

        assertEquals(40, checkpointStore.load().size());
        assertEquals(5, queueStore.size());
        assertEquals("t3_q40", queueStore.peek(1).get(0).id());

        ArgumentCaptor<RunSummary> summary = ArgumentCaptor.forClass(RunSummary.class);
        verify(notifier, times(1)).sendSummary(summary.capture());
        assertEquals(40, summary.getValue().total());
        assertEquals(3, summary.getValue().relevant());
        assertEquals(5, summary.getValue().queueRemaining());
        assertEquals(3, summary.getValue().relevantOf(ItemType.POST));
        assertEquals(40, summary.getValue().totalOf(ItemType.POST));

        // only between the two chunks
        assertEquals(List.of(Duration.ofSeconds(15)), sleeps);
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_relevantItems_shouldBeNotifiedPerChunkInVerdictOrder() throws Exception {
        when(contentSource.fetchAllNewItems()).thenReturn(items(40));
        when(backend.complete(anyString())).thenReturn(ONE_RELEVANT, TWO_RELEVANT);

        orchestrator().run();

        ArgumentCaptor<List<ClassifiedItem>> batches = ArgumentCaptor.forClass(List.class);
        verify(notifier, times(2)).sendBatch(batches.capture());
        assertEquals("t3_q3", batches.getAllValues().get(0).get(0).entry().id());
        assertEquals(List.of("t3_q20", "t3_q27"),
                batches.getAllValues().get(1).stream().map(c -> c.entry().id()).toList());
    }

    @Test
    void run_malformedResponse_shouldLeaveChunkQueued() throws Exception {
        when(contentSource.fetchAllNewItems()).thenReturn(items(40));
        when(backend.complete(anyString())).thenReturn(ONE_RELEVANT, "Sorry, I cannot help with that.");

        RunReport report = orchestrator().run();

        assertEquals(1, report.skippedChunks);
        assertEquals(20, report.processed);
        assertEquals(20, report.queueRemaining);
        Set<String> processed = checkpointStore.load();
        assertEquals(20, processed.size());
        assertFalse(processed.contains("t3_q20"));
        assertEquals("t3_q20", queueStore.peek(1).get(0).id());
        verify(notifier, times(1)).sendSummary(any());
    }

    @Test
    void run_nothingRelevant_shouldSuppressSummary() throws Exception {
        when(contentSource.fetchAllNewItems()).thenReturn(items(10));
        when(backend.complete(anyString())).thenReturn("[{\"index\": 0, \"is_relevant\": false}]");

        RunReport report = orchestrator().run();

        assertEquals(10, report.processed);
        assertEquals(0, report.queueRemaining);
        assertFalse(report.summarySent);
        verify(notifier, never()).sendBatch(anyList());
        verify(notifier, never()).sendSummary(any());
    }

    @Test
    void run_emptyFetchAndEmptyQueue_shouldFinishWithoutClassifying() throws Exception {
        when(contentSource.fetchAllNewItems()).thenReturn(List.of());

        RunReport report = orchestrator().run();

        assertEquals(RunState.DONE, report.lastState);
        assertEquals(0, report.dequeued);
        verify(backend, never()).complete(anyString());
        verifyNoInteractions(notifier);
    }

    @Test
    void run_fetchFailure_shouldStillWorkOffBacklog() throws Exception {
        queueStore.enqueue(items(3), Set.of());
        when(contentSource.fetchAllNewItems()).thenThrow(new IllegalStateException("reddit down"));
        when(backend.complete(anyString())).thenReturn("[{\"index\": 1, \"is_relevant\": true}]");

        RunReport report = orchestrator().run();

        assertEquals(0, report.fetched);
        assertEquals(3, report.processed);
        assertEquals(1, report.relevant);
        assertEquals(0, queueStore.size());
    }

    @Test
    void run_entriesAlreadyCheckpointed_shouldBeSweptBeforeClassifying() throws Exception {
        // state left behind by a run that died between checkpoint save and queue removal
        queueStore.enqueue(items(3), Set.of());
        checkpointStore.save(Set.of("t3_q0", "t3_q1"));
        when(contentSource.fetchAllNewItems()).thenReturn(List.of());
        when(backend.complete(anyString())).thenReturn("[{\"index\": 0, \"is_relevant\": false}]");

        RunReport report = orchestrator().run();

        assertEquals(2, report.purged);
        assertEquals(1, report.dequeued);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(backend).complete(prompt.capture());
        assertTrue(prompt.getValue().contains("Question 2"));
        assertFalse(prompt.getValue().contains("Question 0"));
        assertEquals(3, checkpointStore.load().size());
    }

    @Test
    void run_checkpointUnwritable_shouldKeepNotifiedEntriesQueued() throws Exception {
        // a regular file where the checkpoint directory should be
        Path blocker = Files.writeString(dataDir.resolve("blocker"), "not a directory");
        checkpointStore = new CheckpointStore(blocker.resolve("processed_posts.json"), 5000, clock);
        when(contentSource.fetchAllNewItems()).thenReturn(items(10));
        when(backend.complete(anyString())).thenReturn("[{\"index\": 4, \"is_relevant\": true}]");

        RunReport first = orchestrator().run();

        assertEquals(10, first.processed);
        assertEquals(1, first.sent);
        assertEquals(10, first.queueRemaining);
        assertEquals(10, queueStore.size());
        assertTrue(checkpointStore.load().isEmpty());

        RunReport second = orchestrator().run();

        assertEquals(0, second.enqueued);
        assertEquals(10, queueStore.size());
    }

    @Test
    void run_checkpointSaveFailsOnceThenRecovers_shouldAckBothChunks() throws Exception {
        checkpointStore = spy(checkpointStore);
        doReturn(false).doCallRealMethod().when(checkpointStore).save(any());
        when(contentSource.fetchAllNewItems()).thenReturn(items(40));
        when(backend.complete(anyString())).thenReturn(ONE_RELEVANT, TWO_RELEVANT);

        RunReport report = orchestrator().run();

        assertEquals(0, report.queueRemaining);
        assertEquals(40, checkpointStore.load().size());
        verify(checkpointStore, times(2)).save(any());
    }
}
