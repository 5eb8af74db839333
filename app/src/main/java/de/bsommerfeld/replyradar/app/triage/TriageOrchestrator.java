package de.bsommerfeld.replyradar.app.triage;

import com.google.common.collect.Lists;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.replyradar.agent.BatchClassifier;
import de.bsommerfeld.replyradar.agent.ClassificationResult;
import de.bsommerfeld.replyradar.agent.ProviderSession;
import de.bsommerfeld.replyradar.core.config.ClassifierConfig;
import de.bsommerfeld.replyradar.core.config.QueueConfig;
import de.bsommerfeld.replyradar.core.domain.ClassifiedItem;
import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.domain.ItemType;
import de.bsommerfeld.replyradar.core.domain.QueueEntry;
import de.bsommerfeld.replyradar.core.domain.RunSummary;
import de.bsommerfeld.replyradar.core.event.ApplicationEventBus;
import de.bsommerfeld.replyradar.core.event.TriageEvents.ChunkCompletedEvent;
import de.bsommerfeld.replyradar.core.event.TriageEvents.RunCompletedEvent;
import de.bsommerfeld.replyradar.core.util.Sleeper;
import de.bsommerfeld.replyradar.notifier.Notifier;
import de.bsommerfeld.replyradar.reddit.ContentSource;
import de.bsommerfeld.replyradar.store.CheckpointStore;
import de.bsommerfeld.replyradar.store.PriorityQueueStore;
import de.bsommerfeld.replyradar.store.QueueStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives one triage run from fetching to the summary notification.
 *
 * <pre>
 * FETCH → PREFILTER → ENQUEUE → DEQUEUE → CLASSIFY_LOOP → ACK → SUMMARIZE → DONE
 * </pre>
 *
 * <h3>Delivery guarantees</h3>
 * Entries are taken from the queue with a non-destructive peek. Only after a
 * chunk has been classified are its ids added to the checkpoint (saved
 * immediately) and to the acknowledgement list. The queue is trimmed once,
 * at the end. A chunk that could not be classified simply stays queued for
 * the next run. An id leaves the queue only once a checkpoint save holding it
 * has succeeded; if every save fails, the entries are classified again next
 * run.
 *
 * <p>
 * If the process dies between a checkpoint save and the final removal, the
 * next run finds entries in the queue that the checkpoint already lists.
 * They are swept out before dequeuing, so they are never classified or
 * notified twice.
 *
 * <p>
 * Backlog ahead of fresh content: new items only enter the queue; what gets
 * classified is always the highest-scored part of the whole backlog.
 */
@Singleton
public class TriageOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(TriageOrchestrator.class);

    private final ContentSource contentSource;
    private final PrefilterEngine prefilter;
    private final PriorityQueueStore queueStore;
    private final CheckpointStore checkpointStore;
    private final BatchClassifier classifier;
    private final Notifier notifier;
    private final QueueConfig queueConfig;
    private final ClassifierConfig classifierConfig;
    private final Sleeper sleeper;
    private final ApplicationEventBus eventBus;

    @Inject
    public TriageOrchestrator(ContentSource contentSource, PrefilterEngine prefilter,
            PriorityQueueStore queueStore, CheckpointStore checkpointStore, BatchClassifier classifier,
            Notifier notifier, QueueConfig queueConfig, ClassifierConfig classifierConfig, Sleeper sleeper,
            ApplicationEventBus eventBus) {
        this.contentSource = contentSource;
        this.prefilter = prefilter;
        this.queueStore = queueStore;
        this.checkpointStore = checkpointStore;
        this.classifier = classifier;
        this.notifier = notifier;
        this.queueConfig = queueConfig;
        this.classifierConfig = classifierConfig;
        this.sleeper = sleeper;
        this.eventBus = eventBus;
    }

    public RunReport run() {
        RunReport report = new RunReport();

        // -- FETCH --
        enter(report, RunState.FETCH);
        List<Item> fetched = fetch();
        report.fetched = fetched.size();
        Set<String> processed = checkpointStore.load();

        // -- PREFILTER / ENQUEUE --
        if (!fetched.isEmpty()) {
            enter(report, RunState.PREFILTER);
            PrefilterResult filtered = prefilter.filter(fetched);
            report.kept = filtered.kept().size();

            enter(report, RunState.ENQUEUE);
            report.enqueued = queueStore.enqueue(filtered.kept(), processed);
            logQueueStats();
        } else {
            LOG.info("No new items fetched, working on the existing backlog");
        }

        // -- DEQUEUE --
        enter(report, RunState.DEQUEUE);
        report.purged = queueStore.purgeProcessed(processed);
        List<QueueEntry> entries = queueStore.peek(queueConfig.getItemsPerRun());
        report.dequeued = entries.size();
        if (entries.isEmpty()) {
            LOG.info("Queue is empty, nothing to classify");
            report.queueRemaining = queueStore.size();
            enter(report, RunState.DONE);
            return report;
        }

        // -- CLASSIFY_LOOP --
        enter(report, RunState.CLASSIFY_LOOP);
        Map<ItemType, Integer> totalByType = new EnumMap<>(ItemType.class);
        entries.forEach(e -> totalByType.merge(e.type(), 1, Integer::sum));
        Map<ItemType, Integer> relevantByType = new EnumMap<>(ItemType.class);
        List<String> ackIds = new ArrayList<>();
        // classified, but not yet confirmed on disk by a checkpoint save
        List<String> pendingAck = new ArrayList<>();

        ProviderSession session = new ProviderSession();
        List<List<QueueEntry>> chunks = Lists.partition(entries, classifierConfig.getChunkSize());
        LOG.info("Classifying {} entries in {} chunks of up to {}",
                entries.size(), chunks.size(), classifierConfig.getChunkSize());

        for (int i = 0; i < chunks.size(); i++) {
            List<QueueEntry> chunk = chunks.get(i);
            int chunkNumber = i + 1;
            ClassificationResult result = classifier.classify(chunk, chunkNumber, session);

            if (result.isClassified()) {
                List<ClassifiedItem> relevant = result.relevantItems(chunk);
                if (!relevant.isEmpty()) {
                    report.sent += notifier.sendBatch(relevant);
                    report.relevant += relevant.size();
                    relevant.forEach(r -> relevantByType.merge(r.type(), 1, Integer::sum));
                }
                for (QueueEntry entry : chunk) {
                    processed.add(entry.id());
                    pendingAck.add(entry.id());
                }
                if (checkpointStore.save(processed)) {
                    ackIds.addAll(pendingAck);
                    pendingAck.clear();
                } else {
                    LOG.warn("Chunk {}/{}: checkpoint not saved, {} entries stay queued until a save succeeds",
                            chunkNumber, chunks.size(), pendingAck.size());
                }
                report.processed += chunk.size();
                eventBus.post(new ChunkCompletedEvent(chunkNumber, chunk.size(), true, result.provider(),
                        relevant.size(), relevant.size() + " relevant"));
            } else {
                report.skippedChunks++;
                LOG.warn("Chunk {}/{} skipped ({}), {} entries stay queued",
                        chunkNumber, chunks.size(), result.skipReason(), chunk.size());
                eventBus.post(new ChunkCompletedEvent(chunkNumber, chunk.size(), false, result.provider(),
                        0, String.valueOf(result.skipReason())));
            }

            if (chunkNumber < chunks.size()) {
                sleeper.sleep(classifierConfig.getInterChunkDelay());
            }
        }

        report.lastProvider = session.lastProvider();
        report.primaryExhausted = session.isPrimaryExhausted();

        // -- ACK --
        enter(report, RunState.ACK);
        if (!pendingAck.isEmpty()) {
            LOG.warn("{} classified entries were never checkpointed and are kept in the queue", pendingAck.size());
        }
        if (!ackIds.isEmpty()) {
            queueStore.remove(ackIds);
        }
        report.queueRemaining = queueStore.size();

        // -- SUMMARIZE --
        enter(report, RunState.SUMMARIZE);
        RunSummary summary = new RunSummary(entries.size(), report.relevant, report.sent,
                report.queueRemaining, totalByType, relevantByType);
        if (report.relevant > 0) {
            report.summarySent = notifier.sendSummary(summary);
        } else {
            LOG.info("No relevant items this run, summary suppressed");
        }

        enter(report, RunState.DONE);
        eventBus.post(new RunCompletedEvent(summary, report.skippedChunks, report.summarySent,
                report.lastProvider));
        return report;
    }

    private List<Item> fetch() {
        try {
            List<Item> items = contentSource.fetchAllNewItems();
            return items != null ? items : List.of();
        } catch (RuntimeException e) {
            LOG.error("Content fetch failed, continuing with zero new items", e);
            return List.of();
        }
    }

    private void logQueueStats() {
        QueueStats stats = queueStore.stats();
        LOG.info("Queue: {} total (high {}, medium {}, low {}) - posts {}, comments {}, search {}",
                stats.total(),
                stats.count(QueueStats.ScoreBucket.HIGH),
                stats.count(QueueStats.ScoreBucket.MEDIUM),
                stats.count(QueueStats.ScoreBucket.LOW),
                stats.count(ItemType.POST), stats.count(ItemType.COMMENT), stats.count(ItemType.SEARCH));
    }

    private void enter(RunReport report, RunState state) {
        LOG.debug("{} -> {}", report.lastState, state);
        report.lastState = state;
    }
}
