package de.bsommerfeld.replyradar.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.replyradar.core.config.FilterConfig;
import de.bsommerfeld.replyradar.core.config.QueueConfig;
import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.domain.ItemType;
import de.bsommerfeld.replyradar.core.domain.QueueEntry;
import de.bsommerfeld.replyradar.core.util.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable, de-duplicated backlog of items waiting for classification,
 * ordered by relevance score.
 *
 * <p>
 * The whole queue lives in a single JSON document
 * ({@code {"queue": [...], "last_updated": ...}}). Every mutating operation
 * reads the file, applies the change in memory and writes the complete
 * document back through a temp file and an atomic rename. There is no
 * in-memory cache between calls: the file is the only state, so a failed
 * write leaves the previous content untouched and nothing needs to be
 * rolled back in memory.
 *
 * <p>
 * Ordering: entries are kept sorted by {@code relevance_score} descending.
 * The sort is stable, so entries with equal scores keep their insertion
 * order and older items are not starved by newer ones of the same score.
 *
 * <p>
 * Not thread-safe. A single run owns the file for its whole duration.
 */
@Singleton
public class PriorityQueueStore {

    private static final Logger LOG = LoggerFactory.getLogger(PriorityQueueStore.class);

    private static final Comparator<QueueEntry> BY_SCORE_DESC = Comparator
            .comparingInt(QueueEntry::relevanceScore).reversed();

    private final Path file;
    private final List<String> relevanceKeywords;
    private final Clock clock;
    private final ObjectMapper mapper = JsonFiles.createMapper();

    public PriorityQueueStore(Path file, List<String> relevanceKeywords, Clock clock) {
        this.file = file;
        this.relevanceKeywords = List.copyOf(relevanceKeywords);
        this.clock = clock;
    }

    @Inject
    public PriorityQueueStore(@Named("data-dir") Path dataDir, QueueConfig queueConfig,
            FilterConfig filterConfig, Clock clock) {
        this(dataDir.resolve(queueConfig.getQueueFile()), filterConfig.getRelevanceKeywords(), clock);
    }

    // =====================================================================
    // Operations
    // =====================================================================

    /**
     * Adds new items to the queue, scoring each by the number of relevance
     * keywords found in its title and content.
     *
     * <p>
     * An item is skipped when its effective id is blank, already queued,
     * already processed, or repeated earlier in the same batch. Enqueuing
     * the same batch twice therefore adds nothing the second time.
     *
     * @param items            candidates in source order
     * @param alreadyProcessed ids from the checkpoint
     * @return number of entries actually added; 0 if the write failed
     */
    public int enqueue(List<Item> items, Set<String> alreadyProcessed) {
        List<QueueEntry> entries = new ArrayList<>(readQueue());
        Set<String> known = new HashSet<>();
        entries.forEach(e -> known.add(e.id()));

        Instant now = clock.instant();
        int added = 0;
        for (Item item : items) {
            String id = item.effectiveId();
            if (Strings.isNullOrEmpty(id) || id.isBlank()) {
                LOG.debug("Skipping item without id or link: '{}'", item.title());
                continue;
            }
            if (alreadyProcessed.contains(id) || !known.add(id)) {
                continue;
            }
            int score = KeywordMatcher.countMatches(item.searchableText(), relevanceKeywords);
            entries.add(QueueEntry.of(item, score, now));
            added++;
        }

        if (added == 0) {
            return 0;
        }

        entries.sort(BY_SCORE_DESC);
        if (!writeQueue(entries)) {
            return 0;
        }
        LOG.info("Enqueued {} new items ({} offered, queue size {})", added, items.size(), entries.size());
        return added;
    }

    /**
     * Returns the first {@code n} entries in priority order without removing
     * them. Entries only leave the queue through {@link #remove(Collection)}.
     */
    public List<QueueEntry> peek(int n) {
        if (n <= 0) {
            return List.of();
        }
        List<QueueEntry> entries = readQueue();
        return List.copyOf(entries.subList(0, Math.min(n, entries.size())));
    }

    /**
     * Deletes every entry whose id is in {@code ids}. Unknown ids are
     * ignored. The file is only rewritten when something matched.
     *
     * @return number of entries removed; 0 if the write failed
     */
    public int remove(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        Set<String> toRemove = new HashSet<>(ids);
        return removeWhere(toRemove, "acknowledged");
    }

    /**
     * Drops entries already recorded as processed. Such entries appear
     * when a previous run saved its checkpoint but died before removing the
     * classified entries from the queue.
     *
     * @return number of stale entries removed
     */
    public int purgeProcessed(Set<String> processedIds) {
        if (processedIds.isEmpty()) {
            return 0;
        }
        return removeWhere(processedIds, "already processed");
    }

    public QueueStats stats() {
        List<QueueEntry> entries = readQueue();
        Map<ItemType, Integer> byType = new EnumMap<>(ItemType.class);
        Map<QueueStats.ScoreBucket, Integer> byBucket = new EnumMap<>(QueueStats.ScoreBucket.class);
        for (QueueEntry entry : entries) {
            byType.merge(entry.type(), 1, Integer::sum);
            byBucket.merge(QueueStats.ScoreBucket.of(entry.relevanceScore()), 1, Integer::sum);
        }
        return new QueueStats(entries.size(), byType, byBucket);
    }

    public int size() {
        return readQueue().size();
    }

    public Path getFile() {
        return file;
    }

    // =====================================================================
    // File access
    // =====================================================================

    private int removeWhere(Set<String> ids, String why) {
        List<QueueEntry> entries = readQueue();
        List<QueueEntry> kept = new ArrayList<>(entries.size());
        for (QueueEntry entry : entries) {
            if (!ids.contains(entry.id())) {
                kept.add(entry);
            }
        }

        int removed = entries.size() - kept.size();
        if (removed == 0) {
            return 0;
        }
        if (!writeQueue(kept)) {
            return 0;
        }
        LOG.info("Removed {} {} entries from queue ({} remaining)", removed, why, kept.size());
        return removed;
    }

    private List<QueueEntry> readQueue() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            QueueDocument document = mapper.readValue(file.toFile(), QueueDocument.class);
            return document == null ? List.of() : document.queue();
        } catch (IOException e) {
            LOG.error("Failed to read queue file {}, starting with an empty queue", file, e);
            JsonFiles.quarantine(file, clock.millis());
            return List.of();
        }
    }

    private boolean writeQueue(List<QueueEntry> entries) {
        try {
            JsonFiles.writeAtomically(mapper, file, new QueueDocument(entries, clock.instant().toString()));
            return true;
        } catch (IOException e) {
            LOG.error("Failed to persist queue file {}, keeping previous content", file, e);
            return false;
        }
    }
}
