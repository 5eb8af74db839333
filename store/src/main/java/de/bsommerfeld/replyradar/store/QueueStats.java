package de.bsommerfeld.replyradar.store;

import de.bsommerfeld.replyradar.core.domain.ItemType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of the pending queue, logged after every enqueue.
 */
public record QueueStats(int total, Map<ItemType, Integer> byType, Map<ScoreBucket, Integer> byScoreBucket) {

    public QueueStats {
        EnumMap<ItemType, Integer> types = new EnumMap<>(ItemType.class);
        types.putAll(byType);
        EnumMap<ScoreBucket, Integer> buckets = new EnumMap<>(ScoreBucket.class);
        buckets.putAll(byScoreBucket);
        byType = Collections.unmodifiableMap(types);
        byScoreBucket = Collections.unmodifiableMap(buckets);
    }

    public int count(ItemType type) {
        return byType.getOrDefault(type, 0);
    }

    public int count(ScoreBucket bucket) {
        return byScoreBucket.getOrDefault(bucket, 0);
    }

    /** Coarse relevance bands used for reporting only. */
    public enum ScoreBucket {
        HIGH,
        MEDIUM,
        LOW;

        public static ScoreBucket of(int score) {
            if (score >= 3) {
                return HIGH;
            }
            return score >= 1 ? MEDIUM : LOW;
        }
    }
}
