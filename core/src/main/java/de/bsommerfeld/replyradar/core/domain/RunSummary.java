package de.bsommerfeld.replyradar.core.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate figures of one triage run, sent as a single summary
 * notification when at least one relevant item was found.
 *
 * @param total          number of queue entries taken into this run
 * @param relevant       number of entries judged relevant
 * @param sent           number of item notifications delivered
 * @param queueRemaining queue size after acknowledging processed entries
 * @param totalByType    entries taken into this run per item type
 * @param relevantByType relevant count per item type
 */
public record RunSummary(int total, int relevant, int sent, int queueRemaining,
        Map<ItemType, Integer> totalByType, Map<ItemType, Integer> relevantByType) {

    public RunSummary {
        totalByType = copy(totalByType);
        relevantByType = copy(relevantByType);
    }

    public int totalOf(ItemType type) {
        return totalByType.getOrDefault(type, 0);
    }

    public int relevantOf(ItemType type) {
        return relevantByType.getOrDefault(type, 0);
    }

    private static Map<ItemType, Integer> copy(Map<ItemType, Integer> source) {
        EnumMap<ItemType, Integer> copy = new EnumMap<>(ItemType.class);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }
}
