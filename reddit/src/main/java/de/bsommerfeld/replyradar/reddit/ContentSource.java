package de.bsommerfeld.replyradar.reddit;

import de.bsommerfeld.replyradar.core.domain.Item;

import java.util.List;

/**
 * Supplier of fresh community content for one triage run.
 */
public interface ContentSource {

    /**
     * Fetches everything new across all configured feeds. Implementations
     * contain per-feed failures: a broken feed contributes nothing, the
     * others still deliver.
     *
     * @return items de-duplicated by id, in feed order; never {@code null}
     */
    List<Item> fetchAllNewItems();
}
