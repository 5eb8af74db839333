package de.bsommerfeld.replyradar.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * On-disk shape written by {@link CheckpointStore}. Reading is more lenient
 * and goes through the raw JSON tree.
 */
record CheckpointDocument(
        @JsonProperty("processed_ids") List<String> processedIds,
        @JsonProperty("last_updated") String lastUpdated) {
}
