package de.bsommerfeld.replyradar.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.replyradar.core.domain.QueueEntry;

import java.util.List;

/**
 * On-disk shape of the pending queue file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record QueueDocument(
        @JsonProperty("queue") List<QueueEntry> queue,
        @JsonProperty("last_updated") String lastUpdated) {

    QueueDocument {
        queue = queue == null ? List.of() : List.copyOf(queue);
    }
}
