package de.bsommerfeld.replyradar.app.triage;

import de.bsommerfeld.replyradar.core.domain.Item;

import java.util.List;

/**
 * @param kept             surviving items in their original order
 * @param droppedByAge     items older than the configured maximum age
 * @param droppedByKeyword items matching an exclusion phrase
 */
public record PrefilterResult(List<Item> kept, int droppedByAge, int droppedByKeyword) {

    public PrefilterResult {
        kept = List.copyOf(kept);
    }

    public int dropped() {
        return droppedByAge + droppedByKeyword;
    }
}
