package de.bsommerfeld.replyradar.core.domain;

/**
 * A queued entry that the classifier judged relevant, merged with its
 * verdict. This is what the notifier renders.
 */
public record ClassifiedItem(QueueEntry entry, ClassificationVerdict verdict) {

    public ItemType type() {
        return entry.type();
    }

    public String title() {
        return entry.title();
    }
}
