package de.bsommerfeld.replyradar.notifier;

import de.bsommerfeld.replyradar.core.domain.ClassifiedItem;
import de.bsommerfeld.replyradar.core.domain.RunSummary;

import java.util.List;

/**
 * Delivers relevant items and the run summary to humans. Delivery is
 * best-effort: failures are logged and counted, never thrown.
 */
public interface Notifier {

    /**
     * Sends one message per item. A failed item does not stop the others.
     *
     * @return number of items delivered successfully
     */
    int sendBatch(List<ClassifiedItem> items);

    /**
     * Sends the run summary.
     *
     * @return {@code true} if the endpoint acknowledged it
     */
    boolean sendSummary(RunSummary summary);
}
