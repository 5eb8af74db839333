package de.bsommerfeld.replyradar.notifier;

import com.google.inject.Singleton;
import de.bsommerfeld.replyradar.core.domain.ClassifiedItem;
import de.bsommerfeld.replyradar.core.domain.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * TEST mode notifier: writes what would have been sent to the log and
 * reports every delivery as successful.
 */
@Singleton
public class LoggingNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public int sendBatch(List<ClassifiedItem> items) {
        for (ClassifiedItem item : items) {
            LOG.info("[TEST] Would notify [{}] r/{} '{}' -> {}", item.type().key(), item.entry().sourceGroup(),
                    item.title(), item.verdict().replyDraft());
        }
        return items.size();
    }

    @Override
    public boolean sendSummary(RunSummary summary) {
        LOG.info("[TEST] Would send summary: {}", summary);
        return true;
    }
}
