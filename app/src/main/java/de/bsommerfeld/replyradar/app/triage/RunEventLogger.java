package de.bsommerfeld.replyradar.app.triage;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.replyradar.core.domain.RunSummary;
import de.bsommerfeld.replyradar.core.event.ApplicationEventBus;
import de.bsommerfeld.replyradar.core.event.TriageEvents.ChunkCompletedEvent;
import de.bsommerfeld.replyradar.core.event.TriageEvents.PrefilterCompletedEvent;
import de.bsommerfeld.replyradar.core.event.TriageEvents.RunCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes run events to the log. Registers itself on construction; bound
 * as eager singleton so it listens from the first event on.
 */
@Singleton
public class RunEventLogger {

    private static final Logger LOG = LoggerFactory.getLogger(RunEventLogger.class);

    @Inject
    public RunEventLogger(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onPrefilter(PrefilterCompletedEvent event) {
        LOG.debug("[event] prefilter kept {}/{}", event.kept(), event.input());
    }

    @Subscribe
    public void onChunk(ChunkCompletedEvent event) {
        if (event.classified()) {
            LOG.info("[event] chunk {} ({} items) classified by {}: {}",
                    event.chunkNumber(), event.size(), event.provider(), event.detail());
        } else {
            LOG.warn("[event] chunk {} ({} items) skipped: {}", event.chunkNumber(), event.size(), event.detail());
        }
    }

    @Subscribe
    public void onRunCompleted(RunCompletedEvent event) {
        RunSummary summary = event.summary();
        LOG.info("[event] run completed: {} processed, {} relevant, {} sent, {} queued, {} chunks skipped, summary {}, "
                + "last provider {}",
                summary.total(), summary.relevant(), summary.sent(), summary.queueRemaining(),
                event.skippedChunks(), event.summarySent() ? "sent" : "not sent",
                event.lastProvider() != null ? event.lastProvider() : "none");
    }
}
