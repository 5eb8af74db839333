package de.bsommerfeld.replyradar.app.triage;

/**
 * Figures collected while a run progresses. Fields are mutable and
 * public; the orchestrator fills them in as it goes.
 */
public class RunReport {
    public int fetched = 0;
    public int kept = 0;
    public int enqueued = 0;
    public int purged = 0;
    public int dequeued = 0;
    public int processed = 0;
    public int relevant = 0;
    public int sent = 0;
    public int skippedChunks = 0;
    public int queueRemaining = 0;
    public boolean summarySent = false;
    public String lastProvider = null;
    public boolean primaryExhausted = false;
    public RunState lastState = RunState.FETCH;

    @Override
    public String toString() {
        return String.format(
                "RunReport{fetched=%d, kept=%d, enqueued=%d, purged=%d, dequeued=%d, processed=%d, relevant=%d, "
                        + "sent=%d, skippedChunks=%d, queueRemaining=%d, summarySent=%s, lastProvider=%s, "
                        + "primaryExhausted=%s}",
                fetched, kept, enqueued, purged, dequeued, processed, relevant, sent, skippedChunks,
                queueRemaining, summarySent, lastProvider, primaryExhausted);
    }
}
