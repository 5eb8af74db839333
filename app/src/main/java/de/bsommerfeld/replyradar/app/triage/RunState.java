package de.bsommerfeld.replyradar.app.triage;

/**
 * Phases of a triage run, in order.
 */
public enum RunState {
    FETCH,
    PREFILTER,
    ENQUEUE,
    DEQUEUE,
    CLASSIFY_LOOP,
    ACK,
    SUMMARIZE,
    DONE
}
