package de.bsommerfeld.replyradar.core.event;

import de.bsommerfeld.replyradar.core.domain.RunSummary;

/**
 * Events posted on the {@link ApplicationEventBus} while a triage run
 * progresses.
 */
public final class TriageEvents {

    private TriageEvents() {
    }

    public record PrefilterCompletedEvent(int input, int kept, int droppedByAge, int droppedByKeyword) {
    }

    /**
     * @param chunkNumber 1-based chunk counter within the run
     * @param classified  {@code false} if the chunk was skipped and stays queued
     * @param provider    backend that produced the verdicts, {@code null} when skipped
     * @param detail      skip reason or relevant count, human readable
     */
    public record ChunkCompletedEvent(int chunkNumber, int size, boolean classified, String provider,
            int relevant, String detail) {
    }

    /**
     * @param lastProvider backend that answered the last classified chunk,
     *                     {@code null} if none did
     */
    public record RunCompletedEvent(RunSummary summary, int skippedChunks, boolean summarySent,
            String lastProvider) {
    }
}
