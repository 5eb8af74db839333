package de.bsommerfeld.replyradar.agent;

import de.bsommerfeld.replyradar.core.domain.ClassificationVerdict;
import de.bsommerfeld.replyradar.core.domain.ClassifiedItem;
import de.bsommerfeld.replyradar.core.domain.QueueEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of classifying one chunk.
 *
 * <p>
 * A {@link Outcome#SKIPPED} chunk was never judged: its entries must stay
 * in the queue and must not be checkpointed, so they get another chance in
 * a later run.
 *
 * @param outcome    whether verdicts were produced
 * @param skipReason why the chunk was skipped, {@code null} when classified
 * @param provider   backend that answered, {@code null} if none did
 * @param verdicts   validated verdicts, empty when skipped
 */
public record ClassificationResult(Outcome outcome, SkipReason skipReason, String provider,
        List<ClassificationVerdict> verdicts) {

    public enum Outcome {
        CLASSIFIED,
        SKIPPED
    }

    public enum SkipReason {
        /** No credential for the provider that would have to answer. */
        NO_PROVIDER,
        /** The answer contained no usable verdict array. */
        PARSE_FAILURE,
        /** Quota exhausted with no provider left to fail over to. */
        QUOTA_EXHAUSTED,
        /** Any other provider error. */
        PROVIDER_ERROR,
        EMPTY_CHUNK
    }

    public ClassificationResult {
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
    }

    public static ClassificationResult classified(String provider, List<ClassificationVerdict> verdicts) {
        return new ClassificationResult(Outcome.CLASSIFIED, null, provider, verdicts);
    }

    public static ClassificationResult skipped(SkipReason reason, String provider) {
        return new ClassificationResult(Outcome.SKIPPED, reason, provider, List.of());
    }

    public boolean isClassified() {
        return outcome == Outcome.CLASSIFIED;
    }

    /**
     * Pairs every relevant verdict with its chunk entry, in verdict order.
     */
    public List<ClassifiedItem> relevantItems(List<QueueEntry> chunk) {
        List<ClassifiedItem> relevant = new ArrayList<>();
        for (ClassificationVerdict verdict : verdicts) {
            if (verdict.relevant() && verdict.index() >= 0 && verdict.index() < chunk.size()) {
                relevant.add(new ClassifiedItem(chunk.get(verdict.index()), verdict));
            }
        }
        return relevant;
    }
}
