package de.bsommerfeld.replyradar.agent;

/**
 * Provider state of a single run. Once the primary is marked exhausted it
 * stays exhausted for the rest of the run; the next run starts fresh.
 */
public class ProviderSession {

    private boolean primaryExhausted;
    private String lastProvider;

    public boolean isPrimaryExhausted() {
        return primaryExhausted;
    }

    public void markPrimaryExhausted() {
        primaryExhausted = true;
    }

    public void recordProvider(String provider) {
        lastProvider = provider;
    }

    /** Provider that produced the most recent verdicts, {@code null} if none yet. */
    public String lastProvider() {
        return lastProvider;
    }
}
