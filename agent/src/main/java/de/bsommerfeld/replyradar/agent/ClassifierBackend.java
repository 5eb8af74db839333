package de.bsommerfeld.replyradar.agent;

/**
 * One text-completion provider the {@link BatchClassifier} can send a
 * rendered batch prompt to.
 */
public interface ClassifierBackend {

    /** Short provider name used in logs and reports, e.g. {@code gemini}. */
    String name();

    /**
     * Sends the prompt and returns the raw model text.
     *
     * @throws Exception any provider failure; quota errors are recognized by
     *                   {@link QuotaErrors#isQuotaExceeded(Throwable)}
     */
    String complete(String prompt) throws Exception;
}
