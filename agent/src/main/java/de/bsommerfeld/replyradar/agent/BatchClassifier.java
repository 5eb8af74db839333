package de.bsommerfeld.replyradar.agent;

import com.google.common.base.Strings;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.replyradar.core.config.ClassifierConfig;
import de.bsommerfeld.replyradar.core.domain.ClassificationVerdict;
import de.bsommerfeld.replyradar.core.domain.QueueEntry;
import de.bsommerfeld.replyradar.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Judges a chunk of queued entries in a single provider call.
 *
 * <h3>Provider selection</h3>
 * The primary answers unless the run's {@link ProviderSession} has marked
 * it exhausted or it has no credential. Otherwise the secondary answers.
 *
 * <h3>Quota handling</h3>
 * A quota error from the primary triggers a bounded retry: at most
 * {@code max-primary-attempts} calls, with a pause of
 * {@code backoff-base * attempt} after each failed one. When the attempts
 * are used up the primary is marked exhausted for the rest of the run and
 * the secondary gets exactly one attempt. Any other error ends the chunk
 * immediately as skipped.
 *
 * <h3>Failure semantics</h3>
 * This class never throws for provider or parse problems. It reports
 * {@link ClassificationResult.Outcome#SKIPPED}, which the orchestrator
 * treats as "leave in queue, do not checkpoint".
 */
@Singleton
public class BatchClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(BatchClassifier.class);

    static final int TITLE_LIMIT = 200;
    static final int CONTENT_LIMIT = 500;

    private final ClassifierConfig config;
    private final ClassifierBackends backends;
    private final Sleeper sleeper;

    @Inject
    public BatchClassifier(ClassifierConfig config, ClassifierBackends backends, Sleeper sleeper) {
        this.config = config;
        this.backends = backends;
        this.sleeper = sleeper;
    }

    /**
     * @param chunk       entries to judge, indexed from 0 in the prompt
     * @param chunkNumber 1-based, for logging only
     * @param session     provider state shared by all chunks of the run
     */
    public ClassificationResult classify(List<QueueEntry> chunk, int chunkNumber, ProviderSession session) {
        if (chunk.isEmpty()) {
            return ClassificationResult.skipped(ClassificationResult.SkipReason.EMPTY_CHUNK, null);
        }
        String prompt = renderPrompt(chunk);

        Optional<ClassifierBackend> primary = backends.primary();
        boolean exhaustedNow = false;
        if (primary.isPresent() && !session.isPrimaryExhausted()) {
            ClassificationResult result = tryPrimary(primary.get(), prompt, chunk, chunkNumber, session);
            if (result != null) {
                return result;
            }
            exhaustedNow = true;
        }
        return trySecondary(prompt, chunk, chunkNumber, session, exhaustedNow);
    }

    /**
     * @return the result, or {@code null} if the quota was exhausted and the
     *         secondary has to take over
     */
    private ClassificationResult tryPrimary(ClassifierBackend backend, String prompt, List<QueueEntry> chunk,
            int chunkNumber, ProviderSession session) {
        int maxAttempts = config.getMaxPrimaryAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String text = backend.complete(prompt);
                return interpret(text, chunk, chunkNumber, backend.name(), session);
            } catch (Exception e) {
                if (!QuotaErrors.isQuotaExceeded(e)) {
                    LOG.error("Chunk {}: provider {} failed", chunkNumber, backend.name(), e);
                    return ClassificationResult.skipped(ClassificationResult.SkipReason.PROVIDER_ERROR,
                            backend.name());
                }
                LOG.warn("Chunk {}: provider {} quota exceeded (attempt {}/{})",
                        chunkNumber, backend.name(), attempt, maxAttempts);
                if (attempt < maxAttempts) {
                    Duration wait = config.getBackoffBase().multipliedBy(attempt);
                    LOG.info("Chunk {}: waiting {}s before retrying {}", chunkNumber, wait.toSeconds(), backend.name());
                    sleeper.sleep(wait);
                }
            }
        }
        session.markPrimaryExhausted();
        LOG.warn("Provider {} exhausted for this run", backend.name());
        return null;
    }

    /**
     * @param exhaustedNow whether this very chunk used up the primary quota;
     *                     later chunks without a secondary report
     *                     {@code NO_PROVIDER}
     */
    private ClassificationResult trySecondary(String prompt, List<QueueEntry> chunk, int chunkNumber,
            ProviderSession session, boolean exhaustedNow) {
        Optional<ClassifierBackend> secondary = backends.secondary();
        if (secondary.isEmpty()) {
            ClassificationResult.SkipReason reason = exhaustedNow
                    ? ClassificationResult.SkipReason.QUOTA_EXHAUSTED
                    : ClassificationResult.SkipReason.NO_PROVIDER;
            LOG.error("Chunk {}: no classifier provider available ({}), leaving {} items queued",
                    chunkNumber, reason, chunk.size());
            return ClassificationResult.skipped(reason, null);
        }

        ClassifierBackend backend = secondary.get();
        LOG.info("Chunk {}: using provider {}", chunkNumber, backend.name());
        try {
            String text = backend.complete(prompt);
            return interpret(text, chunk, chunkNumber, backend.name(), session);
        } catch (Exception e) {
            boolean quota = QuotaErrors.isQuotaExceeded(e);
            LOG.error("Chunk {}: provider {} failed{}", chunkNumber, backend.name(),
                    quota ? " (quota exceeded)" : "", e);
            return ClassificationResult.skipped(quota
                    ? ClassificationResult.SkipReason.QUOTA_EXHAUSTED
                    : ClassificationResult.SkipReason.PROVIDER_ERROR, backend.name());
        }
    }

    private ClassificationResult interpret(String text, List<QueueEntry> chunk, int chunkNumber, String provider,
            ProviderSession session) {
        Optional<List<ClassificationVerdict>> verdicts = VerdictParser.parse(text, chunk.size());
        if (verdicts.isEmpty() || verdicts.get().isEmpty()) {
            LOG.warn("Chunk {}: unparseable answer from {}: {}", chunkNumber, provider,
                    Strings.nullToEmpty(text).length() > 200 ? text.substring(0, 200) + "..." : text);
            return ClassificationResult.skipped(ClassificationResult.SkipReason.PARSE_FAILURE, provider);
        }
        session.recordProvider(provider);
        long relevant = verdicts.get().stream().filter(ClassificationVerdict::relevant).count();
        LOG.info("Chunk {}: {} verdicts from {}, {} relevant", chunkNumber, verdicts.get().size(), provider, relevant);
        return ClassificationResult.classified(provider, verdicts.get());
    }

    // =====================================================================
    // Prompt
    // =====================================================================

    String renderPrompt(List<QueueEntry> chunk) {
        StringBuilder sb = new StringBuilder(PromptLoader.render("batch-analysis", Map.of(
                "PRODUCT_NAME", config.getProductName(),
                "PRODUCT_DESCRIPTION", config.getProductDescription(),
                "REPLY_LANGUAGE", config.getReplyLanguage())));
        sb.append('\n');
        for (int i = 0; i < chunk.size(); i++) {
            sb.append(formatItem(i, chunk.get(i)));
        }
        return sb.toString();
    }

    static String formatItem(int index, QueueEntry entry) {
        StringBuilder sb = new StringBuilder()
                .append("\n[Item ").append(index).append("]\n")
                .append("Type: ").append(entry.type().key()).append('\n')
                .append("Subreddit: r/").append(entry.sourceGroup()).append('\n')
                .append("Title: ").append(truncate(entry.title(), TITLE_LIMIT)).append('\n')
                .append("Content: ").append(truncate(entry.content(), CONTENT_LIMIT)).append('\n');
        if (entry.searchKeyword() != null) {
            sb.append("Search Keyword: ").append(entry.searchKeyword()).append('\n');
        }
        return sb.toString();
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
