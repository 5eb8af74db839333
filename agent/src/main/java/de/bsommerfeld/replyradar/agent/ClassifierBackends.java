package de.bsommerfeld.replyradar.agent;

import de.bsommerfeld.replyradar.core.config.ClassifierConfig;
import de.bsommerfeld.replyradar.core.config.Credentials;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The primary and secondary provider of a run. Either may be absent when
 * its credential is missing.
 */
public final class ClassifierBackends {

    private static final Logger LOG = LoggerFactory.getLogger(ClassifierBackends.class);

    public static final String PRIMARY_NAME = "gemini";
    public static final String SECONDARY_NAME = "deepseek";

    private final ClassifierBackend primary;
    private final ClassifierBackend secondary;

    /**
     * @param primary   preferred provider, {@code null} if unavailable
     * @param secondary failover provider, {@code null} if unavailable
     */
    public ClassifierBackends(ClassifierBackend primary, ClassifierBackend secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    /**
     * Builds Gemini as primary and an OpenAI-compatible DeepSeek endpoint as
     * secondary, each only if its API key is present. langchain4j's own
     * retry is limited to one attempt; quota back-off is handled by
     * {@link BatchClassifier}.
     */
    public static ClassifierBackends fromCredentials(ClassifierConfig config, Credentials credentials) {
        ClassifierBackend primary = null;
        if (credentials.hasPrimary()) {
            primary = new ChatModelBackend(PRIMARY_NAME, GoogleAiGeminiChatModel.builder()
                    .apiKey(credentials.primaryApiKey())
                    .modelName(config.getPrimaryModel())
                    .temperature(config.getTemperature())
                    .maxOutputTokens(config.getMaxOutputTokens())
                    .timeout(config.getTimeout())
                    .maxRetries(1)
                    .build());
        }

        ClassifierBackend secondary = null;
        if (credentials.hasSecondary()) {
            secondary = new ChatModelBackend(SECONDARY_NAME, OpenAiChatModel.builder()
                    .baseUrl(config.getSecondaryBaseUrl())
                    .apiKey(credentials.secondaryApiKey())
                    .modelName(config.getSecondaryModel())
                    .temperature(config.getTemperature())
                    .maxTokens(config.getMaxOutputTokens())
                    .timeout(config.getTimeout())
                    .maxRetries(1)
                    .build(), PromptLoader.template("classifier-system"));
        }

        LOG.info("Classifier providers - primary: {} ({}), secondary: {} ({})",
                primary != null ? PRIMARY_NAME : "none", config.getPrimaryModel(),
                secondary != null ? SECONDARY_NAME : "none", config.getSecondaryModel());
        return new ClassifierBackends(primary, secondary);
    }

    /** Offline pair for TEST mode. */
    public static ClassifierBackends offline() {
        return new ClassifierBackends(new TestClassifierBackend(), null);
    }

    public Optional<ClassifierBackend> primary() {
        return Optional.ofNullable(primary);
    }

    public Optional<ClassifierBackend> secondary() {
        return Optional.ofNullable(secondary);
    }

    public boolean isEmpty() {
        return primary == null && secondary == null;
    }
}
