package de.bsommerfeld.replyradar.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Batch classifier settings: chunking, pacing, quota back-off, both
 * provider models and the product persona rendered into the prompt.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassifierConfig {

    @JsonProperty("chunk-size")
    private int chunkSize = 20;

    @JsonProperty("inter-chunk-delay-seconds")
    private long interChunkDelaySeconds = 15;

    @JsonProperty("max-primary-attempts")
    private int maxPrimaryAttempts = 2;

    @JsonProperty("backoff-base-seconds")
    private long backoffBaseSeconds = 10;

    @JsonProperty("primary-model")
    private String primaryModel = "gemini-2.0-flash-lite";

    @JsonProperty("secondary-model")
    private String secondaryModel = "deepseek-chat";

    @JsonProperty("secondary-base-url")
    private String secondaryBaseUrl = "https://api.deepseek.com";

    @JsonProperty("temperature")
    private double temperature = 0.3;

    @JsonProperty("max-output-tokens")
    private int maxOutputTokens = 2000;

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 60;

    @JsonProperty("product-name")
    private String productName = "wefun.ai";

    @JsonProperty("product-description")
    private String productDescription =
            "an AI game maker that turns a plain-language idea into a playable game without writing code";

    @JsonProperty("reply-language")
    private String replyLanguage = "English";

    public int getChunkSize() {
        return Math.max(1, chunkSize);
    }

    public Duration getInterChunkDelay() {
        return Duration.ofSeconds(Math.max(0, interChunkDelaySeconds));
    }

    public int getMaxPrimaryAttempts() {
        return Math.max(1, maxPrimaryAttempts);
    }

    public Duration getBackoffBase() {
        return Duration.ofSeconds(Math.max(0, backoffBaseSeconds));
    }

    public String getPrimaryModel() {
        return primaryModel;
    }

    public String getSecondaryModel() {
        return secondaryModel;
    }

    public String getSecondaryBaseUrl() {
        return secondaryBaseUrl;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public String getProductName() {
        return productName;
    }

    public String getProductDescription() {
        return productDescription;
    }

    public String getReplyLanguage() {
        return replyLanguage;
    }
}
