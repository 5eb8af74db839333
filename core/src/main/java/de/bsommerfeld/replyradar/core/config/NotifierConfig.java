package de.bsommerfeld.replyradar.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Webhook notifier settings. The webhook URL itself is a secret and comes
 * from the environment, see {@link Credentials}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotifierConfig {

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 10;

    @JsonProperty("content-preview-length")
    private int contentPreviewLength = 300;

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public int getContentPreviewLength() {
        return contentPreviewLength;
    }
}
