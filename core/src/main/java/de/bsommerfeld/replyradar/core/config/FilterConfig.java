package de.bsommerfeld.replyradar.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Rule-based prefilter and queue scoring parameters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FilterConfig {

    @JsonProperty("max-age-days")
    private int maxAgeDays = 7;

    // Each match adds one point to the queue score
    @JsonProperty("relevance-keywords")
    private List<String> relevanceKeywords = List.of(
            "beginner", "no code", "without coding", "can't code", "cannot code",
            "non-programmer", "ai", "prototype", "first game", "how do i start",
            "learn", "tool", "engine", "help");

    @JsonProperty("exclude-keywords")
    private List<String> excludeKeywords = List.of(
            "[hiring]", "[for hire]", "[paid]", "commission", "nsfw", "giveaway");

    public int getMaxAgeDays() {
        return maxAgeDays;
    }

    public List<String> getRelevanceKeywords() {
        return relevanceKeywords;
    }

    public List<String> getExcludeKeywords() {
        return excludeKeywords;
    }
}
