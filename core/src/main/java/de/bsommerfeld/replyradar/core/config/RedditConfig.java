package de.bsommerfeld.replyradar.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reddit content source parameters. Values are persisted in config.toml
 * and loaded at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RedditConfig {

    @JsonProperty("subreddits")
    private List<String> subreddits = List.of(
            "gamedev", "indiegaming", "IndieDev", "godot",
            "unity", "unrealengine", "SoloDevelopment", "gamedesign");

    @JsonProperty("posts-per-subreddit")
    private int postsPerSubreddit = 10;

    @JsonProperty("monitor-comments")
    private boolean monitorComments = false;

    @JsonProperty("comments-per-subreddit")
    private int commentsPerSubreddit = 25;

    @JsonProperty("keyword-search-enabled")
    private boolean keywordSearchEnabled = true;

    @JsonProperty("search-keywords")
    private List<String> searchKeywords = List.of(
            "no code game", "make game without coding", "AI game maker",
            "game dev beginner", "how to make a game");

    @JsonProperty("search-results-per-keyword")
    private int searchResultsPerKeyword = 10;

    public List<String> getSubreddits() {
        return subreddits;
    }

    public int getPostsPerSubreddit() {
        return postsPerSubreddit;
    }

    public boolean isMonitorComments() {
        return monitorComments;
    }

    public int getCommentsPerSubreddit() {
        return commentsPerSubreddit;
    }

    public boolean isKeywordSearchEnabled() {
        return keywordSearchEnabled;
    }

    public List<String> getSearchKeywords() {
        return searchKeywords;
    }

    public int getSearchResultsPerKeyword() {
        return searchResultsPerKeyword;
    }
}
