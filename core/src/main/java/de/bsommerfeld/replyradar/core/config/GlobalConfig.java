package de.bsommerfeld.replyradar.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps onto its own POJO; a
 * missing section keeps its defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("reddit")
    private RedditConfig reddit = new RedditConfig();

    @JsonProperty("filter")
    private FilterConfig filter = new FilterConfig();

    @JsonProperty("queue")
    private QueueConfig queue = new QueueConfig();

    @JsonProperty("classifier")
    private ClassifierConfig classifier = new ClassifierConfig();

    @JsonProperty("notifier")
    private NotifierConfig notifier = new NotifierConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public RedditConfig getReddit() {
        return reddit;
    }

    public FilterConfig getFilter() {
        return filter;
    }

    public QueueConfig getQueue() {
        return queue;
    }

    public ClassifierConfig getClassifier() {
        return classifier;
    }

    public NotifierConfig getNotifier() {
        return notifier;
    }
}
