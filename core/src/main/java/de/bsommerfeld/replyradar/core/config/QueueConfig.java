package de.bsommerfeld.replyradar.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Location and limits of the pending queue and the processed checkpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueConfig {

    @JsonProperty("data-dir")
    private String dataDir = "";

    @JsonProperty("queue-file")
    private String queueFile = "pending_queue.json";

    @JsonProperty("checkpoint-file")
    private String checkpointFile = "processed_posts.json";

    @JsonProperty("max-processed-ids")
    private int maxProcessedIds = 5000;

    @JsonProperty("items-per-run")
    private int itemsPerRun = 40;

    public String getDataDir() {
        return dataDir;
    }

    public String getQueueFile() {
        return queueFile;
    }

    public String getCheckpointFile() {
        return checkpointFile;
    }

    public int getMaxProcessedIds() {
        return maxProcessedIds;
    }

    public int getItemsPerRun() {
        return itemsPerRun;
    }

    /**
     * Directory holding both store files. An empty {@code data-dir} resolves
     * to {@code <appDataDir>/data}.
     */
    public Path resolveDataDir(Path appDataDir) {
        if (Strings.isNullOrEmpty(dataDir) || dataDir.isBlank()) {
            return appDataDir.resolve("data");
        }
        return Paths.get(dataDir);
    }
}
