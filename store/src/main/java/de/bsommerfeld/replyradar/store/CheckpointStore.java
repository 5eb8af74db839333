package de.bsommerfeld.replyradar.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.replyradar.core.config.QueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded, insertion-ordered record of ids that have been classified.
 * Once an id is here, it is never enqueued again (until it ages out of the
 * cap).
 *
 * <p>
 * Reading accepts a bare JSON array as well as an object wrapping the id
 * array, so files written by older tooling still load. Writing always
 * produces {@code {"processed_ids": [...], "last_updated": ...}}.
 */
@Singleton
public class CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointStore.class);
    private static final String IDS_FIELD = "processed_ids";

    private final Path file;
    private final int maxIds;
    private final Clock clock;
    private final ObjectMapper mapper = JsonFiles.createMapper();

    public CheckpointStore(Path file, int maxIds, Clock clock) {
        this.file = file;
        this.maxIds = Math.max(1, maxIds);
        this.clock = clock;
    }

    @Inject
    public CheckpointStore(@Named("data-dir") Path dataDir, QueueConfig queueConfig, Clock clock) {
        this(dataDir.resolve(queueConfig.getCheckpointFile()), queueConfig.getMaxProcessedIds(), clock);
    }

    /**
     * @return processed ids, oldest first; empty if the file is missing or
     *         unreadable
     */
    public Set<String> load() {
        Set<String> ids = new LinkedHashSet<>();
        if (!Files.exists(file)) {
            return ids;
        }

        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            LOG.error("Failed to read checkpoint file {}, starting empty", file, e);
            JsonFiles.quarantine(file, clock.millis());
            return ids;
        }

        JsonNode array = findIdArray(root);
        if (array == null) {
            LOG.warn("Checkpoint file {} contains no id array, starting empty", file);
            return ids;
        }
        for (JsonNode node : array) {
            if (node.isTextual() && !node.asText().isBlank()) {
                ids.add(node.asText());
            }
        }
        LOG.debug("Loaded {} processed ids from {}", ids.size(), file);
        return ids;
    }

    /**
     * Replaces the file with the given ids, keeping only the most recent
     * {@code max-processed-ids} in insertion order.
     *
     * @return {@code false} if the write failed; the previous file then
     *         stays in place
     */
    public boolean save(Set<String> ids) {
        List<String> all = new ArrayList<>(ids);
        List<String> kept = all.size() > maxIds
                ? all.subList(all.size() - maxIds, all.size())
                : all;
        try {
            JsonFiles.writeAtomically(mapper, file,
                    new CheckpointDocument(List.copyOf(kept), clock.instant().toString()));
            LOG.debug("Saved {} processed ids to {}", kept.size(), file);
            return true;
        } catch (IOException e) {
            LOG.error("Failed to persist checkpoint file {}", file, e);
            return false;
        }
    }

    public int getMaxIds() {
        return maxIds;
    }

    private static JsonNode findIdArray(JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        if (!root.isObject()) {
            return null;
        }
        JsonNode named = root.get(IDS_FIELD);
        if (named != null && named.isArray()) {
            return named;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isArray()) {
                return value;
            }
        }
        return null;
    }
}
