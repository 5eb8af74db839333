package de.bsommerfeld.replyradar.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void load_missingFile_shouldReturnEmptySet() {
        var store = new CheckpointStore(tempDir.resolve("processed.json"), 100, CLOCK);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void saveAndLoad_shouldPreserveInsertionOrder() {
        var store = new CheckpointStore(tempDir.resolve("processed.json"), 100, CLOCK);
        Set<String> ids = new LinkedHashSet<>(List.of("c", "a", "b"));

        assertTrue(store.save(ids));

        assertEquals(List.of("c", "a", "b"), List.copyOf(store.load()));
    }

    @Test
    void save_shouldKeepOnlyMostRecentIds() {
        var store = new CheckpointStore(tempDir.resolve("processed.json"), 3, CLOCK);

        store.save(new LinkedHashSet<>(List.of("1", "2", "3", "4", "5")));

        assertEquals(List.of("3", "4", "5"), List.copyOf(store.load()));
    }

    @Test
    void load_bareArray_shouldBeAccepted() throws IOException {
        Path file = tempDir.resolve("processed.json");
        Files.writeString(file, "[\"t3_a\", \"t3_b\"]");

        assertEquals(Set.of("t3_a", "t3_b"), new CheckpointStore(file, 10, CLOCK).load());
    }

    @Test
    void load_objectWithOtherArrayField_shouldBeAccepted() throws IOException {
        Path file = tempDir.resolve("processed.json");
        Files.writeString(file, "{\"last_updated\": \"x\", \"ids\": [\"t3_a\", 5, \"\"]}");

        assertEquals(Set.of("t3_a"), new CheckpointStore(file, 10, CLOCK).load());
    }

    @Test
    void save_shouldWriteWrappedDocument() throws IOException {
        Path file = tempDir.resolve("processed.json");

        new CheckpointStore(file, 10, CLOCK).save(Set.of("t3_a"));

        String json = Files.readString(file);
        assertTrue(json.contains("\"processed_ids\""));
        assertTrue(json.contains("2024-05-01T12:00:00Z"));
        assertFalse(Files.exists(tempDir.resolve("processed.json.tmp")));
    }

    @Test
    void save_unwritableLocation_shouldReturnFalse() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");
        var store = new CheckpointStore(blocker.resolve("processed.json"), 10, CLOCK);

        assertFalse(store.save(Set.of("t3_a")));
    }

    @Test
    void load_corruptFile_shouldReturnEmptyAndMoveFileAside() throws IOException {
        Path file = tempDir.resolve("processed.json");
        Files.writeString(file, "[\"unterminated");

        assertTrue(new CheckpointStore(file, 10, CLOCK).load().isEmpty());
        assertFalse(Files.exists(file));
        assertTrue(Files.exists(tempDir.resolve("processed.json.corrupt-" + CLOCK.millis())));
    }
}
