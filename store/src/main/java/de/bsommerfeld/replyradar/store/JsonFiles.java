package de.bsommerfeld.replyradar.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File helpers shared by both stores. All writes go to a {@code .tmp}
 * sibling first and are then moved over the target, so a crash mid-write
 * never leaves a truncated store file behind.
 */
final class JsonFiles {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFiles.class);

    private JsonFiles() {
    }

    static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes {@code value} into {@code target} via temp file and rename.
     * On failure the temp file is removed and {@code target} keeps its
     * previous content.
     *
     * @throws IOException if serialization, the write or the move fails
     */
    static void writeAtomically(ObjectMapper mapper, Path target, Object value) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}, falling back to plain replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /**
     * Moves an unreadable store file aside to
     * {@code <name>.corrupt-<epochMillis>} so the next write starts clean
     * without destroying the evidence.
     */
    static void quarantine(Path file, long epochMillis) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + epochMillis);
        try {
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            LOG.warn("Moved unreadable store file {} to {}", file, aside);
        } catch (IOException e) {
            LOG.error("Could not move unreadable store file {} aside", file, e);
        }
    }
}
