package de.bsommerfeld.replyradar.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.replyradar.core.domain.ClassificationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts verdicts from raw model text.
 *
 * <p>
 * Models like to wrap JSON in Markdown fences or add a sentence around it.
 * The parser strips fences, tries the whole text as a JSON array and
 * otherwise falls back to the span between the first {@code [} and the
 * last {@code ]}.
 *
 * <p>
 * Individual entries are validated one by one. An entry counts only if it
 * is an object with an integral {@code index} inside the chunk and a
 * boolean {@code is_relevant}; anything else is dropped without failing the
 * rest. A repeated index keeps its first entry.
 */
final class VerdictParser {

    private static final Logger LOG = LoggerFactory.getLogger(VerdictParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern FENCE = Pattern.compile("```(?:json|JSON)?\\s*");

    private VerdictParser() {
    }

    /**
     * @param text      raw model output
     * @param chunkSize number of items the prompt contained
     * @return the valid verdicts, or empty if no JSON array could be found
     */
    static Optional<List<ClassificationVerdict>> parse(String text, int chunkSize) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String clean = FENCE.matcher(text).replaceAll("").trim();

        JsonNode array = readArray(clean);
        if (array == null) {
            int start = clean.indexOf('[');
            int end = clean.lastIndexOf(']');
            if (start != -1 && end > start) {
                array = readArray(clean.substring(start, end + 1));
            }
        }
        if (array == null) {
            return Optional.empty();
        }

        List<ClassificationVerdict> verdicts = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (JsonNode node : array) {
            JsonNode index = node.path("index");
            JsonNode relevant = node.path("is_relevant");
            // canConvertToInt: asInt() would wrap 2^32 around to 0
            if (!node.isObject() || !index.isIntegralNumber() || !index.canConvertToInt()
                    || !relevant.isBoolean()) {
                LOG.debug("Dropping malformed verdict entry: {}", node);
                continue;
            }
            int i = index.asInt();
            if (i < 0 || i >= chunkSize || !seen.add(i)) {
                LOG.debug("Dropping verdict with invalid or repeated index {}", i);
                continue;
            }
            verdicts.add(new ClassificationVerdict(i, relevant.asBoolean(),
                    node.path("reason").asText(""),
                    node.path("reply_draft").asText("")));
        }
        return Optional.of(verdicts);
    }

    private static JsonNode readArray(String candidate) {
        try {
            JsonNode node = MAPPER.readTree(candidate);
            return node != null && node.isArray() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
