package de.bsommerfeld.replyradar.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline provider for TEST mode. Answers every {@code [Item i]} block of
 * the prompt with a verdict; every third item is relevant.
 */
public class TestClassifierBackend implements ClassifierBackend {

    private static final Logger LOG = LoggerFactory.getLogger(TestClassifierBackend.class);
    private static final Pattern ITEM_MARKER = Pattern.compile("\\[Item (\\d+)]");

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String name() {
        return "test";
    }

    @Override
    public String complete(String prompt) {
        ArrayNode verdicts = mapper.createArrayNode();
        Matcher m = ITEM_MARKER.matcher(prompt);
        while (m.find()) {
            int index = Integer.parseInt(m.group(1));
            boolean relevant = index % 3 == 0;
            ObjectNode verdict = verdicts.addObject();
            verdict.put("index", index);
            verdict.put("is_relevant", relevant);
            verdict.put("reason", relevant ? "[TEST] looks like a beginner asking for tools" : "[TEST] off-topic");
            verdict.put("reply_draft", relevant ? "been there honestly. start tiny, one mechanic, ship it" : "");
        }
        LOG.debug("[TEST] Synthesized {} verdicts", verdicts.size());
        return "```json\n" + verdicts.toPrettyString() + "\n```";
    }
}
