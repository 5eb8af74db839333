package de.bsommerfeld.replyradar.agent;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PromptLoaderTest {

    private static final Map<String, String> PRODUCT = Map.of(
            "PRODUCT_NAME", "acme.ai",
            "PRODUCT_DESCRIPTION", "a game maker",
            "REPLY_LANGUAGE", "German");

    @Test
    void template_shouldCacheRepeatCalls() {
        String first = PromptLoader.template("batch-analysis");
        String second = PromptLoader.template("batch-analysis");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void template_shouldThrowForMissingResource() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> PromptLoader.template("nonexistent-prompt-template"));
        assertTrue(e.getMessage().contains("prompts/nonexistent-prompt-template.txt"));
    }

    @Test
    void template_batchAnalysis_shouldDeclareProductPlaceholders() {
        assertEquals(Set.of("PRODUCT_NAME", "PRODUCT_DESCRIPTION", "REPLY_LANGUAGE"),
                PromptLoader.placeholders(PromptLoader.template("batch-analysis")));
    }

    @Test
    void render_shouldSubstituteEveryPlaceholder() {
        String result = PromptLoader.render("batch-analysis", PRODUCT);

        assertTrue(PromptLoader.placeholders(result).isEmpty());
        assertTrue(result.contains("About acme.ai: a game maker"));
        assertTrue(result.contains("in German"));
    }

    @Test
    void render_missingValue_shouldFailNamingThePlaceholders() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> PromptLoader.render("batch-analysis", Map.of("PRODUCT_NAME", "acme.ai")));

        assertTrue(e.getMessage().contains("PRODUCT_DESCRIPTION"));
        assertTrue(e.getMessage().contains("REPLY_LANGUAGE"));
        assertFalse(e.getMessage().contains("PRODUCT_NAME,"));
    }

    @Test
    void systemPrompt_shouldDemandJsonArrayAndNeedNoValues() {
        String system = PromptLoader.template("classifier-system");

        assertTrue(system.contains("JSON array"));
        assertTrue(PromptLoader.placeholders(system).isEmpty());
    }
}
