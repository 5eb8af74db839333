package de.bsommerfeld.replyradar.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void globalConfig_shouldInitializeAllSections() {
        var config = new GlobalConfig();

        assertNotNull(config.getReddit());
        assertNotNull(config.getFilter());
        assertNotNull(config.getQueue());
        assertNotNull(config.getClassifier());
        assertNotNull(config.getNotifier());
        assertFalse(config.isDebugMode());
    }

    @Test
    void redditConfig_shouldTargetGameDevCommunities() {
        var config = new RedditConfig();

        assertEquals(8, config.getSubreddits().size());
        assertTrue(config.getSubreddits().contains("gamedev"));
        assertEquals(10, config.getPostsPerSubreddit());
        assertFalse(config.isMonitorComments());
        assertTrue(config.isKeywordSearchEnabled());
        assertEquals(5, config.getSearchKeywords().size());
    }

    @Test
    void queueConfig_shouldMatchRunLimits() {
        var config = new QueueConfig();

        assertEquals(40, config.getItemsPerRun());
        assertEquals(5000, config.getMaxProcessedIds());
        assertEquals("pending_queue.json", config.getQueueFile());
        assertEquals("processed_posts.json", config.getCheckpointFile());
    }

    @Test
    void queueConfig_emptyDataDir_shouldResolveBelowAppData() {
        var config = new QueueConfig();
        Path appData = Path.of("/tmp/reply-radar");

        assertEquals(appData.resolve("data"), config.resolveDataDir(appData));
    }

    @Test
    void classifierConfig_shouldHaveReasonableDefaults() {
        var config = new ClassifierConfig();

        assertEquals(20, config.getChunkSize());
        assertEquals(Duration.ofSeconds(15), config.getInterChunkDelay());
        assertEquals(2, config.getMaxPrimaryAttempts());
        assertEquals(Duration.ofSeconds(10), config.getBackoffBase());
        assertEquals("gemini-2.0-flash-lite", config.getPrimaryModel());
        assertEquals("deepseek-chat", config.getSecondaryModel());
        assertEquals(0.3, config.getTemperature(), 0.001);
    }

    @Test
    void filterConfig_shouldDefaultToOneWeek() {
        var config = new FilterConfig();

        assertEquals(7, config.getMaxAgeDays());
        assertFalse(config.getRelevanceKeywords().isEmpty());
        assertFalse(config.getExcludeKeywords().isEmpty());
    }

    @Test
    void notifierConfig_shouldPreview300Chars() {
        var config = new NotifierConfig();

        assertEquals(300, config.getContentPreviewLength());
        assertEquals(Duration.ofSeconds(10), config.getTimeout());
    }
}
