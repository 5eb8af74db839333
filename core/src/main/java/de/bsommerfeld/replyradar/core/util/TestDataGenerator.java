package de.bsommerfeld.replyradar.core.util;

import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.domain.ItemType;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates plausible community items for offline development and TEST
 * mode, so the whole pipeline runs without network access.
 *
 * <p>
 * Roughly one in five items is a keyword search hit, one in five a comment.
 * Timestamps spread across the last three days. Ids are stable per seed.
 */
public class TestDataGenerator {

    private static final String[] SUBREDDITS = { "gamedev", "indiegaming", "IndieDev", "godot", "unity" };

    private static final String[] OPENERS = { "How do I start", "Looking for a tool", "Beginner question:",
            "Showcase:", "Need help with", "Is there an engine" };
    private static final String[] TOPICS = { "making my first game", "a platformer prototype",
            "game dev without coding", "shaders in Godot", "an AI game maker", "level design" };

    private static final String[] BODIES = {
            "I have zero programming experience but a lot of ideas. Where do I begin?",
            "Been working on this for 2 years, finally released the demo!",
            "Can't code at all. Is there anything that lets me prototype quickly?",
            "My physics are jittery when the framerate drops, any pointers?",
            "We are [hiring] a pixel artist for a paid commission.",
            "Which engine would you recommend for a complete beginner?" };

    private static final String[] KEYWORDS = { "no code game", "AI game maker", "how to make a game" };

    private final Random rnd;
    private int counter = 0;

    public TestDataGenerator() {
        this(new Random());
    }

    public TestDataGenerator(long seed) {
        this(new Random(seed));
    }

    private TestDataGenerator(Random rnd) {
        this.rnd = rnd;
    }

    public List<Item> generateItems(int count) {
        List<Item> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(generateItem());
        }
        return items;
    }

    public Item generateItem() {
        counter++;
        String sub = pick(SUBREDDITS);
        String title = pick(OPENERS) + " " + pick(TOPICS);
        String body = pick(BODIES);
        Instant created = Instant.now().minus(rnd.nextInt(72 * 60), ChronoUnit.MINUTES);
        String published = DateTimeFormatter.RFC_1123_DATE_TIME.format(created.atOffset(ZoneOffset.UTC));

        int roll = rnd.nextInt(5);
        if (roll == 0) {
            String id = "t1_test" + counter;
            return new Item(id, ItemType.COMMENT, sub, title, body,
                    "https://www.reddit.com/r/" + sub + "/comments/test" + counter + "/_/c" + counter,
                    "tester" + rnd.nextInt(100), null, published);
        }
        String id = "t3_test" + counter;
        String link = "https://www.reddit.com/r/" + sub + "/comments/test" + counter + "/";
        if (roll == 1) {
            return new Item(id, ItemType.SEARCH, sub, title, body, link,
                    "tester" + rnd.nextInt(100), pick(KEYWORDS), published);
        }
        return new Item(id, ItemType.POST, sub, title, body, link, "tester" + rnd.nextInt(100), null, published);
    }

    private String pick(String[] pool) {
        return pool[rnd.nextInt(pool.length)];
    }
}
