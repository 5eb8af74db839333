package de.bsommerfeld.replyradar.app.triage;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.replyradar.core.config.FilterConfig;
import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.domain.ItemType;
import de.bsommerfeld.replyradar.core.event.ApplicationEventBus;
import de.bsommerfeld.replyradar.core.event.TriageEvents.PrefilterCompletedEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PrefilterEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-08T12:00:00Z");

    private final ApplicationEventBus eventBus = new ApplicationEventBus();
    private final PrefilterEngine engine = new PrefilterEngine(new FilterConfig(),
            Clock.fixed(NOW, ZoneOffset.UTC), eventBus);

    private static String rfc1123(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atOffset(ZoneOffset.UTC));
    }

    private static Item item(String id, String title, String published) {
        return new Item(id, ItemType.POST, "gamedev", title, "", "https://reddit.com/" + id, "u", null, published);
    }

    @Test
    void filter_exactlyMaxAge_shouldKeep() {
        Item boundary = item("t3_edge", "Edge", rfc1123(NOW.minus(Duration.ofDays(7))));

        PrefilterResult result = engine.filter(List.of(boundary));

        assertEquals(List.of(boundary), result.kept());
        assertEquals(0, result.droppedByAge());
    }

    @Test
    void filter_olderThanMaxAge_shouldDrop() {
        Item old = item("t3_old", "Old", rfc1123(NOW.minus(Duration.ofDays(7)).minusSeconds(1)));

        PrefilterResult result = engine.filter(List.of(old));

        assertTrue(result.kept().isEmpty());
        assertEquals(1, result.droppedByAge());
    }

    @Test
    void filter_missingOrUnparseableDate_shouldKeep() {
        Item noDate = item("t3_a", "No date", null);
        Item garbage = item("t3_b", "Garbage", "yesterday-ish");

        PrefilterResult result = engine.filter(List.of(noDate, garbage));

        assertEquals(2, result.kept().size());
    }

    @Test
    void filter_withoutWeekdayOrIsoDate_shouldStillApplyAgeRule() {
        Item noWeekday = item("t3_a", "A", "20 Apr 2024 12:00:00 +0000");
        Item iso = item("t3_b", "B", "2024-04-20T12:00:00Z");

        PrefilterResult result = engine.filter(List.of(noWeekday, iso));

        assertEquals(2, result.droppedByAge());
    }

    @Test
    void filter_obsoleteZonesAndTwoDigitYears_shouldStillApplyAgeRule() {
        Item oldEst = item("t3_a", "A", "Wed, 1 May 24 08:00 EST");
        Item oldUt = item("t3_b", "B", "20 Apr 2024 12:00:00 UT");
        Item freshPdt = item("t3_c", "C", "6 May 2024 12:00:00 PDT");

        PrefilterResult result = engine.filter(List.of(oldEst, oldUt, freshPdt));

        assertEquals(List.of(freshPdt), result.kept());
        assertEquals(2, result.droppedByAge());
    }

    @Test
    void parsePublished_obsoleteForms_shouldResolveToUtcInstant() {
        assertEquals(Optional.of(Instant.parse("2001-09-09T05:46:40Z")),
                PrefilterEngine.parsePublished("Sun, 09 Sep 01 01:46:40 EDT"));
        assertEquals(Optional.of(Instant.parse("1999-01-01T00:00:00Z")),
                PrefilterEngine.parsePublished("1 Jan 99 00:00 GMT"));
        assertEquals(Optional.empty(), PrefilterEngine.parsePublished("1 May 24 08:00 XYZ"));
    }

    @Test
    void filter_excludePhraseAnywhere_shouldDropCaseInsensitive() {
        Item hiring = item("t3_h", "[HIRING] Unity dev wanted", null);
        Item clean = item("t3_c", "How do I start making a game?", null);
        Item inBody = new Item("t3_b", ItemType.POST, "gamedev", "Art", "open for Commission work",
                "l", "u", null, null);

        PrefilterResult result = engine.filter(List.of(hiring, clean, inBody));

        assertEquals(List.of(clean), result.kept());
        assertEquals(2, result.droppedByKeyword());
        assertEquals(2, result.dropped());
    }

    @Test
    void filter_shouldPreserveOrderAndPostCounts() {
        List<PrefilterCompletedEvent> events = new ArrayList<>();
        eventBus.register(new Object() {
            @Subscribe
            public void on(PrefilterCompletedEvent event) {
                events.add(event);
            }
        });
        Item a = item("t3_a", "First", null);
        Item b = item("t3_b", "nsfw", null);
        Item c = item("t3_c", "Third", null);

        PrefilterResult result = engine.filter(List.of(a, b, c));

        assertEquals(List.of(a, c), result.kept());
        assertEquals(1, events.size());
        assertEquals(new PrefilterCompletedEvent(3, 2, 0, 1), events.get(0));
    }
}
