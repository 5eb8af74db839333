package de.bsommerfeld.replyradar.app.triage;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.replyradar.core.config.FilterConfig;
import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.event.ApplicationEventBus;
import de.bsommerfeld.replyradar.core.event.TriageEvents.PrefilterCompletedEvent;
import de.bsommerfeld.replyradar.core.util.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap rule-based filter in front of the queue. Drops items that are too
 * old or match an exclusion phrase, so they never cost a classifier call.
 *
 * <p>
 * The age rule only drops what it can prove is old: an item without a
 * timestamp, or with one that does not parse, is kept.
 */
@Singleton
public class PrefilterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PrefilterEngine.class);

    // [Wed,] 1 May 24 9:05[:00] EST
    private static final Pattern OBSOLETE_RFC_2822 = Pattern.compile(
            "(?:[A-Za-z]{3},\\s*)?(\\d{1,2})\\s+([A-Za-z]{3})\\s+(\\d{2}|\\d{4})\\s+"
                    + "(\\d{1,2}):(\\d{2})(?::(\\d{2}))?\\s+([A-Za-z]{1,3}|[+-]\\d{4})");

    private static final Map<String, String> OBSOLETE_ZONES = ImmutableMap.<String, String>builder()
            .put("UT", "+0000")
            .put("Z", "+0000")
            .put("EST", "-0500")
            .put("EDT", "-0400")
            .put("CST", "-0600")
            .put("CDT", "-0500")
            .put("MST", "-0700")
            .put("MDT", "-0600")
            .put("PST", "-0800")
            .put("PDT", "-0700")
            .build();

    private final FilterConfig config;
    private final Clock clock;
    private final ApplicationEventBus eventBus;

    @Inject
    public PrefilterEngine(FilterConfig config, Clock clock, ApplicationEventBus eventBus) {
        this.config = config;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public PrefilterResult filter(List<Item> items) {
        Instant now = clock.instant();
        Duration maxAge = Duration.ofDays(config.getMaxAgeDays());

        List<Item> kept = new ArrayList<>(items.size());
        int droppedByAge = 0;
        int droppedByKeyword = 0;

        for (Item item : items) {
            Optional<Instant> published = parsePublished(item.published());
            if (published.isPresent() && Duration.between(published.get(), now).compareTo(maxAge) > 0) {
                droppedByAge++;
                continue;
            }

            Optional<String> excluded = KeywordMatcher.firstMatch(item.searchableText(), config.getExcludeKeywords());
            if (excluded.isPresent()) {
                LOG.debug("Excluding {} on phrase '{}'", item.effectiveId(), excluded.get());
                droppedByKeyword++;
                continue;
            }
            kept.add(item);
        }

        LOG.info("Prefilter: {} in, {} kept, {} too old, {} excluded",
                items.size(), kept.size(), droppedByAge, droppedByKeyword);
        eventBus.post(new PrefilterCompletedEvent(items.size(), kept.size(), droppedByAge, droppedByKeyword));
        return new PrefilterResult(kept, droppedByAge, droppedByKeyword);
    }

    /**
     * Accepts RFC-1123 / RFC-2822 dates with or without weekday
     * ({@code Wed, 1 May 2024 12:00:00 GMT}, {@code 01 May 2024 12:00:00 +0000}),
     * ISO-8601 with offset, and the obsolete RFC-2822 forms with named zones
     * or two-digit years ({@code 1 May 24 08:00 EST}).
     */
    static Optional<Instant> parsePublished(String published) {
        if (published == null || published.isBlank()) {
            return Optional.empty();
        }
        String value = published.trim();
        // the lenient RFC-1123 parser would read a two-digit year as year 00xx
        String rfc = normalizeObsoleteRfc2822(value).orElse(value);
        Optional<Instant> parsed = tryParse(rfc, DateTimeFormatter.RFC_1123_DATE_TIME);
        if (parsed.isEmpty()) {
            parsed = tryParse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        if (parsed.isEmpty()) {
            LOG.debug("Unparseable publication date '{}', keeping item", value);
        }
        return parsed;
    }

    /**
     * Rewrites the obsolete RFC-2822 forms into one
     * {@link DateTimeFormatter#RFC_1123_DATE_TIME} accepts. Named US zones
     * and {@code UT} become numeric offsets; two-digit years 69-99 map to
     * 19xx, 00-68 to 20xx.
     */
    static Optional<String> normalizeObsoleteRfc2822(String value) {
        Matcher m = OBSOLETE_RFC_2822.matcher(value);
        if (!m.matches()) {
            return Optional.empty();
        }
        String zone = m.group(7).toUpperCase(Locale.ROOT);
        int year = Integer.parseInt(m.group(3));
        if (m.group(3).length() == 2) {
            year += year > 68 ? 1900 : 2000;
        }
        return Optional.of(String.format(Locale.ROOT, "%s %s %d %02d:%s:%s %s",
                m.group(1), m.group(2), year, Integer.parseInt(m.group(4)), m.group(5),
                m.group(6) != null ? m.group(6) : "00",
                OBSOLETE_ZONES.getOrDefault(zone, zone)));
    }

    private static Optional<Instant> tryParse(String value, DateTimeFormatter format) {
        try {
            return Optional.of(OffsetDateTime.parse(value, format).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
