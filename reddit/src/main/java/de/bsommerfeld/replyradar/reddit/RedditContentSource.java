package de.bsommerfeld.replyradar.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.replyradar.core.config.RedditConfig;
import de.bsommerfeld.replyradar.core.domain.Item;
import de.bsommerfeld.replyradar.core.domain.ItemType;
import de.bsommerfeld.replyradar.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Collects new posts, comments and keyword search hits from Reddit's public
 * {@code .json} endpoints. No API key required.
 *
 * <h3>Feeds</h3>
 * <ul>
 * <li>{@code /r/<sub>/new.json}: newest posts per configured subreddit</li>
 * <li>{@code /r/<sub>/comments.json}: newest comments, only when
 * {@code monitor-comments} is enabled</li>
 * <li>{@code /search.json?q=<keyword>&sort=new}: site-wide search per
 * configured keyword, only when {@code keyword-search-enabled} is set</li>
 * </ul>
 *
 * <h3>Rate limiting</h3>
 * Reddit returns {@code x-ratelimit-remaining} and {@code x-ratelimit-reset}
 * headers on every response. When fewer than 2 requests remain, the calling
 * thread pauses for the reset window plus one second.
 *
 * <h3>User-Agent convention</h3>
 * Reddit expects {@code <platform>:<app-id>:<version> (by /u/<username>)}.
 * The version comes from {@code reddit-version.properties}, filled by Maven
 * resource filtering.
 *
 * <h3>Failure containment</h3>
 * Each feed is fetched independently. A non-200 status, a transport error or
 * an unparseable body is logged with the feed URL and that feed contributes
 * zero items.
 *
 * @see TestContentSource
 */
@Singleton
public class RedditContentSource implements ContentSource {

    private static final Logger LOG = LoggerFactory.getLogger(RedditContentSource.class);

    static final String REDDIT_BASE = "https://www.reddit.com";
    private static final String JSON_SUFFIX = ".json";
    private static final String USER_AGENT = buildUserAgent();

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(20);

    /** Reddit renders {@code created_utc} as epoch seconds; items carry it as RFC-1123. */
    private static final DateTimeFormatter PUBLISHED_FORMAT = DateTimeFormatter.RFC_1123_DATE_TIME;

    private final RedditConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Sleeper sleeper;

    @Inject
    public RedditContentSource(RedditConfig config, Sleeper sleeper) {
        this.config = config;
        this.sleeper = sleeper;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(REQUEST_TIMEOUT)
                .build();
        this.mapper = new ObjectMapper();
    }

    // =====================================================================
    // Fetch
    // =====================================================================

    @Override
    public List<Item> fetchAllNewItems() {
        Map<String, Item> byId = new LinkedHashMap<>();

        for (String subreddit : config.getSubreddits()) {
            collect(byId, fetchListing(subredditUrl(subreddit, "new", config.getPostsPerSubreddit()),
                    ItemType.POST, null));
            if (config.isMonitorComments()) {
                collect(byId, fetchListing(subredditUrl(subreddit, "comments", config.getCommentsPerSubreddit()),
                        ItemType.COMMENT, null));
            }
        }

        if (config.isKeywordSearchEnabled()) {
            for (String keyword : config.getSearchKeywords()) {
                collect(byId, fetchListing(searchUrl(keyword, config.getSearchResultsPerKeyword()),
                        ItemType.SEARCH, keyword));
            }
        }

        LOG.info("Fetched {} unique items from Reddit", byId.size());
        return new ArrayList<>(byId.values());
    }

    private void collect(Map<String, Item> byId, List<Item> items) {
        for (Item item : items) {
            // First occurrence wins: a post seen in its subreddit keeps type POST even if a search also finds it
            byId.putIfAbsent(item.effectiveId(), item);
        }
    }

    private List<Item> fetchListing(String url, ItemType type, String keyword) {
        LOG.debug("Fetching {}", url);
        try {
            String body = fetchBody(url);
            if (body == null) {
                return List.of();
            }
            return parseListing(body, type, keyword);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while fetching {}", url);
            return List.of();
        } catch (Exception e) {
            LOG.error("Failed to fetch feed {}", url, e);
            return List.of();
        }
    }

    static String subredditUrl(String subreddit, String listing, int limit) {
        return REDDIT_BASE + "/r/" + subreddit + "/" + listing + JSON_SUFFIX + "?limit=" + limit;
    }

    static String searchUrl(String keyword, int limit) {
        return REDDIT_BASE + "/search" + JSON_SUFFIX
                + "?q=" + URLEncoder.encode(keyword, StandardCharsets.UTF_8)
                + "&sort=new&limit=" + limit;
    }

    // =====================================================================
    // Parsing
    // =====================================================================

    /**
     * Converts a Reddit listing ({@code {"data": {"children": [...]}}}) into
     * items. Children without a usable id and link are dropped.
     */
    List<Item> parseListing(String json, ItemType type, String keyword) throws IOException {
        JsonNode root = mapper.readTree(json);
        JsonNode children = root.path("data").path("children");
        if (!children.isArray()) {
            LOG.warn("Listing without children for {} feed", type.key());
            return List.of();
        }

        List<Item> items = new ArrayList<>();
        for (JsonNode child : children) {
            JsonNode data = child.path("data");
            if (data.isMissingNode()) {
                continue;
            }
            Item item = type == ItemType.COMMENT ? parseComment(data) : parsePost(data, type, keyword);
            if (!Strings.isNullOrEmpty(item.effectiveId())) {
                items.add(item);
            }
        }
        return items;
    }

    private Item parsePost(JsonNode data, ItemType type, String keyword) {
        String id = data.path("name").asText("");
        if (id.isEmpty() && data.hasNonNull("id")) {
            id = "t3_" + data.get("id").asText();
        }

        String selftext = unescapeHtml(data.path("selftext").asText(""));
        if (selftext.isEmpty()) {
            if (data.has("url_overridden_by_dest")) {
                selftext = "[Link: " + unescapeHtml(data.get("url_overridden_by_dest").asText()) + "]";
            } else if (data.has("url") && !data.get("url").asText().contains("/comments/")) {
                selftext = "[Link: " + unescapeHtml(data.get("url").asText()) + "]";
            }
        }

        return new Item(id, type,
                data.path("subreddit").asText(""),
                unescapeHtml(data.path("title").asText("")),
                selftext,
                absoluteLink(data.path("permalink").asText("")),
                authorOf(data),
                type == ItemType.SEARCH ? keyword : null,
                published(data));
    }

    private Item parseComment(JsonNode data) {
        String id = data.path("name").asText("");
        if (id.isEmpty() && data.hasNonNull("id")) {
            id = "t1_" + data.get("id").asText();
        }
        return new Item(id, ItemType.COMMENT,
                data.path("subreddit").asText(""),
                unescapeHtml(data.path("link_title").asText("")),
                unescapeHtml(data.path("body").asText("")),
                absoluteLink(data.path("permalink").asText("")),
                authorOf(data),
                null,
                published(data));
    }

    private String authorOf(JsonNode data) {
        String author = data.path("author").asText("unknown");
        return isRealAuthor(author) ? author : "";
    }

    private String published(JsonNode data) {
        long created = data.path("created_utc").asLong(0);
        if (created <= 0) {
            return null;
        }
        return PUBLISHED_FORMAT.format(Instant.ofEpochSecond(created).atOffset(ZoneOffset.UTC));
    }

    private String absoluteLink(String permalink) {
        if (permalink.isEmpty()) {
            return "";
        }
        if (permalink.startsWith("http")) {
            return permalink;
        }
        return REDDIT_BASE + normalizePermalink(permalink);
    }

    // =====================================================================
    // HTTP
    // =====================================================================

    /**
     * Performs a GET with the Reddit User-Agent and rate-limit handling.
     *
     * @return the body, or {@code null} for a non-200 response
     */
    protected String fetchBody(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        checkRateLimit(response);
        if (response.statusCode() != 200) {
            LOG.error("Feed {} answered HTTP {}", url, response.statusCode());
            return null;
        }
        return response.body();
    }

    /**
     * Pauses for {@code x-ratelimit-reset} + 1 seconds once fewer than 2
     * requests remain in the current window. Malformed headers are ignored.
     */
    private void checkRateLimit(HttpResponse<?> response) {
        response.headers().firstValue("x-ratelimit-remaining").ifPresent(remaining -> {
            try {
                if (Double.parseDouble(remaining) < 2.0) {
                    response.headers().firstValue("x-ratelimit-reset").ifPresent(reset -> {
                        long waitSecs = (long) Double.parseDouble(reset) + 1;
                        LOG.warn("Reddit Rate Limit Near. Sleeping for {}s", waitSecs);
                        sleeper.sleep(Duration.ofSeconds(waitSecs));
                    });
                }
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring malformed rate-limit header '{}'", remaining);
            }
        });
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private String normalizePermalink(String permalink) {
        if (!permalink.startsWith("/")) {
            permalink = "/" + permalink;
        }
        return permalink;
    }

    private boolean isRealAuthor(String author) {
        return !author.isEmpty() && !author.equals("unknown") && !author.equals("[deleted]");
    }

    private String unescapeHtml(String text) {
        if (text == null)
            return "";
        return text.replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'");
    }

    private static String buildUserAgent() {
        String version = "unknown";
        try (InputStream in = RedditContentSource.class.getResourceAsStream("/reddit-version.properties")) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                version = props.getProperty("app.version", "unknown");
            }
        } catch (IOException e) {
            LOG.debug("reddit-version.properties unreadable, using 'unknown'", e);
        }
        return "java:de.bsommerfeld.replyradar:v" + version + " (by /u/ReplyRadar)";
    }
}
