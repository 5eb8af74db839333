package de.bsommerfeld.replyradar.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;

import java.time.Instant;

/**
 * An {@link Item} waiting in the priority queue, together with its
 * relevance score and enqueue timestamp. Field names on disk use
 * snake_case.
 *
 * @param relevanceScore number of relevance keywords found in
 *                       {@code title + content}, never negative
 * @param addedAt        ISO-8601 instant of the enqueue
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueEntry(
        @JsonProperty("id") String id,
        @JsonProperty("type") ItemType type,
        @JsonProperty("subreddit") String sourceGroup,
        @JsonProperty("title") String title,
        @JsonProperty("content") String content,
        @JsonProperty("link") String link,
        @JsonProperty("author") String author,
        @JsonProperty("search_keyword") String searchKeyword,
        @JsonProperty("published") String published,
        @JsonProperty("relevance_score") int relevanceScore,
        @JsonProperty("added_at") String addedAt) {

    public QueueEntry {
        id = Strings.nullToEmpty(id);
        type = type != null ? type : ItemType.POST;
        sourceGroup = Strings.nullToEmpty(sourceGroup);
        title = Strings.nullToEmpty(title);
        content = Strings.nullToEmpty(content);
        link = Strings.nullToEmpty(link);
        author = Strings.nullToEmpty(author);
        searchKeyword = Strings.emptyToNull(searchKeyword);
        published = Strings.emptyToNull(published);
        relevanceScore = Math.max(0, relevanceScore);
    }

    /** Wraps an item under its {@link Item#effectiveId() effective id}. */
    public static QueueEntry of(Item item, int relevanceScore, Instant addedAt) {
        return new QueueEntry(item.effectiveId(), item.type(), item.sourceGroup(), item.title(),
                item.content(), item.link(), item.author(), item.searchKeyword(), item.published(),
                relevanceScore, addedAt.toString());
    }

    /** Strips the queue metadata again. */
    public Item toItem() {
        return new Item(id, type, sourceGroup, title, content, link, author, searchKeyword, published);
    }
}
