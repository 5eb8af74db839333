package de.bsommerfeld.replyradar.core.domain;

import com.google.common.base.Strings;
import de.bsommerfeld.replyradar.core.util.KeywordMatcher;

/**
 * Immutable snapshot of a piece of community content as produced by a
 * content source, before it enters the queue.
 *
 * @param id            native identifier (e.g. Reddit fullname {@code t3_abc123});
 *                      may be empty, see {@link #effectiveId()}
 * @param type          origin of the item
 * @param sourceGroup   community or channel name without prefix (e.g.
 *                      {@code gamedev})
 * @param title         title, or parent title for comments
 * @param content       body text, possibly empty
 * @param link          absolute URL of the item
 * @param author        author name without {@code u/} prefix
 * @param searchKeyword keyword that surfaced the item, {@code null} unless
 *                      {@code type == SEARCH}
 * @param published     origin timestamp in RFC-1123 form, {@code null} if
 *                      unknown
 */
public record Item(
        String id,
        ItemType type,
        String sourceGroup,
        String title,
        String content,
        String link,
        String author,
        String searchKeyword,
        String published) {

    /**
     * Canonical constructor. Text fields are never {@code null}; only
     * {@code searchKeyword} and {@code published} are optional.
     */
    public Item {
        type = type != null ? type : ItemType.POST;
        sourceGroup = Strings.nullToEmpty(sourceGroup);
        title = Strings.nullToEmpty(title);
        content = Strings.nullToEmpty(content);
        link = Strings.nullToEmpty(link);
        author = Strings.nullToEmpty(author);
        searchKeyword = Strings.emptyToNull(searchKeyword);
        published = Strings.emptyToNull(published);
    }

    /**
     * Convenience constructor for items without search keyword or
     * publication timestamp.
     */
    public Item(String id, ItemType type, String sourceGroup, String title,
            String content, String link, String author) {
        this(id, type, sourceGroup, title, content, link, author, null, null);
    }

    /**
     * Identity used for de-duplication: the native id, or the link when the
     * source did not supply one.
     */
    public String effectiveId() {
        return Strings.isNullOrEmpty(id) ? link : id;
    }

    /** Lower-cased {@code title + " " + content}, the text keyword rules look at. */
    public String searchableText() {
        return KeywordMatcher.searchableText(title, content);
    }
}
