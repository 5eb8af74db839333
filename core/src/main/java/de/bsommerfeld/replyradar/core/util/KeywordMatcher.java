package de.bsommerfeld.replyradar.core.util;

import com.google.common.base.Strings;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive substring matching over {@code title + " " + content}.
 * Shared by the prefilter exclusion rule and the queue relevance score.
 */
public final class KeywordMatcher {

    private KeywordMatcher() {
    }

    public static String searchableText(String title, String content) {
        return (Strings.nullToEmpty(title) + " " + Strings.nullToEmpty(content)).toLowerCase(Locale.ROOT);
    }

    /**
     * Number of distinct keywords occurring in the text. A keyword counts
     * once no matter how often it appears.
     */
    public static int countMatches(String searchableText, Collection<String> keywords) {
        if (keywords == null) {
            return 0;
        }
        int count = 0;
        for (String keyword : keywords) {
            if (contains(searchableText, keyword)) {
                count++;
            }
        }
        return count;
    }

    /** First keyword, in list order, that occurs in the text. */
    public static Optional<String> firstMatch(String searchableText, Collection<String> keywords) {
        if (keywords == null) {
            return Optional.empty();
        }
        for (String keyword : keywords) {
            if (contains(searchableText, keyword)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    private static boolean contains(String text, String keyword) {
        if (Strings.isNullOrEmpty(keyword) || text == null) {
            return false;
        }
        return text.contains(keyword.toLowerCase(Locale.ROOT));
    }
}
