package de.bsommerfeld.replyradar.core.domain;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Origin of a triaged item. Serialized in lower case ({@code post},
 * {@code comment}, {@code search}) to stay compatible with existing queue
 * files; unknown values fall back to {@link #POST}.
 */
public enum ItemType {

    @JsonEnumDefaultValue
    @JsonProperty("post")
    POST,

    @JsonProperty("comment")
    COMMENT,

    @JsonProperty("search")
    SEARCH;

    /** Lower-case key used in files, prompts and notification payloads. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
