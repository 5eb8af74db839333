package de.bsommerfeld.replyradar.notifier;

import de.bsommerfeld.replyradar.core.domain.ItemType;

/**
 * Visual treatment of an item card per item type.
 */
enum CardStyle {

    POST("📝", "Post", "blue", "Post title"),
    COMMENT("💬", "Comment", "purple", "Comment context"),
    SEARCH("🔍", "Search result", "orange", "Post title");

    final String icon;
    final String label;
    final String headerColor;
    final String titleLabel;

    CardStyle(String icon, String label, String headerColor, String titleLabel) {
        this.icon = icon;
        this.label = label;
        this.headerColor = headerColor;
        this.titleLabel = titleLabel;
    }

    static CardStyle of(ItemType type) {
        switch (type) {
            case COMMENT:
                return COMMENT;
            case SEARCH:
                return SEARCH;
            default:
                return POST;
        }
    }
}
