package de.bsommerfeld.replyradar.notifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import de.bsommerfeld.replyradar.core.domain.ClassifiedItem;
import de.bsommerfeld.replyradar.core.domain.ItemType;
import de.bsommerfeld.replyradar.core.domain.QueueEntry;
import de.bsommerfeld.replyradar.core.domain.RunSummary;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds Feishu/Lark interactive card payloads
 * ({@code {"msg_type": "interactive", "card": {...}}}).
 *
 * <p>
 * The reply button does not link to Reddit directly but to a Google search
 * restricted to the subreddit with the exact title. Opening Reddit links
 * straight from the chat tends to run into Reddit's 429 limits.
 */
final class FeishuCards {

    private static final String GOOGLE_SEARCH = "https://www.google.com/search?q=";
    private static final String BUTTON_TEXT = "🔥 Go to Reply (via Google)";

    private final ObjectMapper mapper;
    private final int previewLength;

    FeishuCards(ObjectMapper mapper, int previewLength) {
        this.mapper = mapper;
        this.previewLength = previewLength;
    }

    ObjectNode itemCard(ClassifiedItem item) {
        QueueEntry entry = item.entry();
        CardStyle style = CardStyle.of(entry.type());

        ObjectNode message = mapper.createObjectNode();
        message.put("msg_type", "interactive");
        ObjectNode card = message.putObject("card");
        card.putObject("config").put("wide_screen_mode", true);
        header(card, "🎯 Reddit lead [" + style.label + "] - r/" + entry.sourceGroup(), style.headerColor);

        ArrayNode elements = card.putArray("elements");
        markdown(elements, "**" + style.icon + " " + style.titleLabel + "**\n" + entry.title());
        markdown(elements, "**📄 Content preview**\n" + preview(entry.content()));
        elements.addObject().put("tag", "hr");
        markdown(elements, "**🤖 Why it matters**\n" + item.verdict().reason());
        markdown(elements, "**💡 Reply draft**\n```\n" + item.verdict().replyDraft() + "\n```");
        elements.addObject().put("tag", "hr");

        ObjectNode fieldsDiv = elements.addObject();
        fieldsDiv.put("tag", "div");
        ArrayNode fields = fieldsDiv.putArray("fields");
        shortField(fields, "**Author**: u/" + (entry.author().isEmpty() ? "unknown" : entry.author()));
        shortField(fields, "**Community**: r/" + entry.sourceGroup());
        if (entry.searchKeyword() != null) {
            shortField(fields, "**Keyword**: " + entry.searchKeyword());
        }

        ObjectNode action = elements.addObject();
        action.put("tag", "action");
        ObjectNode button = action.putArray("actions").addObject();
        button.put("tag", "button");
        button.putObject("text").put("tag", "plain_text").put("content", BUTTON_TEXT);
        button.put("type", "primary");
        button.put("url", googleSearchUrl(entry.title(), entry.sourceGroup()));
        return message;
    }

    ObjectNode summaryCard(RunSummary summary) {
        StringBuilder text = new StringBuilder()
                .append("• Scanned: **").append(summary.total()).append("**\n")
                .append("• Relevant: **").append(summary.relevant()).append("**\n")
                .append("• Delivered: **").append(summary.sent()).append("**\n")
                .append("• Queue remaining: **").append(summary.queueRemaining()).append("**");

        StringBuilder breakdown = new StringBuilder();
        for (ItemType type : ItemType.values()) {
            int total = summary.totalOf(type);
            if (total > 0) {
                breakdown.append("\n• ").append(CardStyle.of(type).label).append(": ")
                        .append(summary.relevantOf(type)).append('/').append(total);
            }
        }
        if (breakdown.length() > 0) {
            text.append("\n\n📊 By type:").append(breakdown);
        }

        ObjectNode message = mapper.createObjectNode();
        message.put("msg_type", "interactive");
        ObjectNode card = message.putObject("card");
        header(card, "📊 Reply Radar run summary", "green");
        markdown(card.putArray("elements"), text.toString());
        return message;
    }

    /**
     * {@code https://www.google.com/search?q=site:reddit.com/r/<sub> "<title>"},
     * fully percent-encoded. Without a title only the site restriction
     * remains.
     */
    static String googleSearchUrl(String title, String sourceGroup) {
        if (Strings.isNullOrEmpty(title)) {
            return GOOGLE_SEARCH + "site:reddit.com";
        }
        String query = Strings.isNullOrEmpty(sourceGroup)
                ? "site:reddit.com \"" + title + "\""
                : "site:reddit.com/r/" + sourceGroup + " \"" + title + "\"";
        return GOOGLE_SEARCH + URLEncoder.encode(query, StandardCharsets.UTF_8).replace("+", "%20");
    }

    String preview(String content) {
        if (content.length() <= previewLength) {
            return content;
        }
        return content.substring(0, previewLength) + "...";
    }

    private static void header(ObjectNode card, String title, String template) {
        ObjectNode header = card.putObject("header");
        header.putObject("title").put("tag", "plain_text").put("content", title);
        header.put("template", template);
    }

    private static void markdown(ArrayNode elements, String content) {
        ObjectNode div = elements.addObject();
        div.put("tag", "div");
        div.putObject("text").put("tag", "lark_md").put("content", content);
    }

    private static void shortField(ArrayNode fields, String content) {
        ObjectNode field = fields.addObject();
        field.put("is_short", true);
        field.putObject("text").put("tag", "lark_md").put("content", content);
    }
}
