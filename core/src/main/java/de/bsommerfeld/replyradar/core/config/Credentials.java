package de.bsommerfeld.replyradar.core.config;

import com.google.common.base.Strings;

import java.util.function.Function;

/**
 * Secrets read from the environment. They never live in config.toml.
 *
 * @param primaryApiKey   Gemini API key ({@code GEMINI_API_KEY})
 * @param secondaryApiKey DeepSeek API key ({@code DEEPSEEK_API_KEY})
 * @param webhookUrl      Feishu/Lark bot webhook ({@code FEISHU_WEBHOOK_URL})
 */
public record Credentials(String primaryApiKey, String secondaryApiKey, String webhookUrl) {

    public static final String PRIMARY_KEY_ENV = "GEMINI_API_KEY";
    public static final String SECONDARY_KEY_ENV = "DEEPSEEK_API_KEY";
    public static final String WEBHOOK_ENV = "FEISHU_WEBHOOK_URL";

    public Credentials {
        primaryApiKey = normalize(primaryApiKey);
        secondaryApiKey = normalize(secondaryApiKey);
        webhookUrl = normalize(webhookUrl);
    }

    public static Credentials fromEnvironment() {
        return from(System::getenv);
    }

    public static Credentials from(Function<String, String> lookup) {
        return new Credentials(lookup.apply(PRIMARY_KEY_ENV),
                lookup.apply(SECONDARY_KEY_ENV),
                lookup.apply(WEBHOOK_ENV));
    }

    public boolean hasPrimary() {
        return primaryApiKey != null;
    }

    public boolean hasSecondary() {
        return secondaryApiKey != null;
    }

    public boolean hasWebhook() {
        return webhookUrl != null;
    }

    @Override
    public String toString() {
        return "Credentials[primary=" + (hasPrimary() ? "set" : "missing")
                + ", secondary=" + (hasSecondary() ? "set" : "missing")
                + ", webhook=" + (hasWebhook() ? "set" : "missing") + "]";
    }

    private static String normalize(String value) {
        return Strings.emptyToNull(value == null ? null : value.trim());
    }
}
