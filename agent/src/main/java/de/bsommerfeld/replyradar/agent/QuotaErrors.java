package de.bsommerfeld.replyradar.agent;

import com.google.common.base.Throwables;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes provider quota and rate-limit failures. SDKs wrap the HTTP
 * error differently, so the whole cause chain is searched for the usual
 * markers.
 */
public final class QuotaErrors {

    private static final List<String> MARKERS = List.of(
            "429", "quota", "resource_exhausted", "rate limit", "rate_limit", "too many requests");

    private QuotaErrors() {
    }

    public static boolean isQuotaExceeded(Throwable error) {
        if (error == null) {
            return false;
        }
        for (Throwable cause : Throwables.getCausalChain(error)) {
            String message = cause.getMessage();
            if (message == null) {
                continue;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            for (String marker : MARKERS) {
                if (lower.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }
}
