package de.bsommerfeld.replyradar.notifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.replyradar.core.config.Credentials;
import de.bsommerfeld.replyradar.core.config.NotifierConfig;
import de.bsommerfeld.replyradar.core.domain.ClassifiedItem;
import de.bsommerfeld.replyradar.core.domain.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Posts interactive cards to a Feishu/Lark custom bot webhook.
 *
 * <p>
 * The webhook answers HTTP 200 even for rejected messages; the verdict is in
 * the body. A message counts as delivered when the body carries
 * {@code "code": 0} or {@code "StatusCode": 0} (both forms occur depending
 * on the bot API version).
 */
@Singleton
public class FeishuNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(FeishuNotifier.class);

    private final String webhookUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final FeishuCards cards;

    @Inject
    public FeishuNotifier(NotifierConfig config, Credentials credentials) {
        this(credentials.webhookUrl(), config.getTimeout(), config.getContentPreviewLength());
    }

    FeishuNotifier(String webhookUrl, Duration timeout, int previewLength) {
        this.webhookUrl = webhookUrl;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
        this.mapper = new ObjectMapper();
        this.cards = new FeishuCards(mapper, previewLength);
    }

    @Override
    public int sendBatch(List<ClassifiedItem> items) {
        if (items.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (ClassifiedItem item : items) {
            if (post(cards.itemCard(item), "item " + item.entry().id())) {
                delivered++;
                LOG.info("Delivered [{}] {}", item.type().key(), abbreviate(item.title()));
            }
        }
        LOG.info("Delivered {}/{} notifications", delivered, items.size());
        return delivered;
    }

    @Override
    public boolean sendSummary(RunSummary summary) {
        return post(cards.summaryCard(summary), "run summary");
    }

    private boolean post(ObjectNode payload, String what) {
        if (webhookUrl == null) {
            LOG.error("No webhook URL configured, cannot send {}", what);
            return false;
        }
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(webhookUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            JsonNode body = mapper.readTree(response.body());
            if (isSuccess(body)) {
                return true;
            }
            LOG.error("Webhook rejected {}: HTTP {} {}", what, response.statusCode(), response.body());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while sending {}", what);
            return false;
        } catch (Exception e) {
            LOG.error("Failed to send {}", what, e);
            return false;
        }
    }

    static boolean isSuccess(JsonNode body) {
        if (body == null) {
            return false;
        }
        JsonNode code = body.get("code");
        if (code != null && code.isNumber() && code.asInt() == 0) {
            return true;
        }
        JsonNode statusCode = body.get("StatusCode");
        return statusCode != null && statusCode.isNumber() && statusCode.asInt() == 0;
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 40) + "...";
    }
}
