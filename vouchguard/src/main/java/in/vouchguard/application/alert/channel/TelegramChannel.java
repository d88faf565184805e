package in.vouchguard.application.alert.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.vouchguard.application.alert.AlertFormatter;
import in.vouchguard.application.alert.AlertPayload;
import in.vouchguard.application.alert.ChannelDeliveryException;
import in.vouchguard.application.alert.NotificationChannel;
import in.vouchguard.domain.alert.AlertAction;
import in.vouchguard.domain.alert.AlertChannel;
import in.vouchguard.domain.alert.CallbackData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Telegram Bot API channel: HTML messages with an inline keyboard.
 */
public final class TelegramChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(TelegramChannel.class);

    public static final String DEFAULT_API_BASE = "https://api.telegram.org";
    static final int CALLBACK_DATA_LIMIT = 64;

    private final String apiBase;
    private final String botToken;
    private final String chatId;
    private final String frontendUrl;
    private final ChannelHttp http;

    public TelegramChannel(String apiBase, String botToken, String chatId, String frontendUrl, Duration timeout) {
        this.apiBase = apiBase;
        this.botToken = botToken;
        this.chatId = chatId;
        this.frontendUrl = frontendUrl;
        this.http = new ChannelHttp(AlertChannel.TELEGRAM, new ObjectMapper(), timeout);
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.TELEGRAM;
    }

    @Override
    public boolean isEnabled() {
        return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
    }

    @Override
    public Optional<String> send(AlertPayload payload) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        ObjectNode body = http.mapper().createObjectNode();
        body.put("chat_id", chatId);
        body.put("text", AlertFormatter.telegramHtml(payload));
        body.put("parse_mode", "HTML");
        body.put("disable_web_page_preview", true);
        body.set("reply_markup", keyboard(payload));

        JsonNode response = http.postJson(method("sendMessage"), body);
        String messageId = messageId(response);
        log.info("[TELEGRAM] Alert sent for review {}: message {}", payload.reviewId(), messageId);
        return Optional.of(messageId);
    }

    @Override
    public boolean sendText(String text) {
        if (!isEnabled()) {
            return false;
        }
        ObjectNode body = http.mapper().createObjectNode();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("parse_mode", "HTML");
        http.postJson(method("sendMessage"), body);
        return true;
    }

    /**
     * Long-poll for updates.
     *
     * @param offset      first update id not yet seen
     * @param pollSeconds server-side wait before an empty answer
     */
    public List<JsonNode> getUpdates(long offset, int pollSeconds) {
        ObjectNode body = http.mapper().createObjectNode();
        body.put("offset", offset);
        body.put("timeout", pollSeconds);
        body.putArray("allowed_updates").add("callback_query");

        JsonNode response = http.postJson(method("getUpdates"), body,
            Duration.ofSeconds(pollSeconds + 10L));
        List<JsonNode> updates = new ArrayList<>();
        response.path("result").forEach(updates::add);
        return updates;
    }

    public void answerCallbackQuery(String callbackQueryId, String text) {
        ObjectNode body = http.mapper().createObjectNode();
        body.put("callback_query_id", callbackQueryId);
        body.put("text", text);
        http.postJson(method("answerCallbackQuery"), body);
    }

    ObjectNode keyboard(AlertPayload payload) {
        String reviewId = payload.reviewId();
        ObjectNode markup = http.mapper().createObjectNode();
        ArrayNode rows = markup.putArray("inline_keyboard");

        boolean requireConfirm = payload.hasAutoDefense() && payload.autoDefense().requireConfirm();
        String dashboardUrl = requireConfirm ? frontendUrl + "/defend/" + reviewId : frontendUrl + "/alerts";

        // Telegram rejects the whole message when any callback_data is too long
        if (new CallbackData(AlertAction.CONFIRM, reviewId, AlertChannel.TELEGRAM).encodedBytes() > CALLBACK_DATA_LIMIT) {
            log.warn("[TELEGRAM] Review id {} too long for callback data, sending dashboard link only", reviewId);
            rows.addArray().add(urlButton("📊 Dashboard", dashboardUrl));
            return markup;
        }

        if (requireConfirm) {
            ArrayNode first = rows.addArray();
            first.add(callbackButton("✅ Confirm defense", AlertAction.CONFIRM, reviewId));
            first.add(callbackButton("✏️ Edit", AlertAction.EDIT, reviewId));
            rows.addArray().add(callbackButton("❌ Ignore", AlertAction.IGNORE, reviewId));
        } else {
            ArrayNode first = rows.addArray();
            first.add(callbackButton("🛡️ Defend", AlertAction.CONFIRM, reviewId));
            first.add(callbackButton("👁️ Ignore", AlertAction.IGNORE, reviewId));
        }
        rows.addArray().add(urlButton("📊 Dashboard", dashboardUrl));
        return markup;
    }

    private ObjectNode callbackButton(String text, AlertAction action, String reviewId) {
        ObjectNode button = http.mapper().createObjectNode();
        button.put("text", text);
        button.put("callback_data", new CallbackData(action, reviewId, AlertChannel.TELEGRAM).encode());
        return button;
    }

    private ObjectNode urlButton(String text, String url) {
        ObjectNode button = http.mapper().createObjectNode();
        button.put("text", text);
        button.put("url", url);
        return button;
    }

    private String method(String name) {
        return apiBase + "/bot" + botToken + "/" + name;
    }

    private String messageId(JsonNode response) {
        if (!response.path("ok").asBoolean(false)) {
            throw new ChannelDeliveryException(AlertChannel.TELEGRAM,
                "sendMessage rejected: " + response.path("description").asText("no description"));
        }
        JsonNode id = response.path("result").path("message_id");
        if (id.isMissingNode() || id.isNull()) {
            throw new ChannelDeliveryException(AlertChannel.TELEGRAM, "No message_id in response");
        }
        return id.asText();
    }
}
