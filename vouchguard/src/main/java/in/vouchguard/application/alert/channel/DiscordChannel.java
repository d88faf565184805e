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
import java.util.Optional;

/**
 * Discord webhook channel: one embed plus action buttons.
 */
public final class DiscordChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(DiscordChannel.class);

    static final int COLOR_SLASH = 0xFF0000;
    static final int COLOR_NEGATIVE = 0xFFA500;
    static final int FIELD_LIMIT = 1024;

    // Discord component styles
    private static final int STYLE_PRIMARY = 1;
    private static final int STYLE_SUCCESS = 3;
    private static final int STYLE_DANGER = 4;
    private static final int STYLE_LINK = 5;

    private final String webhookUrl;
    private final String frontendUrl;
    private final ChannelHttp http;

    public DiscordChannel(String webhookUrl, String frontendUrl, Duration timeout) {
        this.webhookUrl = webhookUrl;
        this.frontendUrl = frontendUrl;
        this.http = new ChannelHttp(AlertChannel.DISCORD, new ObjectMapper(), timeout);
    }

    @Override
    public AlertChannel channel() {
        return AlertChannel.DISCORD;
    }

    @Override
    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public Optional<String> send(AlertPayload payload) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        ObjectNode body = http.mapper().createObjectNode();
        body.putArray("embeds").add(embed(payload));
        body.set("components", components(payload));

        JsonNode response = http.postJson(waitUrl(), body);
        JsonNode id = response.get("id");
        if (id == null || id.isNull()) {
            throw new ChannelDeliveryException(AlertChannel.DISCORD, "No message id in webhook response");
        }
        log.info("[DISCORD] Alert sent for review {}: message {}", payload.reviewId(), id.asText());
        return Optional.of(id.asText());
    }

    @Override
    public boolean sendText(String text) {
        if (!isEnabled()) {
            return false;
        }
        ObjectNode body = http.mapper().createObjectNode();
        body.put("content", text);
        http.postJson(webhookUrl, body);
        return true;
    }

    ObjectNode embed(AlertPayload payload) {
        ObjectNode embed = http.mapper().createObjectNode();
        embed.put("title", "🚨 TRUST ALERT - " + (payload.isSlash() ? "SLASH" : "NEGATIVE REVIEW"));
        embed.put("color", payload.isSlash() ? COLOR_SLASH : COLOR_NEGATIVE);
        embed.put("url", payload.target().profileUrl());

        ArrayNode fields = embed.putArray("fields");
        fields.add(field("📛 Target",
            payload.target().displayName() + "\n`" + payload.target().address() + "`", true));
        fields.add(field("👤 Attacker",
            payload.attacker().displayName() + "\n`" + payload.attacker().address() + "`", true));
        fields.add(field("⭐ Score", Integer.toString(payload.score()), true));

        if (payload.comment() != null && !payload.comment().isBlank()) {
            fields.add(field("💬 Comment",
                AlertFormatter.cut(payload.comment(), FIELD_LIMIT), false));
        }
        if (payload.hasAutoDefense()) {
            fields.add(field("🤖 Suggested defense",
                AlertFormatter.cut("\"" + payload.autoDefense().suggestedComment() + "\"\nScore: +"
                    + payload.autoDefense().suggestedScore(), FIELD_LIMIT), false));
        }

        embed.putObject("footer").put("text", "Detected: " + AlertFormatter.formatDetected(payload.detectedAt()));
        embed.put("timestamp", payload.detectedAt().toString());
        return embed;
    }

    ArrayNode components(AlertPayload payload) {
        ArrayNode rows = http.mapper().createArrayNode();

        ObjectNode actions = rows.addObject();
        actions.put("type", 1);
        ArrayNode actionButtons = actions.putArray("components");
        actionButtons.add(button(STYLE_SUCCESS, "✅ Confirm", AlertAction.CONFIRM, payload.reviewId()));
        actionButtons.add(button(STYLE_PRIMARY, "✏️ Edit", AlertAction.EDIT, payload.reviewId()));
        actionButtons.add(button(STYLE_DANGER, "❌ Ignore", AlertAction.IGNORE, payload.reviewId()));

        ObjectNode links = rows.addObject();
        links.put("type", 1);
        ObjectNode link = links.putArray("components").addObject();
        link.put("type", 2);
        link.put("style", STYLE_LINK);
        link.put("label", "📊 Dashboard");
        link.put("url", frontendUrl + "/defend/" + payload.reviewId());
        return rows;
    }

    private ObjectNode button(int style, String label, AlertAction action, String reviewId) {
        ObjectNode button = http.mapper().createObjectNode();
        button.put("type", 2);
        button.put("style", style);
        button.put("label", label);
        button.put("custom_id", new CallbackData(action, reviewId, AlertChannel.DISCORD).encode());
        return button;
    }

    private ObjectNode field(String name, String value, boolean inline) {
        ObjectNode field = http.mapper().createObjectNode();
        field.put("name", name);
        field.put("value", value);
        field.put("inline", inline);
        return field;
    }

    private String waitUrl() {
        return webhookUrl + (webhookUrl.contains("?") ? "&" : "?") + "wait=true";
    }
}
