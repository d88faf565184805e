package in.vouchguard.application.alert;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Text helpers shared by the channel renderers.
 */
public final class AlertFormatter {
    static final int TELEGRAM_COMMENT_LIMIT = 200;

    private static final DateTimeFormatter DETECTED_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    public static String emoji(AlertPayload payload) {
        return payload.isSlash() ? "⚡" : "🚨";
    }

    public static String typeLabel(AlertPayload payload) {
        return payload.isSlash() ? "SLASH DETECTED" : "NEGATIVE REVIEW";
    }

    /**
     * {@code 0x1234567890abcdef} → {@code 0x1234...cdef}.
     */
    public static String shortAddress(String address) {
        if (address == null || address.isBlank()) {
            return "unknown";
        }
        if (address.length() <= 10) {
            return address;
        }
        return address.substring(0, 6) + "..." + address.substring(address.length() - 4);
    }

    public static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }

    /**
     * Hard cut without a marker, for fields with a strict size cap.
     */
    public static String cut(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) : text;
    }

    public static String formatDetected(Instant instant) {
        return DETECTED_FORMAT.format(instant);
    }

    /**
     * Escape for Telegram's HTML parse mode.
     */
    public static String html(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    public static String telegramHtml(AlertPayload payload) {
        StringBuilder sb = new StringBuilder();
        sb.append(emoji(payload)).append(" <b>TRUST ALERT - ").append(typeLabel(payload)).append("</b>\n\n");
        sb.append("📛 <b>Target:</b> ").append(html(payload.target().displayName())).append('\n');
        sb.append("   <code>").append(html(shortAddress(payload.target().address()))).append("</code>\n\n");
        sb.append("👤 <b>Attacker:</b> ").append(html(payload.attacker().displayName())).append('\n');
        sb.append("   <code>").append(html(shortAddress(payload.attacker().address()))).append("</code>\n\n");
        sb.append("⭐ <b>Score:</b> ").append(payload.score()).append('\n');

        if (payload.comment() != null && !payload.comment().isBlank()) {
            sb.append("💬 <b>Comment:</b>\n<i>\"")
                .append(html(truncate(payload.comment(), TELEGRAM_COMMENT_LIMIT)))
                .append("\"</i>\n\n");
        }

        sb.append("🔗 <a href=\"").append(html(payload.target().profileUrl())).append("\">View profile</a>\n");
        sb.append("⏰ <b>Detected:</b> ").append(formatDetected(payload.detectedAt())).append('\n');

        if (payload.hasAutoDefense()) {
            sb.append("\n━━━━━━━━━━━━━━━━━━━━━━\n");
            sb.append("🤖 <b>Suggested defense:</b>\n");
            sb.append("<i>\"").append(html(payload.autoDefense().suggestedComment())).append("\"</i>\n");
            sb.append("Score: +").append(payload.autoDefense().suggestedScore()).append('\n');
            sb.append("━━━━━━━━━━━━━━━━━━━━━━");
        }
        return sb.toString();
    }

    public static String compactText(AlertPayload payload, String frontendUrl) {
        return emoji(payload) + " TRUST ALERT\n\n"
            + "Target: " + nameOrAddress(payload.target()) + "\n"
            + "Attacker: " + nameOrAddress(payload.attacker()) + "\n"
            + "Score: " + payload.score() + "\n\n"
            + "Dashboard: " + frontendUrl + "/defend/" + payload.reviewId();
    }

    private static String nameOrAddress(AlertPayload.Party party) {
        if (party.name() != null && !party.name().isBlank()) {
            return party.name();
        }
        return cut(party.address(), 10) + "...";
    }

    private AlertFormatter() {}
}
