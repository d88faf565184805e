package in.vouchguard.application.alert.channel;

import com.fasterxml.jackson.databind.JsonNode;
import in.vouchguard.application.alert.AlertCallbackHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Long-polls Telegram for inline-button presses and routes them to the callback handler.
 */
public final class TelegramUpdatePoller {
    private static final Logger log = LoggerFactory.getLogger(TelegramUpdatePoller.class);

    static final int POLL_SECONDS = 25;
    private static final long ERROR_BACKOFF_MS = 5_000;

    private final TelegramChannel telegram;
    private final AlertCallbackHandler callbackHandler;

    private volatile boolean running;
    private volatile Thread thread;
    private long offset;

    public TelegramUpdatePoller(TelegramChannel telegram, AlertCallbackHandler callbackHandler) {
        this.telegram = telegram;
        this.callbackHandler = callbackHandler;
    }

    public synchronized void start() {
        if (running || !telegram.isEnabled()) {
            return;
        }
        running = true;
        thread = new Thread(this::pollLoop, "TelegramUpdatePoller");
        thread.setDaemon(true);
        thread.start();
        log.info("[TELEGRAM] Update polling started");
    }

    public synchronized void stop() {
        running = false;
        Thread current = thread;
        if (current != null) {
            current.interrupt();
            thread = null;
        }
        log.info("[TELEGRAM] Update polling stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void pollLoop() {
        while (running) {
            try {
                pollOnce();
            } catch (Exception e) {
                if (!running) {
                    break;
                }
                log.warn("[TELEGRAM] getUpdates failed: {}", e.getMessage());
                try {
                    Thread.sleep(ERROR_BACKOFF_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * Fetch one batch of updates and dispatch every callback query in it.
     */
    void pollOnce() {
        List<JsonNode> updates = telegram.getUpdates(offset, POLL_SECONDS);
        for (JsonNode update : updates) {
            offset = Math.max(offset, update.path("update_id").asLong() + 1);
            JsonNode query = update.get("callback_query");
            if (query == null || !query.hasNonNull("data")) {
                continue;
            }
            AlertCallbackHandler.CallbackOutcome outcome = callbackHandler.handle(query.get("data").asText());
            try {
                telegram.answerCallbackQuery(query.path("id").asText(), outcome.message());
            } catch (Exception e) {
                log.warn("[TELEGRAM] answerCallbackQuery failed: {}", e.getMessage());
            }
        }
    }

    long offset() {
        return offset;
    }
}
