package in.vouchguard.auth;

import in.vouchguard.domain.credential.CredentialStatus;
import in.vouchguard.domain.credential.TokenClaims;
import in.vouchguard.domain.credential.TokenUpdateResult;
import in.vouchguard.network.CredentialGate;
import in.vouchguard.repository.SettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Tracks the trust network session token and warns before it expires.
 *
 * The token and its claims are swapped as one unit, so readers never see a
 * token paired with another token's expiry. Periodic checks only read that
 * reference and never wait on a monitor cycle.
 */
public class SessionTokenWatchdog implements CredentialGate {
    private static final Logger log = LoggerFactory.getLogger(SessionTokenWatchdog.class);

    public static final String SETTINGS_KEY = "session_token";
    static final long EXPIRING_SOON_SECONDS = 3600;
    static final Duration CHECK_INTERVAL = Duration.ofMinutes(5);

    private record Session(String token, TokenClaims claims) {}

    private final SessionTokenDecoder decoder;
    private final SettingsRepository settingsRepo;
    private final Clock clock;
    private final AtomicReference<Session> session = new AtomicReference<>();
    private final List<CredentialListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler;

    private volatile ScheduledFuture<?> monitorTask;

    public SessionTokenWatchdog(SessionTokenDecoder decoder, SettingsRepository settingsRepo, Clock clock) {
        this.decoder = decoder;
        this.settingsRepo = settingsRepo;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "SessionTokenWatchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Seed the credential at startup. A persisted token that is still valid wins
     * over the configured one, since it is the result of an earlier refresh.
     */
    public void loadInitialToken(String configuredToken) {
        Optional<Session> persisted = settingsRepo.get(SETTINGS_KEY).flatMap(this::decodeUsable);
        Optional<Session> configured = decodeUsable(configuredToken);

        Optional<Session> chosen = persisted.isPresent() ? persisted : configured;
        if (chosen.isPresent()) {
            session.set(chosen.get());
            log.info("[SESSION] Loaded {} session token. {}",
                persisted.isPresent() ? "persisted" : "configured", formatStatus());
        } else if (configuredToken != null && !configuredToken.isBlank()) {
            // Keep an expired/undecodable token so status reports it; writes stay gated
            session.set(new Session(stripBearer(configuredToken), decoder.decode(configuredToken).orElse(null)));
            log.warn("[SESSION] Configured session token is expired or invalid. {}", formatStatus());
        } else {
            log.warn("[SESSION] No session token configured; defenses cannot be posted");
        }
    }

    public Optional<String> currentToken() {
        Session current = session.get();
        return current != null ? Optional.ofNullable(current.token()) : Optional.empty();
    }

    public CredentialStatus getStatus() {
        Session current = session.get();
        if (current == null || current.claims() == null) {
            return CredentialStatus.missing();
        }
        TokenClaims claims = current.claims();
        long expiresIn = claims.expiresAt().getEpochSecond() - clock.instant().getEpochSecond();
        boolean expired = expiresIn <= 0;
        return new CredentialStatus(
            !expired,
            claims.expiresAt(),
            Math.max(0, expiresIn),
            expired,
            expiresIn < EXPIRING_SOON_SECONDS,
            claims.subject(),
            claims.sessionId()
        );
    }

    @Override
    public boolean isCredentialValid() {
        return getStatus().valid();
    }

    /**
     * Replace the session token. On rejection the previous token stays in place.
     */
    public TokenUpdateResult updateToken(String newToken) {
        Optional<TokenClaims> claims = decoder.decode(newToken);
        if (claims.isEmpty()) {
            log.warn("[SESSION] Rejected token update: invalid format");
            return TokenUpdateResult.failure(TokenUpdateResult.Failure.INVALID_FORMAT, getStatus());
        }
        if (!claims.get().expiresAt().isAfter(clock.instant())) {
            log.warn("[SESSION] Rejected token update: already expired at {}", claims.get().expiresAt());
            return TokenUpdateResult.failure(TokenUpdateResult.Failure.ALREADY_EXPIRED, getStatus());
        }

        String token = stripBearer(newToken);
        session.set(new Session(token, claims.get()));
        log.info("[SESSION] Token updated. {}", formatStatus());

        for (CredentialListener listener : listeners) {
            try {
                listener.onTokenUpdated(token);
            } catch (Exception e) {
                log.error("[SESSION] Credential listener failed: {}", e.getMessage(), e);
            }
        }

        try {
            settingsRepo.set(SETTINGS_KEY, token);
        } catch (Exception e) {
            log.error("[SESSION] Token updated in memory but could not be persisted: {}", e.getMessage());
        }

        return TokenUpdateResult.success(getStatus());
    }

    public void addListener(CredentialListener listener) {
        listeners.add(listener);
    }

    /**
     * Check now, then every five minutes. {@code onCheck} sees every status;
     * {@code onExpiring} fires on every check that finds the token expired or
     * expiring within the hour.
     */
    public synchronized void startMonitoring(Consumer<CredentialStatus> onCheck,
                                             Consumer<CredentialStatus> onExpiring) {
        if (monitorTask != null) {
            monitorTask.cancel(false);
        }
        log.info("[SESSION] Starting token monitoring (check interval: {}m)", CHECK_INTERVAL.toMinutes());
        monitorTask = scheduler.scheduleAtFixedRate(
            () -> check(onCheck, onExpiring),
            0,
            CHECK_INTERVAL.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    void check(Consumer<CredentialStatus> onCheck, Consumer<CredentialStatus> onExpiring) {
        try {
            CredentialStatus status = getStatus();
            onCheck.accept(status);
            if (status.expired() || status.expiringSoon()) {
                log.warn("[SESSION] {}", formatStatus());
                onExpiring.accept(status);
            }
        } catch (Exception e) {
            log.error("[SESSION] Token check failed: {}", e.getMessage(), e);
        }
    }

    public synchronized void stopMonitoring() {
        if (monitorTask != null) {
            monitorTask.cancel(false);
            monitorTask = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[SESSION] Token monitoring stopped");
    }

    public String formatStatus() {
        CredentialStatus status = getStatus();
        if (!status.valid()) {
            return "Token: EXPIRED or INVALID";
        }
        long hours = status.expiresInSeconds() / 3600;
        long minutes = (status.expiresInSeconds() % 3600) / 60;
        return String.format("Token: Valid (expires in %dh %dm)", hours, minutes);
    }

    private Optional<Session> decodeUsable(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return decoder.decode(token)
            .filter(claims -> claims.expiresAt().isAfter(now))
            .map(claims -> new Session(stripBearer(token), claims));
    }

    private static String stripBearer(String token) {
        String trimmed = token.trim();
        return trimmed.startsWith("Bearer ") ? trimmed.substring("Bearer ".length()).trim() : trimmed;
    }
}
