package in.vouchguard.auth;

import in.vouchguard.domain.credential.CredentialStatus;
import in.vouchguard.domain.credential.TokenUpdateResult;
import in.vouchguard.network.CredentialExpiredException;
import in.vouchguard.testsupport.InMemoryRepositories;
import in.vouchguard.testsupport.MutableClock;
import in.vouchguard.testsupport.Tokens;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class SessionTokenWatchdogTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryRepositories.Settings settings;
    private MutableClock clock;
    private SessionTokenWatchdog watchdog;

    @BeforeEach
    void setUp() {
        settings = new InMemoryRepositories.Settings();
        clock = new MutableClock(NOW);
        watchdog = new SessionTokenWatchdog(new SessionTokenDecoder(), settings, clock);
    }

    @AfterEach
    void tearDown() {
        watchdog.stopMonitoring();
    }

    @Test
    void testTokenExpiredTenSecondsAgoIsInvalid() {
        watchdog.loadInitialToken(Tokens.expiringAt(NOW.minusSeconds(10)));

        CredentialStatus status = watchdog.getStatus();
        assertFalse(status.valid());
        assertTrue(status.expired());
        assertEquals(0, status.expiresInSeconds());
        assertFalse(watchdog.isCredentialValid());
        assertThrows(CredentialExpiredException.class, watchdog::requireValid);
        assertEquals("Token: EXPIRED or INVALID", watchdog.formatStatus());
    }

    @Test
    void testTokenExpiringInThirtyMinutesIsExpiringSoon() {
        watchdog.loadInitialToken(Tokens.expiringAt(NOW.plus(Duration.ofMinutes(30))));

        CredentialStatus status = watchdog.getStatus();
        assertTrue(status.valid());
        assertTrue(status.expiringSoon());
        assertEquals(1800, status.expiresInSeconds());
        assertEquals("Token: Valid (expires in 0h 30m)", watchdog.formatStatus());
    }

    @Test
    void testStatusFollowsClock() {
        watchdog.loadInitialToken(Tokens.expiringAt(NOW.plus(Duration.ofHours(3))));
        assertFalse(watchdog.getStatus().expiringSoon());

        clock.advance(Duration.ofHours(2).plusMinutes(30));
        assertTrue(watchdog.getStatus().expiringSoon());

        clock.advance(Duration.ofHours(1));
        assertTrue(watchdog.getStatus().expired());
    }

    @Test
    void testMissingTokenIsInvalid() {
        watchdog.loadInitialToken(null);

        assertFalse(watchdog.isCredentialValid());
        assertTrue(watchdog.currentToken().isEmpty());
    }

    @Test
    void testValidPersistedTokenWinsOverConfigured() {
        String persisted = Tokens.expiringAt(NOW.plus(Duration.ofHours(5)));
        settings.set(SessionTokenWatchdog.SETTINGS_KEY, persisted);

        watchdog.loadInitialToken(Tokens.expiringAt(NOW.plus(Duration.ofHours(1))));

        assertEquals(persisted, watchdog.currentToken().orElseThrow());
    }

    @Test
    void testExpiredPersistedTokenFallsBackToConfigured() {
        settings.set(SessionTokenWatchdog.SETTINGS_KEY, Tokens.expiringAt(NOW.minusSeconds(60)));
        String configured = Tokens.expiringAt(NOW.plus(Duration.ofHours(1)));

        watchdog.loadInitialToken("Bearer " + configured);

        assertEquals(configured, watchdog.currentToken().orElseThrow());
        assertTrue(watchdog.isCredentialValid());
    }

    @Test
    void testUpdateReplacesTokenNotifiesAndPersists() {
        watchdog.loadInitialToken(Tokens.expiringAt(NOW.minusSeconds(10)));
        List<String> seen = new ArrayList<>();
        watchdog.addListener(seen::add);
        String fresh = Tokens.expiringAt(NOW.plus(Duration.ofHours(6)));

        TokenUpdateResult result = watchdog.updateToken(fresh);

        assertTrue(result.success());
        assertTrue(result.status().valid());
        assertEquals(List.of(fresh), seen);
        assertEquals(fresh, settings.values.get(SessionTokenWatchdog.SETTINGS_KEY));
        assertTrue(watchdog.isCredentialValid());
    }

    @Test
    void testRejectedUpdatesKeepPreviousToken() {
        String original = Tokens.expiringAt(NOW.plus(Duration.ofHours(2)));
        watchdog.loadInitialToken(original);
        List<String> seen = new ArrayList<>();
        watchdog.addListener(seen::add);

        TokenUpdateResult garbage = watchdog.updateToken("garbage");
        TokenUpdateResult expired = watchdog.updateToken(Tokens.expiringAt(NOW.minusSeconds(1)));

        assertEquals(TokenUpdateResult.Failure.INVALID_FORMAT, garbage.failure());
        assertEquals(TokenUpdateResult.Failure.ALREADY_EXPIRED, expired.failure());
        assertEquals(original, watchdog.currentToken().orElseThrow());
        assertTrue(seen.isEmpty());
        assertFalse(settings.values.containsKey(SessionTokenWatchdog.SETTINGS_KEY));
    }

    @Test
    void testCheckWarnsOnlyWhenExpiringOrExpired() {
        List<CredentialStatus> checked = new ArrayList<>();
        List<CredentialStatus> warnings = new ArrayList<>();
        watchdog.loadInitialToken(Tokens.expiringAt(NOW.plus(Duration.ofHours(3))));

        watchdog.check(checked::add, warnings::add);
        assertTrue(warnings.isEmpty());

        clock.advance(Duration.ofHours(2).plusMinutes(10));
        watchdog.check(checked::add, warnings::add);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).expiringSoon());

        assertEquals(2, checked.size());
        assertEquals(3 * 3600, checked.get(0).expiresInSeconds());
        assertEquals(50 * 60, checked.get(1).expiresInSeconds());
    }

    @Test
    void testMonitoringReportsStatusOnFirstCheck() throws Exception {
        CountDownLatch checked = new CountDownLatch(1);
        AtomicLong remaining = new AtomicLong(-1);
        watchdog.loadInitialToken(Tokens.expiringAt(NOW.plus(Duration.ofHours(3))));

        watchdog.startMonitoring(status -> {
            remaining.set(status.expiresInSeconds());
            checked.countDown();
        }, status -> fail("token is not expiring"));

        assertTrue(checked.await(2, TimeUnit.SECONDS));
        assertEquals(3 * 3600, remaining.get());
    }

    @Test
    void testFailingPersistenceStillUpdatesInMemory() {
        SessionTokenWatchdog brokenStore = new SessionTokenWatchdog(new SessionTokenDecoder(),
            new InMemoryRepositories.Settings() {
                @Override
                public void set(String key, String value) {
                    throw new RuntimeException("db down");
                }
            }, clock);
        String fresh = Tokens.expiringAt(NOW.plus(Duration.ofHours(6)));

        assertTrue(brokenStore.updateToken(fresh).success());
        assertEquals(fresh, brokenStore.currentToken().orElseThrow());
        brokenStore.stopMonitoring();
    }
}
