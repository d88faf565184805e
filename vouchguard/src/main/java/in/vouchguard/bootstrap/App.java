package in.vouchguard.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.vouchguard.application.alert.AlertCallbackHandler;
import in.vouchguard.application.alert.AlertDispatcher;
import in.vouchguard.application.alert.NotificationChannel;
import in.vouchguard.application.alert.channel.DiscordChannel;
import in.vouchguard.application.alert.channel.TelegramChannel;
import in.vouchguard.application.alert.channel.TelegramUpdatePoller;
import in.vouchguard.application.alert.channel.TwitterChannel;
import in.vouchguard.application.defense.DefenseService;
import in.vouchguard.application.defense.DefenseTemplates;
import in.vouchguard.application.monitoring.ActivityNormalizer;
import in.vouchguard.application.monitoring.CycleScheduler;
import in.vouchguard.application.monitoring.IngestionEngine;
import in.vouchguard.auth.SessionTokenDecoder;
import in.vouchguard.auth.SessionTokenWatchdog;
import in.vouchguard.config.MonitorSettings;
import in.vouchguard.config.RuntimeSettings;
import in.vouchguard.infrastructure.metrics.PrometheusMetricsHandler;
import in.vouchguard.infrastructure.metrics.PrometheusMonitorMetrics;
import in.vouchguard.migration.SchemaMigration;
import in.vouchguard.network.HttpTrustNetworkClient;
import in.vouchguard.repository.ActivityRepository;
import in.vouchguard.repository.AlertRepository;
import in.vouchguard.repository.CycleLogRepository;
import in.vouchguard.repository.DefenseRepository;
import in.vouchguard.repository.PostgresActivityRepository;
import in.vouchguard.repository.PostgresAlertRepository;
import in.vouchguard.repository.PostgresCycleLogRepository;
import in.vouchguard.repository.PostgresDefenseRepository;
import in.vouchguard.repository.PostgresRelationshipRepository;
import in.vouchguard.repository.PostgresSettingsRepository;
import in.vouchguard.repository.RelationshipRepository;
import in.vouchguard.repository.SettingsRepository;
import in.vouchguard.transport.http.ApiHandlers;
import in.vouchguard.transport.http.DefenseHandler;
import in.vouchguard.transport.http.SettingsHandler;
import in.vouchguard.transport.http.TokenHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the trust network client, the monitoring cycle, alert channels,
 * defense workflow and the JSON API on Undertow.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== VouchGuard Starting ===");

        MonitorSettings settings = MonitorSettings.fromEnv();
        Clock clock = Clock.systemUTC();

        // Database
        HikariDataSource dataSource = createDataSource(settings);
        new SchemaMigration(dataSource).migrate();

        // Prometheus metrics
        PrometheusMonitorMetrics metrics = new PrometheusMonitorMetrics();
        log.info("Prometheus metrics initialized");

        // Repository layer
        SettingsRepository settingsRepo = new PostgresSettingsRepository(dataSource);
        RelationshipRepository relationshipRepo = new PostgresRelationshipRepository(dataSource);
        ActivityRepository activityRepo = new PostgresActivityRepository(dataSource);
        AlertRepository alertRepo = new PostgresAlertRepository(dataSource);
        DefenseRepository defenseRepo = new PostgresDefenseRepository(dataSource);
        CycleLogRepository cycleLogRepo = new PostgresCycleLogRepository(dataSource);

        RuntimeSettings runtimeSettings = new RuntimeSettings(settings, settingsRepo);
        runtimeSettings.loadPersisted();

        // Session token + trust network client
        SessionTokenWatchdog tokenWatchdog = new SessionTokenWatchdog(new SessionTokenDecoder(), settingsRepo, clock);
        tokenWatchdog.loadInitialToken(settings.sessionToken());
        HttpTrustNetworkClient networkClient = new HttpTrustNetworkClient(
            settings.networkApiUrl(), settings.clientId(), settings.httpTimeout(),
            tokenWatchdog, tokenWatchdog.currentToken().orElse(null));
        tokenWatchdog.addListener(networkClient::setSessionToken);

        // Alert channels
        List<NotificationChannel> channels = new ArrayList<>();
        TelegramChannel telegram = null;
        if (settings.telegramConfigured()) {
            telegram = new TelegramChannel(TelegramChannel.DEFAULT_API_BASE, settings.telegramBotToken(),
                settings.telegramChatId(), settings.frontendUrl(), settings.httpTimeout());
            channels.add(telegram);
        }
        if (settings.discordConfigured()) {
            channels.add(new DiscordChannel(settings.discordWebhookUrl(), settings.frontendUrl(),
                settings.httpTimeout()));
        }
        if (settings.twitterConfigured()) {
            channels.add(new TwitterChannel(settings.twitterApiKey(), settings.twitterApiSecret(),
                settings.frontendUrl()));
        }
        if (channels.isEmpty()) {
            log.warn("No alert channels configured; alerts will only be recorded");
        }
        AlertDispatcher dispatcher = new AlertDispatcher(channels, runtimeSettings, metrics, settings.httpTimeout());

        // Defense workflow
        DefenseService defenseService = new DefenseService(defenseRepo, alertRepo, networkClient,
            tokenWatchdog, new DefenseTemplates(), metrics, clock);
        AlertCallbackHandler callbackHandler = new AlertCallbackHandler(defenseService, alertRepo);

        TelegramUpdatePoller poller = null;
        if (telegram != null) {
            poller = new TelegramUpdatePoller(telegram, callbackHandler);
            poller.start();
        }

        // Monitoring cycle
        IngestionEngine engine = new IngestionEngine(networkClient, relationshipRepo, activityRepo, alertRepo,
            cycleLogRepo, dispatcher, defenseService, runtimeSettings, new ActivityNormalizer(), metrics,
            clock, settings.userKey());
        CycleScheduler scheduler = new CycleScheduler(engine, alertRepo, runtimeSettings,
            settings.intervalMinutes(), settings.alertExpiryHours(), clock);
        scheduler.start();

        tokenWatchdog.startMonitoring(status -> metrics.recordSessionRemaining(status.expiresInSeconds()), status -> {
            String text = status.expired()
                ? "Session token has EXPIRED. Defenses are blocked until POST /api/token/update is called."
                : "Session token expires in " + (status.expiresInSeconds() / 60)
                    + " minutes. Update it via POST /api/token/update.";
            dispatcher.sendNotification(text);
        });

        // HTTP API
        ApiHandlers api = new ApiHandlers(networkClient, tokenWatchdog, relationshipRepo, activityRepo,
            alertRepo, defenseRepo, cycleLogRepo, scheduler, dispatcher);
        DefenseHandler defense = new DefenseHandler(defenseService, alertRepo);
        TokenHandler token = new TokenHandler(tokenWatchdog);
        SettingsHandler settingsHandler = new SettingsHandler(settings, runtimeSettings);

        RoutingHandler routes = Handlers.routing()
            .get("/api/health", api::health)
            .get("/api/stats", api::stats)
            .post("/api/monitor/run", api::runMonitor)
            .get("/api/monitor/status", api::monitorStatus)
            .get("/api/monitor/logs", api::monitorLogs)
            .get("/api/relations", api::relations)
            .get("/api/relations/{id}", api::relation)
            .get("/api/reviews", api::reviews)
            .get("/api/alerts", api::alerts)
            .get("/api/alerts/{id}", api::alert)
            .add("PATCH", "/api/alerts/{id}", api::updateAlert)
            .post("/api/defend", defense::defend)
            .post("/api/defend/confirm/{alertId}", defense::confirm)
            .get("/api/defend/suggest", defense::suggest)
            .get("/api/defend/pending", defense::pending)
            .get("/api/token/status", token::status)
            .post("/api/token/update", token::update)
            .get("/api/settings", settingsHandler::get)
            .post("/api/settings", settingsHandler::update)
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/", exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "VouchGuard\n\n" +
                    "API:     GET /api/health, /api/stats, /api/relations, /api/alerts\n" +
                    "Defend:  POST /api/defend, /api/defend/confirm/{alertId}\n" +
                    "Token:   GET /api/token/status, POST /api/token/update\n"
                );
            });

        HttpHandler blocking = new BlockingHandler(routes);

        // CORS Handler
        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, PATCH, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                blocking.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(settings.port(), "0.0.0.0")
            .setHandler(corsHandler)
            .build();
        server.start();
        log.info("VouchGuard started on http://localhost:{}/ (monitoring {}, every {}m)",
            settings.port(), settings.userKey(), settings.intervalMinutes());

        TelegramUpdatePoller pollerRef = poller;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down VouchGuard");
            scheduler.stop();
            tokenWatchdog.stopMonitoring();
            if (pollerRef != null) {
                pollerRef.stop();
            }
            dispatcher.stop();
            server.stop();
            dataSource.close();
        }, "shutdown"));
    }

    private static HikariDataSource createDataSource(MonitorSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.dbUrl());
        config.setUsername(settings.dbUser());
        config.setPassword(settings.dbPass());
        config.setMaximumPoolSize(settings.dbPoolSize());
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("vouchguard-hikari");

        log.info("DB: url={}, user={}, pool={}", settings.dbUrl(), settings.dbUser(), settings.dbPoolSize());
        return new HikariDataSource(config);
    }

    private App() {}
}
