package in.cryptai.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.cryptai.config.GenerationConfig;
import in.cryptai.domain.signal.MaterializationReport;
import in.cryptai.domain.signal.RunResult;
import in.cryptai.domain.signal.Signal;
import in.cryptai.infrastructure.candidate.PostgresCandidateProvider;
import in.cryptai.infrastructure.metrics.PrometheusGenerationMetrics;
import in.cryptai.infrastructure.metrics.PrometheusMetricsHandler;
import in.cryptai.infrastructure.scoring.HttpScorer;
import in.cryptai.migration.SignalSchemaMigration;
import in.cryptai.repository.GenerationSlotRepository;
import in.cryptai.repository.PostgresGenerationSlotRepository;
import in.cryptai.repository.PostgresSignalRepository;
import in.cryptai.repository.SignalRepository;
import in.cryptai.service.daily.DayMaterializer;
import in.cryptai.service.read.SignalReadModel;
import in.cryptai.service.scheduler.GenerationScheduler;
import in.cryptai.service.signal.CandidateFilter;
import in.cryptai.service.signal.CandidateScorer;
import in.cryptai.service.signal.HourlySignalGenerator;
import in.cryptai.service.signal.RandomCandidateSampler;
import in.cryptai.service.signal.Selector;
import in.cryptai.service.signal.SignalPersister;
import in.cryptai.service.slot.SlotManager;
import in.cryptai.transport.http.SignalApiHandler;
import in.cryptai.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;

/**
 * CryptAI signal engine.
 *
 * Wires:
 * - PostgreSQL repositories (generation ledger, trading signals)
 * - Hourly generation pipeline (filter, score, select, persist)
 * - Best-of-day materializer
 * - Read API and Prometheus metrics over Undertow
 *
 * Operator commands (run once and exit):
 * <pre>
 *   run-hour YYYY-MM-DD H
 *   materialize YYYY-MM-DD [--dry-run]
 * </pre>
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== CryptAI Signal Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 8080);
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Configuration (hard gate)
        // ═══════════════════════════════════════════════════════════════
        GenerationConfig config = GenerationConfig.fromEnv();
        StartupConfigValidator.validate(config);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource();
        new SignalSchemaMigration(dataSource).migrate();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusGenerationMetrics metrics = new PrometheusGenerationMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Repositories
        // ═══════════════════════════════════════════════════════════════
        GenerationSlotRepository slotRepo = new PostgresGenerationSlotRepository(dataSource, clock);
        SignalRepository signalRepo = new PostgresSignalRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Generation pipeline
        // ═══════════════════════════════════════════════════════════════
        SlotManager slotManager = new SlotManager(slotRepo, clock);
        CandidateFilter candidateFilter = new CandidateFilter(
            new PostgresCandidateProvider(dataSource), signalRepo, new RandomCandidateSampler());
        CandidateScorer candidateScorer = new CandidateScorer(
            new HttpScorer(config.scorerUrl(), config.scorerTimeout()), config.scoringParallelism(), metrics);
        SignalPersister persister = new SignalPersister(dataSource, slotManager, signalRepo, clock);
        HourlySignalGenerator generator = new HourlySignalGenerator(
            slotManager, candidateFilter, candidateScorer, new Selector(), persister, config, metrics, clock);

        DayMaterializer materializer = new DayMaterializer(
            dataSource, signalRepo, slotRepo, config.bestOfDayLimit(), metrics);

        // ═══════════════════════════════════════════════════════════════
        // Operator commands
        // ═══════════════════════════════════════════════════════════════
        if (args.length > 0) {
            try {
                runCommand(args, generator, materializer);
            } finally {
                candidateScorer.shutdown();
                dataSource.close();
            }
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Scheduler
        // ═══════════════════════════════════════════════════════════════
        GenerationScheduler scheduler = new GenerationScheduler(
            generator, materializer, clock, config.triggerOffsetMinutes(), config.materializeOffsetMinutes());
        if (config.schedulerEnabled()) {
            scheduler.start();
            log.info("✓ Generation scheduler started");
        } else {
            log.warn("⚠ Generation scheduler disabled (SCHEDULER_ENABLED=false), read API only");
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP Server
        // ═══════════════════════════════════════════════════════════════
        SignalReadModel readModel = new SignalReadModel(signalRepo, slotRepo, config.bestOfDayLimit(), clock);
        SignalApiHandler apiHandler = new SignalApiHandler(readModel, clock);

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes(apiHandler, new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        // ═══════════════════════════════════════════════════════════════
        // Shutdown
        // ═══════════════════════════════════════════════════════════════
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            scheduler.stop();
            candidateScorer.shutdown();
            server.stop();
            dataSource.close();
            log.info("Shutdown complete");
        }, "shutdown-hook"));
    }

    /**
     * Route table. Handlers hit JDBC, so everything runs off the IO thread.
     */
    public static HttpHandler routes(SignalApiHandler api, HttpHandler metricsHandler) {
        RoutingHandler routes = Handlers.routing()
            .get("/api/health", api::getHealth)
            .get("/metrics", metricsHandler)
            .get("/api/signals/hourly", api::getHourly)
            .get("/api/signals/best", api::getBest)
            .get("/api/signals/best/dates", api::getBestDates)
            .get("/api/signals/slots", api::getSlots);
        return new BlockingHandler(routes);
    }

    private static void runCommand(String[] args, HourlySignalGenerator generator, DayMaterializer materializer) {
        switch (args[0]) {
            case "run-hour" -> {
                if (args.length < 3) {
                    throw new IllegalArgumentException("Usage: run-hour YYYY-MM-DD H");
                }
                RunResult result = generator.runHour(LocalDate.parse(args[1]), Integer.parseInt(args[2]));
                log.info("run-hour {} {}:00 -> {} winners={}",
                    result.date(), result.hour(), result.outcome(), result.winners());
            }
            case "materialize" -> {
                if (args.length < 2) {
                    throw new IllegalArgumentException("Usage: materialize YYYY-MM-DD [--dry-run]");
                }
                boolean dryRun = Arrays.asList(args).contains("--dry-run");
                MaterializationReport report = materializer.materialize(LocalDate.parse(args[1]), dryRun);
                for (Signal s : report.best()) {
                    log.info("#{} signal={} candidate={} score={}",
                        s.bestOfDayRank(), s.signalId(), s.candidateId(), s.score());
                }
                if (report.isPartial()) {
                    log.warn("Unfinalized hours: {}", report.unfinalizedHours());
                }
            }
            default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
        }
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/cryptai");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("cryptai-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }
}
