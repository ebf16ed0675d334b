package in.cryptai.infrastructure.metrics;

import in.cryptai.domain.signal.RunResult;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Prometheus implementation of GenerationMetrics.
 *
 * Exposed at /metrics endpoint.
 *
 * Key Metrics:
 * - generation_runs_total{outcome} - Hourly run outcomes
 * - generation_run_duration_seconds - Run latency distribution
 * - generation_candidates_scored_total - Candidates with a usable score
 * - generation_scorer_failures_total - Candidates dropped by Scorer errors
 * - generation_winners_total - Winners committed
 * - generation_last_winners - Winners committed by the latest completed run
 * - best_of_day_materializations_total{mode} - Day snapshots (apply | dry_run)
 */
public class PrometheusGenerationMetrics implements GenerationMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusGenerationMetrics.class);

    private final CollectorRegistry registry;

    private final Counter runCounter;
    private final Histogram runDuration;
    private final Counter scoredCounter;
    private final Counter scorerFailureCounter;
    private final Counter winnerCounter;
    private final Gauge lastWinners;
    private final Counter materializationCounter;

    public PrometheusGenerationMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusGenerationMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.runCounter = Counter.build()
            .name("generation_runs_total")
            .help("Hourly generation runs by outcome")
            .labelNames("outcome")
            .register(registry);

        this.runDuration = Histogram.build()
            .name("generation_run_duration_seconds")
            .help("Hourly generation run duration in seconds")
            .buckets(0.1, 0.5, 1.0, 5.0, 15.0, 30.0, 60.0, 300.0)
            .register(registry);

        this.scoredCounter = Counter.build()
            .name("generation_candidates_scored_total")
            .help("Candidates that returned a usable score")
            .register(registry);

        this.scorerFailureCounter = Counter.build()
            .name("generation_scorer_failures_total")
            .help("Candidates dropped because the scorer failed")
            .register(registry);

        this.winnerCounter = Counter.build()
            .name("generation_winners_total")
            .help("Winning signals committed")
            .register(registry);

        this.lastWinners = Gauge.build()
            .name("generation_last_winners")
            .help("Winners committed by the latest completed run")
            .register(registry);

        this.materializationCounter = Counter.build()
            .name("best_of_day_materializations_total")
            .help("Best-of-day snapshot passes")
            .labelNames("mode")
            .register(registry);

        log.info("Prometheus generation metrics registered");
    }

    @Override
    public void recordRun(RunResult.Outcome outcome, Duration duration) {
        runCounter.labels(outcome.name().toLowerCase(Locale.ROOT)).inc();
        runDuration.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordScored(int count) {
        if (count > 0) {
            scoredCounter.inc(count);
        }
    }

    @Override
    public void recordScorerFailure() {
        scorerFailureCounter.inc();
    }

    @Override
    public void recordWinners(int count) {
        if (count > 0) {
            winnerCounter.inc(count);
        }
        lastWinners.set(count);
    }

    @Override
    public void recordMaterialization(boolean dryRun, int marked) {
        materializationCounter.labels(dryRun ? "dry_run" : "apply").inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
