package in.cryptai.infrastructure.metrics;

import in.cryptai.domain.signal.RunResult;

import java.time.Duration;

/**
 * Signal generation metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus, Grafana, CloudWatch, etc.
 *
 * Key metrics:
 * - Hourly run outcomes (completed, already done, conflict, ...)
 * - Run duration
 * - Candidates scored and Scorer failures
 * - Winners committed
 * - Best-of-day materializations
 */
public interface GenerationMetrics {

    /**
     * Record the end of one hourly run.
     *
     * @param outcome How the run ended
     * @param duration Wall time of the run, scoring included
     */
    void recordRun(RunResult.Outcome outcome, Duration duration);

    /**
     * Record candidates that returned a usable score.
     */
    void recordScored(int count);

    /**
     * Record one candidate dropped because the Scorer failed.
     */
    void recordScorerFailure();

    /**
     * Record winners committed for a slot.
     */
    void recordWinners(int count);

    /**
     * Record a best-of-day pass.
     *
     * @param dryRun Whether the pass only previewed the ranking
     * @param marked Signals ranked in the pass
     */
    void recordMaterialization(boolean dryRun, int marked);

    /**
     * Metrics sink that discards everything.
     */
    static GenerationMetrics noop() {
        return new GenerationMetrics() {
            @Override
            public void recordRun(RunResult.Outcome outcome, Duration duration) {}

            @Override
            public void recordScored(int count) {}

            @Override
            public void recordScorerFailure() {}

            @Override
            public void recordWinners(int count) {}

            @Override
            public void recordMaterialization(boolean dryRun, int marked) {}
        };
    }
}
