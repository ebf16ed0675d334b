package in.cryptai.config;

import in.cryptai.util.Env;

import java.time.Duration;

/**
 * Configuration for hourly signal generation and best-of-day materialization.
 *
 * Loaded from environment variables at startup (see {@link #fromEnv()}).
 * Checked by StartupConfigValidator before anything is wired.
 */
public record GenerationConfig(
    int signalsPerHour,             // winners picked per hourly slot (top-K)
    int candidatePoolSize,          // max candidates sampled and scored per run
    int bestOfDayLimit,             // signals kept in the end-of-day snapshot
    boolean finalizeEmptySlots,     // finalize a slot when no candidate is eligible
    int scoringParallelism,         // concurrent Scorer calls per run
    int triggerOffsetMinutes,       // minute of the UTC hour the hourly run fires
    int materializeOffsetMinutes,   // minute after UTC midnight the daily snapshot fires
    boolean schedulerEnabled,
    String scorerUrl,
    Duration scorerTimeout
) {
    public static final int DEFAULT_SIGNALS_PER_HOUR = 5;
    public static final int DEFAULT_CANDIDATE_POOL_SIZE = 50;
    public static final int DEFAULT_BEST_OF_DAY_LIMIT = 10;

    /**
     * Design defaults: 5 winners per hour out of at most 50 sampled candidates,
     * top 10 per day, run at the top of every UTC hour.
     */
    public static GenerationConfig defaults() {
        return new GenerationConfig(
            DEFAULT_SIGNALS_PER_HOUR,
            DEFAULT_CANDIDATE_POOL_SIZE,
            DEFAULT_BEST_OF_DAY_LIMIT,
            true,
            4,
            0,
            5,
            true,
            "http://localhost:8000",
            Duration.ofSeconds(10)
        );
    }

    public static GenerationConfig fromEnv() {
        GenerationConfig d = defaults();
        return new GenerationConfig(
            Env.getInt("SIGNALS_PER_HOUR", d.signalsPerHour()),
            Env.getInt("CANDIDATE_POOL_SIZE", d.candidatePoolSize()),
            Env.getInt("BEST_OF_DAY_LIMIT", d.bestOfDayLimit()),
            Env.getBool("FINALIZE_EMPTY_SLOTS", d.finalizeEmptySlots()),
            Env.getInt("SCORING_PARALLELISM", d.scoringParallelism()),
            Env.getInt("TRIGGER_OFFSET_MINUTES", d.triggerOffsetMinutes()),
            Env.getInt("MATERIALIZE_OFFSET_MINUTES", d.materializeOffsetMinutes()),
            Env.getBool("SCHEDULER_ENABLED", d.schedulerEnabled()),
            Env.get("SCORER_URL", d.scorerUrl()),
            Duration.ofMillis(Env.getLong("SCORER_TIMEOUT_MS", d.scorerTimeout().toMillis()))
        );
    }

    public GenerationConfig withSignalsPerHour(int value) {
        return new GenerationConfig(value, candidatePoolSize, bestOfDayLimit, finalizeEmptySlots,
            scoringParallelism, triggerOffsetMinutes, materializeOffsetMinutes, schedulerEnabled,
            scorerUrl, scorerTimeout);
    }

    public GenerationConfig withCandidatePoolSize(int value) {
        return new GenerationConfig(signalsPerHour, value, bestOfDayLimit, finalizeEmptySlots,
            scoringParallelism, triggerOffsetMinutes, materializeOffsetMinutes, schedulerEnabled,
            scorerUrl, scorerTimeout);
    }

    public GenerationConfig withFinalizeEmptySlots(boolean value) {
        return new GenerationConfig(signalsPerHour, candidatePoolSize, bestOfDayLimit, value,
            scoringParallelism, triggerOffsetMinutes, materializeOffsetMinutes, schedulerEnabled,
            scorerUrl, scorerTimeout);
    }

    public GenerationConfig withTriggerOffsetMinutes(int value) {
        return new GenerationConfig(signalsPerHour, candidatePoolSize, bestOfDayLimit, finalizeEmptySlots,
            scoringParallelism, value, materializeOffsetMinutes, schedulerEnabled,
            scorerUrl, scorerTimeout);
    }
}
