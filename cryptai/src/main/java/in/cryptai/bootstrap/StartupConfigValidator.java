package in.cryptai.bootstrap;

import in.cryptai.config.GenerationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Collects every problem, logs them, then
 * throws IllegalStateException so the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(GenerationConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> errors = new ArrayList<>();

        if (config.signalsPerHour() < 1) {
            errors.add("SIGNALS_PER_HOUR must be >= 1 (got " + config.signalsPerHour() + ")");
        }
        if (config.candidatePoolSize() < config.signalsPerHour()) {
            errors.add("CANDIDATE_POOL_SIZE (" + config.candidatePoolSize()
                + ") must be >= SIGNALS_PER_HOUR (" + config.signalsPerHour() + ")");
        }
        if (config.bestOfDayLimit() < 1) {
            errors.add("BEST_OF_DAY_LIMIT must be >= 1 (got " + config.bestOfDayLimit() + ")");
        }
        if (config.scoringParallelism() < 1) {
            errors.add("SCORING_PARALLELISM must be >= 1 (got " + config.scoringParallelism() + ")");
        }
        if (config.triggerOffsetMinutes() < 0 || config.triggerOffsetMinutes() > 59) {
            errors.add("TRIGGER_OFFSET_MINUTES must be 0..59 (got " + config.triggerOffsetMinutes() + ")");
        }
        if (config.materializeOffsetMinutes() < 0 || config.materializeOffsetMinutes() > 59) {
            errors.add("MATERIALIZE_OFFSET_MINUTES must be 0..59 (got " + config.materializeOffsetMinutes() + ")");
        }
        if (config.scorerTimeout().isNegative() || config.scorerTimeout().isZero()) {
            errors.add("SCORER_TIMEOUT_MS must be > 0");
        }
        if (!isHttpUrl(config.scorerUrl())) {
            errors.add("SCORER_URL must be an http(s) URL (got " + config.scorerUrl() + ")");
        }

        if (!errors.isEmpty()) {
            for (String error : errors) {
                log.error("❌ {}", error);
            }
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", errors));
        }

        log.info("Generation: {} per hour from pool of {}, best of day top {}",
            config.signalsPerHour(), config.candidatePoolSize(), config.bestOfDayLimit());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static boolean isHttpUrl(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            URI uri = URI.create(value);
            return ("http".equals(uri.getScheme()) || "https".equals(uri.getScheme())) && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
