package in.cryptai.service.signal;

import in.cryptai.config.GenerationConfig;
import in.cryptai.domain.signal.PersistOutcome;
import in.cryptai.domain.signal.RunResult;
import in.cryptai.domain.signal.RunResult.Outcome;
import in.cryptai.domain.signal.ScoredCandidate;
import in.cryptai.infrastructure.metrics.GenerationMetrics;
import in.cryptai.service.slot.SlotManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Runs the per-hour pipeline: slot check, filter, score, select, persist.
 *
 * Safe to call concurrently and repeatedly for the same (date, hour): at most
 * one run commits, the others report ALREADY_DONE. Scoring happens before the
 * slot lock is taken, so a slow Scorer never holds a database transaction.
 */
public final class HourlySignalGenerator {
    private static final Logger log = LoggerFactory.getLogger(HourlySignalGenerator.class);

    private final SlotManager slotManager;
    private final CandidateFilter candidateFilter;
    private final CandidateScorer candidateScorer;
    private final Selector selector;
    private final SignalPersister persister;
    private final GenerationConfig config;
    private final GenerationMetrics metrics;
    private final Clock clock;

    public HourlySignalGenerator(SlotManager slotManager,
                                 CandidateFilter candidateFilter,
                                 CandidateScorer candidateScorer,
                                 Selector selector,
                                 SignalPersister persister,
                                 GenerationConfig config,
                                 GenerationMetrics metrics,
                                 Clock clock) {
        this.slotManager = slotManager;
        this.candidateFilter = candidateFilter;
        this.candidateScorer = candidateScorer;
        this.selector = selector;
        this.persister = persister;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    public RunResult runHour(LocalDate date, int hour) {
        Instant start = clock.instant();
        RunResult result = execute(date, hour);
        metrics.recordRun(result.outcome(), Duration.between(start, clock.instant()));
        log.info("[GENERATE] {} {}:00 -> {} (eligible={}, scored={}, winners={})",
            date, hour, result.outcome(), result.eligibleCount(), result.scoredCount(), result.winners());
        return result;
    }

    private RunResult execute(LocalDate date, int hour) {
        if (slotManager.isCompleted(date, hour)) {
            return RunResult.of(date, hour, Outcome.ALREADY_DONE, 0, 0, List.of());
        }

        Set<String> eligible = candidateFilter.eligible(date, config.candidatePoolSize());
        if (eligible.isEmpty()) {
            if (!config.finalizeEmptySlots()) {
                return RunResult.of(date, hour, Outcome.NO_CANDIDATES, 0, 0, List.of());
            }
            PersistOutcome outcome = persister.persist(date, hour, List.of(), List.of());
            return RunResult.of(date, hour, map(outcome, Outcome.COMPLETED_EMPTY), 0, 0, List.of());
        }

        List<ScoredCandidate> scored = candidateScorer.scoreAll(eligible);
        if (scored.isEmpty()) {
            log.warn("[GENERATE] {} {}:00 every scorer call failed, slot left open", date, hour);
            return RunResult.of(date, hour, Outcome.NOTHING_SCORED, eligible.size(), 0, List.of());
        }

        List<ScoredCandidate> winners = selector.select(scored, config.signalsPerHour());
        PersistOutcome outcome = persister.persist(date, hour, scored, winners);
        List<String> winnerIds = outcome == PersistOutcome.COMMITTED
            ? winners.stream().map(ScoredCandidate::candidateId).toList()
            : List.of();
        if (outcome == PersistOutcome.COMMITTED) {
            metrics.recordWinners(winnerIds.size());
        }
        return RunResult.of(date, hour, map(outcome, Outcome.COMPLETED), eligible.size(), scored.size(), winnerIds);
    }

    private static Outcome map(PersistOutcome outcome, Outcome onCommit) {
        return switch (outcome) {
            case COMMITTED -> onCommit;
            case ALREADY_DONE -> Outcome.ALREADY_DONE;
            case CONFLICT -> Outcome.CONFLICT;
        };
    }
}
