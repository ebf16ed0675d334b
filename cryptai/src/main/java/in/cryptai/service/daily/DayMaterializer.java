package in.cryptai.service.daily;

import in.cryptai.domain.signal.GenerationSlot;
import in.cryptai.domain.signal.MaterializationReport;
import in.cryptai.domain.signal.Signal;
import in.cryptai.infrastructure.metrics.GenerationMetrics;
import in.cryptai.repository.GenerationSlotRepository;
import in.cryptai.repository.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * End-of-day snapshot: ranks the valid signals attributed to a date and marks
 * the top N as best of day.
 *
 * Rebuilds from scratch on every run. Previous marks for the date are cleared
 * in the same transaction, so re-running is idempotent and never leaves stale
 * marks. Running before all 24 slots are finalized yields a partial snapshot.
 */
public final class DayMaterializer {
    private static final Logger log = LoggerFactory.getLogger(DayMaterializer.class);

    /** Score desc, candidate id asc, signal id asc. */
    static final Comparator<Signal> BEST_OF_DAY_ORDER =
        Comparator.comparingDouble(Signal::score).reversed()
            .thenComparing(Signal::candidateId)
            .thenComparingLong(Signal::signalId);

    private final DataSource dataSource;
    private final SignalRepository signalRepo;
    private final GenerationSlotRepository slotRepo;
    private final int limit;
    private final GenerationMetrics metrics;

    public DayMaterializer(DataSource dataSource,
                           SignalRepository signalRepo,
                           GenerationSlotRepository slotRepo,
                           int limit,
                           GenerationMetrics metrics) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Best-of-day limit must be positive, got " + limit);
        }
        this.dataSource = dataSource;
        this.signalRepo = signalRepo;
        this.slotRepo = slotRepo;
        this.limit = limit;
        this.metrics = metrics;
    }

    public MaterializationReport materialize(LocalDate date) {
        return materialize(date, false);
    }

    /**
     * @param dryRun compute the ranking without writing anything
     */
    public MaterializationReport materialize(LocalDate date, boolean dryRun) {
        List<Integer> unfinalized = unfinalizedHours(date);
        if (!unfinalized.isEmpty()) {
            log.warn("[BEST_OF_DAY] {} materializing with {} unfinalized hours: {}",
                date, unfinalized.size(), unfinalized);
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int cleared = dryRun ? 0 : signalRepo.clearBestOfDay(conn, date);

                List<Signal> candidates = new ArrayList<>(signalRepo.findValidAttributedTo(conn, date));
                candidates.sort(BEST_OF_DAY_ORDER);

                List<Signal> best = new ArrayList<>();
                int rank = 1;
                for (Signal s : candidates) {
                    if (rank > limit) {
                        break;
                    }
                    if (!dryRun) {
                        signalRepo.markBestOfDay(conn, s.signalId(), date, rank);
                    }
                    best.add(s.withBestOfDay(date, rank));
                    rank++;
                }

                if (dryRun) {
                    conn.rollback();
                } else {
                    conn.commit();
                }

                metrics.recordMaterialization(dryRun, best.size());
                log.info("[BEST_OF_DAY] {} {}: ranked={} of {} valid, cleared={}",
                    date, dryRun ? "dry run" : "applied", best.size(), candidates.size(), cleared);
                for (Signal s : best) {
                    log.debug("[BEST_OF_DAY] #{} signal={} candidate={} score={}",
                        s.bestOfDayRank(), s.signalId(), s.candidateId(), s.score());
                }
                return new MaterializationReport(date, dryRun, List.copyOf(best), unfinalized, cleared);

            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException re) {
                    log.error("[BEST_OF_DAY] {} rollback failed: {}", date, re.getMessage(), re);
                }
                throw e;
            }
        } catch (SQLException e) {
            log.error("[BEST_OF_DAY] {} failed: {}", date, e.getMessage(), e);
            throw new RuntimeException("Failed to materialize best of day for " + date, e);
        }
    }

    private List<Integer> unfinalizedHours(LocalDate date) {
        Set<Integer> done = slotRepo.findByDate(date).stream()
            .filter(GenerationSlot::isCompleted)
            .map(GenerationSlot::slotHour)
            .collect(Collectors.toSet());
        List<Integer> missing = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            if (!done.contains(hour)) {
                missing.add(hour);
            }
        }
        return List.copyOf(missing);
    }
}
