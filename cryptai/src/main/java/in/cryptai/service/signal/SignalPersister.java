package in.cryptai.service.signal;

import in.cryptai.domain.signal.PersistOutcome;
import in.cryptai.domain.signal.ScoredCandidate;
import in.cryptai.domain.signal.Signal;
import in.cryptai.domain.signal.SlotAcquisition;
import in.cryptai.repository.SignalRepository;
import in.cryptai.repository.SqlStates;
import in.cryptai.service.slot.SlotManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes one hour's outcome atomically.
 *
 * In a single transaction: lock the slot, re-check it, verify no winner already
 * holds a valid signal that day, insert winners (valid, slot-attributed) and
 * the rest of the scored pool (invalid, audit only), then finalize the slot.
 * Any failure rolls the whole hour back and leaves the slot open.
 */
public final class SignalPersister {
    private static final Logger log = LoggerFactory.getLogger(SignalPersister.class);

    private final DataSource dataSource;
    private final SlotManager slotManager;
    private final SignalRepository signalRepo;
    private final Clock clock;

    public SignalPersister(DataSource dataSource, SlotManager slotManager,
                           SignalRepository signalRepo, Clock clock) {
        this.dataSource = dataSource;
        this.slotManager = slotManager;
        this.signalRepo = signalRepo;
        this.clock = clock;
    }

    /**
     * @param scoredPool every candidate that got a score this run (winners included)
     * @param winners selected subset; may be empty to finalize an empty slot
     */
    public PersistOutcome persist(LocalDate date, int hour,
                                  List<ScoredCandidate> scoredPool,
                                  List<ScoredCandidate> winners) {
        slotManager.ensureSlot(date, hour);

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                SlotAcquisition acquisition = slotManager.acquire(conn, date, hour);
                if (acquisition.isAlreadyDone()) {
                    conn.rollback();
                    return PersistOutcome.ALREADY_DONE;
                }

                Instant createdAt = clock.instant();
                Set<String> winnerIds = new HashSet<>();

                for (ScoredCandidate w : winners) {
                    if (signalRepo.existsValidOnDate(conn, w.candidateId(), date)) {
                        throw new SignalConflictException(w.candidateId(), date);
                    }
                    winnerIds.add(w.candidateId());
                }

                for (ScoredCandidate w : winners) {
                    signalRepo.insert(conn, Signal.winner(w.candidateId(), date, hour, w.score(), createdAt));
                }

                int losers = 0;
                for (ScoredCandidate sc : scoredPool) {
                    if (winnerIds.add(sc.candidateId())) {
                        signalRepo.insert(conn, Signal.loser(sc.candidateId(), sc.score(), createdAt));
                        losers++;
                    }
                }

                if (!slotManager.finalizeSlot(conn, date, hour)) {
                    conn.rollback();
                    return PersistOutcome.ALREADY_DONE;
                }
                conn.commit();

                log.info("[PERSIST] {} {}:00 committed: winners={}, losers={}",
                    date, hour, winners.size(), losers);
                return PersistOutcome.COMMITTED;

            } catch (SignalConflictException e) {
                rollback(conn, date, hour);
                log.warn("[PERSIST] {} {}:00 rolled back: {}", date, hour, e.getMessage());

            } catch (SQLException e) {
                rollback(conn, date, hour);
                if (!SqlStates.isIntegrityViolation(e)) {
                    throw e;
                }
                log.warn("[PERSIST] {} {}:00 rolled back on uniqueness violation: {}",
                    date, hour, e.getMessage());

            } catch (RuntimeException e) {
                rollback(conn, date, hour);
                throw e;
            }
        } catch (SQLException e) {
            log.error("[PERSIST] {} {}:00 failed: {}", date, hour, e.getMessage(), e);
            throw new RuntimeException("Failed to persist signals for " + date + " " + hour + ":00", e);
        }

        // Only conflicts get here; the transaction connection is already returned to the pool
        return conflictOutcome(date, hour);
    }

    /**
     * A conflict caused by a concurrent run of the same hour means that run won.
     */
    private PersistOutcome conflictOutcome(LocalDate date, int hour) {
        return slotManager.isCompleted(date, hour) ? PersistOutcome.ALREADY_DONE : PersistOutcome.CONFLICT;
    }

    private static void rollback(Connection conn, LocalDate date, int hour) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.error("[PERSIST] {} {}:00 rollback failed: {}", date, hour, e.getMessage(), e);
        }
    }
}
