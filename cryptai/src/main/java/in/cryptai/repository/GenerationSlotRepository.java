package in.cryptai.repository;

import in.cryptai.domain.signal.GenerationSlot;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the (date, hour) generation ledger.
 *
 * Methods taking a Connection run inside the caller's transaction; the caller
 * owns commit and rollback. The others use their own auto-commit connection.
 */
public interface GenerationSlotRepository {

    /**
     * Read a slot without locking it.
     */
    Optional<GenerationSlot> find(LocalDate date, int hour);

    /**
     * All slots recorded for a date, ordered by hour.
     */
    List<GenerationSlot> findByDate(LocalDate date);

    /**
     * Create the slot row if it is missing (auto-commit).
     * A concurrent creator winning the race is not an error.
     */
    void ensureExists(LocalDate date, int hour);

    /**
     * SELECT ... FOR UPDATE on the slot row. Blocks while another transaction
     * holds the same row; other (date, hour) keys are unaffected.
     */
    Optional<GenerationSlot> lockForUpdate(Connection conn, LocalDate date, int hour) throws SQLException;

    /**
     * Set completed_at if still unset.
     *
     * @return false if the slot was already completed (or missing)
     */
    boolean markCompleted(Connection conn, LocalDate date, int hour, Instant completedAt) throws SQLException;
}
