package in.cryptai.repository;

import in.cryptai.domain.signal.BestOfDayDate;
import in.cryptai.domain.signal.Signal;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Repository for generated trading signals.
 *
 * A valid signal is attributed to its produced_date, or to the UTC date of
 * created_at when produced_date is missing.
 */
public interface SignalRepository {

    /**
     * Candidates holding a valid signal whose produced_date is the date, or whose
     * created_at falls within it. Wider than attribution: a late backfill row for
     * yesterday created today also blocks today.
     * Used by the CandidateFilter (one win per candidate per day).
     */
    Set<String> findCandidatesSignaledOn(LocalDate date);

    /**
     * Same rule as {@link #findCandidatesSignaledOn}, for one candidate,
     * evaluated inside the persisting transaction.
     */
    boolean existsValidOnDate(Connection conn, String candidateId, LocalDate date) throws SQLException;

    /**
     * Insert a signal row.
     *
     * @return generated signal_id
     * @throws SQLException SQLState class 23 when the valid-per-day key is taken
     */
    long insert(Connection conn, Signal signal) throws SQLException;

    /**
     * Valid signals of one (date, hour) slot, best first.
     */
    List<Signal> findValidBySlot(LocalDate date, int hour);

    /**
     * Valid signals attributed to the date (read inside the materializing transaction).
     */
    List<Signal> findValidAttributedTo(Connection conn, LocalDate date) throws SQLException;

    /**
     * Valid signals whose created_at falls on the UTC date.
     */
    List<Signal> findValidCreatedOn(LocalDate date);

    /**
     * Best-of-day snapshot for the date, restricted to rows created on that date,
     * ordered by rank.
     */
    List<Signal> findBestOfDay(LocalDate date);

    /**
     * Remove best-of-day marks currently pointing at the date.
     *
     * @return rows cleared
     */
    int clearBestOfDay(Connection conn, LocalDate date) throws SQLException;

    void markBestOfDay(Connection conn, long signalId, LocalDate date, int rank) throws SQLException;

    /**
     * Dates that have a best-of-day snapshot, newest first.
     */
    List<BestOfDayDate> findBestOfDayDates();
}
