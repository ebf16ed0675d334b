package in.cryptai.repository;

import in.cryptai.domain.signal.BestOfDayDate;
import in.cryptai.domain.signal.Signal;
import in.cryptai.util.UtcDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * PostgreSQL implementation of SignalRepository.
 *
 * Rows are append-only apart from the best-of-day columns; losing rows are
 * kept with is_valid = FALSE for audit.
 */
public final class PostgresSignalRepository implements SignalRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresSignalRepository.class);

    // Valid and attributed to a date: produced_date, else created_at within [start, end)
    private static final String ATTRIBUTED_TO_DATE = """
        is_valid = TRUE
        AND (produced_date = ?
             OR (produced_date IS NULL AND created_at >= ? AND created_at < ?))
        """;

    // Valid and touching a date by either produced_date or created_at; used for same-day exclusion
    private static final String SIGNALED_ON_DATE = """
        is_valid = TRUE
        AND (produced_date = ?
             OR (created_at >= ? AND created_at < ?))
        """;

    private final DataSource dataSource;

    public PostgresSignalRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Set<String> findCandidatesSignaledOn(LocalDate date) {
        String sql = "SELECT DISTINCT candidate_id FROM trading_signals WHERE " + SIGNALED_ON_DATE;

        Set<String> candidates = new LinkedHashSet<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            bindAttributedDate(ps, 1, date);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    candidates.add(rs.getString("candidate_id"));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find signaled candidates for {}: {}", date, e.getMessage());
            throw new RuntimeException("Failed to find signaled candidates", e);
        }
        return candidates;
    }

    @Override
    public boolean existsValidOnDate(Connection conn, String candidateId, LocalDate date) throws SQLException {
        String sql = "SELECT 1 FROM trading_signals WHERE candidate_id = ? AND " + SIGNALED_ON_DATE;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, candidateId);
            bindAttributedDate(ps, 2, date);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public long insert(Connection conn, Signal signal) throws SQLException {
        String sql = """
            INSERT INTO trading_signals (
                candidate_id, produced_date, produced_hour, created_at,
                score, is_valid, valid_day_key,
                is_best_of_day, best_of_day_date, best_of_day_rank
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            int idx = 1;
            ps.setString(idx++, signal.candidateId());
            setDateOrNull(ps, idx++, signal.producedDate());
            setIntOrNull(ps, idx++, signal.producedHour());
            ps.setTimestamp(idx++, Timestamp.from(signal.createdAt()));
            ps.setDouble(idx++, signal.score());
            ps.setBoolean(idx++, signal.valid());
            ps.setString(idx++, validDayKey(signal));
            ps.setBoolean(idx++, signal.bestOfDay());
            setDateOrNull(ps, idx++, signal.bestOfDayDate());
            setIntOrNull(ps, idx++, signal.bestOfDayRank());

            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    return keys.getLong(1);
                }
            }
        }
        throw new SQLException("Insert did not return a signal_id for " + signal.candidateId());
    }

    @Override
    public List<Signal> findValidBySlot(LocalDate date, int hour) {
        String sql = """
            SELECT * FROM trading_signals
            WHERE is_valid = TRUE AND produced_date = ? AND produced_hour = ?
            ORDER BY score DESC, candidate_id ASC
            """;

        List<Signal> signals = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, date);
            ps.setInt(2, hour);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    signals.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find signals for slot {} h{}: {}", date, hour, e.getMessage());
            throw new RuntimeException("Failed to find signals", e);
        }
        return signals;
    }

    @Override
    public List<Signal> findValidAttributedTo(Connection conn, LocalDate date) throws SQLException {
        String sql = "SELECT * FROM trading_signals WHERE " + ATTRIBUTED_TO_DATE
            + " ORDER BY score DESC, candidate_id ASC, signal_id ASC";

        List<Signal> signals = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindAttributedDate(ps, 1, date);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    signals.add(mapRow(rs));
                }
            }
        }
        return signals;
    }

    @Override
    public List<Signal> findValidCreatedOn(LocalDate date) {
        String sql = """
            SELECT * FROM trading_signals
            WHERE is_valid = TRUE AND created_at >= ? AND created_at < ?
            ORDER BY score DESC, candidate_id ASC, signal_id ASC
            """;

        List<Signal> signals = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(UtcDates.startOf(date)));
            ps.setTimestamp(2, Timestamp.from(UtcDates.endOf(date)));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    signals.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find signals created on {}: {}", date, e.getMessage());
            throw new RuntimeException("Failed to find signals", e);
        }
        return signals;
    }

    @Override
    public List<Signal> findBestOfDay(LocalDate date) {
        // Both the mark and created_at must agree with the date
        String sql = """
            SELECT * FROM trading_signals
            WHERE is_best_of_day = TRUE
              AND best_of_day_date = ?
              AND is_valid = TRUE
              AND created_at >= ? AND created_at < ?
            ORDER BY best_of_day_rank ASC, score DESC, candidate_id ASC
            """;

        List<Signal> signals = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, date);
            ps.setTimestamp(2, Timestamp.from(UtcDates.startOf(date)));
            ps.setTimestamp(3, Timestamp.from(UtcDates.endOf(date)));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    signals.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find best-of-day signals for {}: {}", date, e.getMessage());
            throw new RuntimeException("Failed to find best-of-day signals", e);
        }
        return signals;
    }

    @Override
    public int clearBestOfDay(Connection conn, LocalDate date) throws SQLException {
        String sql = """
            UPDATE trading_signals
            SET is_best_of_day = FALSE, best_of_day_date = NULL, best_of_day_rank = NULL
            WHERE best_of_day_date = ?
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, date);
            return ps.executeUpdate();
        }
    }

    @Override
    public void markBestOfDay(Connection conn, long signalId, LocalDate date, int rank) throws SQLException {
        String sql = """
            UPDATE trading_signals
            SET is_best_of_day = TRUE, best_of_day_date = ?, best_of_day_rank = ?
            WHERE signal_id = ? AND is_valid = TRUE
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, date);
            ps.setInt(2, rank);
            ps.setLong(3, signalId);
            if (ps.executeUpdate() != 1) {
                throw new SQLException("Valid signal not found for best-of-day mark: " + signalId);
            }
        }
    }

    @Override
    public List<BestOfDayDate> findBestOfDayDates() {
        String sql = """
            SELECT best_of_day_date, COUNT(*) AS signal_count
            FROM trading_signals
            WHERE is_best_of_day = TRUE AND best_of_day_date IS NOT NULL
            GROUP BY best_of_day_date
            ORDER BY best_of_day_date DESC
            """;

        List<BestOfDayDate> dates = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                dates.add(new BestOfDayDate(
                    rs.getObject("best_of_day_date", LocalDate.class),
                    rs.getInt("signal_count")));
            }
        } catch (Exception e) {
            log.error("Failed to find best-of-day dates: {}", e.getMessage());
            throw new RuntimeException("Failed to find best-of-day dates", e);
        }
        return dates;
    }

    static String validDayKey(Signal signal) {
        if (!signal.valid()) {
            return null;
        }
        return signal.candidateId() + "|" + signal.attributedDate();
    }

    private static void bindAttributedDate(PreparedStatement ps, int start, LocalDate date) throws SQLException {
        ps.setObject(start, date);
        ps.setTimestamp(start + 1, Timestamp.from(UtcDates.startOf(date)));
        ps.setTimestamp(start + 2, Timestamp.from(UtcDates.endOf(date)));
    }

    private Signal mapRow(ResultSet rs) throws SQLException {
        return new Signal(
            rs.getLong("signal_id"),
            rs.getString("candidate_id"),
            rs.getObject("produced_date", LocalDate.class),
            getIntOrNull(rs, "produced_hour"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getDouble("score"),
            rs.getBoolean("is_valid"),
            rs.getBoolean("is_best_of_day"),
            rs.getObject("best_of_day_date", LocalDate.class),
            getIntOrNull(rs, "best_of_day_rank")
        );
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static void setIntOrNull(PreparedStatement ps, int idx, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(idx, value);
        } else {
            ps.setNull(idx, Types.INTEGER);
        }
    }

    private static void setDateOrNull(PreparedStatement ps, int idx, LocalDate value) throws SQLException {
        if (value != null) {
            ps.setObject(idx, value);
        } else {
            ps.setNull(idx, Types.DATE);
        }
    }
}
