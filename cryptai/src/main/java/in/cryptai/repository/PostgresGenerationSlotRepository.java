package in.cryptai.repository;

import in.cryptai.domain.signal.GenerationSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of GenerationSlotRepository.
 * Rows are never deleted; completed_at moves from NULL to a timestamp once.
 */
public final class PostgresGenerationSlotRepository implements GenerationSlotRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresGenerationSlotRepository.class);

    private final DataSource dataSource;
    private final Clock clock;

    public PostgresGenerationSlotRepository(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Optional<GenerationSlot> find(LocalDate date, int hour) {
        String sql = """
            SELECT * FROM generation_slots
            WHERE slot_date = ? AND slot_hour = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, date);
            ps.setInt(2, hour);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find slot {} h{}: {}", date, hour, e.getMessage());
            throw new RuntimeException("Failed to find generation slot", e);
        }
        return Optional.empty();
    }

    @Override
    public List<GenerationSlot> findByDate(LocalDate date) {
        String sql = """
            SELECT * FROM generation_slots
            WHERE slot_date = ?
            ORDER BY slot_hour ASC
            """;

        List<GenerationSlot> slots = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, date);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    slots.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find slots for {}: {}", date, e.getMessage());
            throw new RuntimeException("Failed to find generation slots", e);
        }
        return slots;
    }

    @Override
    public void ensureExists(LocalDate date, int hour) {
        String existsSql = """
            SELECT 1 FROM generation_slots
            WHERE slot_date = ? AND slot_hour = ?
            """;

        String insertSql = """
            INSERT INTO generation_slots (slot_date, slot_hour, completed_at, created_at)
            VALUES (?, ?, NULL, ?)
            """;

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(existsSql)) {
                ps.setObject(1, date);
                ps.setInt(2, hour);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        return;
                    }
                }
            }

            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setObject(1, date);
                ps.setInt(2, hour);
                ps.setTimestamp(3, Timestamp.from(clock.instant()));
                ps.executeUpdate();
                log.info("[SLOT] Created slot {} h{}", date, hour);
            } catch (SQLException e) {
                if (!SqlStates.isIntegrityViolation(e)) {
                    throw e;
                }
                log.debug("[SLOT] Slot {} h{} created concurrently", date, hour);
            }

        } catch (Exception e) {
            log.error("Failed to create slot {} h{}: {}", date, hour, e.getMessage());
            throw new RuntimeException("Failed to create generation slot", e);
        }
    }

    @Override
    public Optional<GenerationSlot> lockForUpdate(Connection conn, LocalDate date, int hour) throws SQLException {
        String sql = """
            SELECT * FROM generation_slots
            WHERE slot_date = ? AND slot_hour = ?
            FOR UPDATE
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, date);
            ps.setInt(2, hour);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean markCompleted(Connection conn, LocalDate date, int hour, Instant completedAt) throws SQLException {
        String sql = """
            UPDATE generation_slots
            SET completed_at = ?
            WHERE slot_date = ? AND slot_hour = ? AND completed_at IS NULL
            """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(completedAt));
            ps.setObject(2, date);
            ps.setInt(3, hour);
            return ps.executeUpdate() == 1;
        }
    }

    private GenerationSlot mapRow(ResultSet rs) throws SQLException {
        Timestamp completedTs = rs.getTimestamp("completed_at");
        Timestamp createdTs = rs.getTimestamp("created_at");
        return new GenerationSlot(
            rs.getLong("slot_id"),
            rs.getObject("slot_date", LocalDate.class),
            rs.getInt("slot_hour"),
            completedTs != null ? completedTs.toInstant() : null,
            createdTs != null ? createdTs.toInstant() : null
        );
    }
}
