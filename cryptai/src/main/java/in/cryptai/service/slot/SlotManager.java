package in.cryptai.service.slot;

import in.cryptai.domain.signal.GenerationSlot;
import in.cryptai.domain.signal.SlotAcquisition;
import in.cryptai.repository.GenerationSlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Owns the generation ledger: one row per (date, hour), finalized at most once.
 *
 * acquire() serializes producers of the same hour through a row lock held by
 * the caller's transaction. Producers of different hours never block each other.
 */
public final class SlotManager {
    private static final Logger log = LoggerFactory.getLogger(SlotManager.class);

    private final GenerationSlotRepository slotRepo;
    private final Clock clock;

    public SlotManager(GenerationSlotRepository slotRepo, Clock clock) {
        this.slotRepo = slotRepo;
        this.clock = clock;
    }

    /**
     * Unlocked read. Used to skip scoring for hours that are already done.
     */
    public Optional<GenerationSlot> peek(LocalDate date, int hour) {
        validate(date, hour);
        return slotRepo.find(date, hour);
    }

    public boolean isCompleted(LocalDate date, int hour) {
        return peek(date, hour).map(GenerationSlot::isCompleted).orElse(false);
    }

    public List<GenerationSlot> slotsFor(LocalDate date) {
        return slotRepo.findByDate(date);
    }

    /**
     * Create the slot row if it is missing, in its own auto-commit connection.
     * Call before borrowing the transaction connection for {@link #acquire}, so a
     * producer never holds two pooled connections at once.
     */
    public void ensureSlot(LocalDate date, int hour) {
        validate(date, hour);
        slotRepo.ensureExists(date, hour);
    }

    /**
     * Lock an existing slot inside {@code conn}.
     * The lock is held until the caller commits or rolls back.
     *
     * @param conn open transaction (auto-commit off)
     * @return ALREADY_DONE if the slot was finalized before the lock was granted
     * @throws IllegalStateException if the slot row does not exist; see {@link #ensureSlot}
     */
    public SlotAcquisition acquire(Connection conn, LocalDate date, int hour) throws SQLException {
        validate(date, hour);
        if (conn.getAutoCommit()) {
            throw new IllegalStateException("Slot lock requires an open transaction (auto-commit is on)");
        }

        GenerationSlot slot = slotRepo.lockForUpdate(conn, date, hour)
            .orElseThrow(() -> new IllegalStateException(
                "Slot " + date + " " + hour + ":00 does not exist; ensureSlot must run first"));

        if (slot.isCompleted()) {
            log.info("[SLOT] {} {}:00 already finalized at {}", date, hour, slot.completedAt());
            return SlotAcquisition.alreadyDone(slot);
        }

        log.debug("[SLOT] {} {}:00 locked", date, hour);
        return SlotAcquisition.acquired(slot);
    }

    /**
     * Stamp completed_at. Must run in the transaction that acquired the slot.
     *
     * @return false if another run finalized the slot first; the caller must roll back
     */
    public boolean finalizeSlot(Connection conn, LocalDate date, int hour) throws SQLException {
        if (!slotRepo.markCompleted(conn, date, hour, clock.instant())) {
            log.warn("[SLOT] {} {}:00 was finalized by another run", date, hour);
            return false;
        }
        log.info("[SLOT] {} {}:00 finalized", date, hour);
        return true;
    }

    private static void validate(LocalDate date, int hour) {
        if (date == null) {
            throw new IllegalArgumentException("Slot date is required");
        }
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Slot hour must be 0..23, got " + hour);
        }
    }
}
