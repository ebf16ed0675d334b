package in.cryptai.domain.signal;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Idempotency ledger row for one (date, hour).
 * completedAt is set exactly once, by the run that commits the hour's winners.
 */
public record GenerationSlot(
        long slotId,
        LocalDate slotDate,
        int slotHour,
        Instant completedAt,
        Instant createdAt) {

    public boolean isCompleted() {
        return completedAt != null;
    }
}
