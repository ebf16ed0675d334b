package in.cryptai.domain.signal;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * One scored outcome for one candidate in one hourly run.
 *
 * Winners carry producedDate/producedHour and valid=true. Losers of the same run
 * are kept for audit with valid=false and no slot attribution.
 * Best-of-day fields are written only by the DayMaterializer.
 */
public record Signal(
        long signalId,              // 0 until persisted
        String candidateId,

        // Slot attribution (winners only)
        LocalDate producedDate,
        Integer producedHour,

        Instant createdAt,
        double score,
        boolean valid,

        // End-of-day snapshot
        boolean bestOfDay,
        LocalDate bestOfDayDate,
        Integer bestOfDayRank) {

    public static Signal winner(String candidateId, LocalDate date, int hour, double score, Instant createdAt) {
        return new Signal(0L, candidateId, date, hour, createdAt, score, true, false, null, null);
    }

    public static Signal loser(String candidateId, double score, Instant createdAt) {
        return new Signal(0L, candidateId, null, null, createdAt, score, false, false, null, null);
    }

    /**
     * UTC calendar date this signal counts against: producedDate, or the
     * created_at date for rows written without slot attribution.
     */
    public LocalDate attributedDate() {
        if (producedDate != null) {
            return producedDate;
        }
        return createdAt.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public Signal withId(long id) {
        return new Signal(id, candidateId, producedDate, producedHour, createdAt, score, valid,
            bestOfDay, bestOfDayDate, bestOfDayRank);
    }

    public Signal withBestOfDay(LocalDate date, int rank) {
        return new Signal(signalId, candidateId, producedDate, producedHour, createdAt, score, valid,
            true, date, rank);
    }
}
