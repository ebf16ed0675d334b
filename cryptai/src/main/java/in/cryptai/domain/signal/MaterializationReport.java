package in.cryptai.domain.signal;

import java.time.LocalDate;
import java.util.List;

/**
 * What one DayMaterializer pass ranked (and, unless dryRun, marked) for a date.
 *
 * @param best ranked signals, rank 1 first, with best-of-day fields populated
 * @param unfinalizedHours hours of the date whose slot had not been finalized
 * @param clearedMarks rows whose previous best-of-day mark for this date was removed
 */
public record MaterializationReport(
        LocalDate date,
        boolean dryRun,
        List<Signal> best,
        List<Integer> unfinalizedHours,
        int clearedMarks) {

    public boolean isPartial() {
        return !unfinalizedHours.isEmpty();
    }
}
