package in.cryptai.domain.signal;

import java.time.LocalDate;
import java.util.List;

/**
 * Summary of one hourly generation attempt.
 */
public record RunResult(
        LocalDate date,
        int hour,
        Outcome outcome,
        int eligibleCount,
        int scoredCount,
        List<String> winners) {

    public enum Outcome {
        COMPLETED,          // winners committed, slot finalized
        COMPLETED_EMPTY,    // no eligible candidate, slot finalized with zero rows
        ALREADY_DONE,       // slot was finalized before this run
        CONFLICT,           // uniqueness conflict, rolled back, slot still open
        NO_CANDIDATES,      // no eligible candidate, slot left open
        NOTHING_SCORED      // every Scorer call failed, slot left open
    }

    public static RunResult of(LocalDate date, int hour, Outcome outcome,
                               int eligibleCount, int scoredCount, List<String> winners) {
        return new RunResult(date, hour, outcome, eligibleCount, scoredCount, List.copyOf(winners));
    }

    public boolean finalized() {
        return outcome == Outcome.COMPLETED || outcome == Outcome.COMPLETED_EMPTY;
    }
}
