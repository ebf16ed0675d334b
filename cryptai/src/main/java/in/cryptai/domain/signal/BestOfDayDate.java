package in.cryptai.domain.signal;

import java.time.LocalDate;

/**
 * A date that has a best-of-day snapshot, with the number of signals in it.
 */
public record BestOfDayDate(LocalDate date, int count) {
}
