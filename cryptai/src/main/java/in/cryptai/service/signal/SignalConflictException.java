package in.cryptai.service.signal;

import java.time.LocalDate;

/**
 * A winner already holds a valid signal attributed to the same date.
 * Aborts the persisting transaction; nothing of the slot is written.
 */
public final class SignalConflictException extends RuntimeException {

    private final String candidateId;
    private final LocalDate date;

    public SignalConflictException(String candidateId, LocalDate date) {
        super("Candidate " + candidateId + " already has a valid signal on " + date);
        this.candidateId = candidateId;
        this.date = date;
    }

    public String getCandidateId() {
        return candidateId;
    }

    public LocalDate getDate() {
        return date;
    }
}
