package in.cryptai.application.port.output;

/**
 * Thrown by a Scorer when a single candidate cannot be scored.
 * Recovered per candidate: the candidate is dropped from ranking.
 */
public class ScoringException extends Exception {

    private final String candidateId;

    public ScoringException(String candidateId, String message) {
        super(String.format("Scoring failed for %s: %s", candidateId, message));
        this.candidateId = candidateId;
    }

    public ScoringException(String candidateId, String message, Throwable cause) {
        super(String.format("Scoring failed for %s: %s", candidateId, message), cause);
        this.candidateId = candidateId;
    }

    public String getCandidateId() {
        return candidateId;
    }
}
