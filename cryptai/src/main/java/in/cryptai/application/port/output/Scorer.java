package in.cryptai.application.port.output;

/**
 * Output port: external quality scorer (technical indicators, ML inference).
 * Called once per sampled candidate per hourly run.
 */
public interface Scorer {

    /**
     * @param candidateId Candidate (symbol) to score
     * @return Quality score, higher is better
     * @throws ScoringException if the candidate cannot be scored
     */
    double score(String candidateId) throws ScoringException;
}
