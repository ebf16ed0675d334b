package in.cryptai.domain.signal;

import java.util.Comparator;

/**
 * A candidate paired with the score the external Scorer returned for it.
 */
public record ScoredCandidate(String candidateId, double score) {

    /**
     * Score descending, then candidate id ascending.
     */
    public static final Comparator<ScoredCandidate> RANKING =
        Comparator.comparingDouble(ScoredCandidate::score).reversed()
            .thenComparing(ScoredCandidate::candidateId);
}
