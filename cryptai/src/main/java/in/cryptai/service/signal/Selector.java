package in.cryptai.service.signal;

import in.cryptai.domain.signal.ScoredCandidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the top k scored candidates.
 *
 * Duplicate candidate ids keep their best score. Ties break on candidate id
 * so the result does not depend on scoring order.
 */
public final class Selector {

    public List<ScoredCandidate> select(Collection<ScoredCandidate> scored, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        List<ScoredCandidate> ranked = rank(scored);
        return ranked.size() <= k ? ranked : List.copyOf(ranked.subList(0, k));
    }

    /**
     * Full ranking with one entry per candidate.
     */
    public List<ScoredCandidate> rank(Collection<ScoredCandidate> scored) {
        Map<String, ScoredCandidate> best = new LinkedHashMap<>();
        for (ScoredCandidate sc : scored) {
            best.merge(sc.candidateId(), sc, (a, b) -> b.score() > a.score() ? b : a);
        }
        List<ScoredCandidate> ranked = new ArrayList<>(best.values());
        ranked.sort(ScoredCandidate.RANKING);
        return List.copyOf(ranked);
    }
}
