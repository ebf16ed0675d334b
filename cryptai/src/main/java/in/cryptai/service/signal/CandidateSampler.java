package in.cryptai.service.signal;

import java.util.Collection;
import java.util.Set;

/**
 * Reduces an eligible pool to at most {@code maxSize} candidates.
 */
public interface CandidateSampler {

    Set<String> sample(Collection<String> pool, int maxSize);
}
