package in.cryptai.service.signal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Uniform random subset. The pool is sorted before shuffling so that a seeded
 * Random gives the same subset regardless of the input's iteration order.
 */
public final class RandomCandidateSampler implements CandidateSampler {

    private final Random random;

    public RandomCandidateSampler() {
        this(new Random());
    }

    public RandomCandidateSampler(Random random) {
        this.random = random;
    }

    public static RandomCandidateSampler seeded(long seed) {
        return new RandomCandidateSampler(new Random(seed));
    }

    @Override
    public Set<String> sample(Collection<String> pool, int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0, got " + maxSize);
        }
        List<String> ordered = new ArrayList<>(new LinkedHashSet<>(pool));
        Collections.sort(ordered);
        if (ordered.size() <= maxSize) {
            return new LinkedHashSet<>(ordered);
        }
        synchronized (random) {
            Collections.shuffle(ordered, random);
        }
        return new LinkedHashSet<>(ordered.subList(0, maxSize));
    }
}
