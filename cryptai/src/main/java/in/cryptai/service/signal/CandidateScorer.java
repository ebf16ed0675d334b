package in.cryptai.service.signal;

import in.cryptai.application.port.output.Scorer;
import in.cryptai.application.port.output.ScoringException;
import in.cryptai.domain.signal.ScoredCandidate;
import in.cryptai.infrastructure.metrics.GenerationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans Scorer calls out over a small worker pool.
 *
 * A candidate whose call throws, or returns NaN/infinity, is dropped from the
 * result and logged. The other candidates are unaffected.
 * Runs outside any database transaction.
 */
public final class CandidateScorer {
    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);

    private final Scorer scorer;
    private final GenerationMetrics metrics;
    private final ExecutorService executor;

    public CandidateScorer(Scorer scorer, int parallelism, GenerationMetrics metrics) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        this.scorer = scorer;
        this.metrics = metrics;
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "candidate-scorer-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Score every candidate. Order of the result is unspecified.
     */
    public List<ScoredCandidate> scoreAll(Collection<String> candidates) {
        List<Future<Optional<ScoredCandidate>>> futures = new ArrayList<>(candidates.size());
        for (String candidateId : candidates) {
            futures.add(executor.submit(() -> scoreOne(candidateId)));
        }

        List<ScoredCandidate> scored = new ArrayList<>(futures.size());
        try {
            for (Future<Optional<ScoredCandidate>> future : futures) {
                future.get().ifPresent(scored::add);
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Scoring interrupted", e);
        } catch (ExecutionException e) {
            // scoreOne catches everything it can recover from
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Scoring worker failed", e.getCause());
        }

        metrics.recordScored(scored.size());
        log.info("[SCORE] scored={}, dropped={}", scored.size(), candidates.size() - scored.size());
        return scored;
    }

    private Optional<ScoredCandidate> scoreOne(String candidateId) {
        try {
            double score = scorer.score(candidateId);
            if (!Double.isFinite(score)) {
                log.warn("[SCORE] {} returned non-finite score {}, dropped", candidateId, score);
                metrics.recordScorerFailure();
                return Optional.empty();
            }
            return Optional.of(new ScoredCandidate(candidateId, score));
        } catch (ScoringException e) {
            log.warn("[SCORE] {}", e.getMessage());
            metrics.recordScorerFailure();
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[SCORE] Unexpected scorer error for {}: {}", candidateId, e.getMessage(), e);
            metrics.recordScorerFailure();
            return Optional.empty();
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
