package in.cryptai.service.signal;

import in.cryptai.application.port.output.CandidateProvider;
import in.cryptai.repository.SignalRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Computes the eligible pool for a date: active candidates minus those that
 * already hold a valid signal attributed to the date, sampled down to the
 * configured pool size.
 */
public final class CandidateFilter {
    private static final Logger log = LoggerFactory.getLogger(CandidateFilter.class);

    private final CandidateProvider candidateProvider;
    private final SignalRepository signalRepo;
    private final CandidateSampler sampler;

    public CandidateFilter(CandidateProvider candidateProvider,
                           SignalRepository signalRepo,
                           CandidateSampler sampler) {
        this.candidateProvider = candidateProvider;
        this.signalRepo = signalRepo;
        this.sampler = sampler;
    }

    public Set<String> eligible(LocalDate date, int maxPoolSize) {
        Set<String> active = candidateProvider.listActive();
        if (active.isEmpty()) {
            log.warn("[FILTER] No active candidates for {}", date);
            return Set.of();
        }

        Set<String> alreadySignaled = signalRepo.findCandidatesSignaledOn(date);
        Set<String> remaining = new HashSet<>(active);
        remaining.removeAll(alreadySignaled);

        Set<String> pool = sampler.sample(remaining, maxPoolSize);
        log.info("[FILTER] {}: active={}, excluded={}, remaining={}, sampled={}",
            date, active.size(), alreadySignaled.size(), remaining.size(), pool.size());
        return pool;
    }
}
