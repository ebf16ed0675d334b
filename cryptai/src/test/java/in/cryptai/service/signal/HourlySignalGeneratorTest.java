package in.cryptai.service.signal;

import in.cryptai.application.port.output.Scorer;
import in.cryptai.application.port.output.ScoringException;
import in.cryptai.config.GenerationConfig;
import in.cryptai.domain.signal.RunResult;
import in.cryptai.domain.signal.RunResult.Outcome;
import in.cryptai.domain.signal.Signal;
import in.cryptai.infrastructure.candidate.PostgresCandidateProvider;
import in.cryptai.infrastructure.metrics.GenerationMetrics;
import in.cryptai.repository.PostgresGenerationSlotRepository;
import in.cryptai.repository.PostgresSignalRepository;
import in.cryptai.repository.SignalRepository;
import in.cryptai.service.slot.SlotManager;
import in.cryptai.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end hourly runs against an in-memory database.
 */
class HourlySignalGeneratorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 1);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T14:00:30Z"), ZoneOffset.UTC);

    // Higher is better: A wins over B, and so on
    private static final Map<String, Double> SCORES = Map.of(
        "A", 0.95, "B", 0.90, "C", 0.85, "D", 0.80,
        "E", 0.75, "F", 0.70, "G", 0.65, "H", 0.60);

    private DataSource dataSource;
    private SignalRepository signalRepo;
    private SlotManager slotManager;
    private CandidateScorer candidateScorer;
    private final AtomicInteger scorerCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.create();
        signalRepo = new PostgresSignalRepository(dataSource);
        slotManager = new SlotManager(new PostgresGenerationSlotRepository(dataSource, CLOCK), CLOCK);
    }

    @AfterEach
    void tearDown() {
        if (candidateScorer != null) {
            candidateScorer.shutdown();
        }
        TestDatabase.shutdown(dataSource);
    }

    private void activeSymbols(String... symbols) {
        Map<String, Boolean> rows = new LinkedHashMap<>();
        for (String s : symbols) {
            rows.put(s, true);
        }
        rows.put("DELISTED", false);
        TestDatabase.createSymbols(dataSource, rows);
    }

    private HourlySignalGenerator generator(Scorer scorer, GenerationConfig config) {
        Scorer counting = id -> {
            scorerCalls.incrementAndGet();
            return scorer.score(id);
        };
        candidateScorer = new CandidateScorer(counting, 4, GenerationMetrics.noop());
        CandidateFilter filter = new CandidateFilter(
            new PostgresCandidateProvider(dataSource), signalRepo, RandomCandidateSampler.seeded(1L));
        SignalPersister persister = new SignalPersister(dataSource, slotManager, signalRepo, CLOCK);
        return new HourlySignalGenerator(slotManager, filter, candidateScorer, new Selector(), persister,
            config, GenerationMetrics.noop(), CLOCK);
    }

    private HourlySignalGenerator generator(Scorer scorer) {
        return generator(scorer, GenerationConfig.defaults());
    }

    private static Scorer fixedScores() {
        return id -> {
            Double score = SCORES.get(id);
            if (score == null) {
                throw new ScoringException(id, "unknown candidate");
            }
            return score;
        };
    }

    private int rows(String where) {
        return TestDatabase.count(dataSource, "SELECT COUNT(*) FROM trading_signals WHERE " + where);
    }

    @Test
    void runHour_samplesFiftyOfSixtyAndKeepsTheTopFiveOfTheSample() {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (int i = 0; i < 60; i++) {
            // 37 is coprime to 60, so every score is distinct
            scores.put(String.format("S%02d", i), ((i * 37) % 60) / 60.0);
        }
        activeSymbols(scores.keySet().toArray(new String[0]));

        Set<String> scored = ConcurrentHashMap.newKeySet();
        Scorer recording = id -> {
            scored.add(id);
            return scores.get(id);
        };

        RunResult result = generator(recording, GenerationConfig.defaults().withCandidatePoolSize(50))
            .runHour(DATE, 14);

        List<String> expectedWinners = scored.stream()
            .sorted((a, b) -> Double.compare(scores.get(b), scores.get(a)))
            .limit(5)
            .toList();

        assertEquals(Outcome.COMPLETED, result.outcome());
        assertEquals(50, scorerCalls.get());
        assertEquals(50, scored.size());
        assertEquals(50, result.eligibleCount());
        assertEquals(expectedWinners, result.winners());
        assertTrue(slotManager.isCompleted(DATE, 14));

        assertEquals(5, rows("is_valid = TRUE AND produced_date = DATE '2024-05-01' AND produced_hour = 14"));
        assertEquals(45, rows("is_valid = FALSE"));
        // The 10 candidates left out of the sample leave no trace
        assertEquals(50, rows("TRUE"));
        assertEquals(50, TestDatabase.count(dataSource,
            "SELECT COUNT(DISTINCT candidate_id) FROM trading_signals"));
    }

    @Test
    void runHour_picksTopFiveAndInvalidatesTheRest() {
        activeSymbols("A", "B", "C", "D", "E", "F", "G", "H");

        RunResult result = generator(fixedScores()).runHour(DATE, 14);

        assertEquals(Outcome.COMPLETED, result.outcome());
        assertEquals(List.of("A", "B", "C", "D", "E"), result.winners());
        assertEquals(8, result.eligibleCount());
        assertEquals(8, result.scoredCount());
        assertTrue(slotManager.isCompleted(DATE, 14));
        assertEquals(5, rows("is_valid = TRUE AND produced_date = DATE '2024-05-01' AND produced_hour = 14"));
        assertEquals(3, rows("is_valid = FALSE"));
        assertEquals(0, rows("candidate_id = 'DELISTED'"));
    }

    @Test
    void runHour_excludesCandidatesThatAlreadyWonToday() {
        activeSymbols("A", "B", "C", "D", "E", "F", "G", "H");
        for (String id : List.of("A", "B", "C")) {
            TestDatabase.insertSignal(dataSource,
                Signal.winner(id, DATE, 10, SCORES.get(id), Instant.parse("2024-05-01T10:00:05Z")));
        }

        RunResult result = generator(fixedScores()).runHour(DATE, 14);

        assertEquals(Outcome.COMPLETED, result.outcome());
        assertEquals(5, result.eligibleCount());
        assertEquals(List.of("D", "E", "F", "G", "H"), result.winners());
        assertEquals(5, signalRepo.findValidBySlot(DATE, 14).size());
    }

    @Test
    void runHour_secondInvocationIsANoOp() {
        activeSymbols("A", "B", "C", "D", "E", "F", "G", "H");
        HourlySignalGenerator generator = generator(fixedScores());
        generator.runHour(DATE, 14);
        Instant completedAt = slotManager.peek(DATE, 14).orElseThrow().completedAt();
        int callsAfterFirst = scorerCalls.get();
        int rowsAfterFirst = rows("1 = 1");

        RunResult again = generator.runHour(DATE, 14);

        assertEquals(Outcome.ALREADY_DONE, again.outcome());
        assertEquals(callsAfterFirst, scorerCalls.get());
        assertEquals(rowsAfterFirst, rows("1 = 1"));
        assertEquals(completedAt, slotManager.peek(DATE, 14).orElseThrow().completedAt());
    }

    @Test
    void runHour_failedCandidatesAreDroppedFromRanking() {
        activeSymbols("A", "B", "C", "D", "E", "F", "G", "H");
        Scorer flaky = id -> {
            if (id.equals("A") || id.equals("C")) {
                throw new ScoringException(id, "timeout");
            }
            return SCORES.get(id);
        };

        RunResult result = generator(flaky).runHour(DATE, 14);

        assertEquals(Outcome.COMPLETED, result.outcome());
        assertEquals(6, result.scoredCount());
        assertEquals(List.of("B", "D", "E", "F", "G"), result.winners());
        assertEquals(0, rows("candidate_id IN ('A', 'C')"));
    }

    @Test
    void runHour_allScorerCallsFailed_leavesSlotOpen() {
        activeSymbols("A", "B", "C");
        Scorer down = id -> {
            throw new ScoringException(id, "connection refused");
        };

        RunResult result = generator(down).runHour(DATE, 14);

        assertEquals(Outcome.NOTHING_SCORED, result.outcome());
        assertFalse(slotManager.isCompleted(DATE, 14));
        assertEquals(0, rows("1 = 1"));
    }

    @Test
    void runHour_noEligibleCandidates_finalizesEmptySlot() {
        activeSymbols("A");
        TestDatabase.insertSignal(dataSource,
            Signal.winner("A", DATE, 2, 0.5, Instant.parse("2024-05-01T02:00:05Z")));

        RunResult result = generator(fixedScores()).runHour(DATE, 14);

        assertEquals(Outcome.COMPLETED_EMPTY, result.outcome());
        assertTrue(result.finalized());
        assertTrue(slotManager.isCompleted(DATE, 14));
        assertEquals(0, scorerCalls.get());
        assertEquals(1, rows("1 = 1"));
    }

    @Test
    void runHour_noEligibleCandidates_leavesSlotOpenWhenConfigured() {
        activeSymbols();

        RunResult result = generator(fixedScores(), GenerationConfig.defaults().withFinalizeEmptySlots(false))
            .runHour(DATE, 14);

        assertEquals(Outcome.NO_CANDIDATES, result.outcome());
        assertFalse(slotManager.isCompleted(DATE, 14));
    }

    @Test
    void runHour_fewerCandidatesThanWinners_commitsWhatExists() {
        activeSymbols("A", "B");

        RunResult result = generator(fixedScores()).runHour(DATE, 14);

        assertEquals(Outcome.COMPLETED, result.outcome());
        assertEquals(List.of("A", "B"), result.winners());
    }

    @Test
    void runHour_concurrentWinDuringScoring_rollsBackThenRetrySucceeds() {
        activeSymbols("A", "B", "C", "D", "E", "F", "G", "H");
        // While the run is scoring, another writer gives C a valid signal for the day
        Set<String> injected = ConcurrentHashMap.newKeySet();
        Scorer racing = id -> {
            if (id.equals("C") && injected.add(id)) {
                TestDatabase.insertSignal(dataSource,
                    Signal.winner("C", DATE, 13, 0.5, Instant.parse("2024-05-01T13:59:59Z")));
            }
            return SCORES.get(id);
        };
        HourlySignalGenerator generator = generator(racing);

        RunResult conflicted = generator.runHour(DATE, 14);

        assertEquals(Outcome.CONFLICT, conflicted.outcome());
        assertTrue(conflicted.winners().isEmpty());
        assertFalse(slotManager.isCompleted(DATE, 14));
        assertEquals(1, rows("1 = 1"));

        RunResult retried = generator.runHour(DATE, 14);

        assertEquals(Outcome.COMPLETED, retried.outcome());
        assertEquals(List.of("A", "B", "D", "E", "F"), retried.winners());
        assertTrue(slotManager.isCompleted(DATE, 14));
    }

    @Test
    void runHour_concurrentSchedulersCommitOnce() throws Exception {
        activeSymbols("A", "B", "C", "D", "E", "F", "G", "H");
        HourlySignalGenerator generator = generator(fixedScores());

        int runners = 4;
        ExecutorService pool = Executors.newFixedThreadPool(runners);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RunResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < runners; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return generator.runHour(DATE, 14);
                }));
            }
            start.countDown();

            int completed = 0;
            for (Future<RunResult> f : futures) {
                RunResult r = f.get(30, TimeUnit.SECONDS);
                if (r.outcome() == Outcome.COMPLETED) {
                    completed++;
                } else {
                    assertEquals(Outcome.ALREADY_DONE, r.outcome());
                }
            }
            assertEquals(1, completed);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(5, rows("is_valid = TRUE"));
        assertEquals(3, rows("is_valid = FALSE"));
        assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM generation_slots"));
    }

    @Test
    void runHour_differentHoursProduceDisjointWinners() {
        activeSymbols("A", "B", "C", "D", "E", "F", "G", "H", "I", "J");
        Map<String, Double> scores = new LinkedHashMap<>(SCORES);
        scores.put("I", 0.55);
        scores.put("J", 0.50);
        HourlySignalGenerator generator = generator(id -> scores.get(id));

        RunResult first = generator.runHour(DATE, 14);
        RunResult second = generator.runHour(DATE, 15);

        assertEquals(List.of("A", "B", "C", "D", "E"), first.winners());
        assertEquals(List.of("F", "G", "H", "I", "J"), second.winners());
        assertEquals(10, rows("is_valid = TRUE"));
    }
}
