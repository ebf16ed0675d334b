package in.cryptai.infrastructure.metrics;

import in.cryptai.domain.signal.RunResult;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for Prometheus /metrics endpoint.
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19090;
    private Undertow server;
    private PrometheusGenerationMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusGenerationMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private String scrape() throws Exception {
        return scrape("/metrics");
    }

    private String scrape(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        return response.body();
    }

    @Test
    public void testRunOutcomesExported() throws Exception {
        metrics.recordRun(RunResult.Outcome.COMPLETED, Duration.ofMillis(1500));
        metrics.recordRun(RunResult.Outcome.ALREADY_DONE, Duration.ofMillis(3));
        metrics.recordRun(RunResult.Outcome.ALREADY_DONE, Duration.ofMillis(2));

        String body = scrape();

        assertTrue(body.contains("generation_runs_total{outcome=\"completed\",} 1.0"), body);
        assertTrue(body.contains("generation_runs_total{outcome=\"already_done\",} 2.0"), body);
        assertTrue(body.contains("generation_run_duration_seconds_count 3.0"), body);
    }

    @Test
    public void testScoringAndWinnerCountersExported() throws Exception {
        metrics.recordScored(8);
        metrics.recordScorerFailure();
        metrics.recordWinners(5);
        metrics.recordMaterialization(true, 10);

        String body = scrape();

        assertTrue(body.contains("generation_candidates_scored_total 8.0"), body);
        assertTrue(body.contains("generation_scorer_failures_total 1.0"), body);
        assertTrue(body.contains("generation_winners_total 5.0"), body);
        assertTrue(body.contains("generation_last_winners 5.0"), body);
        assertTrue(body.contains("best_of_day_materializations_total{mode=\"dry_run\",} 1.0"), body);
    }

    @Test
    public void testNameFilterRestrictsOutput() throws Exception {
        metrics.recordWinners(5);
        metrics.recordScorerFailure();

        String body = scrape("/metrics?name%5B%5D=generation_winners_total");

        assertTrue(body.contains("generation_winners_total 5.0"), body);
        assertFalse(body.contains("generation_scorer_failures_total"), body);
    }
}
