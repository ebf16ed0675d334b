package in.cryptai.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.cryptai.bootstrap.App;
import in.cryptai.domain.signal.BestOfDayDate;
import in.cryptai.domain.signal.GenerationSlot;
import in.cryptai.domain.signal.Signal;
import in.cryptai.infrastructure.metrics.PrometheusGenerationMetrics;
import in.cryptai.infrastructure.metrics.PrometheusMetricsHandler;
import in.cryptai.service.read.SignalReadModel;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Read API over a real Undertow server.
 */
@ExtendWith(MockitoExtension.class)
class SignalApiHandlerTest {

    private static final int TEST_PORT = 19091;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final LocalDate DATE = LocalDate.of(2024, 5, 1);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-03T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SignalReadModel readModel;

    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        PrometheusGenerationMetrics metrics = new PrometheusGenerationMetrics(new CollectorRegistry());
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(App.routes(new SignalApiHandler(readModel, CLOCK),
                new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static Signal signal(long id, String candidate, double score) {
        return new Signal(id, candidate, DATE, 14, Instant.parse("2024-05-01T14:00:05Z"), score,
            true, false, null, null);
    }

    @Test
    void hourly_returnsWinners() throws Exception {
        when(readModel.topForHour(DATE, 14)).thenReturn(List.of(signal(1, "BTC", 0.9), signal(2, "ETH", 0.8)));

        HttpResponse<String> response = get("/api/signals/hourly?date=2024-05-01&hour=14");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("2024-05-01", body.get("date").asText());
        assertEquals(2, body.get("signals").size());
        assertEquals("BTC", body.get("signals").get(0).get("candidate").asText());
        assertEquals("2024-05-01", body.get("signals").get(0).get("producedDate").asText());
    }

    @Test
    void hourly_emptySlotIsNotAnError() throws Exception {
        when(readModel.topForHour(DATE, 3)).thenReturn(List.of());

        HttpResponse<String> response = get("/api/signals/hourly?date=2024-05-01&hour=3");

        assertEquals(200, response.statusCode());
        assertEquals(0, MAPPER.readTree(response.body()).get("signals").size());
    }

    @Test
    void hourly_rejectsBadInput() throws Exception {
        assertEquals(400, get("/api/signals/hourly?date=2024-05-01&hour=24").statusCode());
        assertEquals(400, get("/api/signals/hourly?date=2024-05-01&hour=x").statusCode());
        assertEquals(400, get("/api/signals/hourly?hour=3").statusCode());
        assertEquals(400, get("/api/signals/hourly?date=May-1&hour=3").statusCode());
        verify(readModel, never()).topForHour(any(), anyInt());
    }

    @Test
    void best_defaultsToTodayAndMarksLive() throws Exception {
        LocalDate today = LocalDate.of(2024, 5, 3);
        when(readModel.bestForDate(today)).thenReturn(List.of());

        HttpResponse<String> response = get("/api/signals/best");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("2024-05-03", body.get("date").asText());
        assertTrue(body.get("live").asBoolean());
    }

    @Test
    void best_pastDateCarriesRank() throws Exception {
        when(readModel.bestForDate(DATE)).thenReturn(List.of(signal(7, "SOL", 0.7).withBestOfDay(DATE, 1)));

        JsonNode body = MAPPER.readTree(get("/api/signals/best?date=2024-05-01").body());

        assertFalse(body.get("live").asBoolean());
        assertEquals(1, body.get("signals").get(0).get("bestOfDayRank").asInt());
    }

    @Test
    void best_readFailureIs500() throws Exception {
        when(readModel.bestForDate(DATE)).thenThrow(new RuntimeException("db down"));

        HttpResponse<String> response = get("/api/signals/best?date=2024-05-01");

        assertEquals(500, response.statusCode());
        assertTrue(MAPPER.readTree(response.body()).has("error"));
    }

    @Test
    void bestDates_listsDatesWithCounts() throws Exception {
        when(readModel.bestOfDayDateCounts()).thenReturn(List.of(
            new BestOfDayDate(LocalDate.of(2024, 5, 2), 10),
            new BestOfDayDate(DATE, 7)));

        JsonNode dates = MAPPER.readTree(get("/api/signals/best/dates").body()).get("dates");

        assertEquals(2, dates.size());
        assertEquals("2024-05-02", dates.get(0).get("date").asText());
        assertEquals(7, dates.get(1).get("count").asInt());
    }

    @Test
    void slots_listsLedger() throws Exception {
        when(readModel.slotsForDate(DATE)).thenReturn(List.of(
            new GenerationSlot(1, DATE, 0, Instant.parse("2024-05-01T00:01:00Z"), Instant.parse("2024-05-01T00:00:01Z")),
            new GenerationSlot(2, DATE, 1, null, Instant.parse("2024-05-01T01:00:01Z"))));

        JsonNode slots = MAPPER.readTree(get("/api/signals/slots?date=2024-05-01").body()).get("slots");

        assertTrue(slots.get(0).get("completed").asBoolean());
        assertFalse(slots.get(1).get("completed").asBoolean());
        assertTrue(slots.get(1).get("completedAt").isNull());
    }

    @Test
    void healthAndMetricsAreServed() throws Exception {
        assertEquals(200, get("/api/health").statusCode());

        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("generation_runs"));
    }
}
