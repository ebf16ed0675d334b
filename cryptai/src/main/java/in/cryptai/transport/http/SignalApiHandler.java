package in.cryptai.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.cryptai.domain.signal.BestOfDayDate;
import in.cryptai.domain.signal.GenerationSlot;
import in.cryptai.domain.signal.Signal;
import in.cryptai.service.read.SignalReadModel;
import in.cryptai.util.UtcDates;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP handler for the signal read API. All endpoints are read-only.
 *
 * - GET /api/signals/hourly?date=YYYY-MM-DD&hour=H - Winners of one slot
 * - GET /api/signals/best?date=YYYY-MM-DD - Best of day (date defaults to today UTC)
 * - GET /api/signals/best/dates - Dates with a best-of-day snapshot
 * - GET /api/signals/slots?date=YYYY-MM-DD - Generation ledger for a date
 * - GET /api/health - Liveness
 */
public final class SignalApiHandler {
    private static final Logger log = LoggerFactory.getLogger(SignalApiHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SignalReadModel readModel;
    private final Clock clock;

    public SignalApiHandler(SignalReadModel readModel, Clock clock) {
        this.readModel = readModel;
        this.clock = clock;
    }

    /**
     * GET /api/signals/hourly?date=&hour=
     */
    public void getHourly(HttpServerExchange exchange) {
        LocalDate date;
        int hour;
        try {
            date = requiredDate(exchange);
            hour = Integer.parseInt(requiredParam(exchange, "hour"));
            if (hour < 0 || hour > 23) {
                throw new IllegalArgumentException("hour must be 0..23");
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
            return;
        }

        try {
            List<Signal> signals = readModel.topForHour(date, hour);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("date", date.toString());
            body.put("hour", hour);
            body.put("signals", toJson(signals));
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to read hourly signals for {} {}: {}", date, hour, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read hourly signals");
        }
    }

    /**
     * GET /api/signals/best?date=
     */
    public void getBest(HttpServerExchange exchange) {
        LocalDate date;
        try {
            String raw = param(exchange, "date");
            date = raw == null ? UtcDates.today(clock) : LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid date: " + e.getParsedString());
            return;
        }

        try {
            List<Signal> signals = readModel.bestForDate(date);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("date", date.toString());
            body.put("live", date.equals(UtcDates.today(clock)));
            body.put("signals", toJson(signals));
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to read best of day for {}: {}", date, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read best of day");
        }
    }

    /**
     * GET /api/signals/best/dates
     */
    public void getBestDates(HttpServerExchange exchange) {
        try {
            List<Map<String, Object>> dates = new ArrayList<>();
            for (BestOfDayDate d : readModel.bestOfDayDateCounts()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("date", d.date().toString());
                entry.put("count", d.count());
                dates.add(entry);
            }
            sendJson(exchange, Map.of("dates", dates));
        } catch (Exception e) {
            log.error("Failed to list best-of-day dates: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to list best-of-day dates");
        }
    }

    /**
     * GET /api/signals/slots?date=
     */
    public void getSlots(HttpServerExchange exchange) {
        LocalDate date;
        try {
            date = requiredDate(exchange);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
            return;
        }

        try {
            List<Map<String, Object>> slots = new ArrayList<>();
            for (GenerationSlot slot : readModel.slotsForDate(date)) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("hour", slot.slotHour());
                entry.put("completed", slot.isCompleted());
                entry.put("completedAt", slot.completedAt() == null ? null : slot.completedAt().toString());
                slots.add(entry);
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("date", date.toString());
            body.put("slots", slots);
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to read slots for {}: {}", date, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to read slots");
        }
    }

    /**
     * GET /api/health
     */
    public void getHealth(HttpServerExchange exchange) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "ok");
            body.put("time", clock.instant().toString());
            sendJson(exchange, body);
        } catch (Exception e) {
            log.error("Failed to serve health: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Health check failed");
        }
    }

    private static List<Map<String, Object>> toJson(List<Signal> signals) {
        List<Map<String, Object>> out = new ArrayList<>(signals.size());
        for (Signal s : signals) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("signalId", s.signalId());
            m.put("candidate", s.candidateId());
            m.put("score", s.score());
            m.put("producedDate", s.producedDate() == null ? null : s.producedDate().toString());
            m.put("producedHour", s.producedHour());
            m.put("createdAt", s.createdAt().toString());
            if (s.bestOfDay()) {
                m.put("bestOfDayRank", s.bestOfDayRank());
            }
            out.add(m);
        }
        return out;
    }

    private static LocalDate requiredDate(HttpServerExchange exchange) {
        return LocalDate.parse(requiredParam(exchange, "date"));
    }

    private static String requiredParam(HttpServerExchange exchange, String name) {
        String value = param(exchange, name);
        if (value == null) {
            throw new IllegalArgumentException("Missing query parameter: " + name);
        }
        return value;
    }

    private static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.getFirst().isBlank()) {
            return null;
        }
        return values.getFirst().trim();
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        try {
            String json = MAPPER.writeValueAsString(Map.of("error", message == null ? "error" : message));
            exchange.setStatusCode(statusCode);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("Failed to send error response: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.endExchange();
        }
    }
}
