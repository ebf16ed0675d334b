package in.cryptai.infrastructure.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.cryptai.application.port.output.Scorer;
import in.cryptai.application.port.output.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Scorer backed by the analysis service.
 *
 * GET {baseUrl}/api/score/{candidate}
 *
 * Response:
 * <pre>
 * {"candidate": "BTCUSDT", "score": 0.82}
 * </pre>
 */
public class HttpScorer implements Scorer {
    private static final Logger log = LoggerFactory.getLogger(HttpScorer.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Duration timeout;

    public HttpScorer(String baseUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), baseUrl, timeout);
    }

    HttpScorer(HttpClient httpClient, ObjectMapper mapper, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    @Override
    public double score(String candidateId) throws ScoringException {
        String path = URLEncoder.encode(candidateId, StandardCharsets.UTF_8).replace("+", "%20");
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/api/score/" + path))
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ScoringException(candidateId, "HTTP " + response.statusCode());
            }

            JsonNode score = mapper.readTree(response.body()).get("score");
            if (score == null || !score.isNumber()) {
                throw new ScoringException(candidateId, "response has no numeric score");
            }

            log.debug("[HttpScorer] {} -> {}", candidateId, score.asDouble());
            return score.asDouble();

        } catch (IOException e) {
            throw new ScoringException(candidateId, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScoringException(candidateId, "interrupted", e);
        }
    }
}
