package io.sentinel.infrastructure.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sentinel.application.port.output.MarketStatusProvider;
import io.sentinel.domain.market.MarketStatus;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Market status over HTTP in the broker's compact format.
 *
 * Response format:
 * <pre>
 * {"m": [{"i": 30, "n2": "NASDAQ", "s": "OPEN"},
 *        {"i": 70, "n2": "LSE", "s": "CLOSE"}]}
 * </pre>
 * i = market id, n2 = market name, s = status.
 */
public final class HttpMarketStatusProvider implements MarketStatusProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpMarketStatusProvider.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final String endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public HttpMarketStatusProvider(String endpoint) {
        this(endpoint, HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), new ObjectMapper());
    }

    public HttpMarketStatusProvider(String endpoint, HttpClient httpClient, ObjectMapper mapper) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    @Override
    public List<MarketStatus> getMarketStatus(String filter) {
        String query = filter == null || filter.isEmpty() ? ALL_MARKETS : filter;
        URI uri = URI.create(endpoint + "?m=" + URLEncoder.encode(query, StandardCharsets.UTF_8));

        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(TIMEOUT)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new MarketStatusException("Market status request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketStatusException("Interrupted while fetching market status", e);
        }

        if (response.statusCode() != 200) {
            throw new MarketStatusException("Market status request failed: HTTP " + response.statusCode());
        }

        List<MarketStatus> markets = parse(response.body());
        log.debug("[MARKET] Fetched {} market states from {}", markets.size(), endpoint);
        return markets;
    }

    List<MarketStatus> parse(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new MarketStatusException("Unreadable market status response", e);
        }

        List<MarketStatus> markets = new ArrayList<>();
        JsonNode entries = root.path("m");
        if (!entries.isArray()) {
            return markets;
        }

        for (JsonNode entry : entries) {
            String id = entry.path("i").asText(null);
            String name = entry.path("n2").asText(null);
            String status = entry.path("s").asText("");
            if (id == null && name == null) {
                continue;
            }
            markets.add(new MarketStatus(id, name, status));
        }
        return markets;
    }
}
