package io.sentinel.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and content type
 * - Job metrics recorded and exported
 * - Non-GET requests rejected
 */
public class MetricsEndpointTest {

    private Undertow server;
    private CollectorRegistry registry;
    private PrometheusJobMetrics metrics;
    private HttpClient httpClient;
    private String url;

    @BeforeEach
    public void setUp() {
        // Fresh registry per test so collectors never clash
        registry = new CollectorRegistry();
        metrics = new PrometheusJobMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(0, "localhost")
            .setHandler(Handlers.path()
                .addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        url = "http://localhost:" + address.getPort() + "/metrics";

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

    private HttpResponse<String> get() throws Exception {
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = get();

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        assertTrue(response.body().contains("# TYPE sentinel_queue_depth gauge"));
    }

    @Test
    public void testJobMetricsExported() throws Exception {
        metrics.recordEnqueued("sync:prices");
        metrics.recordExecution("sync:prices", "completed", Duration.ofMillis(1500));
        metrics.recordExecution("sync:prices", "failed", Duration.ofMillis(200));
        metrics.recordNotReady("scoring:calculate", "dependencies");
        metrics.recordHeartbeat(3);
        metrics.updateMarketsOpen(true);

        String body = get().body();

        assertTrue(body.contains("sentinel_jobs_enqueued_total{job_type=\"sync:prices\",} 1.0"));
        assertTrue(body.contains("sentinel_jobs_executed_total{job_type=\"sync:prices\",status=\"completed\",} 1.0"));
        assertTrue(body.contains("sentinel_jobs_not_ready_total{job_type=\"scoring:calculate\",reason=\"dependencies\",} 1.0"));
        assertTrue(body.contains("sentinel_job_duration_seconds_count{job_type=\"sync:prices\",} 2.0"));
        assertTrue(body.contains("sentinel_queue_depth 3.0"));
        assertTrue(body.contains("sentinel_markets_open 1.0"));
    }

    @Test
    public void testRecordedValuesInRegistry() {
        metrics.recordHeartbeat(5);
        metrics.recordHeartbeat(2);
        metrics.updateQueueDepth(1);
        metrics.updateMarketsOpen(false);

        assertEquals(2.0, registry.getSampleValue("sentinel_heartbeats_total"));
        assertEquals(1.0, registry.getSampleValue("sentinel_queue_depth"));
        assertEquals(0.0, registry.getSampleValue("sentinel_markets_open"));
    }

    @Test
    public void testPostRejected() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(405, response.statusCode());
    }
}
