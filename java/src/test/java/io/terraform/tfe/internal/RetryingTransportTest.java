package io.terraform.tfe.internal;

import io.terraform.tfe.ApiServer;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryingTransportTest {

    private static final Duration MS = Duration.ofMillis(1);

    private ApiServer server;
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private final List<Duration> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        server = ApiServer.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void retriesRateLimitedResponsesUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        server.on("GET", "/api/v2/ping", exchange -> {
            if (calls.incrementAndGet() < 3) {
                exchange.getResponseHeaders().add(RetryPolicy.HEADER_RATE_RESET, "0.001");
                ApiServer.reply(exchange, 429, "");
            } else {
                ApiServer.reply(exchange, 200, "{}");
            }
        });

        HttpResponse<InputStream> response = transport(false, 5).send(ping());

        assertEquals(200, response.statusCode());
        try (InputStream body = response.body()) {
            assertEquals("{}", new String(body.readAllBytes(), StandardCharsets.UTF_8));
        }
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void returnsLastResponseOnceRetriesAreExhausted() throws Exception {
        server.respond("GET", "/api/v2/ping", 503, "");

        HttpResponse<InputStream> response = transport(true, 2).send(ping());

        assertEquals(503, response.statusCode());
        response.body().close();
        assertEquals(3, server.requests().size());
        assertEquals(2, sleeps.size());
    }

    @Test
    void doesNotRetryServerErrorsByDefault() throws Exception {
        server.respond("GET", "/api/v2/ping", 503, "");

        HttpResponse<InputStream> response = transport(false, 5).send(ping());

        assertEquals(503, response.statusCode());
        response.body().close();
        assertEquals(1, server.requests().size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void wrapsTransportFailureAfterRetries() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress("localhost", 0));
            closedPort = socket.getLocalPort();
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + closedPort + "/api/v2/ping"))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();

        TfeException ex = assertThrows(TfeException.class, () -> transport(true, 1).send(request));

        assertNull(ex.getError());
        assertNotNull(ex.getCause());
        assertEquals(1, sleeps.size());
    }

    @Test
    void failingRetryHookStillRetries() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        server.on("GET", "/api/v2/ping", exchange -> {
            ApiServer.reply(exchange, calls.incrementAndGet() == 1 ? 429 : 200, calls.get() == 1 ? "" : "{}");
        });
        RetryPolicy policy = new RetryPolicy(false, 3, MS, MS, MS, MS, (attempt, response) -> {
            throw new IllegalStateException("observer failed");
        });
        RetryingTransport transport = new RetryingTransport(httpClient, policy, new RateLimiter(), sleeps::add);

        HttpResponse<InputStream> response = transport.send(ping());

        assertEquals(200, response.statusCode());
        response.body().close();
        assertEquals(2, calls.get());
        assertEquals(1, sleeps.size());
    }

    @Test
    void interruptedSleepCancelsTheRequest() {
        server.respond("GET", "/api/v2/ping", 429, "");
        RetryPolicy policy = new RetryPolicy(false, 5, MS, MS, MS, MS, null);
        RetryingTransport transport = new RetryingTransport(httpClient, policy, new RateLimiter(), duration -> {
            throw new InterruptedException("stop");
        });

        try {
            TfeException ex = assertThrows(TfeException.class, () -> transport.send(ping()));
            assertTrue(ex.is(TfeError.CANCELLED));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void everyAttemptTakesALimiterPermit() throws Exception {
        server.respond("GET", "/api/v2/ping", 200, "{}");
        RateLimiter limiter = new RateLimiter();
        limiter.configure(0.001, 1);
        RetryingTransport transport = new RetryingTransport(httpClient,
            new RetryPolicy(false, 0, MS, MS, MS, MS, null), limiter, sleeps::add);

        transport.send(ping()).body().close();

        assertFalse(limiter.tryAcquire());
    }

    private RetryingTransport transport(boolean retryServerErrors, int retryMax) {
        RetryPolicy policy = new RetryPolicy(retryServerErrors, retryMax, MS, MS, MS, MS, null);
        return new RetryingTransport(httpClient, policy, new RateLimiter(), sleeps::add);
    }

    private HttpRequest ping() {
        return HttpRequest.newBuilder(server.address().resolve("/api/v2/ping"))
            .timeout(Duration.ofSeconds(5))
            .GET()
            .build();
    }
}
