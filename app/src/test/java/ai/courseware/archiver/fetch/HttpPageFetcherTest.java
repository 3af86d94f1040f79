package ai.courseware.archiver.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpPageFetcherTest {

    private HttpServer server;
    private final List<String> cookies = new CopyOnWriteArrayList<>();
    private final AtomicInteger rateLimitedCalls = new AtomicInteger();

    private final HttpPageFetcher fetcher = new HttpPageFetcher(HttpClient.newHttpClient(), Duration.ZERO, Duration.ofSeconds(5));

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> respond(exchange, 200, "<html><body>ok</body></html>"));
        server.createContext("/missing", exchange -> respond(exchange, 404, "not found"));
        server.createContext("/busy-once", exchange -> {
            if (rateLimitedCalls.getAndIncrement() == 0) {
                respond(exchange, 429, "slow down");
            } else {
                respond(exchange, 200, "recovered");
            }
        });
        server.createContext("/busy", exchange -> {
            rateLimitedCalls.incrementAndGet();
            respond(exchange, 429, "slow down");
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void returnsBodyAndSendsCookieHeader() {
        String body = fetcher.fetch(url("/ok"), "htb_academy_session=abc");

        assertThat(body).contains("ok");
        assertThat(cookies).containsExactly("htb_academy_session=abc");
    }

    @Test
    void retriesOnceAfterRateLimit() {
        String body = fetcher.fetch(url("/busy-once"), "s=1");

        assertThat(body).isEqualTo("recovered");
        assertThat(rateLimitedCalls.get()).isEqualTo(2);
    }

    @Test
    void failsWhenStillRateLimitedAfterRetry() {
        assertThatThrownBy(() -> fetcher.fetch(url("/busy"), "s=1"))
                .isInstanceOfSatisfying(FetchException.class, ex -> {
                    assertThat(ex.kind()).isEqualTo(FetchException.Kind.RATE_LIMITED);
                    assertThat(ex.statusCode()).hasValue(429);
                });
        assertThat(rateLimitedCalls.get()).isEqualTo(2);
    }

    @Test
    void reportsHttpStatusFailures() {
        assertThatThrownBy(() -> fetcher.fetch(url("/missing"), "s=1"))
                .isInstanceOfSatisfying(FetchException.class, ex -> {
                    assertThat(ex.kind()).isEqualTo(FetchException.Kind.HTTP);
                    assertThat(ex.statusCode()).hasValue(404);
                });
    }

    @Test
    void reportsTransportFailures() {
        URI unreachable = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/ok");
        server.stop(0);

        assertThatThrownBy(() -> fetcher.fetch(unreachable, "s=1"))
                .isInstanceOfSatisfying(FetchException.class,
                        ex -> assertThat(ex.kind()).isEqualTo(FetchException.Kind.TRANSPORT));
    }

    private URI url(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    private void respond(HttpExchange exchange, int status, String body) throws IOException {
        String cookie = exchange.getRequestHeaders().getFirst("Cookie");
        if (cookie != null) {
            cookies.add(cookie);
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(bytes);
        }
    }
}
