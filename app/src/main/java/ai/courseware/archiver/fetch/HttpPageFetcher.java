package ai.courseware.archiver.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PageFetcher} backed by the JDK HTTP client, attaching the session cookie to each request.
 */
public class HttpPageFetcher implements PageFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpPageFetcher.class);

    static final Duration DEFAULT_RATE_LIMIT_BACKOFF = Duration.ofSeconds(2);
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final int TOO_MANY_REQUESTS = 429;
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";
    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final HttpClient httpClient;
    private final Duration rateLimitBackoff;
    private final Duration requestTimeout;

    public HttpPageFetcher() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(DEFAULT_REQUEST_TIMEOUT)
                .build(), DEFAULT_RATE_LIMIT_BACKOFF, DEFAULT_REQUEST_TIMEOUT);
    }

    public HttpPageFetcher(HttpClient httpClient, Duration rateLimitBackoff, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.rateLimitBackoff = Objects.requireNonNull(rateLimitBackoff, "rateLimitBackoff");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (rateLimitBackoff.isNegative()) {
            throw new IllegalArgumentException("rateLimitBackoff must not be negative");
        }
    }

    @Override
    public String fetch(URI url, String credential) {
        Objects.requireNonNull(url, "url");
        HttpRequest request = buildRequest(url, credential);
        HttpResponse<String> response = send(url, request);
        if (response.statusCode() == TOO_MANY_REQUESTS) {
            LOGGER.warn("Rate limited by {}; retrying once in {} ms", url.getHost(), rateLimitBackoff.toMillis());
            pause(url);
            response = send(url, request);
            if (response.statusCode() == TOO_MANY_REQUESTS) {
                throw FetchException.rateLimited(url);
            }
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw FetchException.http(url, response.statusCode());
        }
        LOGGER.debug("Fetched {} ({} chars)", url, response.body().length());
        return response.body();
    }

    private HttpRequest buildRequest(URI url, String credential) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(url)
                .timeout(requestTimeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", ACCEPT)
                .GET();
        if (credential != null && !credential.isBlank()) {
            builder.header("Cookie", credential.trim());
        }
        return builder.build();
    }

    private HttpResponse<String> send(URI url, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw FetchException.transport(url, ex);
        } catch (IOException ex) {
            throw FetchException.transport(url, ex);
        }
    }

    private void pause(URI url) {
        try {
            Thread.sleep(rateLimitBackoff.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw FetchException.transport(url, ex);
        }
    }
}
