package ai.courseware.archiver.fetch;

import ai.courseware.archiver.document.PipelineException;
import java.net.URI;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Raised when a page cannot be retrieved.
 */
public class FetchException extends PipelineException {

    public enum Kind {
        RATE_LIMITED,
        TRANSPORT,
        HTTP
    }

    private final Kind kind;
    private final URI url;
    private final int statusCode;

    private FetchException(Kind kind, URI url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.url = url;
        this.statusCode = statusCode;
    }

    public static FetchException rateLimited(URI url) {
        return new FetchException(Kind.RATE_LIMITED, url, 429,
                "Rate limited while fetching " + url + " (HTTP 429 after retry)", null);
    }

    public static FetchException http(URI url, int statusCode) {
        return new FetchException(Kind.HTTP, url, statusCode,
                "Unexpected HTTP status " + statusCode + " for " + url, null);
    }

    public static FetchException transport(URI url, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
        return new FetchException(Kind.TRANSPORT, url, -1, "Failed to fetch " + url + detail, cause);
    }

    public Kind kind() {
        return kind;
    }

    public URI url() {
        return url;
    }

    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
