package ai.courseware.archiver.fetch;

import java.net.URI;

/**
 * Retrieves the raw HTML of a page using the caller-supplied session credential.
 */
@FunctionalInterface
public interface PageFetcher {

    String fetch(URI url, String credential);
}
