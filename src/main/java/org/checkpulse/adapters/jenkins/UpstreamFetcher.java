package org.checkpulse.adapters.jenkins;

import java.net.URI;

/**
 * Fetches a response body. Kept narrow so the HTTP stack can be swapped or faked.
 */
@FunctionalInterface
public interface UpstreamFetcher {

    String fetch(URI uri) throws UpstreamFetchException;
}
