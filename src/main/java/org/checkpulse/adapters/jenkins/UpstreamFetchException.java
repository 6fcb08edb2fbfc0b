package org.checkpulse.adapters.jenkins;

/**
 * The upstream API could not be reached or returned something unusable.
 */
public class UpstreamFetchException extends Exception {

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
