package com.chaincustody.http;

/**
 * Explorer or third-party API returned something unusable (HTTP failure, malformed or missing payload).
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
