package com.tfigtfs.backend.client;

/**
 * A connection, timeout or I/O failure while talking to a remote resource.
 */
public class ResourceFetchException extends RuntimeException {

    public ResourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
