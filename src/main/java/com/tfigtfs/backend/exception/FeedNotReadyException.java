package com.tfigtfs.backend.exception;

/**
 * Queried before both feeds have been downloaded at least once.
 */
public class FeedNotReadyException extends RuntimeException {

    public FeedNotReadyException(String message) {
        super(message);
    }
}
