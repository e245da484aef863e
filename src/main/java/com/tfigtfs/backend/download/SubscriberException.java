package com.tfigtfs.backend.download;

import lombok.Getter;

/**
 * A registered callback rejected a freshly downloaded payload.
 */
@Getter
public class SubscriberException extends RuntimeException {

    private final String agentName;
    private final String subscriber;

    public SubscriberException(String agentName, String subscriber, Throwable cause) {
        super(String.format("%s agent: callback %s failed: %s", agentName, subscriber, cause.getMessage()), cause);
        this.agentName = agentName;
        this.subscriber = subscriber;
    }
}
