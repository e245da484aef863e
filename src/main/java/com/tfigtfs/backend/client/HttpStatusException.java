package com.tfigtfs.backend.client;

import lombok.Getter;

/**
 * The remote resource answered with a non-2xx status.
 */
@Getter
public class HttpStatusException extends RuntimeException {

    private final int status;

    public HttpStatusException(String resourceName, int status) {
        super(String.format("%s returned HTTP %d", resourceName, status));
        this.status = status;
    }

    public boolean isRateLimited() {
        return status == ResourceResponse.TOO_MANY_REQUESTS;
    }
}
