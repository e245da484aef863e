package com.tfigtfs.backend.client;

import org.springframework.http.HttpHeaders;

/**
 * Blocking HTTP boundary used by the download agents.
 */
public interface ResourceClient {

    /**
     * Fetches the resource. Non-2xx statuses are returned, not thrown.
     *
     * @throws ResourceFetchException on connection or timeout failures
     */
    ResourceResponse get(String url, HttpHeaders headers);

    /**
     * Issues a HEAD request and returns the response headers only.
     *
     * @throws ResourceFetchException on connection or timeout failures
     */
    HttpHeaders head(String url, HttpHeaders headers);
}
