package com.propertyintel.estate.client;

/**
 * Transport used by the planner and page fetcher.
 * Implementations own retry, timeout and rate limiting.
 */
public interface FetchClient {

    /**
     * GET {@code url} and return the response body.
     *
     * @throws TransientFetchException when retries were exhausted on a retryable failure
     * @throws FatalFetchException     when the response can never succeed
     */
    String fetch(String url);
}
