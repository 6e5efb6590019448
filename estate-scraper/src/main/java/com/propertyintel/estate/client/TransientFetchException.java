package com.propertyintel.estate.client;

/** Retryable: timeouts, connection resets and statuses on the retry list */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String message, String url, int status, Throwable cause) {
        super(message, url, status, cause);
    }
}
