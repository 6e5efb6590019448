package com.propertyintel.estate.client;

public class FatalFetchException extends FetchException {

    public FatalFetchException(String message, String url, int status, Throwable cause) {
        super(message, url, status, cause);
    }
}
