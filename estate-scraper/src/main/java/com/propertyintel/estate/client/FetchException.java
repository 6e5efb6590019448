package com.propertyintel.estate.client;

import lombok.Getter;

@Getter
public class FetchException extends RuntimeException {

    private final String url;
    private final int status;

    public FetchException(String message, String url, int status, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = status;
    }
}
