package com.crosspost.platform.connector.exception;

import lombok.Getter;

@Getter
public class PublishApiException extends RuntimeException {

    private final int statusCode;

    public PublishApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public PublishApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
