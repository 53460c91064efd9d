package com.crosspost.platform.connector.exception;

import lombok.Getter;

@Getter
public class PublishValidationException extends RuntimeException {

    private final ValidationError error;

    public PublishValidationException(ValidationError error) {
        this(error, error.getDefaultMessage());
    }

    public PublishValidationException(ValidationError error, String message) {
        super(message);
        this.error = error;
    }
}
