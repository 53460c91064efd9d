package com.crosspost.platform.connector.exception;

/**
 * A media container could not be created, became unusable, or could not be published.
 */
public class ContainerPublishException extends RuntimeException {

    public ContainerPublishException(String message) {
        super(message);
    }

    public ContainerPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
