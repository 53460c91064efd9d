package com.crosspost.platform.connector.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class ContainerTimeoutException extends ContainerPublishException {

    private final String containerId;
    private final Duration timeout;

    public ContainerTimeoutException(String containerId, Duration timeout) {
        super(String.format("Container %s was not ready after %ds", containerId, timeout.toSeconds()));
        this.containerId = containerId;
        this.timeout = timeout;
    }
}
