package com.crosspost.platform.connector.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Serves file-backed media through the backend's {@code /image/{id}} route.
 */
@Component
public class BackendBinaryUrlResolver implements BinaryUrlResolver {

    @Value("${media.binary-base-url:http://localhost:3331}")
    private String binaryBaseUrl;

    @Override
    public Optional<String> resolve(String fileId) {
        if (fileId == null || fileId.isBlank() || binaryBaseUrl == null || binaryBaseUrl.isBlank()) {
            return Optional.empty();
        }
        String base = binaryBaseUrl.endsWith("/")
                ? binaryBaseUrl.substring(0, binaryBaseUrl.length() - 1)
                : binaryBaseUrl;
        return Optional.of(base + "/image/" + fileId);
    }
}
