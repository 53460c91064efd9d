package com.crosspost.platform.connector.service;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackendBinaryUrlResolverTest {

    private final BackendBinaryUrlResolver resolver = new BackendBinaryUrlResolver();

    @Test
    void resolve_buildsImageRouteUrl() {
        ReflectionTestUtils.setField(resolver, "binaryBaseUrl", "https://backend.example/");

        assertEquals(Optional.of("https://backend.example/image/file-1"), resolver.resolve("file-1"));
    }

    @Test
    void resolve_emptyWithoutIdOrBase() {
        ReflectionTestUtils.setField(resolver, "binaryBaseUrl", "");
        assertTrue(resolver.resolve("file-1").isEmpty());

        ReflectionTestUtils.setField(resolver, "binaryBaseUrl", "https://backend.example");
        assertTrue(resolver.resolve(" ").isEmpty());
    }
}
