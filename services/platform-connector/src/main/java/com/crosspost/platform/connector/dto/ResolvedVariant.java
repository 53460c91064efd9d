package com.crosspost.platform.connector.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Effective text, media and options for one platform after override precedence is applied.
 */
@Value
@Builder
public class ResolvedVariant {
    String platform;
    String text;

    @Builder.Default
    List<String> mediaUrls = List.of();

    /** The entries of {@code mediaUrls} that are videos. */
    @Builder.Default
    Set<String> videoUrls = Set.of();

    String optionsKey;

    /** Null when no layer supplied options for this platform. */
    Map<String, Object> options;
}
