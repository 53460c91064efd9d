package com.crosspost.platform.connector.dto;

import lombok.Value;

/**
 * A fetchable media URL and whether the platform must treat it as a video.
 */
@Value
public class ResolvedMedia {
    String url;
    boolean video;
}
