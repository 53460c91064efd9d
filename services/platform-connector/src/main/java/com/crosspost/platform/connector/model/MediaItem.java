package com.crosspost.platform.connector.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One attachment of a post variant.
 * URL_IMAGE / URL_VIDEO carry {@code url}; IMAGE / VIDEO carry {@code fileId}, an opaque
 * reference to a binary stored next to the post. A missing type with a {@code url} is the
 * legacy direct-URL shape.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MediaItem {
    MediaType type;
    String url;
    String fileId;
    String sourceUrl;
    String alt;
    String filename;

    public static MediaItem urlImage(String url) {
        return MediaItem.builder().type(MediaType.URL_IMAGE).url(url).build();
    }

    public static MediaItem urlVideo(String url) {
        return MediaItem.builder().type(MediaType.URL_VIDEO).url(url).build();
    }

    public static MediaItem image(String fileId) {
        return MediaItem.builder().type(MediaType.IMAGE).fileId(fileId).build();
    }

    public static MediaItem video(String fileId) {
        return MediaItem.builder().type(MediaType.VIDEO).fileId(fileId).build();
    }

    @JsonIgnore
    public boolean isLegacyUrl() {
        return type == null && url != null;
    }

    @JsonIgnore
    public boolean isVideo() {
        return type != null && type.isVideo();
    }
}
