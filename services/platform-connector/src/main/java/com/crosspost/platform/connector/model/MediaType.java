package com.crosspost.platform.connector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

@Getter
public enum MediaType {
    URL_IMAGE("url-image", true, false),
    URL_VIDEO("url-video", true, true),
    IMAGE("image", false, false),
    VIDEO("video", false, true);

    private final String wireName;
    private final boolean directUrl;
    private final boolean video;

    MediaType(String wireName, boolean directUrl, boolean video) {
        this.wireName = wireName;
        this.directUrl = directUrl;
        this.video = video;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static MediaType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElse(null);
    }
}
