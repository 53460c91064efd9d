package com.crosspost.platform.connector.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {
    private String platform;
    private boolean success;
    private String platformPostId;
    private String permalink;
    private String errorCode;
    private String errorMessage;
    private boolean retryable;
    private OffsetDateTime publishedAt;

    public static PublishResult success(String platform, String platformPostId, String permalink) {
        return PublishResult.builder()
                .platform(platform)
                .success(true)
                .platformPostId(platformPostId)
                .permalink(permalink)
                .publishedAt(OffsetDateTime.now())
                .build();
    }

    public static PublishResult failure(String platform, String errorCode, String errorMessage) {
        return PublishResult.builder()
                .platform(platform)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .retryable(true)
                .build();
    }

    public static PublishResult rejected(String platform, String errorCode, String errorMessage) {
        return PublishResult.builder()
                .platform(platform)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .retryable(false)
                .build();
    }

    /**
     * Reason string stored on the post when this attempt failed.
     */
    public String toFailureReason() {
        return String.format("[%s] %s", errorCode, errorMessage);
    }
}
