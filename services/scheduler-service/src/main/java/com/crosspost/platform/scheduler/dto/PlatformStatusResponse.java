package com.crosspost.platform.scheduler.dto;

import com.crosspost.platform.connector.model.PostVariant;
import lombok.*;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformStatusResponse {
    private String platform;
    private String status;
    private Instant scheduledFor;
    private String notScheduledReason;
    private String lastErrorCode;
    private int attemptCount;
    private String platformPostId;
    private String platformShareUrl;
    private Instant publishedAt;

    public static PlatformStatusResponse from(String platform, PostVariant variant) {
        return PlatformStatusResponse.builder()
                .platform(platform)
                .status(variant.getStatus().getWireName())
                .scheduledFor(variant.getScheduledFor())
                .notScheduledReason(variant.getNotScheduledReason())
                .lastErrorCode(variant.getLastErrorCode())
                .attemptCount(variant.getAttemptCount())
                .platformPostId(variant.getAyrsharePostId())
                .platformShareUrl(variant.getSocialPostUrl())
                .publishedAt(variant.getPublishedAt())
                .build();
    }
}
