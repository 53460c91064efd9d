package com.crosspost.platform.connector.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Per-platform version of a post. Immutable; state changes produce a new instance so that
 * snapshots handed out by the document store never change under a reader.
 */
@Value
@Builder(toBuilder = true)
public class PostVariant {
    String text;

    @Builder.Default
    List<MediaItem> media = List.of();

    /** Serialized option bag, e.g. {@code {"redditOptions":{"title":"..."}}}. */
    String platformOptions;

    @Builder.Default
    VariantStatus status = VariantStatus.DRAFT;

    Instant scheduledFor;
    String notScheduledReason;
    String lastErrorCode;
    int attemptCount;

    /** Whether the failure that demoted this variant may be attempted again. */
    boolean retryable;

    String ayrsharePostId;
    String socialPostUrl;
    Instant publishedAt;

    boolean edited;
    Instant lastModified;

    public boolean isScheduleDesired() {
        return status == VariantStatus.SCHEDULE_DESIRED;
    }

    public boolean isScheduled() {
        return status == VariantStatus.SCHEDULED;
    }

    public boolean isPublished() {
        return status == VariantStatus.PUBLISHED;
    }

    public PostVariant commitSchedule() {
        return toBuilder()
                .status(VariantStatus.SCHEDULED)
                .notScheduledReason(null)
                .build();
    }

    /**
     * Commit again after a failed attempt. The last failure reason stays until the next outcome.
     */
    public PostVariant recommit(Instant at) {
        return toBuilder()
                .status(VariantStatus.SCHEDULED)
                .scheduledFor(at)
                .build();
    }

    public PostVariant markPublished(String postId, String permalink, Instant at) {
        return toBuilder()
                .status(VariantStatus.PUBLISHED)
                .ayrsharePostId(postId)
                .socialPostUrl(permalink)
                .publishedAt(at)
                .notScheduledReason(null)
                .lastErrorCode(null)
                .retryable(false)
                .build();
    }

    /**
     * Send the variant back to {@code scheduleDesired}, keeping its time and recording why.
     */
    public PostVariant demote(String errorCode, String reason, boolean retryable) {
        return toBuilder()
                .status(VariantStatus.SCHEDULE_DESIRED)
                .notScheduledReason(reason)
                .lastErrorCode(errorCode)
                .retryable(retryable)
                .attemptCount(attemptCount + 1)
                .build();
    }
}
