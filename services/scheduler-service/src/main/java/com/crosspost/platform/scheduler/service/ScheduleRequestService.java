package com.crosspost.platform.scheduler.service;

import com.crosspost.platform.connector.model.Platform;
import com.crosspost.platform.connector.model.Post;
import com.crosspost.platform.connector.model.PostVariant;
import com.crosspost.platform.connector.model.VariantStatus;
import com.crosspost.platform.scheduler.dto.EditContentRequest;
import com.crosspost.platform.scheduler.dto.PlatformStatusResponse;
import com.crosspost.platform.scheduler.dto.PostScheduleResponse;
import com.crosspost.platform.scheduler.exception.PostNotFoundException;
import com.crosspost.platform.scheduler.exception.ScheduleRuleException;
import com.crosspost.platform.scheduler.store.PostDocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * User-facing schedule changes. Only writes intent ({@code scheduleDesired}, {@code draft});
 * committing and publishing belong to {@link PostScheduler}.
 */
@Service
@Slf4j
public class ScheduleRequestService {

    private final PostDocumentStore store;
    private final PostSchedulerRegistry schedulerRegistry;
    private final Clock clock;
    private final Duration minLeadTime;

    public ScheduleRequestService(PostDocumentStore store,
                                  PostSchedulerRegistry schedulerRegistry,
                                  Clock clock,
                                  @Value("${scheduler.min-lead-time:5m}") Duration minLeadTime) {
        this.store = store;
        this.schedulerRegistry = schedulerRegistry;
        this.clock = clock;
        this.minLeadTime = minLeadTime;
    }

    public PostScheduleResponse requestSchedule(String postId, String platformName, Instant scheduledAt) {
        String platform = platformKey(platformName);
        Instant earliest = clock.instant().plus(minLeadTime);
        if (scheduledAt.isBefore(earliest)) {
            throw new ScheduleRuleException(String.format(
                    "Scheduled time must be at least %d minutes in the future", minLeadTime.toMinutes()));
        }

        Post updated = store.update(postId, post -> {
            PostVariant current = post.findVariant(platform).orElse(PostVariant.builder().build());
            if (current.isPublished()) {
                throw new ScheduleRuleException("Post " + postId + " is already published to " + platform);
            }
            return post.withVariant(platform, current.toBuilder()
                    .status(VariantStatus.SCHEDULE_DESIRED)
                    .scheduledFor(scheduledAt)
                    .notScheduledReason(null)
                    .lastErrorCode(null)
                    .retryable(false)
                    .attemptCount(0)
                    .build());
        });

        log.info("Schedule requested for post {} on {} at {}", postId, platform, scheduledAt);
        return toResponse(updated);
    }

    public PostScheduleResponse cancelSchedule(String postId, String platformName) {
        String platform = platformKey(platformName);

        Post updated = store.update(postId, post -> {
            PostVariant current = post.findVariant(platform)
                    .orElseThrow(() -> new ScheduleRuleException("Post " + postId + " has no variant for " + platform));
            if (current.isPublished()) {
                throw new ScheduleRuleException("Post " + postId + " is already published to " + platform);
            }
            return post.withVariant(platform, current.toBuilder()
                    .status(VariantStatus.DRAFT)
                    .scheduledFor(null)
                    .notScheduledReason(null)
                    .build());
        });

        log.info("Schedule cancelled for post {} on {}", postId, platform);
        return toResponse(updated);
    }

    /**
     * Replace text and/or media of a variant. Any pending schedule is dropped back to draft.
     */
    public PostScheduleResponse editContent(String postId, String variantKey, EditContentRequest request) {
        String key = Platform.BASE_KEY.equalsIgnoreCase(variantKey) ? Platform.BASE_KEY : platformKey(variantKey);
        Instant now = clock.instant();

        Post updated = store.update(postId, post -> {
            PostVariant current = post.findVariant(key).orElse(PostVariant.builder().build());
            if (current.isPublished()) {
                throw new ScheduleRuleException("Published content of post " + postId + " cannot be edited");
            }
            PostVariant.PostVariantBuilder edited = current.toBuilder()
                    .status(VariantStatus.DRAFT)
                    .notScheduledReason(null)
                    .edited(true)
                    .lastModified(now);
            if (request.getText() != null) {
                edited.text(request.getText());
            }
            if (request.getMedia() != null) {
                edited.media(List.copyOf(request.getMedia()));
            }
            return post.withVariant(key, edited.build());
        });

        log.info("Content of post {} edited for {}", postId, key);
        return toResponse(updated);
    }

    public PostScheduleResponse getScheduleStatus(String postId) {
        Post post = store.find(postId).orElseThrow(() -> new PostNotFoundException(postId));
        return toResponse(post);
    }

    private PostScheduleResponse toResponse(Post post) {
        List<PlatformStatusResponse> platforms = post.getPlatformVariants().entrySet().stream()
                .map(entry -> PlatformStatusResponse.from(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        Optional<PostScheduler> scheduler = schedulerRegistry.get(post.getId());

        return PostScheduleResponse.builder()
                .postId(post.getId())
                .title(post.getTitle())
                .schedulerActive(scheduler.map(PostScheduler::isTicking).orElse(false))
                .publishInFlight(scheduler.map(PostScheduler::isPublishInFlight).orElse(false))
                .platforms(platforms)
                .build();
    }

    private static String platformKey(String platformName) {
        return Platform.fromKey(platformName)
                .map(Platform::getKey)
                .orElseThrow(() -> new IllegalArgumentException("Invalid platform: " + platformName));
    }
}
