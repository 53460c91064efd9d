package com.crosspost.platform.scheduler.service;

import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.dto.PublishResult;
import com.crosspost.platform.connector.exception.PublishValidationException;
import com.crosspost.platform.connector.model.Post;
import com.crosspost.platform.connector.model.PostVariant;
import com.crosspost.platform.connector.publish.PublisherRouter;
import com.crosspost.platform.connector.service.MediaResolver;
import com.crosspost.platform.connector.service.PublishRequestBuilder;
import com.crosspost.platform.scheduler.exception.PostNotFoundException;
import com.crosspost.platform.scheduler.store.PostDocumentStore;
import com.crosspost.platform.scheduler.store.Subscription;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Drives the schedule of one post.
 *
 * <p>Every synced snapshot commits eligible {@code scheduleDesired} variants to {@code scheduled}.
 * While anything is scheduled a fixed-rate tick checks whether a variant is due and starts at most
 * one publish attempt at a time for the whole post. The outcome is written back to the store:
 * {@code published} on success, {@code scheduleDesired} with a reason on failure.
 */
@Slf4j
public class PostScheduler {

    @Getter
    private final String postId;
    private final PostDocumentStore store;
    private final PublishRequestBuilder requestBuilder;
    private final PublisherRouter publisherRouter;
    private final MediaResolver mediaResolver;
    private final SchedulingWindow window;
    private final RetryPolicy retryPolicy;
    private final TaskScheduler taskScheduler;
    private final Executor publishExecutor;
    private final Clock clock;
    private final Duration tickInterval;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private volatile Post latest;
    private volatile Subscription subscription;
    private volatile ScheduledFuture<?> tickHandle;
    private volatile boolean cancelled;

    @Builder
    private PostScheduler(String postId, PostDocumentStore store, PublishRequestBuilder requestBuilder,
                          PublisherRouter publisherRouter, MediaResolver mediaResolver, SchedulingWindow window,
                          RetryPolicy retryPolicy, TaskScheduler taskScheduler, Executor publishExecutor,
                          Clock clock, Duration tickInterval) {
        this.postId = postId;
        this.store = store;
        this.requestBuilder = requestBuilder;
        this.publisherRouter = publisherRouter;
        this.mediaResolver = mediaResolver;
        this.window = window;
        this.retryPolicy = retryPolicy;
        this.taskScheduler = taskScheduler;
        this.publishExecutor = publishExecutor;
        this.clock = clock;
        this.tickInterval = tickInterval;
    }

    public synchronized void start() {
        if (cancelled || subscription != null) {
            return;
        }
        subscription = store.subscribe(postId, this::onSnapshot);
    }

    /**
     * Stop ticking and stop watching the post. An attempt already running finishes and writes its outcome.
     */
    public synchronized void cancel() {
        cancelled = true;
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        stopTicking();
        log.info("Scheduler for post {} cancelled", postId);
    }

    synchronized void onSnapshot(Post post) {
        if (cancelled) {
            return;
        }
        latest = post;
        commitEligible(post);

        if (hasScheduledVariant(latest)) {
            ensureTicking();
        } else {
            stopTicking();
        }
    }

    void tick() {
        Post post = latest;
        if (cancelled || post == null || inFlight.get()) {
            return;
        }

        Instant now = clock.instant();
        for (Map.Entry<String, PostVariant> entry : post.getPlatformVariants().entrySet()) {
            String platform = entry.getKey();
            PostVariant variant = entry.getValue();
            if (!variant.isScheduled()) {
                continue;
            }

            if (window.isMissed(variant.getScheduledFor(), now)) {
                markMissed(platform, now);
                continue;
            }

            if (window.isDue(variant.getScheduledFor(), now)) {
                startAttempt(platform);
                return;
            }
        }
    }

    private void startAttempt(String platform) {
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Publish already in flight for post {}, skipping {}", postId, platform);
            return;
        }
        try {
            publishExecutor.execute(() -> attempt(platform));
        } catch (TaskRejectedException e) {
            inFlight.set(false);
            log.warn("Publish executor rejected post {} for {}, will retry next tick", postId, platform);
        }
    }

    void attempt(String platform) {
        try {
            Post current = store.find(postId).orElseThrow(() -> new PostNotFoundException(postId));
            PostVariant variant = current.findVariant(platform).orElse(null);
            if (variant == null || !variant.isScheduled()) {
                log.debug("Post {} is no longer scheduled for {}", postId, platform);
                return;
            }

            log.info("Publishing post {} to {} (scheduled for {})", postId, platform, variant.getScheduledFor());
            PublishRequest request = requestBuilder.buildForPlatform(current, platform);
            PublishResult result = publisherRouter.publish(request).stream()
                    .filter(candidate -> platform.equals(candidate.getPlatform()))
                    .findFirst()
                    .orElseGet(() -> PublishResult.failure(platform, "NO_RESULT", "No publish result for " + platform));

            if (result.isSuccess()) {
                Instant publishedAt = clock.instant();
                writeBack(platform, v -> v.markPublished(result.getPlatformPostId(), result.getPermalink(), publishedAt));
                log.info("Post {} published to {}: {}", postId, platform,
                        result.getPermalink() != null ? result.getPermalink() : result.getPlatformPostId());
            } else {
                log.warn("Publishing post {} to {} failed: {}", postId, platform, result.toFailureReason());
                writeBack(platform, v -> v.demote(result.getErrorCode(), result.toFailureReason(), result.isRetryable()));
            }
        } catch (PublishValidationException e) {
            String code = e.getError().name();
            log.warn("Post {} cannot be published to {}: {}", postId, platform, e.getMessage());
            writeBack(platform, v -> v.demote(code, String.format("[%s] %s", code, e.getMessage()), false));
        } catch (PostNotFoundException e) {
            log.warn("Post {} was deleted before publishing to {}", postId, platform);
        } catch (Exception e) {
            log.error("Error publishing post {} to {}: {}", postId, platform, e.getMessage(), e);
            writeBack(platform, v -> v.demote("INTERNAL_ERROR", e.toString(), true));
        } finally {
            inFlight.set(false);
        }
    }

    private void commitEligible(Post post) {
        Instant now = clock.instant();
        List<String> eligible = new ArrayList<>();
        post.getPlatformVariants().forEach((platform, variant) -> {
            if (committed(post, variant, now).isPresent()) {
                eligible.add(platform);
            }
        });
        if (eligible.isEmpty()) {
            return;
        }

        try {
            store.update(postId, current -> {
                Post updated = current;
                for (String platform : eligible) {
                    PostVariant variant = updated.findVariant(platform).orElse(null);
                    if (variant == null) {
                        continue;
                    }
                    Optional<PostVariant> next = committed(updated, variant, now);
                    if (next.isPresent()) {
                        updated = updated.withVariant(platform, next.get());
                    }
                }
                return updated;
            });
            log.info("Committed schedule of post {} for {}", postId, eligible);
        } catch (PostNotFoundException e) {
            log.warn("Post {} was deleted before its schedule could be committed", postId);
        }
    }

    /**
     * The committed form of a {@code scheduleDesired} variant, or empty when it cannot be committed yet.
     */
    private Optional<PostVariant> committed(Post post, PostVariant variant, Instant now) {
        if (!variant.isScheduleDesired() || variant.getScheduledFor() == null) {
            return Optional.empty();
        }
        if (variant.getNotScheduledReason() != null) {
            return retryPolicy.nextAttemptAt(variant, now).map(variant::recommit);
        }
        if (!hasMedia(post, variant)) {
            return Optional.empty();
        }
        return Optional.of(variant.commitSchedule());
    }

    private boolean hasMedia(Post post, PostVariant variant) {
        return !mediaResolver.resolve(variant).isEmpty() || !mediaResolver.resolve(post.getBase()).isEmpty();
    }

    private void markMissed(String platform, Instant now) {
        String reason = String.format("[%s] Scheduled time passed more than %d minutes ago",
                RetryPolicy.MISSED_WINDOW, window.getGraceWindow().toMinutes());
        log.warn("Post {} missed its scheduling window for {}", postId, platform);
        writeBack(platform, v -> v.isScheduled() && window.isMissed(v.getScheduledFor(), now)
                ? v.demote(RetryPolicy.MISSED_WINDOW, reason, false)
                : v);
    }

    private void writeBack(String platform, UnaryOperator<PostVariant> mutation) {
        try {
            store.update(postId, post -> post.updateVariant(platform, mutation));
        } catch (PostNotFoundException e) {
            log.warn("Post {} was deleted, dropping the {} outcome", postId, platform);
        }
    }

    private static boolean hasScheduledVariant(Post post) {
        return post.getPlatformVariants().values().stream().anyMatch(PostVariant::isScheduled);
    }

    private void ensureTicking() {
        if (cancelled || tickHandle != null) {
            return;
        }
        tickHandle = taskScheduler.scheduleAtFixedRate(this::tick, tickInterval);
        log.debug("Ticking post {} every {}", postId, tickInterval);
    }

    private void stopTicking() {
        ScheduledFuture<?> handle = tickHandle;
        if (handle != null) {
            handle.cancel(false);
            tickHandle = null;
            log.debug("Stopped ticking post {}", postId);
        }
    }

    public boolean isTicking() {
        return tickHandle != null;
    }

    public boolean isPublishInFlight() {
        return inFlight.get();
    }
}
