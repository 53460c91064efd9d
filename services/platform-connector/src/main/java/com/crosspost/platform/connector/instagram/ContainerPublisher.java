package com.crosspost.platform.connector.instagram;

import com.crosspost.platform.connector.dto.PostData;
import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.dto.PublishResult;
import com.crosspost.platform.connector.exception.ContainerPublishException;
import com.crosspost.platform.connector.exception.ContainerTimeoutException;
import com.crosspost.platform.connector.exception.PublishValidationException;
import com.crosspost.platform.connector.exception.ValidationError;
import com.crosspost.platform.connector.model.Platform;
import com.crosspost.platform.connector.model.UserTag;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the container protocol for one publish attempt: create container(s), wait for readiness,
 * group into a carousel when there is more than one item, publish, then look up the permalink.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContainerPublisher {

    private final ContainerPlatformClient platformClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${instagram.container.poll-interval:1s}")
    private Duration pollInterval;

    /** Zero disables the bound and polls until the container leaves PENDING. */
    @Value("${instagram.container.timeout:10m}")
    private Duration containerTimeout;

    public PublishResult publish(PublishRequest request, InstagramCredentials credentials) {
        PostData postData = request.getPostData();
        List<String> mediaUrls = Platform.INSTAGRAM.toContentLimits().capMedia(postData.getMediaUrls());
        if (mediaUrls.isEmpty()) {
            throw new PublishValidationException(ValidationError.NO_MEDIA);
        }

        String caption = postData.getPost();
        List<UserTag> userTags = extractUserTags(request);

        String containerId;
        if (mediaUrls.size() == 1) {
            String url = mediaUrls.get(0);
            containerId = platformClient.createContainer(credentials, url, postData.isVideo(url), caption, userTags, false);
            log.info("Created Instagram container {}", containerId);
            awaitReady(credentials, containerId);
        } else {
            // Children are created one by one so the carousel keeps the media order
            List<String> children = new ArrayList<>();
            for (String url : mediaUrls) {
                String childId = platformClient.createContainer(credentials, url, postData.isVideo(url), null, userTags, true);
                log.info("Created Instagram carousel item container {} ({}/{})", childId, children.size() + 1, mediaUrls.size());
                awaitReady(credentials, childId);
                children.add(childId);
            }
            containerId = platformClient.createCarousel(credentials, children, caption);
            log.info("Created Instagram carousel container {} with {} items", containerId, children.size());
            awaitReady(credentials, containerId);
        }

        log.info("Publishing Instagram container {}", containerId);
        String publishedId = platformClient.publish(credentials, containerId);

        String permalink = platformClient.getPermalink(credentials, publishedId).orElse(null);
        if (permalink == null) {
            log.warn("No permalink available for published Instagram media {}", publishedId);
        }

        log.info("Published Instagram media {} ({})", publishedId, permalink);
        return PublishResult.success(Platform.INSTAGRAM.getKey(), publishedId, permalink);
    }

    void awaitReady(InstagramCredentials credentials, String containerId) {
        Instant deadline = containerTimeout.isZero() ? null : clock.instant().plus(containerTimeout);

        while (true) {
            ContainerStatus status = platformClient.getContainerStatus(credentials, containerId);
            if (status == ContainerStatus.READY) {
                return;
            }
            if (status == ContainerStatus.ERROR) {
                throw new ContainerPublishException("Container " + containerId + " failed processing");
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                throw new ContainerTimeoutException(containerId, containerTimeout);
            }

            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerPublishException("Interrupted while waiting for container " + containerId, e);
            }
        }
    }

    private List<UserTag> extractUserTags(PublishRequest request) {
        Map<String, Object> options = request.getPostData().getOptions().get(Platform.INSTAGRAM.getOptionsKey());
        Object rawTags = options != null ? options.get("userTags") : null;
        if (!(rawTags instanceof List)) {
            return List.of();
        }

        List<UserTag> tags = new ArrayList<>();
        for (Object rawTag : (List<?>) rawTags) {
            if (!(rawTag instanceof Map)) {
                log.warn("Ignoring malformed Instagram user tag: {}", rawTag);
                continue;
            }
            UserTag tag = objectMapper.convertValue(rawTag, UserTag.class);
            if (tag.getUsername() != null && !tag.getUsername().isBlank()) {
                tags.add(tag);
            }
        }
        return tags;
    }
}
