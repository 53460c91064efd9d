package com.crosspost.platform.connector.publish;

import com.crosspost.platform.connector.PlatformPublisher;
import com.crosspost.platform.connector.dto.AyrsharePostResponse;
import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.dto.PublishResult;
import com.crosspost.platform.connector.exception.PublishApiException;
import com.crosspost.platform.connector.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Publishes through the Ayrshare API, which fans a single request out to every listed platform.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AyrsharePublisher implements PlatformPublisher {

    private final AyrsharePublishClient client;

    @Override
    public boolean supports(String platform) {
        return Platform.fromKey(platform).isPresent();
    }

    @Override
    public List<PublishResult> publish(PublishRequest request) {
        AyrsharePostResponse response;
        try {
            response = client.post(request);
        } catch (PublishApiException e) {
            log.error("Publishing API call failed for {}: {}", request.getPlatforms(), e.getMessage());
            return failAll(request, e);
        } catch (Exception e) {
            log.error("Error publishing to {}: {}", request.getPlatforms(), e.getMessage(), e);
            return request.getPlatforms().stream()
                    .map(platform -> PublishResult.failure(platform, "INTERNAL_ERROR", e.getMessage()))
                    .collect(Collectors.toList());
        }

        List<PublishResult> results = new ArrayList<>();
        for (String platform : request.getPlatforms()) {
            results.add(toResult(platform, response));
        }
        return results;
    }

    private PublishResult toResult(String platform, AyrsharePostResponse response) {
        Optional<AyrsharePostResponse.PlatformPostId> postId = Optional.ofNullable(response.getPostIds())
                .flatMap(ids -> ids.stream()
                        .filter(id -> platform.equals(AyrsharePublishClient.fromApiPlatform(id.getPlatform())))
                        .findFirst());
        if (postId.isPresent() && !"error".equalsIgnoreCase(postId.get().getStatus())) {
            String id = postId.get().getId() != null ? postId.get().getId() : response.getId();
            log.info("Published to {}: {}", platform, id);
            return PublishResult.success(platform, id, postId.get().getPostUrl());
        }

        Optional<AyrsharePostResponse.PlatformError> error = Optional.ofNullable(response.getErrors())
                .flatMap(errors -> errors.stream()
                        .filter(e -> platform.equals(AyrsharePublishClient.fromApiPlatform(e.getPlatform())))
                        .findFirst());
        if (error.isPresent()) {
            log.warn("Publishing API reported an error for {}: {}", platform, error.get().getMessage());
            return PublishResult.failure(platform,
                    error.get().getCode() != null ? error.get().getCode() : "PLATFORM_ERROR",
                    error.get().getMessage());
        }

        // Scheduled posts come back with one post id for the whole request
        if ("scheduled".equalsIgnoreCase(response.getStatus()) && response.getId() != null) {
            return PublishResult.success(platform, response.getId(), null);
        }

        log.warn("Publishing API returned no result for {} (status: {})", platform, response.getStatus());
        return PublishResult.failure(platform, "NO_RESULT",
                "Publishing API returned no result for " + platform);
    }

    private List<PublishResult> failAll(PublishRequest request, PublishApiException e) {
        boolean retryable = e.getStatusCode() == 0 || e.getStatusCode() == 429 || e.getStatusCode() >= 500;
        return request.getPlatforms().stream()
                .map(platform -> retryable
                        ? PublishResult.failure(platform, "PUBLISH_API_ERROR", e.getMessage())
                        : PublishResult.rejected(platform, "PUBLISH_API_REJECTED", e.getMessage()))
                .collect(Collectors.toList());
    }
}
