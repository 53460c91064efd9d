package com.crosspost.platform.connector.instagram;

import com.crosspost.platform.connector.exception.ContainerPublishException;
import com.crosspost.platform.connector.model.UserTag;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Instagram content publishing through the Graph API.
 * Requires a Facebook Business account with an Instagram Professional Account linked.
 *
 * API Documentation: https://developers.facebook.com/docs/instagram-api/guides/content-publishing
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstagramGraphApiClient implements ContainerPlatformClient {

    private final WebClient.Builder webClientBuilder;

    @Value("${instagram.graph-api-base:https://graph.facebook.com/v18.0}")
    private String graphApiBase;

    @Override
    public String createContainer(InstagramCredentials credentials, String mediaUrl, boolean video,
                                  String caption, List<UserTag> userTags, boolean carouselItem) {
        Map<String, Object> params = new HashMap<>();
        if (video) {
            // Carousel children must be plain VIDEO; standalone videos publish as Reels
            params.put("media_type", carouselItem ? "VIDEO" : "REELS");
            params.put("video_url", mediaUrl);
        } else {
            params.put("image_url", mediaUrl);
        }

        if (carouselItem) {
            params.put("is_carousel_item", true);
        } else if (caption != null) {
            params.put("caption", caption);
        }

        if (!video && userTags != null && !userTags.isEmpty()) {
            params.put("user_tags", userTags.stream()
                    .map(tag -> Map.of("username", tag.getUsername(), "x", tag.getX(), "y", tag.getY()))
                    .collect(Collectors.toList()));
        }

        InstagramMediaResponse response = webClientBuilder.build().post()
                .uri(graphApiBase + "/{igUserId}/media?access_token={token}",
                        credentials.getInstagramUserId(), credentials.getAccessToken())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(params)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toGraphApiError)
                .bodyToMono(InstagramMediaResponse.class)
                .timeout(Duration.ofSeconds(30))
                .block();

        if (response == null || response.getId() == null) {
            throw new ContainerPublishException("Instagram returned no container ID for " + mediaUrl);
        }
        return response.getId();
    }

    @Override
    public ContainerStatus getContainerStatus(InstagramCredentials credentials, String containerId) {
        InstagramContainerStatus status = webClientBuilder.build().get()
                .uri(graphApiBase + "/{containerId}?fields=status_code&access_token={token}",
                        containerId, credentials.getAccessToken())
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toGraphApiError)
                .bodyToMono(InstagramContainerStatus.class)
                .timeout(Duration.ofSeconds(10))
                .block();

        return ContainerStatus.fromStatusCode(status != null ? status.getStatusCode() : null);
    }

    @Override
    public String createCarousel(InstagramCredentials credentials, List<String> childContainerIds, String caption) {
        Map<String, Object> params = new HashMap<>();
        params.put("media_type", "CAROUSEL");
        params.put("children", String.join(",", childContainerIds));
        if (caption != null) {
            params.put("caption", caption);
        }

        InstagramMediaResponse response = webClientBuilder.build().post()
                .uri(graphApiBase + "/{igUserId}/media?access_token={token}",
                        credentials.getInstagramUserId(), credentials.getAccessToken())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(params)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toGraphApiError)
                .bodyToMono(InstagramMediaResponse.class)
                .timeout(Duration.ofSeconds(30))
                .block();

        if (response == null || response.getId() == null) {
            throw new ContainerPublishException("Instagram returned no carousel container ID");
        }
        return response.getId();
    }

    @Override
    public String publish(InstagramCredentials credentials, String containerId) {
        InstagramMediaResponse response = webClientBuilder.build().post()
                .uri(graphApiBase + "/{igUserId}/media_publish?creation_id={containerId}&access_token={token}",
                        credentials.getInstagramUserId(), containerId, credentials.getAccessToken())
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toGraphApiError)
                .bodyToMono(InstagramMediaResponse.class)
                .timeout(Duration.ofSeconds(30))
                .block();

        if (response == null || response.getId() == null) {
            throw new ContainerPublishException("Failed to publish container " + containerId);
        }
        return response.getId();
    }

    @Override
    public Optional<String> getPermalink(InstagramCredentials credentials, String publishedId) {
        try {
            InstagramPermalink response = webClientBuilder.build().get()
                    .uri(graphApiBase + "/{mediaId}?fields=permalink&access_token={token}",
                            publishedId, credentials.getAccessToken())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toGraphApiError)
                    .bodyToMono(InstagramPermalink.class)
                    .timeout(Duration.ofSeconds(10))
                    .block();

            if (response != null && response.getPermalink() != null && !response.getPermalink().isBlank()) {
                return Optional.of(response.getPermalink());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to get Instagram media permalink for {}: {}", publishedId, e.getMessage());
        }
        return Optional.empty();
    }

    private Mono<Throwable> toGraphApiError(ClientResponse response) {
        int status = response.statusCode().value();
        Throwable fallback = new ContainerPublishException("Instagram Graph API error (HTTP " + status + ")");
        return response.bodyToMono(GraphApiErrorResponse.class)
                .<Throwable>map(body -> new ContainerPublishException(body.describe(status)))
                .onErrorReturn(fallback)
                .defaultIfEmpty(fallback);
    }
}

// Instagram API Response DTOs
@Data
@NoArgsConstructor
@AllArgsConstructor
class InstagramMediaResponse {
    private String id;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
class InstagramContainerStatus {
    @JsonProperty("status_code")
    private String statusCode; // IN_PROGRESS, FINISHED, ERROR, EXPIRED, PUBLISHED
}

@Data
@NoArgsConstructor
@AllArgsConstructor
class InstagramPermalink {
    private String id;
    private String permalink;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
class GraphApiErrorResponse {
    private GraphApiError error;

    String describe(int status) {
        if (error == null) {
            return "Instagram Graph API error (HTTP " + status + ")";
        }
        // error_user_title is the human readable variant Meta shows to end users
        String message = error.getErrorUserTitle() != null ? error.getErrorUserTitle() : error.getMessage();
        return String.format("Instagram Graph API error %s (HTTP %d): %s", error.getCode(), status, message);
    }
}

@Data
@NoArgsConstructor
@AllArgsConstructor
class GraphApiError {
    private String message;
    private String type;
    private Integer code;
    @JsonProperty("error_user_title")
    private String errorUserTitle;
}
