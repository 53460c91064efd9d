package com.crosspost.platform.connector.publish;

import com.crosspost.platform.connector.dto.AyrsharePostResponse;
import com.crosspost.platform.connector.dto.PostData;
import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.exception.PublishApiException;
import com.crosspost.platform.connector.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Client for the Ayrshare publishing API.
 *
 * API Documentation: https://www.ayrshare.com/docs/apis/post/post
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AyrsharePublishClient {

    static final String PROFILE_KEY_HEADER = "Profile-Key";

    private final WebClient.Builder webClientBuilder;

    @Value("${ayrshare.api-url:https://api.ayrshare.com/api}")
    private String apiUrl;

    @Value("${ayrshare.api-key:}")
    private String apiKey;

    public AyrsharePostResponse post(PublishRequest request) {
        Map<String, Object> body = toRequestBody(request);
        log.info("Sending post to publishing API for platforms {} (scheduled: {})",
                body.get("platforms"), body.containsKey("scheduleDate"));

        try {
            AyrsharePostResponse response = webClientBuilder.build().post()
                    .uri(apiUrl + "/post")
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .headers(headers -> {
                        if (request.getProfileKey() != null && !request.getProfileKey().isBlank()) {
                            headers.set(PROFILE_KEY_HEADER, request.getProfileKey());
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toApiError)
                    .bodyToMono(AyrsharePostResponse.class)
                    .timeout(Duration.ofSeconds(60))
                    .block();

            if (response == null) {
                throw new PublishApiException(0, "Empty response from publishing API");
            }
            return response;
        } catch (WebClientRequestException e) {
            throw new PublishApiException("Publishing API unreachable: " + e.getMessage(), e);
        }
    }

    /**
     * Flattens the descriptor into the API's body: post, platforms, mediaUrls, scheduleDate and option bags side by side.
     */
    Map<String, Object> toRequestBody(PublishRequest request) {
        PostData postData = request.getPostData();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("post", postData.getPost() != null ? postData.getPost() : "");
        body.put("platforms", request.getPlatforms().stream()
                .map(AyrsharePublishClient::toApiPlatform)
                .collect(Collectors.toList()));
        if (!postData.getMediaUrls().isEmpty()) {
            body.put("mediaUrls", postData.getMediaUrls());
        }
        if (postData.getScheduleDate() != null) {
            body.put("scheduleDate", postData.getScheduleDate());
        }
        body.putAll(postData.getOptions());
        return body;
    }

    /**
     * The API still names X "twitter".
     */
    static String toApiPlatform(String platform) {
        return Platform.X.getKey().equals(platform) ? "twitter" : platform;
    }

    static String fromApiPlatform(String platform) {
        return Platform.fromKey(platform).map(Platform::getKey).orElse(platform);
    }

    private Mono<Throwable> toApiError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(ApiErrorBody.class)
                .<Throwable>map(body -> new PublishApiException(status, body.getMessage() != null
                        ? body.getMessage()
                        : "Publishing API error (HTTP " + status + ")"))
                .onErrorReturn(new PublishApiException(status, "Publishing API error (HTTP " + status + ")"))
                .defaultIfEmpty(new PublishApiException(status, "Publishing API error (HTTP " + status + ")"));
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ApiErrorBody {
        private String status;
        private Integer code;
        private String message;
        private List<AyrsharePostResponse.PlatformError> errors;
    }
}
