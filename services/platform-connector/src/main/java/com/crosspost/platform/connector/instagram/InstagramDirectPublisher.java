package com.crosspost.platform.connector.instagram;

import com.crosspost.platform.connector.PlatformPublisher;
import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.dto.PublishResult;
import com.crosspost.platform.connector.exception.ContainerPublishException;
import com.crosspost.platform.connector.exception.ContainerTimeoutException;
import com.crosspost.platform.connector.exception.PublishValidationException;
import com.crosspost.platform.connector.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Publishes Instagram posts through the Graph API container protocol instead of the publishing API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InstagramDirectPublisher implements PlatformPublisher {

    private final ContainerPublisher containerPublisher;
    private final InstagramCredentialProvider credentialProvider;

    @Override
    public boolean supports(String platform) {
        return Platform.INSTAGRAM.getKey().equals(platform);
    }

    @Override
    public List<PublishResult> publish(PublishRequest request) {
        String platform = Platform.INSTAGRAM.getKey();
        log.info("Publishing Instagram post directly for profile: {}",
                request.getProfileKey() != null ? InstagramCredentialProvider.abbreviate(request.getProfileKey()) : "default");

        try {
            InstagramCredentials credentials = credentialProvider.forProfileKey(request.getProfileKey());
            return List.of(containerPublisher.publish(request, credentials));
        } catch (PublishValidationException e) {
            log.warn("Instagram post rejected: {}", e.getMessage());
            return List.of(PublishResult.rejected(platform, e.getError().name(), e.getMessage()));
        } catch (ContainerTimeoutException e) {
            log.error("Instagram container timed out: {}", e.getMessage());
            return List.of(PublishResult.failure(platform, "CONTAINER_TIMEOUT", e.getMessage()));
        } catch (ContainerPublishException e) {
            log.error("Instagram container publishing failed: {}", e.getMessage(), e);
            return List.of(PublishResult.failure(platform, "CONTAINER_ERROR", e.getMessage()));
        } catch (Exception e) {
            log.error("Error publishing Instagram post: {}", e.getMessage(), e);
            return List.of(PublishResult.failure(platform, "INTERNAL_ERROR", e.getMessage()));
        }
    }
}
