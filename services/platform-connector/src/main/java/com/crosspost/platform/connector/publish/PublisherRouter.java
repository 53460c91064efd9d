package com.crosspost.platform.connector.publish;

import com.crosspost.platform.connector.PlatformPublisher;
import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.dto.PublishResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sends platforms listed in {@code publishing.direct-platforms} through their direct publisher and
 * everything else through the publishing API.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublisherRouter {

    private final List<PlatformPublisher> publishers;
    private final AyrsharePublisher ayrsharePublisher;

    @Value("${publishing.direct-platforms:instagram}")
    private Set<String> directPlatforms;

    public List<PublishResult> publish(PublishRequest request) {
        List<String> viaApi = new ArrayList<>();
        List<PublishResult> results = new ArrayList<>();

        for (String platform : request.getPlatforms()) {
            Optional<PlatformPublisher> direct = directPublisherFor(platform);
            if (direct.isPresent()) {
                log.debug("Routing {} to {}", platform, direct.get().getClass().getSimpleName());
                results.addAll(direct.get().publish(singlePlatform(request, platform)));
            } else {
                viaApi.add(platform);
            }
        }

        if (!viaApi.isEmpty()) {
            PublishRequest apiRequest = viaApi.size() == request.getPlatforms().size()
                    ? request
                    : request.toBuilder().platforms(List.copyOf(viaApi)).build();
            results.addAll(ayrsharePublisher.publish(apiRequest));
        }
        return results;
    }

    Optional<PlatformPublisher> directPublisherFor(String platform) {
        if (!directPlatforms.contains(platform)) {
            return Optional.empty();
        }
        return publishers.stream()
                .filter(publisher -> publisher != ayrsharePublisher)
                .filter(publisher -> publisher.supports(platform))
                .findFirst();
    }

    private static PublishRequest singlePlatform(PublishRequest request, String platform) {
        return request.toBuilder().platforms(List.of(platform)).build();
    }
}
