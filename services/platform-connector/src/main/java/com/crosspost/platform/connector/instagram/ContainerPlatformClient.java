package com.crosspost.platform.connector.instagram;

import com.crosspost.platform.connector.model.UserTag;

import java.util.List;
import java.util.Optional;

/**
 * Platform API that publishes through staged media containers.
 */
public interface ContainerPlatformClient {

    /**
     * Create a container for one media item and return its id.
     *
     * @param carouselItem true when the container will become a child of a carousel
     */
    String createContainer(InstagramCredentials credentials, String mediaUrl, boolean video,
                           String caption, List<UserTag> userTags, boolean carouselItem);

    ContainerStatus getContainerStatus(InstagramCredentials credentials, String containerId);

    String createCarousel(InstagramCredentials credentials, List<String> childContainerIds, String caption);

    /**
     * Publish a ready container and return the id of the published media.
     */
    String publish(InstagramCredentials credentials, String containerId);

    Optional<String> getPermalink(InstagramCredentials credentials, String publishedId);
}
