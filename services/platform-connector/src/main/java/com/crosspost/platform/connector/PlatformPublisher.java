package com.crosspost.platform.connector;

import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.dto.PublishResult;

import java.util.List;

/**
 * Sends a built publish request to a platform, either directly or through the publishing API.
 * Implementations: InstagramDirectPublisher, AyrsharePublisher
 */
public interface PlatformPublisher {

    /**
     * Whether this publisher can deliver posts to the given platform key
     */
    boolean supports(String platform);

    /**
     * Publish the request and report one result per platform it targets.
     * Failures are reported as results, never thrown.
     */
    List<PublishResult> publish(PublishRequest request);
}
