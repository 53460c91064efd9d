package com.crosspost.platform.connector.publish;

import com.crosspost.platform.connector.dto.AyrsharePostResponse;
import com.crosspost.platform.connector.dto.PostData;
import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.dto.PublishResult;
import com.crosspost.platform.connector.exception.PublishApiException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AyrsharePublisherTest {

    @Mock
    private AyrsharePublishClient client;

    @InjectMocks
    private AyrsharePublisher publisher;

    private final PublishRequest request = PublishRequest.builder()
            .platforms(List.of("x", "reddit"))
            .postData(PostData.builder().post("Hello").build())
            .build();

    @Test
    void supports_knownPlatformsOnly() {
        assertTrue(publisher.supports("reddit"));
        assertFalse(publisher.supports("myspace"));
    }

    @Test
    void publish_mapsPostIdsAndErrorsPerPlatform() {
        AyrsharePostResponse response = new AyrsharePostResponse("error", "ay-1",
                List.of(new AyrsharePostResponse.PlatformPostId("twitter", "t-1", "https://x.com/t-1", "success")),
                List.of(new AyrsharePostResponse.PlatformError("reddit", "SUBREDDIT_MISSING", "Subreddit required")));
        when(client.post(request)).thenReturn(response);

        List<PublishResult> results = publisher.publish(request);

        assertEquals(2, results.size());
        PublishResult x = results.get(0);
        assertTrue(x.isSuccess());
        assertEquals("x", x.getPlatform());
        assertEquals("t-1", x.getPlatformPostId());
        assertEquals("https://x.com/t-1", x.getPermalink());

        PublishResult reddit = results.get(1);
        assertFalse(reddit.isSuccess());
        assertEquals("SUBREDDIT_MISSING", reddit.getErrorCode());
        assertEquals("[SUBREDDIT_MISSING] Subreddit required", reddit.toFailureReason());
    }

    @Test
    void publish_scheduledResponseSucceedsWithRequestId() {
        when(client.post(request)).thenReturn(new AyrsharePostResponse("scheduled", "ay-2", null, null));

        List<PublishResult> results = publisher.publish(request);

        assertTrue(results.stream().allMatch(PublishResult::isSuccess));
        assertEquals("ay-2", results.get(1).getPlatformPostId());
        assertNull(results.get(1).getPermalink());
    }

    @Test
    void publish_missingPlatformResultIsFailure() {
        when(client.post(request)).thenReturn(new AyrsharePostResponse("success", "ay-3",
                List.of(new AyrsharePostResponse.PlatformPostId("twitter", "t-1", null, "success")), null));

        PublishResult reddit = publisher.publish(request).get(1);

        assertEquals("NO_RESULT", reddit.getErrorCode());
    }

    @Test
    void publish_clientErrorStatusIsRejected() {
        when(client.post(request)).thenThrow(new PublishApiException(400, "Bad request"));

        List<PublishResult> results = publisher.publish(request);

        assertEquals(2, results.size());
        assertTrue(results.stream().noneMatch(PublishResult::isRetryable));
        assertEquals("PUBLISH_API_REJECTED", results.get(0).getErrorCode());
    }

    @Test
    void publish_serverAndRateLimitErrorsStayRetryable() {
        when(client.post(request))
                .thenThrow(new PublishApiException(503, "Unavailable"))
                .thenThrow(new PublishApiException(429, "Too many requests"));

        assertEquals("PUBLISH_API_ERROR", publisher.publish(request).get(0).getErrorCode());
        assertTrue(publisher.publish(request).get(0).isRetryable());
    }

    @Test
    void publish_unexpectedErrorFailsEveryPlatform() {
        when(client.post(request)).thenThrow(new IllegalStateException("boom"));

        List<PublishResult> results = publisher.publish(request);

        assertEquals(List.of("INTERNAL_ERROR", "INTERNAL_ERROR"),
                results.stream().map(PublishResult::getErrorCode).collect(Collectors.toList()));
    }
}
