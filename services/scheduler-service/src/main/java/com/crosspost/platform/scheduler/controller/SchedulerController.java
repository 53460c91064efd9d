package com.crosspost.platform.scheduler.controller;

import com.crosspost.platform.connector.dto.CreatePublishRequest;
import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.model.Post;
import com.crosspost.platform.connector.service.PublishRequestBuilder;
import com.crosspost.platform.scheduler.dto.EditContentRequest;
import com.crosspost.platform.scheduler.dto.PostScheduleResponse;
import com.crosspost.platform.scheduler.dto.ScheduleRequest;
import com.crosspost.platform.scheduler.exception.PostNotFoundException;
import com.crosspost.platform.scheduler.service.ScheduleRequestService;
import com.crosspost.platform.scheduler.store.PostDocumentStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final ScheduleRequestService scheduleRequestService;
    private final PublishRequestBuilder publishRequestBuilder;
    private final PostDocumentStore store;

    @PostMapping("/posts/{postId}/platforms/{platform}/schedule")
    public ResponseEntity<PostScheduleResponse> requestSchedule(
            @PathVariable String postId,
            @PathVariable String platform,
            @Valid @RequestBody ScheduleRequest request
    ) {
        return ResponseEntity.ok(scheduleRequestService.requestSchedule(
                postId, platform, request.getScheduledAt().toInstant()));
    }

    @DeleteMapping("/posts/{postId}/platforms/{platform}/schedule")
    public ResponseEntity<PostScheduleResponse> cancelSchedule(
            @PathVariable String postId,
            @PathVariable String platform
    ) {
        return ResponseEntity.ok(scheduleRequestService.cancelSchedule(postId, platform));
    }

    @PutMapping("/posts/{postId}/platforms/{platform}/content")
    public ResponseEntity<PostScheduleResponse> editContent(
            @PathVariable String postId,
            @PathVariable String platform,
            @RequestBody EditContentRequest request
    ) {
        return ResponseEntity.ok(scheduleRequestService.editContent(postId, platform, request));
    }

    @GetMapping("/posts/{postId}/status")
    public ResponseEntity<PostScheduleResponse> getStatus(@PathVariable String postId) {
        return ResponseEntity.ok(scheduleRequestService.getScheduleStatus(postId));
    }

    @PostMapping("/posts/{postId}/publish-requests/preview")
    public ResponseEntity<List<PublishRequest>> previewPublishRequests(
            @PathVariable String postId,
            @RequestHeader(value = "X-Profile-Key", required = false) String profileKey,
            @RequestBody CreatePublishRequest request
    ) {
        Post post = store.find(postId).orElseThrow(() -> new PostNotFoundException(postId));
        return ResponseEntity.ok(publishRequestBuilder.build(request, post, profileKey));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Scheduler Service is healthy");
    }
}
