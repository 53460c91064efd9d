package com.crosspost.platform.scheduler.dto;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostScheduleResponse {
    private String postId;
    private String title;
    private boolean schedulerActive;
    private boolean publishInFlight;
    private List<PlatformStatusResponse> platforms;
}
