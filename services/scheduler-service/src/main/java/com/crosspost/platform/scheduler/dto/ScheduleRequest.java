package com.crosspost.platform.scheduler.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {
    @NotNull(message = "scheduledAt is required")
    private OffsetDateTime scheduledAt;
}
