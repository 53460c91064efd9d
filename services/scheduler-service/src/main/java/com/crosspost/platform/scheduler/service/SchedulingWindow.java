package com.crosspost.platform.scheduler.service;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a committed schedule time is due. A post is due once its time has passed, and
 * stays due for the grace window after that.
 */
@Component
@Getter
public class SchedulingWindow {

    private final Duration graceWindow;

    public SchedulingWindow(@Value("${scheduler.grace-window:5m}") Duration graceWindow) {
        this.graceWindow = graceWindow;
    }

    public boolean isDue(Instant scheduledFor, Instant now) {
        if (scheduledFor == null) {
            return false;
        }
        return now.isAfter(scheduledFor) && now.isBefore(scheduledFor.plus(graceWindow));
    }

    /**
     * True once the grace window has closed without the post firing.
     */
    public boolean isMissed(Instant scheduledFor, Instant now) {
        return scheduledFor != null && !now.isBefore(scheduledFor.plus(graceWindow));
    }
}
