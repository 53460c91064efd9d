package com.crosspost.platform.scheduler.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulingWindowTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:30:00Z");

    private final SchedulingWindow window = new SchedulingWindow(Duration.ofMinutes(5));

    @Test
    void isDue_onlyInsideGraceWindow() {
        assertFalse(window.isDue(NOW.minus(Duration.ofMinutes(10)), NOW));
        assertTrue(window.isDue(NOW.minus(Duration.ofMinutes(2)), NOW));
        assertFalse(window.isDue(NOW.plus(Duration.ofMinutes(1)), NOW));
    }

    @Test
    void isDue_exactScheduledTimeIsNotYetDue() {
        assertFalse(window.isDue(NOW, NOW));
    }

    @Test
    void isMissed_onceGraceWindowCloses() {
        assertTrue(window.isMissed(NOW.minus(Duration.ofMinutes(5)), NOW));
        assertTrue(window.isMissed(NOW.minus(Duration.ofMinutes(10)), NOW));
        assertFalse(window.isMissed(NOW.minus(Duration.ofMinutes(2)), NOW));
    }

    @Test
    void nullScheduleIsNeitherDueNorMissed() {
        assertFalse(window.isDue(null, NOW));
        assertFalse(window.isMissed(null, NOW));
    }
}
