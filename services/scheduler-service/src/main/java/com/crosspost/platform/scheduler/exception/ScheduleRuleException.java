package com.crosspost.platform.scheduler.exception;

/**
 * A scheduling request breaks a rule of the schedule lifecycle, e.g. a time inside the lead time
 * or a change to an already published variant.
 */
public class ScheduleRuleException extends RuntimeException {

    public ScheduleRuleException(String message) {
        super(message);
    }
}
