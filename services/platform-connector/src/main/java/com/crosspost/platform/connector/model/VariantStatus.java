package com.crosspost.platform.connector.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VariantStatus {
    DRAFT("draft"),
    SCHEDULE_DESIRED("scheduleDesired"),
    SCHEDULED("scheduled"),
    PUBLISHED("published"),
    FAILED("failed");

    private final String wireName;

    VariantStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
