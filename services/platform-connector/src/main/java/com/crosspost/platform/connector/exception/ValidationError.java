package com.crosspost.platform.connector.exception;

public enum ValidationError {
    MISSING_ACCOUNT_GROUP("Account group ID is required"),
    NO_PLATFORMS("At least one platform is required"),
    NO_CONTENT("Post has neither text nor media"),
    NO_MEDIA("No images to post");

    private final String defaultMessage;

    ValidationError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

}
