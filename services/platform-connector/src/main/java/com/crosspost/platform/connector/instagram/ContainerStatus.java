package com.crosspost.platform.connector.instagram;

public enum ContainerStatus {
    READY,
    PENDING,
    ERROR;

    /**
     * Map a Graph API {@code status_code} (IN_PROGRESS, FINISHED, ERROR, EXPIRED, PUBLISHED).
     */
    public static ContainerStatus fromStatusCode(String statusCode) {
        if (statusCode == null) {
            return PENDING;
        }
        return switch (statusCode) {
            case "FINISHED", "PUBLISHED" -> READY;
            case "ERROR", "EXPIRED" -> ERROR;
            default -> PENDING;
        };
    }
}
