package com.crosspost.platform.connector.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AyrsharePostResponse {
    private String status; // success, scheduled, error
    private String id;
    private List<PlatformPostId> postIds;
    private List<PlatformError> errors;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlatformPostId {
        private String platform;
        private String id;
        private String postUrl;
        private String status;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlatformError {
        private String platform;
        private String code;
        private String message;
    }
}
