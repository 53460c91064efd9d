package com.crosspost.platform.connector.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PostData {
    String post;

    @Builder.Default
    List<String> mediaUrls = List.of();

    /** The entries of {@code mediaUrls} that are videos. Not part of the API body. */
    @JsonIgnore
    @Builder.Default
    Set<String> videoUrls = Set.of();

    /** ISO-8601 instant, absent for immediate publishing. */
    String scheduleDate;

    /** Canonical option bags keyed by {@code <platform>Options}. */
    @Builder.Default
    Map<String, Map<String, Object>> options = Map.of();

    @JsonAnyGetter
    public Map<String, Map<String, Object>> getOptions() {
        return options;
    }

    public boolean isVideo(String mediaUrl) {
        return videoUrls.contains(mediaUrl);
    }
}
