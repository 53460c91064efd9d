package com.crosspost.platform.connector.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One call to the publishing API. Built fresh for every attempt and never mutated.
 */
@Value
@Builder(toBuilder = true)
public class PublishRequest {
    List<String> platforms;
    PostData postData;

    /** Selects the connected account set; sent as a header, not in the body. */
    @JsonIgnore
    String profileKey;
}
