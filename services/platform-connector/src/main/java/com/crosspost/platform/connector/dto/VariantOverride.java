package com.crosspost.platform.connector.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-platform override sent with a publish request. Overridden media replaces the base media
 * entirely. Any other property is an option bag ({@code redditOptions}, or a bare alias such
 * as {@code reddit}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantOverride {
    private String content;
    private List<String> media;

    @Builder.Default
    private Map<String, Object> options = new LinkedHashMap<>();

    @JsonAnySetter
    public void putOption(String key, Object value) {
        if (options == null) {
            options = new LinkedHashMap<>();
        }
        options.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getOptions() {
        return options;
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    public boolean hasMedia() {
        return media != null && !media.isEmpty();
    }
}
