package com.crosspost.platform.connector.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CreatePublishRequest {
    private String accountGroupId;
    private String content;
    private List<String> platforms;
    private String title;
    private OffsetDateTime scheduledDate;

    // Media attachments
    private List<MediaAttachment> media;

    // Legacy support: imageUrls (for backward compatibility)
    private List<String> imageUrls;

    // Platform-specific variants
    private Map<String, VariantOverride> variants;

    // Business plan profile
    private String profileKey;

    // Root-level option bags: redditOptions, pinterestOptions, or bare aliases like reddit
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

    /**
     * Request-level media URLs: {@code media[].url} followed by legacy {@code imageUrls}.
     */
    @JsonIgnore
    public List<String> getBaseMediaUrls() {
        List<String> urls = new ArrayList<>();
        if (media != null) {
            media.stream()
                    .map(MediaAttachment::getUrl)
                    .filter(url -> url != null && !url.isBlank())
                    .forEach(urls::add);
        }
        if (imageUrls != null) {
            imageUrls.stream()
                    .filter(url -> url != null && !url.isBlank() && !urls.contains(url))
                    .forEach(urls::add);
        }
        return urls;
    }

    /**
     * URLs of request-level attachments declared as {@code video}.
     */
    @JsonIgnore
    public Set<String> getBaseVideoUrls() {
        Set<String> urls = new LinkedHashSet<>();
        if (media != null) {
            media.stream()
                    .filter(attachment -> "video".equalsIgnoreCase(attachment.getType()) && attachment.getUrl() != null)
                    .forEach(attachment -> urls.add(attachment.getUrl()));
        }
        return urls;
    }
}
