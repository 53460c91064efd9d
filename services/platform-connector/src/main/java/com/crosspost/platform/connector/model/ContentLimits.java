package com.crosspost.platform.connector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentLimits {
    private Platform platform;

    /** 0 means the platform imposes no attachment cap. */
    private int maxMediaItems;

    private int maxCaptionLength;

    public boolean hasMediaCap() {
        return maxMediaItems > 0;
    }

    /**
     * Keep the first {@code maxMediaItems} items in their original order.
     */
    public <T> List<T> capMedia(List<T> media) {
        if (media == null) {
            return List.of();
        }
        if (!hasMediaCap() || media.size() <= maxMediaItems) {
            return List.copyOf(media);
        }
        return List.copyOf(media.subList(0, maxMediaItems));
    }

    /**
     * Check if caption length is valid
     */
    public boolean isValidCaptionLength(String caption) {
        return caption == null || maxCaptionLength <= 0 || caption.length() <= maxCaptionLength;
    }

    /**
     * Get warning message if content exceeds limits
     */
    public String getWarningMessage(int mediaCount, String caption) {
        StringBuilder warnings = new StringBuilder();

        if (hasMediaCap() && mediaCount > maxMediaItems) {
            warnings.append(String.format("Media count (%d) exceeds %s limit (%d). Extra items will be dropped. ",
                    mediaCount, platform.getDisplayName(), maxMediaItems));
        }

        if (!isValidCaptionLength(caption)) {
            warnings.append(String.format("Caption length (%d) exceeds %s limit (%d). ",
                    caption.length(), platform.getDisplayName(), maxCaptionLength));
        }

        return warnings.length() > 0 ? warnings.toString().trim() : null;
    }
}
