package com.crosspost.platform.connector.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

@Getter
public enum Platform {
    INSTAGRAM(
        "instagram",
        "Instagram",
        "instagramOptions",
        10,         // carousel children
        2200        // caption length
    ),
    FACEBOOK("facebook", "Facebook", "facebookOptions", 0, 63206),
    X(
        "x",
        "X",
        "twitterOptions",
        4,          // attachments per post
        280
    ),
    LINKEDIN("linkedin", "LinkedIn", "linkedinOptions", 0, 3000),
    YOUTUBE("youtube", "YouTube", "youtubeOptions", 0, 5000),
    TIKTOK("tiktok", "TikTok", "tiktokOptions", 0, 2200),
    PINTEREST("pinterest", "Pinterest", "pinterestOptions", 0, 500),
    REDDIT("reddit", "Reddit", "redditOptions", 0, 40000),
    TELEGRAM("telegram", "Telegram", "telegramOptions", 0, 4096),
    THREADS("threads", "Threads", "threadsOptions", 0, 500),
    BLUESKY(
        "bluesky",
        "Bluesky",
        "blueskyOptions",
        4,          // images per post
        300
    ),
    LIMESKY("limesky", "Limesky", "limeskyOptions", 0, 0),
    GOOGLE("google", "Google Business", "googleOptions", 0, 1500);

    /**
     * Key under which the base variant of a post is stored. Not a platform.
     */
    public static final String BASE_KEY = "base";

    private final String key;
    private final String displayName;
    private final String optionsKey;
    private final int maxMediaItems;
    private final int maxCaptionLength;

    Platform(String key, String displayName, String optionsKey, int maxMediaItems, int maxCaptionLength) {
        this.key = key;
        this.displayName = displayName;
        this.optionsKey = optionsKey;
        this.maxMediaItems = maxMediaItems;
        this.maxCaptionLength = maxCaptionLength;
    }

    /**
     * Look up a platform by its wire key. {@code twitter} is accepted for {@link #X}.
     */
    public static Optional<Platform> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        if ("twitter".equals(normalized)) {
            return Optional.of(X);
        }
        return Arrays.stream(values())
                .filter(platform -> platform.key.equals(normalized))
                .findFirst();
    }

    public ContentLimits toContentLimits() {
        return ContentLimits.builder()
                .platform(this)
                .maxMediaItems(maxMediaItems)
                .maxCaptionLength(maxCaptionLength)
                .build();
    }
}
