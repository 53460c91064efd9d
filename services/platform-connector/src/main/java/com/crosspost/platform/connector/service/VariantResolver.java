package com.crosspost.platform.connector.service;

import com.crosspost.platform.connector.dto.CreatePublishRequest;
import com.crosspost.platform.connector.dto.ResolvedMedia;
import com.crosspost.platform.connector.dto.ResolvedVariant;
import com.crosspost.platform.connector.dto.VariantOverride;
import com.crosspost.platform.connector.model.ContentLimits;
import com.crosspost.platform.connector.model.Platform;
import com.crosspost.platform.connector.model.Post;
import com.crosspost.platform.connector.model.PostVariant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the effective text, media and options of every target platform of a publish request.
 *
 * <p>Precedence, highest first:
 * <ul>
 *   <li>text: override content, request content, saved platform variant text, saved base text</li>
 *   <li>media: override media (taken as-is, never merged with base), saved platform variant media,
 *       then base media when the platform has nothing usable</li>
 *   <li>options: override bag, saved platform variant bag, request root bag, saved base bag,
 *       environment default</li>
 * </ul>
 * Platforms that only appear in {@code variants} are resolved as well.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariantResolver {

    private static final TypeReference<Map<String, Object>> OPTIONS_TYPE = new TypeReference<>() {};

    private final MediaResolver mediaResolver;
    private final PlatformOptionsMapper optionsMapper;
    private final ObjectMapper objectMapper;

    public List<ResolvedVariant> resolve(CreatePublishRequest request, Post post) {
        Map<String, VariantOverride> overrides = normalizeOverrides(request.getVariants());
        Map<String, Object> requestOptions = normalizedCopy(request.getOptions());
        Map<String, Object> savedBaseOptions = post != null ? savedOptions(post.getBase()) : Map.of();
        List<ResolvedMedia> baseMedia = resolveBaseMedia(request, post);

        List<ResolvedVariant> resolved = new ArrayList<>();
        for (Platform platform : targetPlatforms(request.getPlatforms(), overrides.keySet())) {
            String key = platform.getKey();
            VariantOverride override = overrides.get(key);
            Optional<PostVariant> saved = post != null ? post.findVariant(key) : Optional.empty();

            List<ResolvedMedia> uncapped = resolveMedia(override, saved, baseMedia);
            String text = resolveText(request, override, post, key);
            warnIfOverLimits(platform, uncapped.size(), text);
            List<ResolvedMedia> media = platform.toContentLimits().capMedia(uncapped);

            Map<String, Object> overrideOptions = override != null ? normalizedCopy(override.getOptions()) : Map.of();
            Map<String, Object> savedOptions = saved.map(this::savedOptions).orElse(Map.of());
            Map<String, Object> options = optionsMapper.resolveOptions(key,
                    Arrays.asList(overrideOptions, savedOptions, requestOptions, savedBaseOptions))
                    .orElse(null);

            resolved.add(ResolvedVariant.builder()
                    .platform(key)
                    .text(text)
                    .mediaUrls(MediaResolver.urlsOf(media))
                    .videoUrls(videoUrlsOf(media))
                    .optionsKey(optionsMapper.optionsKeyFor(key))
                    .options(options)
                    .build());
        }
        return resolved;
    }

    /**
     * Requested platforms first, then platforms only named in {@code variants}; unknown names are skipped.
     */
    Set<Platform> targetPlatforms(List<String> requested, Set<String> overrideKeys) {
        Set<Platform> targets = new LinkedHashSet<>();
        List<String> names = new ArrayList<>();
        if (requested != null) {
            names.addAll(requested);
        }
        names.addAll(overrideKeys);

        for (String name : names) {
            if (Platform.BASE_KEY.equalsIgnoreCase(name)) {
                continue;
            }
            Optional<Platform> platform = Platform.fromKey(name);
            if (platform.isEmpty()) {
                log.warn("Skipping unknown platform '{}'", name);
                continue;
            }
            targets.add(platform.get());
        }
        return targets;
    }

    private List<ResolvedMedia> resolveMedia(VariantOverride override, Optional<PostVariant> saved,
                                             List<ResolvedMedia> baseMedia) {
        if (override != null && override.hasMedia()) {
            return mediaResolver.resolveUrlMedia(override.getMedia(), Set.of());
        }

        List<ResolvedMedia> media = mediaResolver.resolveMedia(saved.orElse(null));
        return media.isEmpty() ? baseMedia : media;
    }

    private String resolveText(CreatePublishRequest request, VariantOverride override, Post post, String platformKey) {
        if (override != null && override.hasContent()) {
            return override.getContent();
        }
        if (request.getContent() != null && !request.getContent().isEmpty()) {
            return request.getContent();
        }
        if (post == null) {
            return "";
        }
        // variantFor already answers base for a platform without a saved variant
        String savedText = post.variantFor(platformKey).getText();
        if (savedText != null && !savedText.isEmpty()) {
            return savedText;
        }
        return post.getBase().getText() != null ? post.getBase().getText() : "";
    }

    private List<ResolvedMedia> resolveBaseMedia(CreatePublishRequest request, Post post) {
        List<String> requestMedia = request.getBaseMediaUrls();
        if (!requestMedia.isEmpty()) {
            return mediaResolver.resolveUrlMedia(requestMedia, request.getBaseVideoUrls());
        }
        return post != null ? mediaResolver.resolveMedia(post.getBase()) : List.of();
    }

    private static Set<String> videoUrlsOf(List<ResolvedMedia> media) {
        Set<String> videoUrls = new LinkedHashSet<>();
        for (ResolvedMedia item : media) {
            if (item.isVideo()) {
                videoUrls.add(item.getUrl());
            }
        }
        return videoUrls;
    }

    private Map<String, VariantOverride> normalizeOverrides(Map<String, VariantOverride> variants) {
        Map<String, VariantOverride> overrides = new LinkedHashMap<>();
        if (variants == null) {
            return overrides;
        }
        variants.forEach((name, override) -> {
            if (override == null) {
                return;
            }
            String key = Platform.fromKey(name).map(Platform::getKey).orElse(name);
            overrides.putIfAbsent(key, override);
        });
        return overrides;
    }

    private Map<String, Object> savedOptions(PostVariant variant) {
        if (variant == null || variant.getPlatformOptions() == null || variant.getPlatformOptions().isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> options = objectMapper.readValue(variant.getPlatformOptions(), OPTIONS_TYPE);
            return normalizedCopy(options);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable saved platform options: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private Map<String, Object> normalizedCopy(Map<String, Object> options) {
        if (options == null || options.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>(options);
        optionsMapper.normalizeAliases(copy);
        return copy;
    }

    /**
     * Media count is checked before capping; the caption limit is advisory and the text is sent as-is.
     */
    private static void warnIfOverLimits(Platform platform, int mediaCount, String text) {
        ContentLimits limits = platform.toContentLimits();
        String warning = limits.getWarningMessage(mediaCount, text);
        if (warning != null) {
            log.info("{}: {}", platform.getKey(), warning);
        }
    }
}
