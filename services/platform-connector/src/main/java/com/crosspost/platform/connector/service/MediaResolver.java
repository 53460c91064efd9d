package com.crosspost.platform.connector.service;

import com.crosspost.platform.connector.dto.ResolvedMedia;
import com.crosspost.platform.connector.model.MediaItem;
import com.crosspost.platform.connector.model.PostVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts the ordered, fetchable media URLs of a variant, keeping track of which ones are videos.
 * Unusable items are dropped; callers decide what to fall back to when nothing is left.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MediaResolver {

    private static final List<String> VIDEO_EXTENSIONS = List.of(".mp4", ".mov", ".m4v");

    private final BinaryUrlResolver binaryUrlResolver;

    @Value("${media.proxy.base-url:https://app.crosspost.social/api/convert-media-url}")
    private String mediaProxyBase;

    // On-demand image generation hosts that social APIs fail to fetch from directly
    @Value("${media.proxy.hosts:lunary.app}")
    private String[] proxiedHosts;

    public List<String> resolve(PostVariant variant) {
        return urlsOf(resolveMedia(variant));
    }

    /**
     * Typed items keep their declared kind; legacy items without a type are judged by extension.
     */
    public List<ResolvedMedia> resolveMedia(PostVariant variant) {
        if (variant == null || variant.getMedia() == null) {
            return List.of();
        }

        List<ResolvedMedia> media = new ArrayList<>();
        for (MediaItem item : variant.getMedia()) {
            if (item == null) {
                continue;
            }
            resolveItem(item)
                    .map(url -> new ResolvedMedia(proxyIfNeeded(url), item.getType() != null ? item.isVideo() : isVideoUrl(url)))
                    .ifPresent(media::add);
        }
        return media;
    }

    /**
     * Filter raw override URLs down to fetchable ones, routing special hosts through the proxy.
     */
    public List<String> resolveUrls(List<String> urls) {
        return urlsOf(resolveUrlMedia(urls, Set.of()));
    }

    /**
     * Same as {@link #resolveUrls(List)}; a URL is a video when listed in {@code videoUrls} or when its
     * extension says so.
     */
    public List<ResolvedMedia> resolveUrlMedia(List<String> urls, Set<String> videoUrls) {
        if (urls == null) {
            return List.of();
        }
        List<ResolvedMedia> media = new ArrayList<>();
        for (String url : urls) {
            if (isFetchable(url)) {
                media.add(new ResolvedMedia(proxyIfNeeded(url), videoUrls.contains(url) || isVideoUrl(url)));
            } else {
                log.debug("Dropping unfetchable media URL: {}", url);
            }
        }
        return media;
    }

    public String proxyIfNeeded(String url) {
        if (!isFetchable(url) || !isProxiedHost(url)) {
            return url;
        }
        String separator = mediaProxyBase.contains("?") ? "&" : "?";
        return mediaProxyBase + separator + "url=" + UriUtils.encode(url, StandardCharsets.UTF_8);
    }

    private Optional<String> resolveItem(MediaItem item) {
        if (item.getType() == null) {
            if (item.isLegacyUrl() && isFetchable(item.getUrl())) {
                return Optional.of(item.getUrl());
            }
            return Optional.empty();
        }

        if (item.getType().isDirectUrl()) {
            return isFetchable(item.getUrl()) ? Optional.of(item.getUrl()) : Optional.empty();
        }

        Optional<String> served = serveBinary(item.getFileId());
        if (served.isPresent()) {
            return served;
        }
        if (isFetchable(item.getSourceUrl())) {
            log.info("Media file {} not servable, using source URL", item.getFileId());
            return Optional.of(item.getSourceUrl());
        }
        log.warn("Dropping media file {}: no servable URL and no source URL", item.getFileId());
        return Optional.empty();
    }

    private Optional<String> serveBinary(String fileId) {
        if (fileId == null) {
            return Optional.empty();
        }
        try {
            return binaryUrlResolver.resolve(fileId).filter(MediaResolver::isFetchable);
        } catch (RuntimeException e) {
            log.warn("Failed to resolve media file {}: {}", fileId, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isProxiedHost(String url) {
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable media URL {}: {}", url, e.getMessage());
            return false;
        }
        if (host == null) {
            return false;
        }
        String normalizedHost = host.toLowerCase(Locale.ROOT);
        for (String proxiedHost : proxiedHosts) {
            String candidate = proxiedHost.trim().toLowerCase(Locale.ROOT);
            if (!candidate.isEmpty()
                    && (normalizedHost.equals(candidate) || normalizedHost.endsWith("." + candidate))) {
                return true;
            }
        }
        return false;
    }

    static boolean isFetchable(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        return !lower.startsWith("blob:") && (lower.startsWith("http://") || lower.startsWith("https://"));
    }

    public static boolean isVideoUrl(String url) {
        String path = url.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        for (String extension : VIDEO_EXTENSIONS) {
            if (path.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public static List<String> urlsOf(List<ResolvedMedia> media) {
        return media.stream().map(ResolvedMedia::getUrl).collect(Collectors.toList());
    }
}
