package com.crosspost.platform.connector.service;

import com.crosspost.platform.connector.dto.CreatePublishRequest;
import com.crosspost.platform.connector.dto.PostData;
import com.crosspost.platform.connector.dto.PublishRequest;
import com.crosspost.platform.connector.dto.ResolvedVariant;
import com.crosspost.platform.connector.exception.PublishValidationException;
import com.crosspost.platform.connector.exception.ValidationError;
import com.crosspost.platform.connector.model.Post;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shapes resolved variants into publishing API calls. Pure: no network, no state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublishRequestBuilder {

    private final VariantResolver variantResolver;

    public List<PublishRequest> build(CreatePublishRequest request, Post post, String profileKey) {
        if (request.getAccountGroupId() == null || request.getAccountGroupId().isBlank()) {
            throw new PublishValidationException(ValidationError.MISSING_ACCOUNT_GROUP);
        }

        List<ResolvedVariant> resolved = variantResolver.resolve(request, post);
        if (resolved.isEmpty()) {
            throw new PublishValidationException(ValidationError.NO_PLATFORMS);
        }

        for (ResolvedVariant variant : resolved) {
            if ((variant.getText() == null || variant.getText().isBlank()) && variant.getMediaUrls().isEmpty()) {
                throw new PublishValidationException(ValidationError.NO_CONTENT,
                        "Nothing to publish for " + variant.getPlatform() + ": no text and no media");
            }
        }

        String effectiveProfileKey = profileKey != null && !profileKey.isBlank()
                ? profileKey
                : request.getProfileKey();
        String scheduleDate = request.getScheduledDate() != null
                ? DateTimeFormatter.ISO_INSTANT.format(request.getScheduledDate().toInstant())
                : null;

        List<PublishRequest> requests = new ArrayList<>();
        for (List<ResolvedVariant> group : groupByContent(resolved)) {
            requests.add(toPublishRequest(group, scheduleDate, effectiveProfileKey));
        }

        log.info("Prepared {} publish request(s) for {} platform(s) in account group {}",
                requests.size(), resolved.size(), request.getAccountGroupId());
        return requests;
    }

    /**
     * Immediate single-platform request for a saved post, as used by the scheduler when a post is due.
     */
    public PublishRequest buildForPlatform(Post post, String platform) {
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId(post.getAccountGroupId())
                .title(post.getTitle())
                .platforms(List.of(platform))
                .build();
        List<PublishRequest> requests = build(request, post, post.getProfileKey());
        return requests.get(0);
    }

    /**
     * Platforms with identical text and media share one request, in order of first appearance.
     */
    private List<List<ResolvedVariant>> groupByContent(List<ResolvedVariant> resolved) {
        Map<ContentKey, List<ResolvedVariant>> groups = new LinkedHashMap<>();
        for (ResolvedVariant variant : resolved) {
            ContentKey key = new ContentKey(variant.getText(), variant.getMediaUrls(), variant.getVideoUrls());
            groups.computeIfAbsent(key, ignored -> new ArrayList<>()).add(variant);
        }
        return new ArrayList<>(groups.values());
    }

    private PublishRequest toPublishRequest(List<ResolvedVariant> group, String scheduleDate, String profileKey) {
        ResolvedVariant first = group.get(0);
        List<String> platforms = new ArrayList<>();
        Map<String, Map<String, Object>> options = new LinkedHashMap<>();
        for (ResolvedVariant variant : group) {
            platforms.add(variant.getPlatform());
            if (variant.getOptions() != null) {
                options.put(variant.getOptionsKey(), variant.getOptions());
            }
        }

        return PublishRequest.builder()
                .platforms(List.copyOf(platforms))
                .profileKey(profileKey)
                .postData(PostData.builder()
                        .post(first.getText())
                        .mediaUrls(List.copyOf(first.getMediaUrls()))
                        .videoUrls(Set.copyOf(first.getVideoUrls()))
                        .scheduleDate(scheduleDate)
                        .options(Collections.unmodifiableMap(options))
                        .build())
                .build();
    }

    @Value
    private static class ContentKey {
        String text;
        List<String> mediaUrls;
        Set<String> videoUrls;
    }
}
