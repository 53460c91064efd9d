package com.crosspost.platform.connector.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * A logical post: a mandatory {@code base} variant plus per-platform variants keyed by platform key.
 */
@Value
public class Post {
    String id;
    String accountGroupId;
    String profileKey;
    String title;
    Map<String, PostVariant> variants;

    @Builder(toBuilder = true)
    private Post(String id, String accountGroupId, String profileKey, String title,
                 Map<String, PostVariant> variants) {
        if (variants == null || variants.get(Platform.BASE_KEY) == null) {
            throw new IllegalArgumentException("Post " + id + " has no base variant");
        }
        this.id = id;
        this.accountGroupId = accountGroupId;
        this.profileKey = profileKey;
        this.title = title;
        this.variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
    }

    public PostVariant getBase() {
        return variants.get(Platform.BASE_KEY);
    }

    /**
     * The explicitly saved variant for a platform, without falling back to base.
     */
    public Optional<PostVariant> findVariant(String platformKey) {
        return Optional.ofNullable(variants.get(platformKey));
    }

    /**
     * The variant for a platform, or base when the platform has none of its own.
     */
    public PostVariant variantFor(String platformKey) {
        return variants.getOrDefault(platformKey, getBase());
    }

    /**
     * Platform variants in insertion order, base excluded.
     */
    public Map<String, PostVariant> getPlatformVariants() {
        Map<String, PostVariant> platformVariants = new LinkedHashMap<>(variants);
        platformVariants.remove(Platform.BASE_KEY);
        return platformVariants;
    }

    public Post withVariant(String key, PostVariant variant) {
        Map<String, PostVariant> updated = new LinkedHashMap<>(variants);
        updated.put(key, variant);
        return toBuilder().variants(updated).build();
    }

    /**
     * Apply {@code mutation} to the variant stored under {@code key}. Missing variants are left alone.
     */
    public Post updateVariant(String key, UnaryOperator<PostVariant> mutation) {
        PostVariant current = variants.get(key);
        if (current == null) {
            return this;
        }
        return withVariant(key, mutation.apply(current));
    }
}
