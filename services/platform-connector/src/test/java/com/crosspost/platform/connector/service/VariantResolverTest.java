package com.crosspost.platform.connector.service;

import com.crosspost.platform.connector.dto.CreatePublishRequest;
import com.crosspost.platform.connector.dto.MediaAttachment;
import com.crosspost.platform.connector.dto.ResolvedVariant;
import com.crosspost.platform.connector.dto.VariantOverride;
import com.crosspost.platform.connector.model.MediaItem;
import com.crosspost.platform.connector.model.Post;
import com.crosspost.platform.connector.model.PostVariant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class VariantResolverTest {

    private VariantResolver resolver;
    private PlatformOptionDefaults defaults;

    @BeforeEach
    void setUp() {
        MediaResolver mediaResolver = new MediaResolver(fileId -> Optional.empty());
        ReflectionTestUtils.setField(mediaResolver, "mediaProxyBase", "https://api.test.com/api/convert-media-url");
        ReflectionTestUtils.setField(mediaResolver, "proxiedHosts", new String[]{"lunary.app"});
        defaults = new PlatformOptionDefaults();
        ReflectionTestUtils.setField(defaults, "xThread", true);
        resolver = new VariantResolver(mediaResolver, new PlatformOptionsMapper(defaults), new ObjectMapper());
    }

    private static Post savedPost() {
        Map<String, PostVariant> variants = new LinkedHashMap<>();
        variants.put("base", PostVariant.builder()
                .text("Base text from post")
                .media(List.of(MediaItem.urlImage("https://base.example/image.jpg")))
                .platformOptions("{\"redditOptions\":{\"title\":\"Saved base title\",\"subreddit\":\"saved\"}}")
                .build());
        variants.put("instagram", PostVariant.builder()
                .text("Saved IG text")
                .media(List.of(MediaItem.urlImage("https://legacy.example/old.jpg")))
                .build());
        return Post.builder().id("post-1").accountGroupId("group").variants(variants).build();
    }

    private static CreatePublishRequest baseRequest() {
        Map<String, VariantOverride> overrides = new LinkedHashMap<>();
        overrides.put("instagram", VariantOverride.builder()
                .content("IG override")
                .media(List.of("https://cdn.example/ig1.jpg", "https://cdn.example/ig2.jpg"))
                .build());
        VariantOverride reddit = new VariantOverride();
        reddit.putOption("redditOptions", Map.of("title", "Variant Title", "subreddit", "variants"));
        overrides.put("reddit", reddit);

        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .content("Base content")
                .platforms(List.of("reddit", "pinterest"))
                .media(List.of(MediaAttachment.builder().type("image").url("https://base.example/image.jpg").build()))
                .variants(overrides)
                .build();
        request.putOption("redditOptions", Map.of("title", "Base Title", "subreddit", "base"));
        request.putOption("pinterestOptions", Map.of("boardName", "BaseBoard"));
        return request;
    }

    private static ResolvedVariant forPlatform(List<ResolvedVariant> resolved, String platform) {
        return resolved.stream().filter(r -> r.getPlatform().equals(platform)).findFirst().orElseThrow();
    }

    @Test
    void resolve_includesVariantOnlyPlatformsAfterRequestedOnes() {
        List<ResolvedVariant> resolved = resolver.resolve(baseRequest(), savedPost());

        assertEquals(List.of("reddit", "pinterest", "instagram"),
                resolved.stream().map(ResolvedVariant::getPlatform).collect(Collectors.toList()));
    }

    @Test
    void resolve_overrideMediaAndTextAreUsedExclusively() {
        ResolvedVariant instagram = forPlatform(resolver.resolve(baseRequest(), savedPost()), "instagram");

        assertEquals(List.of("https://cdn.example/ig1.jpg", "https://cdn.example/ig2.jpg"), instagram.getMediaUrls());
        assertEquals("IG override", instagram.getText());
    }

    @Test
    void resolve_variantOptionsBeatRequestRoot() {
        ResolvedVariant reddit = forPlatform(resolver.resolve(baseRequest(), savedPost()), "reddit");

        assertEquals("redditOptions", reddit.getOptionsKey());
        assertEquals(Map.of("title", "Variant Title", "subreddit", "variants"), reddit.getOptions());
    }

    @Test
    void resolve_requestRootBeatsSavedBaseOptions() {
        CreatePublishRequest request = baseRequest();
        request.getVariants().remove("reddit");

        ResolvedVariant reddit = forPlatform(resolver.resolve(request, savedPost()), "reddit");

        assertEquals(Map.of("title", "Base Title", "subreddit", "base"), reddit.getOptions());
    }

    @Test
    void resolve_savedBaseOptionsUsedWhenRequestHasNone() {
        CreatePublishRequest request = baseRequest();
        request.getVariants().remove("reddit");
        request.getOptions().remove("redditOptions");

        ResolvedVariant reddit = forPlatform(resolver.resolve(request, savedPost()), "reddit");

        assertEquals(Map.of("title", "Saved base title", "subreddit", "saved"), reddit.getOptions());
    }

    @Test
    void resolve_pinterestFallsBackToEnvironmentBoard() {
        ReflectionTestUtils.setField(defaults, "pinterestBoardId", "lunaryapp/lunary");
        ReflectionTestUtils.setField(defaults, "pinterestBoardName", "Lunary");
        CreatePublishRequest request = baseRequest();
        request.getOptions().remove("pinterestOptions");

        ResolvedVariant pinterest = forPlatform(resolver.resolve(request, savedPost()), "pinterest");

        assertEquals(Map.of("boardName", "lunaryapp/lunary"), pinterest.getOptions());
    }

    @Test
    void resolve_bareAliasesAreNormalizedAtRootAndInVariants() {
        CreatePublishRequest request = baseRequest();
        request.getVariants().remove("reddit");
        request.getOptions().remove("redditOptions");
        request.putOption("reddit", Map.of("title", "root alias"));
        VariantOverride instagram = request.getVariants().get("instagram");
        instagram.putOption("instagram", Map.of("shareReelsFeed", true));

        List<ResolvedVariant> resolved = resolver.resolve(request, savedPost());

        assertEquals(Map.of("title", "root alias"), forPlatform(resolved, "reddit").getOptions());
        assertEquals(Map.of("shareReelsFeed", true), forPlatform(resolved, "instagram").getOptions());
    }

    @Test
    void resolve_capsXMediaToFirstFour() {
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .platforms(List.of("x"))
                .variants(Map.of("x", VariantOverride.builder()
                        .media(List.of("https://m.example/a", "https://m.example/b", "https://m.example/c",
                                "https://m.example/d", "https://m.example/e"))
                        .build()))
                .build();

        ResolvedVariant x = forPlatform(resolver.resolve(request, savedPost()), "x");

        assertEquals(List.of("https://m.example/a", "https://m.example/b", "https://m.example/c",
                "https://m.example/d"), x.getMediaUrls());
        assertEquals("twitterOptions", x.getOptionsKey());
    }

    @Test
    void resolve_capsBlueskyButLeavesFourUntouched() {
        List<String> four = List.of("https://m.example/1", "https://m.example/2", "https://m.example/3",
                "https://m.example/4");
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .platforms(List.of("bluesky"))
                .variants(Map.of("bluesky", VariantOverride.builder().media(four).build()))
                .build();

        assertEquals(four, forPlatform(resolver.resolve(request, savedPost()), "bluesky").getMediaUrls());
    }

    @Test
    void resolve_concreteScenarioKeepsFirstFourOverrideItems() {
        Post post = Post.builder()
                .id("p")
                .variants(Map.of("base", PostVariant.builder()
                        .media(List.of(MediaItem.urlImage("https://m.example/img1")))
                        .build()))
                .build();
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .platforms(List.of("x"))
                .variants(Map.of("x", VariantOverride.builder()
                        .media(List.of("https://m.example/a", "https://m.example/b", "https://m.example/c",
                                "https://m.example/d", "https://m.example/e"))
                        .build()))
                .build();

        List<String> media = forPlatform(resolver.resolve(request, post), "x").getMediaUrls();

        assertEquals(List.of("https://m.example/a", "https://m.example/b", "https://m.example/c",
                "https://m.example/d"), media);
    }

    @Test
    void resolve_fallsBackToBaseMediaWhenSavedVariantHasNone() {
        Map<String, PostVariant> variants = new LinkedHashMap<>();
        variants.put("base", PostVariant.builder()
                .text("base")
                .media(List.of(MediaItem.urlImage("https://base.example/1.jpg")))
                .build());
        variants.put("reddit", PostVariant.builder()
                .text("reddit text")
                .media(List.of(MediaItem.urlImage("blob:https://local/unsaved")))
                .build());
        Post post = Post.builder().id("p").variants(variants).build();
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .platforms(List.of("reddit"))
                .build();

        ResolvedVariant reddit = forPlatform(resolver.resolve(request, post), "reddit");

        assertEquals(List.of("https://base.example/1.jpg"), reddit.getMediaUrls());
        assertEquals("reddit text", reddit.getText());
    }

    @Test
    void resolve_platformWithoutAnyVariantUsesPureBase() {
        Post post = Post.builder()
                .id("p")
                .variants(Map.of("base", PostVariant.builder()
                        .text("only base")
                        .media(List.of(MediaItem.urlImage("https://base.example/1.jpg")))
                        .build()))
                .build();
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .platforms(List.of("threads"))
                .build();

        ResolvedVariant threads = forPlatform(resolver.resolve(request, post), "threads");

        assertEquals("only base", threads.getText());
        assertEquals(List.of("https://base.example/1.jpg"), threads.getMediaUrls());
        assertNull(threads.getOptions());
    }

    @Test
    void resolve_skipsUnknownPlatformsAndBase() {
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .platforms(List.of("myspace", "base", "twitter"))
                .build();

        List<ResolvedVariant> resolved = resolver.resolve(request, savedPost());

        assertEquals(List.of("x"), resolved.stream().map(ResolvedVariant::getPlatform).collect(Collectors.toList()));
    }

    @Test
    void resolve_carriesVideoTypeOfSavedAndRequestMedia() {
        MediaResolver backedResolver = new MediaResolver(fileId -> Optional.of("http://backend:3331/image/" + fileId));
        ReflectionTestUtils.setField(backedResolver, "mediaProxyBase", "https://api.test.com/api/convert-media-url");
        ReflectionTestUtils.setField(backedResolver, "proxiedHosts", new String[]{"lunary.app"});
        VariantResolver videoResolver = new VariantResolver(backedResolver, new PlatformOptionsMapper(defaults),
                new ObjectMapper());
        Map<String, PostVariant> variants = new LinkedHashMap<>();
        variants.put("base", PostVariant.builder().text("Base").build());
        variants.put("instagram", PostVariant.builder()
                .media(List.of(MediaItem.video("vid-1"), MediaItem.image("img-1")))
                .build());
        Post post = Post.builder().id("p").accountGroupId("group").variants(variants).build();
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .platforms(List.of("instagram", "reddit"))
                .media(List.of(MediaAttachment.builder().type("video").url("https://cdn.example/stream/7").build()))
                .build();

        List<ResolvedVariant> resolved = videoResolver.resolve(request, post);

        ResolvedVariant instagram = forPlatform(resolved, "instagram");
        assertEquals(List.of("http://backend:3331/image/vid-1", "http://backend:3331/image/img-1"),
                instagram.getMediaUrls());
        assertEquals(Set.of("http://backend:3331/image/vid-1"), instagram.getVideoUrls());
        assertEquals(Set.of("https://cdn.example/stream/7"), forPlatform(resolved, "reddit").getVideoUrls());
    }

    @Test
    void resolve_emptySavedTextFallsBackToBaseText() {
        Map<String, PostVariant> variants = new LinkedHashMap<>();
        variants.put("base", PostVariant.builder().text("Base caption").build());
        variants.put("x", PostVariant.builder().text("").build());
        Post post = Post.builder().id("p").accountGroupId("group").variants(variants).build();
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .platforms(List.of("x", "bluesky"))
                .build();

        List<ResolvedVariant> resolved = resolver.resolve(request, post);

        assertEquals("Base caption", forPlatform(resolved, "x").getText());
        assertEquals("Base caption", forPlatform(resolved, "bluesky").getText());
    }

    @Test
    void resolve_captionOverPlatformLimitIsSentUnchanged() {
        String longText = "a".repeat(400);
        CreatePublishRequest request = CreatePublishRequest.builder()
                .accountGroupId("group")
                .content(longText)
                .platforms(List.of("bluesky"))
                .build();

        assertEquals(longText, forPlatform(resolver.resolve(request, null), "bluesky").getText());
    }
}
