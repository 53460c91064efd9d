package com.crosspost.platform.connector.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatformOptionsMapperTest {

    private PlatformOptionDefaults defaults;
    private PlatformOptionsMapper mapper;

    @BeforeEach
    void setUp() {
        defaults = new PlatformOptionDefaults();
        ReflectionTestUtils.setField(defaults, "pinterestBoardId", "");
        ReflectionTestUtils.setField(defaults, "pinterestBoardName", "");
        ReflectionTestUtils.setField(defaults, "xThread", true);
        mapper = new PlatformOptionsMapper(defaults);
    }

    @Test
    void optionsKeyFor_usesAliasTableAndFallsBackToPlatformName() {
        assertEquals("twitterOptions", mapper.optionsKeyFor("x"));
        assertEquals("twitterOptions", mapper.optionsKeyFor("twitter"));
        assertEquals("redditOptions", mapper.optionsKeyFor("reddit"));
        assertEquals("myspaceOptions", mapper.optionsKeyFor("myspace"));
    }

    @Test
    void normalizeAliases_movesBareKeyToCanonicalKey() {
        Map<String, Object> bag = new LinkedHashMap<>();
        bag.put("reddit", Map.of("title", "alias", "subreddit", "foo"));
        bag.put("x", Map.of("thread", false));

        mapper.normalizeAliases(bag);

        assertEquals(Map.of("title", "alias", "subreddit", "foo"), bag.get("redditOptions"));
        assertEquals(Map.of("thread", false), bag.get("twitterOptions"));
        assertFalse(bag.containsKey("reddit"));
        assertFalse(bag.containsKey("x"));
    }

    @Test
    void normalizeAliases_keepsExplicitCanonicalBagOverAlias() {
        Map<String, Object> bag = new LinkedHashMap<>();
        bag.put("redditOptions", Map.of("title", "canonical"));
        bag.put("reddit", Map.of("title", "alias"));

        mapper.normalizeAliases(bag);

        assertEquals(Map.of("redditOptions", Map.of("title", "canonical")), bag);
    }

    @Test
    void normalizeAliases_dropsNonObjectAlias() {
        Map<String, Object> bag = new LinkedHashMap<>();
        bag.put("reddit", "not-an-object");
        bag.put("unrelated", "kept");

        mapper.normalizeAliases(bag);

        assertEquals(Map.of("unrelated", "kept"), bag);
    }

    @Test
    void resolveOptions_variantBagWinsWholeOverRequestBag() {
        Map<String, Object> variant = Map.of("redditOptions", Map.of("title", "Variant Title"));
        Map<String, Object> request = Map.of("redditOptions", Map.of("title", "Base Title", "subreddit", "base"));

        assertEquals(Map.of("title", "Variant Title"),
                mapper.resolveOptions("reddit", variant, request).orElseThrow());
    }

    @Test
    void resolveOptions_skipsNullLayers() {
        List<Map<String, Object>> layers = Arrays.asList(null, Map.of("redditOptions", Map.of("title", "t")));

        assertEquals(Map.of("title", "t"), mapper.resolveOptions("reddit", layers).orElseThrow());
    }

    @Test
    void resolveOptions_fallsBackToPinterestBoardIdFromEnvironment() {
        ReflectionTestUtils.setField(defaults, "pinterestBoardId", "lunaryapp/lunary");
        ReflectionTestUtils.setField(defaults, "pinterestBoardName", "Lunary");

        assertEquals(Map.of("boardName", "lunaryapp/lunary"),
                mapper.resolveOptions("pinterest", Map.of(), Map.of()).orElseThrow());
    }

    @Test
    void resolveOptions_usesBoardNameWhenNoBoardId() {
        ReflectionTestUtils.setField(defaults, "pinterestBoardName", "Lunary");

        assertEquals(Map.of("boardName", "Lunary"),
                mapper.resolveOptions("pinterest", Map.of(), Map.of()).orElseThrow());
    }

    @Test
    void resolveOptions_threadsXPostsByDefault() {
        assertEquals(Map.of("thread", true, "threadNumber", true),
                mapper.resolveOptions("x", Map.of(), Map.of()).orElseThrow());

        ReflectionTestUtils.setField(defaults, "xThread", false);
        assertTrue(mapper.resolveOptions("x", Map.of(), Map.of()).isEmpty());
    }

    @Test
    void resolveOptions_emptyWhenNoLayerAndNoDefault() {
        assertTrue(mapper.resolveOptions("reddit", Map.of(), Map.of()).isEmpty());
    }
}
