package com.crosspost.platform.connector.service;

import com.crosspost.platform.connector.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps platform names to canonical option-bag keys and picks the winning bag across layers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlatformOptionsMapper {

    private static final Map<String, String> OPTIONS_KEYS;

    static {
        Map<String, String> keys = new HashMap<>();
        for (Platform platform : Platform.values()) {
            keys.put(platform.getKey(), platform.getOptionsKey());
        }
        keys.put("twitter", Platform.X.getOptionsKey());
        OPTIONS_KEYS = Collections.unmodifiableMap(keys);
    }

    private final PlatformOptionDefaults defaults;

    public String optionsKeyFor(String platform) {
        String normalized = platform.trim().toLowerCase(Locale.ROOT);
        return OPTIONS_KEYS.getOrDefault(normalized, normalized + "Options");
    }

    /**
     * Move bare alias keys ({@code reddit}, {@code x}, ...) to their canonical key in place.
     * An explicit canonical bag wins over its alias; the alias key is removed either way.
     */
    public void normalizeAliases(Map<String, Object> bag) {
        if (bag == null || bag.isEmpty()) {
            return;
        }
        for (String alias : List.copyOf(bag.keySet())) {
            String canonical = OPTIONS_KEYS.get(alias);
            if (canonical == null) {
                continue;
            }
            Object value = bag.remove(alias);
            if (!(value instanceof Map)) {
                log.warn("Ignoring non-object option alias '{}'", alias);
                continue;
            }
            if (bag.containsKey(canonical)) {
                log.debug("Both '{}' and '{}' present, keeping '{}'", alias, canonical, canonical);
                continue;
            }
            bag.put(canonical, value);
        }
    }

    /**
     * First bag found for {@code platform} among {@code layers} (highest precedence first), then the
     * environment default. Bags are taken whole; fields are never merged across layers.
     */
    public Optional<Map<String, Object>> resolveOptions(String platform, List<Map<String, Object>> layers) {
        String key = optionsKeyFor(platform);
        for (Map<String, Object> layer : layers) {
            Optional<Map<String, Object>> bag = bagFrom(layer, key);
            if (bag.isPresent()) {
                return bag;
            }
        }
        return defaults.forPlatform(platform);
    }

    public Optional<Map<String, Object>> resolveOptions(String platform, Map<String, Object> variantOptions,
                                                        Map<String, Object> requestOptions) {
        return resolveOptions(platform, Arrays.asList(variantOptions, requestOptions));
    }

    private static Optional<Map<String, Object>> bagFrom(Map<String, Object> layer, String key) {
        if (layer == null || !(layer.get(key) instanceof Map)) {
            return Optional.empty();
        }
        Map<String, Object> bag = new LinkedHashMap<>();
        ((Map<?, ?>) layer.get(key)).forEach((name, value) -> bag.put(String.valueOf(name), value));
        return Optional.of(bag);
    }
}
