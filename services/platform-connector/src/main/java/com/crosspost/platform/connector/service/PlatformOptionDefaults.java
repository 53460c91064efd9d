package com.crosspost.platform.connector.service;

import com.crosspost.platform.connector.model.Platform;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Environment-supplied option bags, the lowest precedence layer.
 */
@Component
public class PlatformOptionDefaults {

    @Value("${platform.defaults.pinterest.board-id:}")
    private String pinterestBoardId;

    @Value("${platform.defaults.pinterest.board-name:}")
    private String pinterestBoardName;

    @Value("${platform.defaults.x.thread:true}")
    private boolean xThread;

    public Optional<Map<String, Object>> forPlatform(String platform) {
        return Platform.fromKey(platform).flatMap(this::forPlatform);
    }

    private Optional<Map<String, Object>> forPlatform(Platform platform) {
        return switch (platform) {
            case PINTEREST -> pinterestDefaults();
            case X -> xDefaults();
            default -> Optional.empty();
        };
    }

    private Optional<Map<String, Object>> pinterestDefaults() {
        // board id ("user/board") takes precedence over board name
        String board = notBlank(pinterestBoardId) ? pinterestBoardId : pinterestBoardName;
        if (!notBlank(board)) {
            return Optional.empty();
        }
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("boardName", board.trim());
        return Optional.of(options);
    }

    private Optional<Map<String, Object>> xDefaults() {
        if (!xThread) {
            return Optional.empty();
        }
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("thread", true);
        options.put("threadNumber", true);
        return Optional.of(options);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
