package com.crosspost.platform.connector.instagram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Looks up the Graph API token and Instagram user id connected to a profile key.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InstagramCredentialProvider {

    static final String TOKEN_KEY_PREFIX = "instagram:token:";
    static final String USER_ID_KEY_PREFIX = "instagram:user_id:";
    static final String DEFAULT_PROFILE = "default";

    private final StringRedisTemplate redisTemplate;

    public InstagramCredentials forProfileKey(String profileKey) {
        String profile = profileKey != null && !profileKey.isBlank() ? profileKey : DEFAULT_PROFILE;

        String accessToken = redisTemplate.opsForValue().get(TOKEN_KEY_PREFIX + profile);
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalStateException("No valid Instagram access token for profile: " + abbreviate(profile));
        }

        String instagramUserId = redisTemplate.opsForValue().get(USER_ID_KEY_PREFIX + profile);
        if (instagramUserId == null || instagramUserId.isBlank()) {
            throw new IllegalStateException("No Instagram user ID found for profile: " + abbreviate(profile));
        }

        return new InstagramCredentials(accessToken, instagramUserId);
    }

    static String abbreviate(String profileKey) {
        return profileKey.length() <= 8 ? profileKey : profileKey.substring(0, 8) + "...";
    }
}
