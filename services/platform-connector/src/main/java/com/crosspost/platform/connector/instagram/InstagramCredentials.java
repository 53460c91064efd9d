package com.crosspost.platform.connector.instagram;

import lombok.Value;

@Value
public class InstagramCredentials {
    String accessToken;
    String instagramUserId;

    @Override
    public String toString() {
        return "InstagramCredentials(instagramUserId=" + instagramUserId + ")";
    }
}
