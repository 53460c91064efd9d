package com.crosspost.platform.scheduler.exception;

import lombok.Getter;

@Getter
public class PostNotFoundException extends RuntimeException {

    private final String postId;

    public PostNotFoundException(String postId) {
        super("Post not found: " + postId);
        this.postId = postId;
    }
}
