package com.crosspost.platform.scheduler.store;

/**
 * Notified when posts appear in or disappear from the store.
 */
public interface PostLifecycleListener {

    default void onPostAdded(String postId) {
    }

    default void onPostRemoved(String postId) {
    }
}
