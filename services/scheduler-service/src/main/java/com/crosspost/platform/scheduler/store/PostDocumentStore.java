package com.crosspost.platform.scheduler.store;

import com.crosspost.platform.connector.model.Post;
import com.crosspost.platform.scheduler.exception.PostNotFoundException;

import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Live, subscribable store of post documents.
 *
 * <p>A document may be saved while it is still partially synced from its authoring client. Such
 * snapshots are kept but never delivered to subscribers; only fully synced snapshots are.
 */
public interface PostDocumentStore {

    /**
     * Latest snapshot, synced or not.
     */
    Optional<Post> find(String postId);

    void save(Post post, boolean synced);

    /**
     * Atomic read-modify-write against the latest snapshot. The result counts as synced.
     *
     * @throws PostNotFoundException when no post has this id
     */
    Post update(String postId, UnaryOperator<Post> mutation);

    /**
     * @return true when a post was removed
     */
    boolean delete(String postId);

    Set<String> postIds();

    /**
     * Deliver every synced snapshot of the post to {@code listener}, starting with the current one
     * when it is synced.
     */
    Subscription subscribe(String postId, Consumer<Post> listener);

    void addLifecycleListener(PostLifecycleListener listener);
}
