package com.crosspost.platform.scheduler.store;

import com.crosspost.platform.connector.model.Post;
import com.crosspost.platform.scheduler.exception.PostNotFoundException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Process-local document store backend.
 */
@Repository
@Slf4j
public class InMemoryPostDocumentStore implements PostDocumentStore {

    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<Post>>> subscribers = new ConcurrentHashMap<>();
    private final List<PostLifecycleListener> lifecycleListeners = new CopyOnWriteArrayList<>();

    @Override
    public Optional<Post> find(String postId) {
        Document document = documents.get(postId);
        return document != null ? Optional.of(document.getPost()) : Optional.empty();
    }

    @Override
    public void save(Post post, boolean synced) {
        Document previous = documents.put(post.getId(), new Document(post, synced));
        if (previous == null) {
            log.debug("Post {} added to store", post.getId());
            lifecycleListeners.forEach(listener -> listener.onPostAdded(post.getId()));
        }
        if (synced) {
            notifySubscribers(post.getId());
        }
    }

    @Override
    public Post update(String postId, UnaryOperator<Post> mutation) {
        Document updated = documents.compute(postId, (id, current) -> {
            if (current == null) {
                throw new PostNotFoundException(postId);
            }
            return new Document(mutation.apply(current.getPost()), true);
        });
        notifySubscribers(postId);
        return updated.getPost();
    }

    @Override
    public boolean delete(String postId) {
        Document removed = documents.remove(postId);
        if (removed == null) {
            return false;
        }
        subscribers.remove(postId);
        log.debug("Post {} removed from store", postId);
        lifecycleListeners.forEach(listener -> listener.onPostRemoved(postId));
        return true;
    }

    @Override
    public Set<String> postIds() {
        return Set.copyOf(documents.keySet());
    }

    @Override
    public Subscription subscribe(String postId, Consumer<Post> listener) {
        subscribers.computeIfAbsent(postId, id -> new CopyOnWriteArrayList<>()).add(listener);

        Document current = documents.get(postId);
        if (current != null && current.isSynced()) {
            deliver(postId, listener, current.getPost());
        }

        return () -> {
            List<Consumer<Post>> listeners = subscribers.get(postId);
            if (listeners != null) {
                listeners.remove(listener);
            }
        };
    }

    @Override
    public void addLifecycleListener(PostLifecycleListener listener) {
        lifecycleListeners.add(listener);
    }

    private void notifySubscribers(String postId) {
        // Always hand out the newest snapshot, even if another write landed after ours
        Document latest = documents.get(postId);
        List<Consumer<Post>> listeners = subscribers.get(postId);
        if (latest == null || !latest.isSynced() || listeners == null) {
            return;
        }
        for (Consumer<Post> listener : listeners) {
            deliver(postId, listener, latest.getPost());
        }
    }

    private void deliver(String postId, Consumer<Post> listener, Post snapshot) {
        try {
            listener.accept(snapshot);
        } catch (RuntimeException e) {
            log.error("Subscriber of post {} failed to handle snapshot: {}", postId, e.getMessage(), e);
        }
    }

    @Value
    private static class Document {
        Post post;
        boolean synced;
    }
}
