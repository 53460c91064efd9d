package com.crosspost.platform.scheduler.store;

import com.crosspost.platform.connector.model.MediaItem;
import com.crosspost.platform.connector.model.Post;
import com.crosspost.platform.connector.model.PostVariant;
import com.crosspost.platform.scheduler.exception.PostNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryPostDocumentStoreTest {

    private final InMemoryPostDocumentStore store = new InMemoryPostDocumentStore();

    private static Post post(String id, String text) {
        return Post.builder()
                .id(id)
                .accountGroupId("group-1")
                .variants(Map.of("base", PostVariant.builder()
                        .text(text)
                        .media(List.of(MediaItem.urlImage("https://cdn.example/a.jpg")))
                        .build()))
                .build();
    }

    @Test
    void subscribe_deliversOnlySyncedSnapshots() {
        List<Post> received = new ArrayList<>();
        store.save(post("p1", "pending"), false);

        store.subscribe("p1", received::add);
        assertTrue(received.isEmpty());

        store.save(post("p1", "synced"), true);
        assertEquals(1, received.size());
        assertEquals("synced", received.get(0).getBase().getText());
    }

    @Test
    void subscribe_deliversCurrentSyncedSnapshotImmediately() {
        List<Post> received = new ArrayList<>();
        store.save(post("p1", "hello"), true);

        store.subscribe("p1", received::add);

        assertEquals(1, received.size());
    }

    @Test
    void update_appliesMutationAndNotifies() {
        List<Post> received = new ArrayList<>();
        store.save(post("p1", "before"), true);
        store.subscribe("p1", received::add);

        Post updated = store.update("p1", current -> current.updateVariant("base",
                variant -> variant.toBuilder().text("after").build()));

        assertEquals("after", updated.getBase().getText());
        assertEquals("after", store.find("p1").orElseThrow().getBase().getText());
        assertEquals(2, received.size());
    }

    @Test
    void update_missingPostThrows() {
        assertThrows(PostNotFoundException.class, () -> store.update("missing", post -> post));
    }

    @Test
    void unsubscribe_stopsDelivery() {
        List<Post> received = new ArrayList<>();
        store.save(post("p1", "a"), true);
        Subscription subscription = store.subscribe("p1", received::add);

        subscription.unsubscribe();
        store.save(post("p1", "b"), true);

        assertEquals(1, received.size());
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() {
        List<Post> received = new ArrayList<>();
        store.save(post("p1", "a"), false);
        store.subscribe("p1", post -> {
            throw new IllegalStateException("boom");
        });
        store.subscribe("p1", received::add);

        store.save(post("p1", "b"), true);

        assertEquals(1, received.size());
    }

    @Test
    void lifecycleListener_seesAddsAndRemovals() {
        List<String> events = new ArrayList<>();
        store.addLifecycleListener(new PostLifecycleListener() {
            @Override
            public void onPostAdded(String postId) {
                events.add("added:" + postId);
            }

            @Override
            public void onPostRemoved(String postId) {
                events.add("removed:" + postId);
            }
        });

        store.save(post("p1", "a"), true);
        store.save(post("p1", "b"), true);
        assertTrue(store.delete("p1"));
        assertFalse(store.delete("p1"));

        assertEquals(List.of("added:p1", "removed:p1"), events);
        assertEquals(Set.of(), store.postIds());
    }
}
