package com.crosspost.platform.scheduler.service;

import com.crosspost.platform.scheduler.store.PostDocumentStore;
import com.crosspost.platform.scheduler.store.PostLifecycleListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one running {@link PostScheduler} per post in the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostSchedulerRegistry implements PostLifecycleListener {

    private final PostDocumentStore store;
    private final PostSchedulerFactory schedulerFactory;

    private final Map<String, PostScheduler> schedulers = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        store.addLifecycleListener(this);
        reconcile();
    }

    /**
     * Catch up with posts added or removed without a lifecycle event, e.g. by another store client.
     */
    @Scheduled(fixedDelayString = "${scheduler.reconcile-interval-ms:60000}",
            initialDelayString = "${scheduler.reconcile-interval-ms:60000}")
    public void reconcile() {
        Set<String> postIds = store.postIds();
        postIds.forEach(this::ensureScheduler);

        for (String postId : new ArrayList<>(schedulers.keySet())) {
            if (!postIds.contains(postId)) {
                cancelScheduler(postId);
            }
        }
        log.debug("Reconciled schedulers: {} active", schedulers.size());
    }

    @Override
    public void onPostAdded(String postId) {
        ensureScheduler(postId);
    }

    @Override
    public void onPostRemoved(String postId) {
        cancelScheduler(postId);
    }

    public Optional<PostScheduler> get(String postId) {
        return Optional.ofNullable(schedulers.get(postId));
    }

    public int activeCount() {
        return schedulers.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping {} post schedulers", schedulers.size());
        schedulers.values().forEach(PostScheduler::cancel);
        schedulers.clear();
    }

    private void ensureScheduler(String postId) {
        if (schedulers.containsKey(postId)) {
            return;
        }
        PostScheduler scheduler = schedulerFactory.create(postId);
        if (schedulers.putIfAbsent(postId, scheduler) == null) {
            log.info("Created scheduler for post {}", postId);
            scheduler.start();
        }
    }

    private void cancelScheduler(String postId) {
        PostScheduler scheduler = schedulers.remove(postId);
        if (scheduler != null) {
            scheduler.cancel();
        }
    }
}
