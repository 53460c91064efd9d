package com.crosspost.platform.scheduler.service;

import com.crosspost.platform.connector.publish.PublisherRouter;
import com.crosspost.platform.connector.service.MediaResolver;
import com.crosspost.platform.connector.service.PublishRequestBuilder;
import com.crosspost.platform.scheduler.store.PostDocumentStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

@Component
public class PostSchedulerFactory {

    private final PostDocumentStore store;
    private final PublishRequestBuilder requestBuilder;
    private final PublisherRouter publisherRouter;
    private final MediaResolver mediaResolver;
    private final SchedulingWindow window;
    private final RetryPolicy retryPolicy;
    private final TaskScheduler taskScheduler;
    private final Executor publishExecutor;
    private final Clock clock;
    private final Duration tickInterval;

    public PostSchedulerFactory(PostDocumentStore store,
                                PublishRequestBuilder requestBuilder,
                                PublisherRouter publisherRouter,
                                MediaResolver mediaResolver,
                                SchedulingWindow window,
                                RetryPolicy retryPolicy,
                                TaskScheduler taskScheduler,
                                @Qualifier("publishExecutor") Executor publishExecutor,
                                Clock clock,
                                @Value("${scheduler.tick-interval:10s}") Duration tickInterval) {
        this.store = store;
        this.requestBuilder = requestBuilder;
        this.publisherRouter = publisherRouter;
        this.mediaResolver = mediaResolver;
        this.window = window;
        this.retryPolicy = retryPolicy;
        this.taskScheduler = taskScheduler;
        this.publishExecutor = publishExecutor;
        this.clock = clock;
        this.tickInterval = tickInterval;
    }

    public PostScheduler create(String postId) {
        return PostScheduler.builder()
                .postId(postId)
                .store(store)
                .requestBuilder(requestBuilder)
                .publisherRouter(publisherRouter)
                .mediaResolver(mediaResolver)
                .window(window)
                .retryPolicy(retryPolicy)
                .taskScheduler(taskScheduler)
                .publishExecutor(publishExecutor)
                .clock(clock)
                .tickInterval(tickInterval)
                .build();
    }
}
