package com.crosspost.platform.scheduler.store;

/**
 * Handle returned by {@link PostDocumentStore#subscribe}; unsubscribing stops further deliveries.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
