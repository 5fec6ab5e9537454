package com.tablesync.realtime;

/**
 * Handle returned by {@link RealtimeService#subscribe(SubscriptionConfig)}. Calling it more than
 * once is harmless.
 */
@FunctionalInterface
public interface Unsubscribe extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
