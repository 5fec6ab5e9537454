package com.tablesync.transport;

import com.tablesync.domain.model.ChangeFilter;
import java.util.concurrent.CompletableFuture;

/**
 * The change-feed connection the channel pool multiplexes subscriptions over.
 *
 * <p>A channel is a named logical stream. Several bindings (one per filter) may be added to the
 * same channel; there is no per-binding removal, only {@link #unsubscribe(String)} of the whole
 * channel. Implementations may complete futures on any thread, including the calling one.
 */
public interface RealtimeTransport {

    /**
     * Adds a binding for {@code filter} to {@code channelName}, opening the channel if needed.
     * The future completes when the transport confirms the binding and fails if it refuses it.
     */
    CompletableFuture<Void> subscribe(String channelName, ChangeFilter filter, TransportListener listener);

    /**
     * Tears down the channel and every binding on it. Unknown channels are ignored.
     *
     * @throws com.tablesync.exception.TransportException if the transport could not close it cleanly
     */
    void unsubscribe(String channelName);

    /**
     * Round-trips a no-op on the channel. The future fails if the channel is unhealthy; a
     * synchronous exception means the channel handle itself is no longer usable.
     */
    CompletableFuture<Void> ping(String channelName);
}
