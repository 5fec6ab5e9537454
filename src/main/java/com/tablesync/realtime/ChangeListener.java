package com.tablesync.realtime;

import com.tablesync.domain.model.ChangeEvent;
import com.tablesync.exception.ChannelClosedException;
import java.util.List;

/**
 * Receives change events for one subscription.
 *
 * <p>Unbatched subscriptions get {@link #onChange(ChangeEvent)} per event. Batched subscriptions
 * get {@link #onBatch(List)} with the buffered events in arrival order; the default fans the
 * batch back out to {@code onChange}. Exceptions thrown from any method are logged and counted,
 * and never stop delivery to other subscribers.
 */
@FunctionalInterface
public interface ChangeListener {

    void onChange(ChangeEvent event);

    default void onBatch(List<ChangeEvent> events) {
        events.forEach(this::onChange);
    }

    /** The channel carrying this subscription joined (or rejoined after an error). */
    default void onConnected() {}

    /** The channel carrying this subscription failed and is reconnecting. Events may be missed. */
    default void onDisconnected() {}

    /** Terminal: the channel gave up. Called at most once; no events follow. */
    default void onFailure(ChannelClosedException failure) {}
}
