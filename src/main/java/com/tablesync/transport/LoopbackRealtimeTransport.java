package com.tablesync.transport;

import com.tablesync.domain.enums.EventKind;
import com.tablesync.domain.enums.TransportStatus;
import com.tablesync.domain.model.ChangeEvent;
import com.tablesync.domain.model.ChangeFilter;
import com.tablesync.exception.TransportException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process {@link RealtimeTransport}: whatever is passed to {@link #publish(ChangeEvent)} is
 * delivered synchronously to every binding whose filter matches. Used for local runs and
 * end-to-end tests; real deployments register their own transport bean and set
 * {@code tablesync.realtime.transport} to something else.
 */
@Component
@ConditionalOnProperty(prefix = "tablesync.realtime", name = "transport", havingValue = "loopback", matchIfMissing = true)
public class LoopbackRealtimeTransport implements RealtimeTransport {

    private static final Logger log = LoggerFactory.getLogger(LoopbackRealtimeTransport.class);

    private final Map<String, List<Binding>> bindingsByChannel = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> subscribe(String channelName, ChangeFilter filter, TransportListener listener) {
        Binding binding = new Binding(filter, RowPredicate.parse(filter.getPredicate()), listener);
        bindingsByChannel.computeIfAbsent(channelName, name -> new CopyOnWriteArrayList<>()).add(binding);
        log.debug("Bound {} on {}", filter.identityKey(), channelName);
        listener.onStatus(TransportStatus.ACTIVE, null);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void unsubscribe(String channelName) {
        List<Binding> removed = bindingsByChannel.remove(channelName);
        if (removed != null) {
            log.debug("Closed {} with {} bindings", channelName, removed.size());
        }
    }

    @Override
    public CompletableFuture<Void> ping(String channelName) {
        if (!bindingsByChannel.containsKey(channelName)) {
            return CompletableFuture.failedFuture(new TransportException("Unknown channel " + channelName));
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Delivers {@code event} to every matching binding.
     *
     * @return number of bindings that received it
     */
    public int publish(ChangeEvent event) {
        int delivered = 0;
        for (List<Binding> bindings : bindingsByChannel.values()) {
            for (Binding binding : bindings) {
                if (binding.matches(event)) {
                    binding.listener.onEvent(event);
                    delivered++;
                }
            }
        }
        return delivered;
    }

    /**
     * Drops a channel as a network failure would: its bindings are removed and each is told
     * {@code status}.
     */
    public void fail(String channelName, TransportStatus status) {
        List<Binding> removed = bindingsByChannel.remove(channelName);
        if (removed == null) {
            return;
        }
        log.info("Simulating {} on {}", status, channelName);
        TransportException cause = new TransportException("Loopback channel " + channelName + " " + status);
        for (Binding binding : removed) {
            binding.listener.onStatus(status, cause);
        }
    }

    public boolean hasChannel(String channelName) {
        return bindingsByChannel.containsKey(channelName);
    }

    public int bindingCount(String channelName) {
        List<Binding> bindings = bindingsByChannel.get(channelName);
        return bindings == null ? 0 : bindings.size();
    }

    private static final class Binding {

        private final ChangeFilter filter;
        private final RowPredicate predicate;
        private final TransportListener listener;

        private Binding(ChangeFilter filter, RowPredicate predicate, TransportListener listener) {
            this.filter = filter;
            this.predicate = predicate;
            this.listener = listener;
        }

        private boolean matches(ChangeEvent event) {
            if (!filter.getTable().equals(event.getTable()) || !filter.getSchema().equals(event.getSchema())) {
                return false;
            }
            if (!filter.getEventKind().matches(event.getKind())) {
                return false;
            }
            Map<String, Object> row = event.getKind() == EventKind.DELETE ? event.getOldRecord() : event.getNewRecord();
            return predicate.test(row);
        }
    }
}
