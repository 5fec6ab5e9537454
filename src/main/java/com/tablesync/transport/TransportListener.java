package com.tablesync.transport;

import com.tablesync.domain.enums.TransportStatus;
import com.tablesync.domain.model.ChangeEvent;

/**
 * Callback side of one channel binding. Invoked on the transport's own threads.
 */
public interface TransportListener {

    void onEvent(ChangeEvent event);

    /**
     * Status change of the channel the binding lives on. {@code cause} is null unless the
     * status is a failure the transport can explain.
     */
    void onStatus(TransportStatus status, Throwable cause);
}
