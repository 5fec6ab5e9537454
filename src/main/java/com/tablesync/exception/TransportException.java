package com.tablesync.exception;

/**
 * A channel join, binding or heartbeat failed at the transport level. Retried with backoff;
 * only surfaced to subscribers (wrapped in {@link ChannelClosedException}) once the reconnect
 * cap is exceeded.
 */
public class TransportException extends BaseException {

    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }
}
