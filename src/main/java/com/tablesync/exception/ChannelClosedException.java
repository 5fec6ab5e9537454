package com.tablesync.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Delivered to a subscriber's {@code onFailure} when the channel carrying it gave up reconnecting.
 * The subscription will receive no further events; the owner must subscribe again.
 */
@Getter
public class ChannelClosedException extends BaseException {

    private final String channelName;
    private final int attempts;

    public ChannelClosedException(String channelName, int attempts, Throwable cause) {
        super(
                ErrorCode.CHANNEL_CLOSED,
                "Channel " + channelName + " closed after " + attempts + " failed reconnect attempts",
                Map.of("channel", channelName, "attempts", attempts),
                cause);
        this.channelName = channelName;
        this.attempts = attempts;
    }
}
