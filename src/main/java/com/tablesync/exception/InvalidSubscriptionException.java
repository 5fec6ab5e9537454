package com.tablesync.exception;

/**
 * Thrown while building a subscription config that can never work (no table, no listener,
 * non-positive windows). Raised at construction, never at first delivery.
 */
public class InvalidSubscriptionException extends BaseException {

    public InvalidSubscriptionException(String message) {
        super(ErrorCode.INVALID_SUBSCRIPTION, message);
    }
}
