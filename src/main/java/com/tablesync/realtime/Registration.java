package com.tablesync.realtime;

import lombok.Value;

/**
 * Result of registering a listener: the subscription it joined, its own listener slot, and
 * whether the subscription was newly created or an identical one was shared.
 */
@Value
public class Registration {

    String subscriptionId;
    String listenerId;
    boolean created;
}
