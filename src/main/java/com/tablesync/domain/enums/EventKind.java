package com.tablesync.domain.enums;

/**
 * Row-level change kinds emitted by the change feed.
 *
 * <p>{@link #ANY} is only meaningful on the subscribing side: it matches every kind.
 * Events themselves always carry one of INSERT, UPDATE or DELETE.
 */
public enum EventKind {
    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    ANY("*");

    private final String wireValue;

    EventKind(String wireValue) {
        this.wireValue = wireValue;
    }

    /** Value used by the change-feed transport ("INSERT", "UPDATE", "DELETE" or "*"). */
    public String getWireValue() {
        return wireValue;
    }

    /** True if a subscription for this kind should receive an event of the given kind. */
    public boolean matches(EventKind eventKind) {
        return this == ANY || this == eventKind;
    }
}
