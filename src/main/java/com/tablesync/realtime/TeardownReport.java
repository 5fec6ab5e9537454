package com.tablesync.realtime;

import java.util.ArrayList;
import java.util.List;
import lombok.Value;

/**
 * Outcome of tearing down one or more channels. Failures are collected rather than thrown so one
 * stubborn channel does not stop the rest from closing.
 */
@Value
public class TeardownReport {

    int channelsClosed;
    List<Failure> failures;

    public TeardownReport(int channelsClosed, List<Failure> failures) {
        this.channelsClosed = channelsClosed;
        this.failures = List.copyOf(failures);
    }

    public static TeardownReport empty() {
        return new TeardownReport(0, List.of());
    }

    public boolean isClean() {
        return failures.isEmpty();
    }

    public TeardownReport merge(TeardownReport other) {
        List<Failure> all = new ArrayList<>(failures);
        all.addAll(other.failures);
        return new TeardownReport(channelsClosed + other.channelsClosed, all);
    }

    @Value
    public static class Failure {

        String channelName;
        Throwable cause;
    }
}
