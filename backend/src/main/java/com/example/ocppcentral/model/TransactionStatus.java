package com.example.ocppcentral.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a charging transaction, including the billing failure state.
 * Legal moves are listed in {@link #TRANSITIONS}; anything else is rejected.
 */
public enum TransactionStatus {
    STARTED,
    PENDING_START,
    RUNNING,
    PENDING_STOP,
    STOPPED,
    COMPLETED,
    CANCELLED,
    FAILED,
    BILLING_FAILED;

    /** At most one of these per charger. */
    public static final Set<TransactionStatus> ACTIVE =
            Collections.unmodifiableSet(EnumSet.of(STARTED, PENDING_START, RUNNING));

    /** Still open on the charger side, failed when the connector leaves a charging state. */
    public static final Set<TransactionStatus> ONGOING =
            Collections.unmodifiableSet(EnumSet.of(STARTED, PENDING_START, RUNNING, PENDING_STOP));

    private static final Map<TransactionStatus, Set<TransactionStatus>> TRANSITIONS =
            new EnumMap<>(TransactionStatus.class);

    static {
        TRANSITIONS.put(STARTED, EnumSet.of(PENDING_START, RUNNING, STOPPED, CANCELLED, FAILED));
        TRANSITIONS.put(PENDING_START, EnumSet.of(RUNNING, STOPPED, CANCELLED, FAILED));
        TRANSITIONS.put(RUNNING, EnumSet.of(PENDING_STOP, STOPPED, COMPLETED, FAILED));
        TRANSITIONS.put(PENDING_STOP, EnumSet.of(STOPPED, COMPLETED, CANCELLED, FAILED));
        TRANSITIONS.put(STOPPED, EnumSet.of(BILLING_FAILED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(BILLING_FAILED));
        TRANSITIONS.put(FAILED, EnumSet.of(BILLING_FAILED));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(TransactionStatus.class));
        TRANSITIONS.put(BILLING_FAILED, EnumSet.of(COMPLETED));
    }

    public boolean canTransitionTo(TransactionStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isOngoing() {
        return ONGOING.contains(this);
    }
}
