package com.chaincustody.event;

/**
 * Topic names used with {@link EventBroadcaster}.
 */
public final class EventTopics {

    public static final String DEPOSIT_PENDING = "deposit.pending";
    public static final String DEPOSIT_CONFIRMED = "deposit.confirmed";
    public static final String MONITOR_STOPPED = "monitor.stopped";
    public static final String WITHDRAWAL_PENDING = "withdrawal.pending";
    public static final String WITHDRAWAL_SIGNING_REQUESTED = "withdrawal.signing-requested";
    public static final String WITHDRAWAL_BROADCAST = "withdrawal.broadcast";
    public static final String WITHDRAWAL_CONFIRMED = "withdrawal.confirmed";

    private EventTopics() {
    }
}
