package com.chaincustody.deposit.monitor;

import java.time.Duration;

/**
 * Schedules single deferred poll cycles. Monitors chain their own next cycle, so at most one is pending per monitor.
 */
public interface PollScheduler {

    PollHandle schedule(Runnable task, Duration delay);
}
