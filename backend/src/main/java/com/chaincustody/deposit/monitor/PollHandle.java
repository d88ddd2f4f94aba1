package com.chaincustody.deposit.monitor;

/**
 * Cancellation handle of one scheduled poll.
 */
public interface PollHandle {

    /** Cancels the poll if it has not started; a running poll is allowed to finish. */
    void cancel();
}
