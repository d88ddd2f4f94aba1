package com.chaincustody.deposit.monitor;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link PollScheduler} on a Spring {@link TaskScheduler} (the monitor-scheduler pool).
 */
@RequiredArgsConstructor
public class TaskSchedulerPollScheduler implements PollScheduler {

    private final TaskScheduler taskScheduler;

    @Override
    public PollHandle schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, Instant.now().plus(delay));
        return () -> future.cancel(false);
    }
}
