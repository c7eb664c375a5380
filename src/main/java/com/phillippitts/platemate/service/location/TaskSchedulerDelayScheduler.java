package com.phillippitts.platemate.service.location;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link DelayScheduler} backed by the Spring location scheduler.
 */
@Component
public class TaskSchedulerDelayScheduler implements DelayScheduler {

    private final TaskScheduler scheduler;
    private final Clock clock;

    public TaskSchedulerDelayScheduler(@Qualifier("locationScheduler") TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public Handle schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(task, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }
}
