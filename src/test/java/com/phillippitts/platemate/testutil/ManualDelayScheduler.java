package com.phillippitts.platemate.testutil;

import com.phillippitts.platemate.service.location.DelayScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * DelayScheduler that never fires on its own. Tests inspect the requested delays and
 * run due tasks with {@link #runNext()}.
 */
public class ManualDelayScheduler implements DelayScheduler {

    private final List<Scheduled> pending = new ArrayList<>();
    public final List<Duration> requestedDelays = new ArrayList<>();
    public int cancelled;

    @Override
    public synchronized Handle schedule(Runnable task, Duration delay) {
        Scheduled s = new Scheduled(task);
        pending.add(s);
        requestedDelays.add(delay);
        return () -> {
            synchronized (ManualDelayScheduler.this) {
                if (pending.remove(s)) {
                    cancelled++;
                }
            }
        };
    }

    /**
     * Runs the oldest pending task.
     *
     * @return false if nothing was pending
     */
    public boolean runNext() {
        Scheduled next;
        synchronized (this) {
            if (pending.isEmpty()) {
                return false;
            }
            next = pending.remove(0);
        }
        next.task.run();
        return true;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private static final class Scheduled {
        final Runnable task;

        Scheduled(Runnable task) {
            this.task = task;
        }
    }
}
