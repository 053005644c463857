package net.kairos.core.support;

import net.kairos.core.timer.TimerBackend;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Virtual-time timer. Tasks run on the calling thread when {@link #advance} or {@link #runDue} reaches
 * their deadline; the shared {@link ManualClock} moves with it.
 */
public final class ManualTimerBackend implements TimerBackend {

    private static final class Entry {
        final Instant due;
        final long seq;
        final Runnable task;
        boolean cancelled;

        Entry(Instant due, long seq, Runnable task) {
            this.due = due;
            this.seq = seq;
            this.task = task;
        }
    }

    private final ManualClock clock;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparing((Entry e) -> e.due).thenComparingLong(e -> e.seq));
    private final List<Long> requestedDelays = new ArrayList<>();
    private long seq;

    public ManualTimerBackend(ManualClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable schedule(long delayMs, Runnable task) {
        requestedDelays.add(delayMs);
        Entry e = new Entry(clock.now().plusMillis(delayMs), seq++, task);
        queue.add(e);
        return () -> {
            synchronized (ManualTimerBackend.this) {
                if (e.cancelled || !queue.contains(e)) return false;
                e.cancelled = true;
                queue.remove(e);
                return true;
            }
        };
    }

    /** Moves time forward by {@code d}, running every task that becomes due on the way. */
    public void advance(Duration d) {
        Instant target = clock.now().plus(d);
        while (true) {
            Entry next;
            synchronized (this) {
                next = queue.peek();
                if (next == null || next.due.isAfter(target)) break;
                queue.poll();
            }
            if (next.due.isAfter(clock.now())) clock.set(next.due);
            next.task.run();
        }
        clock.set(target);
    }

    /** Runs the tasks due at the current instant (zero-delay wakes). */
    public void runDue() {
        advance(Duration.ZERO);
    }

    public synchronized int pending() {
        return queue.size();
    }

    public synchronized List<Long> requestedDelays() {
        return List.copyOf(requestedDelays);
    }
}
