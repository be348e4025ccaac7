/**
 * MIT License
 *
 * Copyright (c) 2022 Elliot Barlas
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.kiln.internal.reactor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Deadline-ordered timers for one reactor: connection idle timeouts and outbound request timeouts.
 * <p>
 * Cancelled timers stay in the heap until they reach its head or the heap is compacted, so
 * {@link Cancellable#cancel()} is constant-time. Timers with equal deadlines expire in the order they were
 * scheduled.
 * <p>
 * Not threadsafe: only the reactor thread touches it.
 */
class Scheduler {

    private static final int COMPACTION_THRESHOLD = 64;

    private final Clock clock;
    private final PriorityQueue<Timer> timers;
    private long sequence;
    private int pending;

    Scheduler() {
        this(new SystemClock());
    }

    Scheduler(Clock clock) {
        this.clock = clock;
        this.timers = new PriorityQueue<>();
    }

    /**
     * Timers neither cancelled nor expired.
     */
    int size() {
        return pending;
    }

    Cancellable schedule(Runnable task, Duration delay) {
        // Idle timers are rescheduled per request; drop the cancelled ones before they pile up
        if (timers.size() > COMPACTION_THRESHOLD && timers.size() > pending * 2) {
            timers.removeIf(timer -> timer.done);
        }
        Timer timer = new Timer(task, clock.nanoTime() + delay.toNanos(), sequence++);
        timers.add(timer);
        pending++;
        return timer;
    }

    /**
     * Removes and returns every task whose deadline has passed, earliest deadline first.
     */
    List<Runnable> expired() {
        long now = clock.nanoTime();
        List<Runnable> due = new ArrayList<>();
        Timer head;
        while ((head = timers.peek()) != null && (head.done || head.deadline - now <= 0)) {
            timers.poll();
            if (!head.done) {
                head.done = true;
                pending--;
                due.add(head.task);
            }
        }
        return due;
    }

    /**
     * Nanoseconds until the earliest pending deadline, {@code 0} if it has already passed, or {@code -1} if nothing
     * is pending.
     */
    long nanosUntilNextDeadline() {
        Timer head;
        while ((head = timers.peek()) != null && head.done) {
            timers.poll();
        }
        if (head == null) {
            return -1;
        }
        return Math.max(0, head.deadline - clock.nanoTime());
    }

    private final class Timer implements Cancellable, Comparable<Timer> {
        final Runnable task;
        final long deadline;
        final long sequence;
        boolean done;

        Timer(Runnable task, long deadline, long sequence) {
            this.task = task;
            this.deadline = deadline;
            this.sequence = sequence;
        }

        @Override
        public void cancel() {
            if (!done) {
                done = true;
                pending--;
            }
        }

        @Override
        public int compareTo(Timer other) {
            // Subtract before comparing so nanoTime wraparound keeps the order
            int byDeadline = Long.signum(deadline - other.deadline);
            return byDeadline != 0 ? byDeadline : Long.compare(sequence, other.sequence);
        }
    }

}
