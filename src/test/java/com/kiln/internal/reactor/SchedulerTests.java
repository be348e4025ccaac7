/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.kiln.internal.reactor;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SchedulerTests {

    @Test
    public void nothingExpiresEarly() {
        FakeClock clock = new FakeClock();
        Scheduler scheduler = new Scheduler(clock);
        scheduler.schedule(() -> {}, Duration.ofSeconds(1));

        clock.advance(Duration.ofMillis(999));
        assertTrue(scheduler.expired().isEmpty());
        assertEquals(1, scheduler.size());

        clock.advance(Duration.ofMillis(1));
        assertEquals(1, scheduler.expired().size());
        assertEquals(0, scheduler.size());
    }

    @Test
    public void expiredTasksComeBackInDeadlineOrder() {
        FakeClock clock = new FakeClock();
        Scheduler scheduler = new Scheduler(clock);
        List<String> ran = new ArrayList<>();

        scheduler.schedule(() -> ran.add("late"), Duration.ofSeconds(3));
        scheduler.schedule(() -> ran.add("early"), Duration.ofSeconds(1));
        scheduler.schedule(() -> ran.add("tied-first"), Duration.ofSeconds(2));
        scheduler.schedule(() -> ran.add("tied-second"), Duration.ofSeconds(2));

        clock.advance(Duration.ofSeconds(10));
        scheduler.expired().forEach(Runnable::run);

        assertEquals(List.of("early", "tied-first", "tied-second", "late"), ran);
    }

    @Test
    public void cancelledTasksNeverRun() {
        FakeClock clock = new FakeClock();
        Scheduler scheduler = new Scheduler(clock);
        List<String> ran = new ArrayList<>();

        Cancellable cancelled = scheduler.schedule(() -> ran.add("cancelled"), Duration.ofSeconds(1));
        scheduler.schedule(() -> ran.add("kept"), Duration.ofSeconds(1));
        cancelled.cancel();
        // cancelling twice is harmless
        cancelled.cancel();

        clock.advance(Duration.ofSeconds(1));
        scheduler.expired().forEach(Runnable::run);

        assertEquals(List.of("kept"), ran);
    }

    @Test
    public void nextDeadlineSkipsCancelledTimers() {
        FakeClock clock = new FakeClock();
        Scheduler scheduler = new Scheduler(clock);
        assertEquals(-1, scheduler.nanosUntilNextDeadline());

        Cancellable soon = scheduler.schedule(() -> {}, Duration.ofMillis(10));
        scheduler.schedule(() -> {}, Duration.ofMillis(50));
        assertEquals(Duration.ofMillis(10).toNanos(), scheduler.nanosUntilNextDeadline());

        soon.cancel();
        assertEquals(1, scheduler.size());
        assertEquals(Duration.ofMillis(50).toNanos(), scheduler.nanosUntilNextDeadline());

        clock.advance(Duration.ofMillis(60));
        assertEquals(0, scheduler.nanosUntilNextDeadline());
    }

    @Test
    public void rescheduledTimersDoNotAccumulate() {
        FakeClock clock = new FakeClock();
        Scheduler scheduler = new Scheduler(clock);
        List<String> ran = new ArrayList<>();

        // An idle timer re-armed after every request
        Cancellable idleTimer = scheduler.schedule(() -> ran.add("idle"), Duration.ofSeconds(60));
        for (int i = 0; i < 10_000; i++) {
            idleTimer.cancel();
            idleTimer = scheduler.schedule(() -> ran.add("idle"), Duration.ofSeconds(60));
        }

        assertEquals(1, scheduler.size());

        clock.advance(Duration.ofSeconds(60));
        scheduler.expired().forEach(Runnable::run);

        assertEquals(List.of("idle"), ran);
        assertEquals(0, scheduler.size());
        assertEquals(-1, scheduler.nanosUntilNextDeadline());
    }

    @Test
    public void cancellingAnExpiredTimerIsHarmless() {
        FakeClock clock = new FakeClock();
        Scheduler scheduler = new Scheduler(clock);

        Cancellable timer = scheduler.schedule(() -> {}, Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, scheduler.expired().size());

        timer.cancel();
        assertEquals(0, scheduler.size());
    }

    private static class FakeClock implements Clock {
        private long time;

        void advance(Duration duration) {
            time += duration.toNanos();
        }

        @Override
        public long nanoTime() {
            return time;
        }
    }
}
