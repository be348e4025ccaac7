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

package com.kiln;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Keeps a fixed number of worker processes running.
 * <p>
 * Each worker is started through a {@link WorkerLauncher} and watched via {@link Process#onExit()}.  A worker which
 * exits while the supervisor is running is restarted after {@code workerRestartDelay}, indefinitely.  Launch failures
 * are retried after the same delay; more than {@code maximumConsecutiveRestartFailures} of them in a row makes the
 * supervisor give up, stop every worker and report the failure to its failure handler.
 */
@ThreadSafe
public final class WorkerSupervisor {
	@NonNull
	private static final Logger logger;

	static {
		logger = Logger.getLogger(WorkerSupervisor.class.getName());
	}

	@NonNull
	private final Integer workerCount;
	@NonNull
	private final WorkerLauncher workerLauncher;
	@NonNull
	private final Duration workerRestartDelay;
	@NonNull
	private final Integer maximumConsecutiveRestartFailures;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final Consumer<Throwable> failureHandler;
	@NonNull
	private final Map<Integer, Process> processesByWorkerId;
	@NonNull
	private final AtomicInteger consecutiveLaunchFailures;
	@NonNull
	private final AtomicReference<Throwable> failure;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private ScheduledThreadPoolExecutor restartExecutor;
	private volatile boolean started;
	private volatile boolean stopping;

	@NonNull
	public static Builder withWorkerLauncher(@NonNull WorkerLauncher workerLauncher) {
		requireNonNull(workerLauncher);
		return new Builder(workerLauncher);
	}

	private WorkerSupervisor(@NonNull Builder builder) {
		requireNonNull(builder);

		this.workerLauncher = builder.workerLauncher;
		this.workerCount = builder.workerCount == null ? 1 : builder.workerCount;
		this.workerRestartDelay = builder.workerRestartDelay == null ? Duration.ofSeconds(1) : builder.workerRestartDelay;
		this.maximumConsecutiveRestartFailures = builder.maximumConsecutiveRestartFailures == null ? 5 : builder.maximumConsecutiveRestartFailures;
		this.shutdownTimeout = builder.shutdownTimeout == null ? Duration.ofSeconds(10) : builder.shutdownTimeout;
		this.lifecycleObserver = builder.lifecycleObserver == null ? LifecycleObserver.defaultInstance() : builder.lifecycleObserver;
		this.failureHandler = builder.failureHandler == null ? (throwable -> {}) : builder.failureHandler;

		if (this.workerCount < 1)
			throw new IllegalArgumentException(format("Worker count must be at least 1 but was %d", this.workerCount));

		if (this.workerRestartDelay.isNegative())
			throw new IllegalArgumentException("Worker restart delay must not be negative");

		if (this.maximumConsecutiveRestartFailures < 0)
			throw new IllegalArgumentException("Maximum consecutive restart failures must not be negative");

		this.processesByWorkerId = new ConcurrentHashMap<>();
		this.consecutiveLaunchFailures = new AtomicInteger();
		this.failure = new AtomicReference<>();
		this.lock = new ReentrantLock();
	}

	/**
	 * Launches every worker.  Workers which fail to launch are retried in the background.
	 */
	public void start() {
		this.lock.lock();

		try {
			if (this.started)
				throw new IllegalStateException("Supervisor has already been started");

			this.started = true;

			ScheduledThreadPoolExecutor restartExecutor = new ScheduledThreadPoolExecutor(1, runnable -> {
				Thread thread = new Thread(runnable, "kiln-worker-supervisor");
				thread.setDaemon(true);
				return thread;
			});

			restartExecutor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
			this.restartExecutor = restartExecutor;
		} finally {
			this.lock.unlock();
		}

		for (int workerId = 1; workerId <= getWorkerCount(); ++workerId)
			launchWorker(workerId);
	}

	/**
	 * Terminates every worker, waiting up to {@code shutdownTimeout} before killing those still running.
	 */
	public void stop() {
		List<Process> processes;

		this.lock.lock();

		try {
			if (this.stopping)
				return;

			this.stopping = true;

			if (this.restartExecutor != null)
				this.restartExecutor.shutdown();

			processes = new ArrayList<>(this.processesByWorkerId.values());
		} finally {
			this.lock.unlock();
		}

		for (Process process : processes)
			process.destroy();

		long deadline = System.nanoTime() + getShutdownTimeout().toNanos();

		try {
			for (Process process : processes) {
				long remainingNanos = deadline - System.nanoTime();

				if (remainingNanos <= 0 || !process.waitFor(remainingNanos, TimeUnit.NANOSECONDS)) {
					logger.warning(format("Worker process %d did not exit within %s, killing it", process.pid(), getShutdownTimeout()));
					process.destroyForcibly();
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();

			for (Process process : processes)
				process.destroyForcibly();
		}
	}

	private void launchWorker(@NonNull Integer workerId) {
		Process process;

		this.lock.lock();

		try {
			if (this.stopping)
				return;

			try {
				process = getWorkerLauncher().launch(workerId);
			} catch (IOException | RuntimeException e) {
				didFailToLaunchWorker(workerId, e);
				return;
			}

			this.consecutiveLaunchFailures.set(0);
			this.processesByWorkerId.put(workerId, process);
		} finally {
			this.lock.unlock();
		}

		logger.info(format("Started worker %d with pid %d", workerId, process.pid()));

		try {
			getLifecycleObserver().didStartWorker(workerId, process.pid());
		} catch (Throwable t) {
			logObserverFailure("didStartWorker", t);
		}

		process.onExit().thenAccept(exitedProcess -> didDetectWorkerExit(workerId, exitedProcess));
	}

	private void didFailToLaunchWorker(@NonNull Integer workerId,
																		 @NonNull Exception exception) {
		int failures = this.consecutiveLaunchFailures.incrementAndGet();

		logEvent(LogEvent.with(LogEventType.WORKER_LAUNCH_FAILED,
				format("Unable to launch worker %d (%d consecutive failures)", workerId, failures)).throwable(exception).workerId(workerId).build());

		if (failures > getMaximumConsecutiveRestartFailures()) {
			giveUp(workerId, exception);
			return;
		}

		scheduleLaunch(workerId);
	}

	private void didDetectWorkerExit(@NonNull Integer workerId,
																	 @NonNull Process process) {
		this.processesByWorkerId.remove(workerId, process);

		if (this.stopping)
			return;

		Integer exitCode = process.exitValue();

		logEvent(LogEvent.with(LogEventType.WORKER_EXITED, format("Worker %d (pid %d) exited with code %d; restarting in %s",
				workerId, process.pid(), exitCode, getWorkerRestartDelay())).workerId(workerId).build());

		try {
			getLifecycleObserver().didDetectWorkerExit(workerId, process.pid(), exitCode);
		} catch (Throwable t) {
			logObserverFailure("didDetectWorkerExit", t);
		}

		scheduleLaunch(workerId);
	}

	private void scheduleLaunch(@NonNull Integer workerId) {
		ScheduledThreadPoolExecutor restartExecutor = this.restartExecutor;

		if (this.stopping || restartExecutor == null)
			return;

		try {
			restartExecutor.schedule(() -> launchWorker(workerId), getWorkerRestartDelay().toMillis(), TimeUnit.MILLISECONDS);
		} catch (RejectedExecutionException e) {
			logger.log(Level.FINE, format("Not restarting worker %d, supervisor is stopping", workerId), e);
		}
	}

	private void giveUp(@NonNull Integer workerId,
											@NonNull Throwable throwable) {
		logEvent(LogEvent.with(LogEventType.WORKER_RESTART_LIMIT_EXCEEDED,
				format("Worker %d could not be restarted after %d consecutive failures; stopping all workers",
						workerId, this.consecutiveLaunchFailures.get())).throwable(throwable).workerId(workerId).build());

		try {
			getLifecycleObserver().didFailToRestartWorker(workerId, throwable);
		} catch (Throwable t) {
			logObserverFailure("didFailToRestartWorker", t);
		}

		this.failure.compareAndSet(null, throwable);

		// Off-thread: the caller may hold the lock and stop() waits on worker exit
		Thread thread = new Thread(() -> {
			stop();
			this.failureHandler.accept(throwable);
		}, "kiln-worker-supervisor-failure");

		thread.setDaemon(true);
		thread.start();
	}

	private void logEvent(@NonNull LogEvent logEvent) {
		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable t) {
			logger.log(Level.WARNING, format("%s::didReceiveLogEvent failed for %s", LifecycleObserver.class.getSimpleName(), logEvent), t);
		}
	}

	private void logObserverFailure(@NonNull String methodName,
																	@NonNull Throwable throwable) {
		logEvent(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
				format("%s::%s failed", LifecycleObserver.class.getSimpleName(), methodName)).throwable(throwable).build());
	}

	/**
	 * Process ids of the workers currently running, keyed by worker id.
	 */
	@NonNull
	public Map<Integer, Long> getWorkerPids() {
		Map<Integer, Long> workerPids = new TreeMap<>();

		for (Map.Entry<Integer, Process> entry : this.processesByWorkerId.entrySet())
			if (entry.getValue().isAlive())
				workerPids.put(entry.getKey(), entry.getValue().pid());

		return Collections.unmodifiableMap(workerPids);
	}

	/**
	 * The launch failure which made this supervisor give up, if it has.
	 */
	@NonNull
	public Optional<Throwable> getFailure() {
		return Optional.ofNullable(this.failure.get());
	}

	@NonNull
	public Boolean isStopping() {
		return this.stopping;
	}

	@NonNull
	public Integer getWorkerCount() {
		return this.workerCount;
	}

	@NonNull
	public WorkerLauncher getWorkerLauncher() {
		return this.workerLauncher;
	}

	@NonNull
	public Duration getWorkerRestartDelay() {
		return this.workerRestartDelay;
	}

	@NonNull
	public Integer getMaximumConsecutiveRestartFailures() {
		return this.maximumConsecutiveRestartFailures;
	}

	@NonNull
	public Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	private LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	/**
	 * Builder used to construct instances of {@link WorkerSupervisor}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final WorkerLauncher workerLauncher;
		@Nullable
		private Integer workerCount;
		@Nullable
		private Duration workerRestartDelay;
		@Nullable
		private Integer maximumConsecutiveRestartFailures;
		@Nullable
		private Duration shutdownTimeout;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private Consumer<Throwable> failureHandler;

		private Builder(@NonNull WorkerLauncher workerLauncher) {
			requireNonNull(workerLauncher);
			this.workerLauncher = workerLauncher;
		}

		@NonNull
		public Builder workerCount(@Nullable Integer workerCount) {
			this.workerCount = workerCount;
			return this;
		}

		@NonNull
		public Builder workerRestartDelay(@Nullable Duration workerRestartDelay) {
			this.workerRestartDelay = workerRestartDelay;
			return this;
		}

		@NonNull
		public Builder maximumConsecutiveRestartFailures(@Nullable Integer maximumConsecutiveRestartFailures) {
			this.maximumConsecutiveRestartFailures = maximumConsecutiveRestartFailures;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		/**
		 * Called, after all workers have been stopped, when the supervisor gives up restarting a worker.
		 */
		@NonNull
		public Builder failureHandler(@Nullable Consumer<Throwable> failureHandler) {
			this.failureHandler = failureHandler;
			return this;
		}

		@NonNull
		public WorkerSupervisor build() {
			return new WorkerSupervisor(this);
		}
	}
}
