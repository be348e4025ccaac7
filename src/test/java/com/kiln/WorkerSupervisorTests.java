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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class WorkerSupervisorTests {
	@Test
	public void launchesEveryWorker() {
		FakeLauncher launcher = new FakeLauncher(false);
		WorkerSupervisor workerSupervisor = WorkerSupervisor.withWorkerLauncher(launcher)
				.workerCount(3)
				.build();

		workerSupervisor.start();

		try {
			assertEquals(List.of(1, 2, 3), launcher.getLaunchedWorkerIds());
			assertEquals(3, workerSupervisor.getWorkerPids().size());
			assertThrows(IllegalStateException.class, workerSupervisor::start);
		} finally {
			workerSupervisor.stop();
		}
	}

	@Test
	public void exitedWorkerIsRestartedUnderItsOwnId() throws Exception {
		FakeLauncher launcher = new FakeLauncher(false);
		CountDownLatch restarted = new CountDownLatch(3);
		List<String> observed = new CopyOnWriteArrayList<>();

		WorkerSupervisor workerSupervisor = WorkerSupervisor.withWorkerLauncher(launcher)
				.workerCount(2)
				.workerRestartDelay(Duration.ofMillis(10))
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didStartWorker(Integer workerId, Long pid) {
						observed.add("start " + workerId);
						restarted.countDown();
					}

					@Override
					public void didDetectWorkerExit(Integer workerId, Long pid, Integer exitCode) {
						observed.add("exit " + workerId + " code " + exitCode);
					}
				})
				.build();

		workerSupervisor.start();

		try {
			FakeProcess first = launcher.getProcesses().get(0);
			first.exit(3);

			assertTrue(restarted.await(5, TimeUnit.SECONDS));
			assertEquals(List.of("start 1", "start 2", "exit 1 code 3", "start 1"), observed);
			assertEquals(List.of(1, 2, 1), launcher.getLaunchedWorkerIds());

			Map<Integer, Long> workerPids = workerSupervisor.getWorkerPids();
			assertEquals(2, workerPids.size());
			assertEquals(launcher.getProcesses().get(2).pid(), workerPids.get(1));
		} finally {
			workerSupervisor.stop();
		}
	}

	@Test
	public void transientLaunchFailuresAreRetried() throws Exception {
		AtomicInteger attempts = new AtomicInteger();
		CountDownLatch launched = new CountDownLatch(1);
		AtomicReference<Throwable> failure = new AtomicReference<>();

		WorkerSupervisor workerSupervisor = WorkerSupervisor.withWorkerLauncher(workerId -> {
					if (attempts.incrementAndGet() <= 2)
						throw new IOException("fork failed");

					launched.countDown();
					return new FakeProcess(100L, false);
				})
				.workerRestartDelay(Duration.ofMillis(10))
				.maximumConsecutiveRestartFailures(2)
				.failureHandler(failure::set)
				.build();

		workerSupervisor.start();

		try {
			assertTrue(launched.await(5, TimeUnit.SECONDS));
			assertEquals(3, attempts.get());
			assertTrue(workerSupervisor.getFailure().isEmpty());
			assertNull(failure.get());
		} finally {
			workerSupervisor.stop();
		}
	}

	@Test
	public void givesUpAfterTooManyConsecutiveFailures() throws Exception {
		AtomicInteger attempts = new AtomicInteger();
		CompletableFuture<Throwable> failure = new CompletableFuture<>();
		AtomicReference<Integer> failedWorkerId = new AtomicReference<>();
		IOException launchFailure = new IOException("no more processes");

		WorkerSupervisor workerSupervisor = WorkerSupervisor.withWorkerLauncher(workerId -> {
					attempts.incrementAndGet();
					throw launchFailure;
				})
				.workerRestartDelay(Duration.ofMillis(10))
				.maximumConsecutiveRestartFailures(2)
				.failureHandler(failure::complete)
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didFailToRestartWorker(Integer workerId, Throwable throwable) {
						failedWorkerId.set(workerId);
					}
				})
				.build();

		workerSupervisor.start();

		assertSame(launchFailure, failure.get(5, TimeUnit.SECONDS));
		assertEquals(3, attempts.get());
		assertEquals(1, failedWorkerId.get());
		assertSame(launchFailure, workerSupervisor.getFailure().orElseThrow());
		assertTrue(workerSupervisor.isStopping());

		// Nothing is relaunched once the supervisor has given up
		Thread.sleep(100);
		assertEquals(3, attempts.get());
	}

	@Test
	public void stopTerminatesWorkersAndSuppressesRestarts() throws Exception {
		FakeLauncher launcher = new FakeLauncher(false);
		WorkerSupervisor workerSupervisor = WorkerSupervisor.withWorkerLauncher(launcher)
				.workerCount(2)
				.workerRestartDelay(Duration.ofMillis(10))
				.build();

		workerSupervisor.start();
		workerSupervisor.stop();

		for (FakeProcess process : launcher.getProcesses()) {
			assertTrue(process.isDestroyed());
			assertFalse(process.isAlive());
			assertFalse(process.isDestroyedForcibly());
		}

		Thread.sleep(100);

		assertEquals(2, launcher.getLaunchedWorkerIds().size());
		assertTrue(workerSupervisor.getWorkerPids().isEmpty());

		// Idempotent
		workerSupervisor.stop();
	}

	@Test
	public void stubbornWorkersAreKilledAfterTheShutdownTimeout() {
		FakeLauncher launcher = new FakeLauncher(true);
		WorkerSupervisor workerSupervisor = WorkerSupervisor.withWorkerLauncher(launcher)
				.shutdownTimeout(Duration.ofMillis(100))
				.build();

		workerSupervisor.start();
		workerSupervisor.stop();

		FakeProcess process = launcher.getProcesses().get(0);

		assertTrue(process.isDestroyed());
		assertTrue(process.isDestroyedForcibly());
		assertFalse(process.isAlive());
	}

	@Test
	public void illegalSettingsAreRejected() {
		FakeLauncher launcher = new FakeLauncher(false);

		assertThrows(IllegalArgumentException.class, () -> WorkerSupervisor.withWorkerLauncher(launcher).workerCount(0).build());
		assertThrows(IllegalArgumentException.class, () -> WorkerSupervisor.withWorkerLauncher(launcher).workerRestartDelay(Duration.ofMillis(-1)).build());
		assertThrows(IllegalArgumentException.class, () -> WorkerSupervisor.withWorkerLauncher(launcher).maximumConsecutiveRestartFailures(-1).build());
	}

	private static final class FakeLauncher implements WorkerLauncher {
		private final boolean ignoresDestroy;
		private final AtomicLong nextPid;
		private final List<Integer> launchedWorkerIds;
		private final List<FakeProcess> processes;

		FakeLauncher(boolean ignoresDestroy) {
			this.ignoresDestroy = ignoresDestroy;
			this.nextPid = new AtomicLong(1000);
			this.launchedWorkerIds = new CopyOnWriteArrayList<>();
			this.processes = new CopyOnWriteArrayList<>();
		}

		@Override
		public Process launch(Integer workerId) {
			FakeProcess process = new FakeProcess(this.nextPid.incrementAndGet(), this.ignoresDestroy);
			this.launchedWorkerIds.add(workerId);
			this.processes.add(process);
			return process;
		}

		List<Integer> getLaunchedWorkerIds() {
			return this.launchedWorkerIds;
		}

		List<FakeProcess> getProcesses() {
			return this.processes;
		}
	}

	/**
	 * A process whose lifetime the test controls.
	 */
	private static final class FakeProcess extends Process {
		private final long pid;
		private final boolean ignoresDestroy;
		private final CompletableFuture<Process> exit;
		private volatile int exitCode;
		private volatile boolean destroyed;
		private volatile boolean destroyedForcibly;

		FakeProcess(long pid, boolean ignoresDestroy) {
			this.pid = pid;
			this.ignoresDestroy = ignoresDestroy;
			this.exit = new CompletableFuture<>();
		}

		void exit(int exitCode) {
			this.exitCode = exitCode;
			this.exit.complete(this);
		}

		boolean isDestroyed() {
			return this.destroyed;
		}

		boolean isDestroyedForcibly() {
			return this.destroyedForcibly;
		}

		@Override
		public OutputStream getOutputStream() {
			return OutputStream.nullOutputStream();
		}

		@Override
		public InputStream getInputStream() {
			return InputStream.nullInputStream();
		}

		@Override
		public InputStream getErrorStream() {
			return InputStream.nullInputStream();
		}

		@Override
		public int waitFor() throws InterruptedException {
			try {
				this.exit.get();
			} catch (ExecutionException e) {
				throw new IllegalStateException(e);
			}

			return this.exitCode;
		}

		@Override
		public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
			try {
				this.exit.get(timeout, unit);
				return true;
			} catch (TimeoutException e) {
				return false;
			} catch (ExecutionException e) {
				throw new IllegalStateException(e);
			}
		}

		@Override
		public int exitValue() {
			if (!this.exit.isDone())
				throw new IllegalThreadStateException("Process has not exited");

			return this.exitCode;
		}

		@Override
		public void destroy() {
			this.destroyed = true;

			if (!this.ignoresDestroy)
				exit(143);
		}

		@Override
		public Process destroyForcibly() {
			this.destroyedForcibly = true;
			exit(137);
			return this;
		}

		@Override
		public boolean isAlive() {
			return !this.exit.isDone();
		}

		@Override
		public long pid() {
			return this.pid;
		}

		@Override
		public CompletableFuture<Process> onExit() {
			return this.exit;
		}
	}
}
