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
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.kiln.TestSupport.bodyOf;
import static com.kiln.TestSupport.connectWithRetry;
import static com.kiln.TestSupport.readResponse;
import static com.kiln.TestSupport.statusCodeOf;
import static com.kiln.TestSupport.writeAscii;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs real worker JVMs which share a port through {@code SO_REUSEPORT}.
 */
@ThreadSafe
@DisabledOnOs(OS.WINDOWS)
public class WorkerProcessTests {
	@Test
	@Timeout(value = 120, unit = TimeUnit.SECONDS)
	public void survivingWorkersKeepServingWhileOneRestarts() throws Exception {
		int port = TestSupport.findFreePort();
		CountDownLatch workersStarted = new CountDownLatch(3);

		KilnConfig kilnConfig = KilnConfig.withRouteTable(ServingWorker.routeTable())
				.hostAddresses(List.of(HostAddress.of("127.0.0.1", port)))
				.workerCount(2)
				.workerLauncher(DefaultWorkerLauncher.withMainClass(ServingWorker.class)
						.arguments(List.of(String.valueOf(port)))
						.build())
				.workerRestartDelay(Duration.ofMillis(100))
				.shutdownTimeout(Duration.ofSeconds(10))
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didStartWorker(Integer workerId, Long pid) {
						workersStarted.countDown();
					}
				})
				.build();

		try (Kiln kiln = Kiln.withConfig(kilnConfig).build()) {
			kiln.start();

			assertTrue(kiln.getListenAddresses().isEmpty(), "Supervising process should not bind");

			WorkerSupervisor workerSupervisor = kiln.getWorkerSupervisor().orElseThrow();
			awaitServing(port);

			Map<Integer, Long> workerPids = workerSupervisor.getWorkerPids();
			assertEquals(2, workerPids.size());

			long killedPid = workerPids.get(1);
			ProcessHandle.of(killedPid).orElseThrow().destroyForcibly();

			// Connections that were queued on the killed worker may be reset, but the survivor keeps answering
			for (int i = 0; i < 5; ++i)
				assertNotEquals(String.valueOf(killedPid), requestPidWithRetry(port));

			assertTrue(workersStarted.await(60, TimeUnit.SECONDS), "Killed worker was not restarted");

			Map<Integer, Long> restartedWorkerPids = workerSupervisor.getWorkerPids();
			assertEquals(workerPids.get(2), restartedWorkerPids.get(2));
			assertFalse(restartedWorkerPids.containsValue(killedPid));
		}
	}

	private static void awaitServing(int port) throws Exception {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(60);

		// Both workers must be listening before one is killed
		while (System.nanoTime() < deadline) {
			try {
				requestPid(port);
				requestPid(port);
				Thread.sleep(500);
				return;
			} catch (IOException e) {
				Thread.sleep(100);
			}
		}

		throw new AssertionError("Workers never started serving");
	}

	private static String requestPidWithRetry(int port) throws Exception {
		IOException last = null;

		for (int attempt = 0; attempt < 20; ++attempt) {
			try {
				return requestPid(port);
			} catch (IOException e) {
				last = e;
				Thread.sleep(50);
			}
		}

		throw new AssertionError("No worker answered", last);
	}

	private static String requestPid(int port) throws Exception {
		try (Socket socket = connectWithRetry("127.0.0.1", port, 1_000)) {
			writeAscii(socket, "GET /pid HTTP/1.1\r\nHost: localhost\r\nConnection: close\r\n\r\n");
			String response = readResponse(socket.getInputStream());

			if (statusCodeOf(response) == null || statusCodeOf(response) != 200)
				throw new IOException("Unexpected response: " + response);

			return bodyOf(response);
		}
	}

	/**
	 * Worker process entry point: serves its own pid at {@code /pid} on the port given as the first argument.
	 */
	public static final class ServingWorker {
		static RouteTable routeTable() {
			return RouteTable.builder()
					.literal("/pid", PidAction.class)
					.build();
		}

		public static void main(String[] args) throws InterruptedException {
			KilnConfig kilnConfig = KilnConfig.withRouteTable(routeTable())
					.hostAddresses(List.of(HostAddress.of("127.0.0.1", Integer.parseInt(args[0]))))
					.build();

			try (Kiln kiln = Kiln.withConfig(kilnConfig).build()) {
				kiln.start();
				kiln.awaitShutdown();
			}
		}
	}

	public static class PidAction implements Action {
		@Override
		public void get(ActionContext context) {
			context.setContentType("text/plain; charset=UTF-8");
			context.composeHeaders();
			context.write(String.valueOf(ProcessHandle.current().pid()));
		}
	}
}
