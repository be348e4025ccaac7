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

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
@Timeout(value = 120, unit = TimeUnit.SECONDS)
public class DefaultWorkerLauncherTests {
	@Test
	public void launchesChildJvmWithWorkerId() throws Exception {
		DefaultWorkerLauncher launcher = DefaultWorkerLauncher.withMainClass(ExitWithWorkerId.class)
				.arguments(List.of("40"))
				.jvmArguments(List.of("-Xshare:auto"))
				.build();

		Process process = launcher.launch(3);

		assertTrue(process.waitFor(60, TimeUnit.SECONDS), "Worker did not exit");
		assertEquals(43, process.exitValue());
	}

	@Test
	public void supervisorRestartsRealProcesses() throws Exception {
		DefaultWorkerLauncher launcher = DefaultWorkerLauncher.withMainClass(ExitWithWorkerId.class)
				.arguments(List.of("0"))
				.build();

		CompletableFuture<Integer> exitCode = new CompletableFuture<>();
		CompletableFuture<Long> restartedPid = new CompletableFuture<>();

		WorkerSupervisor workerSupervisor = WorkerSupervisor.withWorkerLauncher(launcher)
				.workerRestartDelay(Duration.ofMillis(50))
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didStartWorker(Integer workerId, Long pid) {
						if (exitCode.isDone())
							restartedPid.complete(pid);
					}

					@Override
					public void didDetectWorkerExit(Integer workerId, Long pid, Integer code) {
						exitCode.complete(code);
					}
				})
				.build();

		workerSupervisor.start();

		try {
			assertEquals(1, exitCode.get(60, TimeUnit.SECONDS));
			assertTrue(restartedPid.get(60, TimeUnit.SECONDS) > 0);
		} finally {
			workerSupervisor.stop();
		}
	}

	/**
	 * Exits with the worker id plus the first argument.
	 */
	public static final class ExitWithWorkerId {
		public static void main(String[] args) {
			int workerId = Integer.parseInt(System.getenv(Kiln.WORKER_ID_ENVIRONMENT_VARIABLE));
			System.exit(workerId + Integer.parseInt(args[0]));
		}
	}
}
