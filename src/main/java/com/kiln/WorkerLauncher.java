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

import java.io.IOException;

/**
 * Starts one worker process.  Used by {@link WorkerSupervisor} for the initial launch and for every restart.
 * <p>
 * The launched process is expected to run the application's {@code main} method, which in turn calls
 * {@link Kiln#start()}.  Kiln recognizes it as a worker through the {@value Kiln#WORKER_ID_ENVIRONMENT_VARIABLE}
 * environment variable, which implementations must set to {@code workerId}.
 */
@FunctionalInterface
public interface WorkerLauncher {
	/**
	 * Launches worker {@code workerId}.
	 *
	 * @param workerId the worker's id, starting at {@code 1}
	 * @return the running process
	 * @throws IOException if the process could not be started
	 */
	@NonNull
	Process launch(@NonNull Integer workerId) throws IOException;
}
