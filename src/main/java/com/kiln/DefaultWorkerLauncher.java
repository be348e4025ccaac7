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
import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Launches workers as child JVMs: {@code java [jvmArguments] -cp <classpath> <mainClass> [arguments]}, using the
 * running JVM's {@code java} executable.  Children inherit standard input, output and error.
 */
@ThreadSafe
public final class DefaultWorkerLauncher implements WorkerLauncher {
	@NonNull
	private static final Logger logger;

	static {
		logger = Logger.getLogger(DefaultWorkerLauncher.class.getName());
	}

	@NonNull
	private final String mainClassName;
	@NonNull
	private final List<String> arguments;
	@NonNull
	private final List<String> jvmArguments;
	@NonNull
	private final String classpath;
	@NonNull
	private final Path javaExecutable;

	@NonNull
	public static Builder withMainClass(@NonNull Class<?> mainClass) {
		requireNonNull(mainClass);
		return new Builder(mainClass.getName());
	}

	@NonNull
	public static Builder withMainClassName(@NonNull String mainClassName) {
		requireNonNull(mainClassName);
		return new Builder(mainClassName);
	}

	/**
	 * A launcher which re-runs the current JVM's main class with the same arguments and JVM options.
	 * <p>
	 * Debugger agent options are not passed on, since every child would try to bind the same debug port.
	 *
	 * @return the launcher
	 * @throws IllegalStateException if the main class cannot be determined, for example under {@code java -jar}
	 */
	@NonNull
	public static DefaultWorkerLauncher fromCurrentProcess() {
		String command = System.getProperty("sun.java.command");

		if (command == null || command.isBlank())
			throw new IllegalStateException("Unable to determine the main class of this JVM");

		List<String> commandTokens = Arrays.asList(command.trim().split("\\s+"));
		String mainClassName = commandTokens.get(0);

		if (mainClassName.endsWith(".jar"))
			throw new IllegalStateException(format("This JVM was started from %s; use %s#withMainClass instead",
					mainClassName, DefaultWorkerLauncher.class.getSimpleName()));

		List<String> jvmArguments = new ArrayList<>();

		for (String jvmArgument : ManagementFactory.getRuntimeMXBean().getInputArguments())
			if (!jvmArgument.startsWith("-agentlib:jdwp") && !jvmArgument.startsWith("-Xrunjdwp"))
				jvmArguments.add(jvmArgument);

		return withMainClassName(mainClassName)
				.arguments(commandTokens.subList(1, commandTokens.size()))
				.jvmArguments(jvmArguments)
				.build();
	}

	private DefaultWorkerLauncher(@NonNull Builder builder) {
		requireNonNull(builder);

		this.mainClassName = builder.mainClassName;
		this.arguments = builder.arguments == null ? List.of() : List.copyOf(builder.arguments);
		this.jvmArguments = builder.jvmArguments == null ? List.of() : List.copyOf(builder.jvmArguments);
		this.classpath = builder.classpath == null ? System.getProperty("java.class.path") : builder.classpath;
		this.javaExecutable = Path.of(System.getProperty("java.home"), "bin", "java");
	}

	@Override
	@NonNull
	public Process launch(@NonNull Integer workerId) throws IOException {
		requireNonNull(workerId);

		List<String> command = new ArrayList<>();
		command.add(getJavaExecutable().toString());
		command.addAll(getJvmArguments());
		command.add("-cp");
		command.add(getClasspath());
		command.add(getMainClassName());
		command.addAll(getArguments());

		ProcessBuilder processBuilder = new ProcessBuilder(command).inheritIO();
		processBuilder.environment().put(Kiln.WORKER_ID_ENVIRONMENT_VARIABLE, String.valueOf(workerId));

		if (logger.isLoggable(Level.FINER))
			logger.finer(format("Launching worker %d: %s", workerId, String.join(" ", command)));

		return processBuilder.start();
	}

	@NonNull
	public String getMainClassName() {
		return this.mainClassName;
	}

	@NonNull
	public List<String> getArguments() {
		return this.arguments;
	}

	@NonNull
	public List<String> getJvmArguments() {
		return this.jvmArguments;
	}

	@NonNull
	public String getClasspath() {
		return this.classpath;
	}

	@NonNull
	public Path getJavaExecutable() {
		return this.javaExecutable;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{mainClassName=%s, arguments=%s}", getClass().getSimpleName(), getMainClassName(), getArguments());
	}

	/**
	 * Builder used to construct instances of {@link DefaultWorkerLauncher}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String mainClassName;
		@Nullable
		private List<String> arguments;
		@Nullable
		private List<String> jvmArguments;
		@Nullable
		private String classpath;

		private Builder(@NonNull String mainClassName) {
			requireNonNull(mainClassName);
			this.mainClassName = mainClassName;
		}

		@NonNull
		public Builder arguments(@Nullable List<String> arguments) {
			this.arguments = arguments;
			return this;
		}

		@NonNull
		public Builder jvmArguments(@Nullable List<String> jvmArguments) {
			this.jvmArguments = jvmArguments;
			return this;
		}

		/**
		 * Defaults to the {@code java.class.path} of the running JVM.
		 */
		@NonNull
		public Builder classpath(@Nullable String classpath) {
			this.classpath = classpath;
			return this;
		}

		@NonNull
		public DefaultWorkerLauncher build() {
			return new DefaultWorkerLauncher(this);
		}
	}
}
