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

package com.kiln.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import com.kiln.Kiln;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogManager;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getILoggerFactory;

/**
 * Routes Kiln's {@code java.util.logging} output to Logback.
 * <p>
 * Before the configuration file is read, the Logback context property {@value #WORKER_ID_PROPERTY} is set to the
 * current worker id, or {@code parent} outside a worker process, so patterns can use {@code %property{kiln.workerId}}
 * to tell worker output apart.
 * <p>
 * Logback and {@code jul-to-slf4j} are optional dependencies; applications which call these methods must put them on
 * the classpath.
 */
@ThreadSafe
public final class LoggingUtils {
	@NonNull
	public static final String WORKER_ID_PROPERTY = "kiln.workerId";

	@NonNull
	private static final Object LOCK = new Object();
	// JUL root handlers detached while the bridge is installed.
	@GuardedBy("LOCK")
	@NonNull
	private static final List<Handler> DETACHED_HANDLERS = new ArrayList<>();

	public enum LogbackOption {
		DEBUGGING_ENABLED
	}

	private LoggingUtils() {
		// Non-instantiable
	}

	/**
	 * Configures Logback from {@code logbackConfigurationFile} and bridges all JUL logging to SLF4J.
	 *
	 * @throws IllegalArgumentException if the file does not exist or is not a regular file
	 * @throws IllegalStateException    if Logback rejects the configuration
	 */
	public static void initializeLogback(@NonNull Path logbackConfigurationFile,
																			 @Nullable LogbackOption... logbackOptions) {
		requireNonNull(logbackConfigurationFile);

		Path absolutePath = logbackConfigurationFile.toAbsolutePath();

		if (!Files.isRegularFile(absolutePath))
			throw new IllegalArgumentException(format("Cannot configure Logback from %s: %s", absolutePath,
					Files.exists(absolutePath) ? "not a regular file" : "no such file"));

		boolean debugging = logbackOptions != null && Arrays.asList(logbackOptions).contains(LogbackOption.DEBUGGING_ENABLED);

		synchronized (LOCK) {
			uninstallLogback();

			LoggerContext loggerContext = (LoggerContext) getILoggerFactory();
			loggerContext.reset();
			loggerContext.putProperty(WORKER_ID_PROPERTY, currentWorkerId());

			JoranConfigurator configurator = new JoranConfigurator();
			configurator.setContext(loggerContext);

			try {
				configurator.doConfigure(absolutePath.toFile());
			} catch (JoranException e) {
				throw new IllegalStateException(format("Logback rejected the configuration at %s", absolutePath), e);
			}

			if (debugging)
				StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);

			java.util.logging.Logger rootLogger = LogManager.getLogManager().getLogger("");

			for (Handler handler : rootLogger.getHandlers()) {
				rootLogger.removeHandler(handler);
				DETACHED_HANDLERS.add(handler);
			}

			SLF4JBridgeHandler.install();
		}
	}

	/**
	 * Removes the SLF4J bridge and gives JUL back the root handlers it had before {@link #initializeLogback}.
	 */
	public static void uninstallLogback() {
		synchronized (LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();

			java.util.logging.Logger rootLogger = LogManager.getLogManager().getLogger("");

			for (Handler handler : DETACHED_HANDLERS)
				rootLogger.addHandler(handler);

			DETACHED_HANDLERS.clear();
		}
	}

	@NonNull
	public static Boolean isLogbackInstalled() {
		synchronized (LOCK) {
			return SLF4JBridgeHandler.isInstalled();
		}
	}

	@NonNull
	static String currentWorkerId() {
		String workerId = System.getenv(Kiln.WORKER_ID_ENVIRONMENT_VARIABLE);
		return workerId == null || workerId.isBlank() ? "parent" : workerId.trim();
	}
}
