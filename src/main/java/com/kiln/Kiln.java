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

import com.kiln.internal.reactor.MalformedRequestException;
import com.kiln.internal.reactor.Reactor;
import com.kiln.internal.reactor.ReactorListener;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Kiln's main class - manages the reactor or worker processes and routes requests to actions.
 * <p>
 * How {@link #start()} behaves depends on the process it runs in:
 * <ul>
 *   <li>With {@link KilnConfig#getWorkerCount()} {@code 0}, the reactor runs in this process.</li>
 *   <li>With a positive worker count, this process binds nothing.  It launches that many worker processes through a
 *   {@link WorkerSupervisor} and restarts any that exit.</li>
 *   <li>In a worker process, identified by the {@value #WORKER_ID_ENVIRONMENT_VARIABLE} environment variable, the
 *   reactor runs with {@code SO_REUSEPORT} on every listener so the kernel spreads connections across workers.
 *   Workers stop when their parent process exits.</li>
 * </ul>
 * <pre>{@code public static void main(String[] args) throws Exception {
 *   RouteTable routeTable = RouteTable.builder()
 *     .literal("/", IndexAction.class)
 *     .regex("/validate/(number:\\d+)/(word:\\w+)", ValidateAction.class)
 *     .build();
 *
 *   KilnConfig config = KilnConfig.withRouteTable(routeTable)
 *     .port(8080)
 *     .workerCount(4)
 *     .build();
 *
 *   try (Kiln kiln = Kiln.withConfig(config).build()) {
 *     kiln.start();
 *     kiln.awaitShutdown(ShutdownTrigger.ENTER_KEY);
 *   }
 * }}</pre>
 */
@ThreadSafe
public final class Kiln implements AutoCloseable {
	/**
	 * Environment variable which marks a process as worker {@code n} of a supervised group.
	 */
	@NonNull
	public static final String WORKER_ID_ENVIRONMENT_VARIABLE = "KILN_WORKER_ID";

	@NonNull
	private static final Logger logger;

	static {
		logger = Logger.getLogger(Kiln.class.getName());
	}

	@NonNull
	private final KilnConfig kilnConfig;
	@Nullable
	private final Integer workerId;
	@NonNull
	private final Router router;
	@NonNull
	private final ActionDispatcher actionDispatcher;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<CountDownLatch> awaitShutdownLatchReference;
	@NonNull
	private final AtomicReference<KilnClient> simulatorClientReference;
	@Nullable
	private volatile Reactor reactor;
	@Nullable
	private volatile WorkerSupervisor workerSupervisor;
	private volatile boolean started;

	/**
	 * Vends a builder for a Kiln instance with the given configuration.
	 *
	 * @param kilnConfig configuration that drives the Kiln system
	 * @return a builder for a Kiln instance
	 */
	@NonNull
	public static Builder withConfig(@NonNull KilnConfig kilnConfig) {
		requireNonNull(kilnConfig);
		return new Builder(kilnConfig);
	}

	private Kiln(@NonNull Builder builder) {
		requireNonNull(builder);

		this.kilnConfig = builder.kilnConfig;
		this.workerId = builder.workerId != null ? builder.workerId : workerIdFromEnvironment().orElse(null);
		this.router = new Router(this.kilnConfig.getRouteTable(), this.kilnConfig.getActionRegistry());
		this.actionDispatcher = new ActionDispatcher(this.router, this.kilnConfig.getResponseActions(),
				this.kilnConfig.getLifecycleObserver(), this.kilnConfig.getServerName(), this::newOutboundRequest);
		this.lock = new ReentrantLock();
		this.awaitShutdownLatchReference = new AtomicReference<>(new CountDownLatch(1));
		this.simulatorClientReference = new AtomicReference<>();
	}

	@NonNull
	private static Optional<Integer> workerIdFromEnvironment() {
		String workerId = System.getenv(WORKER_ID_ENVIRONMENT_VARIABLE);

		if (workerId == null || workerId.isBlank())
			return Optional.empty();

		try {
			return Optional.of(Integer.parseInt(workerId.trim()));
		} catch (NumberFormatException e) {
			throw new IllegalStateException(format("Illegal value '%s' for environment variable %s", workerId, WORKER_ID_ENVIRONMENT_VARIABLE), e);
		}
	}

	/**
	 * Starts serving, or starts the worker processes.
	 * <p>
	 * If Kiln is already started, this is a no-op.
	 */
	public void start() {
		this.lock.lock();

		try {
			if (this.started)
				return;

			this.awaitShutdownLatchReference.set(new CountDownLatch(1));

			LifecycleObserver lifecycleObserver = getKilnConfig().getLifecycleObserver();
			lifecycleObserver.willStartKiln(this);

			try {
				if (getWorkerId().isEmpty() && getKilnConfig().getWorkerCount() > 0)
					startWorkerSupervisor();
				else
					startReactor();

				this.started = true;
				lifecycleObserver.didStartKiln(this);
			} catch (Throwable t) {
				Reactor reactor = this.reactor;

				if (reactor != null)
					reactor.stop();

				WorkerSupervisor workerSupervisor = this.workerSupervisor;

				if (workerSupervisor != null)
					workerSupervisor.stop();

				this.reactor = null;
				this.workerSupervisor = null;

				lifecycleObserver.didFailToStartKiln(this, t);

				if (t instanceof RuntimeException)
					throw (RuntimeException) t;

				throw new RuntimeException(t);
			}
		} finally {
			this.lock.unlock();
		}
	}

	private void startWorkerSupervisor() {
		KilnConfig kilnConfig = getKilnConfig();
		WorkerLauncher workerLauncher = kilnConfig.getWorkerLauncher().orElseGet(DefaultWorkerLauncher::fromCurrentProcess);

		WorkerSupervisor workerSupervisor = WorkerSupervisor.withWorkerLauncher(workerLauncher)
				.workerCount(kilnConfig.getWorkerCount())
				.workerRestartDelay(kilnConfig.getWorkerRestartDelay())
				.maximumConsecutiveRestartFailures(kilnConfig.getMaximumConsecutiveWorkerRestartFailures())
				.shutdownTimeout(kilnConfig.getShutdownTimeout())
				.lifecycleObserver(kilnConfig.getLifecycleObserver())
				.failureHandler(throwable -> stop())
				.build();

		this.workerSupervisor = workerSupervisor;
		workerSupervisor.start();

		logger.info(format("Supervising %d workers for %s", kilnConfig.getWorkerCount(), kilnConfig.getHostAddresses()));
	}

	private void startReactor() throws IOException {
		KilnConfig kilnConfig = getKilnConfig();
		Integer workerId = getWorkerId().orElse(null);
		String threadName = workerId == null ? "kiln-reactor" : format("kiln-reactor-worker-%d", workerId);

		Reactor reactor = new Reactor(kilnConfig.toReactorOptions().withThreadName(threadName), new KilnReactorListener());
		this.reactor = reactor;

		for (HostAddress hostAddress : kilnConfig.getHostAddresses())
			reactor.listen(hostAddress.toInetSocketAddress(), workerId != null,
					(request, responseConsumer) -> getActionDispatcher().dispatch(request, responseConsumer));

		reactor.start();

		if (workerId == null) {
			logger.info(format("Listening on %s", reactor.listenAddresses()));
		} else {
			logger.info(format("Worker %d listening on %s", workerId, reactor.listenAddresses()));

			ProcessHandle.current().parent().ifPresent(parent -> parent.onExit().thenRun(() -> {
				logger.warning(format("Parent process %d exited, stopping worker %d", parent.pid(), workerId));
				stop();
			}));
		}
	}

	/**
	 * Stops serving, or stops every worker process.
	 * <p>
	 * If Kiln is already stopped, this is a no-op.
	 */
	public void stop() {
		this.lock.lock();

		try {
			if (this.started) {
				LifecycleObserver lifecycleObserver = getKilnConfig().getLifecycleObserver();
				lifecycleObserver.willStopKiln(this);

				WorkerSupervisor workerSupervisor = this.workerSupervisor;

				if (workerSupervisor != null)
					workerSupervisor.stop();

				Reactor reactor = this.reactor;

				if (reactor != null) {
					reactor.stop();

					if (!reactor.inReactorThread()) {
						try {
							if (!reactor.join(getKilnConfig().getShutdownTimeout()))
								logger.warning(format("Reactor did not stop within %s", getKilnConfig().getShutdownTimeout()));
						} catch (InterruptedException e) {
							Thread.currentThread().interrupt();
						}
					}
				}

				this.started = false;
				lifecycleObserver.didStopKiln(this);
			}
		} finally {
			try {
				this.awaitShutdownLatchReference.get().countDown();
			} finally {
				this.lock.unlock();
			}
		}
	}

	/**
	 * Blocks the current thread until {@link #stop()} is called, the worker supervisor gives up, or one of the
	 * provided {@code shutdownTriggers} occurs.  Then invokes {@link #stop()}.
	 * <p>
	 * {@link ShutdownTrigger#ENTER_KEY} is ignored when standard input is unusable, for example in a container without
	 * a TTY.
	 *
	 * @param shutdownTriggers trigger[s] which signal that shutdown should occur
	 * @throws InterruptedException if the current thread is interrupted while waiting
	 */
	public void awaitShutdown(@Nullable ShutdownTrigger... shutdownTriggers) throws InterruptedException {
		Set<ShutdownTrigger> shutdownTriggersAsSet = shutdownTriggers == null || shutdownTriggers.length == 0
				? EnumSet.noneOf(ShutdownTrigger.class) : EnumSet.copyOf(List.of(shutdownTriggers));
		Thread shutdownHook = null;

		try {
			if (shutdownTriggersAsSet.contains(ShutdownTrigger.ENTER_KEY))
				startEnterKeyListener();

			if (shutdownTriggersAsSet.contains(ShutdownTrigger.JVM_SHUTDOWN)) {
				shutdownHook = new Thread(this::stop, "kiln-shutdown-hook");
				Runtime.getRuntime().addShutdownHook(shutdownHook);
			}

			this.awaitShutdownLatchReference.get().await();
		} finally {
			if (shutdownHook != null) {
				try {
					Runtime.getRuntime().removeShutdownHook(shutdownHook);
				} catch (IllegalStateException e) {
					logger.log(Level.FINE, "JVM is already shutting down", e);
				}
			}
		}

		stop();
	}

	private void startEnterKeyListener() {
		try {
			if (System.in == null || System.in.available() < 0)
				return;
		} catch (IOException e) {
			logger.warning(format("Ignoring %s.%s: standard input is unusable in this environment",
					ShutdownTrigger.class.getSimpleName(), ShutdownTrigger.ENTER_KEY.name()));
			return;
		}

		Thread thread = new Thread(() -> {
			try {
				BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
				// A line or EOF both mean stop
				bufferedReader.readLine();
			} catch (IOException e) {
				logger.log(Level.FINE, "Standard input closed", e);
			}

			stop();
		}, "kiln-enter-key-listener");

		thread.setDaemon(true);
		thread.start();
	}

	/**
	 * Synonym for {@link #stop()}.
	 */
	@Override
	public void close() {
		stop();
		KilnClient simulatorClient = this.simulatorClientReference.getAndSet(null);

		if (simulatorClient != null)
			simulatorClient.close();
	}

	/**
	 * Runs Kiln without sockets: requests given to the {@link Simulator} go straight to the dispatcher.  Useful for
	 * integration testing.  Outbound requests made by actions run on a private client reactor which is closed when
	 * {@code simulatorConsumer} returns.
	 *
	 * @param kilnConfig        configuration that drives the Kiln system
	 * @param simulatorConsumer code to execute within the context of the simulator
	 */
	public static void runSimulator(@NonNull KilnConfig kilnConfig,
																	@NonNull Consumer<Simulator> simulatorConsumer) {
		requireNonNull(kilnConfig);
		requireNonNull(simulatorConsumer);

		Kiln kiln = Kiln.withConfig(kilnConfig).build();

		try {
			simulatorConsumer.accept(new DefaultSimulator(kiln));
		} finally {
			kiln.close();
		}
	}

	@NonNull
	private OutboundRequest newOutboundRequest(@NonNull String host,
																						 @NonNull Integer port) {
		Reactor reactor = this.reactor;

		if (reactor != null && reactor.isRunning())
			return new OutboundRequest(reactor, host, port, getKilnConfig().getOutboundRequestTimeout(), getActionDispatcher()::logEvent);

		if (reactor == null && !this.started) {
			KilnClient simulatorClient = this.simulatorClientReference.updateAndGet(existingClient -> existingClient != null
					? existingClient : KilnClient.fromConfig(getKilnConfig()));
			return simulatorClient.newRequest(host, port);
		}

		throw new IllegalStateException("Outbound requests require a running reactor");
	}

	@NonNull
	public Boolean isStarted() {
		return this.started;
	}

	/**
	 * Addresses actually bound by this process, which differ from the configured ones when port {@code 0} is used.
	 * Empty when this process does not run a reactor.
	 */
	@NonNull
	public List<InetSocketAddress> getListenAddresses() {
		Reactor reactor = this.reactor;
		return reactor == null ? List.of() : reactor.listenAddresses();
	}

	/**
	 * This process's worker id, if it is a supervised worker.
	 */
	@NonNull
	public Optional<Integer> getWorkerId() {
		return Optional.ofNullable(this.workerId);
	}

	/**
	 * The supervisor, if this process supervises workers.
	 */
	@NonNull
	public Optional<WorkerSupervisor> getWorkerSupervisor() {
		return Optional.ofNullable(this.workerSupervisor);
	}

	/**
	 * The router, whose route table can be replaced at runtime via {@link Router#reload(RouteTable)}.
	 */
	@NonNull
	public Router getRouter() {
		return this.router;
	}

	@NonNull
	public KilnConfig getKilnConfig() {
		return this.kilnConfig;
	}

	@NonNull
	ActionDispatcher getActionDispatcher() {
		return this.actionDispatcher;
	}

	/**
	 * Translates reactor callbacks into lifecycle notifications and log events.
	 */
	@ThreadSafe
	private final class KilnReactorListener implements ReactorListener {
		@Override
		public void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			try {
				getKilnConfig().getLifecycleObserver().didAcceptConnection(remoteAddress);
			} catch (Throwable t) {
				logObserverFailure("didAcceptConnection", t);
			}
		}

		@Override
		public void didCloseConnection(@Nullable InetSocketAddress remoteAddress) {
			try {
				getKilnConfig().getLifecycleObserver().didCloseConnection(remoteAddress);
			} catch (Throwable t) {
				logObserverFailure("didCloseConnection", t);
			}
		}

		@Override
		public void didRejectConnection(@Nullable InetSocketAddress remoteAddress) {
			logger.fine(format("Rejected connection from %s: limit of %d connections reached", remoteAddress, getKilnConfig().getMaximumConnections()));
		}

		@Override
		public void didRejectMalformedRequest(@Nullable InetSocketAddress remoteAddress,
																					@NonNull MalformedRequestException exception) {
			getActionDispatcher().logEvent(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST,
					format("Rejected request from %s with status %d: %s", remoteAddress, exception.getStatusCode().getStatusCode(), exception.getMessage()))
					.throwable(exception)
					.workerId(Kiln.this.workerId)
					.build());
		}

		@Override
		public void didTimeOutResponse(@Nullable InetSocketAddress remoteAddress,
																	 @NonNull Request request) {
			getActionDispatcher().logEvent(LogEvent.with(LogEventType.RESPONSE_TIMED_OUT,
					format("No response to %s %s from %s within %s, answered 503", request.getMethodToken(), request.getPath(),
							remoteAddress, getKilnConfig().getResponseTimeout()))
					.request(request)
					.workerId(Kiln.this.workerId)
					.build());
		}

		@Override
		public void didFailUnexpectedly(@NonNull String message,
																		@NonNull Throwable throwable) {
			getActionDispatcher().logEvent(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, message)
					.throwable(throwable)
					.workerId(Kiln.this.workerId)
					.build());
		}

		private void logObserverFailure(@NonNull String methodName,
																		@NonNull Throwable throwable) {
			getActionDispatcher().logEvent(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
					format("%s::%s failed", LifecycleObserver.class.getSimpleName(), methodName)).throwable(throwable).build());
		}
	}

	/**
	 * Builder used to construct instances of {@link Kiln} via {@link Kiln#withConfig(KilnConfig)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final KilnConfig kilnConfig;
		@Nullable
		private Integer workerId;

		private Builder(@NonNull KilnConfig kilnConfig) {
			requireNonNull(kilnConfig);
			this.kilnConfig = kilnConfig;
		}

		/**
		 * Runs as worker {@code workerId} regardless of the {@value Kiln#WORKER_ID_ENVIRONMENT_VARIABLE} environment
		 * variable.
		 */
		@NonNull
		public Builder workerId(@Nullable Integer workerId) {
			this.workerId = workerId;
			return this;
		}

		@NonNull
		public Kiln build() {
			return new Kiln(this);
		}
	}

	@ThreadSafe
	static final class DefaultSimulator implements Simulator {
		@NonNull
		private final Kiln kiln;

		DefaultSimulator(@NonNull Kiln kiln) {
			requireNonNull(kiln);
			this.kiln = kiln;
		}

		@Override
		@NonNull
		public MarshaledResponse performRequest(@NonNull Request request) {
			requireNonNull(request);

			CompletableFuture<MarshaledResponse> response = new CompletableFuture<>();
			this.kiln.getActionDispatcher().dispatch(request, response::complete);

			Duration timeout = this.kiln.getKilnConfig().getOutboundRequestTimeout().plus(this.kiln.getKilnConfig().getShutdownTimeout());

			try {
				return response.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException("Interrupted while waiting for a response", e);
			} catch (ExecutionException e) {
				throw new IllegalStateException("Request handling failed", e.getCause());
			} catch (TimeoutException e) {
				throw new IllegalStateException(format("No response to %s %s within %s; was a deferred response never finished?",
						request.getMethodToken(), request.getPath(), timeout), e);
			}
		}

		@Override
		@NonNull
		public Router getRouter() {
			return this.kiln.getRouter();
		}
	}
}
