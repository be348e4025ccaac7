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

import com.kiln.internal.reactor.ReactorOptions;
import com.kiln.util.PropertiesFileReader;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Defines how a Kiln system is configured.
 * <p>
 * Threadsafe instances can be acquired via the {@link #withRouteTable(RouteTable)} builder factory method.  Use
 * {@link #copy()} to derive a modified configuration from an existing one.
 */
@ThreadSafe
public final class KilnConfig {
	@NonNull
	public static final List<HostAddress> DEFAULT_HOST_ADDRESSES;
	@NonNull
	public static final Integer DEFAULT_WORKER_COUNT;
	@NonNull
	public static final String DEFAULT_SERVER_NAME;
	@NonNull
	public static final Duration DEFAULT_IDLE_TIMEOUT;
	@NonNull
	public static final Duration DEFAULT_OUTBOUND_REQUEST_TIMEOUT;
	@NonNull
	public static final Duration DEFAULT_SOCKET_SELECT_TIMEOUT;
	@NonNull
	public static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@NonNull
	public static final Duration DEFAULT_WORKER_RESTART_DELAY;
	@NonNull
	public static final Integer DEFAULT_MAXIMUM_CONSECUTIVE_WORKER_RESTART_FAILURES;
	@NonNull
	public static final Integer DEFAULT_MAXIMUM_REQUEST_LINE_SIZE_IN_BYTES;
	@NonNull
	public static final Integer DEFAULT_MAXIMUM_HEADER_SIZE_IN_BYTES;
	@NonNull
	public static final Integer DEFAULT_MAXIMUM_BODY_SIZE_IN_BYTES;
	@NonNull
	public static final Integer DEFAULT_MAXIMUM_CONNECTIONS;
	@NonNull
	public static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@NonNull
	public static final Integer DEFAULT_MAXIMUM_OUTBOUND_RESPONSE_SIZE_IN_BYTES;
	@NonNull
	public static final Integer DEFAULT_MAXIMUM_PERSISTENT_REQUESTS;
	@NonNull
	public static final Duration DEFAULT_RESPONSE_TIMEOUT;

	static {
		DEFAULT_HOST_ADDRESSES = List.of(HostAddress.of("0.0.0.0", 8080));
		DEFAULT_WORKER_COUNT = 0;
		DEFAULT_SERVER_NAME = "Kiln";
		DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(60);
		DEFAULT_OUTBOUND_REQUEST_TIMEOUT = Duration.ofSeconds(30);
		DEFAULT_SOCKET_SELECT_TIMEOUT = Duration.ofMillis(100);
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
		DEFAULT_WORKER_RESTART_DELAY = Duration.ofSeconds(1);
		DEFAULT_MAXIMUM_CONSECUTIVE_WORKER_RESTART_FAILURES = 5;
		DEFAULT_MAXIMUM_REQUEST_LINE_SIZE_IN_BYTES = 1_024 * 8;
		DEFAULT_MAXIMUM_HEADER_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_MAXIMUM_BODY_SIZE_IN_BYTES = 1_024 * 1_024 * 10;
		DEFAULT_MAXIMUM_CONNECTIONS = 0;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_MAXIMUM_OUTBOUND_RESPONSE_SIZE_IN_BYTES = 1_024 * 1_024 * 10;
		DEFAULT_MAXIMUM_PERSISTENT_REQUESTS = 0;
		DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(60);
	}

	@NonNull
	private final RouteTable routeTable;
	@NonNull
	private final ActionRegistry actionRegistry;
	@NonNull
	private final ResponseActions responseActions;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final List<HostAddress> hostAddresses;
	@NonNull
	private final Integer workerCount;
	@Nullable
	private final WorkerLauncher workerLauncher;
	@NonNull
	private final String serverName;
	@NonNull
	private final Duration idleTimeout;
	@NonNull
	private final Duration outboundRequestTimeout;
	@NonNull
	private final Duration socketSelectTimeout;
	@NonNull
	private final Duration shutdownTimeout;
	@NonNull
	private final Duration workerRestartDelay;
	@NonNull
	private final Integer maximumConsecutiveWorkerRestartFailures;
	@NonNull
	private final Integer maximumRequestLineSizeInBytes;
	@NonNull
	private final Integer maximumHeaderSizeInBytes;
	@NonNull
	private final Integer maximumBodySizeInBytes;
	@NonNull
	private final Integer maximumConnections;
	@NonNull
	private final Integer requestReadBufferSizeInBytes;
	@NonNull
	private final Integer maximumOutboundResponseSizeInBytes;
	@NonNull
	private final Integer maximumPersistentRequests;
	@NonNull
	private final Duration responseTimeout;

	/**
	 * Vends a configuration builder, primed with the given {@link RouteTable}.
	 *
	 * @param routeTable the routes to serve
	 * @return a builder for {@link KilnConfig} instances
	 */
	@NonNull
	public static Builder withRouteTable(@NonNull RouteTable routeTable) {
		requireNonNull(routeTable);
		return new Builder(routeTable);
	}

	private KilnConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.routeTable = builder.routeTable;
		this.actionRegistry = builder.actionRegistry != null ? builder.actionRegistry : ActionRegistry.withDefaults();
		this.responseActions = builder.responseActions != null ? builder.responseActions : ResponseActions.withDefaults();
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.hostAddresses = builder.hostAddresses != null ? List.copyOf(builder.hostAddresses) : DEFAULT_HOST_ADDRESSES;
		this.workerCount = builder.workerCount != null ? builder.workerCount : DEFAULT_WORKER_COUNT;
		this.workerLauncher = builder.workerLauncher;
		this.serverName = builder.serverName != null ? builder.serverName : DEFAULT_SERVER_NAME;
		this.idleTimeout = builder.idleTimeout != null ? builder.idleTimeout : DEFAULT_IDLE_TIMEOUT;
		this.outboundRequestTimeout = builder.outboundRequestTimeout != null ? builder.outboundRequestTimeout : DEFAULT_OUTBOUND_REQUEST_TIMEOUT;
		this.socketSelectTimeout = builder.socketSelectTimeout != null ? builder.socketSelectTimeout : DEFAULT_SOCKET_SELECT_TIMEOUT;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.workerRestartDelay = builder.workerRestartDelay != null ? builder.workerRestartDelay : DEFAULT_WORKER_RESTART_DELAY;
		this.maximumConsecutiveWorkerRestartFailures = builder.maximumConsecutiveWorkerRestartFailures != null ? builder.maximumConsecutiveWorkerRestartFailures : DEFAULT_MAXIMUM_CONSECUTIVE_WORKER_RESTART_FAILURES;
		this.maximumRequestLineSizeInBytes = builder.maximumRequestLineSizeInBytes != null ? builder.maximumRequestLineSizeInBytes : DEFAULT_MAXIMUM_REQUEST_LINE_SIZE_IN_BYTES;
		this.maximumHeaderSizeInBytes = builder.maximumHeaderSizeInBytes != null ? builder.maximumHeaderSizeInBytes : DEFAULT_MAXIMUM_HEADER_SIZE_IN_BYTES;
		this.maximumBodySizeInBytes = builder.maximumBodySizeInBytes != null ? builder.maximumBodySizeInBytes : DEFAULT_MAXIMUM_BODY_SIZE_IN_BYTES;
		this.maximumConnections = builder.maximumConnections != null ? builder.maximumConnections : DEFAULT_MAXIMUM_CONNECTIONS;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.maximumOutboundResponseSizeInBytes = builder.maximumOutboundResponseSizeInBytes != null ? builder.maximumOutboundResponseSizeInBytes : DEFAULT_MAXIMUM_OUTBOUND_RESPONSE_SIZE_IN_BYTES;
		this.maximumPersistentRequests = builder.maximumPersistentRequests != null ? builder.maximumPersistentRequests : DEFAULT_MAXIMUM_PERSISTENT_REQUESTS;
		this.responseTimeout = builder.responseTimeout != null ? builder.responseTimeout : DEFAULT_RESPONSE_TIMEOUT;

		if (this.hostAddresses.isEmpty())
			throw new IllegalArgumentException("At least one host address is required");

		if (this.workerCount < 0)
			throw new IllegalArgumentException(format("Worker count must not be negative but was %d", this.workerCount));

		requirePositive("idleTimeout", this.idleTimeout);
		requirePositive("outboundRequestTimeout", this.outboundRequestTimeout);
		requirePositive("socketSelectTimeout", this.socketSelectTimeout);
		requirePositive("shutdownTimeout", this.shutdownTimeout);
		requirePositive("responseTimeout", this.responseTimeout);

		if (this.workerRestartDelay.isNegative())
			throw new IllegalArgumentException("workerRestartDelay must not be negative");

		if (this.maximumConsecutiveWorkerRestartFailures < 0)
			throw new IllegalArgumentException("maximumConsecutiveWorkerRestartFailures must not be negative");

		requirePositive("maximumRequestLineSizeInBytes", this.maximumRequestLineSizeInBytes);
		requirePositive("maximumHeaderSizeInBytes", this.maximumHeaderSizeInBytes);
		requirePositive("maximumBodySizeInBytes", this.maximumBodySizeInBytes);
		requirePositive("requestReadBufferSizeInBytes", this.requestReadBufferSizeInBytes);
		requirePositive("maximumOutboundResponseSizeInBytes", this.maximumOutboundResponseSizeInBytes);

		if (this.maximumConnections < 0)
			throw new IllegalArgumentException("maximumConnections must not be negative");

		if (this.maximumPersistentRequests < 0)
			throw new IllegalArgumentException("maximumPersistentRequests must not be negative");
	}

	private static void requirePositive(@NonNull String name,
																			@NonNull Duration duration) {
		if (duration.isNegative() || duration.isZero())
			throw new IllegalArgumentException(format("%s must be positive but was %s", name, duration));
	}

	private static void requirePositive(@NonNull String name,
																			@NonNull Integer value) {
		if (value <= 0)
			throw new IllegalArgumentException(format("%s must be positive but was %d", name, value));
	}

	/**
	 * Vends a mutable copy of this instance's configuration, suitable for building new instances.
	 *
	 * @return a builder primed with this configuration
	 */
	@NonNull
	public Builder copy() {
		return new Builder(getRouteTable())
				.actionRegistry(getActionRegistry())
				.responseActions(getResponseActions())
				.lifecycleObserver(getLifecycleObserver())
				.hostAddresses(getHostAddresses())
				.workerCount(getWorkerCount())
				.workerLauncher(getWorkerLauncher().orElse(null))
				.serverName(getServerName())
				.idleTimeout(getIdleTimeout())
				.outboundRequestTimeout(getOutboundRequestTimeout())
				.socketSelectTimeout(getSocketSelectTimeout())
				.shutdownTimeout(getShutdownTimeout())
				.workerRestartDelay(getWorkerRestartDelay())
				.maximumConsecutiveWorkerRestartFailures(getMaximumConsecutiveWorkerRestartFailures())
				.maximumRequestLineSizeInBytes(getMaximumRequestLineSizeInBytes())
				.maximumHeaderSizeInBytes(getMaximumHeaderSizeInBytes())
				.maximumBodySizeInBytes(getMaximumBodySizeInBytes())
				.maximumConnections(getMaximumConnections())
				.requestReadBufferSizeInBytes(getRequestReadBufferSizeInBytes())
				.maximumOutboundResponseSizeInBytes(getMaximumOutboundResponseSizeInBytes())
				.maximumPersistentRequests(getMaximumPersistentRequests())
				.responseTimeout(getResponseTimeout());
	}

	@NonNull
	ReactorOptions toReactorOptions() {
		return new ReactorOptions()
				.withResolution(getSocketSelectTimeout())
				.withIdleTimeout(getIdleTimeout())
				.withReadBufferSize(getRequestReadBufferSizeInBytes())
				.withMaxConnections(getMaximumConnections())
				.withMaximumRequestLineSize(getMaximumRequestLineSizeInBytes())
				.withMaximumHeaderSize(getMaximumHeaderSizeInBytes())
				.withMaximumBodySize(getMaximumBodySizeInBytes())
				.withMaximumResponseSize(getMaximumOutboundResponseSizeInBytes())
				.withMaximumPersistentRequests(getMaximumPersistentRequests())
				.withResponseTimeout(getResponseTimeout());
	}

	@NonNull
	public RouteTable getRouteTable() {
		return this.routeTable;
	}

	/**
	 * Resolves named action references in the route table.
	 */
	@NonNull
	public ActionRegistry getActionRegistry() {
		return this.actionRegistry;
	}

	@NonNull
	public ResponseActions getResponseActions() {
		return this.responseActions;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	public List<HostAddress> getHostAddresses() {
		return this.hostAddresses;
	}

	/**
	 * Number of worker processes.  {@code 0} runs the reactor in the starting process.
	 */
	@NonNull
	public Integer getWorkerCount() {
		return this.workerCount;
	}

	/**
	 * The launcher for worker processes.  If absent, {@link DefaultWorkerLauncher#fromCurrentProcess()} is used.
	 */
	@NonNull
	public Optional<WorkerLauncher> getWorkerLauncher() {
		return Optional.ofNullable(this.workerLauncher);
	}

	/**
	 * Value of the {@code Server} response header.
	 */
	@NonNull
	public String getServerName() {
		return this.serverName;
	}

	@NonNull
	public Duration getIdleTimeout() {
		return this.idleTimeout;
	}

	@NonNull
	public Duration getOutboundRequestTimeout() {
		return this.outboundRequestTimeout;
	}

	@NonNull
	public Duration getSocketSelectTimeout() {
		return this.socketSelectTimeout;
	}

	@NonNull
	public Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@NonNull
	public Duration getWorkerRestartDelay() {
		return this.workerRestartDelay;
	}

	@NonNull
	public Integer getMaximumConsecutiveWorkerRestartFailures() {
		return this.maximumConsecutiveWorkerRestartFailures;
	}

	@NonNull
	public Integer getMaximumRequestLineSizeInBytes() {
		return this.maximumRequestLineSizeInBytes;
	}

	@NonNull
	public Integer getMaximumHeaderSizeInBytes() {
		return this.maximumHeaderSizeInBytes;
	}

	@NonNull
	public Integer getMaximumBodySizeInBytes() {
		return this.maximumBodySizeInBytes;
	}

	/**
	 * Maximum simultaneous connections per process; {@code 0} means unlimited.
	 */
	@NonNull
	public Integer getMaximumConnections() {
		return this.maximumConnections;
	}

	@NonNull
	public Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	/**
	 * Largest response, status line and headers included, accepted from an upstream by an outbound request.
	 */
	@NonNull
	public Integer getMaximumOutboundResponseSizeInBytes() {
		return this.maximumOutboundResponseSizeInBytes;
	}

	/**
	 * Requests served on one keep-alive connection before the server closes it; {@code 0} means unlimited.
	 */
	@NonNull
	public Integer getMaximumPersistentRequests() {
		return this.maximumPersistentRequests;
	}

	/**
	 * How long a dispatched request may wait for its response before the server answers {@code 503} and closes the
	 * connection.
	 */
	@NonNull
	public Duration getResponseTimeout() {
		return this.responseTimeout;
	}

	/**
	 * Builder used to construct instances of {@link KilnConfig} via {@link KilnConfig#withRouteTable(RouteTable)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private RouteTable routeTable;
		@Nullable
		private ActionRegistry actionRegistry;
		@Nullable
		private ResponseActions responseActions;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private List<HostAddress> hostAddresses;
		@Nullable
		private Integer workerCount;
		@Nullable
		private WorkerLauncher workerLauncher;
		@Nullable
		private String serverName;
		@Nullable
		private Duration idleTimeout;
		@Nullable
		private Duration outboundRequestTimeout;
		@Nullable
		private Duration socketSelectTimeout;
		@Nullable
		private Duration shutdownTimeout;
		@Nullable
		private Duration workerRestartDelay;
		@Nullable
		private Integer maximumConsecutiveWorkerRestartFailures;
		@Nullable
		private Integer maximumRequestLineSizeInBytes;
		@Nullable
		private Integer maximumHeaderSizeInBytes;
		@Nullable
		private Integer maximumBodySizeInBytes;
		@Nullable
		private Integer maximumConnections;
		@Nullable
		private Integer requestReadBufferSizeInBytes;
		@Nullable
		private Integer maximumOutboundResponseSizeInBytes;
		@Nullable
		private Integer maximumPersistentRequests;
		@Nullable
		private Duration responseTimeout;

		private Builder(@NonNull RouteTable routeTable) {
			requireNonNull(routeTable);
			this.routeTable = routeTable;
		}

		@NonNull
		public Builder routeTable(@NonNull RouteTable routeTable) {
			requireNonNull(routeTable);
			this.routeTable = routeTable;
			return this;
		}

		@NonNull
		public Builder actionRegistry(@Nullable ActionRegistry actionRegistry) {
			this.actionRegistry = actionRegistry;
			return this;
		}

		@NonNull
		public Builder responseActions(@Nullable ResponseActions responseActions) {
			this.responseActions = responseActions;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder hostAddresses(@Nullable List<HostAddress> hostAddresses) {
			this.hostAddresses = hostAddresses == null ? null : new ArrayList<>(hostAddresses);
			return this;
		}

		/**
		 * Convenience for listening on a single port on all interfaces.
		 */
		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			return hostAddresses(List.of(HostAddress.of("0.0.0.0", port)));
		}

		@NonNull
		public Builder workerCount(@Nullable Integer workerCount) {
			this.workerCount = workerCount;
			return this;
		}

		@NonNull
		public Builder workerLauncher(@Nullable WorkerLauncher workerLauncher) {
			this.workerLauncher = workerLauncher;
			return this;
		}

		@NonNull
		public Builder serverName(@Nullable String serverName) {
			this.serverName = serverName;
			return this;
		}

		@NonNull
		public Builder idleTimeout(@Nullable Duration idleTimeout) {
			this.idleTimeout = idleTimeout;
			return this;
		}

		@NonNull
		public Builder outboundRequestTimeout(@Nullable Duration outboundRequestTimeout) {
			this.outboundRequestTimeout = outboundRequestTimeout;
			return this;
		}

		@NonNull
		public Builder socketSelectTimeout(@Nullable Duration socketSelectTimeout) {
			this.socketSelectTimeout = socketSelectTimeout;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		@NonNull
		public Builder workerRestartDelay(@Nullable Duration workerRestartDelay) {
			this.workerRestartDelay = workerRestartDelay;
			return this;
		}

		@NonNull
		public Builder maximumConsecutiveWorkerRestartFailures(@Nullable Integer maximumConsecutiveWorkerRestartFailures) {
			this.maximumConsecutiveWorkerRestartFailures = maximumConsecutiveWorkerRestartFailures;
			return this;
		}

		@NonNull
		public Builder maximumRequestLineSizeInBytes(@Nullable Integer maximumRequestLineSizeInBytes) {
			this.maximumRequestLineSizeInBytes = maximumRequestLineSizeInBytes;
			return this;
		}

		@NonNull
		public Builder maximumHeaderSizeInBytes(@Nullable Integer maximumHeaderSizeInBytes) {
			this.maximumHeaderSizeInBytes = maximumHeaderSizeInBytes;
			return this;
		}

		@NonNull
		public Builder maximumBodySizeInBytes(@Nullable Integer maximumBodySizeInBytes) {
			this.maximumBodySizeInBytes = maximumBodySizeInBytes;
			return this;
		}

		@NonNull
		public Builder maximumConnections(@Nullable Integer maximumConnections) {
			this.maximumConnections = maximumConnections;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		@NonNull
		public Builder maximumOutboundResponseSizeInBytes(@Nullable Integer maximumOutboundResponseSizeInBytes) {
			this.maximumOutboundResponseSizeInBytes = maximumOutboundResponseSizeInBytes;
			return this;
		}

		@NonNull
		public Builder maximumPersistentRequests(@Nullable Integer maximumPersistentRequests) {
			this.maximumPersistentRequests = maximumPersistentRequests;
			return this;
		}

		@NonNull
		public Builder responseTimeout(@Nullable Duration responseTimeout) {
			this.responseTimeout = responseTimeout;
			return this;
		}

		/**
		 * Applies any {@code kiln.*} settings present in {@code propertiesFileReader}, overriding values already set.
		 * <p>
		 * Recognized keys: {@code kiln.hosts} (comma-separated {@code host:port}), {@code kiln.workers},
		 * {@code kiln.idleTimeoutSeconds}, {@code kiln.outboundRequestTimeoutSeconds},
		 * {@code kiln.maximumRequestLineSizeInBytes}, {@code kiln.maximumHeaderSizeInBytes},
		 * {@code kiln.maximumBodySizeInBytes}, {@code kiln.maximumOutboundResponseSizeInBytes},
		 * {@code kiln.maximumPersistentRequests}, {@code kiln.responseTimeoutSeconds} and {@code kiln.serverName}.
		 */
		@NonNull
		public Builder properties(@NonNull PropertiesFileReader propertiesFileReader) {
			requireNonNull(propertiesFileReader);

			propertiesFileReader.optionalValueFor("kiln.hosts", String.class).ifPresent(hosts -> {
				List<HostAddress> hostAddresses = new ArrayList<>();

				for (String host : hosts.split(","))
					if (!host.isBlank())
						hostAddresses.add(HostAddress.fromString(host));

				hostAddresses(hostAddresses);
			});

			propertiesFileReader.optionalValueFor("kiln.workers", Integer.class).ifPresent(this::workerCount);
			propertiesFileReader.optionalValueFor("kiln.idleTimeoutSeconds", Long.class).map(Duration::ofSeconds).ifPresent(this::idleTimeout);
			propertiesFileReader.optionalValueFor("kiln.outboundRequestTimeoutSeconds", Long.class).map(Duration::ofSeconds).ifPresent(this::outboundRequestTimeout);
			propertiesFileReader.optionalValueFor("kiln.maximumRequestLineSizeInBytes", Integer.class).ifPresent(this::maximumRequestLineSizeInBytes);
			propertiesFileReader.optionalValueFor("kiln.maximumHeaderSizeInBytes", Integer.class).ifPresent(this::maximumHeaderSizeInBytes);
			propertiesFileReader.optionalValueFor("kiln.maximumBodySizeInBytes", Integer.class).ifPresent(this::maximumBodySizeInBytes);
			propertiesFileReader.optionalValueFor("kiln.maximumOutboundResponseSizeInBytes", Integer.class).ifPresent(this::maximumOutboundResponseSizeInBytes);
			propertiesFileReader.optionalValueFor("kiln.maximumPersistentRequests", Integer.class).ifPresent(this::maximumPersistentRequests);
			propertiesFileReader.optionalValueFor("kiln.responseTimeoutSeconds", Long.class).map(Duration::ofSeconds).ifPresent(this::responseTimeout);
			propertiesFileReader.optionalValueFor("kiln.serverName", String.class).ifPresent(this::serverName);

			return this;
		}

		@NonNull
		public KilnConfig build() {
			return new KilnConfig(this);
		}
	}
}
