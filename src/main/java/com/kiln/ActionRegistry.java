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

import com.kiln.exception.ActionResolutionException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps stable names to {@link ActionFactory} instances for routes registered with {@link ActionReference#named(String)}.
 * <p>
 * Names with no explicit registration are treated as dotted class names and loaded through the registry's class loader,
 * unless class-name resolution was disabled.  Loaded classes are cached until the next reload.
 * <p>
 * {@link #reload()} and {@link #reload(Map)} publish a new immutable snapshot atomically; a request in flight finishes
 * with the snapshot it started with.  Supplying a class loader supplier which returns a fresh loader each time is how
 * changed action classes are picked up without restarting the process.
 */
@ThreadSafe
public final class ActionRegistry {
	@NonNull
	private static final Logger logger;

	static {
		logger = Logger.getLogger(ActionRegistry.class.getName());
	}

	@NonNull
	private final AtomicReference<Snapshot> snapshot;
	@Nullable
	private final Supplier<ClassLoader> classLoaderSupplier;

	/**
	 * Acquires a registry with no explicit registrations which resolves dotted class names through the context class loader.
	 *
	 * @return the registry
	 */
	@NonNull
	public static ActionRegistry withDefaults() {
		return builder().build();
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private ActionRegistry(@NonNull Builder builder) {
		requireNonNull(builder);

		this.classLoaderSupplier = builder.classNameResolutionEnabled ? builder.classLoaderSupplier : null;
		this.snapshot = new AtomicReference<>(createSnapshot(builder.actionFactoriesByName, 0L));
	}

	@NonNull
	private Snapshot createSnapshot(@NonNull Map<String, ActionFactory> actionFactoriesByName,
																	@NonNull Long generation) {
		ClassLoader classLoader = this.classLoaderSupplier == null ? null : this.classLoaderSupplier.get();
		return new Snapshot(Collections.unmodifiableMap(new LinkedHashMap<>(actionFactoriesByName)), classLoader, generation);
	}

	/**
	 * Resolves a name against the current snapshot.
	 *
	 * @param name a registered identifier or a dotted class name
	 * @return the factory
	 * @throws ActionResolutionException if the name is neither registered nor a loadable {@link Action} class
	 */
	@NonNull
	public ActionFactory resolve(@NonNull String name) {
		requireNonNull(name);

		Snapshot snapshot = this.snapshot.get();
		ActionFactory actionFactory = snapshot.actionFactoriesByName.get(name);

		if (actionFactory != null)
			return actionFactory;

		if (snapshot.classLoader == null)
			throw new ActionResolutionException(format("No action is registered under the name '%s'", name), null, name);

		return snapshot.actionFactoriesByClassName.computeIfAbsent(name, (className) -> loadActionFactory(className, snapshot.classLoader));
	}

	@NonNull
	private ActionFactory loadActionFactory(@NonNull String className,
																					@NonNull ClassLoader classLoader) {
		Class<?> loadedClass;

		try {
			loadedClass = Class.forName(className, true, classLoader);
		} catch (ClassNotFoundException | LinkageError e) {
			throw new ActionResolutionException(format("No action is registered under the name '%s' and no class by that name could be loaded",
					className), e, className);
		}

		if (!Action.class.isAssignableFrom(loadedClass))
			throw new ActionResolutionException(format("Class %s does not implement %s", className, Action.class.getName()), null, className);

		try {
			return ActionFactory.forClass(loadedClass.asSubclass(Action.class));
		} catch (IllegalArgumentException e) {
			throw new ActionResolutionException(e.getMessage(), e, className);
		}
	}

	/**
	 * Atomically publishes a new snapshot with the same registrations, a new class loader from the supplier, and an empty class cache.
	 */
	public void reload() {
		Snapshot previous;
		Snapshot next;

		do {
			previous = this.snapshot.get();
			next = createSnapshot(previous.actionFactoriesByName, previous.generation + 1);
		} while (!this.snapshot.compareAndSet(previous, next));

		logger.fine(format("Reloaded action registry, now at generation %d", next.generation));
	}

	/**
	 * Atomically publishes a new snapshot with the given registrations, a new class loader from the supplier, and an empty class cache.
	 *
	 * @param actionFactoriesByName the registrations which replace the current ones
	 */
	public void reload(@NonNull Map<String, ActionFactory> actionFactoriesByName) {
		requireNonNull(actionFactoriesByName);

		Snapshot previous;
		Snapshot next;

		do {
			previous = this.snapshot.get();
			next = createSnapshot(actionFactoriesByName, previous.generation + 1);
		} while (!this.snapshot.compareAndSet(previous, next));

		logger.fine(format("Reloaded action registry with %d registrations, now at generation %d", actionFactoriesByName.size(), next.generation));
	}

	/**
	 * How many times this registry has been reloaded.
	 *
	 * @return the generation, starting at 0
	 */
	@NonNull
	public Long getGeneration() {
		return this.snapshot.get().generation;
	}

	@Override
	@NonNull
	public String toString() {
		Snapshot snapshot = this.snapshot.get();
		return format("%s{names=%s, generation=%d}", getClass().getSimpleName(), snapshot.actionFactoriesByName.keySet(), snapshot.generation);
	}

	@ThreadSafe
	private static final class Snapshot {
		@NonNull
		private final Map<String, ActionFactory> actionFactoriesByName;
		@Nullable
		private final ClassLoader classLoader;
		@NonNull
		private final Long generation;
		@NonNull
		private final ConcurrentHashMap<String, ActionFactory> actionFactoriesByClassName;

		private Snapshot(@NonNull Map<String, ActionFactory> actionFactoriesByName,
										 @Nullable ClassLoader classLoader,
										 @NonNull Long generation) {
			this.actionFactoriesByName = actionFactoriesByName;
			this.classLoader = classLoader;
			this.generation = generation;
			this.actionFactoriesByClassName = new ConcurrentHashMap<>();
		}
	}

	/**
	 * Builder used to construct instances of {@link ActionRegistry}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<String, ActionFactory> actionFactoriesByName;
		@NonNull
		private Supplier<ClassLoader> classLoaderSupplier;
		@NonNull
		private Boolean classNameResolutionEnabled;

		private Builder() {
			this.actionFactoriesByName = new LinkedHashMap<>();
			this.classLoaderSupplier = () -> {
				ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();
				return contextClassLoader == null ? ActionRegistry.class.getClassLoader() : contextClassLoader;
			};
			this.classNameResolutionEnabled = true;
		}

		@NonNull
		public Builder register(@NonNull String name,
														@NonNull ActionFactory actionFactory) {
			requireNonNull(name);
			requireNonNull(actionFactory);

			this.actionFactoriesByName.put(name, actionFactory);
			return this;
		}

		@NonNull
		public Builder register(@NonNull String name,
														@NonNull Class<? extends Action> actionClass) {
			requireNonNull(actionClass);
			return register(name, ActionFactory.forClass(actionClass));
		}

		/**
		 * Supplies the class loader used for dotted class names.  It is invoked once at construction and once per reload.
		 *
		 * @param classLoaderSupplier the class loader supplier
		 * @return this builder
		 */
		@NonNull
		public Builder classLoaderSupplier(@NonNull Supplier<ClassLoader> classLoaderSupplier) {
			this.classLoaderSupplier = requireNonNull(classLoaderSupplier);
			return this;
		}

		@NonNull
		public Builder classNameResolutionEnabled(@NonNull Boolean classNameResolutionEnabled) {
			this.classNameResolutionEnabled = requireNonNull(classNameResolutionEnabled);
			return this;
		}

		@NonNull
		public ActionRegistry build() {
			return new ActionRegistry(this);
		}
	}
}
