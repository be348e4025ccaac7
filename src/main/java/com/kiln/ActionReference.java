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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The handler half of a {@link Route}: either a factory fixed at registration time, or a stable name looked up in the
 * {@link ActionRegistry} on every match so that reloading the registry takes effect without a restart.
 */
@ThreadSafe
public final class ActionReference {
	@Nullable
	private final ActionFactory actionFactory;
	@Nullable
	private final String name;

	@NonNull
	public static ActionReference of(@NonNull ActionFactory actionFactory) {
		requireNonNull(actionFactory);
		return new ActionReference(actionFactory, null);
	}

	@NonNull
	public static ActionReference of(@NonNull Class<? extends Action> actionClass) {
		requireNonNull(actionClass);
		return new ActionReference(ActionFactory.forClass(actionClass), null);
	}

	/**
	 * Acquires a reference resolved through {@link ActionRegistry#resolve(String)} at match time.
	 * <p>
	 * The name may be an identifier registered with the registry or a dotted class name like {@code com.example.HomeAction}.
	 *
	 * @param name the registry identifier or class name
	 * @return the reference
	 */
	@NonNull
	public static ActionReference named(@NonNull String name) {
		requireNonNull(name);

		if (name.isBlank())
			throw new IllegalArgumentException("Action names must not be blank");

		return new ActionReference(null, name.trim());
	}

	private ActionReference(@Nullable ActionFactory actionFactory,
													@Nullable String name) {
		this.actionFactory = actionFactory;
		this.name = name;
	}

	/**
	 * Resolves this reference to a factory.
	 *
	 * @param actionRegistry the registry used for named references
	 * @return the factory
	 * @throws com.kiln.exception.ActionResolutionException if a named reference cannot be resolved
	 */
	@NonNull
	public ActionFactory resolve(@NonNull ActionRegistry actionRegistry) {
		requireNonNull(actionRegistry);
		return this.actionFactory != null ? this.actionFactory : actionRegistry.resolve(this.name);
	}

	@NonNull
	public Optional<String> getName() {
		return Optional.ofNullable(this.name);
	}

	@Override
	@NonNull
	public String toString() {
		return this.name != null
				? format("%s{name=%s}", getClass().getSimpleName(), this.name)
				: format("%s{actionFactory=%s}", getClass().getSimpleName(), this.actionFactory);
	}
}
