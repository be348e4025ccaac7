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
import java.net.InetSocketAddress;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A host and port to listen on, for example {@code 0.0.0.0:8080}.
 */
@ThreadSafe
public final class HostAddress {
	@NonNull
	private final String host;
	@NonNull
	private final Integer port;

	@NonNull
	public static HostAddress of(@NonNull String host,
															 @NonNull Integer port) {
		return new HostAddress(host, port);
	}

	/**
	 * Parses {@code host:port}.  IPv6 hosts must be bracketed, as in {@code [::1]:8080}.
	 *
	 * @param hostAndPort the text to parse
	 * @return the address
	 * @throws IllegalArgumentException if the text is not a valid {@code host:port} pair
	 */
	@NonNull
	public static HostAddress fromString(@NonNull String hostAndPort) {
		requireNonNull(hostAndPort);

		String trimmed = hostAndPort.trim();
		int colonIndex = trimmed.lastIndexOf(':');

		if (colonIndex <= 0 || colonIndex == trimmed.length() - 1)
			throw new IllegalArgumentException(format("Expected host:port but got '%s'", hostAndPort));

		String host = trimmed.substring(0, colonIndex);

		if (host.startsWith("[") && host.endsWith("]"))
			host = host.substring(1, host.length() - 1);

		try {
			return new HostAddress(host, Integer.parseInt(trimmed.substring(colonIndex + 1)));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(format("Illegal port in '%s'", hostAndPort), e);
		}
	}

	private HostAddress(@NonNull String host,
											@NonNull Integer port) {
		requireNonNull(host);
		requireNonNull(port);

		if (host.isBlank())
			throw new IllegalArgumentException("Host must not be blank");

		// Port 0 binds an ephemeral port
		if (port < 0 || port > 65535)
			throw new IllegalArgumentException(format("Illegal port %d", port));

		this.host = host;
		this.port = port;
	}

	@NonNull
	public InetSocketAddress toInetSocketAddress() {
		return new InetSocketAddress(getHost(), getPort());
	}

	@NonNull
	public String getHost() {
		return this.host;
	}

	@NonNull
	public Integer getPort() {
		return this.port;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof HostAddress hostAddress))
			return false;

		return Objects.equals(getHost(), hostAddress.getHost()) && Objects.equals(getPort(), hostAddress.getPort());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getHost(), getPort());
	}

	@Override
	@NonNull
	public String toString() {
		return getHost().indexOf(':') == -1 ? format("%s:%d", getHost(), getPort()) : format("[%s]:%d", getHost(), getPort());
	}
}
