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
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One part of a {@code multipart/form-data} body: a plain form field, or an uploaded file if a filename was sent.
 * <p>
 * Instances are acquired through {@link #with(String, byte[])}.
 */
@ThreadSafe
public final class MultipartField {
	@NonNull
	private final String name;
	@NonNull
	private final byte[] data;
	@Nullable
	private final String filename;
	@Nullable
	private final String contentType;
	@Nullable
	private final Charset charset;

	@NonNull
	public static Builder with(@NonNull String name,
														 @NonNull byte[] data) {
		requireNonNull(name);
		requireNonNull(data);

		return new Builder(name, data);
	}

	private MultipartField(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.name.isEmpty())
			throw new IllegalArgumentException("Multipart field name is required");

		this.name = builder.name;
		this.data = builder.data;
		this.filename = builder.filename;
		this.contentType = builder.contentType;
		this.charset = builder.charset;
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * The raw bytes of this part's body.
	 *
	 * @return the bytes, never {@code null}
	 */
	@NonNull
	public byte[] getData() {
		return this.data.clone();
	}

	/**
	 * The body decoded with the part's declared charset, or UTF-8 if it declared none.
	 *
	 * @return the decoded body
	 */
	@NonNull
	public String getDataAsString() {
		return new String(this.data, getCharset().orElse(StandardCharsets.UTF_8));
	}

	@NonNull
	public Integer getSize() {
		return this.data.length;
	}

	@NonNull
	public Optional<String> getFilename() {
		return Optional.ofNullable(this.filename);
	}

	@NonNull
	public Optional<String> getContentType() {
		return Optional.ofNullable(this.contentType);
	}

	@NonNull
	public Optional<Charset> getCharset() {
		return Optional.ofNullable(this.charset);
	}

	@NonNull
	public Boolean isFile() {
		return this.filename != null;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, filename=%s, contentType=%s, size=%s}", getClass().getSimpleName(),
				getName(), getFilename().orElse(null), getContentType().orElse(null), getSize());
	}

	/**
	 * Builder used to construct instances of {@link MultipartField} via {@link MultipartField#with(String, byte[])}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String name;
		@NonNull
		private final byte[] data;
		@Nullable
		private String filename;
		@Nullable
		private String contentType;
		@Nullable
		private Charset charset;

		private Builder(@NonNull String name,
										@NonNull byte[] data) {
			this.name = name;
			this.data = data;
		}

		@NonNull
		public Builder filename(@Nullable String filename) {
			this.filename = filename;
			return this;
		}

		@NonNull
		public Builder contentType(@Nullable String contentType) {
			this.contentType = contentType;
			return this;
		}

		@NonNull
		public Builder charset(@Nullable Charset charset) {
			this.charset = charset;
			return this;
		}

		@NonNull
		public MultipartField build() {
			return new MultipartField(this);
		}
	}
}
