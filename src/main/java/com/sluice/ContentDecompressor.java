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

package com.sluice;

import com.sluice.exception.DecompressionException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.DataFormatException;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decompresses request bodies according to their {@code Content-Encoding}.
 * <p>
 * This is a pure function of (encoding, bytes): it either produces the decompressed bytes or throws
 * {@link DecompressionException}.  It never returns partially-decompressed output.
 * <p>
 * Output is capped at a configurable size so a small compressed body cannot expand without bound.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ContentDecompressor {
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_DECOMPRESSED_SIZE_IN_BYTES;
	@NonNull
	private static final Integer BUFFER_SIZE_IN_BYTES;
	@NonNull
	private static final ContentDecompressor DEFAULT_INSTANCE;

	static {
		DEFAULT_MAXIMUM_DECOMPRESSED_SIZE_IN_BYTES = 1_024 * 1_024 * 100;
		BUFFER_SIZE_IN_BYTES = 1_024 * 8;
		DEFAULT_INSTANCE = new ContentDecompressor(DEFAULT_MAXIMUM_DECOMPRESSED_SIZE_IN_BYTES);
	}

	@NonNull
	private final Integer maximumDecompressedSizeInBytes;

	/**
	 * Acquires a decompressor which fails any body whose decompressed size exceeds the given limit.
	 *
	 * @param maximumDecompressedSizeInBytes the maximum permitted decompressed size
	 * @return the decompressor
	 */
	@NonNull
	public static ContentDecompressor withMaximumDecompressedSizeInBytes(@NonNull Integer maximumDecompressedSizeInBytes) {
		requireNonNull(maximumDecompressedSizeInBytes);
		return new ContentDecompressor(maximumDecompressedSizeInBytes);
	}

	/**
	 * Acquires a decompressor with a 100 MiB output limit.
	 *
	 * @return the default decompressor
	 */
	@NonNull
	public static ContentDecompressor defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private ContentDecompressor(@NonNull Integer maximumDecompressedSizeInBytes) {
		requireNonNull(maximumDecompressedSizeInBytes);

		if (maximumDecompressedSizeInBytes <= 0)
			throw new IllegalArgumentException("Maximum decompressed size must be > 0");

		this.maximumDecompressedSizeInBytes = maximumDecompressedSizeInBytes;
	}

	/**
	 * Decompresses a body according to a {@code Content-Encoding} header value.
	 * <p>
	 * Absent, {@code identity} or unrecognized encodings return the body unchanged.  An empty body is not a valid
	 * {@code gzip} or {@code deflate} stream and fails like any other malformed input.
	 *
	 * @param contentEncodingHeaderValue the raw {@code Content-Encoding} header value, may be {@code null}
	 * @param body                       the request body as received
	 * @return the decompressed body
	 * @throws DecompressionException if the body is not a valid stream for the declared encoding or decompresses to more than the permitted size
	 */
	@NonNull
	public byte[] decompress(@Nullable String contentEncodingHeaderValue,
													 @NonNull byte[] body) {
		requireNonNull(body);

		ContentEncoding contentEncoding = ContentEncoding.fromHeaderValue(contentEncodingHeaderValue).orElse(null);

		if (contentEncoding == null)
			return body;

		return switch (contentEncoding) {
			case GZIP -> gunzip(body);
			case DEFLATE -> inflate(body, !hasZlibHeader(body));
		};
	}

	@NonNull
	private byte[] gunzip(@NonNull byte[] body) {
		requireNonNull(body);

		try (InputStream inputStream = new GZIPInputStream(new ByteArrayInputStream(body), BUFFER_SIZE_IN_BYTES)) {
			ByteArrayOutputStream outputStream = new ByteArrayOutputStream((int) Math.min((long) body.length * 4L, getMaximumDecompressedSizeInBytes()));
			byte[] buffer = new byte[BUFFER_SIZE_IN_BYTES];
			int bytesRead;

			while ((bytesRead = inputStream.read(buffer)) != -1) {
				if (outputStream.size() + bytesRead > getMaximumDecompressedSizeInBytes())
					throw new DecompressionException(format("Decompressed gzip body exceeds maximum size of %d bytes", getMaximumDecompressedSizeInBytes()));

				outputStream.write(buffer, 0, bytesRead);
			}

			return outputStream.toByteArray();
		} catch (IOException e) {
			throw new DecompressionException(format("Unable to decompress gzip body: %s", e.getMessage()), e);
		}
	}

	@NonNull
	private byte[] inflate(@NonNull byte[] body,
												 boolean raw) {
		requireNonNull(body);

		Inflater inflater = new Inflater(raw);

		try {
			inflater.setInput(body);

			ByteArrayOutputStream outputStream = new ByteArrayOutputStream((int) Math.min((long) body.length * 4L, getMaximumDecompressedSizeInBytes()));
			byte[] buffer = new byte[BUFFER_SIZE_IN_BYTES];

			while (!inflater.finished()) {
				int bytesInflated = inflater.inflate(buffer);

				if (bytesInflated == 0 && (inflater.needsInput() || inflater.needsDictionary()))
					throw new DecompressionException("Unable to decompress deflate body: stream is truncated or requires a preset dictionary");

				if (outputStream.size() + bytesInflated > getMaximumDecompressedSizeInBytes())
					throw new DecompressionException(format("Decompressed deflate body exceeds maximum size of %d bytes", getMaximumDecompressedSizeInBytes()));

				outputStream.write(buffer, 0, bytesInflated);
			}

			return outputStream.toByteArray();
		} catch (DataFormatException e) {
			throw new DecompressionException(format("Unable to decompress deflate body: %s", e.getMessage()), e);
		} finally {
			inflater.end();
		}
	}

	// RFC 1950 section 2.2: CM = 8, and CMF*256 + FLG is a multiple of 31
	private static boolean hasZlibHeader(@NonNull byte[] body) {
		requireNonNull(body);

		if (body.length < 2)
			return false;

		int cmf = body[0] & 0xFF;
		int flg = body[1] & 0xFF;

		return (cmf & 0x0F) == 8 && ((cmf << 8) | flg) % 31 == 0;
	}

	@NonNull
	public Integer getMaximumDecompressedSizeInBytes() {
		return this.maximumDecompressedSizeInBytes;
	}
}
