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

package com.sluice.internal.http;

import com.sluice.Request;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads a single HTTP/1.x request from a blocking stream.
 * <p>
 * Bodies are framed by {@code Content-Length} or {@code Transfer-Encoding: chunked}; a request with neither has an
 * empty body. A request that declares both, declares conflicting lengths or uses any other transfer coding is
 * rejected as malformed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class RequestReader {
	@NonNull
	private static final Integer DEFAULT_MAXIMUM_HEADER_SECTION_SIZE_IN_BYTES;
	@NonNull
	private static final Integer MAXIMUM_LINE_LENGTH_IN_BYTES;
	@NonNull
	private static final byte[] CONTINUE_RESPONSE;

	static {
		DEFAULT_MAXIMUM_HEADER_SECTION_SIZE_IN_BYTES = 64 * 1_024;
		MAXIMUM_LINE_LENGTH_IN_BYTES = 8 * 1_024;
		CONTINUE_RESPONSE = "HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
	}

	@NonNull
	private final Integer maximumBodySizeInBytes;
	@NonNull
	private final Integer maximumHeaderSectionSizeInBytes;

	@NonNull
	public static RequestReader withMaximumBodySizeInBytes(@NonNull Integer maximumBodySizeInBytes) {
		requireNonNull(maximumBodySizeInBytes);
		return new RequestReader(maximumBodySizeInBytes, DEFAULT_MAXIMUM_HEADER_SECTION_SIZE_IN_BYTES);
	}

	private RequestReader(@NonNull Integer maximumBodySizeInBytes,
												@NonNull Integer maximumHeaderSectionSizeInBytes) {
		requireNonNull(maximumBodySizeInBytes);
		requireNonNull(maximumHeaderSectionSizeInBytes);

		if (maximumBodySizeInBytes < 0)
			throw new IllegalArgumentException("Maximum body size must be >= 0");

		this.maximumBodySizeInBytes = maximumBodySizeInBytes;
		this.maximumHeaderSectionSizeInBytes = maximumHeaderSectionSizeInBytes;
	}

	/**
	 * Reads the next request from {@code inputStream}.
	 * <p>
	 * If the client sent {@code Expect: 100-continue} and the declared body fits, an interim {@code 100 Continue}
	 * response is written to {@code outputStream} before the body is read.
	 *
	 * @param inputStream   the connection's input
	 * @param outputStream  the connection's output, used only for the interim response
	 * @param remoteAddress the client's address, if known
	 * @return the request, or {@link Optional#empty()} if the client closed the connection without sending anything
	 * @throws IOException               if reading fails, including a socket read timeout
	 * @throws MalformedRequestException if the input is not a well-formed request
	 * @throws ContentTooLargeException  if the body is larger than the configured maximum
	 */
	@NonNull
	public Optional<Request> readRequest(@NonNull InputStream inputStream,
																			 @NonNull OutputStream outputStream,
																			 @Nullable InetSocketAddress remoteAddress) throws IOException, MalformedRequestException, ContentTooLargeException {
		requireNonNull(inputStream);
		requireNonNull(outputStream);

		HeaderBudget headerBudget = new HeaderBudget(getMaximumHeaderSectionSizeInBytes());
		String requestLine = readLine(inputStream, headerBudget);

		// Tolerate stray CRLFs ahead of the request line
		while (requestLine != null && requestLine.isEmpty())
			requestLine = readLine(inputStream, headerBudget);

		if (requestLine == null)
			return Optional.empty();

		String[] requestLineComponents = requestLine.split(" ", -1);

		if (requestLineComponents.length != 3)
			throw new MalformedRequestException(format("Malformed request line '%s'", requestLine));

		String method = requestLineComponents[0];
		String uri = requestLineComponents[1];
		String version = requestLineComponents[2];

		if (method.isEmpty() || !isToken(method))
			throw new MalformedRequestException(format("Illegal method '%s'", method));

		if (uri.isEmpty())
			throw new MalformedRequestException("Missing request URI");

		if (!version.startsWith("HTTP/1."))
			throw new MalformedRequestException(format("Unsupported protocol version '%s'", version));

		Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		while (true) {
			String headerLine = readLine(inputStream, headerBudget);

			if (headerLine == null)
				throw new MalformedRequestException("Unexpected end of stream while reading headers");

			if (headerLine.isEmpty())
				break;

			if (headerLine.charAt(0) == ' ' || headerLine.charAt(0) == '\t')
				throw new MalformedRequestException("Obsolete header line folding is not supported");

			int colonIndex = headerLine.indexOf(':');

			if (colonIndex <= 0)
				throw new MalformedRequestException(format("Malformed header line '%s'", headerLine));

			String name = headerLine.substring(0, colonIndex);

			if (!isToken(name))
				throw new MalformedRequestException(format("Illegal header name '%s'", name));

			String value = headerLine.substring(colonIndex + 1).trim();
			headers.computeIfAbsent(name, ignored -> new ArrayList<>()).add(value);
		}

		Long contentLength = findContentLength(headers);
		List<String> transferEncodings = findTransferEncodings(headers);

		if (contentLength != null && !transferEncodings.isEmpty())
			throw new MalformedRequestException("Both Content-Length and Transfer-Encoding were specified");

		if (!transferEncodings.isEmpty() && !(transferEncodings.size() == 1 && "chunked".equals(transferEncodings.get(0))))
			throw new MalformedRequestException(format("Unsupported transfer encoding '%s'", String.join(", ", transferEncodings)));

		if (contentLength != null && contentLength > getMaximumBodySizeInBytes())
			throw new ContentTooLargeException(getMaximumBodySizeInBytes());

		if (expectsContinue(headers, version) && (contentLength == null || contentLength > 0)) {
			outputStream.write(CONTINUE_RESPONSE);
			outputStream.flush();
		}

		byte[] body;

		if (!transferEncodings.isEmpty())
			body = readChunkedBody(inputStream);
		else if (contentLength != null)
			body = readFixedLengthBody(inputStream, contentLength.intValue());
		else
			body = new byte[0];

		return Optional.of(Request.withMethodAndUri(method, uri)
				.headers(headers)
				.body(body)
				.remoteAddress(remoteAddress)
				.build());
	}

	@NonNull
	private byte[] readFixedLengthBody(@NonNull InputStream inputStream,
																		 int contentLength) throws IOException, MalformedRequestException {
		requireNonNull(inputStream);

		byte[] body = inputStream.readNBytes(contentLength);

		if (body.length != contentLength)
			throw new MalformedRequestException(format("Unexpected end of stream: expected %d body bytes but received %d",
					contentLength, body.length));

		return body;
	}

	@NonNull
	private byte[] readChunkedBody(@NonNull InputStream inputStream) throws IOException, MalformedRequestException, ContentTooLargeException {
		requireNonNull(inputStream);

		// Chunk framing is bounded by the body limit (every chunk carries at least one byte), trailers by the header limit
		HeaderBudget chunkFramingBudget = new HeaderBudget(Long.MAX_VALUE);
		HeaderBudget trailerBudget = new HeaderBudget(getMaximumHeaderSectionSizeInBytes());
		ByteArrayOutputStream body = new ByteArrayOutputStream();

		while (true) {
			String chunkSizeLine = readLine(inputStream, chunkFramingBudget);

			if (chunkSizeLine == null)
				throw new MalformedRequestException("Unexpected end of stream while reading chunk size");

			long chunkSize = parseChunkSize(chunkSizeLine);

			if (chunkSize == 0)
				break;

			if (body.size() + chunkSize > getMaximumBodySizeInBytes())
				throw new ContentTooLargeException(getMaximumBodySizeInBytes());

			byte[] chunk = inputStream.readNBytes((int) chunkSize);

			if (chunk.length != chunkSize)
				throw new MalformedRequestException("Unexpected end of stream while reading chunk data");

			body.write(chunk);

			String chunkTerminator = readLine(inputStream, chunkFramingBudget);

			if (chunkTerminator == null || !chunkTerminator.isEmpty())
				throw new MalformedRequestException("Chunk data was not followed by CRLF");
		}

		// Trailers are read and discarded
		while (true) {
			String trailerLine = readLine(inputStream, trailerBudget);

			if (trailerLine == null)
				throw new MalformedRequestException("Unexpected end of stream while reading chunked trailers");

			if (trailerLine.isEmpty())
				break;
		}

		return body.toByteArray();
	}

	private long parseChunkSize(@NonNull String chunkSizeLine) throws MalformedRequestException {
		requireNonNull(chunkSizeLine);

		int semicolonIndex = chunkSizeLine.indexOf(';');
		String sizeToken = (semicolonIndex == -1 ? chunkSizeLine : chunkSizeLine.substring(0, semicolonIndex)).trim();

		// 15 hex digits is already well past any body size we accept
		if (sizeToken.isEmpty() || sizeToken.length() > 15)
			throw new MalformedRequestException(format("Invalid chunk size '%s'", sizeToken));

		try {
			return Long.parseLong(sizeToken, 16);
		} catch (NumberFormatException e) {
			throw new MalformedRequestException(format("Invalid chunk size '%s'", sizeToken));
		}
	}

	@Nullable
	private Long findContentLength(@NonNull Map<String, List<String>> headers) throws MalformedRequestException {
		requireNonNull(headers);

		List<String> values = headers.get("Content-Length");

		if (values == null)
			return null;

		Long contentLength = null;

		for (String value : values) {
			// A comma-separated list of identical values is allowed
			for (String component : value.split(",", -1)) {
				String trimmed = component.trim();

				if (trimmed.isEmpty() || trimmed.length() > 18 || !trimmed.chars().allMatch(Character::isDigit))
					throw new MalformedRequestException(format("Invalid Content-Length '%s'", value));

				long parsed = Long.parseLong(trimmed);

				if (contentLength != null && contentLength != parsed)
					throw new MalformedRequestException("Conflicting Content-Length values");

				contentLength = parsed;
			}
		}

		return contentLength;
	}

	@NonNull
	private List<String> findTransferEncodings(@NonNull Map<String, List<String>> headers) {
		requireNonNull(headers);

		List<String> values = headers.get("Transfer-Encoding");
		List<String> transferEncodings = new ArrayList<>();

		if (values == null)
			return transferEncodings;

		for (String value : values) {
			for (String component : value.split(",")) {
				int semicolonIndex = component.indexOf(';');
				String token = (semicolonIndex == -1 ? component : component.substring(0, semicolonIndex)).trim();

				if (!token.isEmpty())
					transferEncodings.add(token.toLowerCase(Locale.ROOT));
			}
		}

		// A header that is present but empty still counts as an (unsupported) coding
		if (transferEncodings.isEmpty())
			transferEncodings.add("");

		return transferEncodings;
	}

	private boolean expectsContinue(@NonNull Map<String, List<String>> headers,
																	@NonNull String version) {
		requireNonNull(headers);
		requireNonNull(version);

		if (!"HTTP/1.1".equals(version))
			return false;

		List<String> values = headers.get("Expect");
		return values != null && values.stream().anyMatch(value -> "100-continue".equalsIgnoreCase(value.trim()));
	}

	/**
	 * Reads a line terminated by CRLF (or a bare LF), without the terminator.
	 *
	 * @return the line, or {@code null} if the stream ended before any byte of the line was read
	 */
	@Nullable
	private String readLine(@NonNull InputStream inputStream,
													@NonNull HeaderBudget headerBudget) throws IOException, MalformedRequestException {
		requireNonNull(inputStream);
		requireNonNull(headerBudget);

		ByteArrayOutputStream line = new ByteArrayOutputStream(128);
		boolean readAnything = false;

		while (true) {
			int b = inputStream.read();

			if (b == -1) {
				if (!readAnything)
					return null;

				throw new MalformedRequestException("Unexpected end of stream in the middle of a line");
			}

			readAnything = true;
			headerBudget.consume();

			if (b == '\n')
				break;

			line.write(b);

			if (line.size() > MAXIMUM_LINE_LENGTH_IN_BYTES)
				throw new MalformedRequestException(format("Line exceeds %d bytes", MAXIMUM_LINE_LENGTH_IN_BYTES));
		}

		byte[] bytes = line.toByteArray();
		int length = bytes.length;

		if (length > 0 && bytes[length - 1] == '\r')
			--length;

		return new String(bytes, 0, length, StandardCharsets.ISO_8859_1);
	}

	private static boolean isToken(@NonNull String string) {
		requireNonNull(string);

		for (int i = 0; i < string.length(); ++i) {
			char c = string.charAt(i);

			if (c <= 0x20 || c >= 0x7F || "()<>@,;:\\\"/[]?={}".indexOf(c) != -1)
				return false;
		}

		return true;
	}

	@NonNull
	public Integer getMaximumBodySizeInBytes() {
		return this.maximumBodySizeInBytes;
	}

	@NonNull
	private Integer getMaximumHeaderSectionSizeInBytes() {
		return this.maximumHeaderSectionSizeInBytes;
	}

	/**
	 * Caps the number of bytes spent on framing lines.
	 */
	private static final class HeaderBudget {
		private final long maximumSizeInBytes;
		private long consumedBytes;

		private HeaderBudget(long maximumSizeInBytes) {
			this.maximumSizeInBytes = maximumSizeInBytes;
		}

		private void consume() throws MalformedRequestException {
			if (++this.consumedBytes > this.maximumSizeInBytes)
				throw new MalformedRequestException(format("Request framing exceeds %d bytes", this.maximumSizeInBytes));
		}
	}
}
