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

import com.sluice.MarshaledResponse;
import com.sluice.StatusCode;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Serializes a {@link MarshaledResponse} as an HTTP/1.1 response.
 * <p>
 * Every response closes the connection: {@code Connection: close} is always written and any
 * {@code Connection}/{@code Content-Length}/{@code Transfer-Encoding} header on the response is replaced.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ResponseWriter {
	private ResponseWriter() {
		// Non-instantiable
	}

	public static void writeResponse(@NonNull OutputStream outputStream,
																	 @NonNull MarshaledResponse marshaledResponse) throws IOException {
		requireNonNull(outputStream);
		requireNonNull(marshaledResponse);

		Integer statusCode = marshaledResponse.getStatusCode();
		byte[] body = marshaledResponse.getBody().orElse(null);
		boolean bodyPermitted = statusCode != 204 && statusCode != 304 && statusCode >= 200;

		StringBuilder head = new StringBuilder(256);
		head.append(format("HTTP/1.1 %d %s\r\n", statusCode, StatusCode.reasonPhraseFor(statusCode)));

		for (Map.Entry<String, String> header : marshaledResponse.getHeaders().entrySet()) {
			String name = header.getKey();

			if ("Connection".equalsIgnoreCase(name)
					|| "Content-Length".equalsIgnoreCase(name)
					|| "Transfer-Encoding".equalsIgnoreCase(name))
				continue;

			head.append(name).append(": ").append(header.getValue()).append("\r\n");
		}

		if (bodyPermitted)
			head.append("Content-Length: ").append(body == null ? 0 : body.length).append("\r\n");

		head.append("Connection: close\r\n\r\n");

		outputStream.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));

		if (bodyPermitted && body != null && body.length > 0)
			outputStream.write(body);

		outputStream.flush();
	}
}
