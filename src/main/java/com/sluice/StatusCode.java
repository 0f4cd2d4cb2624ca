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

import org.jspecify.annotations.NonNull;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The HTTP status codes Sluice writes.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum StatusCode {
	/**
	 * Events were accepted and enqueued (the default success status).
	 */
	HTTP_200(200, "OK"),
	/**
	 * Optional success status, see {@link SluiceConfig#getResponseCode()}.
	 */
	HTTP_201(201, "Created"),
	/**
	 * Optional success status, see {@link SluiceConfig#getResponseCode()}.
	 */
	HTTP_202(202, "Accepted"),
	/**
	 * Optional success status, see {@link SluiceConfig#getResponseCode()}.  Written without a body.
	 */
	HTTP_204(204, "No Content"),
	/**
	 * Unparseable request, undecompressable body or undecodable body.
	 */
	HTTP_400(400, "Bad Request"),
	/**
	 * Credentials are configured and the request did not present matching ones.
	 */
	HTTP_401(401, "Unauthorized"),
	/**
	 * Anything other than {@code POST}.
	 */
	HTTP_405(405, "Method Not Allowed"),
	/**
	 * The client did not finish sending its request within the request timeout.
	 */
	HTTP_408(408, "Request Timeout"),
	/**
	 * The request body exceeds the maximum content length.
	 */
	HTTP_413(413, "Content Too Large"),
	/**
	 * No worker slot was free when the connection was accepted.
	 */
	HTTP_429(429, "Too Many Requests"),
	/**
	 * An unexpected error occurred while handling the request.
	 */
	HTTP_500(500, "Internal Server Error"),
	/**
	 * The server is shutting down.
	 */
	HTTP_503(503, "Service Unavailable");

	@NonNull
	private static final Map<Integer, StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	/**
	 * Given an HTTP status code, return the corresponding enum value.
	 *
	 * @param statusCode the HTTP status code
	 * @return the enum value that corresponds to the provided HTTP status code, or {@link Optional#empty()} if none exists
	 */
	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	/**
	 * The reason phrase to write in a status line for the given code, or {@code Unknown} if Sluice does not know the code.
	 *
	 * @param statusCode the HTTP status code
	 * @return the reason phrase
	 */
	@NonNull
	public static String reasonPhraseFor(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return fromStatusCode(statusCode).map(StatusCode::getReasonPhrase).orElse("Unknown");
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}
}
