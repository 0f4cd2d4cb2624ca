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

import static java.util.Objects.requireNonNull;

/**
 * Decides whether a request presents acceptable credentials.
 * <p>
 * Invoked exactly once per admitted request, before its body is decompressed or decoded.
 * Implementations must be stateless (or threadsafe) and must not reveal to callers why a check failed.
 * <p>
 * Standard implementations are available via {@link #permitAll()} and {@link #withBasicCredentials(String, String)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Authenticator {
	/**
	 * Is this request authenticated?
	 *
	 * @param request the request to check
	 * @return {@code true} if the request may proceed, {@code false} if it should be answered with HTTP 401
	 */
	@NonNull
	Boolean isAuthenticated(@NonNull Request request);

	/**
	 * Acquires an authenticator that lets every request through.
	 *
	 * @return an authenticator which performs no check
	 */
	@NonNull
	static Authenticator permitAll() {
		return request -> true;
	}

	/**
	 * Acquires an authenticator that requires an {@code Authorization: Basic ...} header carrying exactly this username and password.
	 *
	 * @param username the expected username
	 * @param password the expected password
	 * @return an HTTP Basic authenticator
	 */
	@NonNull
	static Authenticator withBasicCredentials(@NonNull String username,
																						@NonNull String password) {
		requireNonNull(username);
		requireNonNull(password);

		return new BasicAuthenticator(username, password);
	}
}
