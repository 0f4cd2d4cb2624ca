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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Locale;

import static com.sluice.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * HTTP Basic (RFC 7617) check against a single configured username/password pair.
 * <p>
 * A missing header, a different scheme, malformed base64, a credential without a {@code :} separator and mismatched
 * credentials are all indistinguishable to the caller.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class BasicAuthenticator implements Authenticator {
	@NonNull
	private static final String BASIC_SCHEME_PREFIX;

	static {
		BASIC_SCHEME_PREFIX = "basic ";
	}

	@NonNull
	private final String username;
	@NonNull
	private final byte[] expectedCredentials;

	BasicAuthenticator(@NonNull String username,
										 @NonNull String password) {
		requireNonNull(username);
		requireNonNull(password);

		this.username = username;
		this.expectedCredentials = format("%s:%s", username, password).getBytes(StandardCharsets.UTF_8);
	}

	@Override
	@NonNull
	public Boolean isAuthenticated(@NonNull Request request) {
		requireNonNull(request);

		byte[] presentedCredentials = extractCredentials(request.getAuthorization().orElse(null));

		if (presentedCredentials == null)
			return false;

		// Constant-time comparison
		return MessageDigest.isEqual(getExpectedCredentials(), presentedCredentials);
	}

	@Nullable
	private byte[] extractCredentials(@Nullable String authorizationHeaderValue) {
		authorizationHeaderValue = trimAggressivelyToNull(authorizationHeaderValue);

		if (authorizationHeaderValue == null)
			return null;

		if (!authorizationHeaderValue.toLowerCase(Locale.ROOT).startsWith(BASIC_SCHEME_PREFIX))
			return null;

		String token = trimAggressivelyToNull(authorizationHeaderValue.substring(BASIC_SCHEME_PREFIX.length()));

		if (token == null)
			return null;

		byte[] credentials;

		try {
			credentials = Base64.getDecoder().decode(token);
		} catch (IllegalArgumentException ignored) {
			// Not valid base64
			return null;
		}

		for (byte b : credentials)
			if (b == ':')
				return credentials;

		return null;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{username=%s}", getClass().getSimpleName(), getUsername());
	}

	@NonNull
	String getUsername() {
		return this.username;
	}

	@NonNull
	private byte[] getExpectedCredentials() {
		return this.expectedCredentials;
	}
}
