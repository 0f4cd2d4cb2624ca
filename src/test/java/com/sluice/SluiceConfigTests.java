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

import com.sluice.exception.ConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SluiceConfigTests {
	@TempDir
	Path temporaryDirectory;

	@Test
	public void defaults_are_applied() {
		SluiceConfig config = SluiceConfig.withPort(8080).build();

		Assertions.assertEquals("0.0.0.0", config.getHost());
		Assertions.assertEquals(8080, config.getPort());
		Assertions.assertEquals(Runtime.getRuntime().availableProcessors(), config.getThreads());
		Assertions.assertFalse(config.getSsl());
		Assertions.assertEquals("plain", config.getCodecRegistry().getDefaultCodecId());
		Assertions.assertEquals(200, config.getResponseCode());
		Assertions.assertEquals(100 * 1024 * 1024, config.getMaximumContentLength());
		Assertions.assertEquals(Duration.ofSeconds(60), config.getRequestTimeout());
		Assertions.assertTrue(config.getRequestHeadersTargetField().isEmpty());
		Assertions.assertTrue(config.getResponseHeaders().isEmpty());
	}

	@Test
	public void ssl_without_keystore_is_rejected() {
		ConfigurationException exception = Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0)
				.ssl(true)
				.keystorePassword("changeit")
				.build());

		Assertions.assertTrue(exception.getMessage().contains("keystore"), exception.getMessage());
	}

	@Test
	public void ssl_without_keystore_password_is_rejected() throws Exception {
		Path keystore = Files.createTempFile(this.temporaryDirectory, "keystore", ".p12");

		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0)
				.ssl(true)
				.keystore(keystore)
				.build());
	}

	@Test
	public void ssl_with_missing_keystore_file_is_rejected() {
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0)
				.ssl(true)
				.keystore(this.temporaryDirectory.resolve("does-not-exist.p12"))
				.keystorePassword("changeit")
				.build());
	}

	@Test
	public void ssl_with_keystore_and_password_is_accepted() throws Exception {
		// Contents are only checked when the server starts
		Path keystore = Files.createTempFile(this.temporaryDirectory, "keystore", ".p12");

		SluiceConfig config = SluiceConfig.withPort(0)
				.ssl(true)
				.keystore(keystore)
				.keystorePassword("changeit")
				.build();

		Assertions.assertTrue(config.getSsl());
		Assertions.assertEquals(keystore, config.getKeystore().orElseThrow());
	}

	@Test
	public void user_and_password_must_be_configured_together() {
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0).user("test").build());
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0).password("pass").build());
	}

	@Test
	public void credentials_select_basic_authenticator() {
		SluiceConfig config = SluiceConfig.withPort(0).user("test").password("pass").build();

		Request unauthenticated = Request.withMethodAndUri("POST", "/").build();

		Assertions.assertFalse(config.getAuthenticator().isAuthenticated(unauthenticated));
		Assertions.assertTrue(SluiceConfig.withPort(0).build().getAuthenticator().isAuthenticated(unauthenticated));
	}

	@Test
	public void illegal_values_are_rejected() {
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(70_000).build());
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0).threads(0).build());
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0).responseCode(302).build());
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0).maximumContentLength(0).build());
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0).requestTimeout(Duration.ZERO).build());
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0).codec("avro").build());
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0)
				.additionalCodecs(Map.of("application/json", "avro"))
				.build());
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withPort(0)
				.responseHeaders(Map.of("Bad Header", "value"))
				.build());
	}

	@Test
	public void permitted_response_codes_are_accepted() {
		for (int responseCode : new int[]{200, 201, 202, 204})
			Assertions.assertEquals(responseCode, SluiceConfig.withPort(0).responseCode(responseCode).build().getResponseCode());
	}

	@Test
	public void properties_file_populates_every_key() throws Exception {
		Path propertiesFile = Path.of(getClass().getResource("/sluice-test.properties").toURI());

		SluiceConfig config = SluiceConfig.withPropertiesFile(propertiesFile).build();

		Assertions.assertEquals("127.0.0.1", config.getHost());
		Assertions.assertEquals(9090, config.getPort());
		Assertions.assertEquals(3, config.getThreads());
		Assertions.assertEquals("line", config.getCodecRegistry().getDefaultCodecId());
		Assertions.assertEquals("json_lines", config.getCodecRegistry().resolveCodecId("application/x-ndjson"));
		Assertions.assertEquals("plain", config.getCodecRegistry().resolveCodecId("application/json"));
		Assertions.assertEquals("sluice", config.getResponseHeaders().get("x-intake"));
		Assertions.assertEquals("*", config.getResponseHeaders().get("Access-Control-Allow-Origin"));
		Assertions.assertEquals(202, config.getResponseCode());
		Assertions.assertEquals(1_048_576, config.getMaximumContentLength());
		Assertions.assertEquals(Duration.ofSeconds(5), config.getRequestTimeout());
		Assertions.assertEquals(Duration.ofSeconds(2), config.getShutdownTimeout());
		Assertions.assertEquals("headers", config.getRequestHeadersTargetField().orElseThrow());
		Assertions.assertEquals("ingest", config.getUser().orElseThrow());
	}

	@Test
	public void in_memory_properties_use_the_same_keys() {
		Map<String, String> properties = new HashMap<>();
		properties.put("port", "0");
		properties.put("ssl", "false");
		properties.put("codec", "json");

		SluiceConfig config = SluiceConfig.withProperties(properties).build();

		Assertions.assertEquals(0, config.getPort());
		Assertions.assertEquals("json", config.getCodecRegistry().getDefaultCodecId());
	}

	@Test
	public void properties_with_ssl_but_no_keystore_fail_at_build() {
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withProperties(Map.of("ssl", "true")).build());
	}

	@Test
	public void unknown_or_unparseable_properties_fail_fast() {
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withProperties(Map.of("prot", "8080")));
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withProperties(Map.of("port", "eighty")));
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withProperties(Map.of("ssl", "yes")));
		Assertions.assertThrows(ConfigurationException.class, () -> SluiceConfig.withProperties(Map.of("request_timeout", "1.5")));
	}

	@Test
	public void missing_properties_file_fails() {
		Assertions.assertThrows(ConfigurationException.class,
				() -> SluiceConfig.withPropertiesFile(this.temporaryDirectory.resolve("missing.properties")));
	}

	@Test
	public void copy_produces_equivalent_configuration() {
		SluiceConfig original = SluiceConfig.withPort(1234)
				.threads(2)
				.codec("line")
				.additionalCodecs(Map.of("application/json", "plain"))
				.responseHeaders(Map.of("X-Test", "1"))
				.responseCode(201)
				.user("test")
				.password("pass")
				.build();

		SluiceConfig copy = original.copy().port(4321).build();

		Assertions.assertEquals(4321, copy.getPort());
		Assertions.assertEquals(2, copy.getThreads());
		Assertions.assertEquals("line", copy.getCodecRegistry().getDefaultCodecId());
		Assertions.assertEquals("plain", copy.getCodecRegistry().resolveCodecId("application/json"));
		Assertions.assertEquals(Map.of("X-Test", "1"), copy.getResponseHeaders());
		Assertions.assertEquals(201, copy.getResponseCode());
		Assertions.assertEquals("test", copy.getUser().orElseThrow());
	}
}
