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
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.KeyStore;
import java.security.cert.CertificateFactory;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static com.sluice.TestSupport.bodyOf;
import static com.sluice.TestSupport.deflate;
import static com.sluice.TestSupport.exchangeRaw;
import static com.sluice.TestSupport.findFreePort;
import static com.sluice.TestSupport.gzip;
import static com.sluice.TestSupport.postRequestBytes;
import static com.sluice.TestSupport.readAll;
import static com.sluice.TestSupport.statusCodeOf;
import static com.sluice.TestSupport.utf8;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SluiceIntegrationTests {
	private static SluiceConfig.Builder localConfig() {
		return SluiceConfig.withPort(0)
				.host("127.0.0.1")
				.threads(2)
				.lifecycleObserver(new TestSupport.QuietLifecycleObserver());
	}

	private static String post(Sluice sluice, String contentType, Map<String, String> headers, byte[] body) throws Exception {
		return exchangeRaw(sluice.getLocalPort().orElseThrow(), postRequestBytes(contentType, headers, body));
	}

	private static String basicAuthorization(String user, String password) {
		return "Basic " + Base64.getEncoder().encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
	}

	private static Path testResource(String name) throws Exception {
		return Paths.get(SluiceIntegrationTests.class.getResource("/" + name).toURI());
	}

	@Test
	public void plain_text_event_carries_message_and_host() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();

		try (Sluice sluice = Sluice.withConfig(localConfig().build(), EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			String response = post(sluice, "text/plain", Map.of(), utf8("hello"));

			Assertions.assertEquals(200, statusCodeOf(response));
			Assertions.assertEquals("ok", bodyOf(response));
			Assertions.assertTrue(response.contains("Content-Type: text/plain; charset=UTF-8\r\n"));

			Event event = queue.poll(5, TimeUnit.SECONDS);
			Assertions.assertNotNull(event);
			Assertions.assertEquals("hello", event.getMessage().orElseThrow());
			Assertions.assertEquals("127.0.0.1", event.getHost().orElseThrow());
			Assertions.assertTrue(queue.isEmpty());
		}
	}

	@Test
	public void compressed_bodies_are_decoded() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();
		byte[] json = utf8("{\"message\":\"compressed\",\"level\":\"info\"}");

		try (Sluice sluice = Sluice.withConfig(localConfig().build(), EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			Assertions.assertEquals(200, statusCodeOf(post(sluice, "application/json", Map.of("Content-Encoding", "gzip"), gzip(json))));
			Assertions.assertEquals(200, statusCodeOf(post(sluice, "application/json", Map.of("Content-Encoding", "deflate"), deflate(json, false))));
			Assertions.assertEquals(200, statusCodeOf(post(sluice, "application/json", Map.of("Content-Encoding", "DEFLATE"), deflate(json, true))));

			Assertions.assertEquals(3, queue.size());

			for (Event event : queue) {
				Assertions.assertEquals("compressed", event.getMessage().orElseThrow());
				Assertions.assertEquals("info", event.getField("level").orElseThrow());
			}
		}
	}

	@Test
	public void invalid_compressed_body_is_400() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();

		try (Sluice sluice = Sluice.withConfig(localConfig().build(), EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			String response = post(sluice, "text/plain", Map.of("Content-Encoding", "gzip"), utf8("definitely not gzip"));

			Assertions.assertEquals(400, statusCodeOf(response));
			Assertions.assertEquals("Failed to decompress body", bodyOf(response));
			Assertions.assertTrue(queue.isEmpty());
		}
	}

	@Test
	public void empty_body_with_compressed_encoding_is_400() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();

		try (Sluice sluice = Sluice.withConfig(localConfig().build(), EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			for (String contentEncoding : List.of("gzip", "deflate")) {
				String response = post(sluice, "text/plain", Map.of("Content-Encoding", contentEncoding), new byte[0]);

				Assertions.assertEquals(400, statusCodeOf(response), contentEncoding);
				Assertions.assertEquals("Failed to decompress body", bodyOf(response), contentEncoding);
			}

			Assertions.assertTrue(queue.isEmpty());
		}
	}

	@Test
	public void line_codec_emits_one_event_per_line_in_order() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();

		try (Sluice sluice = Sluice.withConfig(localConfig().codec("line").build(), EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			Assertions.assertEquals(200, statusCodeOf(post(sluice, "text/plain", Map.of(), utf8("foo\nbar"))));

			List<String> messages = new ArrayList<>();
			for (Event event : queue)
				messages.add(event.getMessage().orElseThrow());

			Assertions.assertEquals(List.of("foo", "bar"), messages);
		}
	}

	@Test
	public void json_content_type_uses_json_codec_by_default() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();

		try (Sluice sluice = Sluice.withConfig(localConfig().build(), EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			Assertions.assertEquals(200, statusCodeOf(post(sluice, "application/json; charset=UTF-8", Map.of(),
					utf8("[{\"id\":1},{\"id\":2}]"))));
			Assertions.assertEquals(2, queue.size());

			String response = post(sluice, "application/json", Map.of(), utf8("{not json"));
			Assertions.assertEquals(400, statusCodeOf(response));
			Assertions.assertTrue(bodyOf(response).startsWith("Failed to decode body: "));
			Assertions.assertEquals(2, queue.size());
		}
	}

	@Test
	public void additional_codecs_override_replaces_json_default() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();
		SluiceConfig config = localConfig()
				.additionalCodecs(Map.of("application/json", "plain"))
				.build();

		try (Sluice sluice = Sluice.withConfig(config, EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			Assertions.assertEquals(200, statusCodeOf(post(sluice, "application/json", Map.of(), utf8("{\"a\":1}"))));

			Event event = queue.poll(5, TimeUnit.SECONDS);
			Assertions.assertNotNull(event);
			Assertions.assertEquals("{\"a\":1}", event.getMessage().orElseThrow());
			Assertions.assertTrue(event.getField("a").isEmpty());
		}
	}

	@Test
	public void authentication_matrix() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();
		SluiceConfig config = localConfig()
				.user("test")
				.password("pass")
				.build();

		try (Sluice sluice = Sluice.withConfig(config, EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			List<Map<String, String>> rejectedHeaderSets = List.of(
					Map.of(),
					Map.of("Authorization", basicAuthorization("test", "wrong")),
					Map.of("Authorization", "Bearer dGVzdDpwYXNz"));

			for (Map<String, String> headers : rejectedHeaderSets) {
				String response = post(sluice, "text/plain", headers, utf8("hello"));

				Assertions.assertEquals(401, statusCodeOf(response), headers.toString());
				Assertions.assertTrue(response.contains("WWW-Authenticate: Basic realm=\"sluice\"\r\n"));
				Assertions.assertEquals("", bodyOf(response));
			}

			Assertions.assertTrue(queue.isEmpty());

			String response = post(sluice, "text/plain", Map.of("Authorization", basicAuthorization("test", "pass")), utf8("hello"));

			Assertions.assertEquals(200, statusCodeOf(response));
			Assertions.assertEquals(1, queue.size());
		}
	}

	@Test
	public void saturated_queue_turns_into_429_and_recovers_after_drain() throws Exception {
		int threads = 2;
		CountDownLatch requestsStarted = new CountDownLatch(threads);

		// Already full: every enqueue blocks until the test drains
		BlockingQueue<Event> queue = new ArrayBlockingQueue<>(1);
		queue.add(Event.withMessage("backlog"));

		SluiceConfig config = localConfig()
				.threads(threads)
				.lifecycleObserver(new TestSupport.QuietLifecycleObserver() {
					@Override
					public void didStartRequestHandling(@NonNull Request request) {
						requestsStarted.countDown();
					}
				})
				.build();

		try (Sluice sluice = Sluice.withConfig(config, EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			List<CompletableFuture<String>> blockedResponses = new ArrayList<>();

			for (int i = 0; i < threads; ++i) {
				String message = "blocked-" + i;
				blockedResponses.add(CompletableFuture.supplyAsync(() -> {
					try {
						return post(sluice, "text/plain", Map.of(), utf8(message));
					} catch (Exception e) {
						throw new RuntimeException(e);
					}
				}));
			}

			Assertions.assertTrue(requestsStarted.await(5, TimeUnit.SECONDS), "Every worker should be busy");

			for (int i = 0; i < 5; ++i) {
				String response = post(sluice, "text/plain", Map.of(), utf8("overflow-" + i));
				Assertions.assertEquals(429, statusCodeOf(response));
				Assertions.assertEquals("", bodyOf(response));
			}

			// Drain: the backlog plus one event per blocked request
			List<String> drained = new ArrayList<>();

			for (int i = 0; i < threads + 1; ++i) {
				Event event = queue.poll(5, TimeUnit.SECONDS);
				Assertions.assertNotNull(event);
				drained.add(event.getMessage().orElseThrow());
			}

			Assertions.assertEquals("backlog", drained.get(0));
			Assertions.assertFalse(drained.stream().anyMatch(message -> message.startsWith("overflow")));

			for (CompletableFuture<String> blockedResponse : blockedResponses)
				Assertions.assertEquals(200, statusCodeOf(blockedResponse.get(5, TimeUnit.SECONDS)));

			// Slots free up once the blocked responses have been written
			String recovered = null;

			for (int i = 0; i < 50 && (recovered == null || statusCodeOf(recovered) != 200); ++i) {
				recovered = post(sluice, "text/plain", Map.of(), utf8("recovered"));

				if (statusCodeOf(recovered) != 200)
					Thread.sleep(20);
			}

			Assertions.assertEquals(200, statusCodeOf(recovered));
			Assertions.assertEquals("recovered", queue.poll(5, TimeUnit.SECONDS).getMessage().orElseThrow());
		}
	}

	@Test
	public void non_post_is_405() throws Exception {
		try (Sluice sluice = Sluice.withConfig(localConfig().build(), EventQueue.fromBlockingQueue(new LinkedBlockingQueue<>()))) {
			sluice.start();

			String response = exchangeRaw(sluice.getLocalPort().orElseThrow(),
					"GET /anything HTTP/1.1\r\nHost: 127.0.0.1\r\n\r\n".getBytes(StandardCharsets.US_ASCII));

			Assertions.assertEquals(405, statusCodeOf(response));
			Assertions.assertTrue(response.contains("Allow: POST\r\n"));
		}
	}

	@Test
	public void oversized_body_is_413() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();

		try (Sluice sluice = Sluice.withConfig(localConfig().maximumContentLength(16).build(), EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			String response = post(sluice, "text/plain", Map.of(), utf8("this body is longer than sixteen bytes"));

			Assertions.assertEquals(413, statusCodeOf(response));
			Assertions.assertTrue(queue.isEmpty());
		}
	}

	@Test
	public void request_headers_are_stored_in_target_field() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();

		try (Sluice sluice = Sluice.withConfig(localConfig().requestHeadersTargetField("headers").build(), EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			Map<String, String> headers = new LinkedHashMap<>();
			headers.put("X-Request-Id", "abc-123");

			Assertions.assertEquals(200, statusCodeOf(post(sluice, "text/plain", headers, utf8("hello"))));

			@SuppressWarnings("unchecked")
			Map<String, Object> storedHeaders = (Map<String, Object>) queue.poll(5, TimeUnit.SECONDS).getField("headers").orElseThrow();

			Assertions.assertEquals("abc-123", storedHeaders.get("x-request-id"));
			Assertions.assertEquals("POST", storedHeaders.get("request_method"));
		}
	}

	@Test
	public void properties_file_configuration_end_to_end() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();
		SluiceConfig config = SluiceConfig.withPropertiesFile(testResource("sluice-test.properties"))
				.port(0)
				.lifecycleObserver(new TestSupport.QuietLifecycleObserver())
				.build();

		try (Sluice sluice = Sluice.withConfig(config, EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			String unauthorized = post(sluice, "text/plain", Map.of(), utf8("a"));
			Assertions.assertEquals(401, statusCodeOf(unauthorized));
			Assertions.assertTrue(unauthorized.contains("X-Intake: sluice\r\n"), "Configured headers go on every response");

			String response = post(sluice, "application/x-ndjson", Map.of("Authorization", basicAuthorization("ingest", "s3cret")),
					utf8("{\"n\":1}\n\n{\"n\":2}\n"));

			Assertions.assertEquals(202, statusCodeOf(response));
			Assertions.assertTrue(response.contains("Access-Control-Allow-Origin: *\r\n"));
			Assertions.assertEquals(2, queue.size());
		}
	}

	@Test
	public void tls_round_trip() throws Exception {
		BlockingQueue<Event> queue = new LinkedBlockingQueue<>();
		SluiceConfig config = localConfig()
				.ssl(true)
				.keystore(testResource("keystore.p12"))
				.keystorePassword("changeit")
				.build();

		try (Sluice sluice = Sluice.withConfig(config, EventQueue.fromBlockingQueue(queue))) {
			sluice.start();

			SSLContext sslContext = clientSslContextTrusting(testResource("certificate.pem"));

			try (SSLSocket socket = (SSLSocket) sslContext.getSocketFactory().createSocket("127.0.0.1", sluice.getLocalPort().orElseThrow())) {
				socket.setSoTimeout(5000);

				OutputStream out = socket.getOutputStream();
				out.write(postRequestBytes("text/plain", Map.of(), utf8("secure hello")));
				out.flush();

				String response = new String(readAll(socket.getInputStream()), StandardCharsets.ISO_8859_1);

				Assertions.assertEquals(200, statusCodeOf(response));
				Assertions.assertEquals("ok", bodyOf(response));
			}

			Event event = queue.poll(5, TimeUnit.SECONDS);
			Assertions.assertNotNull(event);
			Assertions.assertEquals("secure hello", event.getMessage().orElseThrow());
			Assertions.assertEquals("127.0.0.1", event.getHost().orElseThrow());
		}
	}

	@Test
	public void tls_without_keystore_material_fails_before_binding() {
		Assertions.assertThrows(ConfigurationException.class, () -> localConfig().ssl(true).build());
		Assertions.assertThrows(ConfigurationException.class, () -> localConfig().ssl(true).keystorePassword("changeit").build());
	}

	@Test
	public void unusable_keystore_fails_at_start_and_leaves_port_free(@TempDir Path tempDir) throws Exception {
		Path emptyKeystore = Files.createFile(tempDir.resolve("empty.p12"));
		int port = findFreePort();

		SluiceConfig config = localConfig()
				.port(port)
				.ssl(true)
				.keystore(emptyKeystore)
				.keystorePassword("changeit")
				.build();

		Sluice sluice = Sluice.withConfig(config, EventQueue.fromBlockingQueue(new LinkedBlockingQueue<>()));

		Assertions.assertThrows(ConfigurationException.class, sluice::start);
		Assertions.assertFalse(sluice.isStarted());

		try (ServerSocket serverSocket = new ServerSocket()) {
			serverSocket.bind(new InetSocketAddress("127.0.0.1", port));
		}
	}

	@Test
	public void wrong_keystore_password_fails_at_start() throws Exception {
		SluiceConfig config = localConfig()
				.ssl(true)
				.keystore(testResource("keystore.p12"))
				.keystorePassword("not-the-password")
				.build();

		try (Sluice sluice = Sluice.withConfig(config, EventQueue.fromBlockingQueue(new LinkedBlockingQueue<>()))) {
			Assertions.assertThrows(ConfigurationException.class, sluice::start);
			Assertions.assertFalse(sluice.isStarted());
		}
	}

	private static SSLContext clientSslContextTrusting(Path certificatePem) throws Exception {
		KeyStore trustStore = KeyStore.getInstance("PKCS12");
		trustStore.load(null, null);

		try (InputStream inputStream = Files.newInputStream(certificatePem)) {
			trustStore.setCertificateEntry("sluice", CertificateFactory.getInstance("X.509").generateCertificate(inputStream));
		}

		TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
		trustManagerFactory.init(trustStore);

		SSLContext sslContext = SSLContext.getInstance("TLS");
		sslContext.init(null, trustManagerFactory.getTrustManagers(), null);

		return sslContext;
	}
}
