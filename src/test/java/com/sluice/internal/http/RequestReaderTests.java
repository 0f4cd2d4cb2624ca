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
import com.sluice.Request;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/*
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class RequestReaderTests {
	private static final RequestReader REQUEST_READER = RequestReader.withMaximumBodySizeInBytes(1024);

	private static Optional<Request> read(String raw) throws Exception {
		return read(REQUEST_READER, raw, new ByteArrayOutputStream());
	}

	private static Optional<Request> read(RequestReader requestReader,
																				String raw,
																				ByteArrayOutputStream interimOutput) throws Exception {
		return requestReader.readRequest(new ByteArrayInputStream(raw.getBytes(StandardCharsets.ISO_8859_1)), interimOutput,
				new InetSocketAddress("127.0.0.1", 40000));
	}

	@Test
	public void reads_content_length_body() throws Exception {
		Request request = read("POST /ingest HTTP/1.1\r\nHost: x\r\nContent-Type: text/plain\r\nContent-Length: 5\r\n\r\nhello").orElseThrow();

		Assertions.assertEquals("POST", request.getMethod());
		Assertions.assertEquals("/ingest", request.getUri());
		Assertions.assertEquals("text/plain", request.getContentType().orElseThrow());
		Assertions.assertEquals("hello", new String(request.getBody(), StandardCharsets.UTF_8));
		Assertions.assertEquals("127.0.0.1", request.getRemoteHost().orElseThrow());
	}

	@Test
	public void header_names_are_case_insensitive() throws Exception {
		Request request = read("POST / HTTP/1.1\r\ncontent-ENCODING: gzip\r\nContent-Length: 0\r\n\r\n").orElseThrow();
		Assertions.assertEquals("gzip", request.getContentEncoding().orElseThrow());
	}

	@Test
	public void reads_chunked_body_and_discards_trailers() throws Exception {
		Request request = read("POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n"
				+ "3;name=value\r\nfoo\r\n"
				+ "4\r\n\nbar\r\n"
				+ "0\r\nX-Trailer: yes\r\n\r\n").orElseThrow();

		Assertions.assertEquals("foo\nbar", new String(request.getBody(), StandardCharsets.UTF_8));
		Assertions.assertTrue(request.getHeader("X-Trailer").isEmpty());
	}

	@Test
	public void tolerates_bare_lf_and_leading_blank_lines() throws Exception {
		Request request = read("\r\n\nPOST / HTTP/1.1\nContent-Length: 2\n\nok").orElseThrow();
		Assertions.assertEquals("ok", new String(request.getBody(), StandardCharsets.UTF_8));
	}

	@Test
	public void missing_body_framing_means_empty_body() throws Exception {
		Request request = read("POST / HTTP/1.1\r\nHost: x\r\n\r\n").orElseThrow();
		Assertions.assertEquals(0, request.getBody().length);
	}

	@Test
	public void empty_stream_yields_no_request() throws Exception {
		Assertions.assertTrue(read("").isEmpty());
	}

	@Test
	public void identical_content_length_values_are_accepted() throws Exception {
		Request request = read("POST / HTTP/1.1\r\nContent-Length: 2, 2\r\n\r\nok").orElseThrow();
		Assertions.assertEquals(2, request.getBody().length);
	}

	@Test
	public void malformed_requests_are_rejected() {
		Map<String, String> malformedRequestsByDescription = Map.of(
				"two-part request line", "POST /\r\n\r\n",
				"unsupported version", "POST / HTTP/2.0\r\n\r\n",
				"header without colon", "POST / HTTP/1.1\r\nNoColonHere\r\n\r\n",
				"obsolete line folding", "POST / HTTP/1.1\r\nX-A: 1\r\n continued\r\n\r\n",
				"non-numeric content length", "POST / HTTP/1.1\r\nContent-Length: abc\r\n\r\n",
				"conflicting content lengths", "POST / HTTP/1.1\r\nContent-Length: 1\r\nContent-Length: 2\r\n\r\nab",
				"content length with transfer encoding", "POST / HTTP/1.1\r\nContent-Length: 3\r\nTransfer-Encoding: chunked\r\n\r\n0\r\n\r\n",
				"unsupported transfer encoding", "POST / HTTP/1.1\r\nTransfer-Encoding: gzip, chunked\r\n\r\n0\r\n\r\n",
				"truncated body", "POST / HTTP/1.1\r\nContent-Length: 10\r\n\r\nshort",
				"invalid chunk size", "POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\nzz\r\n\r\n");

		for (Map.Entry<String, String> entry : malformedRequestsByDescription.entrySet())
			Assertions.assertThrows(MalformedRequestException.class, () -> read(entry.getValue()), entry.getKey());
	}

	@Test
	public void headers_ended_by_eof_are_malformed() {
		Assertions.assertThrows(MalformedRequestException.class, () -> read("POST / HTTP/1.1\r\nHost: x\r\n"));
	}

	@Test
	public void oversized_content_length_is_rejected_before_reading() {
		ContentTooLargeException e = Assertions.assertThrows(ContentTooLargeException.class,
				() -> read("POST / HTTP/1.1\r\nContent-Length: 1025\r\n\r\n"));

		Assertions.assertEquals(1024, e.getMaximumSizeInBytes());
	}

	@Test
	public void oversized_chunked_body_is_rejected() {
		RequestReader requestReader = RequestReader.withMaximumBodySizeInBytes(4);

		Assertions.assertThrows(ContentTooLargeException.class, () -> read(requestReader,
				"POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n3\r\nabc\r\n3\r\ndef\r\n0\r\n\r\n", new ByteArrayOutputStream()));
	}

	@Test
	public void expect_continue_writes_interim_response() throws Exception {
		ByteArrayOutputStream interimOutput = new ByteArrayOutputStream();
		read(REQUEST_READER, "POST / HTTP/1.1\r\nExpect: 100-continue\r\nContent-Length: 2\r\n\r\nok", interimOutput);

		Assertions.assertEquals("HTTP/1.1 100 Continue\r\n\r\n", interimOutput.toString(StandardCharsets.US_ASCII));
	}

	@Test
	public void expect_continue_is_not_answered_for_oversized_body() {
		ByteArrayOutputStream interimOutput = new ByteArrayOutputStream();

		Assertions.assertThrows(ContentTooLargeException.class,
				() -> read(REQUEST_READER, "POST / HTTP/1.1\r\nExpect: 100-continue\r\nContent-Length: 5000\r\n\r\n", interimOutput));
		Assertions.assertEquals(0, interimOutput.size());
	}

	@Test
	public void response_writer_frames_body_and_closes() throws Exception {
		ByteArrayOutputStream output = new ByteArrayOutputStream();

		ResponseWriter.writeResponse(output, MarshaledResponse.withStatusCode(429)
				.header("X-Intake", "sluice")
				.header("Connection", "keep-alive")
				.build());

		String raw = output.toString(StandardCharsets.ISO_8859_1);

		Assertions.assertTrue(raw.startsWith("HTTP/1.1 429 Too Many Requests\r\n"), raw);
		Assertions.assertTrue(raw.contains("X-Intake: sluice\r\n"), raw);
		Assertions.assertTrue(raw.contains("Content-Length: 0\r\n"), raw);
		Assertions.assertTrue(raw.contains("Connection: close\r\n"), raw);
		Assertions.assertFalse(raw.contains("keep-alive"), raw);
		Assertions.assertTrue(raw.endsWith("\r\n\r\n"), raw);
	}

	@Test
	public void response_writer_omits_content_length_for_204() throws Exception {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		ResponseWriter.writeResponse(output, MarshaledResponse.withStatusCode(204).build());

		String raw = output.toString(StandardCharsets.ISO_8859_1);

		Assertions.assertTrue(raw.startsWith("HTTP/1.1 204 No Content\r\n"), raw);
		Assertions.assertFalse(raw.contains("Content-Length"), raw);
	}
}
