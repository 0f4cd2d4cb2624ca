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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
final class TestSupport {
	private TestSupport() {}

	static int findFreePort() throws IOException {
		try (ServerSocket ss = new ServerSocket(0)) {
			ss.setReuseAddress(true);
			return ss.getLocalPort();
		}
	}

	static byte[] readAll(InputStream in) throws IOException {
		if (in == null) return new byte[0];
		try (InputStream is = in) {
			ByteArrayOutputStream bos = new ByteArrayOutputStream();
			byte[] buf = new byte[8192];
			int n;
			while ((n = is.read(buf)) != -1) {
				bos.write(buf, 0, n);
			}
			return bos.toByteArray();
		}
	}

	static Socket connectWithRetry(String host, int port, int timeoutMs) throws IOException, InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMs;
		IOException last = null;
		while (System.currentTimeMillis() < deadline) {
			try {
				Socket s = new Socket();
				s.connect(new InetSocketAddress(host, port), Math.max(250, timeoutMs / 2));
				return s;
			} catch (IOException e) {
				last = e;
				Thread.sleep(30);
			}
		}
		throw (last != null ? last : new IOException("Unable to connect to " + host + ":" + port));
	}

	/**
	 * Writes raw bytes to a fresh connection and returns everything the server sends back before closing.
	 */
	static String exchangeRaw(int port, byte[] requestBytes) throws IOException, InterruptedException {
		try (Socket socket = connectWithRetry("127.0.0.1", port, 2000)) {
			socket.setSoTimeout(5000);
			OutputStream out = socket.getOutputStream();
			out.write(requestBytes);
			out.flush();
			return new String(readAll(socket.getInputStream()), StandardCharsets.ISO_8859_1);
		}
	}

	static byte[] postRequestBytes(String contentType, Map<String, String> headers, byte[] body) {
		StringBuilder head = new StringBuilder();
		head.append("POST / HTTP/1.1\r\n");
		head.append("Host: 127.0.0.1\r\n");
		if (contentType != null) head.append("Content-Type: ").append(contentType).append("\r\n");
		for (Map.Entry<String, String> e : headers.entrySet()) head.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
		head.append("Content-Length: ").append(body.length).append("\r\n\r\n");

		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		bos.writeBytes(head.toString().getBytes(StandardCharsets.ISO_8859_1));
		bos.writeBytes(body);
		return bos.toByteArray();
	}

	static int statusCodeOf(String rawResponse) {
		// "HTTP/1.1 200 OK"
		return Integer.parseInt(rawResponse.substring(9, 12));
	}

	static String bodyOf(String rawResponse) {
		int index = rawResponse.indexOf("\r\n\r\n");
		return index == -1 ? "" : rawResponse.substring(index + 4);
	}

	static byte[] gzip(byte[] bytes) throws IOException {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		try (GZIPOutputStream gz = new GZIPOutputStream(bos)) {
			gz.write(bytes);
		}
		return bos.toByteArray();
	}

	static byte[] deflate(byte[] bytes, boolean raw) throws IOException {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		try (DeflaterOutputStream out = new DeflaterOutputStream(bos, new Deflater(Deflater.DEFAULT_COMPRESSION, raw))) {
			out.write(bytes);
		}
		return bos.toByteArray();
	}

	static byte[] utf8(String string) {
		return string.getBytes(StandardCharsets.UTF_8);
	}

	static class QuietLifecycleObserver implements LifecycleObserver {
		@Override
		public void didReceiveLogEvent(@NonNull LogEvent logEvent) { /* quiet */ }
	}
}
