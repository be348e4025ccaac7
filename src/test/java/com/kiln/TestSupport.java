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

package com.kiln;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Raw-socket helpers for driving a running Kiln.
 */
final class TestSupport {
	private TestSupport() {}

	/**
	 * A port nothing is listening on at the moment of the call.
	 */
	static int findFreePort() throws IOException {
		try (ServerSocket socket = new ServerSocket()) {
			socket.bind(new InetSocketAddress("127.0.0.1", 0));
			return socket.getLocalPort();
		}
	}

	/**
	 * Connects to a listener that may still be coming up, giving up after {@code patienceMillis}.
	 */
	static Socket connectWithRetry(String host, int port, int patienceMillis) throws IOException, InterruptedException {
		long giveUpAt = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(patienceMillis);

		for (int attempt = 1; ; attempt++) {
			Socket socket = new Socket();

			try {
				socket.connect(new InetSocketAddress(host, port), patienceMillis);
				socket.setSoTimeout(5_000);
				return socket;
			} catch (IOException e) {
				socket.close();

				if (System.nanoTime() - giveUpAt >= 0)
					throw new IOException("Gave up connecting to " + host + ":" + port + " after " + attempt + " attempts", e);

				Thread.sleep(25);
			}
		}
	}

	static void writeAscii(Socket socket, String text) throws IOException {
		OutputStream out = socket.getOutputStream();
		out.write(text.getBytes(StandardCharsets.US_ASCII));
		out.flush();
	}

	/**
	 * Reads one response whose length is given by Content-Length (or which has no body), returning the raw text.
	 */
	static String readResponse(InputStream in) throws IOException {
		ByteArrayOutputStream head = new ByteArrayOutputStream();
		int matched = 0;
		while (matched < 4) {
			int b = in.read();
			if (b == -1) break;
			head.write(b);
			matched = (b == (matched % 2 == 0 ? '\r' : '\n')) ? matched + 1 : (b == '\r' ? 1 : 0);
		}
		String headers = head.toString(StandardCharsets.ISO_8859_1);
		int contentLength = 0;
		for (String line : headers.split("\r\n")) {
			int colon = line.indexOf(':');
			if (colon > 0 && line.substring(0, colon).trim().equalsIgnoreCase("Content-Length"))
				contentLength = Integer.parseInt(line.substring(colon + 1).trim());
		}
		byte[] body = in.readNBytes(contentLength);
		return headers + new String(body, StandardCharsets.UTF_8);
	}

	static Integer statusCodeOf(String rawResponse) {
		String statusLine = rawResponse.substring(0, rawResponse.indexOf("\r\n"));
		return Integer.valueOf(statusLine.split(" ")[1]);
	}

	static String bodyOf(String rawResponse) {
		int index = rawResponse.indexOf("\r\n\r\n");
		return index == -1 ? "" : rawResponse.substring(index + 4);
	}
}
