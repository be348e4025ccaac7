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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
@Timeout(value = 30, unit = TimeUnit.SECONDS)
public class OutboundRequestTests {
	private KilnClient kilnClient;

	@BeforeEach
	public void openClient() {
		this.kilnClient = KilnClient.withRequestTimeout(Duration.ofSeconds(5));
	}

	@AfterEach
	public void closeClient() {
		this.kilnClient.close();
	}

	@Test
	public void successfulResponseIsParsed() throws Exception {
		try (FakeServer server = FakeServer.respondingWith("HTTP/1.1 200 OK\r\n"
				+ "Content-Type: text/plain; charset=UTF-8\r\n"
				+ "Set-Cookie: session=abc123; Path=/; HttpOnly\r\n"
				+ "X-Multi: 1\r\n"
				+ "x-multi: 2\r\n"
				+ "Content-Length: 5\r\n"
				+ "\r\n"
				+ "hello")) {
			OutboundResponse response = kilnClient.newRequest("127.0.0.1", server.getPort())
					.setParameter("q", "kiln test")
					.setHeader("X-Trace", "t1")
					.setCookie("a", "b")
					.open("/search")
					.get(5, TimeUnit.SECONDS);

			assertEquals(200, response.getStatusCode());
			assertEquals("OK", response.getReasonPhrase());
			assertEquals("HTTP/1.1", response.getProtocol());
			assertEquals("hello", response.getBodyAsString());
			assertEquals(Optional.of("text/plain"), response.getContentType());
			assertEquals(Optional.of("UTF-8"), response.getContentEncoding());
			assertEquals(List.of("1", "2"), response.getHeaderValues("X-MULTI"));
			assertEquals("abc123", response.getCookie("session").orElseThrow().getValue());
			assertTrue(response.getCookie("session").orElseThrow().getHttpOnly());

			String request = server.getRequest();

			assertTrue(request.startsWith("GET /search?q=kiln+test HTTP/1.1\r\n"), request);
			assertTrue(request.contains("Host: 127.0.0.1:" + server.getPort() + "\r\n"), request);
			assertTrue(request.contains("X-Trace: t1\r\n"), request);
			assertTrue(request.contains("Cookie: a=b\r\n"), request);
			assertTrue(request.contains("Connection: close\r\n"), request);
		}
	}

	@Test
	public void callbacksFireExactlyOnce() throws Exception {
		try (FakeServer server = FakeServer.respondingWith("HTTP/1.1 204 No Content\r\n\r\n")) {
			List<Object> outcomes = new CopyOnWriteArrayList<>();
			CountDownLatch finished = new CountDownLatch(1);

			kilnClient.newRequest("127.0.0.1", server.getPort())
					.onFinished(response -> {
						outcomes.add(response.getStatusCode());
						finished.countDown();
					})
					.onFailure(outcomes::add)
					.open("/");

			assertTrue(finished.await(5, TimeUnit.SECONDS));
			Thread.sleep(200);

			assertEquals(List.of(204), outcomes);
		}
	}

	@Test
	public void formParametersGoInTheBodyForPost() throws Exception {
		try (FakeServer server = FakeServer.respondingWith("HTTP/1.1 201 Created\r\nContent-Length: 0\r\n\r\n")) {
			OutboundResponse response = kilnClient.newRequest("127.0.0.1", server.getPort())
					.setMethod(HttpMethod.POST)
					.setParameters(Map.of("name", "kiln"))
					.open("/things")
					.get(5, TimeUnit.SECONDS);

			assertEquals(201, response.getStatusCode());

			String request = server.getRequest();

			assertTrue(request.startsWith("POST /things HTTP/1.1\r\n"), request);
			assertTrue(request.contains("Content-Type: application/x-www-form-urlencoded\r\n"), request);
			assertTrue(request.contains("Content-Length: 9\r\n"), request);
			assertTrue(request.endsWith("\r\n\r\nname=kiln"), request);
		}
	}

	@Test
	public void connectionResetFailsOnce() throws Exception {
		try (FakeServer server = FakeServer.handling(socket -> {
			readRequestHead(socket.getInputStream());
			socket.setSoLinger(true, 0);
			socket.close();
		})) {
			List<OutboundRequestException> failures = new CopyOnWriteArrayList<>();
			List<OutboundResponse> responses = new CopyOnWriteArrayList<>();

			CompletableFuture<OutboundResponse> future = kilnClient.newRequest("127.0.0.1", server.getPort())
					.onFinished(responses::add)
					.onFailure(failures::add)
					.open("/reset");

			OutboundRequestException e = failureOf(future);
			Thread.sleep(200);

			assertTrue(e.getReason() == OutboundFailureReason.CONNECTION_RESET
					|| e.getReason() == OutboundFailureReason.CONNECTION_CLOSED, e.getReason().name());
			assertEquals(1, failures.size());
			assertTrue(responses.isEmpty());
		}
	}

	@Test
	public void truncatedResponseFails() throws Exception {
		try (FakeServer server = FakeServer.respondingWith("HTTP/1.1 200 OK\r\nContent-Length: 100\r\n\r\nshort")) {
			OutboundRequestException e = failureOf(kilnClient.newRequest("127.0.0.1", server.getPort()).open("/"));
			assertEquals(OutboundFailureReason.CONNECTION_CLOSED, e.getReason());
		}
	}

	@Test
	public void responseWithoutLengthEndsAtClose() throws Exception {
		try (FakeServer server = FakeServer.respondingWith("HTTP/1.0 200 OK\r\n\r\nuntil the end")) {
			OutboundResponse response = kilnClient.newRequest("127.0.0.1", server.getPort()).open("/").get(5, TimeUnit.SECONDS);

			assertEquals("until the end", response.getBodyAsString());
			assertFalse(response.isPersistent());
		}
	}

	@Test
	public void malformedResponseFails() throws Exception {
		try (FakeServer server = FakeServer.respondingWith("this is not http\r\n\r\n")) {
			OutboundRequestException e = failureOf(kilnClient.newRequest("127.0.0.1", server.getPort()).open("/"));
			assertEquals(OutboundFailureReason.MALFORMED_RESPONSE, e.getReason());
		}
	}

	@Test
	public void oversizedResponseFails() throws Exception {
		KilnConfig kilnConfig = KilnConfig.withRouteTable(RouteTable.builder().build())
				.maximumOutboundResponseSizeInBytes(1_024)
				.build();

		try (KilnClient limitedClient = KilnClient.fromConfig(kilnConfig)) {
			assertEquals(1_024, limitedClient.getMaximumResponseSizeInBytes());

			try (FakeServer server = FakeServer.respondingWith("HTTP/1.1 200 OK\r\nContent-Length: 2147483647\r\n\r\n")) {
				OutboundRequestException e = failureOf(limitedClient.newRequest("127.0.0.1", server.getPort()).open("/"));
				assertEquals(OutboundFailureReason.RESPONSE_TOO_LARGE, e.getReason());
			}

			try (FakeServer server = FakeServer.respondingWith("HTTP/1.0 200 OK\r\n\r\n" + "x".repeat(4_096))) {
				OutboundRequestException e = failureOf(limitedClient.newRequest("127.0.0.1", server.getPort()).open("/"));
				assertEquals(OutboundFailureReason.RESPONSE_TOO_LARGE, e.getReason());
			}
		}
	}

	@Test
	public void silentServerTimesOut() throws Exception {
		CountDownLatch release = new CountDownLatch(1);

		try (FakeServer server = FakeServer.handling(socket -> {
			readRequestHead(socket.getInputStream());
			awaitQuietly(release);
		})) {
			OutboundRequestException e = failureOf(kilnClient.newRequest("127.0.0.1", server.getPort())
					.setTimeout(Duration.ofMillis(300))
					.open("/slow"));

			assertEquals(OutboundFailureReason.TIMED_OUT, e.getReason());
		} finally {
			release.countDown();
		}
	}

	@Test
	public void refusedConnectionFails() throws Exception {
		int port = TestSupport.findFreePort();

		OutboundRequestException e = failureOf(kilnClient.newRequest("127.0.0.1", port).open("/"));
		assertEquals(OutboundFailureReason.CONNECT_FAILED, e.getReason());
	}

	@Test
	public void unresolvableHostFails() throws Exception {
		OutboundRequestException e = failureOf(kilnClient.newRequest("no-such-host.invalid", 80).open("/"));
		assertEquals(OutboundFailureReason.CONNECT_FAILED, e.getReason());
	}

	@Test
	public void stoppingTheReactorFailsPendingRequests() throws Exception {
		CountDownLatch release = new CountDownLatch(1);

		try (FakeServer server = FakeServer.handling(socket -> {
			readRequestHead(socket.getInputStream());
			awaitQuietly(release);
		})) {
			CompletableFuture<OutboundResponse> pending = kilnClient.newRequest("127.0.0.1", server.getPort()).open("/pending");

			server.awaitRequest();
			kilnClient.close();

			assertEquals(OutboundFailureReason.REACTOR_STOPPED, failureOf(pending).getReason());
			assertFalse(kilnClient.isOpen());

			// Requests opened after close fail immediately
			assertEquals(OutboundFailureReason.REACTOR_STOPPED,
					failureOf(kilnClient.newRequest("127.0.0.1", server.getPort()).open("/late")).getReason());
		} finally {
			release.countDown();
		}
	}

	@Test
	public void requestsCannotBeReopened() throws Exception {
		try (FakeServer server = FakeServer.respondingWith("HTTP/1.1 200 OK\r\nContent-Length: 0\r\n\r\n")) {
			OutboundRequest outboundRequest = kilnClient.newRequest("127.0.0.1", server.getPort());
			outboundRequest.open("/").get(5, TimeUnit.SECONDS);

			assertThrows(IllegalStateException.class, () -> outboundRequest.open("/"));
		}
	}

	@Test
	public void invalidRequestsAreRejectedUpFront() {
		assertThrows(IllegalArgumentException.class, () -> kilnClient.newRequest("127.0.0.1", 0));
		assertThrows(IllegalArgumentException.class, () -> kilnClient.newRequest(" ", 80));

		OutboundRequest outboundRequest = kilnClient.newRequest("127.0.0.1", 80);

		assertThrows(IllegalArgumentException.class, () -> outboundRequest.setHeader("Content-Length", "4"));
		assertThrows(IllegalArgumentException.class, () -> outboundRequest.setHeader("X-Injected", "a\r\nb: c"));
		assertThrows(IllegalArgumentException.class, () -> outboundRequest.setTimeout(Duration.ZERO));
		assertThrows(IllegalArgumentException.class, () -> outboundRequest.open("relative"));
		assertThrows(IllegalArgumentException.class, () -> outboundRequest.open("/with space"));
	}

	@Test
	public void requestBytesForDefaultPortOmitPort() {
		byte[] requestBytes = kilnClient.newRequest("example.com", 80)
				.setMethod(HttpMethod.DELETE)
				.setParameter("id", "1")
				.setParameter("id", "2")
				.toRequestBytes("/items?force=true");

		assertEquals("DELETE /items?force=true&id=1&id=2 HTTP/1.1\r\nHost: example.com\r\nConnection: close\r\n\r\n",
				new String(requestBytes, StandardCharsets.ISO_8859_1));
	}

	private static OutboundRequestException failureOf(CompletableFuture<OutboundResponse> future) throws InterruptedException {
		try {
			future.get(10, TimeUnit.SECONDS);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof OutboundRequestException outboundRequestException)
				return outboundRequestException;

			throw new AssertionError("Unexpected failure", e.getCause());
		} catch (java.util.concurrent.TimeoutException e) {
			throw new AssertionError("Request neither completed nor failed", e);
		}

		throw new AssertionError("Expected the request to fail");
	}

	private static String readRequestHead(InputStream in) throws IOException {
		ByteArrayOutputStream head = new ByteArrayOutputStream();
		int matched = 0;

		while (matched < 4) {
			int b = in.read();

			if (b == -1)
				break;

			head.write(b);
			matched = (b == (matched % 2 == 0 ? '\r' : '\n')) ? matched + 1 : (b == '\r' ? 1 : 0);
		}

		return head.toString(StandardCharsets.ISO_8859_1);
	}

	private static void awaitQuietly(CountDownLatch latch) {
		try {
			latch.await(10, TimeUnit.SECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	@FunctionalInterface
	private interface SocketHandler {
		void handle(Socket socket) throws IOException;
	}

	/**
	 * A one-connection server on a background thread.
	 */
	private static final class FakeServer implements AutoCloseable {
		private final ServerSocket serverSocket;
		private final Thread thread;
		private final CompletableFuture<String> request;

		static FakeServer respondingWith(String rawResponse) throws IOException {
			return new FakeServer(null, rawResponse);
		}

		static FakeServer handling(SocketHandler socketHandler) throws IOException {
			return new FakeServer(socketHandler, null);
		}

		private FakeServer(SocketHandler socketHandler, String rawResponse) throws IOException {
			this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
			this.request = new CompletableFuture<>();
			this.thread = new Thread(() -> {
				try (Socket socket = serverSocket.accept()) {
					if (socketHandler != null) {
						request.complete("");
						socketHandler.handle(socket);
						return;
					}

					InputStream in = socket.getInputStream();
					String head = readRequestHead(in);
					String contentLength = head.lines()
							.filter(line -> line.regionMatches(true, 0, "Content-Length:", 0, 15))
							.map(line -> line.substring(15).trim())
							.findFirst()
							.orElse("0");
					byte[] body = in.readNBytes(Integer.parseInt(contentLength));

					request.complete(head + new String(body, StandardCharsets.UTF_8));
					socket.getOutputStream().write(rawResponse.getBytes(StandardCharsets.UTF_8));
					socket.getOutputStream().flush();
				} catch (IOException e) {
					request.completeExceptionally(e);
				}
			}, "fake-server");

			this.thread.setDaemon(true);
			this.thread.start();
		}

		int getPort() {
			return this.serverSocket.getLocalPort();
		}

		String getRequest() throws Exception {
			return this.request.get(5, TimeUnit.SECONDS);
		}

		void awaitRequest() throws Exception {
			getRequest();
			// The handler reads the request head right after accepting
			Thread.sleep(100);
		}

		@Override
		public void close() throws IOException {
			this.serverSocket.close();
		}
	}
}
