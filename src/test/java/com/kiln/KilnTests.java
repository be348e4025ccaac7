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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.kiln.TestSupport.bodyOf;
import static com.kiln.TestSupport.readResponse;
import static com.kiln.TestSupport.statusCodeOf;
import static com.kiln.TestSupport.writeAscii;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
@Timeout(value = 30, unit = TimeUnit.SECONDS)
public class KilnTests {
	@Test
	public void keepAliveConnectionServesSequentialRequests() throws Exception {
		AtomicInteger acceptedConnections = new AtomicInteger();

		KilnConfig.Builder builder = baseConfig().lifecycleObserver(new LifecycleObserver() {
			@Override
			public void didAcceptConnection(InetSocketAddress remoteAddress) {
				acceptedConnections.incrementAndGet();
			}
		});

		try (Kiln kiln = start(builder);
				 Socket socket = connect(kiln)) {
			InputStream in = socket.getInputStream();

			writeAscii(socket, "GET /validate/42/justatest HTTP/1.1\r\nHost: localhost\r\n\r\n");
			String first = readResponse(in);

			writeAscii(socket, "GET /validate/7/again HTTP/1.1\r\nHost: localhost\r\n\r\n");
			String second = readResponse(in);

			assertEquals(200, statusCodeOf(first));
			assertEquals("Number is 42 (Integer), word is justatest", bodyOf(first));
			assertEquals(200, statusCodeOf(second));
			assertEquals("Number is 7 (Integer), word is again", bodyOf(second));
			assertEquals(1, acceptedConnections.get());
		}
	}

	@Test
	public void pipelinedRequestsAreAnsweredInOrder() throws Exception {
		try (Kiln kiln = start(baseConfig());
				 Socket socket = connect(kiln)) {
			InputStream in = socket.getInputStream();

			writeAscii(socket, "GET /validate/1/one HTTP/1.1\r\nHost: localhost\r\n\r\n"
					+ "GET /validate/2/two HTTP/1.1\r\nHost: localhost\r\n\r\n"
					+ "GET /validate/3/three HTTP/1.1\r\nHost: localhost\r\nConnection: close\r\n\r\n");

			assertEquals("Number is 1 (Integer), word is one", bodyOf(readResponse(in)));
			assertEquals("Number is 2 (Integer), word is two", bodyOf(readResponse(in)));

			String last = readResponse(in);
			assertEquals("Number is 3 (Integer), word is three", bodyOf(last));
			assertTrue(last.contains("Connection: close"));
			assertEquals(-1, in.read());
		}
	}

	@Test
	public void connectionClosedMidBodyIsNeverDispatched() throws Exception {
		CountingPostAction.POSTS.set(0);

		try (Kiln kiln = start(baseConfig())) {
			try (Socket socket = connect(kiln)) {
				writeAscii(socket, "POST /count HTTP/1.1\r\nHost: localhost\r\nContent-Length: 10\r\n\r\nabc");
			}

			try (Socket socket = connect(kiln)) {
				writeAscii(socket, "POST /count HTTP/1.1\r\nHost: localhost\r\nContent-Length: 3\r\n\r\nabc");
				assertEquals(200, statusCodeOf(readResponse(socket.getInputStream())));
			}

			assertEquals(1, CountingPostAction.POSTS.get());
		}
	}

	@Test
	public void actionFaultAnswers500AndCloses() throws Exception {
		try (Kiln kiln = start(baseConfig());
				 Socket socket = connect(kiln)) {
			InputStream in = socket.getInputStream();

			writeAscii(socket, "GET /explode HTTP/1.1\r\nHost: localhost\r\n\r\n");
			String response = readResponse(in);

			assertEquals(500, statusCodeOf(response));
			assertTrue(response.contains("Connection: close"));
			assertEquals(-1, in.read());
		}
	}

	@Test
	public void methodNotAllowedCarriesAllowHeader() throws Exception {
		try (Kiln kiln = start(baseConfig());
				 Socket socket = connect(kiln)) {
			writeAscii(socket, "PUT /validate/1/a HTTP/1.1\r\nHost: localhost\r\nContent-Length: 0\r\n\r\n");
			String response = readResponse(socket.getInputStream());

			assertEquals(405, statusCodeOf(response));
			assertTrue(response.contains("Allow: GET, HEAD"));
		}
	}

	@Test
	public void unknownRouteIsNotFound() throws Exception {
		try (Kiln kiln = start(baseConfig());
				 Socket socket = connect(kiln)) {
			writeAscii(socket, "GET /nowhere HTTP/1.1\r\nHost: localhost\r\n\r\n");
			assertEquals(404, statusCodeOf(readResponse(socket.getInputStream())));
		}
	}

	@Test
	public void malformedRequestsAreAnsweredAndClosed() throws Exception {
		try (Kiln kiln = start(baseConfig().maximumRequestLineSizeInBytes(64))) {
			assertRejected(kiln, "NOT A VALID REQUEST LINE\r\n\r\n", 400);
			assertRejected(kiln, "GET /" + "x".repeat(200) + " HTTP/1.1\r\n\r\n", 414);
			assertRejected(kiln, "GET / HTTP/3.0\r\n\r\n", 505);
			assertRejected(kiln, "POST / HTTP/1.1\r\nContent-Length: 3\r\nTransfer-Encoding: chunked\r\n\r\n", 400);

			// The server is still healthy afterwards
			try (Socket socket = connect(kiln)) {
				writeAscii(socket, "GET /validate/5/ok HTTP/1.1\r\nHost: localhost\r\n\r\n");
				assertEquals(200, statusCodeOf(readResponse(socket.getInputStream())));
			}
		}
	}

	@Test
	public void http10WithoutKeepAliveCloses() throws Exception {
		try (Kiln kiln = start(baseConfig());
				 Socket socket = connect(kiln)) {
			InputStream in = socket.getInputStream();

			writeAscii(socket, "GET /validate/1/a HTTP/1.0\r\n\r\n");
			String response = readResponse(in);

			assertTrue(response.startsWith("HTTP/1.0 200"));
			assertEquals(-1, in.read());
		}
	}

	@Test
	public void idleConnectionsAreClosed() throws Exception {
		try (Kiln kiln = start(baseConfig().idleTimeout(Duration.ofMillis(300)));
				 Socket socket = connect(kiln)) {
			long startedAt = System.nanoTime();

			assertEquals(-1, socket.getInputStream().read());
			assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).compareTo(Duration.ofSeconds(4)) < 0);
		}
	}

	@Test
	public void connectionsBeyondTheLimitAreRefused() throws Exception {
		try (Kiln kiln = start(baseConfig().maximumConnections(1));
				 Socket first = connect(kiln)) {
			writeAscii(first, "GET /validate/1/a HTTP/1.1\r\nHost: localhost\r\n\r\n");
			assertEquals(200, statusCodeOf(readResponse(first.getInputStream())));

			try (Socket second = connect(kiln)) {
				assertEquals(-1, readOrEndOfStream(second.getInputStream()));
			}
		}
	}

	@Test
	public void actionsCanCallOutOnTheSameReactor() throws Exception {
		try (Kiln kiln = start(baseConfig());
				 Socket socket = connect(kiln)) {
			ProxyAction.TARGET_PORT.set(kiln.getListenAddresses().get(0).getPort());

			writeAscii(socket, "GET /proxy HTTP/1.1\r\nHost: localhost\r\n\r\n");
			String response = readResponse(socket.getInputStream());

			assertEquals(200, statusCodeOf(response));
			assertEquals("proxied 200: Number is 7 (Integer), word is seven", bodyOf(response));
		}
	}

	@Test
	public void unansweredRequestTimesOutWith503() throws Exception {
		List<LogEvent> logEvents = new CopyOnWriteArrayList<>();

		KilnConfig.Builder builder = baseConfig()
				.responseTimeout(Duration.ofMillis(300))
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didReceiveLogEvent(LogEvent logEvent) {
						logEvents.add(logEvent);
					}
				});

		try (Kiln kiln = start(builder);
				 Socket socket = connect(kiln)) {
			InputStream in = socket.getInputStream();

			writeAscii(socket, "GET /stalled HTTP/1.1\r\nHost: localhost\r\n\r\n");
			String response = readResponse(in);

			assertEquals(503, statusCodeOf(response));
			assertTrue(response.contains("Connection: close"));
			assertEquals(-1, readOrEndOfStream(in));

			// Finishing after the timeout is harmless
			StalledAction.CONTEXT.get(5, TimeUnit.SECONDS).finish();

			assertTrue(logEvents.stream().anyMatch(logEvent -> logEvent.getLogEventType() == LogEventType.RESPONSE_TIMED_OUT
					&& logEvent.getRequest().map(Request::getPath).orElse("").equals("/stalled")));
		}
	}

	@Test
	public void persistentRequestLimitClosesConnection() throws Exception {
		try (Kiln kiln = start(baseConfig().maximumPersistentRequests(2));
				 Socket socket = connect(kiln)) {
			InputStream in = socket.getInputStream();

			writeAscii(socket, "GET /validate/1/a HTTP/1.1\r\nHost: localhost\r\n\r\n");
			String first = readResponse(in);

			writeAscii(socket, "GET /validate/2/b HTTP/1.1\r\nHost: localhost\r\n\r\n");
			String second = readResponse(in);

			assertEquals(200, statusCodeOf(first));
			assertFalse(first.contains("Connection: close"));
			assertEquals(200, statusCodeOf(second));
			assertTrue(second.contains("Connection: close"));
			assertEquals(-1, readOrEndOfStream(in));
		}
	}

	@Test
	public void http10KeepAliveRespectsPersistentRequestLimit() throws Exception {
		try (Kiln kiln = start(baseConfig().maximumPersistentRequests(1));
				 Socket socket = connect(kiln)) {
			InputStream in = socket.getInputStream();

			writeAscii(socket, "GET /validate/1/a HTTP/1.0\r\nConnection: keep-alive\r\n\r\n");
			String response = readResponse(in);

			assertTrue(response.contains("Connection: close"));
			assertFalse(response.contains("Connection: keep-alive"));
			assertEquals(-1, readOrEndOfStream(in));
		}
	}

	@Test
	public void stopIsIdempotentAndReleasesThePort() throws Exception {
		Kiln kiln = start(baseConfig());
		int port = kiln.getListenAddresses().get(0).getPort();

		assertTrue(kiln.isStarted());

		kiln.stop();
		kiln.stop();

		assertFalse(kiln.isStarted());

		KilnConfig restartConfig = baseConfig().hostAddresses(List.of(HostAddress.of("127.0.0.1", port))).build();

		try (Kiln restarted = Kiln.withConfig(restartConfig).build()) {
			restarted.start();
			assertEquals(port, restarted.getListenAddresses().get(0).getPort());
		}
	}

	private static void assertRejected(Kiln kiln, String rawRequest, int expectedStatusCode) throws Exception {
		try (Socket socket = connect(kiln)) {
			InputStream in = socket.getInputStream();
			writeAscii(socket, rawRequest);

			String response = readResponse(in);

			assertEquals(expectedStatusCode, statusCodeOf(response), rawRequest);
			assertTrue(response.contains("Connection: close"));
			assertEquals(-1, readOrEndOfStream(in));
		}
	}

	// A reset from the server also counts as end of stream here
	private static int readOrEndOfStream(InputStream in) {
		try {
			return in.read();
		} catch (IOException e) {
			return -1;
		}
	}

	private static KilnConfig.Builder baseConfig() {
		RouteTable routeTable = RouteTable.builder()
				.prefixed("/validate/", "(number:\\d+)/(word:\\w+)", ActionDispatcherTests.ValidateAction.class)
				.literal("/count", CountingPostAction.class)
				.literal("/explode", ActionDispatcherTests.ExplodingAction.class)
				.literal("/proxy", ProxyAction.class)
				.literal("/stalled", StalledAction.class)
				.build();

		return KilnConfig.withRouteTable(routeTable)
				.hostAddresses(List.of(HostAddress.of("127.0.0.1", 0)))
				.outboundRequestTimeout(Duration.ofSeconds(5))
				.shutdownTimeout(Duration.ofSeconds(5));
	}

	private static Kiln start(KilnConfig.Builder builder) {
		Kiln kiln = Kiln.withConfig(builder.build()).build();
		kiln.start();
		return kiln;
	}

	private static Socket connect(Kiln kiln) throws IOException, InterruptedException {
		InetSocketAddress address = kiln.getListenAddresses().get(0);
		return TestSupport.connectWithRetry("127.0.0.1", address.getPort(), 2_000);
	}

	public static class CountingPostAction implements Action {
		static final AtomicInteger POSTS = new AtomicInteger();

		@Override
		public void post(ActionContext context) {
			POSTS.incrementAndGet();
			context.composeHeaders();
			context.write(context.getBody());
		}
	}

	public static class StalledAction implements Action {
		static final CompletableFuture<ActionContext> CONTEXT = new CompletableFuture<>();

		@Override
		public void get(ActionContext context) {
			context.defer();
			CONTEXT.complete(context);
		}
	}

	public static class ProxyAction implements Action {
		static final AtomicInteger TARGET_PORT = new AtomicInteger();

		@Override
		public void get(ActionContext context) {
			context.defer();

			context.newOutboundRequest("127.0.0.1", TARGET_PORT.get())
					.onFinished(response -> {
						context.setContentType("text/plain; charset=UTF-8");
						context.composeHeaders();
						context.write("proxied " + response.getStatusCode() + ": " + response.getBodyAsString());
						context.finish();
					})
					.onFailure(context::fail)
					.open("/validate/7/seven");
		}
	}
}
