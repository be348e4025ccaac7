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

import com.kiln.util.PropertiesFileReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class KilnConfigTests {
	@Test
	public void defaults() {
		KilnConfig kilnConfig = KilnConfig.withRouteTable(RouteTable.builder().build()).build();

		assertEquals(List.of(HostAddress.of("0.0.0.0", 8080)), kilnConfig.getHostAddresses());
		assertEquals(0, kilnConfig.getWorkerCount());
		assertEquals("Kiln", kilnConfig.getServerName());
		assertEquals(Duration.ofSeconds(60), kilnConfig.getIdleTimeout());
		assertEquals(Duration.ofSeconds(30), kilnConfig.getOutboundRequestTimeout());
		assertTrue(kilnConfig.getWorkerLauncher().isEmpty());
		assertEquals(1_024 * 1_024 * 10, kilnConfig.getMaximumOutboundResponseSizeInBytes());
		assertEquals(0, kilnConfig.getMaximumPersistentRequests());
		assertEquals(Duration.ofSeconds(60), kilnConfig.getResponseTimeout());
	}

	@Test
	public void propertiesOverrideBuilderValues(@TempDir Path directory) throws IOException {
		Path propertiesFile = directory.resolve("kiln.properties");
		Files.writeString(propertiesFile, String.join("\n",
				"# Kiln settings",
				"kiln.hosts=127.0.0.1:9090, [::1]:9091",
				"kiln.workers=4",
				"kiln.idleTimeoutSeconds=15",
				"kiln.outboundRequestTimeoutSeconds=3",
				"kiln.maximumRequestLineSizeInBytes=2048",
				"kiln.maximumOutboundResponseSizeInBytes=4096",
				"kiln.maximumPersistentRequests=100",
				"kiln.responseTimeoutSeconds=20",
				"kiln.serverName=Test Server",
				"unrelated.key=ignored"), StandardCharsets.UTF_8);

		KilnConfig kilnConfig = KilnConfig.withRouteTable(RouteTable.builder().build())
				.port(8081)
				.serverName("Replaced")
				.properties(new PropertiesFileReader(propertiesFile))
				.build();

		assertEquals(List.of(HostAddress.of("127.0.0.1", 9090), HostAddress.of("::1", 9091)), kilnConfig.getHostAddresses());
		assertEquals(4, kilnConfig.getWorkerCount());
		assertEquals(Duration.ofSeconds(15), kilnConfig.getIdleTimeout());
		assertEquals(Duration.ofSeconds(3), kilnConfig.getOutboundRequestTimeout());
		assertEquals(2048, kilnConfig.getMaximumRequestLineSizeInBytes());
		assertEquals(4096, kilnConfig.getMaximumOutboundResponseSizeInBytes());
		assertEquals(100, kilnConfig.getMaximumPersistentRequests());
		assertEquals(Duration.ofSeconds(20), kilnConfig.getResponseTimeout());
		assertEquals("Test Server", kilnConfig.getServerName());

		// Untouched settings keep their defaults
		assertEquals(KilnConfig.DEFAULT_MAXIMUM_BODY_SIZE_IN_BYTES, kilnConfig.getMaximumBodySizeInBytes());
	}

	@Test
	public void blankPropertiesAreIgnored() {
		Properties properties = new Properties();
		properties.setProperty("kiln.workers", "  ");

		KilnConfig kilnConfig = KilnConfig.withRouteTable(RouteTable.builder().build())
				.workerCount(2)
				.properties(new PropertiesFileReader(properties))
				.build();

		assertEquals(2, kilnConfig.getWorkerCount());
	}

	@Test
	public void unparseablePropertiesAreRejected() {
		Properties properties = new Properties();
		properties.setProperty("kiln.workers", "several");

		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(RouteTable.builder().build())
				.properties(new PropertiesFileReader(properties)));
	}

	@Test
	public void missingPropertiesFileIsRejected(@TempDir Path directory) {
		assertThrows(IllegalArgumentException.class, () -> new PropertiesFileReader(directory.resolve("absent.properties")));
		assertThrows(IllegalArgumentException.class, () -> new PropertiesFileReader(directory));
	}

	@Test
	public void requiredPropertyMustBePresent() {
		PropertiesFileReader propertiesFileReader = new PropertiesFileReader(new Properties());
		assertThrows(IllegalStateException.class, () -> propertiesFileReader.valueFor("kiln.workers", Integer.class));
	}

	@Test
	public void illegalValuesAreRejected() {
		RouteTable routeTable = RouteTable.builder().build();

		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(routeTable).hostAddresses(List.of()).build());
		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(routeTable).workerCount(-1).build());
		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(routeTable).idleTimeout(Duration.ZERO).build());
		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(routeTable).maximumBodySizeInBytes(0).build());
		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(routeTable).maximumConnections(-1).build());
		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(routeTable).maximumOutboundResponseSizeInBytes(0).build());
		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(routeTable).maximumPersistentRequests(-1).build());
		assertThrows(IllegalArgumentException.class, () -> KilnConfig.withRouteTable(routeTable).responseTimeout(Duration.ZERO).build());
	}

	@Test
	public void copyPreservesSettings() {
		KilnConfig original = KilnConfig.withRouteTable(RouteTable.builder().build())
				.port(0)
				.serverName("Original")
				.maximumConnections(7)
				.maximumPersistentRequests(3)
				.responseTimeout(Duration.ofSeconds(5))
				.build();

		KilnConfig copy = original.copy().serverName("Copy").build();

		assertEquals(original.getHostAddresses(), copy.getHostAddresses());
		assertEquals(7, copy.getMaximumConnections());
		assertEquals(3, copy.getMaximumPersistentRequests());
		assertEquals(Duration.ofSeconds(5), copy.getResponseTimeout());
		assertEquals("Copy", copy.getServerName());
		assertEquals("Original", original.getServerName());
	}

	@Test
	public void hostAddressParsing() {
		assertEquals(HostAddress.of("localhost", 80), HostAddress.fromString("localhost:80"));
		assertEquals(HostAddress.of("::1", 8080), HostAddress.fromString(" [::1]:8080 "));
		assertEquals("[::1]:8080", HostAddress.of("::1", 8080).toString());
		assertEquals("example.com:443", HostAddress.of("example.com", 443).toString());

		assertThrows(IllegalArgumentException.class, () -> HostAddress.fromString("localhost"));
		assertThrows(IllegalArgumentException.class, () -> HostAddress.fromString("localhost:"));
		assertThrows(IllegalArgumentException.class, () -> HostAddress.fromString(":80"));
		assertThrows(IllegalArgumentException.class, () -> HostAddress.fromString("localhost:http"));
		assertThrows(IllegalArgumentException.class, () -> HostAddress.fromString("localhost:70000"));
	}
}
