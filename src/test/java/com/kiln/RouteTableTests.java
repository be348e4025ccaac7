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

import com.kiln.exception.ActionResolutionException;
import com.kiln.exception.IllegalRouteParameterException;
import com.kiln.exception.RouteRegistrationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class RouteTableTests {
	@Test
	public void typedGroupsAreCoerced() {
		RouteTable routeTable = RouteTable.builder()
				.prefixed("/validate/", "(number:\\d+)/(word:\\w+)", ValidateAction.class)
				.build();

		RouteMatch routeMatch = routeTable.resolve("/validate/42/justatest", ActionRegistry.withDefaults()).orElseThrow();
		RouteParameters params = routeMatch.getRouteParameters();

		assertEquals(Map.of("number", 42, "word", "justatest"), params.asMap());
		assertEquals(Integer.class, params.get("number").orElseThrow().getClass());
		assertEquals(Optional.of(42), params.getInteger("number"));
		assertEquals(Optional.of("justatest"), params.getString("word"));
	}

	@Test
	public void explicitTypeTagsAndUntypedNames() {
		UUID id = UUID.randomUUID();

		RouteTable routeTable = RouteTable.builder()
				.regex("/reports/(id@uuid:[0-9a-f-]{36})/(page@long:\\d+)/(label:[a-z]+)", ValidateAction.class)
				.build();

		RouteParameters params = routeTable.resolve("/reports/" + id + "/7/summary", ActionRegistry.withDefaults())
				.orElseThrow().getRouteParameters();

		assertEquals(Optional.of(id), params.get("id", UUID.class));
		assertEquals(Optional.of(7L), params.get("page", Long.class));
		// "label" is not a known tag, so the raw string is kept
		assertEquals(Optional.of("summary"), params.getString("label"));
	}

	@Test
	public void literalRoutesMatchExactly() {
		RouteTable routeTable = RouteTable.builder()
				.literal("/", ValidateAction.class)
				.literal("/about", OtherAction.class)
				.build();

		assertTrue(routeTable.resolve("/", ActionRegistry.withDefaults()).isPresent());
		assertTrue(routeTable.resolve("/about", ActionRegistry.withDefaults()).isPresent());
		assertTrue(routeTable.resolve("/about/", ActionRegistry.withDefaults()).isEmpty());
		assertTrue(routeTable.resolve("/abou", ActionRegistry.withDefaults()).isEmpty());
	}

	@Test
	public void firstMatchingRouteWins() {
		RouteTable routeTable = RouteTable.builder()
				.regex("/items/(id:\\d+)", ValidateAction.class)
				.regex("/items/(slug:.+)", OtherAction.class)
				.build();

		RouteMatch numeric = routeTable.resolve("/items/12", ActionRegistry.withDefaults()).orElseThrow();
		RouteMatch textual = routeTable.resolve("/items/twelve", ActionRegistry.withDefaults()).orElseThrow();

		assertEquals(ValidateAction.class, numeric.getActionFactory().getActionClass());
		assertEquals(OtherAction.class, textual.getActionFactory().getActionClass());
		assertSame(routeTable.getRoutes().get(0), numeric.getRoute());
	}

	@Test
	public void resolutionIsDeterministic() {
		RouteTable routeTable = RouteTable.builder()
				.prefixed("/validate/", "(number:\\d+)/(word:\\w+)", ValidateAction.class)
				.build();

		for (int i = 0; i < 3; i++) {
			assertTrue(routeTable.resolve("/validate/x/y", ActionRegistry.withDefaults()).isEmpty());
			assertEquals(Optional.of(5), routeTable.resolve("/validate/5/y", ActionRegistry.withDefaults())
					.orElseThrow().getRouteParameters().getInteger("number"));
		}
	}

	@Test
	public void unknownTypeTagFailsAtBuild() {
		RouteTable.Builder builder = RouteTable.builder()
				.regex("/things/(id@bogus:\\d+)", ValidateAction.class);

		assertThrows(RouteRegistrationException.class, builder::build);
	}

	@Test
	public void invalidRegexFailsAtBuild() {
		RouteTable.Builder builder = RouteTable.builder()
				.regex("/things/([0-9", ValidateAction.class);

		assertThrows(RouteRegistrationException.class, builder::build);
	}

	@Test
	public void duplicateGroupNamesFailAtBuild() {
		RouteTable.Builder builder = RouteTable.builder()
				.regex("/(id:\\d+)/(id:\\d+)", ValidateAction.class);

		assertThrows(RouteRegistrationException.class, builder::build);
	}

	@Test
	public void uncoercibleCaptureIsRejected() {
		RouteTable routeTable = RouteTable.builder()
				.regex("/flags/(enabled@bool:\\w+)", ValidateAction.class)
				.build();

		assertEquals(Optional.of(true), routeTable.resolve("/flags/true", ActionRegistry.withDefaults())
				.orElseThrow().getRouteParameters().get("enabled", Boolean.class));

		IllegalRouteParameterException e = assertThrows(IllegalRouteParameterException.class,
				() -> routeTable.resolve("/flags/maybe", ActionRegistry.withDefaults()));

		assertEquals("enabled", e.getRouteParameterName());
		assertEquals(Optional.of("maybe"), e.getRouteParameterValue());
	}

	@Test
	public void customTypeTags() {
		ParamCoercion paramCoercion = ParamCoercion.builder()
				.typeTag("cents", Long.class)
				.build();

		RouteTable routeTable = RouteTable.builder()
				.paramCoercion(paramCoercion)
				.regex("/prices/(amount@cents:\\d+)", ValidateAction.class)
				.build();

		assertEquals(Optional.of(1999L), routeTable.resolve("/prices/1999", ActionRegistry.withDefaults())
				.orElseThrow().getRouteParameters().get("amount", Long.class));
	}

	@Test
	public void routeArgumentsAreCarried() {
		RouteTable routeTable = RouteTable.builder()
				.route("/static/", "(file:.+)", ActionReference.of(ValidateAction.class), Map.of("root", "/srv/www"))
				.build();

		RouteMatch routeMatch = routeTable.resolve("/static/css/site.css", ActionRegistry.withDefaults()).orElseThrow();

		assertEquals(Optional.of("/srv/www"), routeMatch.getRouteArguments().get("root", String.class));
		assertEquals(Optional.of("css/site.css"), routeMatch.getRouteParameters().getString("file"));
	}

	@Test
	public void groupsConsumeTheirPrefix() {
		RouteTable users = RouteTable.builder()
				.literal("users", OtherAction.class)
				.regex("users/(id@int:\\d+)", ValidateAction.class)
				.route("files/", "(file:.+)", ActionReference.of(ValidateAction.class), Map.of("root", "/srv/files"))
				.build();

		RouteTable routeTable = RouteTable.builder()
				.group("/api/", users)
				.literal("/users", ValidateAction.class)
				.build();

		assertEquals(OtherAction.class,
				routeTable.resolve("/api/users", ActionRegistry.withDefaults()).orElseThrow().getActionFactory().getActionClass());

		RouteMatch byId = routeTable.resolve("/api/users/7", ActionRegistry.withDefaults()).orElseThrow();
		assertEquals(ValidateAction.class, byId.getActionFactory().getActionClass());
		assertEquals(Optional.of(7), byId.getRouteParameters().getInteger("id"));

		RouteMatch file = routeTable.resolve("/api/files/a/b.txt", ActionRegistry.withDefaults()).orElseThrow();
		assertEquals(Optional.of("a/b.txt"), file.getRouteParameters().getString("file"));
		assertEquals(Optional.of("/srv/files"), file.getRouteArguments().get("root", String.class));

		// The child regex only sees what follows the prefix
		assertTrue(routeTable.resolve("/api/users/x", ActionRegistry.withDefaults()).isEmpty());
		assertTrue(routeTable.resolve("users", ActionRegistry.withDefaults()).isEmpty());
		assertEquals(ValidateAction.class,
				routeTable.resolve("/users", ActionRegistry.withDefaults()).orElseThrow().getActionFactory().getActionClass());

		assertThrows(RouteRegistrationException.class, () -> RouteTable.builder().group("", users));
	}

	@Test
	public void namedActionsResolveThroughRegistry() {
		ActionRegistry actionRegistry = ActionRegistry.builder()
				.register("validate", ValidateAction.class)
				.build();

		RouteTable routeTable = RouteTable.builder()
				.literal("/registered", ActionReference.named("validate"))
				.literal("/by-class", ActionReference.named(OtherAction.class.getName()))
				.literal("/missing", ActionReference.named("nope"))
				.build();

		assertEquals(ValidateAction.class,
				routeTable.resolve("/registered", actionRegistry).orElseThrow().getActionFactory().getActionClass());
		assertEquals(OtherAction.class,
				routeTable.resolve("/by-class", actionRegistry).orElseThrow().getActionFactory().getActionClass());
		assertThrows(ActionResolutionException.class, () -> routeTable.resolve("/missing", actionRegistry));
	}

	@Test
	public void routerReloadPublishesWholeTable() {
		RouteTable first = RouteTable.builder()
				.literal("/old", ValidateAction.class)
				.build();
		RouteTable second = RouteTable.builder()
				.literal("/new", OtherAction.class)
				.build();

		Router router = new Router(first, ActionRegistry.withDefaults());

		assertTrue(router.resolve(HttpMethod.GET, "/old").isPresent());
		assertTrue(router.resolve(HttpMethod.GET, "/new").isEmpty());

		RouteMatch inFlight = router.resolve(HttpMethod.GET, "/old").orElseThrow();

		assertSame(first, router.reload(second));
		assertSame(second, router.getRouteTable());

		assertTrue(router.resolve(HttpMethod.GET, "/old").isEmpty());
		assertTrue(router.resolve(HttpMethod.GET, "/new").isPresent());
		Assertions.assertEquals(ValidateAction.class, inFlight.getActionFactory().getActionClass());
	}

	public static class ValidateAction implements Action {
		@Override
		public void get(ActionContext context) {
			context.composeHeaders();
		}
	}

	public static class OtherAction implements Action {
		@Override
		public void post(ActionContext context) {
			context.composeHeaders();
		}
	}
}
