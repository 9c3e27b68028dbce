////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls;

import static com.tomaszrup.phpls.syntax.SyntaxFixture.*;

import java.util.List;
import java.util.Optional;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.phpls.config.IndexOptions;
import com.tomaszrup.phpls.symbol.NameResolver;
import com.tomaszrup.phpls.symbol.PhpSymbol;
import com.tomaszrup.phpls.symbol.SymbolKind;
import com.tomaszrup.phpls.syntax.ParsedDocument;

/**
 * Tests for {@link PhpSymbolServices}: publishing document updates,
 * debounced scheduling, closing, searches and definitions.
 */
class PhpSymbolServicesTests {

	private PhpSymbolServices services;

	@BeforeEach
	void setup() {
		// long delay so scheduled updates only apply through flush()
		services = new PhpSymbolServices(new IndexOptions(false, false, 60_000, NameResolver.DEFAULT_BUILT_IN_TYPES));
	}

	@AfterEach
	void tearDown() {
		services.shutdown();
	}

	private static ParsedDocument serviceDocument() {
		return document(file(
				namespaceDef("App"),
				classDecl("UserService",
						method("public", "find", params(), null)),
				statement(assign(variable("$service"), newObject("UserService")))));
	}

	// ------------------------------------------------------------------
	// updates
	// ------------------------------------------------------------------

	@Test
	void testUpdateDocumentPublishes() {
		ParsedDocument document = serviceDocument();
		services.updateDocument(document);

		Assertions.assertSame(document, services.getDocumentStore().get(URI));
		Assertions.assertNotNull(services.getSymbolStore().getSymbolTable(URI));
		List<PhpSymbol> found = services.findExact("App\\UserService");
		Assertions.assertEquals(1, found.size());
		Assertions.assertEquals(SymbolKind.CLASS, found.get(0).getKind());
	}

	@Test
	void testUpdateReplacesEarlierSymbols() {
		services.updateDocument(serviceDocument());
		services.updateDocument(document(file(namespaceDef("App"), classDecl("OrderService"))));

		Assertions.assertTrue(services.findExact("App\\UserService").isEmpty());
		Assertions.assertEquals(1, services.findExact("App\\OrderService").size());
	}

	@Test
	void testScheduledUpdateAppliesOnFlush() {
		services.scheduleUpdate(serviceDocument());
		Assertions.assertTrue(services.findExact("App\\UserService").isEmpty(),
				"scheduled update should wait for the debounce delay");

		services.flush();
		Assertions.assertEquals(1, services.findExact("App\\UserService").size());
	}

	@Test
	void testScheduledUpdatesCoalesce() {
		services.scheduleUpdate(serviceDocument());
		services.scheduleUpdate(document(file(namespaceDef("App"), classDecl("OrderService"))));
		services.flush();

		Assertions.assertTrue(services.findExact("App\\UserService").isEmpty());
		Assertions.assertEquals(1, services.findExact("App\\OrderService").size());
	}

	@Test
	void testCloseDocument() {
		services.updateDocument(serviceDocument());
		services.closeDocument(URI);

		Assertions.assertNull(services.getDocumentStore().get(URI));
		Assertions.assertNull(services.getSymbolStore().getSymbolTable(URI));
		Assertions.assertTrue(services.findExact("App\\UserService").isEmpty());
	}

	@Test
	void testCloseDropsScheduledUpdate() {
		services.scheduleUpdate(serviceDocument());
		services.closeDocument(URI);
		services.flush();

		Assertions.assertTrue(services.findExact("App\\UserService").isEmpty());
	}

	@Test
	void testUpdateRequestedBeforeCloseIsNotPublished() {
		services.updateDocument(serviceDocument());
		long closeCountBeforeClose = services.closeCount(URI);
		services.closeDocument(URI);

		// an update taken off the scheduler before the close, finishing after it
		services.update(serviceDocument(), closeCountBeforeClose);

		Assertions.assertNull(services.getDocumentStore().get(URI));
		Assertions.assertTrue(services.findExact("App\\UserService").isEmpty());
	}

	@Test
	void testUpdateAfterCloseReopensDocument() {
		services.updateDocument(serviceDocument());
		services.closeDocument(URI);
		services.scheduleUpdate(serviceDocument());
		services.flush();

		Assertions.assertEquals(1, services.findExact("App\\UserService").size());
	}

	// ------------------------------------------------------------------
	// queries
	// ------------------------------------------------------------------

	@Test
	void testMatchSubstring() {
		services.updateDocument(serviceDocument());
		List<PhpSymbol> matches = services.matchSubstring("userserv");
		Assertions.assertTrue(matches.stream().anyMatch(s -> s.getName().equals("App\\UserService")));
		Assertions.assertTrue(services.matchSubstring("zzz").isEmpty());
	}

	@Test
	void testProvideDefinition() {
		ParsedDocument document = serviceDocument();
		services.updateDocument(document);

		Optional<Location> location = services.provideDefinition(URI, positionOf(document, "UserService", 1));
		Assertions.assertTrue(location.isPresent());
		Assertions.assertEquals(services.findExact("App\\UserService").get(0).getLocation(), location.get());
	}

	@Test
	void testProvideDefinitionUnknownDocument() {
		Assertions.assertFalse(services.provideDefinition("file:///missing.php", new Position(0, 0))
				.isPresent());
	}
}
