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
package com.tomaszrup.phpls.symbol;

import static com.tomaszrup.phpls.syntax.SyntaxFixture.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.phpls.config.IndexOptions;
import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.tree.CancellationToken;

/**
 * Unit tests for {@link SymbolTable}.
 */
class SymbolTableTests {

	private static PhpSymbol symbol(SymbolKind kind, String name, SymbolModifier... modifiers) {
		PhpSymbol symbol = new PhpSymbol(kind, name);
		for (SymbolModifier modifier : modifiers) {
			symbol.addModifier(modifier);
		}
		return symbol;
	}

	private static ParsedDocument sampleDocument() {
		return document(file(
				namespaceDef("App"),
				classDecl("Foo",
						method(null, "run", params(param(null, "$x")), null,
								statement(assign(variable("$local"), integer(1))))),
				function("helper", params(), null)));
	}

	// ------------------------------------------------------------------
	// indexKeys()
	// ------------------------------------------------------------------

	@Test
	void testIndexKeysAreSuffixesPlusFullName() {
		Assertions.assertEquals(Arrays.asList("Foo", "oo", "o", "App\\Foo"),
				SymbolTable.indexKeys(symbol(SymbolKind.CLASS, "App\\Foo")));
	}

	@Test
	void testIndexKeysStripDollar() {
		Assertions.assertEquals(Arrays.asList("ab", "b", "$ab"),
				SymbolTable.indexKeys(symbol(SymbolKind.VARIABLE, "$ab")));
	}

	@Test
	void testIndexKeysOfImportAndRoot() {
		Assertions.assertTrue(SymbolTable.indexKeys(symbol(SymbolKind.CLASS, "Baz", SymbolModifier.USE)).isEmpty());
		Assertions.assertTrue(SymbolTable.indexKeys(PhpSymbol.root()).isEmpty());
		Assertions.assertTrue(SymbolTable.indexKeys(symbol(SymbolKind.CLASS, "")).isEmpty());
	}

	@Test
	void testIndexKeysOfAnonymous() {
		Assertions.assertEquals(Collections.singletonList("#anon#x#1"),
				SymbolTable.indexKeys(symbol(SymbolKind.CLASS, "#anon#x#1", SymbolModifier.ANONYMOUS)));
	}

	// ------------------------------------------------------------------
	// find() / match()
	// ------------------------------------------------------------------

	@Test
	void testFindByFullName() {
		PhpSymbol root = PhpSymbol.root();
		PhpSymbol foo = symbol(SymbolKind.CLASS, "App\\Foo");
		root.addChild(foo);
		SymbolTable table = new SymbolTable("file:///a.php", root);

		Assertions.assertEquals(Collections.singletonList(foo), table.find("App\\Foo"));
		Assertions.assertEquals(Collections.singletonList(foo), table.find("app\\foo"));
		// "Foo" is only a suffix key of App\Foo
		Assertions.assertTrue(table.find("Foo").isEmpty());
	}

	@Test
	void testFindConstantsAndVariablesKeepCase() {
		PhpSymbol root = PhpSymbol.root();
		PhpSymbol max = symbol(SymbolKind.CONSTANT, "MAX");
		PhpSymbol count = symbol(SymbolKind.VARIABLE, "$count");
		PhpSymbol helper = symbol(SymbolKind.FUNCTION, "helper");
		root.addChild(max);
		root.addChild(count);
		root.addChild(helper);
		SymbolTable table = new SymbolTable("file:///a.php", root);

		Assertions.assertEquals(Collections.singletonList(max), table.find("MAX"));
		Assertions.assertTrue(table.find("max").isEmpty());
		Assertions.assertTrue(table.find("$Count").isEmpty());
		Assertions.assertEquals(Collections.singletonList(helper), table.find("HELPER"));
	}

	@Test
	void testFindCaseSensitive() {
		PhpSymbol root = PhpSymbol.root();
		root.addChild(symbol(SymbolKind.FUNCTION, "helper"));
		SymbolTable table = new SymbolTable("file:///a.php", root, true);
		Assertions.assertEquals(1, table.find("helper").size());
		Assertions.assertTrue(table.find("Helper").isEmpty());
	}

	@Test
	void testMatchSubstring() {
		PhpSymbol root = PhpSymbol.root();
		PhpSymbol foo = symbol(SymbolKind.CLASS, "App\\Foobar");
		PhpSymbol bar = symbol(SymbolKind.METHOD, "barista");
		foo.addChild(bar);
		root.addChild(foo);
		SymbolTable table = new SymbolTable("file:///a.php", root);

		List<PhpSymbol> matches = table.match("bar");
		Assertions.assertEquals(2, matches.size());
		Assertions.assertTrue(matches.contains(foo));
		Assertions.assertTrue(matches.contains(bar));
		Assertions.assertEquals(Collections.singletonList(bar), table.match("ist"));
		Assertions.assertEquals(2, table.size());
	}

	@Test
	void testImportRecordsAreNotSearchable() {
		PhpSymbol root = PhpSymbol.root();
		root.addChild(symbol(SymbolKind.CLASS, "Baz", SymbolModifier.USE));
		SymbolTable table = new SymbolTable("file:///a.php", root);
		Assertions.assertTrue(table.match("Baz").isEmpty());
		Assertions.assertEquals(1, table.size());
	}

	// ------------------------------------------------------------------
	// create()
	// ------------------------------------------------------------------

	@Test
	void testCreateReadsDocument() {
		SymbolTable table = SymbolTable.create(sampleDocument(), IndexOptions.DEFAULTS, new CancellationToken());
		Assertions.assertNotNull(table);
		Assertions.assertEquals(URI, table.getUri());
		Assertions.assertEquals(1, table.find("App\\Foo").size());
		Assertions.assertEquals(1, table.find("App\\helper").size());
		Assertions.assertEquals(1, table.find("$local").size());
	}

	@Test
	void testCreateHonoursExternalOnly() {
		IndexOptions options = new IndexOptions(false, true, 0, NameResolver.DEFAULT_BUILT_IN_TYPES);
		SymbolTable table = SymbolTable.create(sampleDocument(), options, new CancellationToken());
		Assertions.assertTrue(table.find("$local").isEmpty());
		Assertions.assertEquals(1, table.find("$x").size());
	}

	@Test
	void testCreateWithCancelledTokenReturnsNull() {
		CancellationToken token = new CancellationToken();
		token.cancel();
		Assertions.assertNull(SymbolTable.create(sampleDocument(), IndexOptions.DEFAULTS, token));
	}

	// ------------------------------------------------------------------
	// scopeAt()
	// ------------------------------------------------------------------

	@Test
	void testScopeAtInsideMethod() {
		ParsedDocument document = sampleDocument();
		SymbolTable table = SymbolTable.create(document, IndexOptions.DEFAULTS, new CancellationToken());
		List<PhpSymbol> scopes = table.scopeAt(positionOf(document, "$local"));
		Assertions.assertEquals(2, scopes.size());
		Assertions.assertEquals("run", scopes.get(0).getName());
		Assertions.assertEquals("App\\Foo", scopes.get(1).getName());
	}

	@Test
	void testScopeAtTopLevel() {
		ParsedDocument document = sampleDocument();
		SymbolTable table = SymbolTable.create(document, IndexOptions.DEFAULTS, new CancellationToken());
		Assertions.assertTrue(table.scopeAt(new Position(0, 0)).isEmpty());
		Assertions.assertEquals("App\\helper", table.scopeAt(positionOf(document, "helper")).get(0).getName());
	}
}
