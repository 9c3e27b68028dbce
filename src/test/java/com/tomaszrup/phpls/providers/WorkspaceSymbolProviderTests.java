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
package com.tomaszrup.phpls.providers;

import static com.tomaszrup.phpls.syntax.SyntaxFixture.*;

import java.util.List;

import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.phpls.config.IndexOptions;
import com.tomaszrup.phpls.symbol.SymbolStore;
import com.tomaszrup.phpls.symbol.SymbolTable;
import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.tree.CancellationToken;

/**
 * Tests for {@link WorkspaceSymbolProvider}.
 */
class WorkspaceSymbolProviderTests {

	private SymbolStore symbolStore;
	private WorkspaceSymbolProvider provider;

	@BeforeEach
	void setup() {
		symbolStore = new SymbolStore();
		provider = new WorkspaceSymbolProvider(symbolStore);
		ParsedDocument document = document(file(
				namespaceDef("App"),
				use("Lib\\UserBase"),
				classDecl("UserService",
						method(null, "findUser", params(param(null, "$userId")), null,
								statement(assign(variable("$user"), integer(1))))),
				statement(assign(variable("$f"), closure(params(), new String[0])))));
		symbolStore.update(SymbolTable.create(document, IndexOptions.DEFAULTS, new CancellationToken()));
	}

	@Test
	void testMatchesDeclarationsOnly() throws Exception {
		List<WorkspaceSymbol> symbols = provider.provideWorkspaceSymbols("user").get();
		Assertions.assertEquals(2, symbols.size());

		WorkspaceSymbol service = symbols.stream().filter(s -> s.getName().equals("App\\UserService")).findFirst()
				.orElseThrow(AssertionError::new);
		Assertions.assertEquals(SymbolKind.Class, service.getKind());
		Assertions.assertEquals(URI, service.getLocation().getLeft().getUri());
		Assertions.assertNull(service.getContainerName());

		WorkspaceSymbol method = symbols.stream().filter(s -> s.getName().equals("findUser")).findFirst()
				.orElseThrow(AssertionError::new);
		Assertions.assertEquals(SymbolKind.Method, method.getKind());
		Assertions.assertEquals("App\\UserService", method.getContainerName());
	}

	@Test
	void testEmptyQuery() throws Exception {
		Assertions.assertTrue(provider.provideWorkspaceSymbols("").get().isEmpty());
		Assertions.assertTrue(provider.provideWorkspaceSymbols(null).get().isEmpty());
	}

	@Test
	void testNoMatch() throws Exception {
		Assertions.assertTrue(provider.provideWorkspaceSymbols("zzz").get().isEmpty());
	}

	@Test
	void testAnonymousFunctionsAreHidden() throws Exception {
		Assertions.assertTrue(provider.provideWorkspaceSymbols("anon").get().isEmpty());
	}
}
