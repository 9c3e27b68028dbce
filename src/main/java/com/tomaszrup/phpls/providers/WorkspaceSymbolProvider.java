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
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls.providers;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

import com.tomaszrup.phpls.symbol.PhpSymbol;
import com.tomaszrup.phpls.symbol.SymbolStore;
import com.tomaszrup.phpls.util.PhpSymbolUtils;

public class WorkspaceSymbolProvider {
	private SymbolStore symbolStore;

	public WorkspaceSymbolProvider(SymbolStore symbolStore) {
		this.symbolStore = symbolStore;
	}

	public CompletableFuture<List<WorkspaceSymbol>> provideWorkspaceSymbols(String query) {
		if (query == null || query.isEmpty()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		List<WorkspaceSymbol> symbols = symbolStore.match(query, PhpSymbolUtils::isDeclaration).stream()
				.map(this::toWorkspaceSymbol)
				.filter(Objects::nonNull)
				.collect(Collectors.toList());
		return CompletableFuture.completedFuture(symbols);
	}

	private WorkspaceSymbol toWorkspaceSymbol(PhpSymbol symbol) {
		if (symbol.getLocation() == null) {
			return null;
		}
		return new WorkspaceSymbol(symbol.getName(), PhpSymbolUtils.toSymbolKind(symbol.getKind()),
				Either.forLeft(symbol.getLocation()), symbol.getScope());
	}
}
