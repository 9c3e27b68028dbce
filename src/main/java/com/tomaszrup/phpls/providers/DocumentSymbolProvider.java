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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

import com.tomaszrup.phpls.symbol.PhpSymbol;
import com.tomaszrup.phpls.symbol.SymbolModifier;
import com.tomaszrup.phpls.symbol.SymbolStore;
import com.tomaszrup.phpls.symbol.SymbolTable;
import com.tomaszrup.phpls.util.PhpSymbolUtils;

public class DocumentSymbolProvider {
	private SymbolStore symbolStore;

	public DocumentSymbolProvider(SymbolStore symbolStore) {
		this.symbolStore = symbolStore;
	}

	public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> provideDocumentSymbols(
			TextDocumentIdentifier textDocument) {
		SymbolTable table = symbolStore.getSymbolTable(textDocument.getUri());
		if (table == null) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		List<Either<SymbolInformation, DocumentSymbol>> symbols = new ArrayList<>();
		for (DocumentSymbol symbol : toDocumentSymbols(table.getRoot().getChildren())) {
			symbols.add(Either.forRight(symbol));
		}
		return CompletableFuture.completedFuture(symbols);
	}

	private List<DocumentSymbol> toDocumentSymbols(List<PhpSymbol> phpSymbols) {
		List<DocumentSymbol> result = new ArrayList<>();
		for (PhpSymbol phpSymbol : phpSymbols) {
			if (!PhpSymbolUtils.isDeclaration(phpSymbol) || phpSymbol.getLocation() == null
					|| phpSymbol.hasModifier(SymbolModifier.MAGIC)) {
				continue;
			}
			Range range = phpSymbol.getLocation().getRange();
			DocumentSymbol symbol = new DocumentSymbol(phpSymbol.getShortName(),
					PhpSymbolUtils.toSymbolKind(phpSymbol.getKind()), range, range);
			if (!phpSymbol.getType().isEmpty()) {
				symbol.setDetail(phpSymbol.getType().toString());
			}
			List<DocumentSymbol> children = toDocumentSymbols(phpSymbol.getChildren());
			if (!children.isEmpty()) {
				symbol.setChildren(children);
			}
			result.add(symbol);
		}
		return result;
	}
}
