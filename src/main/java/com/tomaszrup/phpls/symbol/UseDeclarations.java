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
package com.tomaszrup.phpls.symbol;

import java.util.ArrayList;
import java.util.List;

import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.syntax.PhraseType;
import com.tomaszrup.phpls.syntax.SyntaxNode;
import com.tomaszrup.phpls.syntax.TokenType;
import com.tomaszrup.phpls.tree.Tree;

/**
 * Reads {@code use} declarations into import records: one symbol per
 * clause, named by its alias, flagged {@link SymbolModifier#USE} and
 * associated with the imported name.
 */
public final class UseDeclarations {
	private UseDeclarations() {
	}

	public static List<PhpSymbol> read(ParsedDocument document, Tree<SyntaxNode> declaration) {
		List<PhpSymbol> records = new ArrayList<>();
		SymbolKind declarationKind = kindOf(declaration, SymbolKind.CLASS);
		String prefix = "";
		if (ParsedDocument.childOf(declaration, PhraseType.NAMESPACE_USE_GROUP_CLAUSE_LIST) != null) {
			prefix = document.nodeText(ParsedDocument.childOf(declaration, PhraseType.NAMESPACE_NAME));
		}
		List<Tree<SyntaxNode>> clauses = declaration.match(
				n -> n.getValue().is(PhraseType.NAMESPACE_USE_CLAUSE)
						|| n.getValue().is(PhraseType.NAMESPACE_USE_GROUP_CLAUSE));
		for (Tree<SyntaxNode> clause : clauses) {
			PhpSymbol record = readClause(document, clause, kindOf(clause, declarationKind), prefix);
			if (record != null) {
				records.add(record);
			}
		}
		return records;
	}

	private static PhpSymbol readClause(ParsedDocument document, Tree<SyntaxNode> clause,
			SymbolKind kind, String prefix) {
		String name = document.nodeText(ParsedDocument.childOf(clause, PhraseType.NAMESPACE_NAME));
		if (name.isEmpty()) {
			return null;
		}
		String fqn = NameResolver.concatNamespaceName(prefix, name);
		if (fqn.startsWith("\\")) {
			fqn = fqn.substring(1);
		}
		Tree<SyntaxNode> aliasing = ParsedDocument.childOf(clause, PhraseType.NAMESPACE_ALIASING_CLAUSE);
		String alias = document.nodeText(ParsedDocument.childOf(aliasing, TokenType.NAME));
		if (alias.isEmpty()) {
			int lastBackslash = fqn.lastIndexOf('\\');
			alias = lastBackslash == -1 ? fqn : fqn.substring(lastBackslash + 1);
		}
		PhpSymbol record = new PhpSymbol(kind, alias);
		record.addModifier(SymbolModifier.USE);
		record.addAssociated(new SymbolReference(kind, fqn));
		record.setLocation(document.nodeLocation(clause));
		return record;
	}

	private static SymbolKind kindOf(Tree<SyntaxNode> node, SymbolKind defaultKind) {
		if (ParsedDocument.childOf(node, TokenType.FUNCTION) != null) {
			return SymbolKind.FUNCTION;
		}
		if (ParsedDocument.childOf(node, TokenType.CONST) != null) {
			return SymbolKind.CONSTANT;
		}
		return defaultKind;
	}
}
