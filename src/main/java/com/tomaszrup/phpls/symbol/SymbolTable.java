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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.eclipse.lsp4j.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.phpls.config.IndexOptions;
import com.tomaszrup.phpls.index.SuffixArray;
import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.tree.CancellationToken;

/**
 * The symbols of one document: the tree read from its syntax tree and a
 * suffix index over every symbol in it.
 *
 * <p>A table is built once from a complete traversal and never changed
 * afterwards; an edit to the document produces a new table.</p>
 */
public class SymbolTable {
	private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

	private final String uri;
	private final PhpSymbol root;
	private final SuffixArray<PhpSymbol> index;

	public SymbolTable(String uri, PhpSymbol root) {
		this(uri, root, false);
	}

	public SymbolTable(String uri, PhpSymbol root, boolean caseSensitive) {
		this.uri = uri;
		this.root = root;
		this.index = new SuffixArray<>(SymbolTable::indexKeys, caseSensitive);
		List<PhpSymbol> symbols = root.flatten();
		index.addAll(symbols.subList(1, symbols.size()));
	}

	/**
	 * Reads and indexes a document.
	 *
	 * @return the table, or {@code null} if the token was cancelled before
	 *         the traversal finished
	 */
	public static SymbolTable create(ParsedDocument document, IndexOptions options, CancellationToken token) {
		PhpSymbol root = PhpSymbol.root();
		SymbolReader reader = SymbolReader.create(document, new NameResolver(options.getBuiltInTypes()), root);
		reader.setExternalOnly(options.isExternalOnly());
		if (!document.traverse(reader, token)) {
			logger.debug("Symbol read of {} cancelled, discarding partial tree", document.getUri());
			return null;
		}
		SymbolTable table = new SymbolTable(document.getUri(), root, options.isCaseSensitiveSearch());
		logger.debug("Read {} symbols from {}", table.size(), document.getUri());
		return table;
	}

	/**
	 * Every suffix of the short name without its {@code $}, plus the full
	 * name. Anonymous symbols are found by full name only and import records
	 * are not indexed at all.
	 */
	static Collection<String> indexKeys(PhpSymbol symbol) {
		if (symbol.getKind() == SymbolKind.NONE || symbol.hasModifier(SymbolModifier.USE)
				|| symbol.getName().isEmpty()) {
			return Collections.emptyList();
		}
		if (symbol.hasModifier(SymbolModifier.ANONYMOUS)) {
			return Collections.singletonList(symbol.getName());
		}
		List<String> keys = new ArrayList<>();
		String shortName = symbol.getShortName();
		if (shortName.startsWith("$")) {
			shortName = shortName.substring(1);
		}
		for (int i = 0; i < shortName.length(); i++) {
			keys.add(shortName.substring(i));
		}
		if (!keys.contains(symbol.getName())) {
			keys.add(symbol.getName());
		}
		return keys;
	}

	public String getUri() {
		return uri;
	}

	public PhpSymbol getRoot() {
		return root;
	}

	/**
	 * Number of symbols in the table, the root excluded.
	 */
	public int size() {
		return root.flatten().size() - 1;
	}

	/**
	 * Symbols whose full name is {@code name}. Unless the index is case
	 * sensitive, names of kinds PHP treats case-insensitively also match
	 * ignoring case.
	 */
	public List<PhpSymbol> find(String name) {
		List<PhpSymbol> result = new ArrayList<>();
		for (PhpSymbol symbol : index.find(name)) {
			boolean equal = symbol.getName().equals(name)
					|| (!index.isCaseSensitive() && symbol.getKind().hasCaseInsensitiveName()
							&& symbol.getName().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT)));
			if (equal) {
				result.add(symbol);
			}
		}
		return result;
	}

	/**
	 * Symbols with a name containing {@code text}, or whose full name starts
	 * with it.
	 */
	public List<PhpSymbol> match(String text) {
		return index.match(text);
	}

	/**
	 * Class-likes, functions and methods whose declaration contains the
	 * position, innermost first.
	 */
	public List<PhpSymbol> scopeAt(Position position) {
		List<PhpSymbol> scopes = new ArrayList<>();
		PhpSymbol current = root;
		while (current != null) {
			PhpSymbol next = null;
			for (PhpSymbol child : current.getChildren()) {
				if (child.getKind().isScope() && child.getKind() != SymbolKind.NAMESPACE
						&& child.getLocation() != null
						&& Ranges.contains(child.getLocation().getRange(), position)) {
					next = child;
					break;
				}
			}
			if (next != null) {
				scopes.add(0, next);
			}
			current = next;
		}
		return scopes;
	}
}
