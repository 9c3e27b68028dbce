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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symbol tables of all known documents, searchable as one.
 *
 * <p>Tables are replaced whole under the write lock, so a query either sees
 * the previous table of a document or the new one, never a mix. Results
 * keep the order in which documents were first registered.</p>
 *
 * <p>Relations between symbols ({@link PhpSymbol#getAssociated()}) are
 * followed by looking names up again, never through held references, since
 * the target's table may be replaced at any time.</p>
 */
public class SymbolStore {
	private static final Logger logger = LoggerFactory.getLogger(SymbolStore.class);

	private final Map<String, SymbolTable> tables = new LinkedHashMap<>();
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
	private final boolean caseSensitive;

	public SymbolStore() {
		this(false);
	}

	public SymbolStore(boolean caseSensitive) {
		this.caseSensitive = caseSensitive;
	}

	/**
	 * Replaces the table of the table's document.
	 */
	public void update(SymbolTable table) {
		lock.writeLock().lock();
		try {
			SymbolTable previous = tables.put(table.getUri(), table);
			logger.debug("{} symbol table for {}", previous == null ? "Added" : "Replaced", table.getUri());
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * Indexes {@code root} and replaces the document's table with it.
	 */
	public void update(String uri, PhpSymbol root) {
		update(new SymbolTable(uri, root, caseSensitive));
	}

	public void remove(String uri) {
		lock.writeLock().lock();
		try {
			if (tables.remove(uri) != null) {
				logger.debug("Removed symbol table for {}", uri);
			}
		} finally {
			lock.writeLock().unlock();
		}
	}

	public SymbolTable getSymbolTable(String uri) {
		lock.readLock().lock();
		try {
			return tables.get(uri);
		} finally {
			lock.readLock().unlock();
		}
	}

	public List<SymbolTable> getSymbolTables() {
		lock.readLock().lock();
		try {
			return new ArrayList<>(tables.values());
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	 * Symbols named exactly {@code name} across all documents.
	 */
	public List<PhpSymbol> find(String name) {
		return find(name, null);
	}

	public List<PhpSymbol> find(String name, Predicate<PhpSymbol> filter) {
		if (name == null || name.isEmpty()) {
			return Collections.emptyList();
		}
		List<PhpSymbol> result = new ArrayList<>();
		for (SymbolTable table : getSymbolTables()) {
			for (PhpSymbol symbol : table.find(name)) {
				if (filter == null || filter.test(symbol)) {
					result.add(symbol);
				}
			}
		}
		return result;
	}

	/**
	 * Symbols whose name contains {@code text} across all documents.
	 */
	public List<PhpSymbol> match(String text) {
		return match(text, null);
	}

	public List<PhpSymbol> match(String text, Predicate<PhpSymbol> filter) {
		if (text == null || text.isEmpty()) {
			return Collections.emptyList();
		}
		List<PhpSymbol> result = new ArrayList<>();
		Set<PhpSymbol> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		for (SymbolTable table : getSymbolTables()) {
			for (PhpSymbol symbol : table.match(text)) {
				if ((filter == null || filter.test(symbol)) && seen.add(symbol)) {
					result.add(symbol);
				}
			}
		}
		return result;
	}

	/**
	 * Members of a class-like type and, transitively, of the classes,
	 * interfaces and traits it is associated with. Members declared on the
	 * type itself come first.
	 */
	public List<PhpSymbol> findMembers(String typeName, Predicate<PhpSymbol> filter) {
		List<PhpSymbol> members = new ArrayList<>();
		Set<String> visited = new HashSet<>();
		Deque<String> pending = new ArrayDeque<>();
		pending.add(typeName);
		while (!pending.isEmpty()) {
			String name = pending.poll();
			if (name.isEmpty() || !visited.add(name.toLowerCase(Locale.ROOT))) {
				continue;
			}
			for (PhpSymbol type : find(name, s -> s.getKind().isClassLike())) {
				for (PhpSymbol member : type.getChildren()) {
					if (filter == null || filter.test(member)) {
						members.add(member);
					}
				}
				for (SymbolReference reference : type.getAssociated()) {
					if (reference.getKind().isClassLike()) {
						pending.add(reference.getName());
					}
				}
			}
		}
		return members;
	}

	/**
	 * The base class named in a class-like's associations, or {@code null}.
	 */
	public static String baseClassName(PhpSymbol type) {
		for (SymbolReference reference : type.getAssociated()) {
			if (reference.getKind() == SymbolKind.CLASS) {
				return reference.getName();
			}
		}
		return null;
	}
}
