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
package com.tomaszrup.phpls.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Sorted multi-key index supporting prefix search over generated keys.
 *
 * <p>Each item is indexed under every key produced by the key generator,
 * typically every suffix of a name. Searching for a prefix of any of those
 * keys then finds the item, which turns a prefix range query into a
 * substring search.</p>
 *
 * <p>Nodes are ordered lexicographically by the case-folded key, ties broken
 * by the raw key, so every key starting with a given prefix (ignoring case)
 * sorts right after that prefix. When the index is case-insensitive, keys and queries are
 * lower-cased before use. Items are held by reference and compared by
 * identity; the index never owns them.</p>
 *
 * @param <T> the item type
 */
public class SuffixArray<T> {

	private static final class Node<T> {
		private final String key;
		private final List<T> items = new ArrayList<>(2);

		private Node(String key) {
			this.key = key;
		}
	}

	private final List<Node<T>> nodes = new ArrayList<>();
	private final BinarySearch<Node<T>> binarySearch = new BinarySearch<>(nodes);
	private final Function<T, Collection<String>> keyGenerator;
	private final boolean caseSensitive;

	public SuffixArray(Function<T, Collection<String>> keyGenerator, boolean caseSensitive) {
		this.keyGenerator = keyGenerator;
		this.caseSensitive = caseSensitive;
	}

	public boolean isCaseSensitive() {
		return caseSensitive;
	}

	public void add(T item) {
		for (String rawKey : keyGenerator.apply(item)) {
			String key = normalize(rawKey);
			Node<T> node = findNode(key);
			if (node == null) {
				node = new Node<>(key);
				insertNode(node);
			}
			if (!containsIdentity(node.items, item)) {
				node.items.add(item);
			}
		}
	}

	public void addAll(Collection<? extends T> items) {
		for (T item : items) {
			add(item);
		}
	}

	public void remove(T item) {
		for (String rawKey : keyGenerator.apply(item)) {
			Node<T> node = findNode(normalize(rawKey));
			if (node == null) {
				continue;
			}
			for (int i = 0; i < node.items.size(); i++) {
				if (node.items.get(i) == item) {
					node.items.remove(i);
					break;
				}
			}
			if (node.items.isEmpty()) {
				deleteNode(node);
			}
		}
	}

	public void removeAll(Collection<? extends T> items) {
		for (T item : items) {
			remove(item);
		}
	}

	/**
	 * @return the items indexed under exactly {@code key}, in insertion order
	 */
	public List<T> find(String key) {
		Node<T> node = findNode(normalize(key));
		return node != null ? Collections.unmodifiableList(new ArrayList<>(node.items)) : Collections.emptyList();
	}

	/**
	 * @return the de-duplicated items of every key that starts with
	 *         {@code text}, in key order
	 */
	public List<T> match(String text) {
		String query = normalize(text);
		String foldedQuery = fold(query);
		List<Node<T>> candidates = binarySearch.range(
				n -> fold(n.key).compareTo(foldedQuery),
				n -> fold(n.key).startsWith(foldedQuery) ? -1 : 1);

		Set<T> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		List<T> matches = new ArrayList<>();
		for (Node<T> node : candidates) {
			// the range is case-folded; a case-sensitive index narrows it here
			if (caseSensitive && !node.key.startsWith(query)) {
				continue;
			}
			for (T item : node.items) {
				if (seen.add(item)) {
					matches.add(item);
				}
			}
		}
		return matches;
	}

	public int size() {
		return nodes.size();
	}

	public List<String> getKeys() {
		List<String> keys = new ArrayList<>(nodes.size());
		for (Node<T> node : nodes) {
			keys.add(node.key);
		}
		return keys;
	}

	private Node<T> findNode(String key) {
		return binarySearch.find(n -> compareKeys(n.key, key));
	}

	private void insertNode(Node<T> node) {
		int rank = binarySearch.rank(n -> compareKeys(n.key, node.key));
		if (rank < nodes.size() && compareKeys(nodes.get(rank).key, node.key) == 0) {
			throw new IllegalStateException("Duplicate index key '" + node.key + "'");
		}
		nodes.add(rank, node);
	}

	private void deleteNode(Node<T> node) {
		int rank = binarySearch.rank(n -> compareKeys(n.key, node.key));
		if (rank < nodes.size() && nodes.get(rank) == node) {
			nodes.remove(rank);
		}
	}

	private int compareKeys(String a, String b) {
		int result = fold(a).compareTo(fold(b));
		return result != 0 ? result : a.compareTo(b);
	}

	private String normalize(String text) {
		return caseSensitive ? text : fold(text);
	}

	private static String fold(String text) {
		return text.toLowerCase(Locale.ROOT);
	}

	private static <T> boolean containsIdentity(List<T> items, T item) {
		for (T existing : items) {
			if (existing == item) {
				return true;
			}
		}
		return false;
	}
}
