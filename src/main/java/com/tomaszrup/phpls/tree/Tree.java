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
package com.tomaszrup.phpls.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Generic ordered tree. A node owns its children; the parent link is a
 * plain back-reference used for ancestor queries and is cleared when the
 * node is detached.
 *
 * @param <T> the value type
 */
public class Tree<T> {
	private final T value;
	private final List<Tree<T>> children = new ArrayList<>();
	private Tree<T> parent;

	public Tree(T value) {
		this.value = value;
	}

	public T getValue() {
		return value;
	}

	public Tree<T> getParent() {
		return parent;
	}

	public List<Tree<T>> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public Tree<T> child(int n) {
		return n >= 0 && n < children.size() ? children.get(n) : null;
	}

	public int childCount() {
		return children.size();
	}

	public Tree<T> addChild(Tree<T> child) {
		if (child.parent != null) {
			throw new IllegalArgumentException("Node is already attached to a parent");
		}
		children.add(child);
		child.parent = this;
		return child;
	}

	public void addChildren(List<Tree<T>> newChildren) {
		for (Tree<T> child : newChildren) {
			addChild(child);
		}
	}

	public Tree<T> removeChild(Tree<T> child) {
		int i = indexOfChild(child);
		if (i == -1) {
			return null;
		}
		child.parent = null;
		return children.remove(i);
	}

	public Tree<T> previousSibling() {
		if (parent == null) {
			return null;
		}
		int i = parent.indexOfChild(this);
		return i > 0 ? parent.children.get(i - 1) : null;
	}

	public Tree<T> nextSibling() {
		if (parent == null) {
			return null;
		}
		int i = parent.indexOfChild(this);
		return i != -1 && i < parent.children.size() - 1 ? parent.children.get(i + 1) : null;
	}

	private int indexOfChild(Tree<T> child) {
		// identity, values may implement equals()
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == child) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Walks the parent links upward and returns the first ancestor matching
	 * the predicate, or {@code null} once the root has been passed.
	 */
	public Tree<T> ancestor(Predicate<Tree<T>> predicate) {
		Tree<T> current = parent;
		while (current != null) {
			if (predicate.test(current)) {
				return current;
			}
			current = current.parent;
		}
		return null;
	}

	/**
	 * Breadth-first search for the first node (this node included) that
	 * matches the predicate.
	 */
	public Tree<T> find(Predicate<Tree<T>> predicate) {
		List<Tree<T>> found = new ArrayList<>(1);
		breadthFirstTraverse(node -> {
			if (predicate.test(node)) {
				found.add(node);
				return false;
			}
			return true;
		});
		return found.isEmpty() ? null : found.get(0);
	}

	/**
	 * Visits nodes level by level. Traversal stops as soon as the visitor
	 * returns {@code false}.
	 */
	public void breadthFirstTraverse(Predicate<Tree<T>> visitor) {
		Deque<Tree<T>> queue = new ArrayDeque<>();
		queue.add(this);
		while (!queue.isEmpty()) {
			Tree<T> node = queue.poll();
			if (!visitor.test(node)) {
				return;
			}
			queue.addAll(node.children);
		}
	}

	/**
	 * Pre-order list of every node matching the predicate.
	 */
	public List<Tree<T>> match(Predicate<Tree<T>> predicate) {
		List<Tree<T>> matches = new ArrayList<>();
		traverse(new TreeVisitor<T>() {
			@Override
			public boolean preOrder(Tree<T> node) {
				if (predicate.test(node)) {
					matches.add(node);
				}
				return true;
			}
		});
		return matches;
	}

	/**
	 * Pre-order flattening of the node values.
	 */
	public List<T> toList() {
		List<T> values = new ArrayList<>();
		traverse(new TreeVisitor<T>() {
			@Override
			public boolean preOrder(Tree<T> node) {
				values.add(node.getValue());
				return true;
			}
		});
		return values;
	}

	public void traverse(TreeVisitor<T> visitor) {
		traverse(visitor, CancellationToken.NONE);
	}

	/**
	 * Depth-first, left-to-right traversal. {@code inOrder} fires between two
	 * consecutive children with the index of the child just finished;
	 * {@code postOrder} fires for every node that received {@code preOrder},
	 * whether or not it was descended into.
	 *
	 * <p>The token is checked before every callback. Once it is cancelled the
	 * traversal unwinds without invoking anything further.</p>
	 *
	 * @return {@code true} if the traversal ran to completion, {@code false}
	 *         if it was cancelled
	 */
	public boolean traverse(TreeVisitor<T> visitor, CancellationToken token) {
		if (token.isCancelled()) {
			return false;
		}
		boolean descend = visitor.preOrder(this);
		if (descend) {
			int n = children.size();
			for (int i = 0; i < n; i++) {
				if (!children.get(i).traverse(visitor, token)) {
					return false;
				}
				if (i < n - 1) {
					if (token.isCancelled()) {
						return false;
					}
					visitor.inOrder(this, i);
				}
			}
		}
		if (token.isCancelled()) {
			return false;
		}
		visitor.postOrder(this);
		return true;
	}

	@Override
	public String toString() {
		return value != null ? value.toString() : "";
	}
}
