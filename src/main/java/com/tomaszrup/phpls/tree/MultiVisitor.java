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

import java.util.ArrayList;
import java.util.List;

/**
 * Runs several visitors in lock-step over a single traversal.
 *
 * <p>Each component decides on its own whether to descend below a node. A
 * component that declines is parked at that node: it receives no callbacks
 * for the node's descendants and is reactivated when {@code postOrder} for
 * the same node fires. The composite descends if at least one active
 * component wants to.</p>
 *
 * @param <T> the tree value type
 */
public class MultiVisitor<T> implements TreeVisitor<T> {

	private final List<TreeVisitor<T>> visitors = new ArrayList<>();

	/** Node at which the visitor with the same index declined, or null while active. */
	private final List<Tree<T>> parkedAt = new ArrayList<>();

	@SafeVarargs
	public MultiVisitor(TreeVisitor<T>... visitors) {
		for (TreeVisitor<T> visitor : visitors) {
			add(visitor);
		}
	}

	public void add(TreeVisitor<T> visitor) {
		visitors.add(visitor);
		parkedAt.add(null);
	}

	public List<TreeVisitor<T>> getVisitors() {
		return visitors;
	}

	@Override
	public boolean preOrder(Tree<T> node) {
		boolean descend = false;
		for (int i = 0; i < visitors.size(); i++) {
			if (parkedAt.get(i) != null) {
				continue;
			}
			if (visitors.get(i).preOrder(node)) {
				descend = true;
			} else {
				parkedAt.set(i, node);
			}
		}
		return descend;
	}

	@Override
	public void inOrder(Tree<T> node, int afterChildIndex) {
		for (int i = 0; i < visitors.size(); i++) {
			if (parkedAt.get(i) == null) {
				visitors.get(i).inOrder(node, afterChildIndex);
			}
		}
	}

	@Override
	public void postOrder(Tree<T> node) {
		for (int i = 0; i < visitors.size(); i++) {
			if (parkedAt.get(i) == node) {
				parkedAt.set(i, null);
			}
			if (parkedAt.get(i) == null) {
				visitors.get(i).postOrder(node);
			}
		}
	}
}
