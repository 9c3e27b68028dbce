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

/**
 * Callbacks fired by {@link Tree#traverse(TreeVisitor, CancellationToken)}.
 * Every callback has a neutral default, so a visitor only overrides what it
 * needs.
 *
 * @param <T> the tree value type
 */
public interface TreeVisitor<T> {

	/**
	 * Called before the children of {@code node} are visited.
	 *
	 * @return whether to descend into the children
	 */
	default boolean preOrder(Tree<T> node) {
		return true;
	}

	/**
	 * Called between two consecutive children of {@code node}.
	 *
	 * @param afterChildIndex index of the child that was just traversed
	 */
	default void inOrder(Tree<T> node, int afterChildIndex) {
	}

	default void postOrder(Tree<T> node) {
	}
}
