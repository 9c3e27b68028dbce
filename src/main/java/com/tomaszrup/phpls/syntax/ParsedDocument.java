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
package com.tomaszrup.phpls.syntax;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.phpls.tree.CancellationToken;
import com.tomaszrup.phpls.tree.Tree;
import com.tomaszrup.phpls.tree.TreeVisitor;

/**
 * A source file together with its parse tree. Immutable: an edit produces a
 * new instance from the parser.
 */
public class ParsedDocument {
	private final String uri;
	private final String text;
	private final Tree<SyntaxNode> tree;
	private final int[] lineStarts;

	public ParsedDocument(String uri, String text, Tree<SyntaxNode> tree) {
		if (uri == null || text == null || tree == null) {
			throw new IllegalArgumentException("uri, text and tree are required");
		}
		this.uri = uri;
		this.text = text;
		this.tree = tree;
		this.lineStarts = Positions.lineStartOffsets(text);
	}

	public String getUri() {
		return uri;
	}

	public String getText() {
		return text;
	}

	public Tree<SyntaxNode> getTree() {
		return tree;
	}

	public boolean traverse(TreeVisitor<SyntaxNode> visitor, CancellationToken token) {
		return tree.traverse(visitor, token);
	}

	/**
	 * Raw source text of a node, trivia included.
	 */
	public String rawText(Tree<SyntaxNode> node) {
		SyntaxNode value = node.getValue();
		int start = Math.min(value.getOffset(), text.length());
		int end = Math.min(value.getEnd(), text.length());
		return text.substring(start, end);
	}

	/**
	 * Source text of a node with whitespace and comment tokens left out.
	 */
	public String nodeText(Tree<SyntaxNode> node) {
		if (node == null) {
			return "";
		}
		if (node.getValue().isToken()) {
			return node.getValue().isTrivia() ? "" : rawText(node);
		}
		StringBuilder builder = new StringBuilder();
		appendText(node, builder);
		return builder.toString();
	}

	private void appendText(Tree<SyntaxNode> node, StringBuilder builder) {
		for (Tree<SyntaxNode> child : node.getChildren()) {
			SyntaxNode value = child.getValue();
			if (value.isToken()) {
				if (!value.isTrivia()) {
					builder.append(rawText(child));
				}
			} else {
				appendText(child, builder);
			}
		}
	}

	public Position positionAtOffset(int offset) {
		return Positions.positionAt(lineStarts, text.length(), offset);
	}

	public int offsetAtPosition(Position position) {
		return Positions.offsetAt(lineStarts, text.length(), position);
	}

	public Range nodeRange(Tree<SyntaxNode> node) {
		SyntaxNode value = node.getValue();
		return new Range(positionAtOffset(value.getOffset()), positionAtOffset(value.getEnd()));
	}

	public Location nodeLocation(Tree<SyntaxNode> node) {
		return new Location(uri, nodeRange(node));
	}

	/**
	 * Finds the token covering {@code offset}. A cursor sitting right after a
	 * token (its end offset) still selects that token unless another
	 * non-trivia token starts exactly there.
	 *
	 * @return the token node, or {@code null} if none is close enough
	 */
	public Tree<SyntaxNode> tokenAtOffset(int offset) {
		Tree<SyntaxNode> node = tree;
		while (node.getValue().isPhrase()) {
			Tree<SyntaxNode> next = childAt(node, offset);
			if (next == null) {
				return null;
			}
			node = next;
		}
		return node;
	}

	private Tree<SyntaxNode> childAt(Tree<SyntaxNode> node, int offset) {
		Tree<SyntaxNode> touching = null;
		for (Tree<SyntaxNode> child : node.getChildren()) {
			SyntaxNode value = child.getValue();
			if (value.getOffset() <= offset && offset < value.getEnd()
					&& !(value.isTrivia() && touching != null)) {
				return child;
			}
			if (value.getEnd() == offset && !value.isTrivia()) {
				touching = child;
			}
		}
		return touching;
	}

	/**
	 * First direct child matching the predicate, or {@code null}.
	 */
	public static Tree<SyntaxNode> childOf(Tree<SyntaxNode> node, Predicate<SyntaxNode> predicate) {
		if (node == null) {
			return null;
		}
		for (Tree<SyntaxNode> child : node.getChildren()) {
			if (predicate.test(child.getValue())) {
				return child;
			}
		}
		return null;
	}

	public static Tree<SyntaxNode> childOf(Tree<SyntaxNode> node, PhraseType type) {
		return childOf(node, v -> v.is(type));
	}

	public static Tree<SyntaxNode> childOf(Tree<SyntaxNode> node, TokenType type) {
		return childOf(node, v -> v.is(type));
	}

	/**
	 * Direct children that are not trivia.
	 */
	public static List<Tree<SyntaxNode>> significantChildren(Tree<SyntaxNode> node) {
		return node.getChildren().stream().filter(c -> !c.getValue().isTrivia()).collect(Collectors.toList());
	}

	public static boolean isPhrase(Tree<SyntaxNode> node, PhraseType... types) {
		if (node == null) {
			return false;
		}
		for (PhraseType type : types) {
			if (node.getValue().is(type)) {
				return true;
			}
		}
		return false;
	}
}
