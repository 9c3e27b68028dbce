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

import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.syntax.PhraseType;
import com.tomaszrup.phpls.syntax.SyntaxNode;
import com.tomaszrup.phpls.tree.CancellationToken;
import com.tomaszrup.phpls.tree.Tree;
import com.tomaszrup.phpls.tree.TreeVisitor;

/**
 * Keeps a {@link NameResolver} in step with the namespace definitions and
 * {@code use} declarations of a traversal.
 *
 * <p>When given a halt node, the visitor cancels the traversal on reaching
 * it, leaving the resolver in the state that applies at that node.</p>
 */
public class NameResolverVisitor implements TreeVisitor<SyntaxNode> {
	private final ParsedDocument document;
	private final NameResolver nameResolver;
	private final Tree<SyntaxNode> haltAtNode;
	private final CancellationToken haltToken;

	public NameResolverVisitor(ParsedDocument document, NameResolver nameResolver) {
		this(document, nameResolver, null, null);
	}

	public NameResolverVisitor(ParsedDocument document, NameResolver nameResolver,
			Tree<SyntaxNode> haltAtNode, CancellationToken haltToken) {
		if (haltAtNode != null && haltToken == null) {
			throw new IllegalArgumentException("A halt node requires a token to cancel");
		}
		this.document = document;
		this.nameResolver = nameResolver;
		this.haltAtNode = haltAtNode;
		this.haltToken = haltToken;
	}

	public NameResolver getNameResolver() {
		return nameResolver;
	}

	@Override
	public boolean preOrder(Tree<SyntaxNode> node) {
		if (haltAtNode != null && node == haltAtNode) {
			haltToken.cancel();
			return false;
		}
		SyntaxNode value = node.getValue();
		if (value.isToken()) {
			return false;
		}
		switch (value.getPhraseType()) {
			case NAMESPACE_DEFINITION:
				nameResolver.setNamespaceName(
						document.nodeText(ParsedDocument.childOf(node, PhraseType.NAMESPACE_NAME)));
				nameResolver.clearRules();
				return true;
			case NAMESPACE_USE_DECLARATION:
				nameResolver.addRules(UseDeclarations.read(document, node));
				return false;
			case CLASS_DECLARATION_BODY:
			case INTERFACE_DECLARATION_BODY:
			case TRAIT_DECLARATION_BODY:
			case FUNCTION_DECLARATION_BODY:
			case METHOD_DECLARATION_BODY:
				// imports cannot appear in here; only a search for the halt node needs to look
				return haltAtNode != null;
			default:
				return true;
		}
	}

	@Override
	public void postOrder(Tree<SyntaxNode> node) {
		if (node.getValue().is(PhraseType.NAMESPACE_DEFINITION)
				&& ParsedDocument.childOf(node, PhraseType.COMPOUND_STATEMENT) != null) {
			nameResolver.setNamespaceName("");
			nameResolver.clearRules();
		}
	}
}
