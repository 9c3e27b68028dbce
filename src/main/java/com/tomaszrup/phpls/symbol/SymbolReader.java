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

import java.util.List;

import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.syntax.SyntaxNode;
import com.tomaszrup.phpls.tree.MultiVisitor;

/**
 * Name resolution and symbol reading in one pass. The resolver visitor runs
 * first at every node so that a declaration is read with the imports and
 * namespace in effect where it appears.
 */
public class SymbolReader extends MultiVisitor<SyntaxNode> {
	private final SymbolVisitor symbolVisitor;

	public SymbolReader(NameResolverVisitor nameResolverVisitor, SymbolVisitor symbolVisitor) {
		super(nameResolverVisitor, symbolVisitor);
		this.symbolVisitor = symbolVisitor;
	}

	public static SymbolReader create(ParsedDocument document, NameResolver nameResolver, PhpSymbol root) {
		return new SymbolReader(new NameResolverVisitor(document, nameResolver),
				new SymbolVisitor(document, nameResolver, root));
	}

	public boolean isExternalOnly() {
		return symbolVisitor.isExternalOnly();
	}

	public void setExternalOnly(boolean externalOnly) {
		symbolVisitor.setExternalOnly(externalOnly);
	}

	public List<PhpSymbol> getSpine() {
		return symbolVisitor.getSpine();
	}
}
