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
package com.tomaszrup.phpls.util;

import org.eclipse.lsp4j.SymbolKind;

import com.tomaszrup.phpls.symbol.PhpSymbol;
import com.tomaszrup.phpls.symbol.SymbolModifier;

/**
 * Mappings from the symbol model to LSP types.
 */
public class PhpSymbolUtils {

	private PhpSymbolUtils() {
	}

	public static SymbolKind toSymbolKind(com.tomaszrup.phpls.symbol.SymbolKind kind) {
		switch (kind) {
			case NAMESPACE:
				return SymbolKind.Namespace;
			case CLASS:
				return SymbolKind.Class;
			case INTERFACE:
				return SymbolKind.Interface;
			case TRAIT:
				// LSP has no trait kind
				return SymbolKind.Module;
			case FUNCTION:
				return SymbolKind.Function;
			case METHOD:
				return SymbolKind.Method;
			case PROPERTY:
				return SymbolKind.Property;
			case CLASS_CONSTANT:
			case CONSTANT:
				return SymbolKind.Constant;
			case PARAMETER:
			case VARIABLE:
				return SymbolKind.Variable;
			default:
				return SymbolKind.File;
		}
	}

	/**
	 * Whether a symbol is worth listing in workspace or document outlines:
	 * named declarations, not locals, imports or anonymous constructs.
	 */
	public static boolean isDeclaration(PhpSymbol symbol) {
		switch (symbol.getKind()) {
			case NONE:
			case PARAMETER:
			case VARIABLE:
				return false;
			default:
				return !symbol.getName().isEmpty()
						&& !symbol.hasModifier(SymbolModifier.ANONYMOUS)
						&& !symbol.hasModifier(SymbolModifier.USE);
		}
	}
}
