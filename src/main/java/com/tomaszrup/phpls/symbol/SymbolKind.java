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

public enum SymbolKind {
	/** Reserved for the synthetic root of a per-document tree. */
	NONE,
	NAMESPACE,
	CLASS,
	INTERFACE,
	TRAIT,
	FUNCTION,
	METHOD,
	PROPERTY,
	CLASS_CONSTANT,
	CONSTANT,
	PARAMETER,
	VARIABLE;

	public boolean isClassLike() {
		return this == CLASS || this == INTERFACE || this == TRAIT;
	}

	/**
	 * Kinds that open a lexical scope in the symbol tree.
	 */
	public boolean isScope() {
		return isClassLike() || this == NAMESPACE || this == FUNCTION || this == METHOD;
	}

	/**
	 * Kinds whose names PHP compares ignoring case. Variables, properties and
	 * constants are case sensitive.
	 */
	public boolean hasCaseInsensitiveName() {
		return isScope();
	}
}
