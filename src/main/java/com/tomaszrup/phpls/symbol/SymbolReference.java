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

import java.util.Objects;

/**
 * A named relation to another symbol (base class, interface, trait, import
 * target). Resolved lazily by name through the {@link SymbolStore}, never by
 * holding the target itself.
 */
public final class SymbolReference {
	private final SymbolKind kind;
	private final String name;

	public SymbolReference(SymbolKind kind, String name) {
		this.kind = kind;
		this.name = name;
	}

	public SymbolKind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SymbolReference)) return false;
		SymbolReference other = (SymbolReference) o;
		return kind == other.kind && Objects.equals(name, other.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, name);
	}

	@Override
	public String toString() {
		return kind + " " + name;
	}
}
