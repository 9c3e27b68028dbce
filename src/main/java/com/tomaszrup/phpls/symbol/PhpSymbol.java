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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.eclipse.lsp4j.Location;

/**
 * A declaration in the symbol index. Built by {@link SymbolVisitor} during
 * a single traversal and not modified once the owning {@link SymbolTable}
 * has been published.
 *
 * <p>{@link #getChildren() children} are owned: each child belongs to
 * exactly one parent. {@link #getAssociated() associated} entries are
 * references by name only.</p>
 */
public class PhpSymbol {
	private final SymbolKind kind;
	private final String name;
	private final EnumSet<SymbolModifier> modifiers = EnumSet.noneOf(SymbolModifier.class);
	private final List<PhpSymbol> children = new ArrayList<>();
	private final List<SymbolReference> associated = new ArrayList<>();
	private TypeString type = TypeString.EMPTY;
	private Location location;
	private Location docLocation;
	private String doc;
	private String scope;

	public PhpSymbol(SymbolKind kind, String name) {
		this.kind = kind;
		this.name = name == null ? "" : name;
	}

	/**
	 * Synthetic root of a per-document tree.
	 */
	public static PhpSymbol root() {
		return new PhpSymbol(SymbolKind.NONE, "");
	}

	public SymbolKind getKind() {
		return kind;
	}

	/**
	 * Fully qualified for namespace members, plain for members and locals.
	 */
	public String getName() {
		return name;
	}

	/**
	 * The name without its namespace prefix.
	 */
	public String getShortName() {
		int lastBackslash = name.lastIndexOf('\\');
		return lastBackslash == -1 ? name : name.substring(lastBackslash + 1);
	}

	public Set<SymbolModifier> getModifiers() {
		return Collections.unmodifiableSet(modifiers);
	}

	public boolean hasModifier(SymbolModifier modifier) {
		return modifiers.contains(modifier);
	}

	void addModifier(SymbolModifier modifier) {
		modifiers.add(modifier);
	}

	void addModifiers(Set<SymbolModifier> toAdd) {
		modifiers.addAll(toAdd);
	}

	public List<PhpSymbol> getChildren() {
		return Collections.unmodifiableList(children);
	}

	void addChild(PhpSymbol child) {
		children.add(child);
	}

	public List<SymbolReference> getAssociated() {
		return Collections.unmodifiableList(associated);
	}

	void addAssociated(SymbolReference reference) {
		associated.add(reference);
	}

	public TypeString getType() {
		return type;
	}

	void setType(TypeString type) {
		this.type = type == null ? TypeString.EMPTY : type;
	}

	public Location getLocation() {
		return location;
	}

	void setLocation(Location location) {
		this.location = location;
	}

	public Location getDocLocation() {
		return docLocation;
	}

	void setDocLocation(Location docLocation) {
		this.docLocation = docLocation;
	}

	public String getDoc() {
		return doc;
	}

	void setDoc(String doc) {
		this.doc = doc;
	}

	/**
	 * Name of the class-like symbol declaring this member, if any.
	 */
	public String getScope() {
		return scope;
	}

	void setScope(String scope) {
		this.scope = scope;
	}

	/**
	 * Pre-order list of this symbol and all of its descendants.
	 */
	public List<PhpSymbol> flatten() {
		List<PhpSymbol> result = new ArrayList<>();
		collect(this, result);
		return result;
	}

	private static void collect(PhpSymbol symbol, List<PhpSymbol> result) {
		result.add(symbol);
		for (PhpSymbol child : symbol.children) {
			collect(child, result);
		}
	}

	@Override
	public String toString() {
		return kind + " " + name;
	}
}
