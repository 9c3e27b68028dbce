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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.syntax.PhraseType;
import com.tomaszrup.phpls.syntax.SyntaxNode;
import com.tomaszrup.phpls.tree.Tree;

/**
 * Turns names as written into fully qualified names using the active
 * namespace and the {@code use} imports seen so far.
 *
 * <p>Resolution never fails: when an import cannot supply a target the
 * literal text is kept.</p>
 */
public class NameResolver {

	public static final Set<String> DEFAULT_BUILT_IN_TYPES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"array", "bool", "boolean", "callable", "double", "false", "float", "int", "integer",
			"iterable", "mixed", "never", "null", "object", "parent", "resource", "self", "static",
			"string", "true", "void", "$this")));

	private final Set<String> builtInTypes;
	private String namespaceName = "";
	private final List<PhpSymbol> rules = new ArrayList<>();

	public NameResolver() {
		this(DEFAULT_BUILT_IN_TYPES);
	}

	/**
	 * @param builtInTypes lower-case names that are never namespace-prefixed
	 */
	public NameResolver(Set<String> builtInTypes) {
		this.builtInTypes = builtInTypes;
	}

	public Set<String> getBuiltInTypes() {
		return builtInTypes;
	}

	public String getNamespaceName() {
		return namespaceName;
	}

	public void setNamespaceName(String namespaceName) {
		this.namespaceName = namespaceName == null ? "" : namespaceName;
	}

	/**
	 * Import records ({@link SymbolModifier#USE}) currently in effect.
	 */
	public List<PhpSymbol> getRules() {
		return Collections.unmodifiableList(rules);
	}

	public void addRules(List<PhpSymbol> importRecords) {
		rules.addAll(importRecords);
	}

	public void clearRules() {
		rules.clear();
	}

	public boolean isBuiltInType(String name) {
		return builtInTypes.contains(name.toLowerCase(Locale.ROOT));
	}

	/**
	 * Prefixes {@code name} with the active namespace.
	 */
	public String resolveRelative(String name) {
		return concatNamespaceName(namespaceName, name);
	}

	/**
	 * Resolves a name that does not start with {@code \}. The first segment
	 * is matched against imports of the given kind; namespaced names always
	 * match class imports, which also cover namespace aliases.
	 */
	public String resolveNotFullyQualified(String name, SymbolKind kind) {
		if (name == null || name.isEmpty()) {
			return "";
		}
		if (kind.isClassLike() && isBuiltInType(name)) {
			return name;
		}
		int backslash = name.indexOf('\\');
		if (backslash == -1) {
			PhpSymbol rule = matchRule(name, kind);
			if (rule != null) {
				return importTarget(rule, name);
			}
			return resolveRelative(name);
		}
		String first = name.substring(0, backslash);
		PhpSymbol rule = matchRule(first, SymbolKind.CLASS);
		if (rule != null) {
			return concatNamespaceName(importTarget(rule, first), name.substring(backslash + 1));
		}
		return resolveRelative(name);
	}

	/**
	 * Resolves a class-like name in any of the three written forms.
	 */
	public String resolveTypeName(String name) {
		if (name.startsWith("\\")) {
			return name.substring(1);
		}
		if (name.toLowerCase(Locale.ROOT).startsWith("namespace\\")) {
			return resolveRelative(name.substring("namespace\\".length()));
		}
		return resolveNotFullyQualified(name, SymbolKind.CLASS);
	}

	/**
	 * Resolves a {@code QUALIFIED_NAME}, {@code FULLY_QUALIFIED_NAME} or
	 * {@code RELATIVE_QUALIFIED_NAME} phrase.
	 *
	 * @return the fully qualified name, or an empty string for other nodes
	 */
	public String resolveNameNode(ParsedDocument document, Tree<SyntaxNode> node, SymbolKind kind) {
		if (node == null) {
			return "";
		}
		Tree<SyntaxNode> namespaceName = ParsedDocument.childOf(node, PhraseType.NAMESPACE_NAME);
		String text = document.nodeText(namespaceName);
		if (text.isEmpty()) {
			return "";
		}
		if (node.getValue().is(PhraseType.FULLY_QUALIFIED_NAME)) {
			return text;
		}
		if (node.getValue().is(PhraseType.RELATIVE_QUALIFIED_NAME)) {
			return resolveRelative(text);
		}
		if (node.getValue().is(PhraseType.QUALIFIED_NAME)) {
			return resolveNotFullyQualified(text, kind);
		}
		return "";
	}

	private PhpSymbol matchRule(String alias, SymbolKind kind) {
		// imports of interfaces and traits are recorded as class imports
		SymbolKind ruleKind = kind.isClassLike() ? SymbolKind.CLASS : kind;
		for (PhpSymbol rule : rules) {
			if (rule.getKind() != ruleKind) {
				continue;
			}
			boolean matches = kind == SymbolKind.CONSTANT
					? rule.getName().equals(alias)
					: rule.getName().equalsIgnoreCase(alias);
			if (matches) {
				return rule;
			}
		}
		return null;
	}

	private static String importTarget(PhpSymbol rule, String literal) {
		List<SymbolReference> associated = rule.getAssociated();
		if (associated.isEmpty() || associated.get(0).getName().isEmpty()) {
			return literal;
		}
		return associated.get(0).getName();
	}

	public static String concatNamespaceName(String prefix, String suffix) {
		if (suffix == null || suffix.isEmpty()) {
			return prefix == null ? "" : prefix;
		}
		if (prefix == null || prefix.isEmpty()) {
			return suffix;
		}
		return prefix + "\\" + suffix;
	}
}
