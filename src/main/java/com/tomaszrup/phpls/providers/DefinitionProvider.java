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
package com.tomaszrup.phpls.providers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.phpls.symbol.NameResolver;
import com.tomaszrup.phpls.symbol.NameResolverVisitor;
import com.tomaszrup.phpls.symbol.PhpSymbol;
import com.tomaszrup.phpls.symbol.SymbolKind;
import com.tomaszrup.phpls.symbol.SymbolModifier;
import com.tomaszrup.phpls.symbol.SymbolStore;
import com.tomaszrup.phpls.symbol.SymbolTable;
import com.tomaszrup.phpls.symbol.UseDeclarations;
import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.syntax.ParsedDocumentStore;
import com.tomaszrup.phpls.syntax.PhraseType;
import com.tomaszrup.phpls.syntax.SyntaxNode;
import com.tomaszrup.phpls.syntax.TokenType;
import com.tomaszrup.phpls.tree.CancellationToken;
import com.tomaszrup.phpls.tree.Tree;

/**
 * Resolves the reference under a cursor to the location of its declaration.
 *
 * <p>The token at the cursor is classified by the smallest enclosing phrase
 * of a known reference shape: a name, a {@code Type::member} access, an
 * {@code $expr->member} access or a variable. Types of expressions are taken
 * from the {@code type} recorded on symbols; there is no flow analysis.
 * Anything that cannot be resolved yields no location.</p>
 */
public class DefinitionProvider {
	private static final Logger logger = LoggerFactory.getLogger(DefinitionProvider.class);

	private final ParsedDocumentStore documentStore;
	private final SymbolStore symbolStore;
	private final Set<String> builtInTypes;

	public DefinitionProvider(ParsedDocumentStore documentStore, SymbolStore symbolStore) {
		this(documentStore, symbolStore, NameResolver.DEFAULT_BUILT_IN_TYPES);
	}

	public DefinitionProvider(ParsedDocumentStore documentStore, SymbolStore symbolStore, Set<String> builtInTypes) {
		this.documentStore = documentStore;
		this.symbolStore = symbolStore;
		this.builtInTypes = builtInTypes;
	}

	public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> provideDefinition(
			TextDocumentIdentifier textDocument, Position position) {
		Location location = findDefinition(textDocument.getUri(), position);
		if (location == null) {
			return CompletableFuture.completedFuture(Either.forLeft(Collections.emptyList()));
		}
		return CompletableFuture.completedFuture(Either.forLeft(Collections.singletonList(location)));
	}

	/**
	 * @return the declaration's location, or {@code null} if the cursor is not
	 *         on a resolvable reference
	 */
	public Location findDefinition(String uri, Position position) {
		ParsedDocument document = documentStore.get(uri);
		SymbolTable table = symbolStore.getSymbolTable(uri);
		if (document == null || table == null) {
			logger.debug("No parsed document or symbol table for {}", uri);
			return null;
		}
		int offset = document.offsetAtPosition(position);
		if (offset < 0) {
			return null;
		}
		Tree<SyntaxNode> token = document.tokenAtOffset(offset);
		if (token == null || token.getValue().isTrivia()) {
			return null;
		}
		Context context = new Context(document, table, position, resolverAt(document, token));
		PhpSymbol definition = resolve(context, token);
		if (definition == null) {
			logger.debug("No definition found at {}:{}:{}", uri, position.getLine(), position.getCharacter());
			return null;
		}
		return definition.getLocation();
	}

	/**
	 * Everything a lookup needs to know about where the cursor is.
	 */
	private static final class Context {
		private final ParsedDocument document;
		private final SymbolTable table;
		private final Position position;
		private final NameResolver nameResolver;

		private Context(ParsedDocument document, SymbolTable table, Position position, NameResolver nameResolver) {
			this.document = document;
			this.table = table;
			this.position = position;
			this.nameResolver = nameResolver;
		}
	}

	/**
	 * Replays namespace and import declarations up to {@code node}.
	 */
	private NameResolver resolverAt(ParsedDocument document, Tree<SyntaxNode> node) {
		NameResolver nameResolver = new NameResolver(builtInTypes);
		CancellationToken haltToken = new CancellationToken();
		document.traverse(new NameResolverVisitor(document, nameResolver, node, haltToken), haltToken);
		return nameResolver;
	}

	private PhpSymbol resolve(Context context, Tree<SyntaxNode> token) {
		Tree<SyntaxNode> node = token.getParent();
		while (node != null) {
			switch (node.getValue().getPhraseType()) {
				case NAMESPACE_NAME:
				case IDENTIFIER:
					node = node.getParent();
					continue;
				case QUALIFIED_NAME:
				case FULLY_QUALIFIED_NAME:
				case RELATIVE_QUALIFIED_NAME:
					return qualifiedName(context, node);
				case NAMESPACE_USE_CLAUSE:
				case NAMESPACE_USE_GROUP_CLAUSE:
					return useClause(context, node);
				case RELATIVE_SCOPE:
					return firstOrNull(relativeScopeTypes(context, node));
				case SCOPED_MEMBER_NAME:
					return scopedMember(context, node.getParent());
				case MEMBER_NAME:
					return instanceMember(context, node.getParent());
				case SIMPLE_VARIABLE:
				case ANONYMOUS_FUNCTION_USE_VARIABLE:
					return variable(context, node);
				default:
					return null;
			}
		}
		return null;
	}

	// names

	private PhpSymbol qualifiedName(Context context, Tree<SyntaxNode> namePhrase) {
		Tree<SyntaxNode> parent = namePhrase.getParent();
		SymbolKind kind = SymbolKind.CLASS;
		if (ParsedDocument.isPhrase(parent, PhraseType.FUNCTION_CALL_EXPRESSION)
				&& ParsedDocument.significantChildren(parent).get(0) == namePhrase) {
			kind = SymbolKind.FUNCTION;
		} else if (ParsedDocument.isPhrase(parent, PhraseType.CONSTANT_ACCESS_EXPRESSION)) {
			kind = SymbolKind.CONSTANT;
		}

		String text = context.document.nodeText(ParsedDocument.childOf(namePhrase, PhraseType.NAMESPACE_NAME));
		if (kind == SymbolKind.CLASS && namePhrase.getValue().is(PhraseType.QUALIFIED_NAME)) {
			String lower = text.toLowerCase(Locale.ROOT);
			if ("self".equals(lower) || "static".equals(lower)) {
				return enclosingClass(context);
			}
			if ("parent".equals(lower)) {
				return firstOrNull(relativeScopeTypes(context, namePhrase));
			}
		}

		String fqn = context.nameResolver.resolveNameNode(context.document, namePhrase, kind);
		PhpSymbol found = findByKind(fqn, kind);
		if (found == null && kind != SymbolKind.CLASS
				&& namePhrase.getValue().is(PhraseType.QUALIFIED_NAME) && text.indexOf('\\') == -1) {
			// unqualified functions and constants fall back to the global namespace
			found = findByKind(text, kind);
		}
		return found;
	}

	private PhpSymbol useClause(Context context, Tree<SyntaxNode> clause) {
		Tree<SyntaxNode> declaration = clause.ancestor(n -> n.getValue().is(PhraseType.NAMESPACE_USE_DECLARATION));
		if (declaration == null) {
			return null;
		}
		for (PhpSymbol record : UseDeclarations.read(context.document, declaration)) {
			if (Ranges.contains(record.getLocation().getRange(), context.position)
					&& !record.getAssociated().isEmpty()) {
				return findByKind(record.getAssociated().get(0).getName(), record.getKind());
			}
		}
		return null;
	}

	private PhpSymbol findByKind(String name, SymbolKind kind) {
		Predicate<PhpSymbol> filter = kind.isClassLike()
				? s -> s.getKind().isClassLike()
				: s -> s.getKind() == kind;
		List<PhpSymbol> found = symbolStore.find(name, filter);
		return found.isEmpty() ? null : found.get(0);
	}

	// members

	private PhpSymbol scopedMember(Context context, Tree<SyntaxNode> access) {
		if (access == null) {
			return null;
		}
		List<Tree<SyntaxNode>> children = ParsedDocument.significantChildren(access);
		if (children.isEmpty()) {
			return null;
		}
		Tree<SyntaxNode> memberName = ParsedDocument.childOf(access, PhraseType.SCOPED_MEMBER_NAME);
		String name = context.document.nodeText(memberName);
		SymbolKind kind;
		if (access.getValue().is(PhraseType.SCOPED_CALL_EXPRESSION)) {
			kind = SymbolKind.METHOD;
		} else if (access.getValue().is(PhraseType.SCOPED_PROPERTY_ACCESS_EXPRESSION)) {
			kind = SymbolKind.PROPERTY;
		} else if (access.getValue().is(PhraseType.CLASS_CONSTANT_ACCESS_EXPRESSION)) {
			kind = SymbolKind.CLASS_CONSTANT;
		} else {
			return null;
		}
		List<String> types = scopeTypes(context, children.get(0));
		return findMember(types, kind, name);
	}

	private PhpSymbol instanceMember(Context context, Tree<SyntaxNode> access) {
		if (access == null) {
			return null;
		}
		List<Tree<SyntaxNode>> children = ParsedDocument.significantChildren(access);
		if (children.isEmpty()) {
			return null;
		}
		String name = context.document.nodeText(ParsedDocument.childOf(access, PhraseType.MEMBER_NAME));
		SymbolKind kind;
		if (access.getValue().is(PhraseType.METHOD_CALL_EXPRESSION)) {
			kind = SymbolKind.METHOD;
		} else if (access.getValue().is(PhraseType.PROPERTY_ACCESS_EXPRESSION)) {
			kind = SymbolKind.PROPERTY;
			name = "$" + name;
		} else {
			return null;
		}
		return findMember(expressionTypes(context, children.get(0)), kind, name);
	}

	private PhpSymbol findMember(List<String> types, SymbolKind kind, String name) {
		for (String type : types) {
			List<PhpSymbol> members = symbolStore.findMembers(type, memberFilter(kind, name));
			if (!members.isEmpty()) {
				return members.get(0);
			}
		}
		return null;
	}

	private static Predicate<PhpSymbol> memberFilter(SymbolKind kind, String name) {
		if (kind == SymbolKind.METHOD) {
			return s -> s.getKind() == kind && s.getName().equalsIgnoreCase(name);
		}
		return s -> s.getKind() == kind && s.getName().equals(name);
	}

	/**
	 * Types named on the left of {@code ::}.
	 */
	private List<String> scopeTypes(Context context, Tree<SyntaxNode> scope) {
		if (scope.getValue().is(PhraseType.RELATIVE_SCOPE)) {
			List<String> names = new ArrayList<>();
			for (PhpSymbol type : relativeScopeTypes(context, scope)) {
				names.add(type.getName());
			}
			return names;
		}
		if (ParsedDocument.isPhrase(scope, PhraseType.QUALIFIED_NAME, PhraseType.FULLY_QUALIFIED_NAME,
				PhraseType.RELATIVE_QUALIFIED_NAME)) {
			String fqn = context.nameResolver.resolveNameNode(context.document, scope, SymbolKind.CLASS);
			return fqn.isEmpty() ? Collections.emptyList() : Collections.singletonList(fqn);
		}
		return expressionTypes(context, scope);
	}

	/**
	 * Class names an expression may evaluate to, as far as declared and
	 * documented types tell.
	 */
	private List<String> expressionTypes(Context context, Tree<SyntaxNode> expression) {
		SyntaxNode value = expression.getValue();
		if (value.isToken()) {
			return Collections.emptyList();
		}
		switch (value.getPhraseType()) {
			case SIMPLE_VARIABLE: {
				String name = context.document.nodeText(expression);
				if ("$this".equals(name)) {
					PhpSymbol enclosing = enclosingClass(context);
					return enclosing == null ? Collections.emptyList() : Collections.singletonList(enclosing.getName());
				}
				PhpSymbol variable = findVariable(context, name);
				return variable == null ? Collections.emptyList() : typeNames(variable);
			}
			case OBJECT_CREATION_EXPRESSION: {
				Tree<SyntaxNode> designator = ParsedDocument.childOf(expression, PhraseType.CLASS_TYPE_DESIGNATOR);
				List<Tree<SyntaxNode>> designatorChildren = designator == null
						? Collections.emptyList()
						: ParsedDocument.significantChildren(designator);
				return designatorChildren.isEmpty()
						? Collections.emptyList()
						: scopeTypes(context, designatorChildren.get(0));
			}
			case ENCAPSULATED_EXPRESSION: {
				for (Tree<SyntaxNode> child : ParsedDocument.significantChildren(expression)) {
					if (child.getValue().isPhrase()) {
						return expressionTypes(context, child);
					}
				}
				return Collections.emptyList();
			}
			case PROPERTY_ACCESS_EXPRESSION:
			case METHOD_CALL_EXPRESSION:
				return typeNames(instanceMember(context, expression));
			case SCOPED_CALL_EXPRESSION:
			case SCOPED_PROPERTY_ACCESS_EXPRESSION:
				return typeNames(scopedMember(context, expression));
			case FUNCTION_CALL_EXPRESSION: {
				Tree<SyntaxNode> callee = ParsedDocument.significantChildren(expression).get(0);
				if (!ParsedDocument.isPhrase(callee, PhraseType.QUALIFIED_NAME, PhraseType.FULLY_QUALIFIED_NAME,
						PhraseType.RELATIVE_QUALIFIED_NAME)) {
					return Collections.emptyList();
				}
				return typeNames(qualifiedName(context, callee));
			}
			default:
				return Collections.emptyList();
		}
	}

	/**
	 * Class names in a symbol's type. {@code self}, {@code static} and
	 * {@code $this} stand for the class declaring the symbol.
	 */
	private List<String> typeNames(PhpSymbol symbol) {
		if (symbol == null) {
			return Collections.emptyList();
		}
		Set<String> names = new LinkedHashSet<>();
		for (String part : symbol.getType().getParts()) {
			String lower = part.toLowerCase(Locale.ROOT);
			if (("self".equals(lower) || "static".equals(lower) || "$this".equals(lower)) && symbol.getScope() != null) {
				names.add(symbol.getScope());
			}
		}
		names.addAll(symbol.getType().classNames(new NameResolver(builtInTypes)));
		return new ArrayList<>(names);
	}

	private List<PhpSymbol> relativeScopeTypes(Context context, Tree<SyntaxNode> relativeScope) {
		String text = context.document.nodeText(relativeScope).toLowerCase(Locale.ROOT);
		if ("parent".equals(text)) {
			List<PhpSymbol> parents = new ArrayList<>();
			for (String name : parentClassNames(context)) {
				PhpSymbol type = findByKind(name, SymbolKind.CLASS);
				if (type != null) {
					parents.add(type);
				}
			}
			return parents;
		}
		PhpSymbol enclosing = enclosingClass(context);
		return enclosing == null ? Collections.emptyList() : Collections.singletonList(enclosing);
	}

	private List<String> parentClassNames(Context context) {
		PhpSymbol enclosing = enclosingClass(context);
		String base = enclosing == null ? null : SymbolStore.baseClassName(enclosing);
		return base == null ? Collections.emptyList() : Collections.singletonList(base);
	}

	private static PhpSymbol firstOrNull(List<PhpSymbol> symbols) {
		return symbols.isEmpty() ? null : symbols.get(0);
	}

	private static PhpSymbol enclosingClass(Context context) {
		for (PhpSymbol scope : context.table.scopeAt(context.position)) {
			if (scope.getKind().isClassLike()) {
				return scope;
			}
		}
		return null;
	}

	// variables

	private PhpSymbol variable(Context context, Tree<SyntaxNode> node) {
		Tree<SyntaxNode> nameToken = node.getValue().is(PhraseType.SIMPLE_VARIABLE)
				? node
				: ParsedDocument.childOf(node, TokenType.VARIABLE_NAME);
		String name = context.document.nodeText(nameToken);
		if ("$this".equals(name)) {
			return enclosingClass(context);
		}
		return findVariable(context, name);
	}

	/**
	 * Looks a variable up in the innermost function-like scope. A closure
	 * {@code use} capture continues the search in the next scope out; any
	 * other miss stops at the function boundary.
	 */
	private PhpSymbol findVariable(Context context, String name) {
		if (name.isEmpty()) {
			return null;
		}
		List<PhpSymbol> functionScopes = new ArrayList<>();
		for (PhpSymbol scope : context.table.scopeAt(context.position)) {
			if (scope.getKind() == SymbolKind.FUNCTION || scope.getKind() == SymbolKind.METHOD) {
				functionScopes.add(scope);
			}
		}
		functionScopes.add(context.table.getRoot());
		for (PhpSymbol scope : functionScopes) {
			PhpSymbol declaration = null;
			for (PhpSymbol child : scope.getChildren()) {
				if ((child.getKind() == SymbolKind.VARIABLE || child.getKind() == SymbolKind.PARAMETER)
						&& child.getName().equals(name)) {
					declaration = child;
					break;
				}
			}
			if (declaration == null) {
				return null;
			}
			if (!declaration.hasModifier(SymbolModifier.USE)) {
				return declaration;
			}
		}
		return null;
	}
}
