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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.eclipse.lsp4j.Location;

import com.tomaszrup.phpls.phpdoc.MethodTagParam;
import com.tomaszrup.phpls.phpdoc.PhpDoc;
import com.tomaszrup.phpls.phpdoc.PhpDocParser;
import com.tomaszrup.phpls.phpdoc.Tag;
import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.syntax.PhraseType;
import com.tomaszrup.phpls.syntax.SyntaxNode;
import com.tomaszrup.phpls.syntax.TokenType;
import com.tomaszrup.phpls.tree.Tree;
import com.tomaszrup.phpls.tree.TreeVisitor;

/**
 * Builds the symbol tree of one document. Must run behind a
 * {@link NameResolverVisitor} over the same traversal, which keeps the
 * shared {@link NameResolver} current; see {@link SymbolReader}.
 *
 * <p>Declarations are read whole when their phrase is entered. Scopes
 * (class-likes, functions, methods, closures) are pushed on the spine and
 * popped again when their phrase is left, so nested declarations land in
 * the right parent. Namespaces are not scopes here: their members are
 * siblings of the namespace symbol.</p>
 */
public class SymbolVisitor implements TreeVisitor<SyntaxNode> {
	private static final String ANONYMOUS_PREFIX = "#anon#";

	private final ParsedDocument document;
	private final NameResolver nameResolver;
	private final Deque<PhpSymbol> spine = new ArrayDeque<>();
	private final Deque<Tree<SyntaxNode>> pushedNodes = new ArrayDeque<>();
	private final Map<PhpSymbol, PhpDoc> functionDocs = new IdentityHashMap<>();
	private final Map<PhpSymbol, Set<String>> variableTables = new IdentityHashMap<>();
	private boolean externalOnly;

	private PhpDoc lastDoc;
	private Location lastDocLocation;

	private PhpDoc declarationDoc;
	private Set<SymbolModifier> declarationModifiers = EnumSet.noneOf(SymbolModifier.class);

	public SymbolVisitor(ParsedDocument document, NameResolver nameResolver, PhpSymbol root) {
		this.document = document;
		this.nameResolver = nameResolver;
		spine.push(root);
	}

	public boolean isExternalOnly() {
		return externalOnly;
	}

	/**
	 * When set, symbols only meaningful inside the document (variables,
	 * imports, closures and anonymous classes) are not created.
	 */
	public void setExternalOnly(boolean externalOnly) {
		this.externalOnly = externalOnly;
	}

	/**
	 * Scopes from the current one (first) out to the root (last).
	 */
	public List<PhpSymbol> getSpine() {
		return new ArrayList<>(spine);
	}

	@Override
	public boolean preOrder(Tree<SyntaxNode> node) {
		SyntaxNode value = node.getValue();
		if (value.isToken()) {
			if (value.is(TokenType.DOCUMENT_COMMENT)) {
				lastDoc = PhpDocParser.parse(document.rawText(node));
				lastDocLocation = document.nodeLocation(node);
			} else if (!value.isTrivia()) {
				lastDoc = null;
				lastDocLocation = null;
			}
			return false;
		}

		boolean descend = readPhrase(node);
		if (!descend && containsCode(node)) {
			// tokens of a declined phrase are never visited
			lastDoc = null;
			lastDocLocation = null;
		}
		return descend;
	}

	private boolean readPhrase(Tree<SyntaxNode> node) {
		switch (node.getValue().getPhraseType()) {
			case NAMESPACE_DEFINITION:
				namespaceDefinition(node);
				return true;
			case NAMESPACE_USE_DECLARATION:
				if (!externalOnly) {
					for (PhpSymbol record : UseDeclarations.read(document, node)) {
						addSymbol(record);
					}
				}
				return false;
			case CLASS_DECLARATION:
				push(node, classDeclaration(node));
				return true;
			case INTERFACE_DECLARATION:
				push(node, interfaceDeclaration(node));
				return true;
			case TRAIT_DECLARATION:
				push(node, traitDeclaration(node));
				return true;
			case ANONYMOUS_CLASS_DECLARATION:
				if (externalOnly) {
					return false;
				}
				push(node, anonymousClassDeclaration(node));
				return true;
			case TRAIT_USE_CLAUSE:
				for (String name : qualifiedNameList(
						ParsedDocument.childOf(node, PhraseType.QUALIFIED_NAME_LIST), SymbolKind.TRAIT)) {
					top().addAssociated(new SymbolReference(SymbolKind.TRAIT, name));
				}
				return false;
			case FUNCTION_DECLARATION:
				push(node, functionDeclaration(node));
				return true;
			case METHOD_DECLARATION:
				push(node, methodDeclaration(node));
				return true;
			case ANONYMOUS_FUNCTION_CREATION_EXPRESSION:
				if (externalOnly) {
					return false;
				}
				push(node, anonymousFunction(node));
				return true;
			case ANONYMOUS_FUNCTION_USE_VARIABLE:
				closureUseVariable(node);
				return false;
			case PARAMETER_DECLARATION:
				addSymbol(parameterDeclaration(node));
				return false;
			case CLASS_CONST_DECLARATION:
				declarationDoc = takeDoc(node);
				declarationModifiers = memberModifiers(ParsedDocument.childOf(node, PhraseType.MEMBER_MODIFIER_LIST));
				declarationModifiers.add(SymbolModifier.STATIC);
				return true;
			case CLASS_CONST_ELEMENT:
				addSymbol(classConstElement(node));
				return false;
			case PROPERTY_DECLARATION:
				declarationDoc = takeDoc(node);
				declarationModifiers = memberModifiers(ParsedDocument.childOf(node, PhraseType.MEMBER_MODIFIER_LIST));
				return true;
			case PROPERTY_ELEMENT:
				addSymbol(propertyElement(node));
				return false;
			case CONST_DECLARATION:
				declarationDoc = takeDoc(node);
				return true;
			case CONST_ELEMENT:
				addSymbol(constElement(node));
				return false;
			case FUNCTION_CALL_EXPRESSION:
				PhpSymbol defined = defineCall(node);
				if (defined != null) {
					addSymbol(defined);
				}
				return true;
			case CATCH_CLAUSE:
				catchClause(node);
				return true;
			case SIMPLE_VARIABLE:
				if (!externalOnly && shouldReadVariable(node)) {
					simpleVariable(node);
				}
				return false;
			default:
				return true;
		}
	}

	private static boolean containsCode(Tree<SyntaxNode> node) {
		return node.find(n -> n.getValue().isToken() && !n.getValue().isTrivia()) != null;
	}

	@Override
	public void postOrder(Tree<SyntaxNode> node) {
		if (!pushedNodes.isEmpty() && pushedNodes.peek() == node) {
			pushedNodes.pop();
			PhpSymbol popped = spine.pop();
			functionDocs.remove(popped);
			variableTables.remove(popped);
			return;
		}
		if (ParsedDocument.isPhrase(node, PhraseType.CLASS_CONST_DECLARATION, PhraseType.PROPERTY_DECLARATION,
				PhraseType.CONST_DECLARATION)) {
			declarationDoc = null;
			declarationModifiers = EnumSet.noneOf(SymbolModifier.class);
		}
	}

	private PhpSymbol top() {
		return spine.peek();
	}

	private void addSymbol(PhpSymbol symbol) {
		top().addChild(symbol);
	}

	private void push(Tree<SyntaxNode> node, PhpSymbol symbol) {
		addSymbol(symbol);
		spine.push(symbol);
		pushedNodes.push(node);
	}

	// declarations

	private void namespaceDefinition(Tree<SyntaxNode> node) {
		String name = document.nodeText(ParsedDocument.childOf(node, PhraseType.NAMESPACE_NAME));
		if (name.isEmpty()) {
			return;
		}
		PhpSymbol symbol = new PhpSymbol(SymbolKind.NAMESPACE, name);
		symbol.setLocation(document.nodeLocation(node));
		addSymbol(symbol);
	}

	private PhpSymbol classDeclaration(Tree<SyntaxNode> node) {
		DocComment doc = takeDocComment(node);
		Tree<SyntaxNode> header = ParsedDocument.childOf(node, PhraseType.CLASS_DECLARATION_HEADER);
		PhpSymbol symbol = new PhpSymbol(SymbolKind.CLASS, declaredName(header));
		symbol.setLocation(document.nodeLocation(node));
		if (ParsedDocument.childOf(header, TokenType.ABSTRACT) != null) {
			symbol.addModifier(SymbolModifier.ABSTRACT);
		}
		if (ParsedDocument.childOf(header, TokenType.FINAL) != null) {
			symbol.addModifier(SymbolModifier.FINAL);
		}
		classHeaderClauses(symbol, header);
		applyClassDoc(symbol, doc);
		return symbol;
	}

	private PhpSymbol interfaceDeclaration(Tree<SyntaxNode> node) {
		DocComment doc = takeDocComment(node);
		Tree<SyntaxNode> header = ParsedDocument.childOf(node, PhraseType.INTERFACE_DECLARATION_HEADER);
		PhpSymbol symbol = new PhpSymbol(SymbolKind.INTERFACE, declaredName(header));
		symbol.setLocation(document.nodeLocation(node));
		Tree<SyntaxNode> baseClause = ParsedDocument.childOf(header, PhraseType.INTERFACE_BASE_CLAUSE);
		for (String name : qualifiedNameList(
				ParsedDocument.childOf(baseClause, PhraseType.QUALIFIED_NAME_LIST), SymbolKind.INTERFACE)) {
			symbol.addAssociated(new SymbolReference(SymbolKind.INTERFACE, name));
		}
		applyClassDoc(symbol, doc);
		return symbol;
	}

	private PhpSymbol traitDeclaration(Tree<SyntaxNode> node) {
		DocComment doc = takeDocComment(node);
		Tree<SyntaxNode> header = ParsedDocument.childOf(node, PhraseType.TRAIT_DECLARATION_HEADER);
		PhpSymbol symbol = new PhpSymbol(SymbolKind.TRAIT, declaredName(header));
		symbol.setLocation(document.nodeLocation(node));
		applyClassDoc(symbol, doc);
		return symbol;
	}

	private PhpSymbol anonymousClassDeclaration(Tree<SyntaxNode> node) {
		PhpSymbol symbol = new PhpSymbol(SymbolKind.CLASS, anonymousName(node));
		symbol.addModifier(SymbolModifier.ANONYMOUS);
		symbol.setLocation(document.nodeLocation(node));
		classHeaderClauses(symbol,
				ParsedDocument.childOf(node, PhraseType.ANONYMOUS_CLASS_DECLARATION_HEADER));
		return symbol;
	}

	private void classHeaderClauses(PhpSymbol symbol, Tree<SyntaxNode> header) {
		Tree<SyntaxNode> baseClause = ParsedDocument.childOf(header, PhraseType.CLASS_BASE_CLAUSE);
		String baseName = nameResolver.resolveNameNode(document, nameChild(baseClause), SymbolKind.CLASS);
		if (!baseName.isEmpty()) {
			symbol.addAssociated(new SymbolReference(SymbolKind.CLASS, baseName));
		}
		Tree<SyntaxNode> interfaceClause = ParsedDocument.childOf(header, PhraseType.CLASS_INTERFACE_CLAUSE);
		for (String name : qualifiedNameList(
				ParsedDocument.childOf(interfaceClause, PhraseType.QUALIFIED_NAME_LIST), SymbolKind.INTERFACE)) {
			symbol.addAssociated(new SymbolReference(SymbolKind.INTERFACE, name));
		}
	}

	private String declaredName(Tree<SyntaxNode> header) {
		String name = document.nodeText(ParsedDocument.childOf(header, TokenType.NAME));
		return name.isEmpty() ? "" : nameResolver.resolveRelative(name);
	}

	private void applyClassDoc(PhpSymbol symbol, DocComment doc) {
		if (doc == null) {
			return;
		}
		applyDoc(symbol, doc);
		for (Tag tag : doc.phpDoc.getMethodTags()) {
			if (!tag.getName().isEmpty()) {
				symbol.addChild(magicMethod(tag, symbol.getName(), doc.location));
			}
		}
		for (Tag tag : doc.phpDoc.getPropertyTags()) {
			if (!tag.getName().isEmpty()) {
				symbol.addChild(magicProperty(tag, symbol.getName(), doc.location));
			}
		}
	}

	private PhpSymbol magicMethod(Tag tag, String scope, Location location) {
		PhpSymbol method = new PhpSymbol(SymbolKind.METHOD, tag.getName());
		method.addModifier(SymbolModifier.MAGIC);
		if (tag.isStatic()) {
			method.addModifier(SymbolModifier.STATIC);
		}
		method.setType(TypeString.parse(tag.getTypeString()).resolve(nameResolver));
		method.setDoc(emptyToNull(tag.getDescription()));
		method.setScope(scope);
		method.setLocation(location);
		for (MethodTagParam param : tag.getParameters()) {
			PhpSymbol parameter = new PhpSymbol(SymbolKind.PARAMETER, param.getName());
			parameter.addModifier(SymbolModifier.MAGIC);
			if (param.isVariadic()) {
				parameter.addModifier(SymbolModifier.VARIADIC);
			}
			parameter.setType(TypeString.parse(param.getTypeString()).resolve(nameResolver));
			parameter.setScope(scope);
			parameter.setLocation(location);
			method.addChild(parameter);
		}
		return method;
	}

	private PhpSymbol magicProperty(Tag tag, String scope, Location location) {
		PhpSymbol property = new PhpSymbol(SymbolKind.PROPERTY, tag.getName());
		property.addModifier(SymbolModifier.MAGIC);
		if (Tag.PROPERTY_READ.equals(tag.getTagName())) {
			property.addModifier(SymbolModifier.READ_ONLY);
		}
		property.setType(TypeString.parse(tag.getTypeString()).resolve(nameResolver));
		property.setDoc(emptyToNull(tag.getDescription()));
		property.setScope(scope);
		property.setLocation(location);
		return property;
	}

	private PhpSymbol functionDeclaration(Tree<SyntaxNode> node) {
		DocComment doc = takeDocComment(node);
		Tree<SyntaxNode> header = ParsedDocument.childOf(node, PhraseType.FUNCTION_DECLARATION_HEADER);
		PhpSymbol symbol = new PhpSymbol(SymbolKind.FUNCTION, declaredName(header));
		symbol.setLocation(document.nodeLocation(node));
		symbol.setType(returnType(header, doc));
		applyDoc(symbol, doc);
		rememberDoc(symbol, doc);
		return symbol;
	}

	private PhpSymbol methodDeclaration(Tree<SyntaxNode> node) {
		DocComment doc = takeDocComment(node);
		Tree<SyntaxNode> header = ParsedDocument.childOf(node, PhraseType.METHOD_DECLARATION_HEADER);
		String name = document.nodeText(ParsedDocument.childOf(header, PhraseType.IDENTIFIER));
		PhpSymbol symbol = new PhpSymbol(SymbolKind.METHOD, name);
		symbol.addModifiers(memberModifiers(ParsedDocument.childOf(header, PhraseType.MEMBER_MODIFIER_LIST)));
		symbol.setLocation(document.nodeLocation(node));
		symbol.setScope(enclosingClassName());
		symbol.setType(returnType(header, doc));
		applyDoc(symbol, doc);
		rememberDoc(symbol, doc);
		return symbol;
	}

	private PhpSymbol anonymousFunction(Tree<SyntaxNode> node) {
		Tree<SyntaxNode> header = ParsedDocument.childOf(node, PhraseType.ANONYMOUS_FUNCTION_HEADER);
		PhpSymbol symbol = new PhpSymbol(SymbolKind.FUNCTION, anonymousName(node));
		symbol.addModifier(SymbolModifier.ANONYMOUS);
		if (ParsedDocument.childOf(header, TokenType.STATIC) != null) {
			symbol.addModifier(SymbolModifier.STATIC);
		}
		symbol.setLocation(document.nodeLocation(node));
		symbol.setType(returnType(header, null));
		return symbol;
	}

	private void closureUseVariable(Tree<SyntaxNode> node) {
		String name = document.nodeText(ParsedDocument.childOf(node, TokenType.VARIABLE_NAME));
		if (name.isEmpty()) {
			return;
		}
		PhpSymbol variable = new PhpSymbol(SymbolKind.VARIABLE, name);
		variable.addModifier(SymbolModifier.USE);
		variable.setLocation(document.nodeLocation(node));
		addSymbol(variable);
		variableTable().add(name);
	}

	private PhpSymbol parameterDeclaration(Tree<SyntaxNode> node) {
		String name = document.nodeText(ParsedDocument.childOf(node, TokenType.VARIABLE_NAME));
		PhpSymbol symbol = new PhpSymbol(SymbolKind.PARAMETER, name);
		symbol.setLocation(document.nodeLocation(node));
		symbol.setScope(top().getName());
		if (ParsedDocument.childOf(node, TokenType.ELLIPSIS) != null) {
			symbol.addModifier(SymbolModifier.VARIADIC);
		}
		Tree<SyntaxNode> typeDeclaration = ParsedDocument.childOf(node, PhraseType.TYPE_DECLARATION);
		if (typeDeclaration != null) {
			if (ParsedDocument.childOf(typeDeclaration, TokenType.QUESTION) != null) {
				symbol.addModifier(SymbolModifier.NULLABLE);
			}
			symbol.setType(TypeString.parse(typeDeclaration(typeDeclaration)));
		}
		PhpDoc functionDoc = functionDocs.get(top());
		if (functionDoc != null) {
			Tag paramTag = functionDoc.findParamTag(name);
			if (paramTag != null) {
				if (symbol.getType().isEmpty()) {
					symbol.setType(TypeString.parse(paramTag.getTypeString()).resolve(nameResolver));
				}
				symbol.setDoc(emptyToNull(paramTag.getDescription()));
			}
		}
		variableTable().add(name);
		return symbol;
	}

	private PhpSymbol classConstElement(Tree<SyntaxNode> node) {
		String name = document.nodeText(ParsedDocument.childOf(node, PhraseType.IDENTIFIER));
		PhpSymbol symbol = new PhpSymbol(SymbolKind.CLASS_CONSTANT, name);
		symbol.addModifiers(declarationModifiers);
		symbol.setLocation(document.nodeLocation(node));
		symbol.setScope(enclosingClassName());
		symbol.setType(varType(null, node));
		applyDeclarationDoc(symbol);
		return symbol;
	}

	private PhpSymbol propertyElement(Tree<SyntaxNode> node) {
		String name = document.nodeText(ParsedDocument.childOf(node, TokenType.VARIABLE_NAME));
		PhpSymbol symbol = new PhpSymbol(SymbolKind.PROPERTY, name);
		symbol.addModifiers(declarationModifiers);
		symbol.setLocation(document.nodeLocation(node));
		symbol.setScope(enclosingClassName());
		symbol.setType(varType(name, ParsedDocument.childOf(node, PhraseType.PROPERTY_INITIALISER)));
		applyDeclarationDoc(symbol);
		return symbol;
	}

	private PhpSymbol constElement(Tree<SyntaxNode> node) {
		String name = document.nodeText(ParsedDocument.childOf(node, TokenType.NAME));
		PhpSymbol symbol = new PhpSymbol(SymbolKind.CONSTANT, name.isEmpty() ? "" : nameResolver.resolveRelative(name));
		symbol.setLocation(document.nodeLocation(node));
		symbol.setType(varType(null, node));
		applyDeclarationDoc(symbol);
		return symbol;
	}

	/**
	 * {@code define('NAME', value)} declares a global constant.
	 */
	private PhpSymbol defineCall(Tree<SyntaxNode> node) {
		List<Tree<SyntaxNode>> children = ParsedDocument.significantChildren(node);
		if (children.isEmpty()) {
			return null;
		}
		String callee = document.nodeText(children.get(0));
		if (callee.startsWith("\\")) {
			callee = callee.substring(1);
		}
		if (!"define".equalsIgnoreCase(callee)) {
			return null;
		}
		List<Tree<SyntaxNode>> arguments = argumentList(ParsedDocument.childOf(node, PhraseType.ARGUMENT_EXPRESSION_LIST));
		if (arguments.isEmpty()) {
			return null;
		}
		String name = unquote(document.nodeText(arguments.get(0)));
		if (name == null || name.isEmpty()) {
			return null;
		}
		if (name.startsWith("\\")) {
			name = name.substring(1);
		}
		PhpSymbol symbol = new PhpSymbol(SymbolKind.CONSTANT, name);
		symbol.setLocation(document.nodeLocation(node));
		if (arguments.size() > 1) {
			symbol.setType(TypeString.parse(literalType(arguments.get(1))));
		}
		return symbol;
	}

	private void catchClause(Tree<SyntaxNode> node) {
		if (externalOnly) {
			return;
		}
		Tree<SyntaxNode> variableName = ParsedDocument.childOf(node, TokenType.VARIABLE_NAME);
		String name = document.nodeText(variableName);
		if (name.isEmpty() || !variableTable().add(name)) {
			return;
		}
		PhpSymbol variable = new PhpSymbol(SymbolKind.VARIABLE, name);
		variable.setLocation(document.nodeLocation(variableName));
		List<String> caught = qualifiedNameList(ParsedDocument.childOf(node, PhraseType.CATCH_NAME_LIST), SymbolKind.CLASS);
		variable.setType(TypeString.parse(String.join("|", caught)));
		addSymbol(variable);
	}

	private void simpleVariable(Tree<SyntaxNode> node) {
		String name = document.nodeText(node);
		if (name.isEmpty() || "$this".equals(name) || !variableTable().add(name)) {
			// first assignment in a scope wins
			return;
		}
		PhpSymbol variable = new PhpSymbol(SymbolKind.VARIABLE, name);
		variable.setLocation(document.nodeLocation(node));
		if (lastDoc != null) {
			Tag varTag = lastDoc.findVarTag(name);
			if (varTag != null) {
				variable.setType(TypeString.parse(varTag.getTypeString()).resolve(nameResolver));
				variable.setDoc(emptyToNull(varTag.getDescription()));
			}
		}
		if (variable.getType().isEmpty()) {
			variable.setType(assignedObjectType(node));
		}
		addSymbol(variable);
	}

	private boolean shouldReadVariable(Tree<SyntaxNode> node) {
		Tree<SyntaxNode> parent = node.getParent();
		if (parent == null) {
			return false;
		}
		if (ParsedDocument.isPhrase(parent, PhraseType.SIMPLE_ASSIGNMENT_EXPRESSION,
				PhraseType.BY_REF_ASSIGNMENT_EXPRESSION)) {
			List<Tree<SyntaxNode>> operands = ParsedDocument.significantChildren(parent);
			return !operands.isEmpty() && operands.get(0) == node;
		}
		if (ParsedDocument.isPhrase(parent, PhraseType.FOREACH_KEY, PhraseType.FOREACH_VALUE)) {
			return true;
		}
		return ParsedDocument.isPhrase(parent, PhraseType.VARIABLE_NAME_LIST)
				&& ParsedDocument.isPhrase(parent.getParent(), PhraseType.GLOBAL_DECLARATION);
	}

	/**
	 * {@code $x = new T} gives {@code $x} the type {@code T}.
	 */
	private TypeString assignedObjectType(Tree<SyntaxNode> variable) {
		Tree<SyntaxNode> parent = variable.getParent();
		if (!ParsedDocument.isPhrase(parent, PhraseType.SIMPLE_ASSIGNMENT_EXPRESSION,
				PhraseType.BY_REF_ASSIGNMENT_EXPRESSION)) {
			return TypeString.EMPTY;
		}
		List<Tree<SyntaxNode>> operands = ParsedDocument.significantChildren(parent);
		Tree<SyntaxNode> right = operands.get(operands.size() - 1);
		if (!right.getValue().is(PhraseType.OBJECT_CREATION_EXPRESSION)) {
			return TypeString.EMPTY;
		}
		Tree<SyntaxNode> designator = ParsedDocument.childOf(right, PhraseType.CLASS_TYPE_DESIGNATOR);
		String name = nameResolver.resolveNameNode(document, nameChild(designator), SymbolKind.CLASS);
		return TypeString.parse(name);
	}

	// types and modifiers

	private TypeString returnType(Tree<SyntaxNode> header, DocComment doc) {
		Tree<SyntaxNode> returnType = ParsedDocument.childOf(header, PhraseType.RETURN_TYPE);
		Tree<SyntaxNode> typeDeclaration = ParsedDocument.childOf(returnType, PhraseType.TYPE_DECLARATION);
		if (typeDeclaration != null) {
			String type = typeDeclaration(typeDeclaration);
			if (ParsedDocument.childOf(typeDeclaration, TokenType.QUESTION) != null) {
				type = type + "|null";
			}
			return TypeString.parse(type);
		}
		if (doc != null && doc.phpDoc.getReturnTag() != null) {
			return TypeString.parse(doc.phpDoc.getReturnTag().getTypeString()).resolve(nameResolver);
		}
		return TypeString.EMPTY;
	}

	private String typeDeclaration(Tree<SyntaxNode> node) {
		Tree<SyntaxNode> name = nameChild(node);
		if (name != null) {
			return nameResolver.resolveNameNode(document, name, SymbolKind.CLASS);
		}
		Tree<SyntaxNode> keyword = ParsedDocument.childOf(node,
				v -> v.is(TokenType.ARRAY) || v.is(TokenType.CALLABLE));
		return document.nodeText(keyword);
	}

	/**
	 * Type of a property or constant: the {@code @var} tag of its declaration,
	 * or else the type of a literal initializer.
	 */
	private TypeString varType(String name, Tree<SyntaxNode> initialiser) {
		if (declarationDoc != null) {
			Tag varTag = declarationDoc.findVarTag(name);
			if (varTag != null && !varTag.getTypeString().isEmpty()) {
				return TypeString.parse(varTag.getTypeString()).resolve(nameResolver);
			}
		}
		if (initialiser == null) {
			return TypeString.EMPTY;
		}
		List<Tree<SyntaxNode>> children = ParsedDocument.significantChildren(initialiser);
		if (children.isEmpty()) {
			return TypeString.EMPTY;
		}
		return TypeString.parse(literalType(children.get(children.size() - 1)));
	}

	private String literalType(Tree<SyntaxNode> expression) {
		SyntaxNode value = expression.getValue();
		if (value.isToken()) {
			switch (value.getTokenType()) {
				case STRING_LITERAL:
					return "string";
				case INTEGER_LITERAL:
					return "int";
				case FLOAT_LITERAL:
					return "float";
				default:
					return "";
			}
		}
		if (value.is(PhraseType.CONSTANT_ACCESS_EXPRESSION)) {
			String text = document.nodeText(expression).toLowerCase(Locale.ROOT);
			if ("true".equals(text) || "false".equals(text)) {
				return "bool";
			}
			return "null".equals(text) ? "null" : "";
		}
		List<Tree<SyntaxNode>> children = ParsedDocument.significantChildren(expression);
		return children.size() == 1 ? literalType(children.get(0)) : "";
	}

	static EnumSet<SymbolModifier> memberModifiers(Tree<SyntaxNode> modifierList) {
		EnumSet<SymbolModifier> modifiers = EnumSet.noneOf(SymbolModifier.class);
		if (modifierList != null) {
			for (Tree<SyntaxNode> child : modifierList.getChildren()) {
				SyntaxNode value = child.getValue();
				if (!value.isToken()) {
					continue;
				}
				switch (value.getTokenType()) {
					case PUBLIC:
					case VAR:
						modifiers.add(SymbolModifier.PUBLIC);
						break;
					case PROTECTED:
						modifiers.add(SymbolModifier.PROTECTED);
						break;
					case PRIVATE:
						modifiers.add(SymbolModifier.PRIVATE);
						break;
					case STATIC:
						modifiers.add(SymbolModifier.STATIC);
						break;
					case ABSTRACT:
						modifiers.add(SymbolModifier.ABSTRACT);
						break;
					case FINAL:
						modifiers.add(SymbolModifier.FINAL);
						break;
					default:
						break;
				}
			}
		}
		if (!modifiers.contains(SymbolModifier.PROTECTED) && !modifiers.contains(SymbolModifier.PRIVATE)) {
			modifiers.add(SymbolModifier.PUBLIC);
		}
		return modifiers;
	}

	// names

	private static Tree<SyntaxNode> nameChild(Tree<SyntaxNode> node) {
		return ParsedDocument.childOf(node, v -> v.is(PhraseType.QUALIFIED_NAME)
				|| v.is(PhraseType.FULLY_QUALIFIED_NAME) || v.is(PhraseType.RELATIVE_QUALIFIED_NAME));
	}

	private List<String> qualifiedNameList(Tree<SyntaxNode> list, SymbolKind kind) {
		if (list == null) {
			return Collections.emptyList();
		}
		List<String> names = new ArrayList<>();
		for (Tree<SyntaxNode> child : list.getChildren()) {
			String name = nameResolver.resolveNameNode(document, child, kind);
			if (!name.isEmpty()) {
				names.add(name);
			}
		}
		return names;
	}

	private List<Tree<SyntaxNode>> argumentList(Tree<SyntaxNode> list) {
		List<Tree<SyntaxNode>> arguments = new ArrayList<>();
		if (list == null) {
			return arguments;
		}
		for (Tree<SyntaxNode> child : ParsedDocument.significantChildren(list)) {
			if (!child.getValue().is(TokenType.COMMA)) {
				arguments.add(child);
			}
		}
		return arguments;
	}

	private static String unquote(String text) {
		if (text.length() >= 2) {
			char first = text.charAt(0);
			if ((first == '\'' || first == '"') && text.charAt(text.length() - 1) == first) {
				return text.substring(1, text.length() - 1);
			}
		}
		return null;
	}

	private String anonymousName(Tree<SyntaxNode> node) {
		return ANONYMOUS_PREFIX + document.getUri() + "#" + node.getValue().getOffset();
	}

	private String enclosingClassName() {
		PhpSymbol top = top();
		return top.getKind().isClassLike() ? top.getName() : null;
	}

	private Set<String> variableTable() {
		return variableTables.computeIfAbsent(top(), k -> new HashSet<>());
	}

	// doc comments

	private static final class DocComment {
		private final PhpDoc phpDoc;
		private final Location location;

		private DocComment(PhpDoc phpDoc, Location location) {
			this.phpDoc = phpDoc;
			this.location = location;
		}
	}

	private PhpDoc takeDoc(Tree<SyntaxNode> node) {
		DocComment doc = takeDocComment(node);
		return doc == null ? null : doc.phpDoc;
	}

	/**
	 * The doc comment directly in front of a declaration: either the last one
	 * seen with nothing significant after it, or one the parser placed in the
	 * declaration's own leading trivia.
	 */
	private DocComment takeDocComment(Tree<SyntaxNode> node) {
		DocComment result = null;
		if (lastDoc != null) {
			result = new DocComment(lastDoc, lastDocLocation);
		} else {
			Tree<SyntaxNode> leading = leadingDocComment(node);
			if (leading != null) {
				result = new DocComment(PhpDocParser.parse(document.rawText(leading)), document.nodeLocation(leading));
			}
		}
		lastDoc = null;
		lastDocLocation = null;
		return result;
	}

	private static Tree<SyntaxNode> leadingDocComment(Tree<SyntaxNode> node) {
		Tree<SyntaxNode> current = node;
		Tree<SyntaxNode> found = null;
		while (current != null && current.getValue().isPhrase()) {
			Tree<SyntaxNode> next = null;
			for (Tree<SyntaxNode> child : current.getChildren()) {
				SyntaxNode value = child.getValue();
				if (value.is(TokenType.DOCUMENT_COMMENT)) {
					found = child;
				} else if (!value.isTrivia()) {
					next = child;
					break;
				}
			}
			current = next;
		}
		return found;
	}

	private void rememberDoc(PhpSymbol symbol, DocComment doc) {
		if (doc != null) {
			functionDocs.put(symbol, doc.phpDoc);
		}
	}

	private void applyDoc(PhpSymbol symbol, DocComment doc) {
		if (doc == null) {
			return;
		}
		symbol.setDoc(doc.phpDoc.getText());
		symbol.setDocLocation(doc.location);
	}

	private void applyDeclarationDoc(PhpSymbol symbol) {
		if (declarationDoc == null) {
			return;
		}
		String text = declarationDoc.getText();
		if (text == null) {
			Tag varTag = declarationDoc.findVarTag(symbol.getKind() == SymbolKind.PROPERTY ? symbol.getName() : null);
			text = varTag == null ? null : emptyToNull(varTag.getDescription());
		}
		symbol.setDoc(text);
	}

	private static String emptyToNull(String text) {
		return text == null || text.isEmpty() ? null : text;
	}
}
