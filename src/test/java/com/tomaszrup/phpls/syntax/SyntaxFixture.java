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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls.syntax;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Position;

import com.tomaszrup.phpls.tree.Tree;

/**
 * Builds PHP parse trees for tests. Nodes are described with their token
 * text only; {@link #document(String, Node)} lays the tokens out one after
 * another and assigns the offsets, so the document text is exactly the
 * concatenation of all token texts.
 */
public final class SyntaxFixture {

	public static final String URI = "file:///test.php";

	private SyntaxFixture() {
	}

	public static final class Node {
		private final PhraseType phraseType;
		private final TokenType tokenType;
		private final String text;
		private final List<Node> children;

		private Node(PhraseType phraseType, TokenType tokenType, String text, List<Node> children) {
			this.phraseType = phraseType;
			this.tokenType = tokenType;
			this.text = text;
			this.children = children;
		}
	}

	public static ParsedDocument document(Node root) {
		return document(URI, root);
	}

	public static ParsedDocument document(String uri, Node root) {
		StringBuilder text = new StringBuilder();
		Tree<SyntaxNode> tree = toTree(root, text);
		return new ParsedDocument(uri, text.toString(), tree);
	}

	private static Tree<SyntaxNode> toTree(Node node, StringBuilder text) {
		int start = text.length();
		if (node.tokenType != null) {
			text.append(node.text);
			return new Tree<>(SyntaxNode.token(node.tokenType, start, node.text.length()));
		}
		List<Tree<SyntaxNode>> children = new ArrayList<>();
		for (Node child : node.children) {
			children.add(toTree(child, text));
		}
		Tree<SyntaxNode> tree = new Tree<>(SyntaxNode.phrase(node.phraseType, start, text.length() - start));
		for (Tree<SyntaxNode> child : children) {
			tree.addChild(child);
		}
		return tree;
	}

	/**
	 * Position of the first character of the {@code occurrence}-th (0-based)
	 * appearance of {@code needle} in the document.
	 */
	public static Position positionOf(ParsedDocument document, String needle, int occurrence) {
		int offset = -1;
		for (int i = 0; i <= occurrence; i++) {
			offset = document.getText().indexOf(needle, offset + 1);
			if (offset == -1) {
				throw new IllegalArgumentException("'" + needle + "' occurs fewer than " + (occurrence + 1) + " times");
			}
		}
		return document.positionAtOffset(offset);
	}

	public static Position positionOf(ParsedDocument document, String needle) {
		return positionOf(document, needle, 0);
	}

	// primitives

	public static Node token(TokenType type, String text) {
		return new Node(null, type, text, Collections.emptyList());
	}

	public static Node phrase(PhraseType type, Node... children) {
		return new Node(type, null, null, new ArrayList<>(Arrays.asList(children)));
	}

	public static Node phrase(PhraseType type, List<Node> children) {
		return new Node(type, null, null, new ArrayList<>(children));
	}

	public static Node ws() {
		return token(TokenType.WHITESPACE, " ");
	}

	public static Node nl() {
		return token(TokenType.WHITESPACE, "\n");
	}

	public static Node openTag() {
		return token(TokenType.OPEN_TAG, "<?php\n");
	}

	public static Node docComment(String text) {
		return token(TokenType.DOCUMENT_COMMENT, text);
	}

	public static Node comment(String text) {
		return token(TokenType.COMMENT, text);
	}

	public static Node semicolon() {
		return token(TokenType.SEMICOLON, ";");
	}

	public static Node file(Node... statements) {
		List<Node> children = new ArrayList<>();
		children.add(openTag());
		for (Node statement : statements) {
			children.add(statement);
			children.add(nl());
		}
		return phrase(PhraseType.STATEMENT_LIST, children);
	}

	// names

	public static Node name(String text) {
		return token(TokenType.NAME, text);
	}

	public static Node namespaceName(String text) {
		List<Node> children = new ArrayList<>();
		String[] segments = text.split("\\\\");
		for (int i = 0; i < segments.length; i++) {
			if (i > 0) {
				children.add(token(TokenType.BACKSLASH, "\\"));
			}
			children.add(name(segments[i]));
		}
		return phrase(PhraseType.NAMESPACE_NAME, children);
	}

	/**
	 * A qualified, fully qualified ({@code \A\B}) or relative
	 * ({@code namespace\A}) name, picked by the text.
	 */
	public static Node qname(String text) {
		if (text.startsWith("\\")) {
			return phrase(PhraseType.FULLY_QUALIFIED_NAME, token(TokenType.BACKSLASH, "\\"),
					namespaceName(text.substring(1)));
		}
		if (text.startsWith("namespace\\")) {
			return phrase(PhraseType.RELATIVE_QUALIFIED_NAME, token(TokenType.NAMESPACE, "namespace"),
					token(TokenType.BACKSLASH, "\\"), namespaceName(text.substring("namespace\\".length())));
		}
		return phrase(PhraseType.QUALIFIED_NAME, namespaceName(text));
	}

	public static Node qnameList(String... names) {
		List<Node> children = new ArrayList<>();
		for (int i = 0; i < names.length; i++) {
			if (i > 0) {
				children.add(token(TokenType.COMMA, ","));
				children.add(ws());
			}
			children.add(qname(names[i]));
		}
		return phrase(PhraseType.QUALIFIED_NAME_LIST, children);
	}

	public static Node identifier(String text) {
		return phrase(PhraseType.IDENTIFIER, name(text));
	}

	// namespaces and imports

	public static Node namespaceDef(String name) {
		return phrase(PhraseType.NAMESPACE_DEFINITION, token(TokenType.NAMESPACE, "namespace"), ws(),
				namespaceName(name), semicolon());
	}

	public static Node namespaceBlock(String name, Node... statements) {
		List<Node> body = new ArrayList<>();
		body.add(token(TokenType.OPEN_BRACE, "{"));
		body.add(nl());
		for (Node statement : statements) {
			body.add(statement);
			body.add(nl());
		}
		body.add(token(TokenType.CLOSE_BRACE, "}"));
		return phrase(PhraseType.NAMESPACE_DEFINITION, token(TokenType.NAMESPACE, "namespace"), ws(),
				namespaceName(name), ws(), phrase(PhraseType.COMPOUND_STATEMENT, body));
	}

	public static Node use(String name) {
		return useDeclaration(null, useClause(name, null));
	}

	public static Node useAs(String name, String alias) {
		return useDeclaration(null, useClause(name, alias));
	}

	public static Node useFunction(String name) {
		return useDeclaration(token(TokenType.FUNCTION, "function"), useClause(name, null));
	}

	public static Node useConst(String name) {
		return useDeclaration(token(TokenType.CONST, "const"), useClause(name, null));
	}

	private static Node useDeclaration(Node kindToken, Node clause) {
		List<Node> children = new ArrayList<>();
		children.add(token(TokenType.USE, "use"));
		children.add(ws());
		if (kindToken != null) {
			children.add(kindToken);
			children.add(ws());
		}
		children.add(phrase(PhraseType.NAMESPACE_USE_CLAUSE_LIST, clause));
		children.add(semicolon());
		return phrase(PhraseType.NAMESPACE_USE_DECLARATION, children);
	}

	private static Node useClause(String name, String alias) {
		if (alias == null) {
			return phrase(PhraseType.NAMESPACE_USE_CLAUSE, namespaceName(name));
		}
		return phrase(PhraseType.NAMESPACE_USE_CLAUSE, namespaceName(name), ws(),
				phrase(PhraseType.NAMESPACE_ALIASING_CLAUSE, token(TokenType.AS, "as"), ws(), name(alias)));
	}

	/**
	 * {@code use Prefix\{A, B as C};}; a member is {@code "A"} or {@code "B as C"}.
	 */
	public static Node useGroup(String prefix, String... members) {
		List<Node> clauses = new ArrayList<>();
		for (int i = 0; i < members.length; i++) {
			if (i > 0) {
				clauses.add(token(TokenType.COMMA, ","));
				clauses.add(ws());
			}
			String[] parts = members[i].split(" as ");
			if (parts.length == 2) {
				clauses.add(phrase(PhraseType.NAMESPACE_USE_GROUP_CLAUSE, namespaceName(parts[0]), ws(),
						phrase(PhraseType.NAMESPACE_ALIASING_CLAUSE, token(TokenType.AS, "as"), ws(), name(parts[1]))));
			} else {
				clauses.add(phrase(PhraseType.NAMESPACE_USE_GROUP_CLAUSE, namespaceName(parts[0])));
			}
		}
		return phrase(PhraseType.NAMESPACE_USE_DECLARATION, token(TokenType.USE, "use"), ws(),
				namespaceName(prefix), token(TokenType.BACKSLASH, "\\"), token(TokenType.OPEN_BRACE, "{"),
				phrase(PhraseType.NAMESPACE_USE_GROUP_CLAUSE_LIST, clauses), token(TokenType.CLOSE_BRACE, "}"),
				semicolon());
	}

	// class-likes

	public static Node classDecl(String name, Node... members) {
		return classDecl(name, null, new String[0], members);
	}

	public static Node classDecl(String name, String baseName, String[] interfaces, Node... members) {
		List<Node> header = new ArrayList<>();
		header.add(token(TokenType.CLASS, "class"));
		header.add(ws());
		header.add(name(name));
		if (baseName != null) {
			header.add(ws());
			header.add(phrase(PhraseType.CLASS_BASE_CLAUSE, token(TokenType.EXTENDS, "extends"), ws(), qname(baseName)));
		}
		if (interfaces.length > 0) {
			header.add(ws());
			header.add(phrase(PhraseType.CLASS_INTERFACE_CLAUSE, token(TokenType.IMPLEMENTS, "implements"), ws(),
					qnameList(interfaces)));
		}
		return phrase(PhraseType.CLASS_DECLARATION, phrase(PhraseType.CLASS_DECLARATION_HEADER, header), ws(),
				classBody(PhraseType.CLASS_DECLARATION_BODY, members));
	}

	public static Node interfaceDecl(String name, String[] baseNames, Node... members) {
		List<Node> header = new ArrayList<>();
		header.add(token(TokenType.INTERFACE, "interface"));
		header.add(ws());
		header.add(name(name));
		if (baseNames.length > 0) {
			header.add(ws());
			header.add(phrase(PhraseType.INTERFACE_BASE_CLAUSE, token(TokenType.EXTENDS, "extends"), ws(),
					qnameList(baseNames)));
		}
		return phrase(PhraseType.INTERFACE_DECLARATION, phrase(PhraseType.INTERFACE_DECLARATION_HEADER, header),
				ws(), classBody(PhraseType.INTERFACE_DECLARATION_BODY, members));
	}

	public static Node traitDecl(String name, Node... members) {
		return phrase(PhraseType.TRAIT_DECLARATION,
				phrase(PhraseType.TRAIT_DECLARATION_HEADER, token(TokenType.TRAIT, "trait"), ws(), name(name)), ws(),
				classBody(PhraseType.TRAIT_DECLARATION_BODY, members));
	}

	private static Node classBody(PhraseType bodyType, Node... members) {
		List<Node> memberList = new ArrayList<>();
		for (Node member : members) {
			memberList.add(nl());
			memberList.add(member);
		}
		memberList.add(nl());
		return phrase(bodyType, token(TokenType.OPEN_BRACE, "{"),
				phrase(PhraseType.CLASS_MEMBER_DECLARATION_LIST, memberList), token(TokenType.CLOSE_BRACE, "}"));
	}

	public static Node traitUse(String... names) {
		return phrase(PhraseType.TRAIT_USE_CLAUSE, token(TokenType.USE, "use"), ws(), qnameList(names), semicolon());
	}

	public static Node modifiers(String modifiers) {
		List<Node> children = new ArrayList<>();
		for (String word : modifiers.trim().split("\\s+")) {
			if (!children.isEmpty()) {
				children.add(ws());
			}
			children.add(token(TokenType.valueOf(word.toUpperCase()), word));
		}
		return phrase(PhraseType.MEMBER_MODIFIER_LIST, children);
	}

	public static Node method(String modifiers, String name, Node params, String returnType, Node... body) {
		List<Node> header = new ArrayList<>();
		if (modifiers != null) {
			header.add(modifiers(modifiers));
			header.add(ws());
		}
		header.add(token(TokenType.FUNCTION, "function"));
		header.add(ws());
		header.add(identifier(name));
		header.add(token(TokenType.OPEN_PAREN, "("));
		header.add(params);
		header.add(token(TokenType.CLOSE_PAREN, ")"));
		if (returnType != null) {
			header.add(returnType(returnType));
		}
		return phrase(PhraseType.METHOD_DECLARATION, phrase(PhraseType.METHOD_DECLARATION_HEADER, header), ws(),
				phrase(PhraseType.METHOD_DECLARATION_BODY, compound(body)));
	}

	public static Node property(String modifiers, String name, Node initialValue) {
		List<Node> element = new ArrayList<>();
		element.add(token(TokenType.VARIABLE_NAME, name));
		if (initialValue != null) {
			element.add(phrase(PhraseType.PROPERTY_INITIALISER, ws(), token(TokenType.EQUALS, "="), ws(), initialValue));
		}
		return phrase(PhraseType.PROPERTY_DECLARATION, modifiers(modifiers), ws(),
				phrase(PhraseType.PROPERTY_ELEMENT_LIST, phrase(PhraseType.PROPERTY_ELEMENT, element)), semicolon());
	}

	public static Node classConst(String modifiers, String name, Node value) {
		List<Node> children = new ArrayList<>();
		if (modifiers != null) {
			children.add(modifiers(modifiers));
			children.add(ws());
		}
		children.add(token(TokenType.CONST, "const"));
		children.add(ws());
		children.add(phrase(PhraseType.CLASS_CONST_ELEMENT_LIST, phrase(PhraseType.CLASS_CONST_ELEMENT,
				identifier(name), ws(), token(TokenType.EQUALS, "="), ws(), value)));
		children.add(semicolon());
		return phrase(PhraseType.CLASS_CONST_DECLARATION, children);
	}

	// functions

	public static Node function(String name, Node params, String returnType, Node... body) {
		List<Node> header = new ArrayList<>();
		header.add(token(TokenType.FUNCTION, "function"));
		header.add(ws());
		header.add(name(name));
		header.add(token(TokenType.OPEN_PAREN, "("));
		header.add(params);
		header.add(token(TokenType.CLOSE_PAREN, ")"));
		if (returnType != null) {
			header.add(returnType(returnType));
		}
		return phrase(PhraseType.FUNCTION_DECLARATION, phrase(PhraseType.FUNCTION_DECLARATION_HEADER, header), ws(),
				phrase(PhraseType.FUNCTION_DECLARATION_BODY, compound(body)));
	}

	public static Node closure(Node params, String[] uses, Node... body) {
		List<Node> header = new ArrayList<>();
		header.add(token(TokenType.FUNCTION, "function"));
		header.add(token(TokenType.OPEN_PAREN, "("));
		header.add(params);
		header.add(token(TokenType.CLOSE_PAREN, ")"));
		if (uses.length > 0) {
			List<Node> useList = new ArrayList<>();
			for (int i = 0; i < uses.length; i++) {
				if (i > 0) {
					useList.add(token(TokenType.COMMA, ","));
					useList.add(ws());
				}
				useList.add(phrase(PhraseType.ANONYMOUS_FUNCTION_USE_VARIABLE, token(TokenType.VARIABLE_NAME, uses[i])));
			}
			header.add(ws());
			header.add(phrase(PhraseType.ANONYMOUS_FUNCTION_USE_CLAUSE, token(TokenType.USE, "use"), ws(),
					token(TokenType.OPEN_PAREN, "("), phrase(PhraseType.CLOSURE_USE_LIST, useList),
					token(TokenType.CLOSE_PAREN, ")")));
		}
		return phrase(PhraseType.ANONYMOUS_FUNCTION_CREATION_EXPRESSION,
				phrase(PhraseType.ANONYMOUS_FUNCTION_HEADER, header), ws(),
				phrase(PhraseType.FUNCTION_DECLARATION_BODY, compound(body)));
	}

	public static Node params(Node... params) {
		List<Node> children = new ArrayList<>();
		for (int i = 0; i < params.length; i++) {
			if (i > 0) {
				children.add(token(TokenType.COMMA, ","));
				children.add(ws());
			}
			children.add(params[i]);
		}
		return phrase(PhraseType.PARAMETER_DECLARATION_LIST, children);
	}

	/**
	 * A parameter; {@code type} may be {@code null}, start with {@code ?}
	 * and {@code name} may start with {@code ...}.
	 */
	public static Node param(String type, String name) {
		List<Node> children = new ArrayList<>();
		if (type != null) {
			children.add(typeDeclaration(type));
			children.add(ws());
		}
		String variable = name;
		if (variable.startsWith("...")) {
			children.add(token(TokenType.ELLIPSIS, "..."));
			variable = variable.substring(3);
		}
		children.add(token(TokenType.VARIABLE_NAME, variable));
		return phrase(PhraseType.PARAMETER_DECLARATION, children);
	}

	public static Node typeDeclaration(String type) {
		List<Node> children = new ArrayList<>();
		String body = type;
		if (body.startsWith("?")) {
			children.add(token(TokenType.QUESTION, "?"));
			body = body.substring(1);
		}
		if ("array".equals(body)) {
			children.add(token(TokenType.ARRAY, body));
		} else if ("callable".equals(body)) {
			children.add(token(TokenType.CALLABLE, body));
		} else {
			children.add(qname(body));
		}
		return phrase(PhraseType.TYPE_DECLARATION, children);
	}

	private static Node returnType(String type) {
		return phrase(PhraseType.RETURN_TYPE, token(TokenType.COLON, ":"), ws(), typeDeclaration(type));
	}

	private static Node compound(Node... statements) {
		List<Node> children = new ArrayList<>();
		children.add(token(TokenType.OPEN_BRACE, "{"));
		List<Node> list = new ArrayList<>();
		for (Node statement : statements) {
			list.add(nl());
			list.add(statement);
		}
		list.add(nl());
		children.add(phrase(PhraseType.STATEMENT_LIST, list));
		children.add(token(TokenType.CLOSE_BRACE, "}"));
		return phrase(PhraseType.COMPOUND_STATEMENT, children);
	}

	// statements and expressions

	public static Node statement(Node expression) {
		return phrase(PhraseType.EXPRESSION_STATEMENT, expression, semicolon());
	}

	public static Node returnStatement(Node expression) {
		return phrase(PhraseType.RETURN_STATEMENT, token(TokenType.OTHER, "return"), ws(), expression, semicolon());
	}

	public static Node variable(String name) {
		return phrase(PhraseType.SIMPLE_VARIABLE, token(TokenType.VARIABLE_NAME, name));
	}

	public static Node assign(Node left, Node right) {
		return phrase(PhraseType.SIMPLE_ASSIGNMENT_EXPRESSION, left, ws(), token(TokenType.EQUALS, "="), ws(), right);
	}

	public static Node string(String text) {
		return token(TokenType.STRING_LITERAL, "'" + text + "'");
	}

	public static Node integer(int value) {
		return token(TokenType.INTEGER_LITERAL, Integer.toString(value));
	}

	public static Node constant(String name) {
		return phrase(PhraseType.CONSTANT_ACCESS_EXPRESSION, qname(name));
	}

	public static Node newObject(String className) {
		return phrase(PhraseType.OBJECT_CREATION_EXPRESSION, token(TokenType.NEW, "new"), ws(),
				phrase(PhraseType.CLASS_TYPE_DESIGNATOR, qname(className)), arguments());
	}

	public static Node arguments(Node... args) {
		List<Node> list = new ArrayList<>();
		for (int i = 0; i < args.length; i++) {
			if (i > 0) {
				list.add(token(TokenType.COMMA, ","));
				list.add(ws());
			}
			list.add(args[i]);
		}
		return phrase(PhraseType.ARGUMENT_EXPRESSION_LIST, list);
	}

	public static Node call(String name, Node... args) {
		return phrase(PhraseType.FUNCTION_CALL_EXPRESSION, qname(name), token(TokenType.OPEN_PAREN, "("),
				arguments(args), token(TokenType.CLOSE_PAREN, ")"));
	}

	public static Node methodCall(Node target, String member, Node... args) {
		return phrase(PhraseType.METHOD_CALL_EXPRESSION, target, token(TokenType.ARROW, "->"),
				phrase(PhraseType.MEMBER_NAME, name(member)), token(TokenType.OPEN_PAREN, "("), arguments(args),
				token(TokenType.CLOSE_PAREN, ")"));
	}

	public static Node propertyAccess(Node target, String member) {
		return phrase(PhraseType.PROPERTY_ACCESS_EXPRESSION, target, token(TokenType.ARROW, "->"),
				phrase(PhraseType.MEMBER_NAME, name(member)));
	}

	/**
	 * {@code self}, {@code parent} or {@code static}.
	 */
	public static Node relativeScope(String keyword) {
		Node token = "static".equals(keyword) ? token(TokenType.STATIC, keyword) : name(keyword);
		return phrase(PhraseType.RELATIVE_SCOPE, token);
	}

	public static Node scopedCall(Node scope, String member) {
		return phrase(PhraseType.SCOPED_CALL_EXPRESSION, scope, token(TokenType.DOUBLE_COLON, "::"),
				phrase(PhraseType.SCOPED_MEMBER_NAME, identifier(member)), token(TokenType.OPEN_PAREN, "("),
				arguments(), token(TokenType.CLOSE_PAREN, ")"));
	}

	public static Node scopedProperty(Node scope, String variableName) {
		return phrase(PhraseType.SCOPED_PROPERTY_ACCESS_EXPRESSION, scope, token(TokenType.DOUBLE_COLON, "::"),
				phrase(PhraseType.SCOPED_MEMBER_NAME, token(TokenType.VARIABLE_NAME, variableName)));
	}

	public static Node classConstAccess(Node scope, String name) {
		return phrase(PhraseType.CLASS_CONSTANT_ACCESS_EXPRESSION, scope, token(TokenType.DOUBLE_COLON, "::"),
				phrase(PhraseType.SCOPED_MEMBER_NAME, identifier(name)));
	}

	public static Node constDecl(String name, Node value) {
		return phrase(PhraseType.CONST_DECLARATION, token(TokenType.CONST, "const"), ws(),
				phrase(PhraseType.CONST_ELEMENT_LIST, phrase(PhraseType.CONST_ELEMENT, name(name), ws(),
						token(TokenType.EQUALS, "="), ws(), value)),
				semicolon());
	}

	public static Node foreachStatement(Node collection, String valueName, Node... body) {
		return phrase(PhraseType.FOREACH_STATEMENT, token(TokenType.OTHER, "foreach"), ws(),
				token(TokenType.OPEN_PAREN, "("), phrase(PhraseType.FOREACH_COLLECTION, collection), ws(),
				token(TokenType.AS, "as"), ws(), phrase(PhraseType.FOREACH_VALUE, variable(valueName)),
				token(TokenType.CLOSE_PAREN, ")"), ws(), compound(body));
	}

	public static Node catchClause(String[] types, String variableName, Node... body) {
		List<Node> names = new ArrayList<>();
		for (int i = 0; i < types.length; i++) {
			if (i > 0) {
				names.add(token(TokenType.VERTICAL_BAR, "|"));
			}
			names.add(qname(types[i]));
		}
		return phrase(PhraseType.CATCH_CLAUSE, token(TokenType.CATCH, "catch"), ws(), token(TokenType.OPEN_PAREN, "("),
				phrase(PhraseType.CATCH_NAME_LIST, names), ws(), token(TokenType.VARIABLE_NAME, variableName),
				token(TokenType.CLOSE_PAREN, ")"), ws(), compound(body));
	}

	public static Node error(String text) {
		return phrase(PhraseType.ERROR, token(TokenType.OTHER, text));
	}
}
