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
package com.tomaszrup.phpls.syntax;

/**
 * Lexical token kinds produced by the PHP parser. Only the kinds the symbol
 * reader and definition lookup inspect are distinguished; everything else is
 * reported as {@link #OTHER}.
 */
public enum TokenType {
	OPEN_TAG,
	WHITESPACE,
	COMMENT,
	DOCUMENT_COMMENT,

	NAME,
	VARIABLE_NAME,
	STRING_LITERAL,
	INTEGER_LITERAL,
	FLOAT_LITERAL,

	ABSTRACT,
	ARRAY,
	AS,
	CALLABLE,
	CATCH,
	CLASS,
	CONST,
	EXTENDS,
	FINAL,
	FUNCTION,
	GLOBAL,
	IMPLEMENTS,
	INTERFACE,
	NAMESPACE,
	NEW,
	PRIVATE,
	PROTECTED,
	PUBLIC,
	STATIC,
	TRAIT,
	USE,
	VAR,

	AMPERSAND,
	ARROW,
	BACKSLASH,
	CLOSE_BRACE,
	CLOSE_PAREN,
	COLON,
	COMMA,
	DOLLAR,
	DOUBLE_COLON,
	ELLIPSIS,
	EQUALS,
	OPEN_BRACE,
	OPEN_PAREN,
	QUESTION,
	SEMICOLON,
	VERTICAL_BAR,

	END_OF_FILE,
	OTHER;

	/**
	 * Trivia carries no syntax: whitespace, comments and the open tag.
	 */
	public boolean isTrivia() {
		return this == WHITESPACE || this == COMMENT || this == DOCUMENT_COMMENT || this == OPEN_TAG;
	}
}
