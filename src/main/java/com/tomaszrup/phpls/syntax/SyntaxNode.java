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
 * Value carried by every node of a PHP parse tree: either a phrase with a
 * {@link PhraseType} or a token with a {@link TokenType}, plus the absolute
 * source span it covers.
 */
public final class SyntaxNode {
	private final PhraseType phraseType;
	private final TokenType tokenType;
	private final int offset;
	private final int length;

	private SyntaxNode(PhraseType phraseType, TokenType tokenType, int offset, int length) {
		if (offset < 0 || length < 0) {
			throw new IllegalArgumentException("Invalid span " + offset + "+" + length);
		}
		this.phraseType = phraseType;
		this.tokenType = tokenType;
		this.offset = offset;
		this.length = length;
	}

	public static SyntaxNode phrase(PhraseType type, int offset, int length) {
		return new SyntaxNode(type, null, offset, length);
	}

	public static SyntaxNode token(TokenType type, int offset, int length) {
		return new SyntaxNode(null, type, offset, length);
	}

	public boolean isPhrase() {
		return phraseType != null;
	}

	public boolean isToken() {
		return tokenType != null;
	}

	public boolean is(PhraseType type) {
		return phraseType == type;
	}

	public boolean is(TokenType type) {
		return tokenType == type;
	}

	public boolean isTrivia() {
		return tokenType != null && tokenType.isTrivia();
	}

	public PhraseType getPhraseType() {
		return phraseType;
	}

	public TokenType getTokenType() {
		return tokenType;
	}

	public int getOffset() {
		return offset;
	}

	public int getLength() {
		return length;
	}

	public int getEnd() {
		return offset + length;
	}

	@Override
	public String toString() {
		return (phraseType != null ? phraseType.name() : tokenType.name()) + "[" + offset + "," + getEnd() + ")";
	}
}
