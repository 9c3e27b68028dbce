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
package com.tomaszrup.phpls.phpdoc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line-oriented doc comment parser. Never throws: unparseable tags are kept
 * with empty fields.
 */
public class PhpDocParser {
	private PhpDocParser() {
	}

	public static PhpDoc parse(String comment) {
		if (comment == null) {
			return new PhpDoc("", "", Collections.emptyList());
		}
		List<String> lines = stripCommentMarkers(comment);

		StringBuilder summary = new StringBuilder();
		StringBuilder description = new StringBuilder();
		List<String> rawTags = new ArrayList<>();
		StringBuilder currentTag = null;
		boolean inSummary = true;

		for (String line : lines) {
			if (line.startsWith("@")) {
				if (currentTag != null) {
					rawTags.add(currentTag.toString());
				}
				currentTag = new StringBuilder(line);
				continue;
			}
			if (currentTag != null) {
				// continuation of the previous tag's description
				if (!line.isEmpty()) {
					currentTag.append(' ').append(line);
				}
				continue;
			}
			if (inSummary) {
				if (line.isEmpty()) {
					if (summary.length() > 0) {
						inSummary = false;
					}
					continue;
				}
				appendLine(summary, line);
				if (line.endsWith(".")) {
					inSummary = false;
				}
			} else if (!line.isEmpty() || description.length() > 0) {
				appendLine(description, line);
			}
		}
		if (currentTag != null) {
			rawTags.add(currentTag.toString());
		}

		List<Tag> tags = new ArrayList<>(rawTags.size());
		for (String rawTag : rawTags) {
			tags.add(parseTag(rawTag));
		}
		return new PhpDoc(summary.toString().trim(), description.toString().trim(), tags);
	}

	private static void appendLine(StringBuilder builder, String line) {
		if (builder.length() > 0) {
			builder.append('\n');
		}
		builder.append(line);
	}

	private static List<String> stripCommentMarkers(String comment) {
		String body = comment;
		if (body.startsWith("/**")) {
			body = body.substring(3);
		} else if (body.startsWith("/*")) {
			body = body.substring(2);
		}
		int end = body.lastIndexOf("*/");
		if (end != -1) {
			body = body.substring(0, end);
		}
		String[] rawLines = body.split("\r\n|\r|\n", -1);
		List<String> lines = new ArrayList<>(rawLines.length);
		for (String rawLine : rawLines) {
			String line = rawLine.trim();
			// strip the leading * of continuation lines
			if (line.startsWith("*")) {
				line = line.substring(1).trim();
			}
			lines.add(line);
		}
		return lines;
	}

	static Tag parseTag(String text) {
		int space = indexOfWhitespace(text, 0);
		String tagName = space == -1 ? text : text.substring(0, space);
		String rest = space == -1 ? "" : text.substring(space).trim();

		switch (tagName) {
			case Tag.PARAM:
			case Tag.PROPERTY:
			case Tag.PROPERTY_READ:
			case Tag.PROPERTY_WRITE:
				return typeThenName(tagName, rest, false);
			case Tag.VAR:
				return typeThenName(tagName, rest, true);
			case Tag.RETURN:
			case Tag.THROWS: {
				String[] parts = splitType(rest);
				return new Tag(tagName, parts[0], "", parts[1], null, false);
			}
			case Tag.METHOD:
				return methodTag(rest);
			default:
				return new Tag(tagName, "", "", rest, null, false);
		}
	}

	/**
	 * {@code type $name description}, where the type may be omitted for
	 * every kind and the name may be omitted for {@code @var}.
	 */
	private static Tag typeThenName(String tagName, String rest, boolean nameOptional) {
		String type = "";
		String remaining = rest;
		if (!isVariableToken(rest)) {
			String[] parts = splitType(rest);
			type = parts[0];
			remaining = parts[1];
		}
		String name = "";
		if (isVariableToken(remaining)) {
			int space = indexOfWhitespace(remaining, 0);
			String token = space == -1 ? remaining : remaining.substring(0, space);
			name = stripVariablePrefix(token);
			remaining = space == -1 ? "" : remaining.substring(space).trim();
		} else if (!nameOptional) {
			// malformed: keep what we have as description
			return new Tag(tagName, type, "", remaining, null, false);
		}
		return new Tag(tagName, type, name, remaining, null, false);
	}

	/**
	 * {@code [static] [returnType] name(params) description}
	 */
	private static Tag methodTag(String rest) {
		int open = rest.indexOf('(');
		if (open == -1) {
			return new Tag(Tag.METHOD, "", "", rest, null, false);
		}
		int close = matchingParen(rest, open);
		String head = rest.substring(0, open).trim();
		String paramText = close == -1 ? rest.substring(open + 1) : rest.substring(open + 1, close);
		String description = close == -1 ? "" : rest.substring(close + 1).trim();

		List<String> headParts = splitOnTopLevelWhitespace(head);
		if (headParts.isEmpty()) {
			return new Tag(Tag.METHOD, "", "", description, null, false);
		}
		String name = headParts.get(headParts.size() - 1);
		boolean isStatic = false;
		String type = "";
		if (headParts.size() >= 3 && "static".equals(headParts.get(0))) {
			isStatic = true;
			type = headParts.get(1);
		} else if (headParts.size() == 2) {
			type = headParts.get(0);
		} else if (headParts.size() > 2) {
			type = headParts.get(headParts.size() - 2);
		}

		List<MethodTagParam> params = new ArrayList<>();
		for (String paramSource : splitParams(paramText)) {
			MethodTagParam param = methodTagParam(paramSource);
			if (param != null) {
				params.add(param);
			}
		}
		return new Tag(Tag.METHOD, type, name, description, params, isStatic);
	}

	private static MethodTagParam methodTagParam(String source) {
		String text = source.trim();
		int equals = text.indexOf('=');
		if (equals != -1) {
			text = text.substring(0, equals).trim();
		}
		if (text.isEmpty()) {
			return null;
		}
		String type = "";
		if (!isVariableToken(text)) {
			String[] parts = splitType(text);
			type = parts[0];
			text = parts[1];
		}
		if (!isVariableToken(text)) {
			return null;
		}
		int space = indexOfWhitespace(text, 0);
		String token = space == -1 ? text : text.substring(0, space);
		boolean variadic = token.startsWith("...") || token.startsWith("&...");
		return new MethodTagParam(type, stripVariablePrefix(token), variadic);
	}

	private static boolean isVariableToken(String text) {
		return text.startsWith("$") || text.startsWith("&$") || text.startsWith("...$") || text.startsWith("&...$");
	}

	/**
	 * Strips by-ref and variadic markers, keeping the {@code $}.
	 */
	private static String stripVariablePrefix(String token) {
		int dollar = token.indexOf('$');
		return dollar == -1 ? token : token.substring(dollar);
	}

	/**
	 * Splits a leading type expression from the rest of the text. Whitespace
	 * inside {@code <>}, {@code ()} or {@code {}} belongs to the type.
	 *
	 * @return {type, rest}
	 */
	private static String[] splitType(String text) {
		int depth = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '<' || c == '(' || c == '{') {
				depth++;
			} else if ((c == '>' || c == ')' || c == '}') && depth > 0) {
				depth--;
			} else if (Character.isWhitespace(c) && depth == 0) {
				return new String[] { text.substring(0, i), text.substring(i).trim() };
			}
		}
		return new String[] { text, "" };
	}

	private static List<String> splitOnTopLevelWhitespace(String text) {
		List<String> parts = new ArrayList<>();
		String remaining = text.trim();
		while (!remaining.isEmpty()) {
			String[] split = splitType(remaining);
			parts.add(split[0]);
			remaining = split[1];
		}
		return parts;
	}

	private static List<String> splitParams(String text) {
		List<String> params = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '<' || c == '(' || c == '[' || c == '{') {
				depth++;
			} else if ((c == '>' || c == ')' || c == ']' || c == '}') && depth > 0) {
				depth--;
			} else if (c == ',' && depth == 0) {
				params.add(text.substring(start, i));
				start = i + 1;
			}
		}
		if (start < text.length()) {
			params.add(text.substring(start));
		}
		return params;
	}

	private static int matchingParen(String text, int open) {
		int depth = 0;
		for (int i = open; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '(') {
				depth++;
			} else if (c == ')') {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	private static int indexOfWhitespace(String text, int from) {
		for (int i = from; i < text.length(); i++) {
			if (Character.isWhitespace(text.charAt(i))) {
				return i;
			}
		}
		return -1;
	}
}
