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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A union of named types as written in a declaration or a doc comment, for
 * example {@code int|\Foo\Bar[]|null}. Purely textual: nothing is inferred.
 */
public final class TypeString {
	public static final TypeString EMPTY = new TypeString(Collections.emptyList());

	private final List<String> parts;

	private TypeString(List<String> parts) {
		this.parts = parts;
	}

	/**
	 * Splits on top-level {@code |}; a {@code |} inside generic brackets
	 * belongs to its part.
	 */
	public static TypeString parse(String text) {
		if (text == null || text.trim().isEmpty()) {
			return EMPTY;
		}
		List<String> parts = new ArrayList<>();
		int depth = 0;
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '<' || c == '(' || c == '{') {
				depth++;
			} else if ((c == '>' || c == ')' || c == '}') && depth > 0) {
				depth--;
			} else if (c == '|' && depth == 0) {
				addPart(parts, text.substring(start, i));
				start = i + 1;
			}
		}
		addPart(parts, text.substring(start));
		return parts.isEmpty() ? EMPTY : new TypeString(Collections.unmodifiableList(parts));
	}

	private static void addPart(List<String> parts, String part) {
		String trimmed = part.trim();
		if (!trimmed.isEmpty() && !parts.contains(trimmed)) {
			parts.add(trimmed);
		}
	}

	public boolean isEmpty() {
		return parts.isEmpty();
	}

	public List<String> getParts() {
		return parts;
	}

	/**
	 * Qualifies every non built-in name. Array suffixes and nullable markers
	 * are preserved; generic parameters are left as written.
	 */
	public TypeString resolve(NameResolver resolver) {
		if (parts.isEmpty()) {
			return this;
		}
		List<String> resolved = new ArrayList<>(parts.size());
		for (String part : parts) {
			String prefix = part.startsWith("?") ? "?" : "";
			String body = prefix.isEmpty() ? part : part.substring(1);
			int suffixStart = suffixStart(body);
			String base = body.substring(0, suffixStart);
			String suffix = body.substring(suffixStart);
			String resolvedBase = base.isEmpty() || resolver.isBuiltInType(base)
					? base
					: resolver.resolveTypeName(base);
			String full = prefix + resolvedBase + suffix;
			if (!resolved.contains(full)) {
				resolved.add(full);
			}
		}
		return new TypeString(Collections.unmodifiableList(resolved));
	}

	/**
	 * Names of the class-like types in the union, stripped of array
	 * suffixes, generic parameters and nullable markers.
	 */
	public List<String> classNames(NameResolver resolver) {
		Set<String> names = new LinkedHashSet<>();
		for (String part : parts) {
			String body = part.startsWith("?") ? part.substring(1) : part;
			if (body.endsWith("[]")) {
				// an array of T is not T
				continue;
			}
			String base = body.substring(0, suffixStart(body));
			if (base.startsWith("\\")) {
				base = base.substring(1);
			}
			if (!base.isEmpty() && !resolver.isBuiltInType(base)) {
				names.add(base);
			}
		}
		return new ArrayList<>(names);
	}

	public TypeString merge(TypeString other) {
		if (other == null || other.isEmpty()) {
			return this;
		}
		if (isEmpty()) {
			return other;
		}
		List<String> merged = new ArrayList<>(parts);
		for (String part : other.parts) {
			if (!merged.contains(part)) {
				merged.add(part);
			}
		}
		return new TypeString(Collections.unmodifiableList(merged));
	}

	private static int suffixStart(String body) {
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c == '[' || c == '<' || c == '{' || c == '(') {
				return i;
			}
		}
		return body.length();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TypeString)) return false;
		return parts.equals(((TypeString) o).parts);
	}

	@Override
	public int hashCode() {
		return parts.hashCode();
	}

	@Override
	public String toString() {
		return String.join("|", parts);
	}
}
