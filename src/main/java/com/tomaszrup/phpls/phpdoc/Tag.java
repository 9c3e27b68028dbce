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

import java.util.Collections;
import java.util.List;

/**
 * A single {@code @tag} of a doc comment. Fields that the tag kind does not
 * carry are empty strings, never {@code null}.
 */
public final class Tag {
	public static final String PARAM = "@param";
	public static final String RETURN = "@return";
	public static final String VAR = "@var";
	public static final String METHOD = "@method";
	public static final String PROPERTY = "@property";
	public static final String PROPERTY_READ = "@property-read";
	public static final String PROPERTY_WRITE = "@property-write";
	public static final String THROWS = "@throws";

	private final String tagName;
	private final String typeString;
	private final String name;
	private final String description;
	private final List<MethodTagParam> parameters;
	private final boolean isStatic;

	Tag(String tagName, String typeString, String name, String description,
			List<MethodTagParam> parameters, boolean isStatic) {
		this.tagName = tagName;
		this.typeString = typeString;
		this.name = name;
		this.description = description;
		this.parameters = parameters == null ? Collections.emptyList() : Collections.unmodifiableList(parameters);
		this.isStatic = isStatic;
	}

	public String getTagName() {
		return tagName;
	}

	public String getTypeString() {
		return typeString;
	}

	public String getName() {
		return name;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * Signature parameters of an {@code @method} tag.
	 */
	public List<MethodTagParam> getParameters() {
		return parameters;
	}

	/**
	 * Whether an {@code @method} tag declares a static method.
	 */
	public boolean isStatic() {
		return isStatic;
	}

	public boolean isPropertyTag() {
		return PROPERTY.equals(tagName) || PROPERTY_READ.equals(tagName) || PROPERTY_WRITE.equals(tagName);
	}
}
