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

/**
 * One parameter of an {@code @method} tag signature.
 */
public final class MethodTagParam {
	private final String typeString;
	private final String name;
	private final boolean variadic;

	public MethodTagParam(String typeString, String name, boolean variadic) {
		this.typeString = typeString;
		this.name = name;
		this.variadic = variadic;
	}

	/**
	 * @return the declared type, empty when none was written
	 */
	public String getTypeString() {
		return typeString;
	}

	/**
	 * @return the parameter name including its {@code $}
	 */
	public String getName() {
		return name;
	}

	public boolean isVariadic() {
		return variadic;
	}
}
