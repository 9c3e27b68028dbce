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

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe holder of the latest parse of every open document.
 *
 * <p>Uses {@link ConcurrentHashMap} so that readers never block an update of
 * another document. A document is replaced whole; a newer parse simply
 * supersedes the older one.</p>
 */
public class ParsedDocumentStore {

	private final ConcurrentHashMap<String, ParsedDocument> documents = new ConcurrentHashMap<>();

	/**
	 * Stores a parse, replacing any earlier one for the same uri.
	 *
	 * @return the replaced parse, or {@code null}
	 */
	public ParsedDocument put(ParsedDocument document) {
		return documents.put(document.getUri(), document);
	}

	public ParsedDocument get(String uri) {
		return documents.get(uri);
	}

	public ParsedDocument remove(String uri) {
		return documents.remove(uri);
	}

	public boolean has(String uri) {
		return documents.containsKey(uri);
	}

	public Set<String> getUris() {
		return Collections.unmodifiableSet(documents.keySet());
	}
}
