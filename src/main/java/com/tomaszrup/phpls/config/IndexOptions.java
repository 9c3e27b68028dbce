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
package com.tomaszrup.phpls.config;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import com.tomaszrup.phpls.symbol.NameResolver;

/**
 * Immutable settings for reading and indexing documents.
 */
public final class IndexOptions {

    public static final long DEFAULT_DEBOUNCE_DELAY_MS = 250;

    public static final IndexOptions DEFAULTS = new IndexOptions(false, false, DEFAULT_DEBOUNCE_DELAY_MS,
            NameResolver.DEFAULT_BUILT_IN_TYPES);

    private final boolean caseSensitiveSearch;
    private final boolean externalOnly;
    private final long debounceDelayMs;
    private final Set<String> builtInTypes;

    public IndexOptions(boolean caseSensitiveSearch, boolean externalOnly, long debounceDelayMs,
            Set<String> builtInTypes) {
        if (debounceDelayMs < 0) {
            throw new IllegalArgumentException("debounceDelayMs must not be negative: " + debounceDelayMs);
        }
        this.caseSensitiveSearch = caseSensitiveSearch;
        this.externalOnly = externalOnly;
        this.debounceDelayMs = debounceDelayMs;
        this.builtInTypes = Collections.unmodifiableSet(new HashSet<>(builtInTypes));
    }

    public boolean isCaseSensitiveSearch() {
        return caseSensitiveSearch;
    }

    /**
     * Whether symbols local to a document (variables, imports, closures) are
     * left out of its symbol table.
     */
    public boolean isExternalOnly() {
        return externalOnly;
    }

    public long getDebounceDelayMs() {
        return debounceDelayMs;
    }

    /** Lower-case type names that are never namespace-qualified. */
    public Set<String> getBuiltInTypes() {
        return builtInTypes;
    }

    @Override
    public String toString() {
        return "IndexOptions{caseSensitiveSearch=" + caseSensitiveSearch
                + ", externalOnly=" + externalOnly
                + ", debounceDelayMs=" + debounceDelayMs
                + ", builtInTypes=" + builtInTypes.size() + "}";
    }
}
