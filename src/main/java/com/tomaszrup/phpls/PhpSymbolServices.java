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
package com.tomaszrup.phpls;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.phpls.config.IndexOptions;
import com.tomaszrup.phpls.providers.DefinitionProvider;
import com.tomaszrup.phpls.providers.DocumentSymbolProvider;
import com.tomaszrup.phpls.providers.WorkspaceSymbolProvider;
import com.tomaszrup.phpls.symbol.PhpSymbol;
import com.tomaszrup.phpls.symbol.SymbolStore;
import com.tomaszrup.phpls.symbol.SymbolTable;
import com.tomaszrup.phpls.syntax.ParsedDocument;
import com.tomaszrup.phpls.syntax.ParsedDocumentStore;
import com.tomaszrup.phpls.tree.CancellationToken;
import com.tomaszrup.phpls.util.Debounce;

/**
 * Entry point to the symbol services: keeps one symbol table per document
 * current and answers searches and definition requests against them.
 *
 * <p>A document update reads the whole syntax tree again. Starting an update
 * cancels any update of the same document still in progress, and a
 * cancelled read is discarded rather than published. Updates arriving in
 * quick succession can be coalesced with {@link #scheduleUpdate}.</p>
 */
public class PhpSymbolServices {
    private static final Logger logger = LoggerFactory.getLogger(PhpSymbolServices.class);

    private final IndexOptions options;
    private final ParsedDocumentStore documentStore = new ParsedDocumentStore();
    private final SymbolStore symbolStore;
    private final DefinitionProvider definitionProvider;
    private final WorkspaceSymbolProvider workspaceSymbolProvider;
    private final DocumentSymbolProvider documentSymbolProvider;

    private final ScheduledExecutorService schedulingPool;
    private final ConcurrentHashMap<String, Debounce<ScheduledUpdate>> pendingUpdates = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CancellationToken> runningUpdates = new ConcurrentHashMap<>();
    // bumped under publishLock on every close
    private final ConcurrentHashMap<String, Long> closeCounts = new ConcurrentHashMap<>();
    private final Object publishLock = new Object();

    public PhpSymbolServices() {
        this(IndexOptions.DEFAULTS);
    }

    public PhpSymbolServices(IndexOptions options) {
        this.options = options;
        this.symbolStore = new SymbolStore(options.isCaseSensitiveSearch());
        this.definitionProvider = new DefinitionProvider(documentStore, symbolStore, options.getBuiltInTypes());
        this.workspaceSymbolProvider = new WorkspaceSymbolProvider(symbolStore);
        this.documentSymbolProvider = new DocumentSymbolProvider(symbolStore);
        this.schedulingPool = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "phpls-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public IndexOptions getOptions() {
        return options;
    }

    public SymbolStore getSymbolStore() {
        return symbolStore;
    }

    public ParsedDocumentStore getDocumentStore() {
        return documentStore;
    }

    public WorkspaceSymbolProvider getWorkspaceSymbolProvider() {
        return workspaceSymbolProvider;
    }

    public DocumentSymbolProvider getDocumentSymbolProvider() {
        return documentSymbolProvider;
    }

    public DefinitionProvider getDefinitionProvider() {
        return definitionProvider;
    }

    /**
     * Reads the document's syntax tree and publishes the resulting symbol
     * table, unless a newer update of the same document started meanwhile
     * or the document was closed.
     */
    public void updateDocument(ParsedDocument document) {
        update(document, closeCount(document.getUri()));
    }

    /**
     * @param expectedCloseCount the document's close count when the update
     *                           was requested; a different count at publish
     *                           time means it was closed since
     */
    void update(ParsedDocument document, long expectedCloseCount) {
        String uri = document.getUri();
        CancellationToken token = new CancellationToken();
        synchronized (publishLock) {
            CancellationToken previous = runningUpdates.put(uri, token);
            if (previous != null) {
                previous.cancel();
            }
        }

        SymbolTable table = SymbolTable.create(document, options, token);

        synchronized (publishLock) {
            if (table == null || token.isCancelled()) {
                logger.debug("Update of {} superseded, not publishing", uri);
                return;
            }
            if (closeCount(uri) != expectedCloseCount) {
                runningUpdates.remove(uri, token);
                logger.debug("{} was closed during its update, not publishing", uri);
                return;
            }
            documentStore.put(document);
            symbolStore.update(table);
            runningUpdates.remove(uri, token);
        }
        logger.debug("Published {} symbols for {}", table.size(), uri);
    }

    /**
     * Updates the document once no newer version has arrived for the
     * configured debounce delay.
     */
    public void scheduleUpdate(ParsedDocument document) {
        String uri = document.getUri();
        pendingUpdates.computeIfAbsent(uri,
                key -> new Debounce<>(u -> update(u.document, u.closeCount), options.getDebounceDelayMs(),
                        schedulingPool))
                .handle(new ScheduledUpdate(document, closeCount(uri)));
    }

    /**
     * Applies all scheduled updates now, on the calling thread.
     */
    public void flush() {
        for (Debounce<ScheduledUpdate> debounce : pendingUpdates.values()) {
            debounce.flush();
        }
    }

    public void closeDocument(String uri) {
        Debounce<ScheduledUpdate> pending = pendingUpdates.remove(uri);
        if (pending != null) {
            pending.clear();
        }
        synchronized (publishLock) {
            CancellationToken running = runningUpdates.remove(uri);
            if (running != null) {
                running.cancel();
            }
            closeCounts.merge(uri, 1L, Long::sum);
            documentStore.remove(uri);
            symbolStore.remove(uri);
        }
        logger.debug("Closed {}", uri);
    }

    public List<PhpSymbol> findExact(String fullyQualifiedName) {
        return symbolStore.find(fullyQualifiedName);
    }

    public List<PhpSymbol> matchSubstring(String text) {
        return symbolStore.match(text);
    }

    public Optional<Location> provideDefinition(String uri, Position position) {
        return Optional.ofNullable(definitionProvider.findDefinition(uri, position));
    }

    long closeCount(String uri) {
        return closeCounts.getOrDefault(uri, 0L);
    }

    private static final class ScheduledUpdate {
        private final ParsedDocument document;
        private final long closeCount;

        private ScheduledUpdate(ParsedDocument document, long closeCount) {
            this.document = document;
            this.closeCount = closeCount;
        }

        @Override
        public String toString() {
            return document.getUri();
        }
    }

    /**
     * Stops the scheduler. Pending scheduled updates are dropped.
     */
    public void shutdown() {
        logger.debug("Shutting down symbol services");
        schedulingPool.shutdownNow();
        try {
            schedulingPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
