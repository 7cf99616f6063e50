/*
 * Huginn - SEI Process Synchronization
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.huginn.sei;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import se.devrandom.huginn.sei.objects.DocumentRecord;
import se.devrandom.huginn.sei.objects.ProcessRecord;
import se.devrandom.huginn.sei.objects.ProgressionRecord;
import se.devrandom.huginn.sei.objects.ScopeEntry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Finds the unit under which a process is visible and fetches it with its documents and
 * progression history.
 *
 * Candidates are the declared unit followed by every other unit of the same tenant, deepest
 * first. The walk stops at the first unit that can see the process, at a not-found answer
 * (a process missing under one unit is missing under all), or at any other failure.
 */
@Component
public class ScopeFallbackOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScopeFallbackOrchestrator.class);

    private final SeiApiClient apiClient;
    private final ScopeDirectory scopeDirectory;
    private final CredentialManager credentialManager;
    private final ExecutorService subFetchPool;

    @Autowired
    public ScopeFallbackOrchestrator(SeiApiClient apiClient, ScopeDirectory scopeDirectory,
                                     CredentialManager credentialManager) {
        this.apiClient = apiClient;
        this.scopeDirectory = scopeDirectory;
        this.credentialManager = credentialManager;

        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r);
            t.setName("sei-subfetch-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.subFetchPool = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * @throws SeiAuthenticationException if SEI login fails; every other failure is a result
     */
    public ProcessFetchResult fetchProcess(String protocol, String declaredScopeName) {
        // Loads the unit table on first use
        credentialManager.getAccessToken();

        Optional<ScopeEntry> declared = scopeDirectory.resolveEntry(declaredScopeName);
        if (declared.isEmpty()) {
            return ProcessFetchResult.accessDenied(protocol, List.of(),
                    "Unit " + declaredScopeName + " is not visible to this user");
        }
        if (!declared.get().name().equals(declaredScopeName)) {
            log.info("{}: declared unit {} queried as {}", protocol, declaredScopeName, declared.get().name());
        }

        // Units are recorded under the name actually queried
        List<String> tried = new ArrayList<>();
        for (ScopeEntry candidate : candidates(declared.get())) {
            FetchOutcome<ProcessRecord> metadata;
            try {
                metadata = apiClient.consultProcess(candidate.id(), protocol);
            } catch (SeiAuthenticationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("{}: unexpected failure via {}: {}", protocol, candidate.name(), e.getMessage(), e);
                return ProcessFetchResult.error(protocol, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            tried.add(candidate.name());

            switch (metadata.kind()) {
                case SUCCESS -> {
                    if (tried.size() > 1) {
                        log.info("{} found via fallback unit {} after {} attempts", protocol, candidate.name(), tried.size());
                    }
                    return withChildren(protocol, candidate, metadata.payload(), tried);
                }
                case SCOPE_ACCESS_DENIED ->
                        log.debug("{}: no access via {}, trying next unit", protocol, candidate.name());
                case FATAL -> {
                    log.info("{} not found (via {}): {}", protocol, candidate.name(), metadata.message());
                    return ProcessFetchResult.notFound(protocol, candidate.name(), metadata.message());
                }
                case TRANSIENT_ERROR -> {
                    return ProcessFetchResult.error(protocol, "Via " + candidate.name() + ": " + metadata.message());
                }
            }
        }

        String message = String.format("None of the %d units had access. Units tried: %s",
                tried.size(), String.join(", ", tried));
        log.warn("{}: {}", protocol, message);
        return ProcessFetchResult.accessDenied(protocol, tried, message);
    }

    List<ScopeEntry> candidates(ScopeEntry declared) {
        List<ScopeEntry> candidates = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        candidates.add(declared);
        seenIds.add(declared.id());

        for (ScopeEntry sibling : scopeDirectory.siblingsOfTenant(ScopeDirectory.tenantOf(declared.name()))) {
            if (seenIds.add(sibling.id())) {
                candidates.add(sibling);
            }
        }
        return candidates;
    }

    private ProcessFetchResult withChildren(String protocol, ScopeEntry scope, ProcessRecord process, List<String> tried) {
        CompletableFuture<List<DocumentRecord>> documents = CompletableFuture.supplyAsync(
                () -> degradeToEmpty(protocol, "documents", () -> apiClient.listDocuments(scope.id(), protocol)),
                subFetchPool);
        CompletableFuture<List<ProgressionRecord>> progressions = CompletableFuture.supplyAsync(
                () -> degradeToEmpty(protocol, "progressions", () -> apiClient.listProgressions(scope.id(), protocol)),
                subFetchPool);

        return ProcessFetchResult.success(protocol, scope.name(), scope.id(), process,
                join(documents), join(progressions), tried);
    }

    private <T> List<T> degradeToEmpty(String protocol, String what, Supplier<FetchOutcome<List<T>>> fetch) {
        try {
            FetchOutcome<List<T>> outcome = fetch.get();
            if (outcome.isSuccess()) {
                return outcome.payload();
            }
            log.warn("{}: could not fetch {}, continuing without them: {}", protocol, what, outcome);
        } catch (SeiAuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("{}: could not fetch {}, continuing without them: {}", protocol, what, e.getMessage());
        }
        return List.of();
    }

    private static <T> List<T> join(CompletableFuture<List<T>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof SeiAuthenticationException authError) {
                throw authError;
            }
            throw e;
        }
    }

    @PreDestroy
    public void shutdown() {
        subFetchPool.shutdown();
        try {
            if (!subFetchPool.awaitTermination(30, TimeUnit.SECONDS)) {
                subFetchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            subFetchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
