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

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import se.devrandom.huginn.sei.objects.PageEnvelope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches every page of a paginated SEI list endpoint.
 *
 * Page 1 tells how many pages there are; pages 2..N are then requested concurrently.
 * The page pool is unbounded, the executor's semaphore is what limits calls on the wire.
 * A failed page after the first is logged and skipped, so the result may be partial.
 */
@Component
public class ParallelPaginator {
    private static final Logger log = LoggerFactory.getLogger(ParallelPaginator.class);

    static final String PAGE_PARAM = "pagina";
    static final String PAGE_SIZE_PARAM = "quantidade";

    private final SeiRequestExecutor requestExecutor;
    private final ExecutorService pagePool;

    @Autowired
    public ParallelPaginator(SeiRequestExecutor requestExecutor) {
        this.requestExecutor = requestExecutor;

        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r);
            t.setName("sei-page-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.pagePool = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * @param path     list endpoint
     * @param params   query parameters other than the paging ones
     * @param itemsKey envelope key holding the items, e.g. "Documentos"
     * @param pageSize items per page
     * @return all items that could be fetched, or page 1's failure
     */
    public FetchOutcome<List<JsonNode>> fetchAll(String path, Map<String, ?> params, String itemsKey, int pageSize) {
        FetchOutcome<PageEnvelope> first = fetchPage(path, params, itemsKey, pageSize, 1);
        if (!first.isSuccess()) {
            return first.retype();
        }

        PageEnvelope firstPage = first.payload();
        List<JsonNode> items = new ArrayList<>(firstPage.items());
        int totalPages = firstPage.totalPages();
        if (totalPages <= 1) {
            return FetchOutcome.success(items);
        }

        log.debug("{}: {} pages, {} items reported", path, totalPages, firstPage.totalItems());

        List<CompletableFuture<FetchOutcome<PageEnvelope>>> futures = new ArrayList<>(totalPages - 1);
        for (int page = 2; page <= totalPages; page++) {
            int pageNumber = page;
            futures.add(CompletableFuture.supplyAsync(
                    () -> fetchPage(path, params, itemsKey, pageSize, pageNumber), pagePool));
        }

        int failedPages = 0;
        for (int i = 0; i < futures.size(); i++) {
            int pageNumber = i + 2;
            try {
                FetchOutcome<PageEnvelope> outcome = futures.get(i).join();
                if (outcome.isSuccess()) {
                    items.addAll(outcome.payload().items());
                } else {
                    failedPages++;
                    log.warn("{} page {}/{} skipped: {}", path, pageNumber, totalPages, outcome);
                }
            } catch (CompletionException e) {
                if (e.getCause() instanceof SeiAuthenticationException authError) {
                    throw authError;
                }
                failedPages++;
                log.warn("{} page {}/{} skipped: {}", path, pageNumber, totalPages,
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            }
        }

        if (failedPages > 0) {
            log.warn("{}: {} of {} pages failed, returning {} of {} items",
                    path, failedPages, totalPages, items.size(), firstPage.totalItems());
        }
        return FetchOutcome.success(items);
    }

    private FetchOutcome<PageEnvelope> fetchPage(String path, Map<String, ?> params, String itemsKey,
                                                 int pageSize, int page) {
        Map<String, Object> pageParams = new LinkedHashMap<>(params);
        pageParams.put(PAGE_PARAM, page);
        pageParams.put(PAGE_SIZE_PARAM, pageSize);
        return requestExecutor.get(path, pageParams).map(body -> PageEnvelope.from(body, itemsKey));
    }

    @PreDestroy
    public void shutdown() {
        pagePool.shutdown();
        try {
            if (!pagePool.awaitTermination(30, TimeUnit.SECONDS)) {
                pagePool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pagePool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
