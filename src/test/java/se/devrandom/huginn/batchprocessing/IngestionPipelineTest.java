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
package se.devrandom.huginn.batchprocessing;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.devrandom.huginn.sei.CredentialManager;
import se.devrandom.huginn.sei.FetchOutcome;
import se.devrandom.huginn.sei.ProcessFetchResult;
import se.devrandom.huginn.sei.ScopeDirectory;
import se.devrandom.huginn.sei.ScopeFallbackOrchestrator;
import se.devrandom.huginn.sei.SeiApiClient;
import se.devrandom.huginn.sei.SeiAuthenticationException;
import se.devrandom.huginn.sei.objects.ProcessRecord;
import se.devrandom.huginn.sei.objects.SeiLoginResponse;
import se.devrandom.huginn.storage.BulkWriteStats;
import se.devrandom.huginn.storage.PendingProcess;
import se.devrandom.huginn.storage.ProcessStore;
import se.devrandom.huginn.storage.SyncStatisticsService;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionPipelineTest {

    private ScopeFallbackOrchestrator orchestrator;
    private RecordingStore store;
    private SyncStatisticsService statistics;
    private IngestionPipeline pipeline;
    private final AtomicInteger fetchCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        orchestrator = mock(ScopeFallbackOrchestrator.class);
        store = new RecordingStore();
        statistics = new SyncStatisticsService();
        pipeline = new IngestionPipeline(orchestrator, store, statistics);
    }

    private void answerWith(Function<String, ProcessFetchResult> byProtocol) {
        when(orchestrator.fetchProcess(anyString(), anyString())).thenAnswer(invocation -> {
            fetchCalls.incrementAndGet();
            return byProtocol.apply(invocation.getArgument(0));
        });
    }

    private static List<PendingProcess> records(int count) {
        List<PendingProcess> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(new PendingProcess(protocol(i), "SEAD-PI/GAB"));
        }
        return records;
    }

    private static String protocol(int n) {
        return String.format("00002.%06d/2024-11", n);
    }

    private static int number(String protocol) {
        return Integer.parseInt(protocol.substring(6, 12));
    }

    private static ProcessFetchResult found(String protocol) {
        return ProcessFetchResult.success(protocol, "SEAD-PI/GAB", "101", null, List.of(), List.of(),
                List.of("SEAD-PI/GAB"));
    }

    @Test
    void everyRecordIsPersistedExactlyOnce() {
        answerWith(protocol -> {
            int n = number(protocol);
            if (n % 40 == 0) {
                return ProcessFetchResult.notFound(protocol, "SEAD-PI/GAB", "Processo não encontrado");
            }
            if (n % 50 == 0) {
                return ProcessFetchResult.accessDenied(protocol, List.of("SEAD-PI/GAB", "SEAD-PI"), "no access");
            }
            if (n % 7 == 0) {
                // found through a sibling unit after the declared one was denied
                return ProcessFetchResult.success(protocol, "SEAD-PI/DRH", "104", null, List.of(), List.of(),
                        List.of("SEAD-PI/GAB", "SEAD-PI/DRH"));
            }
            return found(protocol);
        });

        IngestionSummary summary = pipeline.run(records(120), 8, 25);

        assertThat(store.protocols).hasSize(120);
        assertThat(new HashSet<>(store.protocols)).hasSize(120);
        assertThat(store.batchSizes).allSatisfy(size -> assertThat(size).isBetween(1, 25));
        assertThat(summary.notFound()).isEqualTo(3);
        assertThat(summary.accessDenied()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(115);
        assertThat(summary.errored()).isZero();
        assertThat(summary.notDispatched()).isZero();
        assertThat(summary.processed()).isEqualTo(120);
        assertThat(summary.bulkWrites()).isEqualTo(store.batchSizes.size());
        assertThat(store.threadNames).allSatisfy(name -> assertThat(name).startsWith("sync-writer-"));
        assertThat(statistics.getProcessesSucceeded()).isEqualTo(115);
        assertThat(statistics.getBulkWrites()).isEqualTo(summary.bulkWrites());
    }

    @Test
    void slowWriterHoldsBackFetching() throws Exception {
        answerWith(IngestionPipelineTest::found);
        CountDownLatch releaseStore = new CountDownLatch(1);
        store.blockFirstWriteOn(releaseStore);
        int threshold = 5;
        int concurrency = 4;

        CompletableFuture<IngestionSummary> run = CompletableFuture.supplyAsync(
                () -> pipeline.run(records(100), concurrency, threshold));

        assertThat(store.firstWriteStarted.await(10, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(1000);
        // writer buffer + full queue + one result held by each blocked fetch thread
        assertThat(fetchCalls.get()).isLessThanOrEqualTo(threshold + 2 * threshold + concurrency);

        releaseStore.countDown();
        IngestionSummary summary = run.get(30, TimeUnit.SECONDS);

        assertThat(summary.succeeded()).isEqualTo(100);
        assertThat(store.protocols).hasSize(100);
    }

    @Test
    void quietQueueFlushesAHalfFullBuffer() throws Exception {
        CountDownLatch firstFlush = new CountDownLatch(1);
        store.onWrite(firstFlush::countDown);
        answerWith(protocol -> {
            if (number(protocol) == 6) {
                try {
                    firstFlush.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return found(protocol);
        });

        IngestionSummary summary = pipeline.run(records(6), 1, 10);

        assertThat(store.batchSizes).containsExactly(5, 1);
        assertThat(summary.succeeded()).isEqualTo(6);
    }

    @Test
    void oddThresholdWaitsForHalfBeforeAnEarlyFlush() {
        answerWith(protocol -> {
            if (number(protocol) == 2) {
                pause(4 * IngestionPipeline.POLL_TIMEOUT_MS);
            }
            return found(protocol);
        });

        IngestionSummary summary = pipeline.run(records(3), 1, 3);

        // a single buffered result is below half of 3, so the quiet queue must not flush it
        assertThat(store.batchSizes.get(0)).isGreaterThanOrEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(3);
    }

    @Test
    void stopAndAwaitReturnsOnlyOnceInFlightResultsAreFlushed() throws Exception {
        CountDownLatch fetchesStarted = new CountDownLatch(2);
        CountDownLatch releaseFetches = new CountDownLatch(1);
        answerWith(protocol -> {
            fetchesStarted.countDown();
            try {
                releaseFetches.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return found(protocol);
        });

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<IngestionSummary> run = CompletableFuture.supplyAsync(
                    () -> pipeline.run(records(10), 2, 10), callers);
            assertThat(fetchesStarted.await(10, TimeUnit.SECONDS)).isTrue();

            CompletableFuture<Boolean> stopped = CompletableFuture.supplyAsync(
                    () -> pipeline.stopAndAwait(Duration.ofSeconds(30)), callers);
            Thread.sleep(2 * IngestionPipeline.POLL_TIMEOUT_MS);
            assertThat(stopped).isNotDone();
            assertThat(store.protocols).isEmpty();

            releaseFetches.countDown();

            assertThat(stopped.get(30, TimeUnit.SECONDS)).isTrue();
            assertThat(store.protocols).containsExactlyInAnyOrder(protocol(1), protocol(2));
            IngestionSummary summary = run.get(10, TimeUnit.SECONDS);
            assertThat(summary.succeeded()).isEqualTo(2);
            assertThat(summary.notDispatched()).isEqualTo(8);
        } finally {
            releaseFetches.countDown();
            callers.shutdownNow();
        }
    }

    @Test
    void deniedDeclaredUnitsAreRecoveredThroughTheirSiblingEndToEnd() {
        SeiApiClient apiClient = mock(SeiApiClient.class);
        ScopeDirectory scopeDirectory = new ScopeDirectory();
        CredentialManager credentialManager = new CredentialManager(() -> {
            SeiLoginResponse response = new SeiLoginResponse();
            response.token = "t";
            response.unidades.add(unit("SEAD-PI/GAB", "2"));
            response.unidades.add(unit("SEAD-PI/DRH", "4"));
            return response;
        }, scopeDirectory);
        ScopeFallbackOrchestrator realOrchestrator = new ScopeFallbackOrchestrator(apiClient, scopeDirectory,
                credentialManager);

        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("IdProcedimento", "777");
        when(apiClient.consultProcess(eq("4"), anyString()))
                .thenReturn(FetchOutcome.accessDenied("Unidade não possui acesso ao processo"));
        when(apiClient.consultProcess(eq("2"), anyString()))
                .thenAnswer(invocation -> FetchOutcome.success(ProcessRecord.fromApi(invocation.getArgument(1), payload)));
        when(apiClient.listDocuments(anyString(), anyString())).thenReturn(FetchOutcome.success(List.of()));
        when(apiClient.listProgressions(anyString(), anyString())).thenReturn(FetchOutcome.success(List.of()));

        List<PendingProcess> input = new ArrayList<>();
        for (int i = 1; i <= 120; i++) {
            input.add(new PendingProcess(protocol(i), i % 40 == 0 ? "SEAD-PI/DRH" : "SEAD-PI/GAB"));
        }

        IngestionSummary summary;
        try {
            summary = new IngestionPipeline(realOrchestrator, store, statistics).run(input, 8, 25);
        } finally {
            realOrchestrator.shutdown();
        }

        assertThat(summary.succeeded()).isEqualTo(120);
        assertThat(summary.notFound()).isZero();
        assertThat(summary.accessDenied()).isZero();
        assertThat(summary.errored()).isZero();
        assertThat(new HashSet<>(store.protocols)).hasSize(120);
        assertThat(store.results)
                .filteredOn(result -> result.triedScopes().size() > 1)
                .extracting(ProcessFetchResult::protocol)
                .containsExactlyInAnyOrder(protocol(40), protocol(80), protocol(120));
        assertThat(store.results)
                .filteredOn(result -> result.triedScopes().size() > 1)
                .allSatisfy(result -> {
                    assertThat(result.triedScopes()).containsExactly("SEAD-PI/DRH", "SEAD-PI/GAB");
                    assertThat(result.scopeId()).isEqualTo("2");
                });
        verify(apiClient, times(3)).consultProcess(eq("4"), anyString());
        verify(apiClient, times(120)).consultProcess(eq("2"), anyString());
    }

    private static SeiLoginResponse.Unidade unit(String name, String id) {
        SeiLoginResponse.Unidade unidade = new SeiLoginResponse.Unidade();
        unidade.sigla = name;
        unidade.id = id;
        return unidade;
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void stopRequestEndsDispatchingButKeepsInFlightResults() {
        answerWith(protocol -> {
            if (number(protocol) == 3) {
                pipeline.requestStop();
            }
            return found(protocol);
        });

        IngestionSummary summary = pipeline.run(records(10), 1, 4);

        assertThat(fetchCalls.get()).isEqualTo(3);
        assertThat(store.protocols).containsExactlyInAnyOrder(protocol(1), protocol(2), protocol(3));
        assertThat(summary.succeeded()).isEqualTo(3);
        assertThat(summary.notDispatched()).isEqualTo(7);
        assertThat(statistics.getProcessesNotDispatched()).isEqualTo(7);
    }

    @Test
    void stopRequestDoesNotCarryOverToTheNextRun() {
        answerWith(protocol -> {
            if (fetchCalls.get() == 1) {
                pipeline.requestStop();
            }
            return found(protocol);
        });
        IngestionSummary first = pipeline.run(records(3), 1, 2);

        IngestionSummary second = pipeline.run(records(3), 1, 2);

        assertThat(first.notDispatched()).isEqualTo(2);
        assertThat(second.notDispatched()).isZero();
        assertThat(second.succeeded()).isEqualTo(3);
    }

    @Test
    void authenticationFailureAbortsAfterFlushingEarlierResults() {
        answerWith(protocol -> {
            if (number(protocol) == 4) {
                throw new SeiAuthenticationException("SEI login failed: 401");
            }
            return found(protocol);
        });

        assertThatThrownBy(() -> pipeline.run(records(10), 1, 2))
                .isInstanceOf(SeiAuthenticationException.class)
                .hasMessageContaining("login failed");

        assertThat(fetchCalls.get()).isEqualTo(4);
        assertThat(store.protocols).containsExactlyInAnyOrder(protocol(1), protocol(2), protocol(3));
        assertThat(statistics.getProcessesSucceeded()).isEqualTo(3);
        assertThat(statistics.getProcessesNotDispatched()).isEqualTo(7);
    }

    @Test
    void passedDeadlineDispatchesNothing() {
        answerWith(IngestionPipelineTest::found);

        IngestionSummary summary = pipeline.run(records(5), 2, 2, Instant.now().minusSeconds(1));

        assertThat(fetchCalls.get()).isZero();
        assertThat(store.batchSizes).isEmpty();
        assertThat(summary.notDispatched()).isEqualTo(5);
        assertThat(summary.processed()).isZero();
    }

    @Test
    void failedFlushCountsItsItemsAsErrored() {
        answerWith(IngestionPipelineTest::found);
        store.failFirstWrite();

        IngestionSummary summary = pipeline.run(records(4), 1, 2);

        // the rolled-back batch is errored, the writer keeps going with the rest
        assertThat(summary.failedWrites()).isEqualTo(1);
        assertThat(summary.errored()).isPositive();
        assertThat(summary.succeeded() + summary.errored()).isEqualTo(4);
        assertThat(store.protocols).hasSize(summary.succeeded());
        assertThat(statistics.getFailedWrites()).isEqualTo(1);
        assertThat(statistics.getProcessesErrored()).isEqualTo(summary.errored());
    }

    @Test
    void unexpectedFetchExceptionBecomesAnErrorResult() {
        answerWith(protocol -> {
            if (number(protocol) == 2) {
                throw new IllegalStateException("SEI returned a body that is not JSON");
            }
            return found(protocol);
        });

        IngestionSummary summary = pipeline.run(records(3), 2, 10);

        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.errored()).isEqualTo(1);
        assertThat(store.statuses).contains(ProcessFetchResult.Status.ERROR);
    }

    @Test
    void emptyInputIsANoOp() {
        IngestionSummary summary = pipeline.run(List.of(), 4, 10);

        assertThat(summary).isEqualTo(IngestionSummary.EMPTY);
        assertThat(store.batchSizes).isEmpty();
    }

    @Test
    void nonPositiveSettingsAreRejected() {
        assertThatThrownBy(() -> pipeline.run(records(1), 0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pipeline.run(records(1), 1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * In-memory store that records what it was asked to write and which thread asked.
     */
    private static final class RecordingStore implements ProcessStore {
        final List<String> protocols = new CopyOnWriteArrayList<>();
        final List<ProcessFetchResult> results = new CopyOnWriteArrayList<>();
        final List<ProcessFetchResult.Status> statuses = new CopyOnWriteArrayList<>();
        final List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        final List<String> threadNames = new CopyOnWriteArrayList<>();
        final CountDownLatch firstWriteStarted = new CountDownLatch(1);
        private final AtomicInteger writes = new AtomicInteger();
        private volatile CountDownLatch blockFirstWrite;
        private volatile boolean failFirstWrite;
        private volatile Runnable onWrite = () -> { };

        void blockFirstWriteOn(CountDownLatch latch) {
            this.blockFirstWrite = latch;
        }

        void failFirstWrite() {
            this.failFirstWrite = true;
        }

        void onWrite(Runnable callback) {
            this.onWrite = callback;
        }

        @Override
        public BulkWriteStats bulkUpsert(List<ProcessFetchResult> results) throws SQLException {
            int write = writes.incrementAndGet();
            threadNames.add(Thread.currentThread().getName());
            if (write == 1) {
                firstWriteStarted.countDown();
                if (blockFirstWrite != null) {
                    try {
                        blockFirstWrite.await(30, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                if (failFirstWrite) {
                    throw new SQLException("deadlock detected");
                }
            }
            batchSizes.add(results.size());
            this.results.addAll(results);
            for (ProcessFetchResult result : results) {
                protocols.add(result.protocol());
                statuses.add(result.status());
            }
            onWrite.run();
            return new BulkWriteStats(results.size(), 0, 0, results.size());
        }
    }
}
