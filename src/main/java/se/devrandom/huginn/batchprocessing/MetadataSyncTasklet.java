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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.devrandom.huginn.storage.PendingProcess;
import se.devrandom.huginn.storage.PostgresService;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Syncs metadata, document lists and progressions for every process in the queue that has
 * not reached a terminal status.
 */
@Component
@ConditionalOnProperty(name = "spring.batch.job.enabled", havingValue = "true", matchIfMissing = true)
public class MetadataSyncTasklet implements Tasklet {
    private static final Logger log = LoggerFactory.getLogger(MetadataSyncTasklet.class);

    private final PostgresService postgresService;
    private final IngestionPipeline pipeline;

    @Value("${huginn.sync.concurrency:10}")
    private int concurrency;

    @Value("${huginn.sync.flush-threshold:50}")
    private int flushThreshold;

    @Value("${huginn.sync.limit:0}")
    private int limit;

    @Value("${huginn.sync.tenant-filter:}")
    private String tenantFilter;

    // ISO date, e.g. 2024-01-31
    @Value("${huginn.sync.since:}")
    private String since;

    @Value("${huginn.sync.deadline-minutes:0}")
    private long deadlineMinutes;

    @Value("${huginn.sync.shutdown-timeout-seconds:120}")
    private long shutdownTimeoutSeconds;

    @Autowired
    public MetadataSyncTasklet(PostgresService postgresService, IngestionPipeline pipeline) {
        this.postgresService = postgresService;
        this.pipeline = pipeline;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        LocalDate sinceDate = since == null || since.isBlank() ? null : LocalDate.parse(since.trim());
        List<PendingProcess> pending = postgresService.loadPendingProcesses(tenantFilter, sinceDate, limit);

        Instant deadline = deadlineMinutes > 0 ? Instant.now().plus(Duration.ofMinutes(deadlineMinutes)) : null;

        // SIGTERM: stop dispatching, then hold the JVM until in-flight fetches land and the writer flushes
        Duration shutdownTimeout = Duration.ofSeconds(shutdownTimeoutSeconds);
        Thread shutdownHook = new Thread(() -> pipeline.stopAndAwait(shutdownTimeout), "sync-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            IngestionSummary summary = pipeline.run(pending, concurrency, flushThreshold, deadline);
            contribution.incrementWriteCount(summary.processed());
            if (summary.notDispatched() > 0) {
                log.warn("{} processes were not dispatched and remain pending", summary.notDispatched());
            }
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, shutdown hook stays registered");
            }
        }
        return RepeatStatus.FINISHED;
    }
}
