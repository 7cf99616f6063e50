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
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.devrandom.huginn.storage.PostgresService;
import se.devrandom.huginn.storage.SyncStatisticsService;

import java.sql.SQLException;

@Component
@ConditionalOnProperty(name = "spring.batch.job.enabled", havingValue = "true", matchIfMissing = true)
public class JobCompletionNotificationListener implements JobExecutionListener {
    private static final Logger log = LoggerFactory.getLogger(JobCompletionNotificationListener.class);

    private final SyncStatisticsService statisticsService;
    private final PostgresService postgresService;

    public JobCompletionNotificationListener(SyncStatisticsService statisticsService,
                                             PostgresService postgresService) {
        this.statisticsService = statisticsService;
        this.postgresService = postgresService;
    }

    @Override
    public void beforeJob(JobExecution jobExecution) {
        log.info("Starting job {}", jobExecution.getJobInstance().getJobName());
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        if (jobExecution.getStatus() == BatchStatus.COMPLETED) {
            log.info("!!! JOB FINISHED! Time to verify the results");
            printSummary("SYNC JOB SUMMARY");
        } else if (jobExecution.getStatus() == BatchStatus.FAILED) {
            log.error("!!! JOB FAILED! Check logs for errors");
            jobExecution.getAllFailureExceptions()
                    .forEach(e -> log.error("Failure: {}", e.getMessage()));
            printSummary("SYNC JOB SUMMARY (FAILED)");
        }
    }

    private void printSummary(String title) {
        try {
            statisticsService.setMetadataStatusTotals(postgresService.countMetadataStatuses());
        } catch (SQLException e) {
            log.warn("Could not count sync statuses: {}", e.getMessage());
        }

        statisticsService.markJobComplete();
        String summary = statisticsService.generateSummaryReport();

        log.info("\n" + "=".repeat(80));
        log.info(title);
        log.info("=".repeat(80));
        log.info(summary);
        log.info("=".repeat(80));
    }
}
