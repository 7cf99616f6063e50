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

@Component
@ConditionalOnProperty(name = "spring.batch.job.enabled", havingValue = "true", matchIfMissing = true)
public class DocumentDownloadTasklet implements Tasklet {
    private static final Logger log = LoggerFactory.getLogger(DocumentDownloadTasklet.class);

    private final DocumentDownloadService downloadService;

    @Value("${huginn.documents.enabled:true}")
    private boolean enabled;

    @Value("${huginn.documents.concurrency:5}")
    private int concurrency;

    @Value("${huginn.documents.limit:1000}")
    private int limit;

    @Value("${huginn.documents.max-attempts:3}")
    private int maxAttempts;

    @Autowired
    public DocumentDownloadTasklet(DocumentDownloadService downloadService) {
        this.downloadService = downloadService;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        if (!enabled) {
            log.info("Document download disabled (huginn.documents.enabled=false), skipping");
            return RepeatStatus.FINISHED;
        }

        DocumentDownloadService.Summary summary = downloadService.downloadPending(limit, concurrency, maxAttempts);
        contribution.incrementWriteCount(summary.downloaded());
        return RepeatStatus.FINISHED;
    }
}
