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

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
@ConditionalOnProperty(name = "spring.batch.job.enabled", havingValue = "true", matchIfMissing = true)
public class BatchConfiguration {

    @Bean
    public Job processSyncJob(JobRepository jobRepository,
                              JobCompletionNotificationListener listener,
                              Step syncProcessMetadataStep,
                              Step downloadDocumentsStep) {
        return new JobBuilder("processSyncJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .listener(listener)
                .start(syncProcessMetadataStep)
                .next(downloadDocumentsStep)
                .build();
    }

    @Bean
    public Step syncProcessMetadataStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                        MetadataSyncTasklet tasklet) {
        return new StepBuilder("syncProcessMetadataStep", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    // Runs after metadata so newly listed documents are picked up in the same run
    @Bean
    public Step downloadDocumentsStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                      DocumentDownloadTasklet tasklet) {
        return new StepBuilder("downloadDocumentsStep", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }
}
