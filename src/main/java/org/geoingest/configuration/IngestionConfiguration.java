package org.geoingest.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.geoingest.adapters.Collector;
import org.geoingest.adapters.CollectorRegistry;
import org.geoingest.repository.DataFileMetadataRepository;
import org.geoingest.repository.DataRecordIndexRepository;
import org.geoingest.service.IngestionCoordinator;
import org.geoingest.service.scheduler.CollectionExecutor;
import org.geoingest.service.scheduler.IngestionScheduler;
import org.geoingest.service.scheduler.RetryPolicy;
import org.geoingest.service.source.JsonSourceCatalog;
import org.geoingest.service.source.SourceCatalog;
import org.geoingest.service.source.SourceRegistry;
import org.geoingest.service.storage.BlobCodec;
import org.geoingest.service.storage.StorageEngine;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Wires the ingestion core. The core classes take plain constructor arguments; this is the
 * only place that reads {@link IngestionProperties}.
 */
@Configuration
@EnableConfigurationProperties(IngestionProperties.class)
public class IngestionConfiguration {

    @Bean
    public Clock ingestionClock() {
        return Clock.systemUTC();
    }

    @Bean
    public SourceRegistry sourceRegistry() {
        return new SourceRegistry();
    }

    @Bean
    public CollectorRegistry collectorRegistry(ObjectProvider<Collector> collectors) {
        return new CollectorRegistry(collectors.orderedStream().toList());
    }

    @Bean
    public SourceCatalog sourceCatalog(IngestionProperties properties,
                                       ResourceLoader resourceLoader,
                                       ObjectMapper objectMapper) {
        return new JsonSourceCatalog(resourceLoader.getResource(properties.getCatalog().getLocation()), objectMapper);
    }

    @Bean
    public BlobCodec blobCodec(IngestionProperties properties, ObjectMapper objectMapper) {
        return new BlobCodec(objectMapper, properties.getStorage().getCompressionLevel());
    }

    @Bean
    public StorageEngine storageEngine(IngestionProperties properties,
                                       BlobCodec blobCodec,
                                       DataFileMetadataRepository fileMetadataRepository,
                                       DataRecordIndexRepository recordIndexRepository,
                                       TransactionTemplate transactionTemplate,
                                       Clock ingestionClock) {
        IngestionProperties.Storage storage = properties.getStorage();
        return new StorageEngine(
                Paths.get(storage.getBasePath()),
                blobCodec,
                fileMetadataRepository,
                recordIndexRepository,
                transactionTemplate,
                ingestionClock,
                storage.getDefaultQueryLimit(),
                storage.getOrphanGracePeriod());
    }

    @Bean
    public ThreadPoolTaskExecutor collectionWorkers(IngestionProperties properties) {
        IngestionProperties.Scheduler scheduler = properties.getScheduler();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(scheduler.getMaxConcurrentTasks());
        executor.setMaxPoolSize(scheduler.getMaxConcurrentTasks());
        executor.setQueueCapacity(scheduler.getQueueCapacity());
        executor.setThreadNamePrefix("collector-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler ingestionTickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ingestion-tick-");
        return scheduler;
    }

    @Bean
    public CollectionExecutor collectionExecutor(SourceRegistry sourceRegistry,
                                                 CollectorRegistry collectorRegistry,
                                                 StorageEngine storageEngine,
                                                 Clock ingestionClock) {
        return new CollectionExecutor(sourceRegistry, collectorRegistry, storageEngine, ingestionClock);
    }

    @Bean
    public IngestionScheduler ingestionScheduler(IngestionProperties properties,
                                                 SourceRegistry sourceRegistry,
                                                 CollectionExecutor collectionExecutor,
                                                 ThreadPoolTaskExecutor collectionWorkers,
                                                 ThreadPoolTaskScheduler ingestionTickScheduler,
                                                 Clock ingestionClock) {
        IngestionProperties.Retry retry = properties.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.getMaxRetries(), retry.getBackoff(), retry.getMode(),
                retry.getMaxBackoff(), retry.isScaledByFrequency());
        return new IngestionScheduler(
                sourceRegistry,
                collectionExecutor,
                retryPolicy,
                collectionWorkers,
                ingestionTickScheduler,
                ingestionClock,
                properties.getScheduler().getTickInterval());
    }

    @Bean
    public IngestionCoordinator ingestionCoordinator(SourceRegistry sourceRegistry,
                                                     CollectorRegistry collectorRegistry,
                                                     SourceCatalog sourceCatalog,
                                                     IngestionScheduler ingestionScheduler,
                                                     CollectionExecutor collectionExecutor,
                                                     StorageEngine storageEngine) {
        return new IngestionCoordinator(sourceRegistry, collectorRegistry, sourceCatalog,
                ingestionScheduler, collectionExecutor, storageEngine);
    }
}
