package org.geoingest.configuration;

import lombok.Data;
import org.geoingest.models.enums.BackoffMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    private Storage storage = new Storage();
    private Scheduler scheduler = new Scheduler();
    private Retry retry = new Retry();
    private Catalog catalog = new Catalog();

    @Data
    public static class Storage {
        private String basePath = "./data";
        private int compressionLevel = 6;
        private int defaultQueryLimit = 1000;
        private Duration orphanGracePeriod = Duration.ofMinutes(10);
    }

    @Data
    public static class Scheduler {
        private Duration tickInterval = Duration.ofSeconds(60);
        private int maxConcurrentTasks = 10;
        private int queueCapacity = 100;
        private boolean autoStart = false;
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private Duration backoff = Duration.ofMinutes(5);
        private BackoffMode mode = BackoffMode.FIXED;
        private Duration maxBackoff = Duration.ofHours(1);
        private boolean scaledByFrequency = false;
    }

    @Data
    public static class Catalog {
        private String location = "classpath:catalog/sources.json";
        private boolean loadOnStartup = true;
    }
}
