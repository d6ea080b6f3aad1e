package com.disasterfeed.sync.config;

import com.disasterfeed.sync.scheduler.MonitorSleeper;
import com.disasterfeed.sync.scheduler.Sleeper;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the collaborators the pipeline treats as given: HTTP client, clock, geometry factory,
 * transaction template and the fetch executor.
 */
@Configuration
public class SyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate feedRestTemplate(RestTemplateBuilder builder, DisasterSyncProperties properties) {
        DisasterSyncProperties.Feed feed = properties.getFeed();
        return builder
                .setConnectTimeout(feed.getConnectTimeout())
                .setReadTimeout(feed.getReadTimeout())
                .build();
    }

    @Bean
    public GeometryFactory geometryFactory(DisasterSyncProperties properties) {
        return new GeometryFactory(new PrecisionModel(), properties.getStore().getSrid());
    }

    @Bean
    public TransactionTemplate syncTransactionTemplate(PlatformTransactionManager transactionManager,
                                                       DisasterSyncProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout((int) properties.getStore().getQueryTimeout().toSeconds());
        return template;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService feedFetchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "feed-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Sleeper sleeper() {
        return new MonitorSleeper();
    }
}
