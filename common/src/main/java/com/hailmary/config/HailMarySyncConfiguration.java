package com.hailmary.config;

import com.hailmary.checkpoint.CheckpointStore;
import com.hailmary.checkpoint.FileCheckpointStore;
import com.hailmary.checkpoint.InMemoryCheckpointStore;
import com.hailmary.checkpoint.JdbcCheckpointStore;
import com.hailmary.elasticsearch.ElasticsearchService;
import com.hailmary.orchestrator.SyncOrchestrator;
import com.hailmary.source.JdbcRelationalStore;
import com.hailmary.source.RelationalStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring configuration that wires the sync beans.
 *
 * <p>Discovered via component-scanning from the application's {@code @SpringBootApplication}
 * (which scans {@code com.hailmary.*}).  The {@link DataSource} comes from Spring Boot's
 * {@code spring.datasource.*} properties; everything else from {@code hailmary.*}.</p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SyncConfig.class)
public class HailMarySyncConfiguration {

    @Bean
    public Clock syncClock() {
        return Clock.systemUTC();
    }

    @Bean
    public NamedParameterJdbcTemplate syncJdbcTemplate(DataSource dataSource, SyncConfig config) {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout(config.getRetry().getQueryTimeoutSeconds());
        return new NamedParameterJdbcTemplate(jdbc);
    }

    @Bean
    public RelationalStore relationalStore(NamedParameterJdbcTemplate syncJdbcTemplate) {
        return new JdbcRelationalStore(syncJdbcTemplate);
    }

    @Bean
    public CheckpointStore checkpointStore(SyncConfig config, NamedParameterJdbcTemplate syncJdbcTemplate,
                                           Clock syncClock) {
        CheckpointConfig checkpoint = config.getCheckpoint();
        log.info("Using {} checkpoint store", checkpoint.getType());
        return switch (checkpoint.getType()) {
            case JDBC -> {
                JdbcCheckpointStore store = new JdbcCheckpointStore(syncJdbcTemplate, checkpoint.getTable(), syncClock);
                if (checkpoint.isInitializeSchema()) {
                    store.initialize();
                }
                yield store;
            }
            case FILE -> {
                FileCheckpointStore store = new FileCheckpointStore(Path.of(checkpoint.getDirectory()), syncClock);
                if (checkpoint.isInitializeSchema()) {
                    store.initialize();
                }
                yield store;
            }
            case MEMORY -> new InMemoryCheckpointStore(syncClock);
        };
    }

    @Bean(destroyMethod = "close")
    public ElasticsearchService elasticsearchService(SyncConfig config) {
        return new ElasticsearchService(config.getElasticsearch());
    }

    @Bean(destroyMethod = "stop")
    public SyncOrchestrator syncOrchestrator(SyncConfig config,
                                             RelationalStore relationalStore,
                                             ElasticsearchService elasticsearchService,
                                             CheckpointStore checkpointStore,
                                             Clock syncClock) {
        return SyncOrchestrator.fromConfig(config, relationalStore, elasticsearchService, checkpointStore, syncClock);
    }

    @Bean
    public ApplicationListener<ApplicationReadyEvent> syncStarter(SyncConfig config, SyncOrchestrator syncOrchestrator) {
        return event -> {
            if (config.isAutoStart()) {
                syncOrchestrator.start();
            } else {
                log.info("hailmary.auto-start is false, pipelines run only when triggered");
            }
        };
    }
}
