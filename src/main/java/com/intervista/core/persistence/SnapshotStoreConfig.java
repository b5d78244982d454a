package com.intervista.core.persistence;

import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Provides the LangGraph4j {@link BaseCheckpointSaver} behind the {@link SnapshotStore}.
 * <p>
 * With a {@link DataSource} (the {@code postgres} profile) Spring Boot provides a {@link JdbcTemplate}
 * and snapshots go to PostgreSQL through a {@link JdbcSnapshotSaver}. Otherwise a {@link MemorySaver}
 * is used and snapshots do not survive a restart.
 */
@Configuration
public class SnapshotStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStoreConfig.class);

    @Bean
    public BaseCheckpointSaver snapshotSaver(ObjectProvider<JdbcTemplate> jdbcTemplate) {
        JdbcTemplate template = jdbcTemplate.getIfAvailable();
        if (template != null) {
            log.info("Configuring JDBC snapshot saver (PostgreSQL)");
            var saver = new JdbcSnapshotSaver(template);
            saver.createTables();
            return saver;
        }
        log.info("No DataSource available; using in-memory snapshot saver (snapshots will not persist across restarts)");
        return new MemorySaver();
    }
}
