package com.eainde.slopstopper.support;

import com.eainde.slopstopper.store.JdbcRecordStore;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.util.UUID;

/**
 * Fresh in-memory H2 database per instance, initialised from the production {@code schema.sql}.
 */
public final class TestDatabase {

    private final JdbcTemplate jdbcTemplate;
    private final JdbcRecordStore recordStore;

    public TestDatabase() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.recordStore = new JdbcRecordStore(jdbcTemplate, new DataSourceTransactionManager(dataSource));
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public JdbcRecordStore recordStore() {
        return recordStore;
    }
}
