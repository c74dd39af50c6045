package com.xgpt.search.support;

import com.xgpt.search.store.SchemaInitializer;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Private in-memory SQLite database with the full schema, one per test.
 */
public final class SqliteTestDatabase implements AutoCloseable {

    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    public SqliteTestDatabase() {
        dataSource = new SingleConnectionDataSource("jdbc:sqlite::memory:", true);
        jdbcTemplate = new JdbcTemplate(dataSource);
        new SchemaInitializer(jdbcTemplate).ensureSchema();
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public int count(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public void close() {
        dataSource.destroy();
    }
}
