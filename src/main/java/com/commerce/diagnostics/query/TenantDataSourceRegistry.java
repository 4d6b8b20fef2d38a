package com.commerce.diagnostics.query;

import com.commerce.diagnostics.config.EngineConfig;
import com.commerce.diagnostics.config.TenantDataSourceConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one bounded connection pool per brand. Pools are created on first use
 * and closed on shutdown.
 */
@Component
public class TenantDataSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantDataSourceRegistry.class);

    private final TenantDataSourceConfig config;
    private final EngineConfig engineConfig;
    private final Map<Long, HikariDataSource> dataSources = new ConcurrentHashMap<>();
    private final Map<Long, JdbcTemplate> templates = new ConcurrentHashMap<>();

    public TenantDataSourceRegistry(TenantDataSourceConfig config, EngineConfig engineConfig) {
        this.config = config;
        this.engineConfig = engineConfig;
    }

    /**
     * @throws DataFetchException if no database is configured for the brand
     */
    public JdbcTemplate jdbcTemplate(Long brandId) {
        if (brandId == null) {
            throw new DataFetchException("Missing brand id for tenant query");
        }
        return templates.computeIfAbsent(brandId, this::createJdbcTemplate);
    }

    private JdbcTemplate createJdbcTemplate(Long brandId) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSources.computeIfAbsent(brandId, this::createDataSource));
        // statement timeout is in whole seconds
        int timeoutSeconds = (int) Math.max(1, (engineConfig.getQueryTimeoutMs() + 999) / 1000);
        jdbcTemplate.setQueryTimeout(timeoutSeconds);
        return jdbcTemplate;
    }

    private HikariDataSource createDataSource(Long brandId) {
        String database = config.getDatabases().get(brandId);
        if (config.getHost() == null || config.getUsername() == null || database == null) {
            throw new DataFetchException("Missing database credentials for brand " + brandId);
        }

        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("brand-" + brandId);
        hikari.setJdbcUrl(String.format(config.getJdbcUrlTemplate(), config.getHost(), config.getPort(), database));
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        hikari.setMaximumPoolSize(config.getMaxPoolSize());
        hikari.setConnectionTimeout(config.getConnectionTimeoutMs());
        hikari.setReadOnly(true);

        log.info("Creating connection pool for brand {} -> {}@{}", brandId, database, config.getHost());
        return new HikariDataSource(hikari);
    }

    public int size() {
        return dataSources.size();
    }

    @PreDestroy
    public void close() {
        dataSources.forEach((brandId, dataSource) -> {
            log.info("Closing connection pool for brand {}", brandId);
            dataSource.close();
        });
        dataSources.clear();
        templates.clear();
    }
}
