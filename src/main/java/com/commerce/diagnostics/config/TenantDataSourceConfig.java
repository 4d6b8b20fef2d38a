package com.commerce.diagnostics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Connection settings for the per-brand analytics databases.
 * All brands share one server and credentials; each has its own schema.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tenants.datasource")
public class TenantDataSourceConfig {

    private String host;
    private int port = 3306;
    private String username;
    private String password;

    // Formatted with host, port and database name
    private String jdbcUrlTemplate = "jdbc:mysql://%s:%d/%s?connectionTimeZone=UTC&sslMode=REQUIRED";

    // Brand id -> database name
    private Map<Long, String> databases = new HashMap<>();

    private int maxPoolSize = 10;
    private long connectionTimeoutMs = 10000;
}
