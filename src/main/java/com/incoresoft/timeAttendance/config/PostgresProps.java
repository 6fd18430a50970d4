package com.incoresoft.timeAttendance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * PostgreSQL settings used to build the JPA DataSource.
 */
@Data
@ConfigurationProperties(prefix = "postgres")
public class PostgresProps {
    private String host = "localhost";
    private int port = 5432;
    /**
     * Database holding scans, daily records and the request tables.
     */
    private String database = "attendance";
    private String username;
    private String password;
    /** Upper bound for the Hikari pool. */
    private int maxPoolSize = 10;

    public String jdbcUrl() {
        String db = (database == null || database.isBlank()) ? "postgres" : database;
        return "jdbc:postgresql://" + host + ":" + port + "/" + db;
    }
}
