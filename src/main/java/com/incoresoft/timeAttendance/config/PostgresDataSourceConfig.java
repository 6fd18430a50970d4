package com.incoresoft.timeAttendance.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Creates a DataSource from {@link PostgresProps}.
 *
 * The service reads its connection settings from the {@code postgres} block rather than
 * spring.datasource.*, so Spring Boot cannot auto-configure the datasource.
 */
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(PostgresProps.class)
public class PostgresDataSourceConfig {

    private final PostgresProps props;

    @Bean
    public DataSource dataSource() {
        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(props.jdbcUrl());
        cfg.setUsername(props.getUsername());
        cfg.setPassword(props.getPassword());
        cfg.setDriverClassName("org.postgresql.Driver");

        cfg.setMaximumPoolSize(props.getMaxPoolSize());
        cfg.setMinimumIdle(1);
        cfg.setPoolName("timeAttendance-hikari");

        return new HikariDataSource(cfg);
    }

    /**
     * Every (employee, date) reconciliation and every ingestion batch commits or rolls back
     * on its own, independent of any surrounding transaction.
     */
    @Bean
    public TransactionTemplate requiresNewTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }
}
