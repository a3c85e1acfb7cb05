package com.acme.commandengine.processor.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the pooled DataSource for the event store and migrates its schema with Flyway before
 * the first use. The migration location follows {@code db.dialect}.
 */
@Factory
public class DataSourceFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DataSourceFactory.class);

    @Singleton
    @Bean(preDestroy = "close")
    public HikariDataSource dataSource(
            @Value("${datasource.url}") String url,
            @Value("${datasource.username:sa}") String username,
            @Value("${datasource.password:}") String password,
            @Value("${datasource.maximum-pool-size:10}") int maximumPoolSize,
            @Value("${db.dialect:H2}") String dialect) {

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setPoolName("event-store");

        HikariDataSource dataSource = new HikariDataSource(config);

        String location = migrationLocation(dialect);
        Flyway.configure()
                .dataSource(dataSource)
                .locations(location)
                .load()
                .migrate();
        LOG.info("Event store schema migrated from {}", location);
        return dataSource;
    }

    static String migrationLocation(String dialect) {
        return "PostgreSQL".equalsIgnoreCase(dialect)
                ? "classpath:db/migration/postgres"
                : "classpath:db/migration/h2";
    }
}
