package com.example.datalake.kbsearch.config;

import com.pgvector.PGvector;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Registers the pgvector types on startup so chunk queries can bind {@link PGvector} parameters.
 */
@Slf4j
@Configuration
@Profile("!test")
@RequiredArgsConstructor
public class PgvectorConfig {

    private final DataSource dataSource;

    @PostConstruct
    public void registerPgvectorTypes() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            String driverName = conn.getMetaData().getDriverName();
            if (driverName != null && driverName.toLowerCase(Locale.ROOT).contains("postgresql")) {
                PGvector.registerTypes(conn);
                log.info("Registered pgvector types");
            } else {
                log.warn("Datasource driver '{}' is not PostgreSQL, vector search will not work", driverName);
            }
        }
    }
}
