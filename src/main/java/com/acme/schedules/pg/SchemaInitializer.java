package com.acme.schedules.pg;

import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the schedules table and its indexes from {@code schema.sql} at startup.
 * The script is idempotent.
 */
@Singleton
@Requires(property = "schedules.init-schema", value = "true", defaultValue = "false")
public class SchemaInitializer implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaInitializer.class);
    static final String SCHEMA_RESOURCE = "schema.sql";

    private final ConnectionOperations<Connection> connectionOps;

    public SchemaInitializer(ConnectionOperations<Connection> connectionOps) {
        this.connectionOps = connectionOps;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        initialize();
    }

    public void initialize() {
        String sql = loadSchema();
        connectionOps.executeWrite(status -> {
            try (var stmt = status.getConnection().createStatement()) {
                stmt.execute(sql);
                return null;
            } catch (SQLException e) {
                throw new IllegalStateException("Failed to initialize schedules schema", e);
            }
        });
        LOG.info("Schedules schema initialized from {}", SCHEMA_RESOURCE);
    }

    static String loadSchema() {
        InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE);
        if (in == null) {
            throw new IllegalStateException(SCHEMA_RESOURCE + " not found on classpath");
        }
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
