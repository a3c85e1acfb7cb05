package com.acme.commandengine.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

/**
 * PostgreSQL-specific implementation of EventStore. Events and snapshots are stored as JSONB.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresEventStore extends JdbcEventStore {

    public PostgresEventStore(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getSelectSnapshotSql() {
        return """
                SELECT revision, state::text AS state FROM snapshots WHERE aggregate_id = ?
                """;
    }

    @Override
    protected String getSelectEventStreamSql() {
        return """
                SELECT position, event::text AS event FROM events
                WHERE aggregate_id = ? AND revision >= ?
                ORDER BY revision
                """;
    }

    @Override
    protected String getUpsertSnapshotSql() {
        return """
                INSERT INTO snapshots (aggregate_id, revision, state)
                VALUES (?, ?, CAST(? AS jsonb))
                ON CONFLICT (aggregate_id) DO UPDATE
                SET revision = EXCLUDED.revision, state = EXCLUDED.state
                WHERE snapshots.revision < EXCLUDED.revision
                """;
    }

    @Override
    protected String getInsertEventSql() {
        return """
                INSERT INTO events (aggregate_id, revision, event, has_been_published)
                VALUES (?, ?, CAST(? AS jsonb), FALSE)
                """;
    }

    @Override
    protected String getMarkPublishedSql() {
        return """
                UPDATE events SET has_been_published = TRUE
                WHERE aggregate_id = ? AND revision BETWEEN ? AND ?
                AND NOT has_been_published
                """;
    }

    @Override
    protected String getSelectUnpublishedSql() {
        return """
                SELECT position, event::text AS event FROM events
                WHERE NOT has_been_published
                ORDER BY position
                """;
    }
}
