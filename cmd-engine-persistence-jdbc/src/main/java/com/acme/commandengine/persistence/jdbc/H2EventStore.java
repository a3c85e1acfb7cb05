package com.acme.commandengine.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific implementation of EventStore */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2EventStore extends JdbcEventStore {

  public H2EventStore(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected String getSelectSnapshotSql() {
    return """
        SELECT revision, state FROM snapshots WHERE aggregate_id = ?
        """;
  }

  @Override
  protected String getSelectEventStreamSql() {
    return """
        SELECT position, event FROM events
        WHERE aggregate_id = ? AND revision >= ?
        ORDER BY revision
        """;
  }

  @Override
  protected String getUpsertSnapshotSql() {
    return """
        MERGE INTO snapshots t
        USING (VALUES (CAST(? AS UUID), CAST(? AS BIGINT), CAST(? AS CHARACTER LARGE OBJECT)))
          AS s(aggregate_id, revision, state)
        ON t.aggregate_id = s.aggregate_id
        WHEN MATCHED AND s.revision > t.revision THEN
          UPDATE SET revision = s.revision, state = s.state
        WHEN NOT MATCHED THEN
          INSERT (aggregate_id, revision, state) VALUES (s.aggregate_id, s.revision, s.state)
        """;
  }

  @Override
  protected String getInsertEventSql() {
    return """
        INSERT INTO events (aggregate_id, revision, event, has_been_published)
        VALUES (?, ?, ?, FALSE)
        """;
  }

  @Override
  protected String getMarkPublishedSql() {
    return """
        UPDATE events SET has_been_published = TRUE
        WHERE aggregate_id = ? AND revision BETWEEN ? AND ?
        """;
  }

  @Override
  protected String getSelectUnpublishedSql() {
    return """
        SELECT position, event FROM events
        WHERE has_been_published = FALSE
        ORDER BY position
        """;
  }
}
