package com.acme.commandengine.persistence.jdbc;

import static org.assertj.core.api.Assertions.*;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.lang.reflect.Method;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * SQL verification tests for PostgresEventStore. Verifies that the statements use PostgreSQL
 * features such as JSONB casts and ON CONFLICT upserts.
 */
@DisplayName("PostgreSQL Event Store SQL Verification")
class PostgresEventStoreSqlTest {

  private PostgresEventStore store;
  private HikariDataSource dataSource;

  @BeforeEach
  void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:pgsql");
    config.setUsername("sa");
    config.setPassword("");
    dataSource = new HikariDataSource(config);

    store = new PostgresEventStore(dataSource);
  }

  @AfterEach
  void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @Test
  @DisplayName("Insert event SQL should cast the payload to JSONB")
  void testInsertEventSql() {
    String sql = invokeProtectedMethod("getInsertEventSql");

    assertThat(sql)
        .contains("INSERT INTO events")
        .contains("(aggregate_id, revision, event, has_been_published)")
        .contains("CAST(? AS jsonb)");
  }

  @Test
  @DisplayName("Snapshot upsert should only replace older snapshots")
  void testUpsertSnapshotSql() {
    String sql = invokeProtectedMethod("getUpsertSnapshotSql");

    assertThat(sql)
        .contains("ON CONFLICT (aggregate_id) DO UPDATE")
        .contains("WHERE snapshots.revision < EXCLUDED.revision")
        .doesNotContain("MERGE INTO");
  }

  @Test
  @DisplayName("Event stream SQL should filter by revision and order by revision")
  void testSelectEventStreamSql() {
    String sql = invokeProtectedMethod("getSelectEventStreamSql");

    assertThat(sql)
        .contains("event::text AS event")
        .contains("WHERE aggregate_id = ? AND revision >= ?")
        .contains("ORDER BY revision");
  }

  @Test
  @DisplayName("Unpublished SQL should order by global position")
  void testSelectUnpublishedSql() {
    String sql = invokeProtectedMethod("getSelectUnpublishedSql");

    assertThat(sql).contains("NOT has_been_published").contains("ORDER BY position");
  }

  @Test
  @DisplayName("Mark published SQL should target a revision range")
  void testMarkPublishedSql() {
    String sql = invokeProtectedMethod("getMarkPublishedSql");

    assertThat(sql)
        .contains("UPDATE events SET has_been_published = TRUE")
        .contains("revision BETWEEN ? AND ?");
  }

  @Test
  @DisplayName("Snapshot SQL should read state as text")
  void testSelectSnapshotSql() {
    String sql = invokeProtectedMethod("getSelectSnapshotSql");

    assertThat(sql).contains("state::text AS state").contains("WHERE aggregate_id = ?");
  }

  private String invokeProtectedMethod(String methodName) {
    try {
      Method method = PostgresEventStore.class.getDeclaredMethod(methodName);
      method.setAccessible(true);
      return (String) method.invoke(store);
    } catch (Exception e) {
      throw new RuntimeException("Failed to invoke method: " + methodName, e);
    }
  }
}
