package com.acme.commandengine.persistence.jdbc;

import com.acme.commandengine.core.ConcurrencyConflictException;
import com.acme.commandengine.core.Jsons;
import com.acme.commandengine.domain.Event;
import com.acme.commandengine.domain.Snapshot;
import com.acme.commandengine.spi.EventStore;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Abstract JDBC implementation of EventStore using Template Method pattern.
 * Subclasses override database-specific SQL methods.
 *
 * <p>Events are stored as JSON without their position; the position column is assigned by the
 * database and put back on the event when it is read.
 */
public abstract class JdbcEventStore implements EventStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcEventStore.class);

    protected final DataSource dataSource;

    protected JdbcEventStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<Snapshot> getSnapshot(UUID aggregateId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getSelectSnapshotSql())) {

            ps.setObject(1, aggregateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                ObjectNode state = (ObjectNode) Jsons.readTree(rs.getString("state"));
                return Optional.of(new Snapshot(aggregateId, state, rs.getLong("revision")));
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "get snapshot", LOG);
        }
    }

    @Override
    public Stream<Event> getEventStream(UUID aggregateId, long fromRevision) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getSelectEventStreamSql())) {

            ps.setObject(1, aggregateId);
            ps.setLong(2, fromRevision);
            return readEvents(ps).stream();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "get event stream", LOG);
        }
    }

    @Override
    public void saveSnapshot(Snapshot snapshot) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getUpsertSnapshotSql())) {

            ps.setObject(1, snapshot.aggregateId());
            ps.setLong(2, snapshot.revision());
            ps.setString(3, Jsons.toJson(snapshot.state()));
            ps.executeUpdate();
            LOG.debug("Saved snapshot: aggregateId={}, revision={}",
                    snapshot.aggregateId(), snapshot.revision());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "save snapshot", LOG);
        }
    }

    @Override
    public List<Event> saveEvents(List<Event> events) {
        if (events.isEmpty()) {
            return List.of();
        }

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                List<Event> committed = insertEvents(conn, events);
                conn.commit();
                return committed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "save events", LOG);
        }
    }

    @Override
    public void markEventsAsPublished(UUID aggregateId, long fromRevision, long toRevision) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getMarkPublishedSql())) {

            ps.setObject(1, aggregateId);
            ps.setLong(2, fromRevision);
            ps.setLong(3, toRevision);
            int updated = ps.executeUpdate();
            LOG.debug("Marked {} event(s) published: aggregateId={}, revisions={}..{}",
                    updated, aggregateId, fromRevision, toRevision);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark events as published", LOG);
        }
    }

    @Override
    public Stream<Event> getUnpublishedEventStream() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getSelectUnpublishedSql())) {

            return readEvents(ps).stream();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "get unpublished events", LOG);
        }
    }

    private List<Event> insertEvents(Connection conn, List<Event> events) throws SQLException {
        List<Event> committed = new ArrayList<>(events.size());
        try (PreparedStatement ps =
                     conn.prepareStatement(getInsertEventSql(), Statement.RETURN_GENERATED_KEYS)) {
            for (Event event : events) {
                ps.setObject(1, event.aggregate().id());
                ps.setLong(2, event.revision());
                ps.setString(3, Jsons.toJson(event));
                try {
                    ps.executeUpdate();
                } catch (SQLException e) {
                    if (ExceptionTranslator.isUniqueViolation(e)) {
                        LOG.debug("Revision conflict: aggregateId={}, revision={}",
                                event.aggregate().id(), event.revision());
                        throw new ConcurrencyConflictException(
                                event.aggregate().id(), event.revision(), e);
                    }
                    throw e;
                }

                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No position generated for event " + event.id());
                    }
                    committed.add(event.withPosition(keys.getLong(1)));
                }
            }
        }
        return committed;
    }

    private static List<Event> readEvents(PreparedStatement ps) throws SQLException {
        List<Event> events = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Event event = Jsons.fromJson(rs.getString("event"), Event.class);
                events.add(event.withPosition(rs.getLong("position")));
            }
        }
        return events;
    }

    // Template methods for database-specific SQL

    protected abstract String getSelectSnapshotSql();

    protected abstract String getSelectEventStreamSql();

    protected abstract String getUpsertSnapshotSql();

    protected abstract String getInsertEventSql();

    protected abstract String getMarkPublishedSql();

    protected abstract String getSelectUnpublishedSql();
}
