package com.moodsentinel.core.store;

import com.moodsentinel.core.config.StoreSettings;
import com.moodsentinel.core.model.Alert;
import com.moodsentinel.core.model.AlertType;
import com.moodsentinel.core.model.CandidateAlert;
import com.moodsentinel.core.model.DeliveryStatus;
import com.moodsentinel.core.model.Severity;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC implementation of {@link AlertStore} (H2 by default, PostgreSQL
 * compatible SQL).
 *
 * <p>
 * Every operation is a single statement on its own auto-committed
 * connection, so inserts and batch updates are atomic: either every matching
 * row changes or none does. Mark operations carry {@code status = 'PENDING'}
 * in their predicate, which makes them idempotent and lets racing coordinators
 * account each row exactly once.
 * </p>
 *
 * <p>
 * Timestamps are stored with microsecond precision in UTC.
 * </p>
 *
 * <p><b>Thread Safety:</b> safe for concurrent use; consistency comes from the
 * database.
 */
public class JdbcAlertStore implements AlertStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcAlertStore.class);

    private static final Map<String, String> SQL = SqlLoader.loadQueries("sql/queries.sql");
    private static final String SCHEMA = "sql/schema.sql";
    private static final String IDS_TOKEN = "{ids}";
    private static final String UNIQUE_VIOLATION = "23505";

    private final DataSource dataSource;
    private final Clock clock;

    /**
     * @param dataSource connection source; must not be {@code null}
     * @param clock      source of {@code createdAt}; must not be {@code null}
     */
    public JdbcAlertStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Open a store on an H2 data source and make sure the schema exists.
     *
     * @param settings connection settings
     * @param clock    source of {@code createdAt}
     * @return an initialised store
     * @throws StoreException if the schema cannot be created
     */
    public static JdbcAlertStore open(StoreSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "StoreSettings must not be null");
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL(settings.getJdbcUrl());
        ds.setUser(settings.getUsername());
        ds.setPassword(settings.getPassword());

        JdbcAlertStore store = new JdbcAlertStore(ds, clock);
        store.initSchema();
        return store;
    }

    /**
     * Create tables and indexes if they do not exist.
     *
     * @throws StoreException on failure
     */
    public void initSchema() {
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement()) {
            for (String ddl : SqlLoader.loadStatements(SCHEMA)) {
                stmt.execute(ddl);
            }
            LOG.info("Alert store schema initialized");
        } catch (SQLException e) {
            throw failure("initialize alert store schema", e);
        }
    }

    @Override
    public long persist(CandidateAlert candidate) {
        Objects.requireNonNull(candidate, "Candidate must not be null");
        Instant createdAt = now();

        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_alert"),
                        Statement.RETURN_GENERATED_KEYS)) {
            int idx = 1;
            stmt.setString(idx++, candidate.getSubjectId());
            stmt.setString(idx++, candidate.getType().name());
            stmt.setString(idx++, candidate.getSeverity().name());
            stmt.setInt(idx++, candidate.getSeverity().rank());
            stmt.setString(idx++, candidate.getSummary());
            stmt.setObject(idx++, toDb(createdAt));
            stmt.setObject(idx, toDb(candidate.getObservedAt().truncatedTo(ChronoUnit.MICROS)));
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new StoreException("No id generated for alert of " + candidate.getSubjectId());
                }
                long id = keys.getLong(1);
                LOG.debug("Persisted alert {} ({} {}) for {}",
                        id, candidate.getType(), candidate.getSeverity(), candidate.getSubjectId());
                return id;
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                LOG.info("Alert {} for {} observed at {} already stored",
                        candidate.getType(), candidate.getSubjectId(), candidate.getObservedAt());
                throw new DuplicateAlertException("Alert " + candidate.getType() + " for "
                        + candidate.getSubjectId() + " observed at " + candidate.getObservedAt()
                        + " already stored", e);
            }
            throw failure("persist alert for " + candidate.getSubjectId(), e);
        }
    }

    @Override
    public Optional<Alert> findByOrigin(String subjectId, AlertType type, Instant observedAt) {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(observedAt, "observedAt must not be null");
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SQL.get("select_by_origin"))) {
            stmt.setString(1, subjectId);
            stmt.setString(2, type.name());
            stmt.setObject(3, toDb(observedAt.truncatedTo(ChronoUnit.MICROS)));
            List<Alert> found = readAll(stmt);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw failure("look up " + type + " alert for " + subjectId, e);
        }
    }

    @Override
    public Optional<Alert> get(long id) {
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SQL.get("select_by_id"))) {
            stmt.setLong(1, id);
            List<Alert> found = readAll(stmt);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw failure("load alert " + id, e);
        }
    }

    @Override
    public List<Alert> history(String subjectId, Instant since) {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(since, "since must not be null");
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SQL.get("select_history"))) {
            stmt.setString(1, subjectId);
            stmt.setObject(2, toDb(since));
            return readAll(stmt);
        } catch (SQLException e) {
            throw failure("load alert history for " + subjectId, e);
        }
    }

    @Override
    public List<Alert> listUndelivered(Instant since, int limit) {
        Objects.requireNonNull(since, "since must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SQL.get("select_undelivered"))) {
            stmt.setObject(1, toDb(since));
            stmt.setInt(2, limit);
            return readAll(stmt);
        } catch (SQLException e) {
            throw failure("list undelivered alerts", e);
        }
    }

    @Override
    public int markDelivered(Collection<Long> ids, String channel, Instant sentAt) {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(sentAt, "sentAt must not be null");
        List<Long> distinct = distinct(ids);
        if (distinct.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(expandIds("mark_delivered", distinct.size()))) {
            stmt.setObject(1, toDb(sentAt.truncatedTo(ChronoUnit.MICROS)));
            stmt.setString(2, channel);
            bindIds(stmt, 3, distinct);
            int updated = stmt.executeUpdate();
            LOG.info("Marked {} of {} alert(s) as delivered via {}", updated, distinct.size(), channel);
            return updated;
        } catch (SQLException e) {
            throw failure("mark alerts delivered", e);
        }
    }

    @Override
    public int markFailed(Collection<Long> ids, String reason) {
        List<Long> distinct = distinct(ids);
        if (distinct.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(expandIds("mark_failed", distinct.size()))) {
            stmt.setString(1, truncate(reason));
            bindIds(stmt, 2, distinct);
            int updated = stmt.executeUpdate();
            LOG.warn("Marked {} alert(s) as failed: {}", updated, reason);
            return updated;
        } catch (SQLException e) {
            throw failure("mark alerts failed", e);
        }
    }

    @Override
    public int recordTransientFailure(Collection<Long> ids) {
        List<Long> distinct = distinct(ids);
        if (distinct.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(
                        expandIds("record_transient_failure", distinct.size()))) {
            bindIds(stmt, 1, distinct);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("record transient delivery failures", e);
        }
    }

    @Override
    public int failExhausted(Collection<Long> ids, int maxAttempts, String reason) {
        List<Long> distinct = distinct(ids);
        if (distinct.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(expandIds("fail_exhausted", distinct.size()))) {
            stmt.setString(1, truncate(reason));
            stmt.setInt(2, maxAttempts);
            bindIds(stmt, 3, distinct);
            int updated = stmt.executeUpdate();
            if (updated > 0) {
                LOG.warn("Gave up on {} alert(s) after {} delivery attempt(s)", updated, maxAttempts);
            }
            return updated;
        } catch (SQLException e) {
            throw failure("fail exhausted alerts", e);
        }
    }

    @Override
    public int expireStale(Instant before, String reason) {
        Objects.requireNonNull(before, "before must not be null");
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SQL.get("expire_stale"))) {
            stmt.setString(1, truncate(reason));
            stmt.setObject(2, toDb(before));
            int updated = stmt.executeUpdate();
            if (updated > 0) {
                LOG.warn("Expired {} pending alert(s) created before {}", updated, before);
            }
            return updated;
        } catch (SQLException e) {
            throw failure("expire stale alerts", e);
        }
    }

    @Override
    public int rearm(Collection<Long> ids) {
        List<Long> distinct = distinct(ids);
        if (distinct.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(expandIds("rearm", distinct.size()))) {
            bindIds(stmt, 1, distinct);
            int updated = stmt.executeUpdate();
            LOG.info("Re-armed {} failed alert(s) for delivery", updated);
            return updated;
        } catch (SQLException e) {
            throw failure("re-arm failed alerts", e);
        }
    }

    @Override
    public List<Alert> query(AlertQuery query) {
        Objects.requireNonNull(query, "Query must not be null");

        StringBuilder sql = new StringBuilder(SQL.get("select_alerts"));
        List<Object> params = new ArrayList<>();
        List<String> where = new ArrayList<>();

        query.getSubjectId().ifPresent(s -> {
            where.add("subject_id = ?");
            params.add(s);
        });
        query.getType().ifPresent(t -> {
            where.add("alert_type = ?");
            params.add(t.name());
        });
        query.getStatus().ifPresent(s -> {
            where.add("status = ?");
            params.add(s.name());
        });
        query.getFrom().ifPresent(f -> {
            where.add("created_at >= ?");
            params.add(toDb(f));
        });
        query.getTo().ifPresent(t -> {
            where.add("created_at < ?");
            params.add(toDb(t));
        });

        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?");
        params.add(query.getLimit());
        params.add(query.getOffset());

        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                stmt.setObject(i + 1, params.get(i));
            }
            return readAll(stmt);
        } catch (SQLException e) {
            throw failure("query alerts " + query, e);
        }
    }

    @Override
    public List<Alert> createdSince(Instant since) {
        Objects.requireNonNull(since, "since must not be null");
        try (Connection conn = dataSource.getConnection();
                PreparedStatement stmt = conn.prepareStatement(SQL.get("select_created_since"))) {
            stmt.setObject(1, toDb(since));
            return readAll(stmt);
        } catch (SQLException e) {
            throw failure("load alerts created since " + since, e);
        }
    }

    // ---------------------------------------------------------------
    // Mapping helpers
    // ---------------------------------------------------------------

    private static List<Alert> readAll(PreparedStatement stmt) throws SQLException {
        List<Alert> alerts = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                alerts.add(mapRow(rs));
            }
        }
        return alerts;
    }

    private static Alert mapRow(ResultSet rs) throws SQLException {
        return Alert.builder()
                .id(rs.getLong("id"))
                .subjectId(rs.getString("subject_id"))
                .type(AlertType.valueOf(rs.getString("alert_type")))
                .severity(Severity.valueOf(rs.getString("severity")))
                .summary(rs.getString("summary"))
                .createdAt(fromDb(rs.getObject("created_at", OffsetDateTime.class)))
                .observedAt(fromDb(rs.getObject("observed_at", OffsetDateTime.class)))
                .status(DeliveryStatus.valueOf(rs.getString("status")))
                .deliveredAt(fromDb(rs.getObject("delivered_at", OffsetDateTime.class)))
                .deliveryChannel(rs.getString("delivery_channel"))
                .build();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static OffsetDateTime toDb(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant fromDb(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }

    private static String expandIds(String queryName, int count) {
        return SQL.get(queryName).replace(IDS_TOKEN, String.join(", ", Collections.nCopies(count, "?")));
    }

    private static void bindIds(PreparedStatement stmt, int firstIndex, List<Long> ids) throws SQLException {
        int idx = firstIndex;
        for (Long id : ids) {
            stmt.setLong(idx++, id);
        }
    }

    private static List<Long> distinct(Collection<Long> ids) {
        Objects.requireNonNull(ids, "ids must not be null");
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() <= 500 ? reason : reason.substring(0, 500);
    }

    private static StoreException failure(String action, SQLException e) {
        LOG.error("Failed to {}: {}", action, e.getMessage(), e);
        return new StoreException("Failed to " + action, e);
    }
}
