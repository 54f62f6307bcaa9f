package io.checkpoint.jdbc.store;

import io.checkpoint.SequenceNumber;
import io.checkpoint.jdbc.JdbcTemplate;
import io.checkpoint.jdbc.StoreException;
import io.checkpoint.jdbc.TableNames;
import io.checkpoint.jdbc.dialect.Dialect;
import io.checkpoint.jdbc.schema.ColumnDefinition;
import io.checkpoint.jdbc.schema.SchemaSynchronizer;
import io.checkpoint.jdbc.schema.TableDefinition;
import io.checkpoint.jdbc.tx.JdbcTransactionManager;
import io.checkpoint.spi.ConnectionProvider;
import io.checkpoint.spi.ProvidesSetup;
import io.checkpoint.subscription.DuplicateSubscriptionException;
import io.checkpoint.subscription.RunMode;
import io.checkpoint.subscription.Status;
import io.checkpoint.subscription.Subscription;
import io.checkpoint.subscription.SubscriptionCriteria;
import io.checkpoint.subscription.SubscriptionError;
import io.checkpoint.subscription.SubscriptionGroup;
import io.checkpoint.subscription.SubscriptionId;
import io.checkpoint.subscription.SubscriptionNotFoundException;
import io.checkpoint.subscription.SubscriptionStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * JDBC {@link SubscriptionStore}. Thread-safe; every call borrows its own connection.
 *
 * <p>The lock flag is a {@code locked} column flipped by conditional updates, so
 * {@link #acquireLock(SubscriptionId)} never blocks and never keeps a transaction open.
 */
public final class JdbcSubscriptionStore implements SubscriptionStore, ProvidesSetup {

    private static final String COLUMNS = "id, group_name, run_mode, status, position, locked, "
            + "error_message, error_previous_status, error_trace, retry_attempt, last_saved_at";

    private static final JdbcTemplate.RowMapper<Subscription> ROW_MAPPER = JdbcSubscriptionStore::mapRow;

    private final ConnectionProvider connectionProvider;
    private final JdbcTransactionManager txManager;
    private final Dialect dialect;
    private final String tableName;
    private final Clock clock;

    private JdbcSubscriptionStore(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.dialect = Objects.requireNonNull(builder.dialect, "dialect");
        this.tableName = TableNames.validate(builder.tableName);
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.txManager = new JdbcTransactionManager(connectionProvider);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String tableName() {
        return tableName;
    }

    @Override
    public Optional<Subscription> findOneById(SubscriptionId id) {
        Objects.requireNonNull(id, "id");
        try (Connection conn = connectionProvider.getConnection()) {
            return JdbcTemplate.queryOne(conn,
                    "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id = ?",
                    ROW_MAPPER, id.value());
        } catch (SQLException e) {
            throw new StoreException("Failed to find subscription " + id, e);
        }
    }

    @Override
    public List<Subscription> findByCriteria(SubscriptionCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria");
        if (criteria.matchesNothing()) {
            return List.of();
        }
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        criteria.ids().ifPresent(ids -> addInCondition("id", ids, SubscriptionId::value, conditions, params));
        criteria.groups().ifPresent(groups ->
                addInCondition("group_name", groups, SubscriptionGroup::value, conditions, params));
        criteria.statuses().ifPresent(statuses ->
                addInCondition("status", statuses, Status::name, conditions, params));

        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ").append(tableName);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY id");

        try (Connection conn = connectionProvider.getConnection()) {
            return JdbcTemplate.query(conn, sql.toString(), ROW_MAPPER, params.toArray());
        } catch (SQLException e) {
            throw new StoreException("Failed to find subscriptions matching " + criteria, e);
        }
    }

    @Override
    public boolean acquireLock(SubscriptionId id) {
        Objects.requireNonNull(id, "id");
        try (Connection conn = connectionProvider.getConnection()) {
            int updated = JdbcTemplate.update(conn,
                    "UPDATE " + tableName + " SET locked = ?, last_saved_at = ? WHERE id = ? AND locked = ?",
                    true, now(), id.value(), false);
            return updated == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to acquire lock of subscription " + id, e);
        }
    }

    @Override
    public void releaseLock(SubscriptionId id) {
        Objects.requireNonNull(id, "id");
        try (Connection conn = connectionProvider.getConnection()) {
            JdbcTemplate.update(conn,
                    "UPDATE " + tableName + " SET locked = ?, last_saved_at = ? WHERE id = ?",
                    false, now(), id.value());
        } catch (SQLException e) {
            throw new StoreException("Failed to release lock of subscription " + id, e);
        }
    }

    @Override
    public void add(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        SubscriptionError error = subscription.error();
        try (Connection conn = connectionProvider.getConnection()) {
            JdbcTemplate.update(conn,
                    "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    subscription.id().value(),
                    subscription.group().value(),
                    subscription.runMode().name(),
                    subscription.status().name(),
                    subscription.position().value(),
                    false,
                    error == null ? null : error.errorMessage(),
                    error == null || error.previousStatus() == null ? null : error.previousStatus().name(),
                    error == null ? null : error.errorTrace(),
                    subscription.retryAttempt(),
                    now());
        } catch (StoreException e) {
            if (dialect.isUniqueViolation(e.sqlException())) {
                throw new DuplicateSubscriptionException(subscription.id(), e.getCause());
            }
            throw e;
        } catch (SQLException e) {
            throw new StoreException("Failed to add subscription " + subscription.id(), e);
        }
    }

    @Override
    public Subscription update(SubscriptionId id, UnaryOperator<Subscription> transform) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(transform, "transform");
        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            Connection conn = tx.connection();
            Subscription current = JdbcTemplate.queryOne(conn,
                            "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id = ?",
                            ROW_MAPPER, id.value())
                    .orElseThrow(() -> new SubscriptionNotFoundException(id));

            Subscription next = Objects.requireNonNull(transform.apply(current), "transform result");
            if (!id.equals(next.id())) {
                throw new IllegalArgumentException("Update of subscription \"" + id
                        + "\" must not change its id to \"" + next.id() + "\"");
            }

            Instant savedAt = now();
            SubscriptionError error = next.error();
            JdbcTemplate.update(conn,
                    "UPDATE " + tableName + " SET group_name = ?, run_mode = ?, status = ?, position = ?, "
                            + "error_message = ?, error_previous_status = ?, error_trace = ?, "
                            + "retry_attempt = ?, last_saved_at = ? WHERE id = ?",
                    next.group().value(),
                    next.runMode().name(),
                    next.status().name(),
                    next.position().value(),
                    error == null ? null : error.errorMessage(),
                    error == null || error.previousStatus() == null ? null : error.previousStatus().name(),
                    error == null ? null : error.errorTrace(),
                    next.retryAttempt(),
                    savedAt,
                    id.value());
            tx.commit();
            return new Subscription(next.id(), next.group(), next.runMode(), next.status(), next.position(),
                    current.locked(), error, next.retryAttempt(), savedAt);
        } catch (SQLException e) {
            throw new StoreException("Failed to update subscription " + id, e);
        }
    }

    /**
     * Creates the table, adds missing columns and creates the {@code group_name} and
     * {@code status} indexes. Safe to run repeatedly.
     */
    @Override
    public void setup() {
        try (Connection conn = connectionProvider.getConnection()) {
            new SchemaSynchronizer(dialect).synchronize(conn, tableDefinition(tableName));
        } catch (SQLException e) {
            throw new StoreException("Failed to set up subscription table " + tableName, e);
        }
    }

    /**
     * Desired shape of the subscription table.
     */
    public static TableDefinition tableDefinition(String tableName) {
        return TableDefinition.builder(tableName)
                .column(ColumnDefinition.string("id", SubscriptionId.MAX_LENGTH))
                .column(ColumnDefinition.string("group_name", SubscriptionGroup.MAX_LENGTH))
                .column(ColumnDefinition.string("run_mode", 16))
                .column(ColumnDefinition.string("status", 32))
                .column(ColumnDefinition.bigint("position").withDefault("0"))
                .column(ColumnDefinition.bool("locked").withDefault("FALSE"))
                .column(ColumnDefinition.text("error_message").asNullable())
                .column(ColumnDefinition.string("error_previous_status", 32).asNullable())
                .column(ColumnDefinition.text("error_trace").asNullable())
                .column(ColumnDefinition.integer("retry_attempt").withDefault("0"))
                .column(ColumnDefinition.timestamp("last_saved_at").asNullable())
                .primaryKey("id")
                .index("group_name")
                .index("status")
                .build();
    }

    // columns keep microseconds; round up so the stamp is never earlier than the clock
    private Instant now() {
        Instant instant = clock.instant();
        Instant micros = instant.truncatedTo(ChronoUnit.MICROS);
        return micros.equals(instant) ? micros : micros.plus(1, ChronoUnit.MICROS);
    }

    private static <T> void addInCondition(String column, Collection<T> values, Function<T, String> toParam,
            List<String> conditions, List<Object> params) {
        conditions.add(column + " IN (" + values.stream().map(v -> "?").collect(Collectors.joining(", ")) + ")");
        values.stream().map(toParam).forEach(params::add);
    }

    private static Subscription mapRow(ResultSet rs) throws SQLException {
        String errorMessage = rs.getString("error_message");
        SubscriptionError error = null;
        if (errorMessage != null) {
            String previousStatus = rs.getString("error_previous_status");
            String trace = rs.getString("error_trace");
            error = new SubscriptionError(errorMessage,
                    previousStatus == null ? null : Status.valueOf(previousStatus),
                    trace == null ? "" : trace);
        }
        Timestamp lastSavedAt = rs.getTimestamp("last_saved_at");
        return new Subscription(
                SubscriptionId.of(rs.getString("id")),
                SubscriptionGroup.of(rs.getString("group_name")),
                RunMode.valueOf(rs.getString("run_mode")),
                Status.valueOf(rs.getString("status")),
                SequenceNumber.of(rs.getLong("position")),
                rs.getBoolean("locked"),
                error,
                rs.getInt("retry_attempt"),
                lastSavedAt == null ? null : lastSavedAt.toInstant());
    }

    /**
     * Builder for {@link JdbcSubscriptionStore}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private Dialect dialect;
        private String tableName = TableNames.DEFAULT_SUBSCRIPTION_TABLE;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder dialect(Dialect dialect) {
            this.dialect = dialect;
            return this;
        }

        /**
         * Optional. Defaults to {@value TableNames#DEFAULT_SUBSCRIPTION_TABLE}.
         */
        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        /**
         * Optional. Source of {@code lastSavedAt}; defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JdbcSubscriptionStore build() {
            return new JdbcSubscriptionStore(this);
        }
    }
}
