package com.acme.schedules.pg;

import com.acme.schedules.config.SchedulesConfig;
import com.acme.schedules.core.Jsons;
import com.acme.schedules.core.Result;
import com.acme.schedules.core.Schedule;
import com.acme.schedules.core.ScheduleProps;
import com.acme.schedules.core.ScheduleSearch;
import com.acme.schedules.core.ScheduleState;
import com.acme.schedules.core.ScheduleStateTransition;
import com.acme.schedules.core.ScheduleStoreException;
import com.acme.schedules.core.ScheduleUpdate;
import com.acme.schedules.spi.ScheduleStore;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import io.micronaut.data.connection.ConnectionOperations;
import jakarta.inject.Singleton;
import java.sql.*;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ScheduleStore on PostgreSQL.
 * <p>
 * Ids are UUIDv7 strings generated here; collisions are not checked. State changes
 * are conditional on the state that was validated, so a concurrent transition makes
 * the later writer fail with NO_ROWS_AFFECTED instead of overwriting.
 */
@Singleton
public class PgScheduleStore implements ScheduleStore {
    private static final Logger LOG = LoggerFactory.getLogger(PgScheduleStore.class);
    private static final TimeBasedEpochGenerator IDS = Generators.timeBasedEpochGenerator();

    private static final String INSERT =
        "insert into " + DbSchedule.TABLE + "(" + DbSchedule.COLUMNS + ") " +
        "values (?,?,?,?,?::interval,?::json,?,?,?) returning " + DbSchedule.COLUMNS;
    private static final String SELECT_BY_ID =
        "select " + DbSchedule.COLUMNS + " from " + DbSchedule.TABLE + " where id=?";
    private static final String TRANSITION =
        "update " + DbSchedule.TABLE + " set state=?, updated_at=? where id=? and state=? returning " + DbSchedule.COLUMNS;
    private static final String TRANSITION_TO_DELETED =
        "update " + DbSchedule.TABLE + " set state=?, updated_at=?, deleted_at=? where id=? and state=? returning " + DbSchedule.COLUMNS;
    // deleted_at is stamped once; repeating the delete leaves both timestamps alone
    private static final String REMOVE =
        "update " + DbSchedule.TABLE + " set state='DELETED', " +
        "deleted_at=coalesce(deleted_at, ?::timestamptz), " +
        "updated_at=case when deleted_at is null then ?::timestamptz else updated_at end " +
        "where id=? returning " + DbSchedule.COLUMNS;

    private final ConnectionOperations<Connection> connectionOps;
    private final Clock clock;
    private final SchedulesConfig config;

    public PgScheduleStore(ConnectionOperations<Connection> connectionOps, Clock clock, SchedulesConfig config) {
        this.connectionOps = connectionOps;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public Result<Schedule> create(ScheduleProps props) {
        if (props == null) {
            return Result.err(ScheduleStoreException.invalidArgument("Error: schedule properties must not be null"));
        }
        if (props.name() == null || props.name().isBlank()) {
            return Result.err(ScheduleStoreException.invalidArgument("Error: schedule name must not be blank"));
        }
        if (props.frequencyMs() <= 0) {
            return Result.err(ScheduleStoreException.invalidArgument(
                "Error: schedule '" + props.name() + "' frequency must be positive, was " + props.frequencyMs()));
        }
        Instant now = now();
        DbSchedule row;
        try {
            row = DbSchedule.to(new Schedule(
                IDS.generate().toString(),
                props.name(),
                ScheduleState.STARTED,
                now,
                props.frequencyMs(),
                props.payload() == null ? NullNode.getInstance() : props.payload(),
                now,
                now,
                null
            ));
        } catch (IllegalArgumentException e) {
            return Result.err(new ScheduleStoreException(ScheduleStoreException.Kind.INVALID_ARGUMENT,
                "Error creating schedule '" + props.name() + "': " + e.getMessage(), e));
        }
        return guarded("Error creating schedule '" + props.name() + "'", () -> {
            Optional<Schedule> inserted = writeOne(INSERT, ps -> {
                ps.setString(1, row.id());
                ps.setString(2, row.name());
                ps.setString(3, row.state());
                ps.setTimestamp(4, row.startsAt());
                ps.setString(5, row.frequency());
                ps.setString(6, row.payload());
                ps.setTimestamp(7, row.createdAt());
                ps.setTimestamp(8, row.updatedAt());
                ps.setTimestamp(9, row.deletedAt());
            });
            if (inserted.isEmpty()) {
                return Result.err(ScheduleStoreException.noRowsAffected("Error: no schedule '" + props.name() + "' created"));
            }
            return Result.ok(inserted.get());
        });
    }

    @Override
    public Result<Schedule> get(String id) {
        return guarded("Error getting schedule '" + id + "'", () -> {
            Optional<Schedule> found = readOne(SELECT_BY_ID, ps -> ps.setString(1, id));
            if (found.isEmpty()) {
                return Result.err(ScheduleStoreException.notFound("Error: no schedule '" + id + "' found"));
            }
            return Result.ok(found.get());
        });
    }

    @Override
    public Result<Schedule> transitionState(String id, ScheduleState to) {
        Result<Schedule> current = get(id);
        if (current.isErr()) {
            return current;
        }
        ScheduleState from = current.value().state();
        Result<ScheduleStateTransition> transition = ScheduleStateTransition.validate(from, to);
        if (transition.isErr()) {
            return Result.err(transition.error());
        }
        Timestamp now = DbSchedule.timestamp(now());
        String sql = to == ScheduleState.DELETED ? TRANSITION_TO_DELETED : TRANSITION;
        return guarded("Error transitioning schedule '" + id + "'", () -> {
            Optional<Schedule> updated = writeOne(sql, ps -> {
                int i = 1;
                ps.setString(i++, to.name());
                ps.setTimestamp(i++, now);
                if (to == ScheduleState.DELETED) {
                    ps.setTimestamp(i++, now);
                }
                ps.setString(i++, id);
                ps.setString(i, from.name());
            });
            if (updated.isEmpty()) {
                return Result.err(ScheduleStoreException.noRowsAffected(
                    "Error: schedule '" + id + "' was not transitioned from " + from + " to " + to
                        + ", its state changed concurrently"));
            }
            return Result.ok(updated.get());
        });
    }

    @Override
    public Result<Schedule> update(String id, ScheduleUpdate update) {
        if (update == null) {
            return Result.err(ScheduleStoreException.invalidArgument(
                "Error: update of schedule '" + id + "' must not be null"));
        }
        if (update.frequencyMs() != null && update.frequencyMs() <= 0) {
            return Result.err(ScheduleStoreException.invalidArgument(
                "Error: schedule '" + id + "' frequency must be positive, was " + update.frequencyMs()));
        }
        var sql = new StringBuilder("update " + DbSchedule.TABLE + " set updated_at=?");
        if (update.frequencyMs() != null) {
            sql.append(", frequency=?::interval");
        }
        if (update.payload() != null) {
            sql.append(", payload=?::json");
        }
        sql.append(" where id=? returning ").append(DbSchedule.COLUMNS);
        String payloadJson;
        try {
            payloadJson = update.payload() == null ? null : Jsons.toJson(update.payload());
        } catch (IllegalArgumentException e) {
            return Result.err(new ScheduleStoreException(ScheduleStoreException.Kind.INVALID_ARGUMENT,
                "Error updating schedule '" + id + "': " + e.getMessage(), e));
        }
        Timestamp now = DbSchedule.timestamp(now());

        return guarded("Error updating schedule '" + id + "'", () -> {
            Optional<Schedule> updated = writeOne(sql.toString(), ps -> {
                int i = 1;
                ps.setTimestamp(i++, now);
                if (update.frequencyMs() != null) {
                    ps.setString(i++, Intervals.toLiteral(update.frequencyMs()));
                }
                if (payloadJson != null) {
                    ps.setString(i++, payloadJson);
                }
                ps.setString(i, id);
            });
            if (updated.isEmpty()) {
                return Result.err(ScheduleStoreException.notFound("Error: no schedule '" + id + "' updated"));
            }
            return Result.ok(updated.get());
        });
    }

    @Override
    public Result<Schedule> remove(String id) {
        Timestamp now = DbSchedule.timestamp(now());
        return guarded("Error deleting schedule '" + id + "'", () -> {
            Optional<Schedule> deleted = writeOne(REMOVE, ps -> {
                ps.setTimestamp(1, now);
                ps.setTimestamp(2, now);
                ps.setString(3, id);
            });
            if (deleted.isEmpty()) {
                return Result.err(ScheduleStoreException.notFound("Error: no schedule '" + id + "' deleted"));
            }
            return Result.ok(deleted.get());
        });
    }

    @Override
    public Result<List<Schedule>> search(ScheduleSearch search) {
        if (search == null) {
            return Result.err(ScheduleStoreException.invalidArgument("Error: search criteria must not be null"));
        }
        if (search.limit() < 0) {
            return Result.err(ScheduleStoreException.invalidArgument(
                "Error: search limit must not be negative, was " + search.limit()));
        }
        int limit = Math.min(search.limit(), config.getSearch().getMaxLimit());
        var sql = new StringBuilder("select " + DbSchedule.COLUMNS + " from " + DbSchedule.TABLE);
        List<String> conditions = new ArrayList<>();
        if (search.name() != null) {
            conditions.add("name=?");
        }
        if (search.state() != null) {
            conditions.add("state=?");
        }
        if (!conditions.isEmpty()) {
            sql.append(" where ").append(String.join(" and ", conditions));
        }
        // UUIDv7 text sorts by creation time
        sql.append(" order by id desc limit ?");

        return guarded("Error searching schedules", () -> Result.ok(readMany(sql.toString(), ps -> {
            int i = 1;
            if (search.name() != null) {
                ps.setString(i++, search.name());
            }
            if (search.state() != null) {
                ps.setString(i++, search.state().name());
            }
            ps.setInt(i, limit);
        })));
    }

    private Instant now() {
        // postgres keeps microseconds
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private <T> Result<T> guarded(String context, Supplier<Result<T>> op) {
        try {
            return op.get();
        } catch (RuntimeException e) {
            LOG.debug("{} failed", context, e);
            return Result.err(ScheduleStoreException.storageFailure(context, e));
        }
    }

    private Optional<Schedule> writeOne(String sql, SqlApplier a) {
        return connectionOps.executeWrite(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(DbSchedule.from(rs)) : Optional.<Schedule>empty();
                }
            } catch (SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    private Optional<Schedule> readOne(String sql, SqlApplier a) {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                try (var rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(DbSchedule.from(rs)) : Optional.<Schedule>empty();
                }
            } catch (SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    private List<Schedule> readMany(String sql, SqlApplier a) {
        return connectionOps.executeRead(status -> {
            try (var ps = status.getConnection().prepareStatement(sql)) {
                a.apply(ps);
                try (var rs = ps.executeQuery()) {
                    List<Schedule> result = new ArrayList<>();
                    while (rs.next()) {
                        result.add(DbSchedule.from(rs));
                    }
                    return result;
                }
            } catch (SQLException e) {
                throw new RuntimeException(e);
            }
        });
    }

    interface SqlApplier {
        void apply(PreparedStatement ps) throws SQLException;
    }
}
