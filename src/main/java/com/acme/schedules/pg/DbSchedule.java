package com.acme.schedules.pg;

import com.acme.schedules.core.Jsons;
import com.acme.schedules.core.Schedule;
import com.acme.schedules.core.ScheduleState;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import org.postgresql.util.PGInterval;

/**
 * Storage shape of a schedule row in the {@code schedules} table.
 */
record DbSchedule(
    String id,
    String name,
    String state,
    Timestamp startsAt,
    String frequency,
    String payload,
    Timestamp createdAt,
    Timestamp updatedAt,
    Timestamp deletedAt
) {
    static final String TABLE = "schedules";
    static final String COLUMNS = "id, name, state, starts_at, frequency, payload, created_at, updated_at, deleted_at";

    static DbSchedule to(Schedule schedule) {
        return new DbSchedule(
            schedule.id(),
            schedule.name(),
            schedule.state().name(),
            timestamp(schedule.startsAt()),
            Intervals.toLiteral(schedule.frequencyMs()),
            Jsons.toJson(schedule.payload()),
            timestamp(schedule.createdAt()),
            timestamp(schedule.updatedAt()),
            timestamp(schedule.deletedAt())
        );
    }

    /** Reads the current row; columns are looked up by name. */
    static Schedule from(ResultSet rs) throws SQLException {
        return new Schedule(
            rs.getString("id"),
            rs.getString("name"),
            ScheduleState.valueOf(rs.getString("state")),
            instant(rs.getTimestamp("starts_at")),
            Intervals.toMillis((PGInterval) rs.getObject("frequency")),
            Jsons.fromJson(rs.getString("payload")),
            instant(rs.getTimestamp("created_at")),
            instant(rs.getTimestamp("updated_at")),
            instant(rs.getTimestamp("deleted_at"))
        );
    }

    static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
