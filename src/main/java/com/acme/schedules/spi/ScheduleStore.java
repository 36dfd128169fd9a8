package com.acme.schedules.spi;

import com.acme.schedules.core.Result;
import com.acme.schedules.core.Schedule;
import com.acme.schedules.core.ScheduleProps;
import com.acme.schedules.core.ScheduleSearch;
import com.acme.schedules.core.ScheduleState;
import com.acme.schedules.core.ScheduleUpdate;
import java.util.List;

/**
 * Authoritative store of job schedules. No method throws for storage faults;
 * every failure is returned as {@link Result.Err}.
 */
public interface ScheduleStore {

    /** Creates a STARTED schedule starting now. */
    Result<Schedule> create(ScheduleProps props);

    /** Fetches one schedule by id, including soft-deleted ones. */
    Result<Schedule> get(String id);

    /** Moves a schedule along a legal edge of the state machine. */
    Result<Schedule> transitionState(String id, ScheduleState to);

    /** Writes the supplied fields only; always refreshes {@code updatedAt}. */
    Result<Schedule> update(String id, ScheduleUpdate update);

    /** Soft-deletes a schedule from any state. Repeating it is a no-op. */
    Result<Schedule> remove(String id);

    Result<List<Schedule>> search(ScheduleSearch search);
}
