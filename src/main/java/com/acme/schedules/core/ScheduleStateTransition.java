package com.acme.schedules.core;

import java.util.Set;

/**
 * A legal edge of the schedule state machine. DELETED is terminal.
 */
public record ScheduleStateTransition(ScheduleState from, ScheduleState to) {

    public static final Set<ScheduleStateTransition> VALID = Set.of(
        new ScheduleStateTransition(ScheduleState.STARTED, ScheduleState.PAUSED),
        new ScheduleStateTransition(ScheduleState.STARTED, ScheduleState.DELETED),
        new ScheduleStateTransition(ScheduleState.PAUSED, ScheduleState.STARTED)
    );

    public static Result<ScheduleStateTransition> validate(ScheduleState from, ScheduleState to) {
        var transition = new ScheduleStateTransition(from, to);
        if (VALID.contains(transition)) {
            return Result.ok(transition);
        }
        return Result.err(ScheduleStoreException.invalidTransition(
            "Invalid state transition from " + from + " to " + to));
    }
}
