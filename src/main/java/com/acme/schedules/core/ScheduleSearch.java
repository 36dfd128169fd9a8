package com.acme.schedules.core;

/**
 * Search filters. Null name or state means no filter on that column.
 */
public record ScheduleSearch(String name, ScheduleState state, int limit) {

    public static ScheduleSearch latest(int limit) {
        return new ScheduleSearch(null, null, limit);
    }

    public ScheduleSearch withName(String name) {
        return new ScheduleSearch(name, state, limit);
    }

    public ScheduleSearch withState(ScheduleState state) {
        return new ScheduleSearch(name, state, limit);
    }
}
