package com.acme.schedules.core;

public enum ScheduleState {
    STARTED,
    PAUSED,
    DELETED
}
