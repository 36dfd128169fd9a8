package com.acme.schedules.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Partial update of a schedule. A null component is left unchanged; a JSON null
 * payload is written as {@code NullNode}.
 */
public record ScheduleUpdate(Long frequencyMs, JsonNode payload) {

    public static ScheduleUpdate frequency(long frequencyMs) {
        return new ScheduleUpdate(frequencyMs, null);
    }

    public static ScheduleUpdate payload(JsonNode payload) {
        return new ScheduleUpdate(null, payload);
    }

    public static ScheduleUpdate touch() {
        return new ScheduleUpdate(null, null);
    }
}
