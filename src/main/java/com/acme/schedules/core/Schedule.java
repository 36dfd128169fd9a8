package com.acme.schedules.core;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A recurring job schedule as seen by callers of the store.
 * {@code deletedAt} is null unless {@code state} is {@link ScheduleState#DELETED}.
 */
public record Schedule(
    String id,
    String name,
    ScheduleState state,
    Instant startsAt,
    long frequencyMs,
    JsonNode payload,
    Instant createdAt,
    Instant updatedAt,
    Instant deletedAt
) {}
