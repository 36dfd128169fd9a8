package com.acme.schedules.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller-supplied fields of a new schedule. Everything else is assigned by the store.
 */
public record ScheduleProps(String name, long frequencyMs, JsonNode payload) {}
