package com.proveground.matchengine.availability;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative availability of a student during one week.
 */
public enum AvailabilityLevel {

    HIGH,
    MEDIUM,
    LOW,
    /** No free hours, or away for the whole week. */
    NONE;

    @JsonValue
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
