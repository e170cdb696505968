package com.runhub.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative strength of the evidence linking a payment to a run.
 * Declared strongest first; {@link Enum#ordinal()} order is relied upon.
 */
public enum AttributionConfidence {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isStrongerThan(AttributionConfidence other) {
        return other == null || ordinal() < other.ordinal();
    }
}
