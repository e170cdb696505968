package com.runhub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a payment was matched to a candidate run, in descending confidence.
 * LINK   → the payment carried the run's tracking link          → HIGH
 * EMAIL  → the payer's e-mail received a send from the run      → MEDIUM
 * CART   → the payment closed a cart the run was recovering     → LOW
 * AMOUNT → the payment amount matched what the run promoted     → LOW
 */
public enum MatchMethod {
    LINK(AttributionConfidence.HIGH),
    EMAIL(AttributionConfidence.MEDIUM),
    CART(AttributionConfidence.LOW),
    AMOUNT(AttributionConfidence.LOW);

    private final AttributionConfidence confidence;

    MatchMethod(AttributionConfidence confidence) {
        this.confidence = confidence;
    }

    public AttributionConfidence confidence() {
        return confidence;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MatchMethod fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("match method is required");
        }
        for (MatchMethod method : values()) {
            if (method.value().equalsIgnoreCase(value.trim())) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown match method: " + value);
    }
}
