package com.runhub.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of one delivery attempt to one recipient.
 * SENT       → the e-mail collaborator accepted the message
 * FAILED     → delivery was attempted and failed
 * SUPPRESSED → the recipient is on a suppression list and was skipped
 *
 * Only SENT rows count towards the recipient cooldown.
 */
public enum SendStatus {
    SENT,
    FAILED,
    SUPPRESSED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SendStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("send status is required");
        }
        for (SendStatus status : values()) {
            if (status.value().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown send status: " + value);
    }
}
