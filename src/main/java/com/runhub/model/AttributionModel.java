package com.runhub.model;

import java.time.Duration;

/**
 * Attribution policies. Only last-touch with a 48 hour lookback exists today:
 * the most recent eligible run within the window before the payment is credited.
 */
public enum AttributionModel {
    LAST_TOUCH_48H("last_touch_48h", Duration.ofHours(48));

    private final String tag;
    private final Duration lookback;

    AttributionModel(String tag, Duration lookback) {
        this.tag = tag;
        this.lookback = lookback;
    }

    public String getTag() {
        return tag;
    }

    public Duration getLookback() {
        return lookback;
    }
}
