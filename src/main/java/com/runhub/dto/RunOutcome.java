package com.runhub.dto;

import com.runhub.model.AttributionConfidence;
import com.runhub.model.MatchMethod;
import lombok.*;

/**
 * Conversions credited to one run, aggregated over its attributions.
 *
 * Example:
 * {
 *   "model": "last_touch_48h",
 *   "windowHours": 48,
 *   "conversions": 3,
 *   "revenueCents": 14700,
 *   "currency": "USD",
 *   "confidence": "high",
 *   "matchedBy": "link"
 * }
 *
 * confidence and matchedBy report the strongest evidence among the attributions.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RunOutcome {
    private String model;
    private long windowHours;
    private int conversions;
    private long revenueCents;
    private String currency;
    private AttributionConfidence confidence;
    private MatchMethod matchedBy;
}
