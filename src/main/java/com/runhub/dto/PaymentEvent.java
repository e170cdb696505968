package com.runhub.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.time.Instant;

/**
 * A payment/conversion event, as delivered by webhook ingestion.
 *
 * Example JSON:
 * {
 *   "paymentEventId": "evt_pay_551",
 *   "projectId": "proj_42",
 *   "occurredAt": "2026-03-01T10:15:00Z",
 *   "amountCents": 4900,
 *   "currency": "usd"
 * }
 *
 * - paymentEventId: unique per payment; the attribution key
 * - occurredAt:     lookback window anchor; defaults to "now" when absent
 * - currency:       three-letter ISO-4217 code, any case; stored upper-cased
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class PaymentEvent {

    @NotBlank(message = "paymentEventId is required")
    private String paymentEventId;

    @NotBlank(message = "projectId is required")
    private String projectId;

    private Instant occurredAt;

    @NotNull(message = "amountCents is required")
    @PositiveOrZero(message = "amountCents must not be negative")
    private Long amountCents;

    @NotBlank(message = "currency is required")
    @Pattern(regexp = "^[A-Za-z]{3}$", message = "currency must be a three-letter ISO-4217 code")
    private String currency;
}
