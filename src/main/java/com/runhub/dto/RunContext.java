package com.runhub.dto;

import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * Caller-supplied details recorded with a new run.
 * Ignored on replay: a deduplicated start returns the run exactly as first stored.
 *
 * - triggeredBy:            actor that requested the run (user id, "system", ...)
 * - params:                 free-form action parameters, persisted as JSON
 * - locale:                 merged into params as "locale" when present
 * - clientRequestedAt:      when the client clicked, if it told us
 * - recipientCountEstimate: audience size the client previewed
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RunContext {

    private String triggeredBy;
    private Map<String, Object> params;
    private String locale;
    private Instant clientRequestedAt;
    private Integer recipientCountEstimate;
}
