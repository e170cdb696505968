package com.runhub.dto;

import com.runhub.model.MatchMethod;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.UUID;

/**
 * A run the caller believes may have caused a payment, and how it matched.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MatchCandidate {

    @NotNull(message = "runId is required")
    private UUID runId;

    @NotNull(message = "matchMethod is required")
    private MatchMethod matchMethod;
}
