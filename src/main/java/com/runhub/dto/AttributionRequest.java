package com.runhub.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AttributionRequest {

    @Valid
    @NotNull(message = "payment is required")
    private PaymentEvent payment;

    @Valid
    private List<MatchCandidate> candidates;
}
