package com.runhub.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RecipientsRequest {

    @NotBlank(message = "actionId is required")
    private String actionId;

    @NotNull(message = "candidates is required")
    private List<String> candidates;

    // null = configured default cooldown, 0 = no cooldown
    @PositiveOrZero(message = "cooldownHours must not be negative")
    private Long cooldownHours;
}
