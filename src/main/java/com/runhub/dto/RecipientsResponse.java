package com.runhub.dto;

import lombok.*;

import java.util.List;

/**
 * excludedCount counts distinct candidates held back by the cooldown.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RecipientsResponse {
    private String actionId;
    private List<String> eligible;
    private int excludedCount;
}
