package com.runhub.dto;

import com.runhub.model.SendStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RecordSendRequest {

    @NotBlank(message = "email is required")
    private String email;

    @NotNull(message = "status is required")
    private SendStatus status;
}
