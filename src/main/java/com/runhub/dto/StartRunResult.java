package com.runhub.dto;

import com.runhub.model.WorkflowRun;
import lombok.*;

/**
 * Result of startRun: the surviving run, and whether this call replayed an
 * existing one (deduplicated = true) instead of inserting it.
 */
@Getter @AllArgsConstructor
public class StartRunResult {
    private final WorkflowRun run;
    private final boolean deduplicated;
}
