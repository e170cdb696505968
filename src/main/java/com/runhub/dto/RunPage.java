package com.runhub.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

/**
 * One page of runs, newest first. nextCursor identifies the last run on the page
 * as "{createdAt}_{id}" and is only present when older runs exist.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunPage {
    private List<WorkflowRunResponse> runs;
    private String nextCursor;
}
