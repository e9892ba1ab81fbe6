package com.example.presence.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a scheduled or manually triggered job run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRunResult {
    private String job;
    private int processed;
    private int succeeded;
    private int failed;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
    private boolean dryRun;
    private boolean fatal;

    /**
     * 200 when nothing failed, 500 when the run itself aborted, 207 otherwise.
     */
    public HttpStatus httpStatus() {
        if (fatal) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (failed == 0 && errors.isEmpty()) {
            return HttpStatus.OK;
        }
        return HttpStatus.MULTI_STATUS;
    }
}
