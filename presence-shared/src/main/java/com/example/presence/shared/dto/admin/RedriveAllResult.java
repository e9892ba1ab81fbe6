package com.example.presence.shared.dto.admin;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Summary of a redrive-all request over dead-lettered delivery records.
 */
@Data
@Builder
public class RedriveAllResult {
    private int totalRecords;
    private int successCount;
    private int failureCount;
    private List<RedriveFailureDetail> failures;
}
