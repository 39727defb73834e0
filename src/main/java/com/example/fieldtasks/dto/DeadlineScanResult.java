package com.example.fieldtasks.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one deadline scan run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadlineScanResult {
    private Instant scannedAt;
    private Instant horizon;
    private int candidates;
    private int alerted;
    private int skipped;
    private int failed;
    private List<UUID> alertedTaskIds;
}
