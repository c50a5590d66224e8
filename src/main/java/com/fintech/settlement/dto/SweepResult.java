package com.fintech.settlement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Statistics of one scheduled sweep (renewals, dunning, expiry).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepResult {

    private String sweep;
    private Instant startedAt;
    private Instant completedAt;

    @Builder.Default
    private int examined = 0;

    @Builder.Default
    private int acted = 0;

    @Builder.Default
    private int skipped = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<String> errorDetails = new ArrayList<>();

    public void incrementExamined() {
        this.examined++;
    }

    public void incrementActed() {
        this.acted++;
    }

    public void incrementSkipped() {
        this.skipped++;
    }

    public void addError(Object id, String message) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(id + ": " + message);
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
