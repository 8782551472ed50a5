package com.di.silverline.coordinator;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome list of one coordinator run plus aggregates. Whether failed tables fail the run as a
 * whole is the caller's decision; {@link #hasFailures()} is offered for that.
 */
@Value
@Builder
public class RunSummary {

    String runId;
    LocalDate logicalDate;
    Instant startedAt;
    Instant finishedAt;
    @Singular
    List<IngestionOutcome> outcomes;

    public Map<OutcomeStatus, Long> getStatusCounts() {
        Map<OutcomeStatus, Long> counts = new EnumMap<>(OutcomeStatus.class);
        for (OutcomeStatus status : OutcomeStatus.values()) {
            counts.put(status, 0L);
        }
        outcomes.forEach(o -> counts.merge(o.getStatus(), 1L, Long::sum));
        return counts;
    }

    public long getTotalRowsAffected() {
        return outcomes.stream().mapToLong(IngestionOutcome::getRowsAffected).sum();
    }

    public long getDurationMs() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    @JsonProperty("hasFailures")
    public boolean hasFailures() {
        return outcomes.stream().anyMatch(IngestionOutcome::isFailed);
    }
}
