package org.geoingest.service.scheduler;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TickSummary(Instant tickTime, List<TaskResult> results) {

    public static TickSummary empty(Instant tickTime) {
        return new TickSummary(tickTime, List.of());
    }

    public int dispatched() {
        return (int) results.stream().filter(result -> result.outcome() != Outcome.DEFERRED).count();
    }

    public long count(Outcome outcome) {
        return results.stream().filter(result -> result.outcome() == outcome).count();
    }

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        DEFERRED,
        SKIPPED
    }

    public record TaskResult(UUID sourceId, Outcome outcome, int recordCount, String error) {

        static TaskResult succeeded(UUID sourceId, int recordCount) {
            return new TaskResult(sourceId, Outcome.SUCCEEDED, recordCount, null);
        }

        static TaskResult failed(UUID sourceId, String error) {
            return new TaskResult(sourceId, Outcome.FAILED, 0, error);
        }

        static TaskResult deferred(UUID sourceId) {
            return new TaskResult(sourceId, Outcome.DEFERRED, 0, null);
        }

        static TaskResult skipped(UUID sourceId) {
            return new TaskResult(sourceId, Outcome.SKIPPED, 0, null);
        }
    }
}
