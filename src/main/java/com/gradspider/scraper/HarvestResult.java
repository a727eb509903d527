package com.gradspider.scraper;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of one harvesting run.
 *
 * @param universityCode code of the harvested university
 * @param succeeded      accepted records in acceptance order
 * @param failed         tasks that produced no record
 * @param duplicates     records rejected by the deduplicator
 * @param taskCount      tasks found by the list scan
 * @param elapsed        wall time of the run, teardown included
 * @param cancelled      whether the run signal was raised before the backlog was exhausted
 */
public record HarvestResult(
    String universityCode,
    List<RawRecord> succeeded,
    List<FailedTask> failed,
    int duplicates,
    int taskCount,
    Duration elapsed,
    boolean cancelled
) {
    public HarvestResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public Map<ExtractionErrorKind, Long> failuresByKind() {
        return failed.stream().collect(Collectors.groupingBy(FailedTask::kind,
            () -> new EnumMap<>(ExtractionErrorKind.class), Collectors.counting()));
    }

    public List<FailedTask> failuresOf(ExtractionErrorKind kind) {
        return failed.stream().filter(f -> f.kind() == kind).toList();
    }

    /**
     * One line for the log, e.g. {@code HK001: 4 programs, 1 failed {TIMEOUT=1}, 0 duplicates, 5 tasks in 3.2s}.
     */
    public String summary() {
        String failures = failed.isEmpty() ? "" : " " + failuresByKind();
        return String.format(Locale.ROOT, "%s: %d programs, %d failed%s, %d duplicates, %d tasks in %.1fs%s",
            universityCode, succeeded.size(), failed.size(), failures, duplicates, taskCount,
            elapsed.toMillis() / 1000.0, cancelled ? " (cancelled)" : "");
    }
}
