/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.iiif.stats;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.event.DerivativeTaskEvent;
import org.fireflyframework.iiif.model.FailureKind;
import org.springframework.context.event.EventListener;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe tracker of orchestrator task outcomes.
 *
 * <p>Counts successes and failures per task name (derivative label or {@code palette}) and
 * failures per {@link FailureKind}. Since manifests only reveal failures by omission, this
 * gives operators an aggregate view across batches.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * statsTracker.recordSuccess("b");
 * statsTracker.recordFailure("d", FailureKind.DERIVATIVE_PROCESSING);
 *
 * ProcessingStatsReport report = statsTracker.getReport();
 * }</pre>
 *
 * @see ProcessingStatsReport
 */
@Slf4j
public class ProcessingStatsTracker {

    private final Map<String, AtomicLong> successCounts = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> failureCounts = new ConcurrentHashMap<>();
    private final Map<FailureKind, AtomicLong> failureKindCounts = new ConcurrentHashMap<>();

    /**
     * Records the outcome carried by a task event.
     *
     * @param event the task event
     */
    @EventListener
    public void onTaskCompleted(DerivativeTaskEvent event) {
        if (event.isSuccess()) {
            recordSuccess(event.getTask());
        } else {
            recordFailure(event.getTask(), event.getFailureKind());
        }
    }

    public void recordSuccess(String task) {
        successCounts.computeIfAbsent(task, k -> new AtomicLong(0)).incrementAndGet();
    }

    public void recordFailure(String task, FailureKind kind) {
        failureCounts.computeIfAbsent(task, k -> new AtomicLong(0)).incrementAndGet();
        if (kind != null) {
            failureKindCounts.computeIfAbsent(kind, k -> new AtomicLong(0)).incrementAndGet();
        }
        log.debug("Recorded failure of task '{}' ({})", task, kind);
    }

    /**
     * Generates a report with per-task breakdown.
     *
     * @return the stats report
     */
    public ProcessingStatsReport getReport() {
        Map<String, ProcessingStatsReport.TaskStats> tasks = new TreeMap<>();
        successCounts.keySet().forEach(task -> tasks.put(task, taskStats(task)));
        failureCounts.keySet().forEach(task -> tasks.put(task, taskStats(task)));

        Map<FailureKind, Long> failuresByKind = new EnumMap<>(FailureKind.class);
        failureKindCounts.forEach((kind, count) -> failuresByKind.put(kind, count.get()));

        return ProcessingStatsReport.builder()
                .tasks(tasks)
                .totalSucceeded(sum(successCounts))
                .totalFailed(sum(failureCounts))
                .failuresByKind(failuresByKind)
                .generatedAt(Instant.now())
                .build();
    }

    /**
     * Clears all counters.
     */
    public void reset() {
        successCounts.clear();
        failureCounts.clear();
        failureKindCounts.clear();
    }

    private ProcessingStatsReport.TaskStats taskStats(String task) {
        return ProcessingStatsReport.TaskStats.builder()
                .task(task)
                .succeeded(count(successCounts, task))
                .failed(count(failureCounts, task))
                .build();
    }

    private static long count(Map<String, AtomicLong> counts, String task) {
        AtomicLong count = counts.get(task);
        return count == null ? 0 : count.get();
    }

    private static long sum(Map<String, AtomicLong> counts) {
        return counts.values().stream()
                .mapToLong(AtomicLong::get)
                .sum();
    }
}
