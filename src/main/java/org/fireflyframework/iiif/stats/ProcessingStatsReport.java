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

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.iiif.model.FailureKind;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of task outcomes collected by {@link ProcessingStatsTracker}.
 */
@Data
@Builder
public class ProcessingStatsReport {

    private final Map<String, TaskStats> tasks;
    private final long totalSucceeded;
    private final long totalFailed;
    private final Map<FailureKind, Long> failuresByKind;
    private final Instant generatedAt;

    /**
     * Outcome counts of one task name.
     */
    @Data
    @Builder
    public static class TaskStats {
        private final String task;
        private final long succeeded;
        private final long failed;
    }
}
