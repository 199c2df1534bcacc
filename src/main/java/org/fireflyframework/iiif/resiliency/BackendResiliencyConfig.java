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

package org.fireflyframework.iiif.resiliency;

import lombok.Data;

/**
 * Resilience settings for one image or report backend.
 *
 * <p>Everything is disabled by default: backend calls run undecorated and without a deadline.</p>
 */
@Data
public class BackendResiliencyConfig {

    private boolean retryEnabled = false;
    private int retryMaxAttempts = 3;
    private long retryWaitDurationMs = 500;

    private boolean bulkheadEnabled = false;
    private int bulkheadMaxConcurrentCalls = 16;
    private long bulkheadMaxWaitDurationMs = 0;

    /** Deadline for a single call; {@code 0} disables it. */
    private long timeoutMs = 0;
}
