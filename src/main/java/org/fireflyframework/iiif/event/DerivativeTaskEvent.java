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

package org.fireflyframework.iiif.event;

import lombok.Data;
import org.fireflyframework.iiif.model.FailureKind;

import java.time.Instant;

/**
 * Event published by the {@link org.fireflyframework.iiif.process.DerivativeOrchestrator}
 * each time one of its tasks finishes, whether it succeeded or not.
 *
 * <p>Processing a source against {@code N} instructions publishes exactly {@code N + 1}
 * of these events: one per label and one for the palette task.</p>
 */
@Data
public class DerivativeTaskEvent {

    private final String source;
    private final String task;
    private final boolean success;
    private final FailureKind failureKind;
    private final Instant timestamp;

    public DerivativeTaskEvent(String source, String task, boolean success, FailureKind failureKind) {
        this.source = source;
        this.task = task;
        this.success = success;
        this.failureKind = failureKind;
        this.timestamp = Instant.now();
    }

    public static DerivativeTaskEvent succeeded(String source, String task) {
        return new DerivativeTaskEvent(source, task, true, null);
    }

    public static DerivativeTaskEvent failed(String source, String task, FailureKind kind) {
        return new DerivativeTaskEvent(source, task, false, kind);
    }
}
