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

package org.fireflyframework.iiif.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A task that did not complete, as listed in {@link ProcessManifest#getFailures()}.
 *
 * <p>{@code task} is the derivative label, or {@value #PALETTE_TASK} for the palette task.</p>
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"task", "kind", "message"})
public class TaskFailure {

    public static final String PALETTE_TASK = "palette";

    String task;
    FailureKind kind;
    String message;

    public static TaskFailure of(String task, FailureKind kind, String message) {
        return TaskFailure.builder()
                .task(task)
                .kind(kind)
                .message(message)
                .build();
    }
}
