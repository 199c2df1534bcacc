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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of processing one source image against an {@link InstructionSet}.
 *
 * <p>{@code uris} and {@code dimensions} hold an entry only for labels whose task completed;
 * a missing label means the task failed. {@code palette} is present only when the palette
 * capability is enabled and its task succeeded. {@code failures} lists the tasks that did
 * not complete and is omitted from JSON when empty.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * {
 *   "uris": {"b": "avocado.png/full/!2048,1536/0/color.jpg"},
 *   "dimensions": {"b": [2048, 1536]}
 * }
 * }</pre>
 */
@Value
@Builder
@Jacksonized
@JsonPropertyOrder({"uris", "dimensions", "palette", "failures"})
public class ProcessManifest {

    @Builder.Default
    Map<String, String> uris = Map.of();

    @Builder.Default
    Map<String, List<Integer>> dimensions = Map.of();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    List<PaletteColor> palette;

    @Builder.Default
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    List<TaskFailure> failures = List.of();

    /**
     * Returns whether any task failed.
     */
    @JsonIgnore
    public boolean isPartial() {
        return !failures.isEmpty();
    }

    /**
     * Returns the failure recorded for a task, if any.
     *
     * @param task a derivative label or {@link TaskFailure#PALETTE_TASK}
     * @return the failure, or empty when the task did not fail
     */
    public Optional<TaskFailure> failureFor(String task) {
        return failures.stream()
                .filter(failure -> failure.getTask().equals(task))
                .findFirst();
    }
}
