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

package org.fireflyframework.iiif.process;

import lombok.Getter;
import org.fireflyframework.iiif.model.FailureKind;

/**
 * Failure of a single orchestrator task. Always absorbed into the manifest,
 * never propagated to the caller.
 */
@Getter
public class DerivativeTaskException extends RuntimeException {

    private final FailureKind kind;
    private final String task;

    public DerivativeTaskException(FailureKind kind, String task, String message) {
        super(message);
        this.kind = kind;
        this.task = task;
    }

    public DerivativeTaskException(FailureKind kind, String task, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.task = task;
    }
}
