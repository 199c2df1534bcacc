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

package org.fireflyframework.iiif.uri;

import java.util.Map;

/**
 * A {@link SourceUri} whose derivatives are written to a computed target path
 * instead of next to the origin.
 */
public interface TargetDerivingUri extends SourceUri {

    /**
     * Derives the target path of a derivative.
     *
     * @param options derivation options such as {@code label}, {@code format} and {@code original}
     * @return the target path
     * @throws InvalidSourceUriException if the options or the URI do not allow a target to be derived
     */
    String target(Map<String, String> options);
}
