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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Manifests of a batch, keyed by source origin in processing order.
 *
 * <p>Serialises as a plain JSON object, e.g. {@code {"avocado.png": {"uris": {...}, ...}}}.</p>
 */
@EqualsAndHashCode
@ToString
public final class BatchReport {

    private final Map<String, ProcessManifest> manifests;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public BatchReport(Map<String, ProcessManifest> manifests) {
        this.manifests = Collections.unmodifiableMap(new LinkedHashMap<>(manifests));
    }

    @JsonValue
    public Map<String, ProcessManifest> getManifests() {
        return manifests;
    }

    public ProcessManifest get(String origin) {
        return manifests.get(origin);
    }

    public int size() {
        return manifests.size();
    }
}
