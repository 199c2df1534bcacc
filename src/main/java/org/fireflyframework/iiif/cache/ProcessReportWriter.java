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

package org.fireflyframework.iiif.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.model.ProcessManifest;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.fireflyframework.iiif.resiliency.BackendResiliencyRegistry;
import reactor.core.publisher.Mono;

import java.io.IOException;

/**
 * Persists process reports (JSON-encoded manifests) in a {@link DerivativesCache}.
 *
 * <p>Reports are stored under {@code <origin>/<reportName>}, e.g. {@code avocado.png/process.json}.</p>
 */
@Slf4j
public class ProcessReportWriter {

    private final DerivativesCache cache;
    private final ObjectMapper objectMapper;
    private final BackendResiliencyRegistry resiliency;

    public ProcessReportWriter(DerivativesCache cache, ObjectMapper objectMapper) {
        this(cache, objectMapper, BackendResiliencyRegistry.none());
    }

    public ProcessReportWriter(DerivativesCache cache, ObjectMapper objectMapper, BackendResiliencyRegistry resiliency) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.resiliency = resiliency;
    }

    /**
     * Writes the report of one source.
     *
     * @param origin     the source origin
     * @param reportName the report file name
     * @param manifest   the manifest to persist
     * @return a {@link Mono} completing once the report is stored, or erroring if it could not be
     */
    public Mono<Void> write(String origin, String reportName, ProcessManifest manifest) {
        String key = reportKey(origin, reportName);
        return Mono.fromCallable(() -> encode(manifest))
                .flatMap(bytes -> resiliency.decorate(BackendResiliencyRegistry.REPORT,
                        Mono.defer(() -> cache.set(key, bytes))))
                .doOnSuccess(ignored -> log.debug("Stored process report {}", key));
    }

    /**
     * Reads a previously written report.
     *
     * @param origin     the source origin
     * @param reportName the report file name
     * @return a {@link Mono} emitting the manifest, or empty if no report exists
     */
    public Mono<ProcessManifest> read(String origin, String reportName) {
        String key = reportKey(origin, reportName);
        return cache.get(key)
                .map(bytes -> {
                    try {
                        return objectMapper.readValue(bytes, ProcessManifest.class);
                    } catch (IOException e) {
                        throw new IllegalStateException("Unable to decode process report " + key + ": " + e.getMessage(), e);
                    }
                });
    }

    /**
     * Builds the cache key of a report, joining origin and name with a single {@code /}.
     *
     * @param origin     the source origin
     * @param reportName the report file name, {@value ProcessOptions#DEFAULT_REPORT_NAME} when blank
     * @return the cache key
     */
    public static String reportKey(String origin, String reportName) {
        String name = reportName == null || reportName.isBlank() ? ProcessOptions.DEFAULT_REPORT_NAME : reportName;
        String base = origin;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        return base.isEmpty() ? name : base + "/" + name;
    }

    private byte[] encode(ProcessManifest manifest) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(manifest);
    }
}
