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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the JSON shape of {@link ProcessManifest} and {@link BatchReport}.
 */
class ProcessManifestJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void completeManifest_shouldOmitPaletteAndFailures() throws Exception {
        // Given
        ProcessManifest manifest = ProcessManifest.builder()
                .uris(new TreeMap<>(Map.of("b", "avocado.png/full/!2048,1536/0/color.jpg")))
                .dimensions(new TreeMap<>(Map.of("b", List.of(2048, 1536))))
                .build();

        // When
        String json = objectMapper.writeValueAsString(manifest);

        // Then
        assertThat(json).isEqualTo(
                "{\"uris\":{\"b\":\"avocado.png/full/!2048,1536/0/color.jpg\"},\"dimensions\":{\"b\":[2048,1536]}}");
        assertThat(manifest.isPartial()).isFalse();
    }

    @Test
    void partialManifest_shouldListFailures() throws Exception {
        // Given
        ProcessManifest manifest = ProcessManifest.builder()
                .failures(List.of(TaskFailure.of("d", FailureKind.DERIVATIVE_PROCESSING, "boom")))
                .build();

        // When
        String json = objectMapper.writeValueAsString(manifest);
        ProcessManifest decoded = objectMapper.readValue(json, ProcessManifest.class);

        // Then
        assertThat(json).contains("\"failures\":[{\"task\":\"d\",\"kind\":\"DERIVATIVE_PROCESSING\",\"message\":\"boom\"}]");
        assertThat(decoded.isPartial()).isTrue();
        assertThat(decoded.failureFor("d")).isPresent();
        assertThat(decoded.failureFor("b")).isEmpty();
    }

    @Test
    void batchReport_shouldSerialiseAsObjectKeyedByOrigin() throws Exception {
        // Given
        Map<String, ProcessManifest> manifests = new java.util.LinkedHashMap<>();
        manifests.put("zebra.png", ProcessManifest.builder().build());
        manifests.put("avocado.png", ProcessManifest.builder().build());

        // When
        String json = objectMapper.writeValueAsString(new BatchReport(manifests));

        // Then
        assertThat(json).isEqualTo(
                "{\"zebra.png\":{\"uris\":{},\"dimensions\":{}},\"avocado.png\":{\"uris\":{},\"dimensions\":{}}}");
    }
}
