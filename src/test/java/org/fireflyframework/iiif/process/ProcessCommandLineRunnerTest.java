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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.iiif.cache.InMemoryDerivativesCache;
import org.fireflyframework.iiif.cache.ProcessReportWriter;
import org.fireflyframework.iiif.support.TestImaging;
import org.fireflyframework.iiif.uri.UriRewriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ProcessCommandLineRunner}.
 */
class ProcessCommandLineRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private InMemoryDerivativesCache cache;
    private ProcessCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        cache = new InMemoryDerivativesCache();
        BatchProcessRunner batchRunner = new BatchProcessRunner(
                new DerivativeOrchestrator(new UriRewriter(), null),
                new ProcessReportWriter(cache, objectMapper));
        runner = new ProcessCommandLineRunner(batchRunner, TestImaging.options().build(), objectMapper,
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void run_shouldPrintBatchReportAsJson() throws Exception {
        // When
        runner.run(new DefaultApplicationArguments("avocado.png", "banana.jpg"));

        // Then
        JsonNode report = objectMapper.readTree(output.toString(StandardCharsets.UTF_8));
        assertThat(report.fieldNames()).toIterable().containsExactly("avocado.png", "banana.jpg");
        assertThat(report.at("/avocado.png/uris/d").asText()).isEqualTo("avocado.png/-1,-1,320,320/full/0/dither.jpg");
        assertThat(report.at("/banana.jpg/dimensions/b").toString()).isEqualTo("[2048,1536]");
        assertThat(cache.size()).isZero();
    }

    @Test
    void run_shouldPersistReports_whenReportOptionGiven() throws Exception {
        // When
        runner.run(new DefaultApplicationArguments("--report", "--report-name=derivatives.json", "avocado.png"));

        // Then
        assertThat(cache.exists("avocado.png/derivatives.json").block()).isTrue();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void run_shouldDoNothing_withoutSourceUris() throws Exception {
        // When
        runner.run(new DefaultApplicationArguments("--report"));

        // Then
        assertThat(output.size()).isZero();
        assertThat(cache.size()).isZero();
    }
}
