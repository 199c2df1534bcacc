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

package org.fireflyframework.iiif.config;

import org.fireflyframework.iiif.cache.DerivativesCache;
import org.fireflyframework.iiif.cache.DiskDerivativesCache;
import org.fireflyframework.iiif.cache.InMemoryDerivativesCache;
import org.fireflyframework.iiif.cache.ProcessReportWriter;
import org.fireflyframework.iiif.controller.ProcessController;
import org.fireflyframework.iiif.controller.advice.ProcessExceptionHandler;
import org.fireflyframework.iiif.image.ImageDriver;
import org.fireflyframework.iiif.image.ImageProcessor;
import org.fireflyframework.iiif.model.InstructionSet;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.fireflyframework.iiif.process.BatchProcessRunner;
import org.fireflyframework.iiif.process.DerivativeOrchestrator;
import org.fireflyframework.iiif.process.ProcessCommandLineRunner;
import org.fireflyframework.iiif.resiliency.BackendResiliencyRegistry;
import org.fireflyframework.iiif.stats.ProcessingStatsTracker;
import org.fireflyframework.iiif.support.TestImaging;
import org.fireflyframework.iiif.uri.SourceUris;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ReactiveWebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the IIIF process auto-configurations.
 */
class IiifProcessAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    DerivativesCacheAutoConfiguration.class,
                    IiifProcessAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class ImagingConfiguration {

        @Bean
        ImageDriver imageDriver() {
            return TestImaging.driver();
        }

        @Bean
        ImageProcessor imageProcessor() {
            return TestImaging.processor();
        }
    }

    @Test
    void shouldConfigureProcessingBeans_whenImagingBackendPresent() {
        contextRunner
                .withUserConfiguration(ImagingConfiguration.class)
                .withPropertyValues("firefly.iiif.process.instructions-location=classpath:instructions-test.json")
                .run(context -> {
                    assertThat(context).hasSingleBean(DerivativeOrchestrator.class);
                    assertThat(context).hasSingleBean(BatchProcessRunner.class);
                    assertThat(context).hasSingleBean(ProcessOptions.class);
                    assertThat(context).hasSingleBean(ProcessReportWriter.class);
                    assertThat(context).hasSingleBean(BackendResiliencyRegistry.class);
                    assertThat(context).hasSingleBean(ProcessingStatsTracker.class);
                    assertThat(context).getBean(DerivativesCache.class).isInstanceOf(InMemoryDerivativesCache.class);
                    assertThat(context).doesNotHaveBean(ProcessCommandLineRunner.class);

                    InstructionSet instructions = context.getBean(InstructionSet.class);
                    assertThat(instructions.labels()).containsExactlyInAnyOrder("o", "b", "d");
                });
    }

    @Test
    void shouldRecordTaskStats_fromOrchestratorEvents() {
        contextRunner
                .withUserConfiguration(ImagingConfiguration.class)
                .withPropertyValues("firefly.iiif.process.instructions-location=classpath:instructions-test.json")
                .run(context -> {
                    BatchProcessRunner runner = context.getBean(BatchProcessRunner.class);
                    ProcessOptions options = context.getBean(ProcessOptions.class);

                    runner.processMany(options, List.of(SourceUris.parse("avocado.png")))
                            .block(Duration.ofSeconds(10));

                    ProcessingStatsTracker tracker = context.getBean(ProcessingStatsTracker.class);
                    assertThat(tracker.getReport().getTotalSucceeded()).isEqualTo(4);
                    assertThat(tracker.getReport().getTasks()).containsOnlyKeys("palette", "o", "b", "d");
                });
    }

    @Test
    void shouldUseEmptyInstructionSet_whenDocumentMissing() {
        contextRunner
                .withUserConfiguration(ImagingConfiguration.class)
                .withPropertyValues("firefly.iiif.process.instructions-location=classpath:does-not-exist.json")
                .run(context -> assertThat(context.getBean(InstructionSet.class).isEmpty()).isTrue());
    }

    @Test
    void shouldNotConfigureBatchRunner_withoutImagingBackend() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(DerivativeOrchestrator.class);
            assertThat(context).doesNotHaveBean(BatchProcessRunner.class);
            assertThat(context).doesNotHaveBean(ProcessOptions.class);
        });
    }

    @Test
    void shouldBindReportSettings_intoProcessOptions() {
        contextRunner
                .withUserConfiguration(ImagingConfiguration.class)
                .withPropertyValues(
                        "firefly.iiif.process.report=true",
                        "firefly.iiif.process.report-name=derivatives.json",
                        "firefly.iiif.profile.services.enable=palette")
                .run(context -> {
                    ProcessOptions options = context.getBean(ProcessOptions.class);
                    assertThat(options.isReport()).isTrue();
                    assertThat(options.getReportName()).isEqualTo("derivatives.json");
                    assertThat(options.getConfig().isServiceEnabled(IiifProcessProperties.PALETTE_SERVICE)).isTrue();
                });
    }

    @Test
    void shouldConfigureDiskCache_whenSelected(@TempDir Path root) {
        contextRunner
                .withPropertyValues(
                        "firefly.iiif.derivatives.cache.name=disk",
                        "firefly.iiif.derivatives.cache.path=" + root)
                .run(context -> assertThat(context).getBean(DerivativesCache.class)
                        .isInstanceOf(DiskDerivativesCache.class));
    }

    @Test
    void shouldFailStartup_whenDiskCacheHasNoPath() {
        contextRunner
                .withPropertyValues("firefly.iiif.derivatives.cache.name=disk")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldRegisterCommandLineRunner_whenEnabled() {
        contextRunner
                .withUserConfiguration(ImagingConfiguration.class)
                .withPropertyValues("firefly.iiif.process.cli.enabled=true")
                .run(context -> assertThat(context).hasSingleBean(ProcessCommandLineRunner.class));
    }

    @Test
    void shouldBackOff_whenDisabled() {
        contextRunner
                .withUserConfiguration(ImagingConfiguration.class)
                .withPropertyValues("firefly.iiif.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(DerivativeOrchestrator.class);
                    assertThat(context).doesNotHaveBean(DerivativesCache.class);
                });
    }

    @Test
    void shouldRegisterWebEndpoints_inReactiveApplication() {
        new ReactiveWebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        DerivativesCacheAutoConfiguration.class,
                        IiifProcessAutoConfiguration.class,
                        IiifProcessWebAutoConfiguration.class))
                .withUserConfiguration(ImagingConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(ProcessController.class);
                    assertThat(context).hasSingleBean(ProcessExceptionHandler.class);
                });
    }

    @Test
    void shouldSkipWebEndpoints_whenWebDisabled() {
        new ReactiveWebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        DerivativesCacheAutoConfiguration.class,
                        IiifProcessAutoConfiguration.class,
                        IiifProcessWebAutoConfiguration.class))
                .withUserConfiguration(ImagingConfiguration.class)
                .withPropertyValues("firefly.iiif.web.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(ProcessController.class));
    }
}
