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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.cache.ProcessReportWriter;
import org.fireflyframework.iiif.image.ImageDriver;
import org.fireflyframework.iiif.image.ImageProcessor;
import org.fireflyframework.iiif.image.PaletteService;
import org.fireflyframework.iiif.model.InstructionSet;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.fireflyframework.iiif.process.BatchProcessRunner;
import org.fireflyframework.iiif.process.DerivativeOrchestrator;
import org.fireflyframework.iiif.process.ProcessCommandLineRunner;
import org.fireflyframework.iiif.resiliency.BackendResiliencyRegistry;
import org.fireflyframework.iiif.stats.ProcessingStatsTracker;
import org.fireflyframework.iiif.uri.UriRewriter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;

/**
 * Auto-configuration for parallel derivative processing.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>{@link DerivativeOrchestrator} with the optional {@link PaletteService} bean</li>
 *   <li>The {@link InstructionSet} read from {@code firefly.iiif.process.instructions-location}</li>
 *   <li>{@link BatchProcessRunner} and {@link ProcessOptions}, once an {@link ImageDriver}
 *       and an {@link ImageProcessor} bean are registered</li>
 *   <li>{@link ProcessCommandLineRunner} when {@code firefly.iiif.process.cli.enabled} is true</li>
 *   <li>{@link ProcessingStatsTracker} listening for task events</li>
 * </ul>
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   iiif:
 *     enabled: true
 *     process:
 *       report: true
 *       instructions-location: file:/etc/iiif/instructions.json
 * }</pre>
 */
@Slf4j
@AutoConfiguration(after = DerivativesCacheAutoConfiguration.class)
@EnableConfigurationProperties(IiifProcessProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.iiif",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class IiifProcessAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public UriRewriter uriRewriter() {
        return new UriRewriter();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessingStatsTracker processingStatsTracker() {
        return new ProcessingStatsTracker();
    }

    /**
     * Creates the derivative orchestrator.
     *
     * <p>Palette extraction fails per source when the palette service is enabled in the
     * profile but no {@link PaletteService} bean is registered.</p>
     */
    @Bean
    @ConditionalOnMissingBean
    public DerivativeOrchestrator derivativeOrchestrator(
            UriRewriter uriRewriter,
            ObjectProvider<PaletteService> paletteService,
            ObjectProvider<BackendResiliencyRegistry> resiliency,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        PaletteService palette = paletteService.getIfAvailable();
        log.info("Configuring Derivative Orchestrator (palette service {})", palette != null ? "available" : "absent");
        return new DerivativeOrchestrator(uriRewriter, palette,
                resiliency.getIfAvailable(BackendResiliencyRegistry::none), eventPublisher,
                Schedulers.boundedElastic());
    }

    /**
     * Reads the instruction set. A missing document yields an empty set, which still
     * derives the palette of every source.
     */
    @Bean
    @ConditionalOnMissingBean
    public InstructionSet instructionSet(IiifProcessProperties properties,
                                         ResourceLoader resourceLoader,
                                         ObjectProvider<ObjectMapper> objectMapper) throws IOException {
        String location = properties.getProcess().getInstructionsLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("No instructions found at {}, only palettes will be derived", location);
            return InstructionSet.empty();
        }
        try (InputStream document = resource.getInputStream()) {
            InstructionSet instructions = InstructionSet.fromJson(objectMapper.getIfAvailable(ObjectMapper::new), document);
            log.info("Loaded {} instructions from {}: {}", instructions.size(), location, instructions.labels());
            return instructions;
        }
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ImageDriver.class, ImageProcessor.class})
    public ProcessOptions processOptions(IiifProcessProperties properties,
                                         ImageDriver imageDriver,
                                         ImageProcessor imageProcessor,
                                         InstructionSet instructionSet) {
        return ProcessOptions.builder()
                .config(properties)
                .driver(imageDriver)
                .processor(imageProcessor)
                .instructions(instructionSet)
                .report(properties.getProcess().isReport())
                .reportName(properties.getProcess().getReportName())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({ImageDriver.class, ImageProcessor.class})
    public BatchProcessRunner batchProcessRunner(DerivativeOrchestrator orchestrator,
                                                 ObjectProvider<ProcessReportWriter> reportWriter) {
        return new BatchProcessRunner(orchestrator, reportWriter.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(BatchProcessRunner.class)
    @ConditionalOnProperty(prefix = "firefly.iiif.process.cli", name = "enabled", havingValue = "true")
    public ProcessCommandLineRunner processCommandLineRunner(BatchProcessRunner batchRunner,
                                                             ProcessOptions processOptions,
                                                             ObjectProvider<ObjectMapper> objectMapper) {
        return new ProcessCommandLineRunner(batchRunner, processOptions, objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
