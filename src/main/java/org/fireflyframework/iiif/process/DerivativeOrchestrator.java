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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.config.IiifProcessProperties;
import org.fireflyframework.iiif.event.DerivativeTaskEvent;
import org.fireflyframework.iiif.image.ImageDriver;
import org.fireflyframework.iiif.image.ImageProcessor;
import org.fireflyframework.iiif.image.PaletteService;
import org.fireflyframework.iiif.image.ProcessedDerivative;
import org.fireflyframework.iiif.model.Dimensions;
import org.fireflyframework.iiif.model.FailureKind;
import org.fireflyframework.iiif.model.InstructionSet;
import org.fireflyframework.iiif.model.Instructions;
import org.fireflyframework.iiif.model.PaletteColor;
import org.fireflyframework.iiif.model.ProcessManifest;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.fireflyframework.iiif.model.TaskFailure;
import org.fireflyframework.iiif.resiliency.BackendResiliencyRegistry;
import org.fireflyframework.iiif.uri.SourceUri;
import org.fireflyframework.iiif.uri.UriRewriter;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generates every derivative of one source image in parallel and collects the results
 * into a {@link ProcessManifest}.
 *
 * <p>For an {@link InstructionSet} of {@code N} labels the orchestrator starts {@code N + 1}
 * independent tasks: one per label plus one that opens the source image and, when the
 * {@value IiifProcessProperties#PALETTE_SERVICE} service is enabled, computes its palette.
 * A failing task never cancels its siblings. Its error is logged with the source and label,
 * listed in {@link ProcessManifest#getFailures()}, and its label is left out of the
 * manifest's {@code uris} and {@code dimensions}.</p>
 *
 * <p>The returned {@link Mono} completes once all {@code N + 1} tasks have finished. It only
 * errors for setup problems detected before any task starts.</p>
 *
 * <p>When an {@link ApplicationEventPublisher} is provided, a {@link DerivativeTaskEvent}
 * is published as each task finishes.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * DerivativeOrchestrator orchestrator = new DerivativeOrchestrator(new UriRewriter(), paletteService);
 * Mono<ProcessManifest> manifest = orchestrator.process(options, SourceUris.parse("avocado.png"));
 * }</pre>
 */
@Slf4j
public class DerivativeOrchestrator {

    private final UriRewriter uriRewriter;
    private final PaletteService paletteService;
    private final BackendResiliencyRegistry resiliency;
    private final ApplicationEventPublisher eventPublisher;
    private final Scheduler scheduler;

    /**
     * Creates an orchestrator without resiliency decoration or event publishing.
     *
     * @param uriRewriter    the rewriter computing effective processing URIs
     * @param paletteService the palette service, or {@code null} if none is available
     */
    public DerivativeOrchestrator(UriRewriter uriRewriter, PaletteService paletteService) {
        this(uriRewriter, paletteService, BackendResiliencyRegistry.none(), null, Schedulers.boundedElastic());
    }

    /**
     * Creates an orchestrator.
     *
     * @param uriRewriter    the rewriter computing effective processing URIs
     * @param paletteService the palette service, or {@code null} if none is available
     * @param resiliency     the registry decorating backend calls
     * @param eventPublisher the event publisher, or {@code null} to disable event publishing
     * @param scheduler      the scheduler the tasks run on
     */
    public DerivativeOrchestrator(UriRewriter uriRewriter,
                                  PaletteService paletteService,
                                  BackendResiliencyRegistry resiliency,
                                  ApplicationEventPublisher eventPublisher,
                                  Scheduler scheduler) {
        this.uriRewriter = uriRewriter;
        this.paletteService = paletteService;
        this.resiliency = resiliency;
        this.eventPublisher = eventPublisher;
        this.scheduler = scheduler;
    }

    /**
     * Processes one source image against the instruction set in {@code options}.
     *
     * @param options the configuration, driver, processor and instructions to use
     * @param source  the source image
     * @return a {@link Mono} emitting the manifest once every task has finished
     * @throws NullPointerException if the source or a required option is missing
     */
    public Mono<ProcessManifest> process(ProcessOptions options, SourceUri source) {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options.getConfig(), "options.config must not be null");
        Objects.requireNonNull(options.getDriver(), "options.driver must not be null");
        Objects.requireNonNull(options.getProcessor(), "options.processor must not be null");
        Objects.requireNonNull(options.getInstructions(), "options.instructions must not be null");

        return Mono.defer(() -> {
            InstructionSet instructionSet = options.getInstructions();
            ManifestCollector collector = new ManifestCollector();

            List<Mono<Boolean>> tasks = new ArrayList<>(instructionSet.size() + 1);
            tasks.add(paletteTask(options, source, collector));
            instructionSet.forEach((label, instructions) ->
                    tasks.add(derivativeTask(options, source, label, instructions.ensureDefaults(), collector)));

            log.debug("Processing {} with {} tasks", source, tasks.size());

            return Flux.merge(Flux.fromIterable(tasks), tasks.size())
                    .reduce(0, (failed, success) -> success ? failed : failed + 1)
                    .map(failed -> {
                        ProcessManifest manifest = collector.toManifest();
                        if (failed > 0) {
                            log.warn("Processed {} with {} of {} tasks failed", source, failed, tasks.size());
                        } else {
                            log.info("Processed {} ({} derivatives)", source, manifest.getUris().size());
                        }
                        return manifest;
                    });
        });
    }

    private Mono<Boolean> paletteTask(ProcessOptions options, SourceUri source, ManifestCollector collector) {
        IiifProcessProperties config = options.getConfig();
        ImageDriver driver = options.getDriver();
        String task = TaskFailure.PALETTE_TASK;

        Mono<Void> work = resiliency.decorate(BackendResiliencyRegistry.DRIVER,
                        Mono.defer(() -> driver.openImage(config, source.origin())))
                .onErrorMap(e -> !(e instanceof DerivativeTaskException),
                        e -> new DerivativeTaskException(FailureKind.SOURCE_OPEN, task,
                                String.format("Failed to open %s : %s", source, e.getMessage()), e))
                .switchIfEmpty(Mono.error(() -> new DerivativeTaskException(FailureKind.SOURCE_OPEN, task,
                        String.format("Failed to open %s : driver returned no image", source))))
                .flatMap(image -> {
                    if (!config.isServiceEnabled(IiifProcessProperties.PALETTE_SERVICE)) {
                        return Mono.empty();
                    }
                    if (paletteService == null) {
                        return Mono.error(new DerivativeTaskException(FailureKind.PALETTE, task,
                                String.format("Failed to derive palette for %s : no palette service is configured", source)));
                    }
                    Mono<List<PaletteColor>> colors = resiliency.decorate(BackendResiliencyRegistry.PALETTE,
                            Mono.defer(() -> paletteService.compute(config.getPalette(), image)));
                    return colors
                            .onErrorMap(e -> !(e instanceof DerivativeTaskException),
                                    e -> new DerivativeTaskException(FailureKind.PALETTE, task,
                                            String.format("Failed to derive palette for %s : %s", source, e.getMessage()), e))
                            .switchIfEmpty(Mono.error(() -> new DerivativeTaskException(FailureKind.PALETTE, task,
                                    String.format("Failed to derive palette for %s : palette service returned no colors", source))))
                            .doOnNext(collector::recordPalette);
                })
                .then();

        return complete(source, task, FailureKind.PALETTE, work, collector);
    }

    private Mono<Boolean> derivativeTask(ProcessOptions options, SourceUri source, String label,
                                         Instructions instructions, ManifestCollector collector) {
        ImageProcessor processor = options.getProcessor();

        Mono<Void> work = Mono.fromCallable(() -> uriRewriter.rewrite(source, label, instructions.getFormat()))
                .onErrorMap(e -> !(e instanceof DerivativeTaskException),
                        e -> new DerivativeTaskException(FailureKind.REWRITE, label, e.getMessage(), e))
                .flatMap(processUri -> resiliency.decorate(BackendResiliencyRegistry.PROCESSOR,
                                Mono.defer(() -> processor.process(processUri, label, instructions)))
                        .onErrorMap(e -> !(e instanceof DerivativeTaskException),
                                e -> new DerivativeTaskException(FailureKind.DERIVATIVE_PROCESSING, label,
                                        String.format("Failed to process %s (%s) : %s", source, label, e.getMessage()), e))
                        .switchIfEmpty(Mono.error(() -> new DerivativeTaskException(FailureKind.DERIVATIVE_PROCESSING, label,
                                String.format("Failed to process %s (%s) : processor returned no derivative", source, label)))))
                .doOnNext(derivative -> {
                    String uri = uriOf(source, label, derivative);
                    Dimensions size = dimensionsOf(source, label, derivative);
                    collector.recordDerivative(label, uri, size);
                })
                .then();

        return complete(source, label, FailureKind.DERIVATIVE_PROCESSING, work, collector);
    }

    private String uriOf(SourceUri source, String label, ProcessedDerivative derivative) {
        String uri = derivative.uri();
        if (uri == null || uri.isBlank()) {
            throw new DerivativeTaskException(FailureKind.DERIVATIVE_PROCESSING, label,
                    String.format("Failed to process %s (%s) : processor reported no derivative URI", source, label));
        }
        return uri;
    }

    private Dimensions dimensionsOf(SourceUri source, String label, ProcessedDerivative derivative) {
        if (derivative.image() == null) {
            throw new DerivativeTaskException(FailureKind.DIMENSION_QUERY, label,
                    String.format("Failed to read dimensions of %s (%s) : processor returned no image", source, label));
        }
        Dimensions size;
        try {
            size = derivative.image().dimensions();
        } catch (RuntimeException e) {
            throw new DerivativeTaskException(FailureKind.DIMENSION_QUERY, label,
                    String.format("Failed to read dimensions of %s (%s) : %s", source, label, e.getMessage()), e);
        }
        if (size == null) {
            throw new DerivativeTaskException(FailureKind.DIMENSION_QUERY, label,
                    String.format("Failed to read dimensions of %s (%s) : no dimensions reported", source, label));
        }
        return size;
    }

    /**
     * Turns a task into one that always emits exactly one completion value: {@code true} on
     * success, {@code false} after its failure has been logged and recorded.
     */
    private Mono<Boolean> complete(SourceUri source, String task, FailureKind defaultKind,
                                   Mono<Void> work, ManifestCollector collector) {
        return work
                .thenReturn(true)
                .onErrorResume(e -> {
                    FailureKind kind = e instanceof DerivativeTaskException taskException
                            ? taskException.getKind()
                            : defaultKind;
                    log.error("Task {} for {} failed ({}): {}", task, source, kind, e.getMessage());
                    collector.recordFailure(TaskFailure.of(task, kind, e.getMessage()));
                    publishEvent(DerivativeTaskEvent.failed(source.toString(), task, kind));
                    return Mono.just(false);
                })
                .doOnNext(success -> {
                    if (success) {
                        publishEvent(DerivativeTaskEvent.succeeded(source.toString(), task));
                    }
                })
                .subscribeOn(scheduler);
    }

    private void publishEvent(DerivativeTaskEvent event) {
        if (eventPublisher == null) {
            return;
        }
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Unable to publish task event for {} ({}): {}", event.getSource(), event.getTask(), e.getMessage());
        }
    }
}
