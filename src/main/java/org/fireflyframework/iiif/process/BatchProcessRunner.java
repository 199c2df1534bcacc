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
import org.fireflyframework.iiif.cache.ProcessReportWriter;
import org.fireflyframework.iiif.model.BatchReport;
import org.fireflyframework.iiif.model.ProcessManifest;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.fireflyframework.iiif.uri.SourceUri;
import org.fireflyframework.iiif.uri.SourceUris;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Runs the {@link DerivativeOrchestrator} over many source images.
 *
 * <p>Sources are processed one after another in input order; parallelism only exists
 * within a single source. When reporting is enabled, each manifest is persisted by a
 * background write that starts as soon as its source is done. Report failures are
 * logged and never affect the batch, and the batch completes only after every write
 * has finished.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * BatchProcessRunner runner = new BatchProcessRunner(orchestrator, reportWriter);
 * runner.processMany(options, List.of(SourceUris.parse("avocado.png")))
 *       .subscribe(report -> ...);
 * }</pre>
 */
@Slf4j
public class BatchProcessRunner {

    private final DerivativeOrchestrator orchestrator;
    private final ProcessReportWriter reportWriter;
    private final Scheduler scheduler;

    /**
     * Creates a runner.
     *
     * @param orchestrator the single-source orchestrator
     * @param reportWriter the report writer, or {@code null} if reports cannot be persisted
     */
    public BatchProcessRunner(DerivativeOrchestrator orchestrator, ProcessReportWriter reportWriter) {
        this(orchestrator, reportWriter, Schedulers.boundedElastic());
    }

    public BatchProcessRunner(DerivativeOrchestrator orchestrator, ProcessReportWriter reportWriter, Scheduler scheduler) {
        this.orchestrator = orchestrator;
        this.reportWriter = reportWriter;
        this.scheduler = scheduler;
    }

    /**
     * Processes every source and aggregates the manifests by origin.
     *
     * @param options the processing options shared by all sources
     * @param sources the sources, processed in order
     * @return a {@link Mono} emitting the batch report once all sources and report writes are done
     */
    public Mono<BatchReport> processMany(ProcessOptions options, List<SourceUri> sources) {
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(sources, "sources must not be null");

        if (options.isReport() && reportWriter == null) {
            log.warn("Process reports requested but no report writer is configured; reports will be skipped");
        }

        return Flux.fromIterable(sources)
                .concatMap(source -> orchestrator.process(options, source)
                        .map(manifest -> new SourceManifest(source.origin(), manifest)))
                .flatMapSequential(result -> persistReport(options, result).thenReturn(result))
                .collect(LinkedHashMap<String, ProcessManifest>::new,
                        (manifests, result) -> manifests.put(result.origin(), result.manifest()))
                .map(manifests -> {
                    log.info("Processed batch of {} sources", manifests.size());
                    return new BatchReport(manifests);
                });
    }

    /**
     * Parses and processes source URI strings.
     *
     * @param options the processing options shared by all sources
     * @param uris    the source URI strings
     * @return a {@link Mono} emitting the batch report
     * @throws org.fireflyframework.iiif.uri.InvalidSourceUriException if any URI is invalid; nothing is processed then
     */
    public Mono<BatchReport> processUris(ProcessOptions options, List<String> uris) {
        List<SourceUri> sources = uris.stream()
                .map(SourceUris::parse)
                .toList();
        return processMany(options, sources);
    }

    private Mono<Void> persistReport(ProcessOptions options, SourceManifest result) {
        if (!options.isReport() || reportWriter == null) {
            return Mono.empty();
        }

        String key = ProcessReportWriter.reportKey(result.origin(), options.getReportName());
        return reportWriter.write(result.origin(), options.getReportName(), result.manifest())
                .subscribeOn(scheduler)
                .onErrorResume(e -> {
                    log.error("Unable to write process report {}, {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    private record SourceManifest(String origin, ProcessManifest manifest) {
    }
}
