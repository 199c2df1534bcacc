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

package org.fireflyframework.iiif.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.cache.ProcessReportWriter;
import org.fireflyframework.iiif.model.BatchReport;
import org.fireflyframework.iiif.model.ProcessApiRequest;
import org.fireflyframework.iiif.model.ProcessManifest;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.fireflyframework.iiif.process.BatchProcessRunner;
import org.fireflyframework.iiif.stats.ProcessingStatsReport;
import org.fireflyframework.iiif.stats.ProcessingStatsTracker;
import org.fireflyframework.iiif.uri.InvalidSourceUriException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller that runs derivative batches and exposes their reports.
 *
 * <p><b>Example Usage:</b></p>
 * <pre>{@code
 * POST /api/v1/iiif/process
 * {"uris": ["avocado.png"], "report": true}
 * }</pre>
 *
 * <p><b>Response:</b></p>
 * <pre>{@code
 * {
 *   "avocado.png": {
 *     "uris": {"b": "avocado.png/full/!2048,1536/0/color.jpg"},
 *     "dimensions": {"b": [2048, 1536]}
 *   }
 * }
 * }</pre>
 *
 * <p><b>Error Handling:</b></p>
 * <ul>
 *   <li><b>400 Bad Request</b> - No source URIs, or a source URI that cannot be parsed</li>
 *   <li><b>404 Not Found</b> - No persisted report for the requested origin</li>
 * </ul>
 * <p>Failed derivatives do not fail the request; they are listed in each manifest's {@code failures}.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/iiif/process")
@Tag(name = "IIIF Process", description = "Parallel derivative generation and process reports")
public class ProcessController {

    private final BatchProcessRunner batchRunner;
    private final ProcessOptions options;
    private final ProcessReportWriter reportWriter;
    private final ProcessingStatsTracker statsTracker;

    /**
     * @param reportWriter the report store, or {@code null} if reports are not persisted
     */
    public ProcessController(BatchProcessRunner batchRunner,
                             ProcessOptions options,
                             ProcessReportWriter reportWriter,
                             ProcessingStatsTracker statsTracker) {
        this.batchRunner = batchRunner;
        this.options = options;
        this.reportWriter = reportWriter;
        this.statsTracker = statsTracker;
    }

    /**
     * Processes the requested sources with the configured instruction set.
     *
     * @param request the sources and report settings
     * @return the batch report keyed by origin
     */
    @PostMapping
    @Operation(
        summary = "Process source images",
        description = "Generates every configured derivative for each source and returns the manifests by origin"
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Batch processed; individual derivatives may have failed",
            content = @Content(schema = @Schema(implementation = BatchReport.class))
        ),
        @ApiResponse(responseCode = "400", description = "Missing or invalid source URIs")
    })
    public Mono<BatchReport> process(
            @Parameter(description = "Sources to process", required = true)
            @RequestBody ProcessApiRequest request) {

        return Mono.defer(() -> {
            if (request.getUris() == null || request.getUris().isEmpty()) {
                return Mono.error(new InvalidSourceUriException("At least one source URI is required"));
            }

            ProcessOptions.ProcessOptionsBuilder runOptions = options.toBuilder();
            if (request.getReport() != null) {
                runOptions.report(request.getReport());
            }
            if (request.getReportName() != null && !request.getReportName().isBlank()) {
                runOptions.reportName(request.getReportName());
            }

            log.info("Received process request for {} sources", request.getUris().size());
            return batchRunner.processUris(runOptions.build(), request.getUris());
        });
    }

    /**
     * Returns the persisted process report of a source.
     *
     * @param origin     the source origin
     * @param reportName the report file name, defaults to configuration
     * @return the manifest, or 404 if no report was persisted
     */
    @GetMapping("/report")
    @Operation(
        summary = "Get a persisted process report",
        description = "Reads the manifest stored under <origin>/<reportName> in the derivatives cache"
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Report found",
            content = @Content(schema = @Schema(implementation = ProcessManifest.class))
        ),
        @ApiResponse(responseCode = "404", description = "No report stored for the origin")
    })
    public Mono<ResponseEntity<ProcessManifest>> getReport(
            @Parameter(description = "Source origin", required = true, example = "avocado.png")
            @RequestParam String origin,
            @Parameter(description = "Report file name", example = "process.json")
            @RequestParam(required = false) String reportName) {

        if (reportWriter == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        String name = reportName == null || reportName.isBlank() ? options.getReportName() : reportName;
        log.debug("Reading process report {}", ProcessReportWriter.reportKey(origin, name));

        return reportWriter.read(origin, name)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Returns aggregate task outcomes since startup.
     *
     * @return the stats report
     */
    @GetMapping("/stats")
    @Operation(
        summary = "Get task outcome statistics",
        description = "Returns success and failure counts per derivative label and failure kind"
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Stats report generated successfully")
    })
    public Mono<ProcessingStatsReport> getStats() {
        return Mono.fromCallable(statsTracker::getReport);
    }
}
