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

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Request body of the batch processing endpoint.
 *
 * <p><b>Example Request:</b></p>
 * <pre>{@code
 * {
 *   "uris": ["avocado.png", "idsecret:///banana.jpg?id=1234&secret=abc&secret_o=def"],
 *   "report": true
 * }
 * }</pre>
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Source images to process with the configured instruction set")
public class ProcessApiRequest {

    @Schema(description = "Source URIs, processed in order", example = "[\"avocado.png\"]")
    List<String> uris;

    @Schema(description = "Whether to persist a process report per source; defaults to configuration", example = "true")
    Boolean report;

    @Schema(description = "Report file name; defaults to configuration", example = "process.json")
    String reportName;
}
