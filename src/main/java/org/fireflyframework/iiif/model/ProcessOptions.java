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

import lombok.Builder;
import lombok.Value;
import org.fireflyframework.iiif.config.IiifProcessProperties;
import org.fireflyframework.iiif.image.ImageDriver;
import org.fireflyframework.iiif.image.ImageProcessor;

/**
 * Everything a processing run needs besides the source URIs.
 */
@Value
@Builder(toBuilder = true)
public class ProcessOptions {

    public static final String DEFAULT_REPORT_NAME = "process.json";

    IiifProcessProperties config;
    ImageDriver driver;
    ImageProcessor processor;
    InstructionSet instructions;

    /** Whether a process report is persisted for each source. */
    boolean report;

    @Builder.Default
    String reportName = DEFAULT_REPORT_NAME;
}
