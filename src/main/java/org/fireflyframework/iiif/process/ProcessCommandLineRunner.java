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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.model.BatchReport;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.io.PrintStream;
import java.util.List;

/**
 * Processes the source URIs given as application arguments and prints the batch report as JSON.
 *
 * <p>Non-option arguments are source URIs. {@code --report} enables process reports and
 * {@code --report-name=<name>} overrides the report file name.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>
 * java -jar app.jar --firefly.iiif.process.cli.enabled=true --report avocado.png
 * {"avocado.png":{"uris":{...},"dimensions":{...}}}
 * </pre>
 */
@Slf4j
public class ProcessCommandLineRunner implements ApplicationRunner {

    private final BatchProcessRunner batchRunner;
    private final ProcessOptions options;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public ProcessCommandLineRunner(BatchProcessRunner batchRunner, ProcessOptions options, ObjectMapper objectMapper) {
        this(batchRunner, options, objectMapper, System.out);
    }

    public ProcessCommandLineRunner(BatchProcessRunner batchRunner, ProcessOptions options,
                                    ObjectMapper objectMapper, PrintStream out) {
        this.batchRunner = batchRunner;
        this.options = options;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> uris = args.getNonOptionArgs();
        if (uris.isEmpty()) {
            log.warn("No source URIs given, nothing to process");
            return;
        }

        ProcessOptions runOptions = options;
        if (args.containsOption("report")) {
            runOptions = runOptions.toBuilder().report(true).build();
        }
        List<String> reportName = args.getOptionValues("report-name");
        if (reportName != null && !reportName.isEmpty()) {
            runOptions = runOptions.toBuilder().reportName(reportName.get(0)).build();
        }

        log.info("Processing {} sources from the command line", uris.size());
        BatchReport report = batchRunner.processUris(runOptions, uris).block();
        out.println(objectMapper.writeValueAsString(report));
    }
}
