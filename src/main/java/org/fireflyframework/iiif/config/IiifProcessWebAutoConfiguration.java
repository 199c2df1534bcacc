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

import org.fireflyframework.iiif.cache.ProcessReportWriter;
import org.fireflyframework.iiif.controller.ProcessController;
import org.fireflyframework.iiif.controller.advice.ProcessExceptionHandler;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.fireflyframework.iiif.process.BatchProcessRunner;
import org.fireflyframework.iiif.stats.ProcessingStatsTracker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;

/**
 * Registers the process REST endpoints in reactive web applications.
 *
 * <p>Disable with {@code firefly.iiif.web.enabled=false}.</p>
 */
@AutoConfiguration(after = IiifProcessAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@ConditionalOnProperty(prefix = "firefly.iiif.web", name = "enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnBean(BatchProcessRunner.class)
public class IiifProcessWebAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProcessController processController(BatchProcessRunner batchRunner,
                                               ProcessOptions processOptions,
                                               ObjectProvider<ProcessReportWriter> reportWriter,
                                               ProcessingStatsTracker statsTracker) {
        return new ProcessController(batchRunner, processOptions, reportWriter.getIfAvailable(), statsTracker);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessExceptionHandler processExceptionHandler() {
        return new ProcessExceptionHandler();
    }
}
