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
import org.fireflyframework.iiif.cache.DerivativesCache;
import org.fireflyframework.iiif.cache.DerivativesCaches;
import org.fireflyframework.iiif.cache.ProcessReportWriter;
import org.fireflyframework.iiif.resiliency.BackendResiliencyRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the derivatives cache and the process report store on top of it.
 *
 * <p>The cache implementation is selected by {@code firefly.iiif.derivatives.cache.name}:</p>
 * <ul>
 *   <li>{@code memory} - in-process map (default)</li>
 *   <li>{@code disk} - files under {@code firefly.iiif.derivatives.cache.path}</li>
 *   <li>{@code null} - discards every write</li>
 * </ul>
 */
@Slf4j
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(IiifProcessProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.iiif",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class DerivativesCacheAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DerivativesCache derivativesCache(IiifProcessProperties properties) {
        DerivativesCache cache = DerivativesCaches.fromConfig(properties.getDerivatives().getCache());
        log.info("Configuring derivatives cache '{}'", cache.getName());
        return cache;
    }

    @Bean
    @ConditionalOnMissingBean
    public BackendResiliencyRegistry backendResiliencyRegistry(IiifProcessProperties properties) {
        log.info("Configuring backend resiliency for {}", properties.getResiliency().keySet());
        return new BackendResiliencyRegistry(properties.getResiliency());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessReportWriter processReportWriter(DerivativesCache derivativesCache,
                                                   ObjectProvider<ObjectMapper> objectMapper,
                                                   BackendResiliencyRegistry resiliency) {
        return new ProcessReportWriter(derivativesCache, objectMapper.getIfAvailable(ObjectMapper::new), resiliency);
    }
}
