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

package org.fireflyframework.iiif.resiliency;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Registry that manages per-backend Resilience4j instances.
 *
 * <p>Each backend ({@value #DRIVER}, {@value #PROCESSOR}, {@value #PALETTE}, {@value #REPORT})
 * can have its own retry, bulkhead and timeout settings. Backends without configuration
 * are passed through undecorated.</p>
 *
 * <p>Decoration is applied in order: bulkhead, retry, timeout.</p>
 */
@Slf4j
public class BackendResiliencyRegistry {

    public static final String DRIVER = "driver";
    public static final String PROCESSOR = "processor";
    public static final String PALETTE = "palette";
    public static final String REPORT = "report";

    private final Map<String, BackendResiliencyInstances> backendInstances = new ConcurrentHashMap<>();

    public BackendResiliencyRegistry(Map<String, BackendResiliencyConfig> backendConfigs) {
        backendConfigs.forEach((backend, config) -> {
            backendInstances.put(backend, createInstances(backend, config));
            log.info("Registered resilience configuration for backend '{}': retry={}, bulkhead={}, timeoutMs={}",
                    backend, config.isRetryEnabled(), config.isBulkheadEnabled(), config.getTimeoutMs());
        });

        log.info("Initialized BackendResiliencyRegistry with {} backend-specific configurations", backendInstances.size());
    }

    /**
     * Returns a registry that decorates nothing.
     */
    public static BackendResiliencyRegistry none() {
        return new BackendResiliencyRegistry(Map.of());
    }

    /**
     * Decorates a backend call with the backend's resiliency patterns.
     *
     * @param backend   the backend name
     * @param operation the reactive operation to decorate
     * @param <T>       the return type
     * @return the decorated operation, or {@code operation} itself when the backend is not configured
     */
    public <T> Mono<T> decorate(String backend, Mono<T> operation) {
        BackendResiliencyInstances instances = backendInstances.get(backend);

        if (instances == null) {
            return operation;
        }

        Mono<T> decorated = operation;

        if (instances.bulkhead() != null) {
            decorated = decorated.transformDeferred(BulkheadOperator.of(instances.bulkhead()));
        }

        if (instances.retry() != null) {
            decorated = decorated.transformDeferred(RetryOperator.of(instances.retry()));
        }

        if (instances.timeoutMs() > 0) {
            decorated = decorated.timeout(Duration.ofMillis(instances.timeoutMs()));
        }

        return decorated;
    }

    /**
     * Returns whether a backend-specific configuration exists.
     *
     * @param backend the backend name
     * @return true if the backend has explicit resilience configuration
     */
    public boolean hasBackendConfig(String backend) {
        return backendInstances.containsKey(backend);
    }

    private BackendResiliencyInstances createInstances(String backend, BackendResiliencyConfig config) {
        Retry retry = null;
        Bulkhead bulkhead = null;

        if (config.isRetryEnabled()) {
            RetryConfig retryConfig = RetryConfig.custom()
                    .maxAttempts(config.getRetryMaxAttempts())
                    .waitDuration(Duration.ofMillis(config.getRetryWaitDurationMs()))
                    .retryExceptions(Exception.class)
                    .ignoreExceptions(TimeoutException.class)
                    .build();
            retry = Retry.of(backend, retryConfig);
        }

        if (config.isBulkheadEnabled()) {
            BulkheadConfig bulkheadConfig = BulkheadConfig.custom()
                    .maxConcurrentCalls(config.getBulkheadMaxConcurrentCalls())
                    .maxWaitDuration(Duration.ofMillis(config.getBulkheadMaxWaitDurationMs()))
                    .build();
            bulkhead = Bulkhead.of(backend, bulkheadConfig);
        }

        return new BackendResiliencyInstances(retry, bulkhead, config.getTimeoutMs());
    }

    private record BackendResiliencyInstances(
            Retry retry,
            Bulkhead bulkhead,
            long timeoutMs
    ) {}
}
