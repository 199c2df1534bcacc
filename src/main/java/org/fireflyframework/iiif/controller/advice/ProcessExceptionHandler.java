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

package org.fireflyframework.iiif.controller.advice;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.model.InvalidInstructionSetException;
import org.fireflyframework.iiif.uri.InvalidSourceUriException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates setup-level processing errors into HTTP 400 responses.
 */
@Slf4j
@RestControllerAdvice(basePackages = "org.fireflyframework.iiif.controller")
public class ProcessExceptionHandler {

    @ExceptionHandler(InvalidSourceUriException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSourceUri(InvalidSourceUriException ex) {
        log.warn("Rejected process request: {}", ex.getMessage());
        return badRequest("Invalid Source URI", ex.getMessage());
    }

    @ExceptionHandler(InvalidInstructionSetException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInstructionSet(InvalidInstructionSetException ex) {
        log.warn("Rejected process request: {}", ex.getMessage());
        return badRequest("Invalid Instruction Set", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> badRequest(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", 400);
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
