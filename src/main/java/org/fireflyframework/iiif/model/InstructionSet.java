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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.EqualsAndHashCode;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Keyed collection of {@link Instructions}, one entry per derivative label.
 *
 * <p>Entries are independent of each other; iteration order carries no meaning.
 * The label {@value #ORIGINAL_LABEL} is reserved for the unmodified source image, and
 * {@value TaskFailure#PALETTE_TASK} names the palette task and cannot be used.</p>
 *
 * <p><b>Example document:</b></p>
 * <pre>{@code
 * {
 *   "o": {"size": "full", "rotation": "-1"},
 *   "b": {"size": "!2048,1536", "format": "jpg"},
 *   "d": {"region": "-1,-1,320,320", "quality": "dither", "format": "jpg"}
 * }
 * }</pre>
 */
@EqualsAndHashCode
public final class InstructionSet {

    /** Label denoting the unmodified original. */
    public static final String ORIGINAL_LABEL = "o";

    private static final TypeReference<LinkedHashMap<String, Instructions>> DOCUMENT_TYPE =
            new TypeReference<>() {};

    private final Map<String, Instructions> entries;

    private InstructionSet(Map<String, Instructions> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Creates an instruction set from a label-keyed map.
     *
     * @param entries the instructions by label
     * @return the instruction set
     * @throws InvalidInstructionSetException if a label is blank or reserved, or its instructions are missing
     */
    public static InstructionSet of(Map<String, Instructions> entries) {
        if (entries == null) {
            throw new InvalidInstructionSetException("Instruction set is required but was null");
        }
        entries.forEach((label, instructions) -> {
            if (label == null || label.isBlank()) {
                throw new InvalidInstructionSetException("Instruction labels must not be blank");
            }
            if (TaskFailure.PALETTE_TASK.equals(label)) {
                throw new InvalidInstructionSetException(
                        "Instruction label '" + label + "' is reserved for the palette task");
            }
            if (instructions == null) {
                throw new InvalidInstructionSetException("Instructions for label '" + label + "' are missing");
            }
        });
        return new InstructionSet(entries);
    }

    /**
     * Returns an instruction set without entries. Processing it still derives the palette.
     *
     * @return the empty set
     */
    public static InstructionSet empty() {
        return new InstructionSet(Map.of());
    }

    /**
     * Reads an instructions document.
     *
     * @param objectMapper the mapper used to decode the document
     * @param document     the JSON document
     * @return the instruction set
     * @throws InvalidInstructionSetException if the document cannot be decoded
     */
    public static InstructionSet fromJson(ObjectMapper objectMapper, InputStream document) {
        try {
            return of(objectMapper.readValue(document, DOCUMENT_TYPE));
        } catch (IOException e) {
            throw new InvalidInstructionSetException("Unable to read instructions document: " + e.getMessage(), e);
        }
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Set<String> labels() {
        return entries.keySet();
    }

    public Instructions get(String label) {
        return entries.get(label);
    }

    public void forEach(BiConsumer<String, Instructions> action) {
        entries.forEach(action);
    }

    public Map<String, Instructions> asMap() {
        return entries;
    }

    @Override
    public String toString() {
        return "InstructionSet" + entries.keySet();
    }
}
