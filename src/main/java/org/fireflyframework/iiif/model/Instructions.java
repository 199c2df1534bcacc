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
import lombok.extern.jackson.Jacksonized;

/**
 * IIIF image parameters for a single derivative.
 *
 * <p>Any field may be left unset in an instructions document; {@link #ensureDefaults()}
 * resolves the blanks before the instructions are handed to an
 * {@link org.fireflyframework.iiif.image.ImageProcessor}.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * {"region": "-1,-1,320,320", "size": "full", "quality": "dither", "format": "jpg"}
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Instructions {

    public static final String DEFAULT_REGION = "full";
    public static final String DEFAULT_SIZE = "full";
    public static final String DEFAULT_ROTATION = "0";
    public static final String DEFAULT_QUALITY = "color";
    public static final String DEFAULT_FORMAT = "jpg";

    String region;
    String size;
    String rotation;
    String quality;
    String format;

    /**
     * Returns a copy of these instructions with every blank field replaced by its default.
     *
     * @return the resolved instructions
     */
    public Instructions ensureDefaults() {
        return toBuilder()
                .region(orDefault(region, DEFAULT_REGION))
                .size(orDefault(size, DEFAULT_SIZE))
                .rotation(orDefault(rotation, DEFAULT_ROTATION))
                .quality(orDefault(quality, DEFAULT_QUALITY))
                .format(orDefault(format, DEFAULT_FORMAT))
                .build();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
