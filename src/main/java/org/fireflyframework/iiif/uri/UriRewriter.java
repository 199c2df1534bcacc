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

package org.fireflyframework.iiif.uri;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.iiif.model.InstructionSet;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the URI a derivative is processed from.
 *
 * <p>Sources implementing {@link TargetDerivingUri} are rewritten into a {@link RewriteUri}
 * naming the derivative's target path, since processors only accept structured rewrite URIs.
 * Every other source is processed as is.</p>
 */
@Slf4j
public class UriRewriter {

    /**
     * Returns the effective processing URI for one derivative.
     *
     * @param source the source URI
     * @param label  the derivative label
     * @param format the resolved output format
     * @return the rewritten URI, or {@code source} when it needs no rewriting
     * @throws UriRewriteException if the target cannot be derived or the rewrite URI cannot be parsed
     */
    public SourceUri rewrite(SourceUri source, String label, String format) {
        if (!(source instanceof TargetDerivingUri targetDeriving)) {
            return source;
        }

        Map<String, String> options = new LinkedHashMap<>();
        options.put("label", label);
        options.put("format", format);
        if (InstructionSet.ORIGINAL_LABEL.equals(label)) {
            options.put("original", "1");
        }

        try {
            String target = targetDeriving.target(options);
            String origin = UriUtils.encodePath(source.origin(), StandardCharsets.UTF_8);
            String rewritten = RewriteUri.toRewriteString(origin + "?target="
                    + UriUtils.encodeQueryParam(target, StandardCharsets.UTF_8));
            log.debug("Rewrote {} ({}) to {}", source, label, rewritten);
            return SourceUris.parse(rewritten);
        } catch (InvalidSourceUriException | IllegalArgumentException e) {
            throw new UriRewriteException(source, label, e);
        }
    }
}
