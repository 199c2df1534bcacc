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

import lombok.EqualsAndHashCode;
import org.springframework.web.util.UriComponents;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Source URI whose derivatives are stored under an id-and-secret path instead of the origin.
 *
 * <p>Form: {@code idsecret:///<origin>?id=<id>&secret=<secret>&secret_o=<original secret>}.
 * The target of a derivative is {@code <id path>/<id>_<secret>_<label>.<format>}, where the
 * id path splits the id into three-digit directories ({@code 1234567 -> 123/456/7}).
 * Originals ({@code original=1}) use {@code secret_o}.</p>
 */
@EqualsAndHashCode
public final class IdSecretUri implements TargetDerivingUri {

    public static final String DRIVER = "idsecret";

    private static final int ID_PATH_SEGMENT = 3;

    private final String uri;
    private final String origin;
    private final long id;
    private final String secret;
    private final String originalSecret;

    private IdSecretUri(String uri, String origin, long id, String secret, String originalSecret) {
        this.uri = uri;
        this.origin = origin;
        this.id = id;
        this.secret = secret;
        this.originalSecret = originalSecret;
    }

    static IdSecretUri parse(String uri) {
        UriComponents components = SourceUris.components(uri);
        String origin = SourceUris.origin(uri, components);

        String rawId = SourceUris.queryParam(components, "id");
        if (rawId == null || rawId.isBlank()) {
            throw new InvalidSourceUriException("idsecret URI is missing an id: " + uri);
        }
        long id;
        try {
            id = Long.parseLong(rawId);
        } catch (NumberFormatException e) {
            throw new InvalidSourceUriException("idsecret URI has a non-numeric id '" + rawId + "': " + uri);
        }
        if (id < 0) {
            throw new InvalidSourceUriException("idsecret URI has a negative id: " + uri);
        }

        String secret = SourceUris.queryParam(components, "secret");
        if (secret == null || secret.isBlank()) {
            throw new InvalidSourceUriException("idsecret URI is missing a secret: " + uri);
        }

        return new IdSecretUri(uri, origin, id, secret, SourceUris.queryParam(components, "secret_o"));
    }

    @Override
    public String target(Map<String, String> options) {
        String label = options.get("label");
        String format = options.get("format");

        if (label == null || label.isBlank()) {
            throw new InvalidSourceUriException("Missing label option for " + uri);
        }
        if (format == null || format.isBlank()) {
            throw new InvalidSourceUriException("Missing format option for " + uri);
        }

        String fileSecret = secret;
        if (options.containsKey("original")) {
            if (originalSecret == null || originalSecret.isBlank()) {
                throw new InvalidSourceUriException("Missing original secret (secret_o) for " + uri);
            }
            fileSecret = originalSecret;
        }

        String fileName = String.format("%d_%s_%s.%s", id, fileSecret, label, format);
        return idPath() + "/" + fileName;
    }

    private String idPath() {
        String digits = Long.toString(id);
        StringJoiner path = new StringJoiner("/");
        for (int start = 0; start < digits.length(); start += ID_PATH_SEGMENT) {
            path.add(digits.substring(start, Math.min(start + ID_PATH_SEGMENT, digits.length())));
        }
        return path.toString();
    }

    @Override
    public String driver() {
        return DRIVER;
    }

    @Override
    public String origin() {
        return origin;
    }

    public long id() {
        return id;
    }

    @Override
    public String toString() {
        return uri;
    }
}
