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

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SourceUris} and the URI variants it produces.
 */
class SourceUrisTest {

    @Test
    void parse_shouldTreatBarePathAsFile() {
        // When
        SourceUri uri = SourceUris.parse("avocado.png");

        // Then
        assertThat(uri).isInstanceOf(FileUri.class);
        assertThat(uri.driver()).isEqualTo("file");
        assertThat(uri.origin()).isEqualTo("avocado.png");
        assertThat(uri.toString()).isEqualTo("avocado.png");
    }

    @Test
    void parse_shouldStripLeadingSlashesFromFileOrigin() {
        // When
        SourceUri uri = SourceUris.parse("file:///fruit/avocado.png");

        // Then
        assertThat(uri).isInstanceOf(FileUri.class);
        assertThat(uri.origin()).isEqualTo("fruit/avocado.png");
    }

    @Test
    void parse_shouldNormaliseBareAbsolutePath() {
        // When
        SourceUri uri = SourceUris.parse("/data/fruit%20bowl/avocado.png");

        // Then
        assertThat(uri).isInstanceOf(FileUri.class);
        assertThat(uri.origin()).isEqualTo("data/fruit bowl/avocado.png");
        assertThat(uri.origin()).isEqualTo(SourceUris.parse("file:///data/fruit%20bowl/avocado.png").origin());
        assertThat(uri.toString()).isEqualTo("/data/fruit%20bowl/avocado.png");
    }

    @Test
    void parse_shouldRejectMalformedPercentEncoding() {
        // When & Then
        assertThatThrownBy(() -> SourceUris.parse("file:///100%.png"))
                .isInstanceOf(InvalidSourceUriException.class)
                .hasMessageContaining("100%.png");
    }

    @Test
    void parse_shouldReadIdSecretParameters() {
        // When
        SourceUri uri = SourceUris.parse("idsecret:///avocado.png?id=1234&secret=abc&secret_o=def");

        // Then
        assertThat(uri).isInstanceOf(IdSecretUri.class);
        assertThat(uri.driver()).isEqualTo("idsecret");
        assertThat(uri.origin()).isEqualTo("avocado.png");
        assertThat(((IdSecretUri) uri).id()).isEqualTo(1234L);
    }

    @Test
    void parse_shouldReadRewriteTarget() {
        // When
        SourceUri uri = SourceUris.parse("rewrite:///avocado.png?target=123/4/1234_abc_b.jpg");

        // Then
        assertThat(uri).isInstanceOf(RewriteUri.class);
        assertThat(uri.origin()).isEqualTo("avocado.png");
        assertThat(((RewriteUri) uri).target()).isEqualTo("123/4/1234_abc_b.jpg");
    }

    @Test
    void parse_shouldRejectUnknownDriver() {
        assertThatThrownBy(() -> SourceUris.parse("s3:///bucket/avocado.png"))
                .isInstanceOf(InvalidSourceUriException.class)
                .hasMessageContaining("s3");
    }

    @Test
    void parse_shouldRejectBlankUri() {
        assertThatThrownBy(() -> SourceUris.parse(" "))
                .isInstanceOf(InvalidSourceUriException.class);
    }

    @Test
    void parse_shouldRejectIdSecretWithoutSecret() {
        assertThatThrownBy(() -> SourceUris.parse("idsecret:///avocado.png?id=1234"))
                .isInstanceOf(InvalidSourceUriException.class)
                .hasMessageContaining("secret");
    }

    @Test
    void parse_shouldRejectNonNumericId() {
        assertThatThrownBy(() -> SourceUris.parse("idsecret:///avocado.png?id=abc&secret=xyz"))
                .isInstanceOf(InvalidSourceUriException.class)
                .hasMessageContaining("non-numeric");
    }

    @Test
    void parse_shouldRejectRewriteWithoutTarget() {
        assertThatThrownBy(() -> SourceUris.parse("rewrite:///avocado.png"))
                .isInstanceOf(InvalidSourceUriException.class)
                .hasMessageContaining("target");
    }

    @Test
    void idSecretTarget_shouldSplitIdIntoDirectories() {
        // Given
        IdSecretUri uri = (IdSecretUri) SourceUris.parse("idsecret:///avocado.png?id=1234567&secret=abc&secret_o=def");

        // When
        String target = uri.target(Map.of("label", "b", "format", "jpg"));

        // Then
        assertThat(target).isEqualTo("123/456/7/1234567_abc_b.jpg");
    }

    @Test
    void idSecretTarget_shouldUseOriginalSecretForOriginals() {
        // Given
        IdSecretUri uri = (IdSecretUri) SourceUris.parse("idsecret:///avocado.png?id=1234&secret=abc&secret_o=def");

        // When
        String target = uri.target(Map.of("label", "o", "format", "png", "original", "1"));

        // Then
        assertThat(target).isEqualTo("123/4/1234_def_o.png");
    }

    @Test
    void idSecretTarget_shouldRequireFormat() {
        // Given
        IdSecretUri uri = (IdSecretUri) SourceUris.parse("idsecret:///avocado.png?id=1234&secret=abc");

        // When & Then
        assertThatThrownBy(() -> uri.target(Map.of("label", "b")))
                .isInstanceOf(InvalidSourceUriException.class)
                .hasMessageContaining("format");
    }

    @Test
    void toRewriteString_shouldPrefixSchemeOnce() {
        assertThat(RewriteUri.toRewriteString("/avocado.png?target=x.jpg"))
                .isEqualTo("rewrite:///avocado.png?target=x.jpg");
        assertThat(RewriteUri.toRewriteString("rewrite:///avocado.png?target=x.jpg"))
                .isEqualTo("rewrite:///avocado.png?target=x.jpg");
    }
}
