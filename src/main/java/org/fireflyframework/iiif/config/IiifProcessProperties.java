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

import lombok.Data;
import org.fireflyframework.iiif.model.ProcessOptions;
import org.fireflyframework.iiif.resiliency.BackendResiliencyConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration properties for IIIF derivative processing.
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   iiif:
 *     profile:
 *       services:
 *         enable: [palette]
 *     palette:
 *       extruder: vibrant
 *       count: 5
 *     derivatives:
 *       cache:
 *         name: disk
 *         path: /var/cache/iiif
 *     process:
 *       report: true
 *       report-name: process.json
 *       instructions-location: classpath:instructions.json
 *     resiliency:
 *       processor:
 *         retry-enabled: true
 *         retry-max-attempts: 2
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.iiif")
public class IiifProcessProperties {

    /** Service name that enables palette extraction. */
    public static final String PALETTE_SERVICE = "palette";

    private boolean enabled = true;

    private Profile profile = new Profile();

    private Palette palette = new Palette();

    private Derivatives derivatives = new Derivatives();

    private ProcessSettings process = new ProcessSettings();

    private Web web = new Web();

    /** Per-backend resilience settings keyed by backend name (driver, processor, palette, report). */
    private Map<String, BackendResiliencyConfig> resiliency = new HashMap<>();

    /**
     * Returns whether the named service is enabled in the active profile.
     *
     * @param service the service name, e.g. {@value #PALETTE_SERVICE}
     * @return true if the profile lists the service
     */
    public boolean isServiceEnabled(String service) {
        return profile.getServices().getEnable().stream()
                .anyMatch(name -> name != null && name.trim().toLowerCase(Locale.ROOT).equals(service));
    }

    @Data
    public static class Profile {
        private Services services = new Services();
    }

    @Data
    public static class Services {
        private List<String> enable = new ArrayList<>();
    }

    @Data
    public static class Palette {
        private String extruder = "vibrant";
        private int count = 5;
        private String grid = "euclidian";
        private List<String> palettes = new ArrayList<>(List.of("crayola", "css4"));
    }

    @Data
    public static class Derivatives {
        private Cache cache = new Cache();
    }

    @Data
    public static class Cache {
        /** One of {@code memory}, {@code disk} or {@code null}. */
        private String name = "memory";
        /** Root directory of the {@code disk} cache. */
        private String path;
    }

    @Data
    public static class ProcessSettings {
        private boolean report = false;
        private String reportName = ProcessOptions.DEFAULT_REPORT_NAME;
        private String instructionsLocation = "classpath:instructions.json";
        private Cli cli = new Cli();
    }

    @Data
    public static class Cli {
        private boolean enabled = false;
    }

    @Data
    public static class Web {
        private boolean enabled = true;
    }
}
