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

package org.fireflyframework.iiif.support;

import org.fireflyframework.iiif.config.IiifProcessProperties;
import org.fireflyframework.iiif.image.ImageDriver;
import org.fireflyframework.iiif.image.ImageHandle;
import org.fireflyframework.iiif.image.ImageProcessor;
import org.fireflyframework.iiif.image.ProcessedDerivative;
import org.fireflyframework.iiif.model.Dimensions;
import org.fireflyframework.iiif.model.InstructionSet;
import org.fireflyframework.iiif.model.Instructions;
import org.fireflyframework.iiif.model.ProcessOptions;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory imaging backend for tests.
 *
 * <p>The processor names each derivative {@code <origin>/<region>/<size>/<rotation>/<quality>.<format>}
 * and sizes it from its region or size parameter, falling back to the {@value #SOURCE_WIDTH}x{@value #SOURCE_HEIGHT} source.</p>
 */
public final class TestImaging {

    public static final int SOURCE_WIDTH = 4000;
    public static final int SOURCE_HEIGHT = 3000;

    private TestImaging() {}

    public static ImageHandle image(int width, int height) {
        return () -> new Dimensions(width, height);
    }

    public static ImageDriver driver() {
        return (config, origin) -> Mono.just(image(SOURCE_WIDTH, SOURCE_HEIGHT));
    }

    public static ImageProcessor processor() {
        return (uri, label, instructions) -> Mono.fromCallable(() -> derivative(uri.origin(), instructions));
    }

    public static ProcessedDerivative derivative(String origin, Instructions instructions) {
        String name = String.join("/", origin, instructions.getRegion(), instructions.getSize(),
                instructions.getRotation(), instructions.getQuality() + "." + instructions.getFormat());
        return new ProcessedDerivative(name, image(instructions));
    }

    private static ImageHandle image(Instructions instructions) {
        String[] region = instructions.getRegion().split(",");
        if (region.length == 4) {
            return image(Integer.parseInt(region[2]), Integer.parseInt(region[3]));
        }
        String size = instructions.getSize().startsWith("!") ? instructions.getSize().substring(1) : instructions.getSize();
        String[] box = size.split(",");
        if (box.length == 2) {
            return image(Integer.parseInt(box[0]), Integer.parseInt(box[1]));
        }
        return image(SOURCE_WIDTH, SOURCE_HEIGHT);
    }

    /**
     * The three-label instruction set used throughout the tests: an unrotated original,
     * a bounded resize and a dithered square crop.
     */
    public static InstructionSet avocadoInstructions() {
        Map<String, Instructions> entries = new LinkedHashMap<>();
        entries.put("o", Instructions.builder().size("full").rotation("-1").build());
        entries.put("b", Instructions.builder().size("!2048,1536").format("jpg").build());
        entries.put("d", Instructions.builder().region("-1,-1,320,320").quality("dither").format("jpg").build());
        return InstructionSet.of(entries);
    }

    public static IiifProcessProperties config(String... enabledServices) {
        IiifProcessProperties properties = new IiifProcessProperties();
        properties.getProfile().getServices().setEnable(List.of(enabledServices));
        return properties;
    }

    public static ProcessOptions.ProcessOptionsBuilder options() {
        return ProcessOptions.builder()
                .config(config())
                .driver(driver())
                .processor(processor())
                .instructions(avocadoInstructions());
    }
}
