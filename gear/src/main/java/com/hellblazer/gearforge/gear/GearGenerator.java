/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Gearforge.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.gearforge.gear;

import com.hellblazer.gearforge.mesh.PolygonMesh;
import com.hellblazer.gearforge.mesh.WavefrontWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point for gear generation: parameters to rings to mesh to Wavefront OBJ.
 * <p>
 * Each call allocates its own rings and mesh; a generator holds nothing but its configuration and may be shared
 * between threads. Serialization starts only once the mesh is fully assembled, so a failed generation never
 * produces partial output.
 *
 * @author hal.hildebrand
 */
public class GearGenerator {
    private static final Logger log = LoggerFactory.getLogger(GearGenerator.class);

    private final RingBuilder     ringBuilder;
    private final MeshAssembler   assembler;
    private final WavefrontWriter writer;

    public GearGenerator() {
        this(GearConfiguration.defaultConfig());
    }

    public GearGenerator(GearConfiguration config) {
        Objects.requireNonNull(config, "config");
        this.ringBuilder = new RingBuilder(config);
        this.assembler = new MeshAssembler();
        this.writer = new WavefrontWriter(config.getExportOptions());
    }

    /**
     * File name derived from the gear's parameters, {@code <teeth>t_<outer radius>r_<thickness>y.obj}
     */
    public static String defaultFileName(GearSpec spec) {
        return spec.teeth() + "t_" + compact(spec.outerRadius()) + "r_" + compact(spec.thickness()) + "y.obj";
    }

    private static String compact(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Build the gear's mesh
     */
    public PolygonMesh generate(GearSpec spec) {
        var start = System.nanoTime();
        var rings = ringBuilder.buildRings(spec);
        var mesh = assembler.assemble(rings, spec);
        log.info("Generated {} tooth gear: {} rings, {} vertices, {} faces in {} ms", spec.teeth(), rings.size(),
                 mesh.getVertexCount(), mesh.getFaceCount(), (System.nanoTime() - start) / 1_000_000);
        return mesh;
    }

    /**
     * Generate the gear and serialize it as OBJ text
     */
    public String export(GearSpec spec) {
        return writer.write(generate(spec));
    }

    /**
     * Generate the gear and serialize it as UTF-8 OBJ bytes
     */
    public byte[] exportBytes(GearSpec spec) {
        return writer.toBytes(generate(spec));
    }

    /**
     * Generate the gear and write it to a file. A directory target receives {@link #defaultFileName(GearSpec)}.
     *
     * @return the file written
     * @throws IOException if file writing fails
     */
    public Path write(GearSpec spec, Path target) throws IOException {
        var file = Files.isDirectory(target) ? target.resolve(defaultFileName(spec)) : target;
        var bytes = exportBytes(spec);
        Files.write(file, bytes);
        log.info("Wrote {} bytes to {}", bytes.length, file);
        return file;
    }
}
