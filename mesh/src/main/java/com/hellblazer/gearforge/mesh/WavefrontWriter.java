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
package com.hellblazer.gearforge.mesh;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Serializes a {@link PolygonMesh} as Wavefront OBJ text.
 * <p>
 * Layout: optional {@code #} header, {@code o} line, every vertex as {@code v x y z} in index order, {@code s off},
 * then every face as {@code f i1 i2 i3 ...} with 1-based indices in face order. Coordinates are written in fixed
 * point with at least the configured number of fractional digits and never fewer than
 * {@value #MIN_SIGNIFICANT_DIGITS} significant digits, independent of the default locale, so identical meshes always
 * serialize to identical bytes and sub-unit meshes keep their shape.
 *
 * @author hal.hildebrand
 */
public class WavefrontWriter {
    public static final int MIN_SIGNIFICANT_DIGITS = 6;

    private static final Logger log = LoggerFactory.getLogger(WavefrontWriter.class);

    private final WavefrontExportOptions options;

    public WavefrontWriter() {
        this(WavefrontExportOptions.defaultConfig());
    }

    public WavefrontWriter(WavefrontExportOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Serialize the mesh to a string
     */
    public String write(PolygonMesh mesh) {
        var out = new StringWriter();
        try {
            write(mesh, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Serialize the mesh to UTF-8 bytes
     */
    public byte[] toBytes(PolygonMesh mesh) {
        return write(mesh).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Export the mesh to a file, replacing any existing content
     *
     * @throws IOException if file writing fails
     */
    public void write(PolygonMesh mesh, Path file) throws IOException {
        try (var writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(mesh, writer);
        }
        log.debug("Wrote {} to {}", mesh, file);
    }

    /**
     * Stream the mesh to a writer. The writer is flushed but not closed.
     *
     * @throws IOException if writing fails
     */
    public void write(PolygonMesh mesh, Writer writer) throws IOException {
        var out = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);

        if (options.getHeader() != null) {
            out.write("# " + options.getHeader() + "\n");
        }
        out.write("o " + options.getObjectName() + "\n");

        var scale = options.getScale();
        var offset = options.getOffset();
        for (int i = 0; i < mesh.getVertexCount(); i++) {
            var v = mesh.getVertex(i);
            out.write("v ");
            out.write(format(v.x * scale.x + offset.x));
            out.write(' ');
            out.write(format(v.y * scale.y + offset.y));
            out.write(' ');
            out.write(format(v.z * scale.z + offset.z));
            out.write('\n');
        }

        out.write("s off\n");

        // a mirroring scale turns the mesh inside out; flip windings to keep normals outward
        var mirrored = scale.x * scale.y * scale.z < 0;
        for (var face : mesh.getFaces()) {
            var oriented = mirrored ? face.reversed() : face;
            writeFace(out, oriented);
            if (options.isDoubleSided()) {
                writeFace(out, oriented.reversed());
            }
        }
        out.flush();
    }

    private void writeFace(Writer out, PolygonMesh.Face face) throws IOException {
        if (options.isTriangulate() && face.size() > 3) {
            for (int i = 1; i < face.size() - 1; i++) {
                writeIndices(out, face.index(0), face.index(i), face.index(i + 1));
            }
        } else {
            writeIndices(out, face.indices());
        }
    }

    private static void writeIndices(Writer out, int... indices) throws IOException {
        out.write('f');
        for (var index : indices) {
            out.write(' ');
            out.write(Integer.toString(index + 1));
        }
        out.write('\n');
    }

    /**
     * Fixed point, never scientific notation, never negative zero. Small magnitudes get extra fractional digits so
     * that {@link #MIN_SIGNIFICANT_DIGITS} significant digits survive.
     */
    String format(double value) {
        var decimal = BigDecimal.valueOf(value);
        var scale = options.getDecimals();
        if (decimal.signum() != 0) {
            // decimal exponent of the leading digit, exact for any double
            var exponent = decimal.precision() - decimal.scale() - 1;
            scale = Math.max(scale, MIN_SIGNIFICANT_DIGITS - 1 - exponent);
        }
        return decimal.setScale(scale, RoundingMode.HALF_EVEN).toPlainString();
    }
}
