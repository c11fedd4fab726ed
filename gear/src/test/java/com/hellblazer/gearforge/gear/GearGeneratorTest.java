/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.gearforge.gear;

import com.hellblazer.gearforge.mesh.WavefrontExportOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end tests from gear parameters to OBJ output
 *
 * @author hal.hildebrand
 */
public class GearGeneratorTest {

    private static GearSpec helical() {
        return GearSpec.builder()
                       .withRadii(20, 24)
                       .withTeeth(12)
                       .withThickness(4)
                       .withTwist(layer -> layer / 8.0)
                       .withVerticalLayers(8)
                       .build();
    }

    @Test
    void testExportLayout() {
        var generator = new GearGenerator();
        var spec = new GearSpec(20, 24, 12, 4, null, null, 1);
        var lines = generator.export(spec).split("\n");
        var points = 12 * GearConfiguration.DEFAULT_SAMPLES_PER_TOOTH;
        var vertices = 2 * points + 2;

        assertEquals("o gear", lines[0]);
        assertEquals("v 24.000000 0.000000 0.000000", lines[1]);
        assertEquals("v 24.000000 0.000000 4.000000", lines[1 + points]);
        assertEquals("v 0.000000 0.000000 0.000000", lines[vertices - 1]);
        assertEquals("v 0.000000 0.000000 4.000000", lines[vertices]);
        assertEquals("s off", lines[vertices + 1]);
        assertEquals("f 1 2 " + (points + 2) + " " + (points + 1), lines[vertices + 2]);
        assertEquals(1 + vertices + 1 + 3 * points, lines.length);
        assertEquals("f " + (2 * points + 1) + " 2 1", lines[vertices + 2 + points]);
    }

    @Test
    void testSubUnitGearKeepsDistinctVertices() {
        var generator = new GearGenerator();
        var spec = new GearSpec(0.00001, 0.00002, 12, 0.00001, null, null, 1);
        var mesh = generator.generate(spec);
        var obj = generator.export(spec);

        var vertexLines = obj.lines().filter(line -> line.startsWith("v ")).collect(Collectors.toList());
        assertEquals(mesh.getVertexCount(), vertexLines.size());
        assertEquals(mesh.getVertexCount(), new HashSet<>(vertexLines).size());
        assertFalse(obj.contains("E"), "scientific notation in output");
    }

    @Test
    void testOutputIsDeterministic() {
        var first = new GearGenerator().exportBytes(helical());
        var second = new GearGenerator().exportBytes(helical());
        assertArrayEquals(first, second);

        var parallel = new GearGenerator(GearConfiguration.builder().withParallelLayers(true).build());
        assertArrayEquals(first, parallel.exportBytes(helical()));
    }

    @Test
    void testFaceIndicesReferenceEmittedVertices() {
        var obj = new GearGenerator().export(helical());
        var vertexCount = 0;
        var faceCount = 0;
        for (var line : obj.split("\n")) {
            if (line.startsWith("v ")) {
                assertEquals(0, faceCount, "vertex after faces");
                assertEquals(4, line.split(" ").length);
                assertFalse(line.contains("E"), line);
                vertexCount++;
            } else if (line.startsWith("f ")) {
                var tokens = line.split(" ");
                assertTrue(tokens.length == 4 || tokens.length == 5, line);
                for (int i = 1; i < tokens.length; i++) {
                    var index = Integer.parseInt(tokens[i]);
                    assertTrue(index >= 1 && index <= vertexCount, line);
                }
                faceCount++;
            }
        }
        var points = 12 * GearConfiguration.DEFAULT_SAMPLES_PER_TOOTH;
        assertEquals(9 * points + 2, vertexCount);
        assertEquals(8 * points + 2 * points, faceCount);
    }

    @Test
    void testGenerateMatchesExport() {
        var generator = new GearGenerator(GearConfiguration.previewConfig());
        var mesh = generator.generate(helical());
        var obj = generator.export(helical());
        assertEquals(mesh.getVertexCount(), obj.lines().filter(l -> l.startsWith("v ")).count());
        assertEquals(mesh.getFaceCount(), obj.lines().filter(l -> l.startsWith("f ")).count());
    }

    @Test
    void testExportOptionsApplied() {
        var options = WavefrontExportOptions.builder()
                                            .withObjectName("fishbone")
                                            .withTriangulate(true)
                                            .withDecimals(3)
                                            .build();
        var config = GearConfiguration.builder().withSamplesPerTooth(4).withExportOptions(options).build();
        var spec = new GearSpec(14, 16, 16, 4, ToothShapes.V_SHAPE, TwistFunction.fishbone(0.2, 7), 7);
        var obj = new GearGenerator(config).export(spec);

        assertTrue(obj.startsWith("o fishbone\nv 16.000 0.000 0.000\n"));
        var points = 16 * 4;
        assertEquals(7 * points * 2 + 2 * points, obj.lines().filter(l -> l.startsWith("f ")).count());
    }

    @Test
    void testDefaultFileName() {
        assertEquals("12t_24r_4y.obj", GearGenerator.defaultFileName(helical()));
        assertEquals("10t_18.5r_0.25y.obj",
                     GearGenerator.defaultFileName(new GearSpec(2, 18.5, 10, 0.25, null, null, 1)));
    }

    @Test
    void testWriteToDirectory(@TempDir Path dir) throws IOException {
        var generator = new GearGenerator(GearConfiguration.previewConfig());
        var file = generator.write(helical(), dir);
        assertEquals(dir.resolve("12t_24r_4y.obj"), file);
        assertArrayEquals(generator.exportBytes(helical()), Files.readAllBytes(file));

        var named = generator.write(helical(), dir.resolve("helical.obj"));
        assertEquals(Files.readString(file), Files.readString(named));
    }

    @Test
    void testFailedGenerationWritesNothing(@TempDir Path dir) throws IOException {
        var spec = new GearSpec(20, 24, 12, 4, u -> {
            throw new IllegalArgumentException("broken profile");
        }, null, 1);
        var target = dir.resolve("broken.obj");

        assertThrows(GearException.ShapeFunctionException.class, () -> new GearGenerator().write(spec, target));
        assertFalse(Files.exists(target));
        try (var listing = Files.list(dir)) {
            assertEquals(0, listing.count());
        }
    }
}
