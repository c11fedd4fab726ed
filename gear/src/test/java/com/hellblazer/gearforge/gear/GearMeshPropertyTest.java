/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.gearforge.gear;

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property based tests over random valid gears
 */
class GearMeshPropertyTest {

    private final GearGenerator generator = new GearGenerator(GearConfiguration.previewConfig());

    private static GearSpec spec(double inner, double depth, int teeth, double thickness, double step, int layers) {
        return new GearSpec(inner, inner + depth, teeth, thickness, ToothShapes.SINE, TwistFunction.linear(step),
                            layers);
    }

    @Property(tries = 50)
    @Label("Vertex and face counts follow the size law")
    void sizeLaw(@ForAll @DoubleRange(min = 0.5, max = 50) double inner,
                 @ForAll @DoubleRange(min = 0.1, max = 10) double depth, @ForAll @IntRange(min = 2, max = 40) int teeth,
                 @ForAll @DoubleRange(min = 0.1, max = 20) double thickness,
                 @ForAll @DoubleRange(min = -0.5, max = 0.5) double step,
                 @ForAll @IntRange(min = 1, max = 12) int layers) {
        var mesh = generator.generate(spec(inner, depth, teeth, thickness, step, layers));
        var points = teeth * GearConfiguration.previewConfig().getSamplesPerTooth();

        assertEquals((layers + 1) * points + 2, mesh.getVertexCount());
        assertEquals(layers * points + 2 * points, mesh.getFaceCount());
        assertEquals(layers * points, mesh.countFaces(4));
    }

    @Property(tries = 30)
    @Label("Every emitted face index references an emitted vertex")
    void faceIndicesInRange(@ForAll @IntRange(min = 2, max = 30) int teeth,
                            @ForAll @IntRange(min = 1, max = 10) int layers,
                            @ForAll @DoubleRange(min = -3, max = 3) double step) {
        var obj = generator.export(spec(10, 2, teeth, 3, step, layers));
        var vertices = obj.lines().filter(line -> line.startsWith("v ")).count();
        obj.lines().filter(line -> line.startsWith("f ")).forEach(line -> {
            var tokens = line.split(" ");
            for (int i = 1; i < tokens.length; i++) {
                var index = Long.parseLong(tokens[i]);
                assertTrue(index >= 1 && index <= vertices, line);
            }
        });
    }

    @Property(tries = 20)
    @Label("Generation is deterministic")
    void deterministic(@ForAll @IntRange(min = 2, max = 30) int teeth, @ForAll @IntRange(min = 1, max = 10) int layers,
                       @ForAll @DoubleRange(min = -1, max = 1) double step) {
        var spec = spec(10, 2, teeth, 3, step, layers);
        assertArrayEquals(generator.exportBytes(spec), generator.exportBytes(spec));
    }

    @Property(tries = 30)
    @Label("All vertices lie within the gear's radial and axial bounds")
    void verticesWithinBounds(@ForAll @DoubleRange(min = 0.5, max = 50) double inner,
                              @ForAll @DoubleRange(min = 0.1, max = 10) double depth,
                              @ForAll @IntRange(min = 2, max = 40) int teeth,
                              @ForAll @DoubleRange(min = 0.1, max = 20) double thickness) {
        var spec = new GearSpec(inner, inner + depth, teeth, thickness, u -> 4 * u - 1.5, null, 2);
        var mesh = generator.generate(spec);
        var ringVertices = mesh.getVertexCount() - 2;
        for (int v = 0; v < ringVertices; v++) {
            var vertex = mesh.getVertex(v);
            var radius = Math.hypot(vertex.x, vertex.y);
            assertTrue(radius >= inner - 1e-9 && radius <= inner + depth + 1e-9, "radius " + radius);
            assertTrue(vertex.z >= 0 && vertex.z <= thickness);
        }
    }
}
