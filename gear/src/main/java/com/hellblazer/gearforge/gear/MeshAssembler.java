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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.List;
import java.util.Objects;

/**
 * Lifts rings into 3D and stitches them into a closed polygon mesh.
 * <p>
 * Vertex layout, with {@code P} points per ring and {@code V} vertical layers:
 * <ul>
 * <li>ring {@code L} point {@code i} at index {@code L * P + i}, {@code z = L * thickness / V}</li>
 * <li>bottom cap center at {@code (V + 1) * P}, top cap center at {@code (V + 1) * P + 1}</li>
 * </ul>
 * Face order: side wall quads band by band, then the bottom cap fan, then the top cap fan. Caps are fans around the
 * gear axis. Every ring is a function of angle around the axis, so the fan stays simple for concave tooth outlines.
 * Windings are counter-clockwise seen from outside the solid.
 *
 * @author hal.hildebrand
 */
public class MeshAssembler {
    private static final Logger log = LoggerFactory.getLogger(MeshAssembler.class);

    /**
     * Vertex count for a gear with the given ring size
     */
    public static int vertexCount(GearSpec spec, int pointsPerRing) {
        return Math.addExact(Math.multiplyExact(spec.ringCount(), pointsPerRing), 2);
    }

    /**
     * Face count for a gear with the given ring size: one quad per point per band plus one triangle per point per cap
     */
    public static int faceCount(GearSpec spec, int pointsPerRing) {
        return Math.multiplyExact(spec.verticalLayers() + 2, pointsPerRing);
    }

    /**
     * Assemble the mesh of a gear
     *
     * @param rings bottom to top, as produced by {@link RingBuilder#buildRings(GearSpec)}
     * @param spec  the gear the rings were built for
     * @throws GearException.InvalidParameterException if the rings do not match the gear or each other
     * @throws GearException.DegenerateMeshException   if a ring has a zero-length edge or a cap triangle no area
     */
    public PolygonMesh assemble(List<Ring> rings, GearSpec spec) {
        Objects.requireNonNull(rings, "rings");
        Objects.requireNonNull(spec, "spec");
        if (rings.size() != spec.ringCount()) {
            throw new GearException.InvalidParameterException("rings", "expected " + spec.ringCount() + " rings for "
                                                                       + spec.verticalLayers()
                                                                       + " vertical layers, got " + rings.size());
        }
        var points = rings.get(0).size();
        for (var ring : rings) {
            if (ring.size() != points) {
                throw new GearException.InvalidParameterException("rings",
                                                                  "ring " + ring.layer() + " has " + ring.size()
                                                                  + " points, expected " + points);
            }
        }

        var layers = spec.verticalLayers();
        var mesh = new PolygonMesh(vertexCount(spec, points), faceCount(spec, points));

        for (int layer = 0; layer <= layers; layer++) {
            var ring = rings.get(layer);
            var z = layerHeight(spec, layer);
            for (int i = 0; i < points; i++) {
                var p = ring.point(i);
                mesh.addVertex(p.x, p.y, z);
            }
            checkEdges(mesh, layer, points);
        }
        var bottom = mesh.addVertex(0, 0, 0);
        var top = mesh.addVertex(0, 0, spec.thickness());

        for (int layer = 0; layer < layers; layer++) {
            var base = layer * points;
            var above = base + points;
            for (int i = 0; i < points; i++) {
                var next = (i + 1) % points;
                mesh.addFace(base + i, base + next, above + next, above + i);
            }
        }

        for (int i = 0; i < points; i++) {
            var next = (i + 1) % points;
            addCapTriangle(mesh, 0, i, bottom, next, i);
        }
        var topBase = layers * points;
        for (int i = 0; i < points; i++) {
            var next = (i + 1) % points;
            addCapTriangle(mesh, layers, i, topBase + i, topBase + next, top);
        }

        log.debug("Assembled {} from {} rings of {} points", mesh, rings.size(), points);
        return mesh;
    }

    /**
     * Height of a layer's ring; the top ring lands exactly on the thickness
     */
    static double layerHeight(GearSpec spec, int layer) {
        if (layer == spec.verticalLayers()) {
            return spec.thickness();
        }
        return spec.thickness() * layer / spec.verticalLayers();
    }

    private static void checkEdges(PolygonMesh mesh, int layer, int points) {
        var base = layer * points;
        for (int i = 0; i < points; i++) {
            var current = mesh.getVertex(base + i);
            var next = mesh.getVertex(base + (i + 1) % points);
            if (current.x == next.x && current.y == next.y) {
                throw new GearException.DegenerateMeshException(layer, i, String.format(
                "points %d and %d coincide at (%.6f, %.6f)", i, (i + 1) % points, current.x, current.y));
            }
        }
    }

    private static void addCapTriangle(PolygonMesh mesh, int layer, int point, int a, int b, int c) {
        if (area(mesh.getVertex(a), mesh.getVertex(b), mesh.getVertex(c)) == 0.0) {
            throw new GearException.DegenerateMeshException(layer, point, "cap triangle has zero area");
        }
        mesh.addFace(a, b, c);
    }

    /**
     * Twice the signed area of the triangle projected on the x-y plane
     */
    private static double area(Point3d a, Point3d b, Point3d c) {
        return (b.x - a.x) * (c.y - a.y) - (c.x - a.x) * (b.y - a.y);
    }
}
