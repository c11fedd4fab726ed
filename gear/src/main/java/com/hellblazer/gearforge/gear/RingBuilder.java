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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Profile and layer builder: samples the tooth shape around the circumference and applies each layer's twist,
 * producing {@code verticalLayers + 1} rings of identical size.
 * <p>
 * A ring's radius at in-tooth position {@code u} is {@code innerRadius + height(u) * toothDepth}, clamped into
 * [innerRadius, outerRadius]. Each layer depends only on the GearSpec and its own index, so layers may be computed in
 * parallel; the result is always in layer order.
 *
 * @author hal.hildebrand
 */
public class RingBuilder {
    private static final Logger log = LoggerFactory.getLogger(RingBuilder.class);

    private final GearConfiguration config;

    public RingBuilder() {
        this(GearConfiguration.defaultConfig());
    }

    public RingBuilder(GearConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Number of points in every ring of the gear
     *
     * @throws GearException.InvalidParameterException if the ring size does not fit an int
     */
    public int pointsPerRing(GearSpec spec) {
        try {
            return Math.multiplyExact(spec.teeth(), config.getSamplesPerTooth());
        } catch (ArithmeticException e) {
            throw new GearException.InvalidParameterException("teeth", String.format(
            "%d teeth at %d samples overflow the ring size", spec.teeth(), config.getSamplesPerTooth()));
        }
    }

    /**
     * Build the rings of a gear, bottom face first
     *
     * @throws GearException.InvalidParameterException if the mesh would exceed the configured vertex ceiling
     * @throws GearException.ShapeFunctionException    if a shape or twist function fails
     */
    public List<Ring> buildRings(GearSpec spec) {
        Objects.requireNonNull(spec, "spec");
        checkVertexCeiling(spec);

        var layers = IntStream.rangeClosed(0, spec.verticalLayers());
        if (config.isParallelLayers()) {
            layers = layers.parallel();
        }
        var rings = layers.mapToObj(layer -> buildRing(spec, layer)).collect(Collectors.toList());

        log.debug("Built {} rings of {} points", rings.size(), pointsPerRing(spec));
        return rings;
    }

    /**
     * Build the ring of a single layer
     */
    public Ring buildRing(GearSpec spec, int layer) {
        if (layer < 0 || layer > spec.verticalLayers()) {
            throw new GearException.InvalidParameterException("layer", "must be within [0, " + spec.verticalLayers()
                                                                       + "], got " + layer);
        }
        var twist = evaluateTwist(spec, layer);
        var profile = sampleProfile(spec, layer);

        var samplesPerTooth = config.getSamplesPerTooth();
        var points = pointsPerRing(spec);
        var angles = new double[points];
        var radii = new double[points];
        for (int k = 0; k < points; k++) {
            angles[k] = Ring.normalizeAngle(Ring.TWO_PI * k / points + twist);
            radii[k] = profile[k % samplesPerTooth];
        }

        log.debug("Calculated layer {} of {}: twist {}", layer, spec.verticalLayers(), twist);
        return new Ring(layer, twist, angles, radii);
    }

    private double evaluateTwist(GearSpec spec, int layer) {
        double twist;
        try {
            twist = spec.twist().angle(layer);
        } catch (RuntimeException e) {
            throw GearException.ShapeFunctionException.twist(layer, "threw " + e, e);
        }
        if (!Double.isFinite(twist)) {
            throw GearException.ShapeFunctionException.twist(layer, "returned " + twist, null);
        }
        return twist;
    }

    /**
     * Radii of one tooth slice; every tooth of the layer shares them
     */
    private double[] sampleProfile(GearSpec spec, int layer) {
        var samplesPerTooth = config.getSamplesPerTooth();
        var profile = new double[samplesPerTooth];
        var clamped = 0;
        for (int s = 0; s < samplesPerTooth; s++) {
            var u = (double) s / samplesPerTooth;
            double height;
            try {
                height = spec.toothShape().height(u);
            } catch (RuntimeException e) {
                throw GearException.ShapeFunctionException.toothShape(layer, u, "threw " + e, e);
            }
            if (!Double.isFinite(height)) {
                throw GearException.ShapeFunctionException.toothShape(layer, u, "returned " + height, null);
            }
            var radius = spec.innerRadius() + height * spec.toothDepth();
            if (radius < spec.innerRadius()) {
                radius = spec.innerRadius();
                clamped++;
            } else if (radius > spec.outerRadius()) {
                radius = spec.outerRadius();
                clamped++;
            }
            profile[s] = radius;
        }
        if (clamped > 0) {
            log.debug("Layer {}: clamped {} of {} tooth samples into [{}, {}]", layer, clamped, samplesPerTooth,
                      spec.innerRadius(), spec.outerRadius());
        }
        return profile;
    }

    private void checkVertexCeiling(GearSpec spec) {
        var samplesPerTooth = config.getSamplesPerTooth();
        long vertices;
        try {
            var points = Math.multiplyExact((long) spec.teeth(), (long) samplesPerTooth);
            vertices = Math.addExact(Math.multiplyExact(spec.verticalLayers() + 1L, points), 2L);
        } catch (ArithmeticException e) {
            throw new GearException.InvalidParameterException("verticalLayers", String.format(
            "%d layers of %d teeth at %d samples overflow the vertex count", spec.verticalLayers(), spec.teeth(),
            samplesPerTooth));
        }
        if (vertices > config.getMaxVertexCount()) {
            throw new GearException.InvalidParameterException("verticalLayers", String.format(
            "%d layers of %d teeth at %d samples need %d vertices, limit is %d", spec.verticalLayers(), spec.teeth(),
            samplesPerTooth, vertices, config.getMaxVertexCount()));
        }
    }
}
