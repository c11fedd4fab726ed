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

import javax.vecmath.Point2d;

/**
 * One layer's closed outline as polar samples around the gear axis.
 * <p>
 * Points are ordered by their angle before the layer's twist was applied, so point {@code i} sits at the same
 * circumferential position of the untwisted profile in every ring of a gear. Stored angles include the twist and are
 * normalized into [0, 2π); the list holds no duplicate closing point.
 *
 * @author hal.hildebrand
 */
public final class Ring {
    static final double TWO_PI = Math.PI * 2;

    private final int      layer;
    private final double   twist;
    private final double[] angles;
    private final double[] radii;

    /**
     * @param layer  layer index, 0 at the bottom face
     * @param twist  rotation applied to the layer
     * @param angles final angles, one per point
     * @param radii  radii, one per point
     */
    public Ring(int layer, double twist, double[] angles, double[] radii) {
        if (angles.length != radii.length) {
            throw new IllegalArgumentException(
            "Angle and radius counts differ: " + angles.length + " != " + radii.length);
        }
        if (angles.length < 3) {
            throw new IllegalArgumentException("A ring needs at least 3 points, got " + angles.length);
        }
        this.layer = layer;
        this.twist = twist;
        this.angles = angles.clone();
        this.radii = radii.clone();
    }

    /**
     * Normalize an angle into [0, 2π)
     */
    public static double normalizeAngle(double angle) {
        var normalized = angle % TWO_PI;
        if (normalized < 0) {
            normalized += TWO_PI;
        }
        // -tiny % 2π + 2π rounds up to 2π
        return normalized >= TWO_PI ? 0.0 : normalized;
    }

    public int layer() {
        return layer;
    }

    public double twist() {
        return twist;
    }

    public int size() {
        return angles.length;
    }

    public double angle(int i) {
        return angles[i];
    }

    public double radius(int i) {
        return radii[i];
    }

    /**
     * Cartesian position of point {@code i} in the gear plane
     */
    public Point2d point(int i) {
        return new Point2d(radii[i] * Math.cos(angles[i]), radii[i] * Math.sin(angles[i]));
    }

    @Override
    public String toString() {
        return String.format("Ring[layer=%d, twist=%.6f, points=%d]", layer, twist, angles.length);
    }
}
