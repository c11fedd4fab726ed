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

import java.util.Objects;

/**
 * Immutable gear parameters. Radii and thickness share whatever unit the caller uses.
 * <p>
 * The gear lies in the x-y plane centered on the z axis, with its bottom face at z = 0 and its top face at z =
 * {@code thickness}. Construction validates every scalar and fails with
 * {@link GearException.InvalidParameterException} before any geometry is sampled.
 *
 * @param innerRadius    radius of the root circle, between teeth
 * @param outerRadius    radius of the tip circle
 * @param teeth          number of teeth
 * @param thickness      extent along z
 * @param toothShape     profile of a single tooth
 * @param twist          per layer rotation
 * @param verticalLayers number of bands the thickness is divided into; there is one ring more than bands
 * @author hal.hildebrand
 */
public record GearSpec(double innerRadius, double outerRadius, int teeth, double thickness, ToothShape toothShape,
                       TwistFunction twist, int verticalLayers) {

    /** Layer count when no twist is given: a straight extrusion needs only its two faces */
    public static final int DEFAULT_SPUR_LAYERS    = 1;
    /** Layer count when a twist is given without an explicit count */
    public static final int DEFAULT_TWISTED_LAYERS = 31;

    public GearSpec {
        if (!(innerRadius > 0) || Double.isInfinite(innerRadius)) {
            throw new GearException.InvalidParameterException("innerRadius",
                                                              "must be positive and finite, got " + innerRadius);
        }
        if (!(outerRadius > innerRadius) || Double.isInfinite(outerRadius)) {
            throw new GearException.InvalidParameterException("outerRadius", "must be finite and greater than "
                                                                             + "innerRadius " + innerRadius
                                                                             + ", got " + outerRadius);
        }
        if (teeth < 2) {
            throw new GearException.InvalidParameterException("teeth", "must be at least 2, got " + teeth);
        }
        if (!(thickness > 0) || Double.isInfinite(thickness)) {
            throw new GearException.InvalidParameterException("thickness",
                                                              "must be positive and finite, got " + thickness);
        }
        if (verticalLayers < 1) {
            throw new GearException.InvalidParameterException("verticalLayers",
                                                              "must be at least 1, got " + verticalLayers);
        }
        if (toothShape == null) {
            toothShape = ToothShapes.SINE;
        }
        if (twist == null) {
            twist = TwistFunction.none();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Radial height of the teeth
     */
    public double toothDepth() {
        return outerRadius - innerRadius;
    }

    /**
     * Number of rings the thickness is sampled at
     */
    public int ringCount() {
        return verticalLayers + 1;
    }

    public static final class Builder {
        private double        innerRadius;
        private double        outerRadius;
        private int           teeth;
        private double        thickness;
        private ToothShape    toothShape;
        private TwistFunction twist;
        private Integer       verticalLayers;

        public Builder withInnerRadius(double innerRadius) {
            this.innerRadius = innerRadius;
            return this;
        }

        public Builder withOuterRadius(double outerRadius) {
            this.outerRadius = outerRadius;
            return this;
        }

        public Builder withRadii(double innerRadius, double outerRadius) {
            return withInnerRadius(innerRadius).withOuterRadius(outerRadius);
        }

        public Builder withTeeth(int teeth) {
            this.teeth = teeth;
            return this;
        }

        public Builder withThickness(double thickness) {
            this.thickness = thickness;
            return this;
        }

        public Builder withToothShape(ToothShape toothShape) {
            this.toothShape = Objects.requireNonNull(toothShape, "toothShape");
            return this;
        }

        public Builder withTwist(TwistFunction twist) {
            this.twist = Objects.requireNonNull(twist, "twist");
            return this;
        }

        public Builder withVerticalLayers(int verticalLayers) {
            this.verticalLayers = verticalLayers;
            return this;
        }

        public GearSpec build() {
            int layers;
            if (verticalLayers != null) {
                layers = verticalLayers;
            } else {
                layers = twist == null ? DEFAULT_SPUR_LAYERS : DEFAULT_TWISTED_LAYERS;
            }
            return new GearSpec(innerRadius, outerRadius, teeth, thickness, toothShape, twist, layers);
        }
    }
}
