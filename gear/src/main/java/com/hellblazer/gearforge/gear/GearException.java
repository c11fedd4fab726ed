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

import java.util.OptionalDouble;

/**
 * Sealed exception hierarchy for gear generation.
 * <p>
 * Every failure is terminal for the generation call that raised it. Generation is deterministic, so retrying with
 * the same input reproduces the same failure.
 * <ul>
 * <li>{@link InvalidParameterException} - malformed gear parameters or configuration, raised before any sampling</li>
 * <li>{@link ShapeFunctionException} - a caller supplied shape or twist function threw or returned a non-finite
 * value</li>
 * <li>{@link DegenerateMeshException} - the geometry collapsed into zero-length edges or zero-area faces</li>
 * </ul>
 */
public sealed class GearException extends RuntimeException
    permits GearException.InvalidParameterException,
            GearException.ShapeFunctionException,
            GearException.DegenerateMeshException {

    public GearException(String message) {
        super(message);
    }

    public GearException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Invalid gear parameter exception.
     * <p>
     * Thrown when a radius, tooth count, thickness, layer count or sampling setting is out of range.
     */
    public static final class InvalidParameterException extends GearException {
        private final String parameter;

        public InvalidParameterException(String parameter, String message) {
            super(parameter + ": " + message);
            this.parameter = parameter;
        }

        /**
         * Gets the name of the offending parameter.
         *
         * @return parameter name
         */
        public String getParameter() {
            return parameter;
        }
    }

    /**
     * Shape function exception.
     * <p>
     * Thrown when a tooth shape or twist function throws, or returns NaN or an infinity. Carries the layer and, for
     * tooth shapes, the normalized in-tooth position that was being sampled.
     */
    public static final class ShapeFunctionException extends GearException {
        private final int    layer;
        private final double u;

        private ShapeFunctionException(String message, int layer, double u, Throwable cause) {
            super(message, cause);
            this.layer = layer;
            this.u = u;
        }

        public static ShapeFunctionException toothShape(int layer, double u, String problem, Throwable cause) {
            return new ShapeFunctionException(
            String.format("Tooth shape function %s at layer %d, u=%s", problem, layer, u), layer, u, cause);
        }

        public static ShapeFunctionException twist(int layer, String problem, Throwable cause) {
            return new ShapeFunctionException(String.format("Twist function %s at layer %d", problem, layer), layer,
                                              Double.NaN, cause);
        }

        public int getLayer() {
            return layer;
        }

        /**
         * Gets the in-tooth position being sampled; empty when the twist function failed.
         *
         * @return normalized position in [0, 1)
         */
        public OptionalDouble getU() {
            return Double.isNaN(u) ? OptionalDouble.empty() : OptionalDouble.of(u);
        }
    }

    /**
     * Degenerate mesh exception.
     * <p>
     * Thrown when consecutive ring points coincide or a cap triangle has no area, usually a sign of a tooth shape
     * that collapses a tooth.
     */
    public static final class DegenerateMeshException extends GearException {
        private final int layer;
        private final int point;

        public DegenerateMeshException(int layer, int point, String message) {
            super(String.format("Degenerate mesh at layer %d, point %d: %s", layer, point, message));
            this.layer = layer;
            this.point = point;
        }

        public int getLayer() {
            return layer;
        }

        public int getPoint() {
            return point;
        }
    }
}
