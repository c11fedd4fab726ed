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
import java.util.function.DoubleUnaryOperator;

/**
 * Rotation, in radians counter-clockwise seen from +z, applied to every sample of a layer's ring. Layers run from 0
 * at the bottom face to {@code verticalLayers} at the top face.
 * <p>
 * A constant function gives a straight spur gear, a linear one a helical gear and a function that reverses its
 * slope part way through the thickness a fishbone (herringbone) gear. Implementations must be pure.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface TwistFunction {

    double angle(int layer);

    static TwistFunction none() {
        return layer -> 0.0;
    }

    static TwistFunction constant(double radians) {
        return layer -> radians;
    }

    /**
     * Helical twist growing by a fixed step per layer
     */
    static TwistFunction linear(double radiansPerLayer) {
        return layer -> layer * radiansPerLayer;
    }

    /**
     * Fishbone twist: rises linearly from 0 at the bottom to {@code peak} at the middle of the thickness, then
     * returns to 0 at the top
     */
    static TwistFunction fishbone(double peak, int verticalLayers) {
        return ofProgress(progress -> peak * (1 - Math.abs(1 - 2 * progress)), verticalLayers);
    }

    /**
     * Adapt a function of thickness progress, 0 at the bottom face and 1 at the top face, to a layer function
     */
    static TwistFunction ofProgress(DoubleUnaryOperator byProgress, int verticalLayers) {
        Objects.requireNonNull(byProgress, "byProgress");
        if (verticalLayers < 1) {
            throw new GearException.InvalidParameterException("verticalLayers",
                                                              "must be at least 1, got " + verticalLayers);
        }
        return layer -> byProgress.applyAsDouble((double) layer / verticalLayers);
    }
}
