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

/**
 * Stock tooth profiles
 *
 * @author hal.hildebrand
 */
public final class ToothShapes {

    /**
     * Sinusoidal tooth, tip at the start of the slice and root in the middle. The default profile.
     */
    public static final ToothShape SINE = u -> Math.cos(u * Math.PI * 2) / 2 + 0.5;

    /**
     * V shaped: tips at the slice edges, a sharp root in the middle
     */
    public static final ToothShape V_SHAPE = u -> Math.abs(0.5 - u) * 2;

    /**
     * A shaped: a sharp tip in the middle of the slice
     */
    public static final ToothShape A_SHAPE = u -> 1 - V_SHAPE.height(u);

    /**
     * Undercut half sine: the rounded half of the sine tooth, the rest of the slice stays on the root circle
     */
    public static final ToothShape HALF_SINE = u -> Math.max(Math.cos(u * Math.PI * 2), 0);

    private ToothShapes() {
    }

    /**
     * A toothless disc at the given height
     */
    public static ToothShape constant(double height) {
        return u -> height;
    }
}
