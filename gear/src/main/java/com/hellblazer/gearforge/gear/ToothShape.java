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
 * Profile of a single tooth. Maps a position inside one tooth's angular slice, normalized to [0, 1) and running
 * counter-clockwise, to a height normalized to [0, 1]: 0 is the inner (root) radius, 1 the outer (tip) radius.
 * Results outside [0, 1] are clamped by the sampler.
 * <p>
 * Implementations must be pure; they are invoked once per sample and must return the same value for the same
 * input.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ToothShape {

    double height(double u);
}
