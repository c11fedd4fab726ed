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
package com.hellblazer.gearforge.mesh;

import javax.vecmath.Vector3d;
import java.util.Objects;

/**
 * Immutable options for {@link WavefrontWriter}
 *
 * @author hal.hildebrand
 */
public final class WavefrontExportOptions {

    public static final String DEFAULT_OBJECT_NAME = "gear";
    public static final int    DEFAULT_DECIMALS    = 6;
    public static final int    MAX_DECIMALS        = 15;

    private final String   objectName;
    private final int      decimals;
    private final Vector3d scale;
    private final Vector3d offset;
    private final boolean  doubleSided;
    private final boolean  triangulate;
    private final String   header;

    private WavefrontExportOptions(Builder builder) {
        this.objectName = builder.objectName;
        this.decimals = builder.decimals;
        this.scale = new Vector3d(builder.scale);
        this.offset = new Vector3d(builder.offset);
        this.doubleSided = builder.doubleSided;
        this.triangulate = builder.triangulate;
        this.header = builder.header;
    }

    public static WavefrontExportOptions defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Name emitted on the {@code o} line
     */
    public String getObjectName() {
        return objectName;
    }

    /**
     * Fixed number of fractional digits for coordinates
     */
    public int getDecimals() {
        return decimals;
    }

    public Vector3d getScale() {
        return new Vector3d(scale);
    }

    public Vector3d getOffset() {
        return new Vector3d(offset);
    }

    /**
     * Whether every face is followed by a copy with reversed winding
     */
    public boolean isDoubleSided() {
        return doubleSided;
    }

    /**
     * Whether faces with more than three vertices are split into triangle fans
     */
    public boolean isTriangulate() {
        return triangulate;
    }

    /**
     * Comment written at the top of the file, or null for none
     */
    public String getHeader() {
        return header;
    }

    public Builder toBuilder() {
        return new Builder().withObjectName(objectName)
                            .withDecimals(decimals)
                            .withScale(scale)
                            .withOffset(offset)
                            .withDoubleSided(doubleSided)
                            .withTriangulate(triangulate)
                            .withHeader(header);
    }

    @Override
    public String toString() {
        return String.format("WavefrontExportOptions[object=%s, decimals=%d, scale=%s, offset=%s, doubleSided=%b, "
                             + "triangulate=%b]", objectName, decimals, scale, offset, doubleSided, triangulate);
    }

    public static final class Builder {
        private String   objectName  = DEFAULT_OBJECT_NAME;
        private int      decimals    = DEFAULT_DECIMALS;
        private Vector3d scale       = new Vector3d(1, 1, 1);
        private Vector3d offset      = new Vector3d(0, 0, 0);
        private boolean  doubleSided = false;
        private boolean  triangulate = false;
        private String   header;

        public Builder withObjectName(String objectName) {
            this.objectName = objectName;
            return this;
        }

        public Builder withDecimals(int decimals) {
            this.decimals = decimals;
            return this;
        }

        public Builder withScale(Vector3d scale) {
            this.scale = new Vector3d(Objects.requireNonNull(scale, "scale"));
            return this;
        }

        public Builder withScale(double uniform) {
            return withScale(new Vector3d(uniform, uniform, uniform));
        }

        public Builder withOffset(Vector3d offset) {
            this.offset = new Vector3d(Objects.requireNonNull(offset, "offset"));
            return this;
        }

        public Builder withDoubleSided(boolean doubleSided) {
            this.doubleSided = doubleSided;
            return this;
        }

        public Builder withTriangulate(boolean triangulate) {
            this.triangulate = triangulate;
            return this;
        }

        public Builder withHeader(String header) {
            this.header = header;
            return this;
        }

        public WavefrontExportOptions build() {
            if (objectName == null || objectName.isBlank() || objectName.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("Object name must be a non-empty token: " + objectName);
            }
            if (decimals < 1 || decimals > MAX_DECIMALS) {
                throw new IllegalArgumentException(
                "Decimals must be between 1 and " + MAX_DECIMALS + ", got " + decimals);
            }
            if (!isFinite(scale) || !isFinite(offset)) {
                throw new IllegalArgumentException("Scale and offset must be finite");
            }
            if (scale.x == 0 || scale.y == 0 || scale.z == 0) {
                throw new IllegalArgumentException("Scale components must be non-zero: " + scale);
            }
            if (header != null && (header.indexOf('\n') >= 0 || header.indexOf('\r') >= 0)) {
                throw new IllegalArgumentException("Header must be a single line");
            }
            return new WavefrontExportOptions(this);
        }

        private static boolean isFinite(Vector3d v) {
            return Double.isFinite(v.x) && Double.isFinite(v.y) && Double.isFinite(v.z);
        }
    }
}
