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

import com.hellblazer.gearforge.mesh.WavefrontExportOptions;

import java.util.Objects;

/**
 * Configuration for gear generation: sampling resolution, layer parallelism, the vertex ceiling bounding the work of
 * a single call, and the OBJ export options.
 *
 * @author hal.hildebrand
 */
public final class GearConfiguration {

    public static final int  DEFAULT_SAMPLES_PER_TOOTH = 20;
    public static final long DEFAULT_MAX_VERTEX_COUNT  = 5_000_000L;

    private final int                    samplesPerTooth;
    private final boolean                parallelLayers;
    private final long                   maxVertexCount;
    private final WavefrontExportOptions exportOptions;

    private GearConfiguration(Builder builder) {
        this.samplesPerTooth = builder.samplesPerTooth;
        this.parallelLayers = builder.parallelLayers;
        this.maxVertexCount = builder.maxVertexCount;
        this.exportOptions = builder.exportOptions;
    }

    public static GearConfiguration defaultConfig() {
        return new Builder().build();
    }

    /**
     * Coarse sampling for previews and tests
     */
    public static GearConfiguration previewConfig() {
        return new Builder().withSamplesPerTooth(8).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of profile samples per tooth; every ring has {@code teeth * samplesPerTooth} points
     */
    public int getSamplesPerTooth() {
        return samplesPerTooth;
    }

    public boolean isParallelLayers() {
        return parallelLayers;
    }

    /**
     * Largest mesh, in vertices, a single generation may produce
     */
    public long getMaxVertexCount() {
        return maxVertexCount;
    }

    public WavefrontExportOptions getExportOptions() {
        return exportOptions;
    }

    @Override
    public String toString() {
        return String.format("GearConfiguration[samplesPerTooth=%d, parallelLayers=%b, maxVertexCount=%d, %s]",
                             samplesPerTooth, parallelLayers, maxVertexCount, exportOptions);
    }

    public static final class Builder {
        private int                    samplesPerTooth = DEFAULT_SAMPLES_PER_TOOTH;
        private boolean                parallelLayers  = false;
        private long                   maxVertexCount  = DEFAULT_MAX_VERTEX_COUNT;
        private WavefrontExportOptions exportOptions   = WavefrontExportOptions.defaultConfig();

        public Builder withSamplesPerTooth(int samplesPerTooth) {
            this.samplesPerTooth = samplesPerTooth;
            return this;
        }

        public Builder withParallelLayers(boolean parallelLayers) {
            this.parallelLayers = parallelLayers;
            return this;
        }

        public Builder withMaxVertexCount(long maxVertexCount) {
            this.maxVertexCount = maxVertexCount;
            return this;
        }

        public Builder withExportOptions(WavefrontExportOptions exportOptions) {
            this.exportOptions = Objects.requireNonNull(exportOptions, "exportOptions");
            return this;
        }

        public GearConfiguration build() {
            if (samplesPerTooth < 2) {
                throw new IllegalArgumentException("Samples per tooth must be at least 2, got " + samplesPerTooth);
            }
            if (maxVertexCount < 1 || maxVertexCount > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(
                "Max vertex count must be between 1 and " + Integer.MAX_VALUE + ", got " + maxVertexCount);
            }
            return new GearConfiguration(this);
        }
    }
}
