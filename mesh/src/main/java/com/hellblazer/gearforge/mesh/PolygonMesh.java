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

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Polygon mesh storage: an ordered vertex list and an ordered list of faces referencing it by zero-based index.
 * Insertion order is the emission order of the serialized form.
 *
 * @author hal.hildebrand
 */
public class PolygonMesh {

    private final List<Point3d> vertices;
    private final List<Face>    faces;

    public PolygonMesh() {
        this.vertices = new ArrayList<>();
        this.faces = new ArrayList<>();
    }

    /**
     * Pre-size the mesh for a known vertex and face count
     */
    public PolygonMesh(int expectedVertices, int expectedFaces) {
        this.vertices = new ArrayList<>(expectedVertices);
        this.faces = new ArrayList<>(expectedFaces);
    }

    /**
     * Add a vertex to the mesh
     *
     * @return the index of the added vertex
     */
    public int addVertex(Point3d vertex) {
        vertices.add(new Point3d(vertex));
        return vertices.size() - 1;
    }

    public int addVertex(double x, double y, double z) {
        return addVertex(new Point3d(x, y, z));
    }

    /**
     * Add a polygon face using vertex indices. Faces need at least three distinct, existing vertices.
     *
     * @return the index of the added face
     */
    public int addFace(int... indices) {
        if (indices.length < 3) {
            throw new IllegalArgumentException("Face needs at least 3 vertices, got " + indices.length);
        }
        for (int i = 0; i < indices.length; i++) {
            var index = indices[i];
            if (index < 0 || index >= vertices.size()) {
                throw new IllegalArgumentException(
                "Invalid vertex index " + index + " (vertex count " + vertices.size() + ")");
            }
            for (int j = 0; j < i; j++) {
                if (indices[j] == index) {
                    throw new IllegalArgumentException("Repeated vertex index " + index + " in face");
                }
            }
        }
        faces.add(new Face(indices.clone()));
        return faces.size() - 1;
    }

    public int getVertexCount() {
        return vertices.size();
    }

    public int getFaceCount() {
        return faces.size();
    }

    /**
     * Get a vertex by index
     */
    public Point3d getVertex(int index) {
        return new Point3d(vertices.get(index));
    }

    public Face getFace(int index) {
        return faces.get(index);
    }

    public List<Face> getFaces() {
        return Collections.unmodifiableList(faces);
    }

    /**
     * Number of faces with exactly the given vertex count
     */
    public int countFaces(int vertexCount) {
        int count = 0;
        for (var face : faces) {
            if (face.size() == vertexCount) {
                count++;
            }
        }
        return count;
    }

    /**
     * Geometric normal of a face, using Newell's method so quads and larger polygons are handled. The result is not
     * normalized; its length is twice the projected polygon area.
     */
    public Vector3d computeNormal(int faceIndex) {
        var face = faces.get(faceIndex);
        var normal = new Vector3d();
        for (int i = 0; i < face.size(); i++) {
            var current = vertices.get(face.index(i));
            var next = vertices.get(face.index((i + 1) % face.size()));
            normal.x += (current.y - next.y) * (current.z + next.z);
            normal.y += (current.z - next.z) * (current.x + next.x);
            normal.z += (current.x - next.x) * (current.y + next.y);
        }
        return normal;
    }

    @Override
    public String toString() {
        return "PolygonMesh[vertices=" + vertices.size() + ", faces=" + faces.size() + "]";
    }

    /**
     * Polygon face as an ordered list of zero-based vertex indices. Winding is counter-clockwise seen from the side
     * the face points to.
     */
    public static final class Face {
        private final int[] indices;

        private Face(int[] indices) {
            this.indices = indices;
        }

        public int size() {
            return indices.length;
        }

        public int index(int i) {
            return indices[i];
        }

        public int[] indices() {
            return indices.clone();
        }

        /**
         * The same polygon with opposite winding
         */
        public Face reversed() {
            var reversed = new int[indices.length];
            for (int i = 0; i < indices.length; i++) {
                reversed[i] = indices[indices.length - 1 - i];
            }
            return new Face(reversed);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Face other)) return false;
            return Arrays.equals(indices, other.indices);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(indices);
        }

        @Override
        public String toString() {
            return "Face" + Arrays.toString(indices);
        }
    }
}
