/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package jetbrains.kmeans.engine;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Fixed number of vectors of the same dimension stored one after another in a single array.
 */
public final class DoubleVectorSegment {
    private final int dimensions;
    private final int count;
    private final double[] vectors;

    private DoubleVectorSegment(int count, int dimensions, double[] vectors) {
        this.dimensions = dimensions;
        this.count = count;
        this.vectors = vectors;
    }

    public int dimensions() {
        return dimensions;
    }

    public int count() {
        return count;
    }

    public void add(int idx1, double[] v2, int v2Offset) {
        VectorOperations.add(vectors, idx1 * dimensions, v2, v2Offset, vectors, idx1 * dimensions, dimensions);
    }

    public void div(int idx, long scalar) {
        VectorOperations.div(vectors, idx * dimensions, scalar, vectors, idx * dimensions, dimensions);
    }

    public double get(int vectorIdx, int dimension) {
        return vectors[vectorIdx * dimensions + dimension];
    }

    public void set(int vectorIdx, double[] vector, int vectorOffset) {
        System.arraycopy(vector, vectorOffset, vectors, vectorIdx * dimensions, dimensions);
    }

    public void copyTo(int vectorIdx, double[] result, int resultOffset) {
        System.arraycopy(vectors, vectorIdx * dimensions, result, resultOffset, dimensions);
    }

    public double[] getInternalArray() {
        return vectors;
    }

    public int offset(int vectorIdx) {
        return vectorIdx * dimensions;
    }

    public double[][] toArray() {
        var array = new double[count][dimensions];
        for (int i = 0; i < count; i++) {
            System.arraycopy(vectors, i * dimensions, array[i], 0, dimensions);
        }
        return array;
    }

    public void fill(double value) {
        Arrays.fill(vectors, value);
    }

    public static DoubleVectorSegment makeSegment(int count, int dimensions) {
        if (count < 0 || dimensions < 1) {
            throw new IllegalArgumentException("count = " + count + ", dimensions = " + dimensions);
        }
        return new DoubleVectorSegment(count, dimensions, new double[Math.multiplyExact(count, dimensions)]);
    }

    /**
     * Wraps {@code vectors} without copying, its length must be a multiple of {@code dimensions}.
     */
    public static DoubleVectorSegment wrap(@NotNull double[] vectors, int dimensions) {
        if (dimensions < 1 || vectors.length % dimensions != 0) {
            throw new IllegalArgumentException("length = " + vectors.length + ", dimensions = " + dimensions);
        }
        return new DoubleVectorSegment(vectors.length / dimensions, dimensions, vectors);
    }

    public static DoubleVectorSegment of(@NotNull double[]... vectors) {
        if (vectors.length == 0) {
            throw new IllegalArgumentException("No vectors");
        }
        var dimensions = vectors[0].length;
        var segment = makeSegment(vectors.length, dimensions);
        for (int i = 0; i < vectors.length; i++) {
            if (vectors[i].length != dimensions) {
                throw new IllegalArgumentException("Vector " + i + " has " + vectors[i].length +
                        " dimensions, expected " + dimensions);
            }
            segment.set(i, vectors[i], 0);
        }
        return segment;
    }
}
