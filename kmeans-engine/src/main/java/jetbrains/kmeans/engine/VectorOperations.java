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

final class VectorOperations {

    private VectorOperations() {
    }

    /**
     * vector1 + vector2 -> result
     * */
    public static void add(double[] v1, int idx1, double[] v2, int idx2, double[] result, int resultIdx, int size) {
        for (int i = 0; i < size; i++) {
            result[resultIdx + i] = v1[idx1 + i] + v2[idx2 + i];
        }
    }

    /**
     * vector1 / scalar -> result
     * */
    public static void div(double[] v1, int idx1, long scalar, double[] result, int resultIdx, int size) {
        for (int i = 0; i < size; i++) {
            result[resultIdx + i] = v1[idx1 + i] / scalar;
        }
    }

    /**
     * Squared Euclidean distance.
     * */
    public static double l2DistanceSquared(double[] v1, int idx1, double[] v2, int idx2, int size) {
        var sum = 0.0;
        for (int i = 0; i < size; i++) {
            var diff = v1[idx1 + i] - v2[idx2 + i];
            sum += diff * diff;
        }
        return sum;
    }
}
