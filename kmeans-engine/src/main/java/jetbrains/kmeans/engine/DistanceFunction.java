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

public interface DistanceFunction {

    double computeDistance(double[] firstVector, int firstVectorFrom,
                           double[] secondVector, int secondVectorFrom,
                           int size);

    /**
     * Index of the vector closest to {@code vector} among {@code vectors} laid out with stride
     * {@code size}. The first of several equally close vectors wins, and the first vector is
     * returned if no distance is finite.
     */
    default int findClosestVector(double[] vectors, double[] vector, int from, int size) {
        var minDistance = Double.POSITIVE_INFINITY;
        var minIndex = 0;

        var numVectors = vectors.length / size;

        for (int i = 0; i < numVectors; i++) {
            var distance = computeDistance(vector, from, vectors, i * size, size);

            if (distance < minDistance) {
                minDistance = distance;
                minIndex = i;
            }
        }

        return minIndex;
    }
}
