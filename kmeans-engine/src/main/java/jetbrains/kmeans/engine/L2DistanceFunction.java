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

/**
 * Squared Euclidean distance. The square root is never taken: the order of distances is all the
 * clustering needs.
 */
public final class L2DistanceFunction implements DistanceFunction {
    public static final L2DistanceFunction INSTANCE = new L2DistanceFunction();

    private L2DistanceFunction() {
    }

    @Override
    public double computeDistance(double[] firstVector, int firstVectorFrom, double[] secondVector, int secondVectorFrom, int size) {
        return VectorOperations.l2DistanceSquared(firstVector, firstVectorFrom, secondVector, secondVectorFrom, size);
    }
}
