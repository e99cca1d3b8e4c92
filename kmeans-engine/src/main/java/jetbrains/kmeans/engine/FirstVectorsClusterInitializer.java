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

/**
 * Centroid {@code i} starts as a copy of vector {@code i}. No randomness is involved, so the same
 * input always yields the same clustering.
 */
public final class FirstVectorsClusterInitializer implements ClusterInitializer {
    public static final FirstVectorsClusterInitializer INSTANCE = new FirstVectorsClusterInitializer();

    private FirstVectorsClusterInitializer() {
    }

    @Override
    public void initializeCentroids(@NotNull VectorReader vectors, @NotNull DoubleVectorSegment centroids,
                                    @NotNull ProgressTracker progressTracker) {
        var numClusters = centroids.count();
        if (vectors.size() < numClusters) throw new IllegalArgumentException();
        if (vectors.dimensions() != centroids.dimensions()) throw new IllegalArgumentException();

        var internal = centroids.getInternalArray();
        for (int i = 0; i < numClusters; i++) {
            vectors.read(i, internal, centroids.offset(i));
        }
    }
}
