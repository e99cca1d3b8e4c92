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
 * Receives non-fatal diagnostics of a clustering run. A run reporting them still completes and
 * produces a full centroid set.
 */
public interface ClusteringListener {
    ClusteringListener NONE = (iteration, clusterIdx) -> {
    };

    /**
     * No vector was assigned to cluster {@code clusterIdx} during pass {@code iteration}
     * (0-based), so its centroid keeps the previous value.
     */
    void emptyCluster(int iteration, int clusterIdx);
}
