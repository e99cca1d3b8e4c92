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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a clustering run: the final centroids in cluster id order plus the details of how
 * the run went.
 */
public final class KMeansResult {
    @NotNull
    private final double[][] centroids;
    @NotNull
    private final int[] assignments;
    private final int iterations;
    private final boolean converged;
    @NotNull
    private final List<EmptyClusterWarning> emptyClusterWarnings;

    KMeansResult(@NotNull double[][] centroids, @NotNull int[] assignments, int iterations, boolean converged,
                 @NotNull List<EmptyClusterWarning> emptyClusterWarnings) {
        this.centroids = centroids;
        this.assignments = assignments;
        this.iterations = iterations;
        this.converged = converged;
        this.emptyClusterWarnings = Collections.unmodifiableList(emptyClusterWarnings);
    }

    public int numClusters() {
        return centroids.length;
    }

    public int dimensions() {
        return centroids[0].length;
    }

    @NotNull
    public double[] getCentroid(int clusterIdx) {
        return centroids[clusterIdx].clone();
    }

    @NotNull
    public double[][] getCentroids() {
        var result = new double[centroids.length][];
        for (int i = 0; i < centroids.length; i++) {
            result[i] = centroids[i].clone();
        }
        return result;
    }

    /**
     * Cluster id of every input vector after the last assignment pass.
     */
    @NotNull
    public int[] getAssignments() {
        return assignments.clone();
    }

    /**
     * Number of assign/update passes actually run.
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * {@code true} if clustering stopped before exhausting the iteration limit.
     */
    public boolean isConverged() {
        return converged;
    }

    @NotNull
    public List<EmptyClusterWarning> getEmptyClusterWarnings() {
        return emptyClusterWarnings;
    }
}
