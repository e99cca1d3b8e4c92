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
 * Working state of a single {@link KMeansClustering#cluster} call. Nothing here outlives the call
 * and nothing is shared between calls.
 */
final class KMeansWorkspace {
    static final int UNASSIGNED = -1;

    final int numVectors;
    final int numClusters;
    final int dimensions;

    final DoubleVectorSegment centroids;
    final DoubleVectorSegment previousCentroids;

    /**
     * sum of the vectors assigned to a cluster during the current pass
     */
    final DoubleVectorSegment clusterSums;
    final IntSegment clusterSizes;

    /**
     * centroidIdx by vectorIdx
     * */
    final IntSegment assignments;
    final IntSegment previousAssignments;

    final double[] vectorBuffer;

    KMeansWorkspace(int numVectors, int numClusters, int dimensions) {
        this.numVectors = numVectors;
        this.numClusters = numClusters;
        this.dimensions = dimensions;

        centroids = DoubleVectorSegment.makeSegment(numClusters, dimensions);
        previousCentroids = DoubleVectorSegment.makeSegment(numClusters, dimensions);
        clusterSums = DoubleVectorSegment.makeSegment(numClusters, dimensions);
        clusterSizes = IntSegment.makeSegment(numClusters);
        assignments = IntSegment.makeSegment(numVectors);
        previousAssignments = IntSegment.makeSegment(numVectors);
        vectorBuffer = new double[dimensions];

        assignments.fill(UNASSIGNED);
    }

    void startPass() {
        clusterSums.fill(0);
        clusterSizes.fill(0);
        assignments.copyTo(previousAssignments);
        System.arraycopy(centroids.getInternalArray(), 0, previousCentroids.getInternalArray(), 0,
                numClusters * dimensions);
    }
}
