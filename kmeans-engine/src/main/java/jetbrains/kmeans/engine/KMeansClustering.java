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

import jetbrains.kmeans.ClusteringException;
import jetbrains.kmeans.InvalidClusterCountException;
import jetbrains.kmeans.InvalidIterationCountException;
import jetbrains.kmeans.KMeansConfig;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lloyd's k-means. Centroids are seeded by a {@link ClusterInitializer}, then every pass assigns
 * each vector to its closest centroid and moves each centroid to the mean of its vectors. A pass
 * that reassigns no vector, other than the very first one, ends the run.
 *
 * <p>An instance holds no per-run state and can be reused for any number of sequential runs.
 */
public final class KMeansClustering {
    private static final Logger logger = LoggerFactory.getLogger(KMeansClustering.class);

    @NotNull
    private final DistanceFunction distanceFun;

    @NotNull
    private final ClusterInitializer clusterInitializer;

    @NotNull
    private final ClusteringListener listener;

    @NotNull
    private final KMeansConfig config;

    public KMeansClustering() {
        this(KMeansConfig.DEFAULT, ClusteringListener.NONE);
    }

    public KMeansClustering(@NotNull KMeansConfig config, @NotNull ClusteringListener listener) {
        this(L2DistanceFunction.INSTANCE, FirstVectorsClusterInitializer.INSTANCE, config, listener);
    }

    public KMeansClustering(
            @NotNull DistanceFunction distanceFun,
            @NotNull ClusterInitializer clusterInitializer,
            @NotNull KMeansConfig config,
            @NotNull ClusteringListener listener
    ) {
        this.distanceFun = distanceFun;
        this.clusterInitializer = clusterInitializer;
        this.config = config;
        this.listener = listener;
    }

    public KMeansResult cluster(@NotNull VectorReader vectors, int numClusters) {
        return cluster(vectors, numClusters, config.getMaxIterations());
    }

    public KMeansResult cluster(@NotNull VectorReader vectors, int numClusters, int maxIterations) {
        ProgressTracker progressTracker = config.isProgressLogging() ?
                new Slf4jProgressTracker() : NoOpProgressTracker.INSTANCE;
        progressTracker.start("k-means");
        try {
            return cluster(vectors, numClusters, maxIterations, progressTracker);
        } finally {
            progressTracker.finish();
        }
    }

    public KMeansResult cluster(@NotNull VectorReader vectors, int numClusters, int maxIterations,
                                @NotNull ProgressTracker progressTracker) {
        var numVectors = vectors.size();
        var dimensions = vectors.dimensions();

        if (numClusters < 1 || numClusters >= numVectors) {
            throw new InvalidClusterCountException(numClusters, numVectors);
        }
        if (maxIterations < 1) {
            throw new InvalidIterationCountException(maxIterations);
        }
        if (dimensions < 1) {
            throw new ClusteringException("Invalid vector dimensions: " + dimensions);
        }

        progressTracker.pushPhase("K-means clustering",
                "max iterations", String.valueOf(maxIterations),
                "clusters count", String.valueOf(numClusters),
                "vectors count", String.valueOf(numVectors)
        );
        try {
            var workspace = new KMeansWorkspace(numVectors, numClusters, dimensions);
            var warnings = new ArrayList<EmptyClusterWarning>();
            var epsilon = config.getConvergenceEpsilon();

            clusterInitializer.initializeCentroids(vectors, workspace.centroids, progressTracker);

            var iterations = 0;
            var converged = false;
            for (int iteration = 0; iteration < maxIterations; iteration++) {
                int changes;
                progressTracker.pushPhase("Iteration " + iteration);
                try {
                    workspace.startPass();
                    changes = assignVectorsToClosestClusters(vectors, workspace);
                    accumulateClusters(vectors, workspace);
                    calculateCentroids(workspace, iteration, warnings);
                } finally {
                    progressTracker.pullPhase();
                }
                iterations++;
                progressTracker.progress(100.0 * iterations / maxIterations);

                if (changes == 0 && iteration > 0) {
                    converged = true;
                    break;
                }
                if (epsilon > 0 && maxCentroidShiftSquared(workspace) <= epsilon * epsilon) {
                    converged = true;
                    break;
                }
            }

            if (logger.isDebugEnabled()) {
                logger.debug("K-means clustering of {} vectors into {} clusters finished after {} iterations, converged: {}",
                        numVectors, numClusters, iterations, converged);
            }
            return new KMeansResult(workspace.centroids.toArray(), workspace.assignments.toArray(), iterations,
                    converged, warnings);
        } finally {
            progressTracker.pullPhase();
        }
    }

    /**
     * @return number of vectors assigned to a cluster other than in the previous pass
     */
    private int assignVectorsToClosestClusters(@NotNull VectorReader vectors, @NotNull KMeansWorkspace workspace) {
        var changes = 0;
        var vector = workspace.vectorBuffer;
        var centroids = workspace.centroids.getInternalArray();

        for (int vectorIdx = 0; vectorIdx < workspace.numVectors; vectorIdx++) {
            vectors.read(vectorIdx, vector, 0);
            var centroidIdx = distanceFun.findClosestVector(centroids, vector, 0, workspace.dimensions);
            workspace.assignments.set(vectorIdx, centroidIdx);
            if (workspace.previousAssignments.get(vectorIdx) != centroidIdx) {
                changes++;
            }
        }
        return changes;
    }

    private static void accumulateClusters(@NotNull VectorReader vectors, @NotNull KMeansWorkspace workspace) {
        var vector = workspace.vectorBuffer;
        for (int vectorIdx = 0; vectorIdx < workspace.numVectors; vectorIdx++) {
            vectors.read(vectorIdx, vector, 0);
            var centroidIdx = workspace.assignments.get(vectorIdx);
            workspace.clusterSums.add(centroidIdx, vector, 0);
            workspace.clusterSizes.add(centroidIdx, 1);
        }
    }

    private void calculateCentroids(@NotNull KMeansWorkspace workspace, int iteration,
                                    @NotNull List<EmptyClusterWarning> warnings) {
        var centroids = workspace.centroids;
        for (int centroidIdx = 0; centroidIdx < workspace.numClusters; centroidIdx++) {
            var vectorCount = workspace.clusterSizes.get(centroidIdx);
            if (vectorCount > 0) {
                centroids.set(centroidIdx, workspace.clusterSums.getInternalArray(),
                        workspace.clusterSums.offset(centroidIdx));
                centroids.div(centroidIdx, vectorCount);
            } else {
                logger.warn("Cluster {} has no vectors assigned at iteration {}, its centroid is left unchanged",
                        centroidIdx, iteration);
                warnings.add(new EmptyClusterWarning(iteration, centroidIdx));
                listener.emptyCluster(iteration, centroidIdx);
            }
        }
    }

    private double maxCentroidShiftSquared(@NotNull KMeansWorkspace workspace) {
        var maxShift = 0.0;
        var current = workspace.centroids;
        var previous = workspace.previousCentroids;
        for (int centroidIdx = 0; centroidIdx < workspace.numClusters; centroidIdx++) {
            var shift = distanceFun.computeDistance(current.getInternalArray(), current.offset(centroidIdx),
                    previous.getInternalArray(), previous.offset(centroidIdx), workspace.dimensions);
            maxShift = Math.max(maxShift, shift);
        }
        return maxShift;
    }
}
