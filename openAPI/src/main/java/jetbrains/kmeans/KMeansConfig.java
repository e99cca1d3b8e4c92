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
package jetbrains.kmeans;

import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.NotNull;

/**
 * Specifies settings of a k-means run. Default settings are specified by {@linkplain #DEFAULT}
 * which is immutable. Any newly created {@code KMeansConfig} is filled up with values of system
 * properties, falling back to the same settings as {@linkplain #DEFAULT}.
 *
 * <pre>
 *     final KMeansConfig config = new KMeansConfig().setConvergenceEpsilon(0.001);
 * </pre>
 */
@SuppressWarnings({"WeakerAccess", "AutoBoxing", "AutoUnboxing"})
public class KMeansConfig extends AbstractConfig {

    public static final KMeansConfig DEFAULT = new KMeansConfig(ConfigurationStrategy.IGNORE) {
        @Override
        public KMeansConfig setMutable(boolean isMutable) {
            if (!this.isMutable() && isMutable) {
                throw new ClusteringException("Can't make KMeansConfig.DEFAULT mutable");
            }
            return super.setMutable(isMutable);
        }
    }.setMutable(false);

    public static final int DEFAULT_MAX_ITERATIONS = 400;

    /**
     * Defines the maximum number of assign/update passes if the caller doesn't specify it
     * explicitly. Default value is {@code 400}.
     */
    public static final String MAX_ITERATIONS = "kmeans.maxIterations";

    /**
     * If greater than {@code 0}, clustering also stops as soon as no centroid has moved farther
     * than this Euclidean distance during a pass. Default value is {@code 0}, so only a pass without
     * any reassignment stops clustering.
     */
    public static final String CONVERGENCE_EPSILON = "kmeans.convergenceEpsilon";

    /**
     * If is set to {@code true}, clustering phases are reported to the log at debug level.
     * Default value is {@code false}.
     */
    public static final String PROGRESS_LOGGING = "kmeans.progressLogging";

    public KMeansConfig() {
        this(ConfigurationStrategy.SYSTEM_PROPERTY);
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    public KMeansConfig(@NotNull final ConfigurationStrategy strategy) {
        super(new Pair[]{
                Pair.of(MAX_ITERATIONS, DEFAULT_MAX_ITERATIONS),
                Pair.of(CONVERGENCE_EPSILON, 0.0),
                Pair.of(PROGRESS_LOGGING, false)
        }, strategy);
    }

    @Override
    public KMeansConfig setSetting(@NotNull final String key, @NotNull final Object value) {
        return (KMeansConfig) super.setSetting(key, value);
    }

    @Override
    public KMeansConfig setMutable(boolean isMutable) {
        return (KMeansConfig) super.setMutable(isMutable);
    }

    public int getMaxIterations() {
        return (Integer) getSetting(MAX_ITERATIONS);
    }

    public KMeansConfig setMaxIterations(final int maxIterations) {
        return setSetting(MAX_ITERATIONS, maxIterations);
    }

    public double getConvergenceEpsilon() {
        return (Double) getSetting(CONVERGENCE_EPSILON);
    }

    public KMeansConfig setConvergenceEpsilon(final double convergenceEpsilon) {
        return setSetting(CONVERGENCE_EPSILON, convergenceEpsilon);
    }

    public boolean isProgressLogging() {
        return (Boolean) getSetting(PROGRESS_LOGGING);
    }

    public KMeansConfig setProgressLogging(final boolean progressLogging) {
        return setSetting(PROGRESS_LOGGING, progressLogging);
    }
}
