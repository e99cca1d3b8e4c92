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

/**
 * Thrown if the requested number of clusters is out of range: it is too small, or it is not
 * less than the number of vectors to cluster.
 */
public class InvalidClusterCountException extends ClusteringException {

    public InvalidClusterCountException(final int clusters, final int vectors) {
        super("Invalid number of clusters: " + clusters + ", vectors count: " + vectors);
    }

    public InvalidClusterCountException(final String message) {
        super(message);
    }
}
