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

public final class DoubleVectorSegmentReader implements VectorReader {

    @NotNull
    private final DoubleVectorSegment vectors;

    public DoubleVectorSegmentReader(@NotNull DoubleVectorSegment vectors) {
        this.vectors = vectors;
    }

    @Override
    public int size() {
        return vectors.count();
    }

    @Override
    public int dimensions() {
        return vectors.dimensions();
    }

    @Override
    public void read(int vectorIdx, double[] result, int resultOffset) {
        vectors.copyTo(vectorIdx, result, resultOffset);
    }
}
