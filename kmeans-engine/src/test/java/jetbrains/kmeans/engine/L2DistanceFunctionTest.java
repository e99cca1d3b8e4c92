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

import org.junit.Assert;
import org.junit.Test;

import java.util.Random;

public class L2DistanceFunctionTest {

    @Test
    public void testSquaredDistance() {
        var distance = L2DistanceFunction.INSTANCE.computeDistance(
                new double[]{0, 1, 2}, 1, new double[]{4, 5, 9, 9}, 1, 2);
        Assert.assertEquals(16 + 49, distance, 0.0);
    }

    @Test
    public void testRandomVectors() {
        var seed = System.nanoTime();
        System.out.println("testRandomVectors seed = " + seed);
        var rnd = new Random(seed);

        for (int i = 0; i < 100; i++) {
            var size = 1 + rnd.nextInt(16);
            var first = new double[size];
            var second = new double[size];
            var expected = 0.0;
            for (int j = 0; j < size; j++) {
                first[j] = rnd.nextGaussian();
                second[j] = rnd.nextGaussian();
                expected += (first[j] - second[j]) * (first[j] - second[j]);
            }
            Assert.assertEquals(expected,
                    L2DistanceFunction.INSTANCE.computeDistance(first, 0, second, 0, size), 1e-12);
        }
    }

    @Test
    public void testFindClosestVectorPrefersLowestIndexOnTie() {
        var centroids = new double[]{0, 0, 2, 0, 1, 5};
        var vector = new double[]{1, 0};
        Assert.assertEquals(0, L2DistanceFunction.INSTANCE.findClosestVector(centroids, vector, 0, 2));

        vector = new double[]{1.5, 0};
        Assert.assertEquals(1, L2DistanceFunction.INSTANCE.findClosestVector(centroids, vector, 0, 2));
    }

    @Test
    public void testFindClosestVectorWithoutFiniteDistance() {
        var centroids = new double[]{Double.MAX_VALUE, -Double.MAX_VALUE};
        var vector = new double[]{-Double.MAX_VALUE};
        Assert.assertEquals(0, L2DistanceFunction.INSTANCE.findClosestVector(centroids, vector, 0, 1));
    }
}
