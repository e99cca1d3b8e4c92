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

import java.util.Arrays;

public final class IntSegment {

    private final int[] values;

    private IntSegment(int[] values) {
        this.values = values;
    }

    public int count() { return values.length; }

    public void fill(int value) {
        Arrays.fill(values, value);
    }

    public int get(int idx) {
        return values[idx];
    }

    public void set(int idx, int value) {
        values[idx] = value;
    }

    public void add(int idx, int value) {
        values[idx] += value;
    }

    public void copyTo(IntSegment target) {
        System.arraycopy(values, 0, target.values, 0, values.length);
    }

    public int[] toArray() {
        return values.clone();
    }

    public static IntSegment makeSegment(int count) {
        return new IntSegment(new int[count]);
    }
}
