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
package jetbrains.kmeans.io;

import jetbrains.kmeans.engine.KMeansResult;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Writes centroids one per line, components separated by commas with exactly
 * {@value #FRACTION_DIGITS} fractional digits.
 */
public final class CentroidWriter {
    public static final int FRACTION_DIGITS = 4;

    private static final char SEPARATOR = ',';

    private CentroidWriter() {
    }

    public static void write(@NotNull KMeansResult result, @NotNull Writer writer) throws IOException {
        write(result.getCentroids(), writer);
    }

    public static void write(@NotNull double[][] centroids, @NotNull Writer writer) throws IOException {
        var builder = new StringBuilder();
        for (var centroid : centroids) {
            for (int i = 0; i < centroid.length; i++) {
                if (i > 0) {
                    builder.append(SEPARATOR);
                }
                builder.append(format(centroid[i]));
            }
            builder.append('\n');
        }
        writer.write(builder.toString());
        writer.flush();
    }

    @NotNull
    public static String toString(@NotNull double[][] centroids) {
        var writer = new StringWriter();
        try {
            write(centroids, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    /**
     * Rounds the exact binary value half to even. Negative values rounded to zero keep their sign.
     */
    @NotNull
    static String format(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        var formatted = new BigDecimal(value).setScale(FRACTION_DIGITS, RoundingMode.HALF_EVEN).toPlainString();
        var negative = value < 0 || (value == 0 && 1 / value < 0);
        if (negative && formatted.charAt(0) != '-') {
            return '-' + formatted;
        }
        return formatted;
    }
}
