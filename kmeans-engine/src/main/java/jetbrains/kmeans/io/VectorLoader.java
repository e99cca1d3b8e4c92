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

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import jetbrains.kmeans.VectorFormatException;
import jetbrains.kmeans.engine.DoubleVectorSegment;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Reads vectors written one per line as comma separated decimal numbers, e.g.
 * <pre>
 *     1.5,-2,3e2
 *     0.25, 7, .5
 * </pre>
 * Empty lines are skipped. Whitespace may precede every number and follow the last one, nothing
 * else is allowed between numbers and commas. The number of components of the first vector fixes
 * the dimension of all the others.
 *
 * <p>Loading is all or nothing: any malformed line fails the whole input with
 * {@link VectorFormatException}.
 */
public final class VectorLoader {
    private static final Logger logger = LoggerFactory.getLogger(VectorLoader.class);

    private static final char SEPARATOR = ',';
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private VectorLoader() {
    }

    public static DoubleVectorSegment load(@NotNull Path path) throws IOException {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public static DoubleVectorSegment load(@NotNull Reader reader) throws IOException {
        var lineReader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        var values = new DoubleArrayList();
        var dimensions = 0;
        var count = 0;
        var lineNumber = 0;

        String line;
        while ((line = lineReader.readLine()) != null) {
            lineNumber++;
            if (line.isEmpty()) {
                continue;
            }

            var components = StringUtils.splitPreserveAllTokens(line, SEPARATOR);
            if (dimensions == 0) {
                dimensions = components.length;
            } else if (components.length != dimensions) {
                throw new VectorFormatException(lineNumber,
                        "expected " + dimensions + " components, found " + components.length);
            }

            for (int i = 0; i < components.length; i++) {
                var component = StringUtils.stripStart(components[i], null);
                if (i == components.length - 1) {
                    component = StringUtils.stripEnd(component, null);
                }
                values.add(parseComponent(component, lineNumber));
            }
            count++;
        }

        if (count == 0) {
            throw new VectorFormatException("No vectors found");
        }

        logger.debug("{} vectors loaded with dimension {}", count, dimensions);
        return DoubleVectorSegment.wrap(values.toDoubleArray(), dimensions);
    }

    static double parseComponent(@NotNull String component, int lineNumber) {
        if (!DECIMAL.matcher(component).matches()) {
            throw new VectorFormatException(lineNumber, "malformed number '" + component + "'");
        }
        var value = Double.parseDouble(component);
        if (Double.isInfinite(value)) {
            throw new VectorFormatException(lineNumber, "number out of range '" + component + "'");
        }
        return value;
    }
}
