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
package jetbrains.kmeans.console;

import jetbrains.kmeans.ClusteringException;
import jetbrains.kmeans.InvalidClusterCountException;
import jetbrains.kmeans.InvalidIterationCountException;
import jetbrains.kmeans.KMeansConfig;
import jetbrains.kmeans.engine.DoubleVectorSegment;
import jetbrains.kmeans.engine.DoubleVectorSegmentReader;
import jetbrains.kmeans.engine.KMeansClustering;
import jetbrains.kmeans.io.CentroidWriter;
import jetbrains.kmeans.io.VectorLoader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Clusters vectors read from standard input (or a file) and prints the centroids.
 * <pre>
 *     kmeans [-i FILE] K [MAX_ITER]
 * </pre>
 * Any failure prints a single line to standard output, nothing else, and exits with status 1.
 * Empty clusters met during the run are reported on standard error and don't fail the run.
 */
public final class KMeansConsole {
    private static final Logger logger = LoggerFactory.getLogger(KMeansConsole.class);

    static final String GENERAL_ERROR = "An Error Has Occurred";
    static final String INVALID_CLUSTERS = "Incorrect number of clusters!";
    static final String INVALID_ITERATIONS = "Incorrect maximum iteration!";

    static final int MIN_K = 1;
    static final int MIN_ITER = 1;
    static final int MAX_ITER = 1000;

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private static final Pattern INTEGER = Pattern.compile("\\s*[+-]?\\d+");

    @NotNull
    private final InputStream in;
    @NotNull
    private final PrintStream out;
    @NotNull
    private final PrintStream err;
    @NotNull
    private final KMeansConfig config;

    public KMeansConsole(@NotNull InputStream in, @NotNull PrintStream out, @NotNull PrintStream err,
                         @NotNull KMeansConfig config) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.config = config;
    }

    public static void main(String[] args) {
        var console = new KMeansConsole(System.in, System.out, System.err, new KMeansConfig());
        System.exit(console.run(args));
    }

    public int run(String[] args) {
        try {
            var line = getCommandLine(args);
            if (line.hasOption('h')) {
                printUsage();
                return EXIT_SUCCESS;
            }

            var positional = line.getArgList();
            if (positional.isEmpty() || positional.size() > 2) {
                throw new ParseException("Expected 1 or 2 positional arguments, got " + positional.size());
            }

            var numClusters = parseClusters(positional.get(0));
            var maxIterations = positional.size() == 2 ?
                    parseIterations(positional.get(1)) : validateIterations(config.getMaxIterations());

            var input = line.getOptionValue('i');
            var vectors = loadVectors(input == null ? null : Path.of(input));
            if (numClusters >= vectors.count()) {
                throw new InvalidClusterCountException(numClusters, vectors.count());
            }

            var clustering = new KMeansClustering(config, (iteration, clusterIdx) -> err.print(GENERAL_ERROR + '\n'));
            var result = clustering.cluster(new DoubleVectorSegmentReader(vectors), numClusters, maxIterations);

            CentroidWriter.write(result, new OutputStreamWriter(out, StandardCharsets.UTF_8));
            return EXIT_SUCCESS;
        } catch (InvalidClusterCountException e) {
            return fail(INVALID_CLUSTERS, e);
        } catch (InvalidIterationCountException e) {
            return fail(INVALID_ITERATIONS, e);
        } catch (ParseException | IOException | InvalidPathException | ClusteringException e) {
            return fail(GENERAL_ERROR, e);
        } catch (OutOfMemoryError e) {
            return fail(GENERAL_ERROR, e);
        }
    }

    private int fail(@NotNull String message, @NotNull Throwable cause) {
        logger.debug(message, cause);
        out.print(message + '\n');
        out.flush();
        return EXIT_FAILURE;
    }

    private DoubleVectorSegment loadVectors(@Nullable Path input) throws IOException {
        if (input != null) {
            return VectorLoader.load(input);
        }
        return VectorLoader.load(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    static int parseClusters(@NotNull String value) throws ParseException {
        var clusters = parseInteger(value);
        if (clusters.compareTo(BigInteger.valueOf(MIN_K)) <= 0
                || clusters.compareTo(BigInteger.valueOf(Integer.MAX_VALUE)) > 0) {
            throw new InvalidClusterCountException("Invalid number of clusters: " + value);
        }
        return clusters.intValue();
    }

    static int parseIterations(@NotNull String value) throws ParseException {
        var iterations = parseInteger(value);
        if (iterations.compareTo(BigInteger.valueOf(MIN_ITER)) <= 0
                || iterations.compareTo(BigInteger.valueOf(MAX_ITER)) >= 0) {
            throw new InvalidIterationCountException(iterations.longValue());
        }
        return iterations.intValue();
    }

    static int validateIterations(int iterations) {
        if (iterations <= MIN_ITER || iterations >= MAX_ITER) {
            throw new InvalidIterationCountException(iterations);
        }
        return iterations;
    }

    private static BigInteger parseInteger(@NotNull String value) throws ParseException {
        if (!INTEGER.matcher(value).matches()) {
            throw new ParseException("Not an integer: '" + value + "'");
        }
        var digits = value.strip();
        return new BigInteger(digits.startsWith("+") ? digits.substring(1) : digits);
    }

    private static Options getOptions() {
        var options = new Options();
        options.addOption(Option.builder("i").longOpt("input").hasArg().argName("FILE")
                .desc("read vectors from FILE instead of standard input").build());
        options.addOption(Option.builder("h").longOpt("help").desc("print this message").build());
        return options;
    }

    private static CommandLine getCommandLine(String[] args) throws ParseException {
        // positionals may be negative numbers, so parsing stops at the first of them
        return new DefaultParser().parse(getOptions(), args, true);
    }

    private void printUsage() {
        var writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "kmeans [-i FILE] K [MAX_ITER]",
                null, getOptions(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }
}
