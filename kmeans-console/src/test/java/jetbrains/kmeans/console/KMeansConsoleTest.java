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

import jetbrains.kmeans.ConfigurationStrategy;
import jetbrains.kmeans.KMeansConfig;
import org.jetbrains.annotations.NotNull;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class KMeansConsoleTest {
    private static final String PAIRS = "0,0\n10,10\n0,1\n10,11\n";
    private static final String PAIRS_OUTPUT = "0.0000,0.5000\n10.0000,10.5000\n";
    private static final String DUMMY_INPUT = "1,2,3\n4,5,6\n7,8,9\n1,2,3\n";

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testPairs() {
        var run = run(PAIRS, "2", "10");
        run.assertSuccess(PAIRS_OUTPUT);
        Assert.assertEquals("", run.err);
    }

    @Test
    public void testDefaultIterations() {
        run(PAIRS, "2").assertSuccess(PAIRS_OUTPUT);
    }

    @Test
    public void testBlobsFixtures() throws IOException {
        var input = fixture("input_blobs.txt");
        run(input, "3", "100").assertSuccess(fixture("output_blobs_3_100.txt"));
        run(input, "5", "2").assertSuccess(fixture("output_blobs_5_2.txt"));
    }

    @Test
    public void testOutputShape() throws IOException {
        var run = run(fixture("input_blobs.txt"), "7");
        Assert.assertEquals(KMeansConsole.EXIT_SUCCESS, run.exitCode);
        var lines = run.out.split("\n", -1);
        Assert.assertEquals(8, lines.length);
        Assert.assertEquals("", lines[7]);
        for (int i = 0; i < 7; i++) {
            Assert.assertTrue(lines[i], lines[i].matches("-?\\d+\\.\\d{4},-?\\d+\\.\\d{4},-?\\d+\\.\\d{4}"));
        }
    }

    @Test
    public void testDeterministicOutput() throws IOException {
        var input = fixture("input_blobs.txt");
        Assert.assertEquals(run(input, "4", "50").out, run(input, "4", "50").out);
    }

    @Test
    public void testIterationBoundaries() {
        run(PAIRS, "2", "2").assertSuccess(PAIRS_OUTPUT);
        run(PAIRS, "2", "999").assertSuccess(PAIRS_OUTPUT);
        run(PAIRS, "2", "1").assertFailure(KMeansConsole.INVALID_ITERATIONS);
        run(PAIRS, "2", "1000").assertFailure(KMeansConsole.INVALID_ITERATIONS);
        run(PAIRS, "2", "-2").assertFailure(KMeansConsole.INVALID_ITERATIONS);
        run(PAIRS, "2", "0").assertFailure(KMeansConsole.INVALID_ITERATIONS);
        run(PAIRS, "2", "99999999999999999999").assertFailure(KMeansConsole.INVALID_ITERATIONS);
    }

    @Test
    public void testClusterBoundaries() {
        run(DUMMY_INPUT, "3", "2").assertSuccess("1.0000,2.0000,3.0000\n4.0000,5.0000,6.0000\n7.0000,8.0000,9.0000\n");
        run(DUMMY_INPUT, "4", "2").assertFailure(KMeansConsole.INVALID_CLUSTERS);
        run(DUMMY_INPUT, "8", "2").assertFailure(KMeansConsole.INVALID_CLUSTERS);
        run(DUMMY_INPUT, "1", "2").assertFailure(KMeansConsole.INVALID_CLUSTERS);
        run(DUMMY_INPUT, "0", "2").assertFailure(KMeansConsole.INVALID_CLUSTERS);
        run(DUMMY_INPUT, "-2", "2").assertFailure(KMeansConsole.INVALID_CLUSTERS);
        run(DUMMY_INPUT, "65536").assertFailure(KMeansConsole.INVALID_CLUSTERS);
        run(DUMMY_INPUT, "99999999999999999999").assertFailure(KMeansConsole.INVALID_CLUSTERS);
    }

    @Test
    public void testClusterCountCheckedBeforeIterations() {
        run(DUMMY_INPUT, "1", "1000").assertFailure(KMeansConsole.INVALID_CLUSTERS);
    }

    @Test
    public void testArgumentErrors() {
        run(DUMMY_INPUT).assertFailure(KMeansConsole.GENERAL_ERROR);
        run(DUMMY_INPUT, "2", "2", "3").assertFailure(KMeansConsole.GENERAL_ERROR);
        run(DUMMY_INPUT, "a", "2").assertFailure(KMeansConsole.GENERAL_ERROR);
        run(DUMMY_INPUT, "2", "a").assertFailure(KMeansConsole.GENERAL_ERROR);
        run(DUMMY_INPUT, "2.5").assertFailure(KMeansConsole.GENERAL_ERROR);
        run(DUMMY_INPUT, "65,536").assertFailure(KMeansConsole.GENERAL_ERROR);
        run(DUMMY_INPUT, "🐞").assertFailure(KMeansConsole.GENERAL_ERROR);
        run(DUMMY_INPUT, "2", "2.5").assertFailure(KMeansConsole.GENERAL_ERROR);
    }

    @Test
    public void testSignedAndPaddedIntegers() {
        run(PAIRS, "+2", " 10").assertSuccess(PAIRS_OUTPUT);
    }

    @Test
    public void testMalformedInput() {
        run("1,2,three\n4,5,6\n7,8,9\n", "2").assertFailure(KMeansConsole.GENERAL_ERROR);
    }

    @Test
    public void testDimensionMismatch() {
        run("1,2,3\n4,5\n7,8,9\n", "2").assertFailure(KMeansConsole.GENERAL_ERROR);
    }

    @Test
    public void testEmptyInput() {
        run("", "2").assertFailure(KMeansConsole.GENERAL_ERROR);
    }

    @Test
    public void testMalformedInputReportedBeforeClusterCount() {
        run("1,2\nx,y\n", "5").assertFailure(KMeansConsole.GENERAL_ERROR);
    }

    @Test
    public void testEmptyClusterIsNotFatal() {
        var run = run("0,0\n0,0\n5,5\n", "2", "10");
        run.assertSuccess("5.0000,5.0000\n0.0000,0.0000\n");
        Assert.assertEquals(KMeansConsole.GENERAL_ERROR + '\n', run.err);
    }

    @Test
    public void testInputFile() throws IOException {
        var file = temporaryFolder.newFile("pairs.txt").toPath();
        Files.writeString(file, PAIRS, StandardCharsets.UTF_8);

        run("", "-i", file.toString(), "2", "10").assertSuccess(PAIRS_OUTPUT);
        run("", "--input", file.toString(), "2").assertSuccess(PAIRS_OUTPUT);
    }

    @Test
    public void testMissingInputFile() {
        var missing = temporaryFolder.getRoot().toPath().resolve("missing.txt");
        run(PAIRS, "-i", missing.toString(), "2").assertFailure(KMeansConsole.GENERAL_ERROR);
    }

    @Test
    public void testMalformedInputPath() {
        run(PAIRS, "-i", "pairs\u0000.txt", "2").assertFailure(KMeansConsole.GENERAL_ERROR);
    }

    @Test
    public void testOptionAfterPositionalsIsAnArgument() {
        run(PAIRS, "2", "10", "-i").assertFailure(KMeansConsole.GENERAL_ERROR);
    }

    @Test
    public void testHelp() {
        var run = run("", "--help");
        Assert.assertEquals(KMeansConsole.EXIT_SUCCESS, run.exitCode);
        Assert.assertTrue(run.out, run.out.contains("kmeans [-i FILE] K [MAX_ITER]"));
    }

    @Test
    public void testConfiguredDefaultIterations() {
        var config = new KMeansConfig(ConfigurationStrategy.IGNORE).setMaxIterations(1000);
        run(config, PAIRS, "2").assertFailure(KMeansConsole.INVALID_ITERATIONS);

        config = new KMeansConfig(ConfigurationStrategy.IGNORE).setMaxIterations(1000);
        run(config, PAIRS, "2", "10").assertSuccess(PAIRS_OUTPUT);
    }

    private static String fixture(@NotNull String name) throws IOException {
        try (InputStream stream = KMeansConsoleTest.class.getResourceAsStream("/fixtures/" + name)) {
            Assert.assertNotNull(name, stream);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Run run(@NotNull String input, String... args) {
        return run(new KMeansConfig(ConfigurationStrategy.IGNORE), input, args);
    }

    private static Run run(@NotNull KMeansConfig config, @NotNull String input, String... args) {
        var in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        var exitCode = new KMeansConsole(in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                config).run(args);
        return new Run(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    private static final class Run {
        private final int exitCode;
        private final String out;
        private final String err;

        private Run(int exitCode, String out, String err) {
            this.exitCode = exitCode;
            this.out = out;
            this.err = err;
        }

        private void assertSuccess(@NotNull String expectedOutput) {
            Assert.assertEquals(err, KMeansConsole.EXIT_SUCCESS, exitCode);
            Assert.assertEquals(expectedOutput, out);
        }

        private void assertFailure(@NotNull String message) {
            Assert.assertEquals(KMeansConsole.EXIT_FAILURE, exitCode);
            Assert.assertEquals(message + '\n', out);
        }
    }
}
