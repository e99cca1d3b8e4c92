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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Locale;

public final class Slf4jProgressTracker implements ProgressTracker {
    private static final Logger logger = LoggerFactory.getLogger(Slf4jProgressTracker.class);

    private final ArrayDeque<ProgressPhase> phases = new ArrayDeque<>();
    private String runName;

    @Override
    public void start(String runName) {
        this.runName = runName;
        assert phases.isEmpty();
    }

    @Override
    public void finish() {
        this.runName = null;
        assert phases.isEmpty();
    }

    @Override
    public void pushPhase(String phaseName, String... parameters) {
        if (parameters.length % 2 != 0) {
            throw new IllegalArgumentException("Phase parameters must be name/value pairs");
        }
        phases.addLast(new ProgressPhase(phaseName, parameters));
        reportProgress();
    }

    @Override
    public void progress(double progress) {
        var phase = phases.peekLast();
        assert phase != null;

        var value = Math.max(phase.progress, Math.min(100, Math.max(0, progress)));
        if (value > phase.progress) {
            phase.progress = value;
            reportProgress();
        }
    }

    @Override
    public void pullPhase() {
        phases.removeLast();
    }

    private void reportProgress() {
        if (logger.isDebugEnabled()) {
            var status = createOutput();
            if (!status.isBlank()) {
                logger.debug(status);
            }
        }
    }

    @NotNull
    String createOutput() {
        if (runName == null || phases.isEmpty()) {
            return "";
        }

        StringBuilder builder = new StringBuilder();
        builder.append(runName).append(" : ");

        int counter = 0;
        for (var phase : phases) {
            if (counter > 0) {
                builder.append(" -> ");
            }

            builder.append(phase.phaseName);
            var parameters = phase.parameters;

            if (parameters.length > 0) {
                builder.append(" ");
            }

            for (int j = 0; j < parameters.length; j += 2) {
                builder.append("{");
                builder.append(parameters[j]);
                builder.append(":");
                builder.append(parameters[j + 1]);
                builder.append("}");

                if (j < parameters.length - 2) {
                    builder.append(", ");
                }
            }
            if (phase.progress >= 0) {
                builder.append(" [").append(String.format(Locale.US, "%.2f", phase.progress)).append("%]");
            }
            counter++;
        }
        return builder.toString();
    }

    private static final class ProgressPhase {
        private double progress = -1;
        private final String phaseName;
        private final String[] parameters;

        private ProgressPhase(String phaseName, String... parameters) {
            this.phaseName = phaseName;
            this.parameters = parameters;
        }
    }
}
