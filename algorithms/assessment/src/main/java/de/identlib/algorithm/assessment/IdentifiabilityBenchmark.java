/* Copyright (C) 2024-2026 IdentLib contributors
 * This file is part of IdentLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.identlib.algorithm.assessment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.model.IdentifiableModel;
import de.identlib.api.statistic.Diagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the assessment of all parameters of a number of named models several times and averages the stage durations.
 */
public class IdentifiabilityBenchmark {

    public static final String TOTAL_TIME = "total";

    private static final Logger LOGGER = LoggerFactory.getLogger(IdentifiabilityBenchmark.class);

    private final IdentifiabilityAssessor assessor;
    private final AssessmentConfig config;
    private final int runs;
    private final Map<String, IdentifiableModel> models = new LinkedHashMap<>();

    public IdentifiabilityBenchmark(IdentifiabilityAssessor assessor, AssessmentConfig config, int runs) {
        if (runs < 1) {
            throw new ConfigurationException("At least one run is required, got " + runs);
        }
        this.assessor = assessor;
        this.config = config;
        this.runs = runs;
    }

    public IdentifiabilityBenchmark add(String name, IdentifiableModel model) {
        if (models.putIfAbsent(name, model) != null) {
            throw new ConfigurationException("Duplicate benchmark name '" + name + "'");
        }
        return this;
    }

    /**
     * Runs all registered models.
     *
     * @return model name to the average duration of every recorded stage, including {@value #TOTAL_TIME}
     */
    public Map<String, Map<String, Duration>> run() {
        Map<String, Map<String, Duration>> result = new LinkedHashMap<>();
        for (Map.Entry<String, IdentifiableModel> entry : models.entrySet()) {
            LOGGER.info("Processing {}", entry.getKey());
            result.put(entry.getKey(), run(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    private Map<String, Duration> run(IdentifiableModel model) {
        List<Diagnostics> measurements = new ArrayList<>(runs);
        for (int i = 0; i < runs; i++) {
            Diagnostics diagnostics = new Diagnostics();
            diagnostics.time(TOTAL_TIME,
                             () -> assessor.assessGlobalIdentifiability(model,
                                                                        Collections.emptyList(),
                                                                        config.getProbability(),
                                                                        config.variableChangePolicy(),
                                                                        diagnostics));
            measurements.add(diagnostics);
        }
        return average(measurements);
    }

    static Map<String, Duration> average(List<Diagnostics> measurements) {
        Map<String, Long> sums = new LinkedHashMap<>();
        for (Diagnostics diagnostics : measurements) {
            diagnostics.getTimings().forEach((stage, duration) -> sums.merge(stage, duration.toNanos(), Long::sum));
        }
        Map<String, Duration> result = new LinkedHashMap<>();
        sums.forEach((stage, nanos) -> result.put(stage, Duration.ofNanos(nanos / measurements.size())));
        return result;
    }
}
