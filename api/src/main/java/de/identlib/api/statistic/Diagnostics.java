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
package de.identlib.api.statistic;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Collects the wall-clock time spent in the stages of an identifiability assessment, and the advisory messages the
 * assessment emitted. Written by the assessment, read only by the caller that created it.
 * <p>
 * Repeated measurements of the same stage are summed. Not thread-safe.
 */
public final class Diagnostics {

    public static final String IOEQ_TIME = "ioeq_time";
    public static final String WRONSKIAN_TIME = "wrnsk_time";
    public static final String RANK_TIME = "rank_time";
    public static final String SIMPLIFY_TIME = "simplify_time";
    public static final String CHECK_TIME = "check_time";

    private final Map<String, Long> nanos = new LinkedHashMap<>();
    private final List<String> advisories = new ArrayList<>();

    public <T> T time(String stage, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(stage, System.nanoTime() - start);
        }
    }

    public void record(String stage, long durationNanos) {
        nanos.merge(stage, Math.max(0, durationNanos), Long::sum);
    }

    public Duration getTiming(String stage) {
        Long value = nanos.get(stage);
        return value == null ? Duration.ZERO : Duration.ofNanos(value);
    }

    public double getSeconds(String stage) {
        return getTiming(stage).toNanos() / 1e9;
    }

    public boolean contains(String stage) {
        return nanos.containsKey(stage);
    }

    public Map<String, Duration> getTimings() {
        Map<String, Duration> result = new LinkedHashMap<>();
        nanos.forEach((stage, value) -> result.put(stage, Duration.ofNanos(value)));
        return Collections.unmodifiableMap(result);
    }

    public void addAdvisory(String message) {
        advisories.add(message);
    }

    public List<String> getAdvisories() {
        return Collections.unmodifiableList(advisories);
    }

    @Override
    public String toString() {
        return getTimings().toString();
    }
}
