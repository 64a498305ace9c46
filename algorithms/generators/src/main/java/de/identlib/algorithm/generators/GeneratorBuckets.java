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
package de.identlib.algorithm.generators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.PolynomialContext;

/**
 * Generator groups split by whether they involve states, together with the ring all of them live in.
 */
public final class GeneratorBuckets {

    private final PolynomialContext context;
    private final List<GeneratorGroup> withStates;
    private final List<GeneratorGroup> noStates;

    public GeneratorBuckets(PolynomialContext context, List<GeneratorGroup> withStates, List<GeneratorGroup> noStates) {
        this.context = context;
        this.withStates = Collections.unmodifiableList(new ArrayList<>(withStates));
        this.noStates = Collections.unmodifiableList(new ArrayList<>(noStates));
    }

    public PolynomialContext getContext() {
        return context;
    }

    public List<GeneratorGroup> getWithStates() {
        return withStates;
    }

    public List<GeneratorGroup> getNoStates() {
        return noStates;
    }

    /**
     * Returns a copy with the parameter-only bucket replaced.
     */
    public GeneratorBuckets withNoStates(List<GeneratorGroup> replacement) {
        return new GeneratorBuckets(context, withStates, replacement);
    }

    /**
     * All groups, parameter-only ones first.
     */
    public List<GeneratorGroup> merged() {
        List<GeneratorGroup> result = new ArrayList<>(noStates.size() + withStates.size());
        result.addAll(noStates);
        result.addAll(withStates);
        return result;
    }
}
