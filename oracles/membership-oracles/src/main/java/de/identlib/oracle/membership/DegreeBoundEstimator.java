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
package de.identlib.oracle.membership;

import java.util.List;

import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.RationalFunction;

/**
 * Computes an upper bound {@code D} on the total degrees of the polynomials that appear when the membership question is
 * brought to a common denominator.
 * <p>
 * With {@code L} the sum of the degrees of all pivots and all candidate denominators (an over-approximation of the
 * degree of their least common multiple), the bound is
 * <pre>
 * D = max( L + 1,
 *          max_i (L - deg(pivot_i) + maxdeg(group_i)),
 *          max_j (L - deg(den_j) + deg(num_j)) )
 * </pre>
 * Understating {@code D} would void the probability guarantee of the sampler.
 */
public final class DegreeBoundEstimator {

    private DegreeBoundEstimator() {
        // prevent instantiation
    }

    public static int estimate(List<GeneratorGroup> groups, List<RationalFunction> candidates) {
        int combined = 0;
        for (GeneratorGroup group : groups) {
            combined += group.pivotDegree();
        }
        for (RationalFunction candidate : candidates) {
            combined += candidate.denominator().degree();
        }

        int bound = combined + 1;
        for (GeneratorGroup group : groups) {
            bound = Math.max(bound, combined - group.pivotDegree() + group.maxDegree());
        }
        for (RationalFunction candidate : candidates) {
            bound = Math.max(bound, combined - candidate.denominator().degree() + candidate.numerator().degree());
        }
        return bound;
    }
}
