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
package de.identlib.api.oracle;

import java.util.List;

import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.RationalFunction;

/**
 * Answers membership queries of rational functions in a field of rational functions given by generator groups.
 * <p>
 * Group {@code i} with members {@code [g_i1, ..., g_in]} and pivot {@code g_i} contributes the generators
 * {@code g_ij / g_i}; the field in question is generated over the rationals by all these ratios.
 */
public interface FieldMembershipOracle {

    /**
     * Decides for every candidate whether it belongs to the field generated by the groups.
     *
     * @param groups
     *         the generator groups, must not be empty
     * @param candidates
     *         the rational functions to test, all from the same ring as the groups
     * @param probability
     *         a number in {@code (0, 1)}; the whole returned list is correct with at least this probability
     *
     * @return one flag per candidate, in candidate order
     */
    List<Boolean> checkFieldMembership(List<GeneratorGroup> groups,
                                       List<RationalFunction> candidates,
                                       double probability);
}
