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
package de.identlib.api.ring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import cc.redberry.rings.Rational;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.exception.ConfigurationException;

/**
 * A non-empty list of polynomials {@code [g_1, ..., g_n]} whose ratios to the group's pivot generate (part of) a field
 * of rational functions.
 * <p>
 * The pivot is the first non-zero member of minimal total degree; it serves as the common denominator of the group.
 * A group with a single member contributes only constants.
 */
public final class GeneratorGroup {

    private final List<MultivariatePolynomial<Rational<BigInteger>>> members;
    private final int pivotIndex;

    public GeneratorGroup(List<MultivariatePolynomial<Rational<BigInteger>>> members) {
        if (members.isEmpty()) {
            throw new ConfigurationException("A generator group must not be empty");
        }
        int nVariables = members.get(0).nVariables;
        int pivot = -1;
        for (int i = 0; i < members.size(); i++) {
            MultivariatePolynomial<Rational<BigInteger>> member = members.get(i);
            if (member.nVariables != nVariables) {
                throw new ConfigurationException(
                        "Generator group mixes rings with " + nVariables + " and " + member.nVariables + " variables");
            }
            // zero members contribute nothing and cannot serve as a denominator
            if (!member.isZero() && (pivot < 0 || member.degree() < members.get(pivot).degree())) {
                pivot = i;
            }
        }
        if (pivot < 0) {
            throw new ConfigurationException("A generator group must contain a non-zero polynomial");
        }
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
        this.pivotIndex = pivot;
    }

    @SafeVarargs
    public static GeneratorGroup of(MultivariatePolynomial<Rational<BigInteger>>... members) {
        return new GeneratorGroup(Arrays.asList(members));
    }

    /**
     * Creates the group {@code [denominator, numerator]} which contributes the single generator
     * {@code numerator / denominator} (provided the denominator has the smaller degree, otherwise its inverse).
     */
    public static GeneratorGroup of(RationalFunction function) {
        return of(function.denominator(), function.numerator());
    }

    public List<MultivariatePolynomial<Rational<BigInteger>>> members() {
        return members;
    }

    public MultivariatePolynomial<Rational<BigInteger>> pivot() {
        return members.get(pivotIndex);
    }

    public int pivotDegree() {
        return pivot().degree();
    }

    public int maxDegree() {
        int max = 0;
        for (MultivariatePolynomial<Rational<BigInteger>> member : members) {
            max = Math.max(max, member.degree());
        }
        return max;
    }

    public int nVariables() {
        return members.get(0).nVariables;
    }

    public int size() {
        return members.size();
    }

    public boolean isDegenerate() {
        return members.size() == 1;
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
