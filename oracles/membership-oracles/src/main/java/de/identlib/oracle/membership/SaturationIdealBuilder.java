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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import cc.redberry.rings.Rational;
import cc.redberry.rings.Rings;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.Monomial;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.ring.EvaluationPoint;
import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.Polynomials;

/**
 * Turns field membership into ideal membership.
 * <p>
 * For a group with pivot {@code g} and a point {@code pt}, every member {@code f} yields {@code f*g(pt) - f(pt)*g},
 * forcing {@code f/g} to take the value {@code f(pt)/g(pt)}. A fresh variable {@code s_i} per group yields
 * {@code g*s_i - 1}, which saturates the ideal with respect to the pivot. A rational function {@code a/b} of the field
 * is then constant on the fiber through {@code pt}, which means {@code a*b(pt) - b*a(pt)} lies in the ideal.
 */
public final class SaturationIdealBuilder {

    private SaturationIdealBuilder() {
        // prevent instantiation
    }

    public static SaturationIdeal build(List<GeneratorGroup> groups, EvaluationPoint point) {
        int nVariables = groups.get(0).nVariables();
        int extra = groups.size();
        List<MultivariatePolynomial<Rational<BigInteger>>> equations = new ArrayList<>();

        for (int i = 0; i < groups.size(); i++) {
            GeneratorGroup group = groups.get(i);
            MultivariatePolynomial<Rational<BigInteger>> pivot = Polynomials.extend(group.pivot(), extra);
            Rational<BigInteger> pivotValue = Polynomials.evaluate(group.pivot(), point);

            for (MultivariatePolynomial<Rational<BigInteger>> member : group.members()) {
                Rational<BigInteger> memberValue = Polynomials.evaluate(member, point);
                MultivariatePolynomial<Rational<BigInteger>> scaledMember =
                        Polynomials.extend(member, extra).multiply(pivotValue);
                MultivariatePolynomial<Rational<BigInteger>> scaledPivot = pivot.copy().multiply(memberValue);
                MultivariatePolynomial<Rational<BigInteger>> equation = scaledMember.subtract(scaledPivot);
                if (!equation.isZero()) {
                    equations.add(equation);
                }
            }

            int[] exponents = new int[nVariables + extra];
            exponents[nVariables + i] = 1;
            MultivariatePolynomial<Rational<BigInteger>> saturation =
                    pivot.createZero().add(new Monomial<>(exponents, Rings.Q.getOne()));
            equations.add(saturation.multiply(pivot).subtract(pivot.createOne()));
        }

        return new SaturationIdeal(nVariables, extra, equations);
    }

    /**
     * The generators of a saturation ideal, living in the base ring extended by one variable per generator group.
     */
    public static final class SaturationIdeal {

        private final int baseVariables;
        private final int saturationVariables;
        private final List<MultivariatePolynomial<Rational<BigInteger>>> generators;

        SaturationIdeal(int baseVariables,
                        int saturationVariables,
                        List<MultivariatePolynomial<Rational<BigInteger>>> generators) {
            this.baseVariables = baseVariables;
            this.saturationVariables = saturationVariables;
            this.generators = Collections.unmodifiableList(generators);
        }

        public int getBaseVariables() {
            return baseVariables;
        }

        public int getSaturationVariables() {
            return saturationVariables;
        }

        public List<MultivariatePolynomial<Rational<BigInteger>>> getGenerators() {
            return generators;
        }

        /**
         * Moves a polynomial of the base ring into the extended ring of this ideal.
         */
        public MultivariatePolynomial<Rational<BigInteger>> lift(MultivariatePolynomial<Rational<BigInteger>> poly) {
            return Polynomials.extend(poly, saturationVariables);
        }
    }
}
