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

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;

import cc.redberry.rings.Rational;
import cc.redberry.rings.Rings;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.Monomial;
import cc.redberry.rings.poly.multivar.MonomialOrder;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.exception.ConfigurationException;

/**
 * Static helpers on polynomials over the rationals that the Rings library does not offer in the shape needed here.
 */
public final class Polynomials {

    private Polynomials() {
        // prevent instantiation
    }

    /**
     * Evaluates a polynomial at an integer point.
     *
     * @param poly
     *         the polynomial, its variables are matched with the first coordinates of the point
     * @param point
     *         the point, must have at least as many coordinates as the polynomial has variables
     *
     * @return the (exact) value
     */
    public static Rational<BigInteger> evaluate(MultivariatePolynomial<Rational<BigInteger>> poly,
                                                EvaluationPoint point) {
        if (point.dimension() < poly.nVariables) {
            throw new ConfigurationException(
                    "Point of dimension " + point.dimension() + " cannot be used for " + poly.nVariables
                    + " variables");
        }
        MultivariatePolynomial<Rational<BigInteger>> value = poly;
        for (int i = 0; i < poly.nVariables; i++) {
            value = value.evaluate(i, point.rational(i));
        }
        return value.cc();
    }

    /**
     * Appends {@code count} fresh variables (with exponent zero everywhere) to the polynomial's ring.
     */
    public static <E> MultivariatePolynomial<E> extend(MultivariatePolynomial<E> poly, int count) {
        int nVariables = poly.nVariables + count;
        MultivariatePolynomial<E> result = MultivariatePolynomial.zero(nVariables, poly.ring, MonomialOrder.GREVLEX);
        for (Monomial<E> term : poly) {
            result.add(new Monomial<>(Arrays.copyOf(term.exponents, nVariables), term.coefficient));
        }
        return result;
    }

    /**
     * Counts the variables that occur with non-zero exponent in at least one of the given polynomials.
     */
    public static int countOccurringVariables(Collection<MultivariatePolynomial<Rational<BigInteger>>> polys) {
        BitSet occurring = new BitSet();
        for (MultivariatePolynomial<Rational<BigInteger>> poly : polys) {
            int[] degrees = poly.degrees();
            for (int i = 0; i < degrees.length; i++) {
                if (degrees[i] > 0) {
                    occurring.set(i);
                }
            }
        }
        return occurring.cardinality();
    }

    /**
     * Splits a polynomial over the rationals into an integer polynomial and a positive common denominator, such that
     * {@code poly = numerator / denominator}.
     */
    public static IntegerForm toIntegerForm(MultivariatePolynomial<Rational<BigInteger>> poly) {
        BigInteger denominator = BigInteger.ONE;
        for (Monomial<Rational<BigInteger>> term : poly) {
            BigInteger d = term.coefficient.denominator();
            denominator = denominator.divide(denominator.gcd(d)).multiply(d);
        }
        if (denominator.signum() < 0) {
            denominator = denominator.negate();
        }

        MultivariatePolynomial<BigInteger> numerator =
                MultivariatePolynomial.zero(poly.nVariables, Rings.Z, MonomialOrder.GREVLEX);
        for (Monomial<Rational<BigInteger>> term : poly) {
            Rational<BigInteger> c = term.coefficient;
            BigInteger scaled = c.numerator().multiply(denominator.divide(c.denominator()));
            numerator.add(new Monomial<>(term.exponents, scaled));
        }
        return new IntegerForm(numerator, denominator);
    }

    /**
     * Inverse of {@link #toIntegerForm(MultivariatePolynomial)} for an integer polynomial without denominator.
     */
    public static MultivariatePolynomial<Rational<BigInteger>> toRational(MultivariatePolynomial<BigInteger> poly) {
        MultivariatePolynomial<Rational<BigInteger>> result =
                MultivariatePolynomial.zero(poly.nVariables, Rings.Q, MonomialOrder.GREVLEX);
        for (Monomial<BigInteger> term : poly) {
            result.add(new Monomial<>(term.exponents, new Rational<>(Rings.Z, term.coefficient)));
        }
        return result;
    }

    /**
     * An integer polynomial together with a common denominator.
     */
    public static final class IntegerForm {

        private final MultivariatePolynomial<BigInteger> numerator;
        private final BigInteger denominator;

        IntegerForm(MultivariatePolynomial<BigInteger> numerator, BigInteger denominator) {
            this.numerator = numerator;
            this.denominator = denominator;
        }

        public MultivariatePolynomial<BigInteger> getNumerator() {
            return numerator;
        }

        public BigInteger getDenominator() {
            return denominator;
        }
    }
}
