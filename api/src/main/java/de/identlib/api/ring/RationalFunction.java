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

import java.util.Objects;

import cc.redberry.rings.Rational;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.exception.ConfigurationException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A rational function given as a pair of polynomials of the same ring. The pair is not reduced: {@code (x*y, x)} and
 * {@code (y, 1)} are different instances that describe the same function.
 */
public final class RationalFunction {

    private final MultivariatePolynomial<Rational<BigInteger>> numerator;
    private final MultivariatePolynomial<Rational<BigInteger>> denominator;

    private RationalFunction(MultivariatePolynomial<Rational<BigInteger>> numerator,
                             MultivariatePolynomial<Rational<BigInteger>> denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static RationalFunction of(MultivariatePolynomial<Rational<BigInteger>> numerator,
                                      MultivariatePolynomial<Rational<BigInteger>> denominator) {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.isZero()) {
            throw new ConfigurationException("Denominator of a rational function must not be zero");
        }
        if (numerator.nVariables != denominator.nVariables) {
            throw new ConfigurationException("Numerator and denominator belong to different rings ("
                    + numerator.nVariables + " vs. " + denominator.nVariables + " variables)");
        }
        return new RationalFunction(numerator, denominator);
    }

    public static RationalFunction of(MultivariatePolynomial<Rational<BigInteger>> polynomial) {
        return of(polynomial, polynomial.createOne());
    }

    public MultivariatePolynomial<Rational<BigInteger>> numerator() {
        return numerator;
    }

    public MultivariatePolynomial<Rational<BigInteger>> denominator() {
        return denominator;
    }

    public int nVariables() {
        return numerator.nVariables;
    }

    /**
     * Returns the value of this function at the given point, or {@code null} if the denominator vanishes there.
     */
    public @Nullable Rational<BigInteger> evaluate(EvaluationPoint point) {
        Rational<BigInteger> den = Polynomials.evaluate(denominator, point);
        if (den.isZero()) {
            return null;
        }
        return Polynomials.evaluate(numerator, point).divide(den);
    }

    @Override
    public String toString() {
        return "(" + numerator + ")/(" + denominator + ")";
    }
}
