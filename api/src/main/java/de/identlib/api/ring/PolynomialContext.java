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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import cc.redberry.rings.Rational;
import cc.redberry.rings.Rings;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.MultivariateRing;
import cc.redberry.rings.poly.multivar.Monomial;
import cc.redberry.rings.poly.multivar.MonomialOrder;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.exception.ConfigurationException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A multivariate polynomial ring over the rationals whose variables carry names.
 * <p>
 * Polynomials of the Rings library only know their variables by index. This class keeps the names next to the ring so
 * that polynomials can be moved between rings of different models (parameters only, parameters and states,
 * input-output equations) by matching names, and so that they can be printed readably.
 * <p>
 * All polynomials created here use the graded reverse lexicographic order.
 */
public final class PolynomialContext {

    private final List<String> variables;
    private final Map<String, Integer> indices;
    private final MultivariateRing<MultivariatePolynomial<Rational<BigInteger>>> ring;

    public PolynomialContext(List<String> variables) {
        if (variables.isEmpty()) {
            throw new ConfigurationException("A polynomial ring needs at least one variable");
        }
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.indices = new HashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            if (indices.put(variables.get(i), i) != null) {
                throw new ConfigurationException("Duplicate variable name '" + variables.get(i) + "'");
            }
        }
        this.ring =
                new MultivariateRing<>(MultivariatePolynomial.zero(variables.size(), Rings.Q, MonomialOrder.GREVLEX));
    }

    public static PolynomialContext of(String... variables) {
        return new PolynomialContext(Arrays.asList(variables));
    }

    public MultivariateRing<MultivariatePolynomial<Rational<BigInteger>>> ring() {
        return ring;
    }

    public List<String> variables() {
        return variables;
    }

    public int nVariables() {
        return variables.size();
    }

    public boolean contains(String name) {
        return indices.containsKey(name);
    }

    public int indexOf(String name) {
        Integer index = indices.get(name);
        if (index == null) {
            throw new ConfigurationException("Unknown variable '" + name + "', ring has " + variables);
        }
        return index;
    }

    public MultivariatePolynomial<Rational<BigInteger>> variable(String name) {
        return ring.variable(indexOf(name));
    }

    public MultivariatePolynomial<Rational<BigInteger>> constant(long value) {
        return ring.valueOf(value);
    }

    public MultivariatePolynomial<Rational<BigInteger>> constant(long numerator, long denominator) {
        Rational<BigInteger> value =
                new Rational<>(Rings.Z, BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
        return ring.getZero().createConstant(value);
    }

    /**
     * Checks whether the given polynomial lives in a ring with the same number of variables as this one.
     */
    public boolean owns(MultivariatePolynomial<Rational<BigInteger>> poly) {
        return poly.nVariables == variables.size();
    }

    /**
     * Returns the names of the variables that occur in the given polynomial with non-zero exponent.
     */
    public Set<String> occurringVariables(MultivariatePolynomial<Rational<BigInteger>> poly) {
        Set<String> result = new LinkedHashSet<>();
        int[] degrees = poly.degrees();
        for (int i = 0; i < degrees.length; i++) {
            if (degrees[i] > 0) {
                result.add(variables.get(i));
            }
        }
        return result;
    }

    /**
     * Rewrites a polynomial of the {@code source} ring as a polynomial of this ring, matching variables by name.
     *
     * @return the rewritten polynomial, or {@code null} if the polynomial involves a variable this ring does not have
     */
    public @Nullable MultivariatePolynomial<Rational<BigInteger>> cast(MultivariatePolynomial<Rational<BigInteger>> poly,
                                                                       PolynomialContext source) {
        int[] targetIndex = new int[source.nVariables()];
        for (int i = 0; i < targetIndex.length; i++) {
            Integer index = indices.get(source.variables.get(i));
            targetIndex[i] = index == null ? -1 : index;
        }

        MultivariatePolynomial<Rational<BigInteger>> result =
                MultivariatePolynomial.zero(nVariables(), Rings.Q, MonomialOrder.GREVLEX);
        for (Monomial<Rational<BigInteger>> term : poly) {
            int[] exponents = new int[nVariables()];
            for (int i = 0; i < term.exponents.length; i++) {
                if (term.exponents[i] == 0) {
                    continue;
                }
                if (targetIndex[i] < 0) {
                    return null;
                }
                exponents[targetIndex[i]] = term.exponents[i];
            }
            result.add(new Monomial<>(exponents, term.coefficient));
        }
        return result;
    }

    /**
     * Same as {@link #cast(MultivariatePolynomial, PolynomialContext)} for both parts of a rational function.
     */
    public @Nullable RationalFunction cast(RationalFunction function, PolynomialContext source) {
        MultivariatePolynomial<Rational<BigInteger>> num = cast(function.numerator(), source);
        MultivariatePolynomial<Rational<BigInteger>> den = cast(function.denominator(), source);
        if (num == null || den == null) {
            return null;
        }
        return RationalFunction.of(num, den);
    }

    public String toString(MultivariatePolynomial<Rational<BigInteger>> poly) {
        if (poly.isZero()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (Monomial<Rational<BigInteger>> term : poly) {
            String coefficient = term.coefficient.toString();
            boolean negative = coefficient.startsWith("-");
            if (sb.length() > 0) {
                sb.append(negative ? " - " : " + ");
            } else if (negative) {
                sb.append('-');
            }
            String magnitude = negative ? coefficient.substring(1) : coefficient;

            StringBuilder monomial = new StringBuilder();
            for (int i = 0; i < term.exponents.length; i++) {
                if (term.exponents[i] == 0) {
                    continue;
                }
                if (monomial.length() > 0) {
                    monomial.append('*');
                }
                monomial.append(variables.get(i));
                if (term.exponents[i] > 1) {
                    monomial.append('^').append(term.exponents[i]);
                }
            }

            if (monomial.length() == 0) {
                sb.append(magnitude);
            } else if ("1".equals(magnitude)) {
                sb.append(monomial);
            } else {
                sb.append(magnitude).append('*').append(monomial);
            }
        }
        return sb.toString();
    }

    public String toString(RationalFunction function) {
        if (function.denominator().isOne()) {
            return toString(function.numerator());
        }
        return "(" + toString(function.numerator()) + ")/(" + toString(function.denominator()) + ")";
    }

    @Override
    public String toString() {
        return "Q" + variables;
    }
}
