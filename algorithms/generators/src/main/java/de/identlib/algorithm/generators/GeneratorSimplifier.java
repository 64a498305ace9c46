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
import java.util.Arrays;
import java.util.List;

import cc.redberry.rings.Rational;
import cc.redberry.rings.Rationals;
import cc.redberry.rings.Rings;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.MultivariateRing;
import cc.redberry.rings.poly.multivar.Monomial;
import cc.redberry.rings.poly.multivar.MonomialOrder;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.algebra.BasisHandle;
import de.identlib.api.algebra.GroebnerEngine;
import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.Polynomials;
import de.identlib.api.ring.Polynomials.IntegerForm;
import de.identlib.api.ring.RationalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact simplification of a generating set of a field of rational functions.
 * <p>
 * The saturation ideal of the groups is built as in the randomized oracle, but instead of a sampled point the
 * generic point {@code (t_1, ..., t_n)} is used, where the {@code t_i} are transcendental symbols: the ideal lives in
 * {@code Q(t_1, ..., t_n)[x_1, ..., x_n, s_1, ..., s_k]}. The coefficients of its reduced Gröbner basis, divided by the
 * respective leading coefficient, generate the same field and are usually far fewer and simpler than the input.
 * <p>
 * Deterministic, but considerably more expensive than a randomized membership test.
 */
public class GeneratorSimplifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneratorSimplifier.class);

    private final GroebnerEngine engine;

    public GeneratorSimplifier(GroebnerEngine engine) {
        this.engine = engine;
    }

    /**
     * Computes a simplified set of generators of the field generated by the given groups.
     *
     * @return the generators as rational functions in the groups' ring; constants are omitted and no generator occurs
     * together with its negative
     */
    public List<RationalFunction> simplify(List<GeneratorGroup> groups) {
        if (groups.isEmpty()) {
            throw new ConfigurationException("At least one generator group is required");
        }
        int nVariables = groups.get(0).nVariables();
        int extra = groups.size();

        MultivariateRing<MultivariatePolynomial<BigInteger>> symbols =
                new MultivariateRing<>(MultivariatePolynomial.zero(nVariables, Rings.Z, MonomialOrder.GREVLEX));
        Rationals<MultivariatePolynomial<BigInteger>> field = Rings.Frac(symbols);
        FieldEmbedding embedding = new FieldEmbedding(symbols, field, nVariables + extra);

        List<MultivariatePolynomial<Rational<MultivariatePolynomial<BigInteger>>>> equations = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            GeneratorGroup group = groups.get(i);
            if (group.nVariables() != nVariables) {
                throw new ConfigurationException("Generator groups belong to different rings");
            }
            MultivariatePolynomial<Rational<MultivariatePolynomial<BigInteger>>> pivot = embedding.lift(group.pivot());
            Rational<MultivariatePolynomial<BigInteger>> pivotSymbolic = embedding.symbolic(group.pivot());

            for (MultivariatePolynomial<Rational<BigInteger>> member : group.members()) {
                MultivariatePolynomial<Rational<MultivariatePolynomial<BigInteger>>> equation =
                        embedding.lift(member).multiply(pivotSymbolic)
                                 .subtract(pivot.copy().multiply(embedding.symbolic(member)));
                if (!equation.isZero()) {
                    equations.add(equation);
                }
            }

            int[] exponents = new int[nVariables + extra];
            exponents[nVariables + i] = 1;
            MultivariatePolynomial<Rational<MultivariatePolynomial<BigInteger>>> saturation =
                    pivot.createZero().add(new Monomial<>(exponents, field.getOne()));
            equations.add(saturation.multiply(pivot).subtract(pivot.createOne()));
        }

        LOGGER.debug("Computing Groebner basis over the field of symbols ({} equations)", equations.size());
        BasisHandle<Rational<MultivariatePolynomial<BigInteger>>> basis = engine.basis(equations);

        List<Rational<MultivariatePolynomial<BigInteger>>> generators = new ArrayList<>();
        for (MultivariatePolynomial<Rational<MultivariatePolynomial<BigInteger>>> poly : basis.getPolynomials()) {
            Rational<MultivariatePolynomial<BigInteger>> leading = poly.lc();
            for (Monomial<Rational<MultivariatePolynomial<BigInteger>>> term : poly) {
                Rational<MultivariatePolynomial<BigInteger>> ratio = term.coefficient.divide(leading);
                if (isConstant(ratio) || containsUpToSign(generators, ratio)) {
                    continue;
                }
                generators.add(ratio);
            }
        }

        List<RationalFunction> result = new ArrayList<>(generators.size());
        for (Rational<MultivariatePolynomial<BigInteger>> generator : generators) {
            result.add(RationalFunction.of(Polynomials.toRational(generator.numerator()),
                                           Polynomials.toRational(generator.denominator())));
        }
        LOGGER.debug("Simplified {} generator groups to {} generators", groups.size(), result.size());
        return result;
    }

    /**
     * Same as {@link #simplify(List)}, with every generator {@code num/den} returned as the group {@code [den, num]}.
     */
    public List<GeneratorGroup> simplifyToGroups(List<GeneratorGroup> groups) {
        List<GeneratorGroup> result = new ArrayList<>();
        for (RationalFunction generator : simplify(groups)) {
            result.add(GeneratorGroup.of(generator));
        }
        return result;
    }

    private static boolean isConstant(Rational<MultivariatePolynomial<BigInteger>> value) {
        return value.numerator().isConstant() && value.denominator().isConstant();
    }

    private static boolean containsUpToSign(List<Rational<MultivariatePolynomial<BigInteger>>> generators,
                                            Rational<MultivariatePolynomial<BigInteger>> value) {
        for (Rational<MultivariatePolynomial<BigInteger>> g : generators) {
            if (g.subtract(value).isZero() || g.add(value).isZero()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Maps polynomials over the rationals into the two places they take in the symbolic ideal: as polynomials with
     * symbolic coefficients in the extended ring, and as elements of the field of symbols.
     */
    private static final class FieldEmbedding {

        private final MultivariateRing<MultivariatePolynomial<BigInteger>> symbols;
        private final Rationals<MultivariatePolynomial<BigInteger>> field;
        private final int nVariables;

        FieldEmbedding(MultivariateRing<MultivariatePolynomial<BigInteger>> symbols,
                       Rationals<MultivariatePolynomial<BigInteger>> field,
                       int nVariables) {
            this.symbols = symbols;
            this.field = field;
            this.nVariables = nVariables;
        }

        MultivariatePolynomial<Rational<MultivariatePolynomial<BigInteger>>> lift(
                MultivariatePolynomial<Rational<BigInteger>> poly) {
            MultivariatePolynomial<Rational<MultivariatePolynomial<BigInteger>>> result =
                    MultivariatePolynomial.zero(nVariables, field, MonomialOrder.GREVLEX);
            for (Monomial<Rational<BigInteger>> term : poly) {
                Rational<BigInteger> c = term.coefficient;
                Rational<MultivariatePolynomial<BigInteger>> coefficient =
                        new Rational<>(symbols, constant(c.numerator()), constant(c.denominator()));
                int[] exponents = Arrays.copyOf(term.exponents, nVariables);
                result.add(new Monomial<>(exponents, coefficient));
            }
            return result;
        }

        Rational<MultivariatePolynomial<BigInteger>> symbolic(MultivariatePolynomial<Rational<BigInteger>> poly) {
            IntegerForm form = Polynomials.toIntegerForm(poly);
            return new Rational<>(symbols, form.getNumerator(), constant(form.getDenominator()));
        }

        private MultivariatePolynomial<BigInteger> constant(BigInteger value) {
            return symbols.getZero().createConstant(value);
        }
    }
}
