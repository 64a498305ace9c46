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
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.algebra.BasisHandle;
import de.identlib.api.algebra.GroebnerEngine;
import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.exception.DegenerateSampleException;
import de.identlib.api.oracle.FieldMembershipOracle;
import de.identlib.api.ring.EvaluationPoint;
import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.Polynomials;
import de.identlib.api.ring.RationalFunction;
import de.identlib.oracle.membership.SaturationIdealBuilder.SaturationIdeal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monte Carlo field membership oracle.
 * <p>
 * One query samples a single point (see {@link GenericPointSampler}), builds the saturation ideal of the generators at
 * that point (see {@link SaturationIdealBuilder}), computes its Gröbner basis with the configured engine and reduces
 * {@code num*den(pt) - den*num(pt)} for every candidate {@code num/den}. A candidate belongs to the field if and only
 * if the reduction vanishes, up to the failure probability of the sampled point. Since the point is shared, the
 * failure probability bounds the whole batch rather than each answer.
 * <p>
 * Points at which a pivot or a candidate denominator vanishes are rejected and re-drawn.
 * <p>
 * This oracle is <b>not</b> thread-safe.
 */
public class RandomizedFieldMembershipOracle implements FieldMembershipOracle {

    public static final int DEFAULT_MAX_RESAMPLES = 8;

    private static final Logger LOGGER = LoggerFactory.getLogger(RandomizedFieldMembershipOracle.class);

    private final GroebnerEngine engine;
    private final GenericPointSampler sampler;
    private final int maxResamples;

    public RandomizedFieldMembershipOracle(GroebnerEngine engine, GenericPointSampler sampler) {
        this(engine, sampler, DEFAULT_MAX_RESAMPLES);
    }

    public RandomizedFieldMembershipOracle(GroebnerEngine engine, GenericPointSampler sampler, int maxResamples) {
        if (maxResamples < 0) {
            throw new ConfigurationException("Number of re-samples must not be negative");
        }
        this.engine = engine;
        this.sampler = sampler;
        this.maxResamples = maxResamples;
    }

    @Override
    public List<Boolean> checkFieldMembership(List<GeneratorGroup> groups,
                                              List<RationalFunction> candidates,
                                              double probability) {
        ConfigurationException.checkProbability(probability);
        validate(groups, candidates);
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }

        if (LOGGER.isDebugEnabled()) {
            List<Integer> pivotDegrees = new ArrayList<>(groups.size());
            for (GeneratorGroup group : groups) {
                pivotDegrees.add(group.pivotDegree());
            }
            LOGGER.debug("Pivot degrees are {}", pivotDegrees);
        }

        int degreeBound = DegreeBoundEstimator.estimate(groups, candidates);
        List<MultivariatePolynomial<Rational<BigInteger>>> involved = new ArrayList<>();
        for (GeneratorGroup group : groups) {
            involved.addAll(group.members());
        }
        for (RationalFunction candidate : candidates) {
            involved.add(candidate.numerator());
            involved.add(candidate.denominator());
        }
        int nVariables = Polynomials.countOccurringVariables(involved);
        LOGGER.debug("Bound for the degrees is {}, {} variables occur", degreeBound, nVariables);

        java.math.BigInteger bound =
                GenericPointSampler.samplingBound(degreeBound, nVariables, candidates.size(), probability);
        LOGGER.debug("Sampling from {} to {}", bound.negate(), bound);

        EvaluationPoint point = samplePoint(groups, candidates, bound);
        LOGGER.debug("Point is {}", point);

        return checkFieldMembership(groups, candidates, point);
    }

    /**
     * Answers the membership queries for a fixed evaluation point. The result is deterministic in its arguments.
     *
     * @param point
     *         the point, must not annihilate any pivot or candidate denominator
     */
    public List<Boolean> checkFieldMembership(List<GeneratorGroup> groups,
                                              List<RationalFunction> candidates,
                                              EvaluationPoint point) {
        validate(groups, candidates);
        if (point.dimension() != groups.get(0).nVariables()) {
            throw new ConfigurationException("Point has " + point.dimension() + " coordinates, ring has "
                    + groups.get(0).nVariables() + " variables");
        }
        for (GeneratorGroup group : groups) {
            if (Polynomials.evaluate(group.pivot(), point).isZero()) {
                throw new ConfigurationException("Pivot " + group.pivot() + " vanishes at " + point);
            }
        }
        for (RationalFunction candidate : candidates) {
            if (Polynomials.evaluate(candidate.denominator(), point).isZero()) {
                throw new ConfigurationException("Denominator of " + candidate + " vanishes at " + point);
            }
        }

        SaturationIdeal ideal = SaturationIdealBuilder.build(groups, point);
        LOGGER.debug("Computing Groebner basis ({} equations)", ideal.getGenerators().size());
        BasisHandle<Rational<BigInteger>> basis = engine.basis(ideal.getGenerators());

        List<Boolean> result = new ArrayList<>(candidates.size());
        for (RationalFunction candidate : candidates) {
            Rational<BigInteger> numValue = Polynomials.evaluate(candidate.numerator(), point);
            Rational<BigInteger> denValue = Polynomials.evaluate(candidate.denominator(), point);
            MultivariatePolynomial<Rational<BigInteger>> scaledNum = candidate.numerator().copy().multiply(denValue);
            MultivariatePolynomial<Rational<BigInteger>> scaledDen = candidate.denominator().copy().multiply(numValue);
            MultivariatePolynomial<Rational<BigInteger>> poly = ideal.lift(scaledNum.subtract(scaledDen));
            result.add(engine.reduce(poly, basis).isZero());
        }
        return result;
    }

    private EvaluationPoint samplePoint(List<GeneratorGroup> groups,
                                        List<RationalFunction> candidates,
                                        java.math.BigInteger bound) {
        int dimension = groups.get(0).nVariables();
        for (int attempt = 0; attempt <= maxResamples; attempt++) {
            EvaluationPoint point = sampler.sample(dimension, bound);
            if (isRegular(groups, candidates, point)) {
                return point;
            }
            LOGGER.debug("Point {} annihilates a pivot or a denominator, re-sampling", point);
        }
        throw new DegenerateSampleException(maxResamples + 1);
    }

    private static boolean isRegular(List<GeneratorGroup> groups,
                                     List<RationalFunction> candidates,
                                     EvaluationPoint point) {
        for (GeneratorGroup group : groups) {
            if (Polynomials.evaluate(group.pivot(), point).isZero()) {
                return false;
            }
        }
        for (RationalFunction candidate : candidates) {
            if (Polynomials.evaluate(candidate.denominator(), point).isZero()) {
                return false;
            }
        }
        return true;
    }

    private static void validate(List<GeneratorGroup> groups, List<RationalFunction> candidates) {
        if (groups.isEmpty()) {
            throw new ConfigurationException("At least one generator group is required");
        }
        int nVariables = groups.get(0).nVariables();
        for (GeneratorGroup group : groups) {
            if (group.nVariables() != nVariables) {
                throw new ConfigurationException("Generator groups belong to different rings");
            }
        }
        for (RationalFunction candidate : candidates) {
            if (candidate.nVariables() != nVariables) {
                throw new ConfigurationException("Candidate " + candidate + " does not belong to the generators' ring");
            }
        }
    }
}
