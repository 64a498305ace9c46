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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.ring.EvaluationPoint;

/**
 * Draws integer points that avoid a hypersurface of bounded degree with prescribed probability.
 * <p>
 * By the Schwartz-Zippel lemma a non-zero polynomial of degree {@code d} vanishes at a point drawn uniformly from
 * {@code [-B, B]^n} with probability at most {@code d / (2B + 1)}. The half-width used here,
 * {@code B = ceil(3 * D^(k + 3) * m / (1 - p))}, covers all degenerate loci of a membership query with {@code m}
 * candidates, degree bound {@code D} and {@code k} variables.
 * <p>
 * The random source is the only mutable state and is not synchronized.
 */
public class GenericPointSampler {

    private final Random random;

    public GenericPointSampler(Random random) {
        this.random = random;
    }

    /**
     * Computes the half-width {@code ceil(3 * D^(k + 3) * m / (1 - p))} of the sampling range.
     *
     * @param degreeBound
     *         the degree bound {@code D}
     * @param nVariables
     *         the number {@code k} of variables that occur in the query
     * @param nCandidates
     *         the number {@code m} of candidates
     * @param probability
     *         the required probability {@code p} of correctness, in {@code (0, 1)}
     */
    public static BigInteger samplingBound(int degreeBound, int nVariables, int nCandidates, double probability) {
        ConfigurationException.checkProbability(probability);
        if (degreeBound < 0 || nVariables < 0 || nCandidates < 0) {
            throw new ConfigurationException("Degree bound, variable and candidate count must be non-negative");
        }
        BigInteger numerator = BigInteger.valueOf(3)
                                         .multiply(BigInteger.valueOf(degreeBound).pow(nVariables + 3))
                                         .multiply(BigInteger.valueOf(nCandidates));
        // 1 - p in decimal arithmetic, so that e.g. p = 0.7 yields exactly 0.3
        BigDecimal failure = BigDecimal.ONE.subtract(BigDecimal.valueOf(probability));
        return new BigDecimal(numerator).divide(failure, 0, RoundingMode.CEILING)
                                        .toBigIntegerExact();
    }

    /**
     * Draws a point with {@code dimension} coordinates, each uniform in {@code [-bound, bound]}.
     */
    public EvaluationPoint sample(int dimension, BigInteger bound) {
        if (bound.signum() < 0) {
            throw new IllegalArgumentException("Negative sampling bound " + bound);
        }
        BigInteger span = bound.shiftLeft(1).add(BigInteger.ONE);
        List<cc.redberry.rings.bigint.BigInteger> coordinates = new ArrayList<>(dimension);
        for (int i = 0; i < dimension; i++) {
            BigInteger value = uniformBelow(span).subtract(bound);
            coordinates.add(new cc.redberry.rings.bigint.BigInteger(value.toString()));
        }
        return new EvaluationPoint(coordinates);
    }

    private BigInteger uniformBelow(BigInteger span) {
        BigInteger candidate;
        do {
            candidate = new BigInteger(span.bitLength(), random);
        } while (candidate.compareTo(span) >= 0);
        return candidate;
    }
}
