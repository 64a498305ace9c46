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
package de.identlib.algorithm.assessment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import cc.redberry.rings.Rational;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.algorithm.generators.GeneratorBuckets;
import de.identlib.algorithm.generators.GeneratorSetExtractor;
import de.identlib.algorithm.generators.GeneratorSimplifier;
import de.identlib.api.algebra.GroebnerEngine;
import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.model.IdentifiableModel;
import de.identlib.api.model.InputOutputEquations;
import de.identlib.api.model.SubmodelFinder;
import de.identlib.api.model.VariableChangePolicy;
import de.identlib.api.oracle.FieldMembershipOracle;
import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.PolynomialContext;
import de.identlib.api.ring.RationalFunction;
import de.identlib.api.ring.RationalMatrix;
import de.identlib.api.statistic.Diagnostics;
import de.identlib.oracle.membership.GenericPointSampler;
import de.identlib.oracle.membership.RandomizedFieldMembershipOracle;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assesses global identifiability of functions of the parameters (and possibly states) of a model.
 * <p>
 * The pipeline is linear: input-output equations, Wronskian check, generator extraction, optional simplification,
 * randomized membership test. A failure in any stage aborts the whole call. The result is correct with at least the
 * requested probability.
 * <p>
 * Stage durations and advisory messages are written to the {@link Diagnostics} passed by the caller, if any.
 */
public class IdentifiabilityAssessor {

    static final String MULTI_EXPERIMENT_ADVISORY =
            "One of the Wronskians has corank greater than one, so the results will be valid only for "
            + "multi-experiment identifiability";

    private static final Logger LOGGER = LoggerFactory.getLogger(IdentifiabilityAssessor.class);

    private final FieldMembershipOracle oracle;
    private final GeneratorSetExtractor extractor;
    private final GeneratorSimplifier simplifier;
    private final @Nullable SubmodelFinder submodelFinder;

    public IdentifiabilityAssessor(GroebnerEngine engine, Random random) {
        this(new RandomizedFieldMembershipOracle(engine, new GenericPointSampler(random)),
             new GeneratorSetExtractor(),
             new GeneratorSimplifier(engine),
             null);
    }

    public IdentifiabilityAssessor(FieldMembershipOracle oracle,
                                   GeneratorSetExtractor extractor,
                                   GeneratorSimplifier simplifier,
                                   @Nullable SubmodelFinder submodelFinder) {
        this.oracle = oracle;
        this.extractor = extractor;
        this.simplifier = simplifier;
        this.submodelFinder = submodelFinder;
    }

    /**
     * Wires an assessor from the engine, random source and re-sample limit of the given configuration.
     */
    public static IdentifiabilityAssessor fromConfig(AssessmentConfig config) {
        return fromConfig(config, null);
    }

    public static IdentifiabilityAssessor fromConfig(AssessmentConfig config, @Nullable SubmodelFinder submodelFinder) {
        config.validate();
        GroebnerEngine engine = config.engine();
        LOGGER.debug("Creating assessor with engine '{}', seed {}", engine.getName(), config.getSeed());
        FieldMembershipOracle oracle = new RandomizedFieldMembershipOracle(engine,
                                                                           new GenericPointSampler(config.newRandom()),
                                                                           config.getMaxResamples());
        return new IdentifiabilityAssessor(oracle,
                                           new GeneratorSetExtractor(),
                                           new GeneratorSimplifier(engine),
                                           submodelFinder);
    }

    /**
     * Checks which candidates are identifiable from the coefficients of the given input-output equations.
     *
     * @param ioEquations
     *         the input-output equations
     * @param parameters
     *         the names of the parameter variables of the equations' ring, all other variables are treated as
     *         inputs, outputs and their derivatives
     * @param candidates
     *         rational functions in the equations' ring
     * @param probability
     *         the probability of the whole result being correct
     *
     * @return one answer per candidate
     */
    public List<Boolean> checkIdentifiability(InputOutputEquations ioEquations,
                                              Collection<String> parameters,
                                              List<RationalFunction> candidates,
                                              double probability) {
        ConfigurationException.checkProbability(probability);
        LOGGER.debug("Extracting coefficients");
        GeneratorBuckets buckets = extractor.extract(ioEquations, parameters);
        return oracle.checkFieldMembership(buckets.merged(), candidates, probability);
    }

    /**
     * Same as {@link #checkIdentifiability(InputOutputEquations, Collection, List, double)} for a single equation.
     */
    public List<Boolean> checkIdentifiability(PolynomialContext context,
                                              MultivariatePolynomial<Rational<BigInteger>> ioEquation,
                                              Collection<String> parameters,
                                              List<RationalFunction> candidates,
                                              double probability) {
        return checkIdentifiability(InputOutputEquations.of(context, Collections.singletonList(ioEquation)),
                                    parameters,
                                    candidates,
                                    probability);
    }

    /**
     * Checks the parameters themselves.
     *
     * @return one answer per parameter, in the given order
     */
    public List<Boolean> checkIdentifiability(InputOutputEquations ioEquations,
                                              List<String> parameters,
                                              double probability) {
        return checkIdentifiability(ioEquations,
                                    parameters,
                                    asFunctions(ioEquations.getContext(), parameters),
                                    probability);
    }

    /**
     * Checks which candidates are identifiable in the given model.
     *
     * @param model
     *         the model
     * @param candidates
     *         rational functions in the model's ring, may involve states
     * @param known
     *         rational functions in the model's ring whose values are assumed to be known
     * @param probability
     *         the probability of the whole result being correct
     * @param policy
     *         forwarded to the model when computing input-output equations
     *
     * @return one answer per candidate
     */
    public List<Boolean> checkIdentifiability(IdentifiableModel model,
                                              List<RationalFunction> candidates,
                                              List<RationalFunction> known,
                                              double probability,
                                              VariableChangePolicy policy) {
        return checkIdentifiability(model, candidates, known, probability, policy, new Diagnostics());
    }

    public List<Boolean> checkIdentifiability(IdentifiableModel model,
                                              List<RationalFunction> candidates,
                                              List<RationalFunction> known,
                                              double probability,
                                              VariableChangePolicy policy,
                                              Diagnostics diagnostics) {
        ConfigurationException.checkProbability(probability);
        PolynomialContext modelContext = model.getContext();
        boolean withStates = involveStates(modelContext, candidates, model.getParameters());

        LOGGER.info("Computing IO-equations");
        InputOutputEquations ioEquations =
                diagnostics.time(Diagnostics.IOEQ_TIME, () -> model.computeIOEquations(policy));
        LOGGER.info("Computed {} IO-equations in {} seconds",
                    ioEquations.size(),
                    diagnostics.getSeconds(Diagnostics.IOEQ_TIME));

        checkWronskians(model, ioEquations, diagnostics);
        reportSubmodels(model, diagnostics);

        PolynomialContext ioContext = ioEquations.getContext();
        List<RationalFunction> castCandidates = new ArrayList<>(candidates.size());
        for (RationalFunction candidate : candidates) {
            RationalFunction cast = ioContext.cast(candidate, modelContext);
            if (cast == null) {
                throw new ConfigurationException("Function " + modelContext.toString(candidate)
                                                 + " cannot be expressed in the ring of the IO-equations " + ioContext);
            }
            castCandidates.add(cast);
        }

        GeneratorBuckets buckets = extractor.extract(model, ioEquations, known, withStates);
        List<GeneratorGroup> noStates = buckets.getNoStates();
        if (withStates && !noStates.isEmpty()) {
            LOGGER.info("Simplifying generators");
            List<GeneratorGroup> simplified =
                    diagnostics.time(Diagnostics.SIMPLIFY_TIME, () -> simplifier.simplifyToGroups(noStates));
            LOGGER.info("Simplified {} groups to {} generators in {} seconds",
                        noStates.size(),
                        simplified.size(),
                        diagnostics.getSeconds(Diagnostics.SIMPLIFY_TIME));
            buckets = buckets.withNoStates(simplified);
        }
        List<GeneratorGroup> groups = buckets.merged();

        double halfP = 0.5 + probability / 2;
        LOGGER.info("Assessing global identifiability using the coefficients of the IO-equations");
        List<Boolean> result = diagnostics.time(Diagnostics.CHECK_TIME,
                                                () -> oracle.checkFieldMembership(groups, castCandidates, halfP));
        LOGGER.info("Computed in {} seconds", diagnostics.getSeconds(Diagnostics.CHECK_TIME));
        return result;
    }

    /**
     * Same as {@link #checkIdentifiability(IdentifiableModel, List, List, double, VariableChangePolicy, Diagnostics)}.
     */
    public List<Boolean> assessGlobalIdentifiability(IdentifiableModel model,
                                                     List<RationalFunction> candidates,
                                                     List<RationalFunction> known,
                                                     double probability,
                                                     VariableChangePolicy policy,
                                                     Diagnostics diagnostics) {
        return checkIdentifiability(model, candidates, known, probability, policy, diagnostics);
    }

    /**
     * Checks every parameter of the model.
     *
     * @return parameter name to identifiability, in the model's parameter order
     */
    public Map<String, Boolean> assessGlobalIdentifiability(IdentifiableModel model,
                                                            List<RationalFunction> known,
                                                            double probability,
                                                            VariableChangePolicy policy,
                                                            Diagnostics diagnostics) {
        List<String> parameters = model.getParameters();
        List<Boolean> answers = checkIdentifiability(model,
                                                     asFunctions(model.getContext(), parameters),
                                                     known,
                                                     probability,
                                                     policy,
                                                     diagnostics);
        Map<String, Boolean> result = new LinkedHashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            result.put(parameters.get(i), answers.get(i));
        }
        return result;
    }

    public Map<String, Boolean> assessGlobalIdentifiability(IdentifiableModel model, double probability) {
        return assessGlobalIdentifiability(model,
                                           Collections.emptyList(),
                                           probability,
                                           VariableChangePolicy.DEFAULT,
                                           new Diagnostics());
    }

    /**
     * Computes a simplified generating set of the field of functions identifiable from the coefficients of the given
     * input-output equations. Exact, but expensive.
     */
    public List<RationalFunction> extractIdentifiableFunctions(InputOutputEquations ioEquations,
                                                               Collection<String> parameters) {
        LOGGER.debug("Extracting coefficients");
        GeneratorBuckets buckets = extractor.extract(ioEquations, parameters);
        return simplifier.simplify(buckets.merged());
    }

    private void checkWronskians(IdentifiableModel model, InputOutputEquations ioEquations, Diagnostics diagnostics) {
        LOGGER.info("Computing Wronskians");
        List<RationalMatrix> wronskians =
                diagnostics.time(Diagnostics.WRONSKIAN_TIME, () -> model.computeWronskians(ioEquations));
        LOGGER.info("Computed in {} seconds", diagnostics.getSeconds(Diagnostics.WRONSKIAN_TIME));

        List<Integer> coranks = diagnostics.time(Diagnostics.RANK_TIME, () -> {
            List<Integer> values = new ArrayList<>(wronskians.size());
            for (RationalMatrix wronskian : wronskians) {
                values.add(wronskian.corank());
            }
            return values;
        });
        LOGGER.debug("Coranks of the Wronskians {}", coranks);
        LOGGER.info("Ranks of the Wronskians computed in {} seconds", diagnostics.getSeconds(Diagnostics.RANK_TIME));

        for (int corank : coranks) {
            if (corank > 1) {
                LOGGER.warn(MULTI_EXPERIMENT_ADVISORY);
                diagnostics.addAdvisory(MULTI_EXPERIMENT_ADVISORY);
                return;
            }
        }
    }

    private void reportSubmodels(IdentifiableModel model, Diagnostics diagnostics) {
        if (submodelFinder == null) {
            return;
        }
        List<IdentifiableModel> submodels = submodelFinder.findSubmodels(model);
        if (!submodels.isEmpty()) {
            String message = "The model has " + submodels.size()
                             + " non-trivial submodels, they may have better identifiability properties";
            LOGGER.info(message);
            diagnostics.addAdvisory(message);
        }
    }

    private static boolean involveStates(PolynomialContext context,
                                         List<RationalFunction> functions,
                                         Collection<String> parameters) {
        for (RationalFunction function : functions) {
            Set<String> occurring = context.occurringVariables(function.numerator());
            occurring.addAll(context.occurringVariables(function.denominator()));
            if (!parameters.containsAll(occurring)) {
                return true;
            }
        }
        return false;
    }

    private static List<RationalFunction> asFunctions(PolynomialContext context, List<String> names) {
        List<RationalFunction> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(RationalFunction.of(context.variable(name)));
        }
        return result;
    }
}
