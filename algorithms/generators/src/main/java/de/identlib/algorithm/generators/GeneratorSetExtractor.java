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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import cc.redberry.rings.Rational;
import cc.redberry.rings.Rings;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.Monomial;
import cc.redberry.rings.poly.multivar.MonomialOrder;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.model.IdentifiableModel;
import de.identlib.api.model.InputOutputEquations;
import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.PolynomialContext;
import de.identlib.api.ring.RationalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives generators of the field of identifiable functions.
 * <p>
 * Every input-output equation, read as a polynomial in the non-parameter variables (outputs, inputs and their
 * derivatives) with coefficients in the parameters, contributes the list of its coefficients as one generator group:
 * the equation is determined by the data up to a common factor, so the ratios of its coefficients are identifiable.
 * Optionally, generators involving states and externally known quantities are added.
 */
public class GeneratorSetExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneratorSetExtractor.class);

    /**
     * Extracts only the coefficient groups of the input-output equations.
     */
    public GeneratorBuckets extract(InputOutputEquations ioEquations, Collection<String> parameters) {
        List<GeneratorGroup> groups = new ArrayList<>(ioEquations.size());
        for (MultivariatePolynomial<Rational<BigInteger>> equation : ioEquations.getPolynomials()) {
            groups.add(new GeneratorGroup(extractCoefficients(ioEquations.getContext(), equation, parameters)));
        }
        if (LOGGER.isDebugEnabled()) {
            for (GeneratorGroup group : groups) {
                int[] degrees = group.members().stream().mapToInt(p -> p.degree()).sorted().toArray();
                LOGGER.debug("Coefficient degrees {}", Arrays.toString(degrees));
            }
        }
        return new GeneratorBuckets(ioEquations.getContext(), Collections.emptyList(), groups);
    }

    /**
     * Extracts the coefficient groups and adds state generators and known quantities.
     *
     * @param model
     *         the model, supplies parameters, states, the ring of the known quantities and the state generators
     * @param ioEquations
     *         the model's input-output equations
     * @param known
     *         functions (in the model's ring) whose values are assumed to be known
     * @param withStates
     *         whether to ask the model for generators involving states
     */
    public GeneratorBuckets extract(IdentifiableModel model,
                                    InputOutputEquations ioEquations,
                                    List<RationalFunction> known,
                                    boolean withStates) {
        PolynomialContext context = ioEquations.getContext();
        GeneratorBuckets coefficients = extract(ioEquations, model.getParameters());
        List<GeneratorGroup> stateGroups = new ArrayList<>();
        List<GeneratorGroup> parameterGroups = new ArrayList<>(coefficients.getNoStates());

        if (withStates) {
            List<RationalFunction> stateGenerators = model.computeStateGenerators(ioEquations);
            LOGGER.debug("Model provided {} generators involving states", stateGenerators.size());
            for (RationalFunction generator : stateGenerators) {
                stateGroups.add(GeneratorGroup.of(generator));
            }
        }

        for (RationalFunction quantity : known) {
            RationalFunction cast = context.cast(quantity, model.getContext());
            if (cast == null) {
                LOGGER.warn("Known quantity {} cannot be expressed in the ring of the input-output equations {}, "
                            + "it will be ignored", model.getContext().toString(quantity), context);
                continue;
            }
            GeneratorGroup group = GeneratorGroup.of(cast);
            if (involvesOnly(context, cast, model.getParameters())) {
                parameterGroups.add(group);
            } else {
                stateGroups.add(group);
            }
        }

        return new GeneratorBuckets(context, stateGroups, parameterGroups);
    }

    /**
     * Collects the coefficients of a polynomial viewed as a polynomial in the non-parameter variables.
     *
     * @return the coefficients, ordered by first occurrence of the corresponding monomial
     */
    public static List<MultivariatePolynomial<Rational<BigInteger>>> extractCoefficients(
            PolynomialContext context,
            MultivariatePolynomial<Rational<BigInteger>> poly,
            Collection<String> parameters) {
        boolean[] isParameter = new boolean[context.nVariables()];
        for (String parameter : parameters) {
            if (context.contains(parameter)) {
                isParameter[context.indexOf(parameter)] = true;
            }
        }

        Map<List<Integer>, MultivariatePolynomial<Rational<BigInteger>>> coefficients = new LinkedHashMap<>();
        for (Monomial<Rational<BigInteger>> term : poly) {
            List<Integer> key = new ArrayList<>();
            int[] parameterExponents = term.exponents.clone();
            for (int i = 0; i < parameterExponents.length; i++) {
                if (!isParameter[i]) {
                    key.add(parameterExponents[i]);
                    parameterExponents[i] = 0;
                }
            }
            coefficients.computeIfAbsent(key, k -> MultivariatePolynomial.zero(context.nVariables(),
                                                                               Rings.Q,
                                                                               MonomialOrder.GREVLEX))
                        .add(new Monomial<>(parameterExponents, term.coefficient));
        }
        return new ArrayList<>(coefficients.values());
    }

    private static boolean involvesOnly(PolynomialContext context,
                                        RationalFunction function,
                                        Collection<String> parameters) {
        Set<String> occurring = context.occurringVariables(function.numerator());
        occurring.addAll(context.occurringVariables(function.denominator()));
        return parameters.containsAll(occurring);
    }
}
