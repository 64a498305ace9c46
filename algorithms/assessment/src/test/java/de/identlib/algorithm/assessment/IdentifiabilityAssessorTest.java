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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

import cc.redberry.rings.Rational;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.algebra.groebner.GroebnerEngines;
import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.model.InputOutputEquations;
import de.identlib.api.model.VariableChangePolicy;
import de.identlib.api.ring.PolynomialContext;
import de.identlib.api.ring.RationalFunction;
import de.identlib.api.statistic.Diagnostics;
import de.identlib.oracle.membership.GenericPointSampler;
import de.identlib.oracle.membership.RandomizedFieldMembershipOracle;
import de.identlib.algorithm.generators.GeneratorSetExtractor;
import de.identlib.algorithm.generators.GeneratorSimplifier;
import org.testng.Assert;
import org.testng.annotations.Test;

public class IdentifiabilityAssessorTest {

    private static final PolynomialContext MODEL = ProductModel.MODEL;

    private static IdentifiabilityAssessor assessor(long seed) {
        return new IdentifiabilityAssessor(GroebnerEngines.DEFAULT, new Random(seed));
    }

    private static List<RationalFunction> aBAndProduct() {
        return Arrays.asList(RationalFunction.of(MODEL.variable("a")),
                             RationalFunction.of(MODEL.variable("b")),
                             RationalFunction.of(MODEL.variable("a").multiply(MODEL.variable("b"))));
    }

    @Test
    public void testOnlyProductIdentifiable() {
        ProductModel model = new ProductModel();
        Diagnostics diagnostics = new Diagnostics();

        List<Boolean> result = assessor(1).checkIdentifiability(model,
                                                                 aBAndProduct(),
                                                                 Collections.emptyList(),
                                                                 0.99,
                                                                 VariableChangePolicy.NO,
                                                                 diagnostics);

        Assert.assertEquals(result, Arrays.asList(false, false, true));
        Assert.assertEquals(model.getLastPolicy(), VariableChangePolicy.NO);
        Assert.assertTrue(diagnostics.getAdvisories().isEmpty());
        for (String stage : Arrays.asList(Diagnostics.IOEQ_TIME,
                                          Diagnostics.WRONSKIAN_TIME,
                                          Diagnostics.RANK_TIME,
                                          Diagnostics.CHECK_TIME)) {
            Assert.assertTrue(diagnostics.contains(stage), stage);
        }
        // no candidate involves states, so nothing is simplified
        Assert.assertFalse(diagnostics.contains(Diagnostics.SIMPLIFY_TIME));
    }

    @Test
    public void testKnownParameterMakesOtherIdentifiable() {
        List<RationalFunction> known = Collections.singletonList(RationalFunction.of(MODEL.variable("a")));
        List<RationalFunction> candidates = Collections.singletonList(RationalFunction.of(MODEL.variable("b")));

        List<Boolean> result = assessor(2).checkIdentifiability(new ProductModel(),
                                                                 candidates,
                                                                 known,
                                                                 0.99,
                                                                 VariableChangePolicy.DEFAULT);
        Assert.assertEquals(result, Collections.singletonList(true));
    }

    @Test
    public void testParameterMap() {
        Map<String, Boolean> result = assessor(3).assessGlobalIdentifiability(new ProductModel(), 0.99);

        Assert.assertEquals(result.size(), 2);
        Assert.assertEquals(result.keySet().iterator().next(), "a");
        Assert.assertFalse(result.get("a"));
        Assert.assertFalse(result.get("b"));
    }

    @Test
    public void testHighCorankIsAdvisoryOnly() {
        ProductModel model = new ProductModel(new long[][] {{1, 2, 3}, {2, 4, 6}});
        Diagnostics diagnostics = new Diagnostics();

        List<Boolean> result = assessor(4).assessGlobalIdentifiability(model,
                                                                        aBAndProduct(),
                                                                        Collections.emptyList(),
                                                                        0.99,
                                                                        VariableChangePolicy.DEFAULT,
                                                                        diagnostics);

        Assert.assertEquals(result, Arrays.asList(false, false, true));
        Assert.assertEquals(diagnostics.getAdvisories(),
                            Collections.singletonList(IdentifiabilityAssessor.MULTI_EXPERIMENT_ADVISORY));
    }

    @Test
    public void testSubmodelAdvisory() {
        IdentifiabilityAssessor assessor =
                new IdentifiabilityAssessor(new RandomizedFieldMembershipOracle(GroebnerEngines.DEFAULT,
                                                                                new GenericPointSampler(new Random(5))),
                                            new GeneratorSetExtractor(),
                                            new GeneratorSimplifier(GroebnerEngines.DEFAULT),
                                            model -> Collections.singletonList(model));
        Diagnostics diagnostics = new Diagnostics();

        assessor.assessGlobalIdentifiability(new ProductModel(),
                                             Collections.emptyList(),
                                             0.99,
                                             VariableChangePolicy.DEFAULT,
                                             diagnostics);
        Assert.assertEquals(diagnostics.getAdvisories().size(), 1);
    }

    @Test
    public void testSameSeedSameAnswers() {
        List<Boolean> first = assessor(11).checkIdentifiability(new ProductModel(),
                                                                 aBAndProduct(),
                                                                 Collections.emptyList(),
                                                                 0.9,
                                                                 VariableChangePolicy.DEFAULT);
        List<Boolean> second = assessor(11).checkIdentifiability(new ProductModel(),
                                                                  aBAndProduct(),
                                                                  Collections.emptyList(),
                                                                  0.9,
                                                                  VariableChangePolicy.DEFAULT);
        Assert.assertEquals(first, second);
    }

    @Test
    public void testParameterMapAgreesWithCandidateList() {
        ProductModel model = new ProductModel();
        List<RationalFunction> parameters = Arrays.asList(RationalFunction.of(MODEL.variable("a")),
                                                          RationalFunction.of(MODEL.variable("b")));

        List<Boolean> list = assessor(5).checkIdentifiability(model,
                                                               parameters,
                                                               Collections.emptyList(),
                                                               0.99,
                                                               VariableChangePolicy.DEFAULT);
        Map<String, Boolean> map = assessor(5).assessGlobalIdentifiability(model, 0.99);

        Assert.assertEquals(map.keySet(), new LinkedHashSet<>(model.getParameters()));
        for (int i = 0; i < model.getParameters().size(); i++) {
            String parameter = model.getParameters().get(i);
            Assert.assertEquals(map.get(parameter), list.get(i), parameter);
        }
    }

    @Test
    public void testStateCandidates() {
        DecayModel model = new DecayModel();
        PolynomialContext ctx = DecayModel.MODEL;
        List<RationalFunction> candidates =
                Arrays.asList(RationalFunction.of(ctx.variable("x")), RationalFunction.of(ctx.variable("a")));
        // c does not occur in the input-output ring and is dropped
        List<RationalFunction> known = Collections.singletonList(RationalFunction.of(ctx.variable("c")));
        Diagnostics diagnostics = new Diagnostics();

        List<Boolean> result = assessor(6).checkIdentifiability(model,
                                                                 candidates,
                                                                 known,
                                                                 0.99,
                                                                 VariableChangePolicy.DEFAULT,
                                                                 diagnostics);

        Assert.assertEquals(result, Arrays.asList(true, true));
        Assert.assertTrue(diagnostics.contains(Diagnostics.SIMPLIFY_TIME));
    }

    @Test
    public void testUnrepresentableCandidate() {
        List<RationalFunction> candidates =
                Collections.singletonList(RationalFunction.of(DecayModel.MODEL.variable("c")));
        Assert.assertThrows(ConfigurationException.class,
                            () -> assessor(7).checkIdentifiability(new DecayModel(),
                                                                   candidates,
                                                                   Collections.emptyList(),
                                                                   0.99,
                                                                   VariableChangePolicy.DEFAULT));
    }

    @Test
    public void testInvalidProbability() {
        Assert.assertThrows(ConfigurationException.class,
                            () -> assessor(8).assessGlobalIdentifiability(new ProductModel(), 1.0));
    }

    @Test
    public void testInputOutputEquations() {
        PolynomialContext io = ProductModel.IO;
        InputOutputEquations equations = new ProductModel().computeIOEquations(VariableChangePolicy.DEFAULT);
        List<String> parameters = Arrays.asList("a", "b");

        Assert.assertEquals(assessor(9).checkIdentifiability(equations, parameters, 0.99), Arrays.asList(false, false));

        MultivariatePolynomial<Rational<BigInteger>> product = io.variable("a").multiply(io.variable("b"));
        List<RationalFunction> candidates = Arrays.asList(RationalFunction.of(product),
                                                          RationalFunction.of(io.constant(1), product.copy()));
        Assert.assertEquals(assessor(10).checkIdentifiability(io,
                                                               equations.getPolynomials().get(0),
                                                               parameters,
                                                               candidates,
                                                               0.99),
                            Arrays.asList(true, true));
    }

    @Test
    public void testExtractIdentifiableFunctions() {
        InputOutputEquations equations = new ProductModel().computeIOEquations(VariableChangePolicy.DEFAULT);
        List<RationalFunction> functions =
                assessor(0).extractIdentifiableFunctions(equations, Arrays.asList("a", "b"));

        Assert.assertEquals(functions.size(), 1);
        Assert.assertEquals(functions.get(0).numerator().degree(), 2);
        Assert.assertEquals(ProductModel.IO.occurringVariables(functions.get(0).numerator()).size(), 2);
    }

    @Test
    public void testFromConfig() {
        AssessmentConfig config = AssessmentConfig.fromJson("{\"engine\": \"buchberger\", \"seed\": 17}");
        IdentifiabilityAssessor assessor = IdentifiabilityAssessor.fromConfig(config);

        List<Boolean> result = assessor.checkIdentifiability(new ProductModel(),
                                                             aBAndProduct(),
                                                             Collections.emptyList(),
                                                             config.getProbability(),
                                                             config.variableChangePolicy());
        Assert.assertEquals(result, Arrays.asList(false, false, true));
    }
}
