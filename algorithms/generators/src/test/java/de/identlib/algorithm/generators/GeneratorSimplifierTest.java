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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import cc.redberry.rings.Rational;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.algebra.groebner.GroebnerEngines;
import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.PolynomialContext;
import de.identlib.api.ring.RationalFunction;
import org.testng.Assert;
import org.testng.annotations.Test;

public class GeneratorSimplifierTest {

    private final PolynomialContext ctx = PolynomialContext.of("a", "b");
    private final GeneratorSimplifier simplifier = new GeneratorSimplifier(GroebnerEngines.DEFAULT);

    private MultivariatePolynomial<Rational<BigInteger>> ab() {
        return ctx.variable("a").multiply(ctx.variable("b"));
    }

    @Test
    public void testSingleProduct() {
        List<RationalFunction> generators =
                simplifier.simplify(Collections.singletonList(GeneratorGroup.of(ctx.constant(1), ab())));

        Assert.assertEquals(generators.size(), 1);
        RationalFunction generator = generators.get(0);
        Assert.assertTrue(generator.denominator().isConstant());
        Assert.assertEquals(ctx.occurringVariables(generator.numerator()).size(), 2);
        Assert.assertEquals(generator.numerator().degree(), 2);
    }

    @Test
    public void testFixedPoint() {
        List<GeneratorGroup> input = Collections.singletonList(GeneratorGroup.of(ctx.constant(1), ab()));
        List<GeneratorGroup> once = simplifier.simplifyToGroups(input);
        List<GeneratorGroup> twice = simplifier.simplifyToGroups(once);
        Assert.assertEquals(twice.size(), once.size());
    }

    @Test
    public void testRedundantGeneratorsCollapse() {
        // Q(a, a^2, 2a) = Q(a)
        MultivariatePolynomial<Rational<BigInteger>> a = ctx.variable("a");
        MultivariatePolynomial<Rational<BigInteger>> twice = a.copy().multiply(ctx.constant(2));
        List<GeneratorGroup> groups = Arrays.asList(GeneratorGroup.of(ctx.constant(1), a.copy(), a.copy().multiply(a)),
                                                    GeneratorGroup.of(ctx.constant(1), twice));

        List<RationalFunction> generators = simplifier.simplify(groups);
        Assert.assertEquals(generators.size(), 1);
        Assert.assertEquals(generators.get(0).numerator().degree(), 1);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testEmptyInput() {
        simplifier.simplify(Collections.emptyList());
    }
}
