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
package de.identlib.algebra.groebner;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import cc.redberry.rings.Rational;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.algebra.BasisHandle;
import de.identlib.api.algebra.GroebnerEngine;
import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.ring.PolynomialContext;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class GroebnerEnginesTest {

    private final PolynomialContext ctx = PolynomialContext.of("x", "y");

    @DataProvider(name = "engines")
    public static Object[][] engines() {
        return new Object[][] {{GroebnerEngines.DEFAULT}, {GroebnerEngines.BUCHBERGER}};
    }

    @Test
    public void testForName() {
        Assert.assertSame(GroebnerEngines.forName("default"), GroebnerEngines.DEFAULT);
        Assert.assertSame(GroebnerEngines.forName(" Buchberger"), GroebnerEngines.BUCHBERGER);
        Assert.assertEquals(GroebnerEngines.BUCHBERGER.getName(), "buchberger");
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testUnknownEngine() {
        GroebnerEngines.forName("f5");
    }

    @Test(dataProvider = "engines")
    public void testIdealMembership(GroebnerEngine engine) {
        MultivariatePolynomial<Rational<BigInteger>> x = ctx.variable("x");
        MultivariatePolynomial<Rational<BigInteger>> y = ctx.variable("y");

        // (x - 1, y - x) contains y^2 - 1 but not y + 1
        BasisHandle<Rational<BigInteger>> basis =
                engine.basis(Arrays.asList(x.copy().subtract(ctx.constant(1)), y.copy().subtract(x)));

        Assert.assertEquals(basis.getEngine(), engine.getName());
        Assert.assertFalse(basis.isUnitIdeal());
        Assert.assertTrue(engine.reduce(y.copy().multiply(y).subtract(ctx.constant(1)), basis).isZero());
        Assert.assertFalse(engine.reduce(y.copy().add(ctx.constant(1)), basis).isZero());
    }

    @Test(dataProvider = "engines")
    public void testUnitIdeal(GroebnerEngine engine) {
        MultivariatePolynomial<Rational<BigInteger>> x = ctx.variable("x");
        BasisHandle<Rational<BigInteger>> basis =
                engine.basis(Arrays.asList(x.copy(), x.copy().subtract(ctx.constant(1))));

        Assert.assertTrue(basis.isUnitIdeal());
        Assert.assertTrue(engine.reduce(ctx.variable("y"), basis).isZero());
    }

    @Test(dataProvider = "engines")
    public void testZeroGeneratorsAreIgnored(GroebnerEngine engine) {
        List<MultivariatePolynomial<Rational<BigInteger>>> generators = Collections.singletonList(ctx.ring().getZero());
        BasisHandle<Rational<BigInteger>> basis = engine.basis(generators);

        Assert.assertEquals(basis.size(), 0);
        MultivariatePolynomial<Rational<BigInteger>> x = ctx.variable("x");
        Assert.assertEquals(engine.reduce(x, basis), x);
    }
}
