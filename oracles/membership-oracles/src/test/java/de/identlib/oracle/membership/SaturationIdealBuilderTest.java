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

import java.util.Arrays;
import java.util.Collections;

import de.identlib.api.ring.EvaluationPoint;
import de.identlib.api.ring.GeneratorGroup;
import de.identlib.api.ring.PolynomialContext;
import de.identlib.oracle.membership.SaturationIdealBuilder.SaturationIdeal;
import org.testng.Assert;
import org.testng.annotations.Test;

public class SaturationIdealBuilderTest {

    private final PolynomialContext ctx = PolynomialContext.of("x", "y");

    @Test
    public void testOneSaturationVariablePerGroup() {
        GeneratorGroup first = GeneratorGroup.of(ctx.variable("x"), ctx.variable("x").multiply(ctx.variable("y")));
        GeneratorGroup second = GeneratorGroup.of(ctx.constant(1), ctx.variable("y"));

        SaturationIdeal ideal = SaturationIdealBuilder.build(Arrays.asList(first, second), EvaluationPoint.of(3, 5));

        Assert.assertEquals(ideal.getBaseVariables(), 2);
        Assert.assertEquals(ideal.getSaturationVariables(), 2);
        // pivot equations vanish identically and are skipped: 3x(y - 5), y - 5, x*s1 - 1, s2 - 1
        Assert.assertEquals(ideal.getGenerators().size(), 4);
        for (int i = 0; i < ideal.getGenerators().size(); i++) {
            Assert.assertEquals(ideal.getGenerators().get(i).nVariables, 4);
        }
        Assert.assertEquals(ideal.lift(ctx.variable("y")).nVariables, 4);
    }

    @Test
    public void testSaturationRelationUsesPivot() {
        GeneratorGroup group = GeneratorGroup.of(ctx.variable("y"));
        SaturationIdeal ideal =
                SaturationIdealBuilder.build(Collections.singletonList(group), EvaluationPoint.of(1, 2));

        Assert.assertEquals(ideal.getGenerators().size(), 1);
        // y * s - 1 has degree 2 in the extended ring
        Assert.assertEquals(ideal.getGenerators().get(0).degree(), 2);
    }
}
