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
import java.util.List;

import cc.redberry.rings.Rational;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.model.IdentifiableModel;
import de.identlib.api.model.InputOutputEquations;
import de.identlib.api.model.VariableChangePolicy;
import de.identlib.api.ring.PolynomialContext;
import de.identlib.api.ring.RationalFunction;
import de.identlib.api.ring.RationalMatrix;

/**
 * {@code x' = -a*x, y = x}, with input-output equation {@code y' + a*y = 0}. The state is observed directly. The ring
 * of the model carries an additional parameter {@code c} the dynamics do not use, and which the input-output ring
 * lacks.
 */
class DecayModel implements IdentifiableModel {

    static final PolynomialContext MODEL = PolynomialContext.of("a", "c", "x");
    static final PolynomialContext IO = PolynomialContext.of("a", "x", "y0", "y1");

    @Override
    public PolynomialContext getContext() {
        return MODEL;
    }

    @Override
    public List<String> getParameters() {
        return Arrays.asList("a", "c");
    }

    @Override
    public List<String> getStates() {
        return Collections.singletonList("x");
    }

    @Override
    public InputOutputEquations computeIOEquations(VariableChangePolicy policy) {
        MultivariatePolynomial<Rational<BigInteger>> equation =
                IO.variable("y1").add(IO.variable("a").multiply(IO.variable("y0")));
        return InputOutputEquations.of(IO, Collections.singletonList(equation));
    }

    @Override
    public List<RationalMatrix> computeWronskians(InputOutputEquations ioEquations) {
        return Collections.singletonList(RationalMatrix.of(new long[][] {{2, -6}}));
    }

    @Override
    public List<RationalFunction> computeStateGenerators(InputOutputEquations ioEquations) {
        // y = x
        return Collections.singletonList(RationalFunction.of(ioEquations.getContext().variable("x")));
    }
}
