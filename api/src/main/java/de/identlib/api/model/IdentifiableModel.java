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
package de.identlib.api.model;

import java.util.List;

import de.identlib.api.ring.PolynomialContext;
import de.identlib.api.ring.RationalFunction;
import de.identlib.api.ring.RationalMatrix;

/**
 * A rational ODE model as seen by the identifiability assessment.
 * <p>
 * Deriving input-output equations and Wronskians requires differential elimination, which is the model's business:
 * the assessment only consumes the results.
 */
public interface IdentifiableModel {

    /**
     * The ring in which target functions and known quantities are written. Contains at least all parameters and all
     * states.
     */
    PolynomialContext getContext();

    /**
     * The parameter names, in the order used for reporting.
     */
    List<String> getParameters();

    List<String> getStates();

    /**
     * Computes the input-output equations. The returned ring must contain every parameter under the same name.
     */
    InputOutputEquations computeIOEquations(VariableChangePolicy policy);

    /**
     * Computes one Wronskian per input-output equation, evaluated so that its entries are rational numbers.
     */
    List<RationalMatrix> computeWronskians(InputOutputEquations ioEquations);

    /**
     * Computes generators involving states, in the ring of the given input-output equations. Each returned function
     * {@code f} says that {@code f} is a function of the input-output data.
     *
     * @throws UnsupportedOperationException
     *         if the model cannot produce such generators
     */
    default List<RationalFunction> computeStateGenerators(InputOutputEquations ioEquations) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " cannot derive state generators");
    }
}
