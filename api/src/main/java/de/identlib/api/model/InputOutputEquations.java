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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import cc.redberry.rings.Rational;
import cc.redberry.rings.bigint.BigInteger;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.exception.ConfigurationException;
import de.identlib.api.ring.PolynomialContext;

/**
 * The input-output equations of a model: one differential polynomial per output, relating outputs, inputs and their
 * derivatives (all represented as plain ring variables) with coefficients in the parameters.
 */
public final class InputOutputEquations {

    private final PolynomialContext context;
    private final Map<String, MultivariatePolynomial<Rational<BigInteger>>> equations;

    public InputOutputEquations(PolynomialContext context,
                                Map<String, MultivariatePolynomial<Rational<BigInteger>>> equations) {
        if (equations.isEmpty()) {
            throw new ConfigurationException("At least one input-output equation is required");
        }
        for (Map.Entry<String, MultivariatePolynomial<Rational<BigInteger>>> e : equations.entrySet()) {
            if (!context.owns(e.getValue())) {
                throw new ConfigurationException("Equation for '" + e.getKey() + "' does not belong to " + context);
            }
        }
        this.context = context;
        this.equations = Collections.unmodifiableMap(new LinkedHashMap<>(equations));
    }

    public static InputOutputEquations of(PolynomialContext context,
                                          List<MultivariatePolynomial<Rational<BigInteger>>> equations) {
        Map<String, MultivariatePolynomial<Rational<BigInteger>>> keyed = new LinkedHashMap<>();
        for (int i = 0; i < equations.size(); i++) {
            keyed.put("y" + (i + 1), equations.get(i));
        }
        return new InputOutputEquations(context, keyed);
    }

    public PolynomialContext getContext() {
        return context;
    }

    public Map<String, MultivariatePolynomial<Rational<BigInteger>>> getEquations() {
        return equations;
    }

    public List<MultivariatePolynomial<Rational<BigInteger>>> getPolynomials() {
        return new ArrayList<>(equations.values());
    }

    public int size() {
        return equations.size();
    }
}
