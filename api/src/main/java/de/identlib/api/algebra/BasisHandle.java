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
package de.identlib.api.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import cc.redberry.rings.poly.multivar.MultivariatePolynomial;

/**
 * Result of {@link GroebnerEngine#basis(List)}: the basis polynomials, in the order produced by the engine.
 *
 * @param <E>
 *         coefficient type
 */
public final class BasisHandle<E> {

    private final List<MultivariatePolynomial<E>> polynomials;
    private final String engine;

    public BasisHandle(List<MultivariatePolynomial<E>> polynomials, String engine) {
        this.polynomials = Collections.unmodifiableList(new ArrayList<>(polynomials));
        this.engine = engine;
    }

    public List<MultivariatePolynomial<E>> getPolynomials() {
        return polynomials;
    }

    public String getEngine() {
        return engine;
    }

    public int size() {
        return polynomials.size();
    }

    /**
     * Whether the basis describes the unit ideal, i.e. the constraints are inconsistent.
     */
    public boolean isUnitIdeal() {
        for (MultivariatePolynomial<E> poly : polynomials) {
            if (poly.isConstant() && !poly.isZero()) {
                return true;
            }
        }
        return false;
    }
}
