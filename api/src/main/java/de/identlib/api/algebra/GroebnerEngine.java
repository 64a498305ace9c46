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

import java.util.List;

import cc.redberry.rings.poly.multivar.MultivariatePolynomial;

/**
 * Strategy for computing Gröbner bases and normal forms. The choice of engine only affects the running time, never the
 * result of a membership test: all engines must work with exact arithmetic.
 * <p>
 * Polynomials passed to one engine call must share the same ring (number of variables and coefficient ring).
 */
public interface GroebnerEngine {

    /**
     * Computes a Gröbner basis (graded reverse lexicographic order) of the ideal generated by the given polynomials.
     *
     * @param generators
     *         the ideal generators, zero polynomials are permitted and ignored
     * @param <E>
     *         coefficient type
     *
     * @return a handle on the computed basis
     */
    <E> BasisHandle<E> basis(List<MultivariatePolynomial<E>> generators);

    /**
     * Reduces a polynomial modulo a basis previously computed by {@link #basis(List)}. The polynomial lies in the ideal
     * if and only if the result is zero.
     */
    <E> MultivariatePolynomial<E> reduce(MultivariatePolynomial<E> poly, BasisHandle<E> basis);

    /**
     * The name under which this engine can be selected.
     */
    String getName();
}
