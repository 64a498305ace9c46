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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import cc.redberry.rings.poly.multivar.GroebnerBases;
import cc.redberry.rings.poly.multivar.MonomialOrder;
import cc.redberry.rings.poly.multivar.MultivariateDivision;
import cc.redberry.rings.poly.multivar.MultivariatePolynomial;
import de.identlib.api.algebra.BasisHandle;
import de.identlib.api.algebra.GroebnerEngine;
import de.identlib.api.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Gröbner engines shipped with IdentLib, all backed by the Rings library and all exact.
 * <ul>
 * <li>{@link #DEFAULT}: lets Rings pick its algorithm (a modular algorithm over the rationals, Buchberger with sugar
 * strategy over other fields). Usually the fastest choice.</li>
 * <li>{@link #BUCHBERGER}: plain Buchberger algorithm over the coefficient field, useful as a reference.</li>
 * </ul>
 */
public enum GroebnerEngines implements GroebnerEngine {

    DEFAULT("default") {
        @Override
        <E> List<MultivariatePolynomial<E>> compute(List<MultivariatePolynomial<E>> generators) {
            return GroebnerBases.GroebnerBasis(generators, MonomialOrder.GREVLEX);
        }
    },
    BUCHBERGER("buchberger") {
        @Override
        <E> List<MultivariatePolynomial<E>> compute(List<MultivariatePolynomial<E>> generators) {
            return GroebnerBases.BuchbergerGB(generators, MonomialOrder.GREVLEX);
        }
    };

    private static final Logger LOGGER = LoggerFactory.getLogger(GroebnerEngines.class);

    private final String engineName;

    GroebnerEngines(String name) {
        this.engineName = name;
    }

    abstract <E> List<MultivariatePolynomial<E>> compute(List<MultivariatePolynomial<E>> generators);

    @Override
    public <E> BasisHandle<E> basis(List<MultivariatePolynomial<E>> generators) {
        List<MultivariatePolynomial<E>> nonZero = new ArrayList<>(generators.size());
        for (MultivariatePolynomial<E> g : generators) {
            if (!g.isZero()) {
                nonZero.add(g);
            }
        }
        if (nonZero.isEmpty()) {
            return new BasisHandle<>(nonZero, engineName);
        }

        LOGGER.debug("Computing Groebner basis of {} polynomials in {} variables with engine '{}'",
                     nonZero.size(), nonZero.get(0).nVariables, engineName);
        List<MultivariatePolynomial<E>> basis = compute(nonZero);
        LOGGER.debug("Basis has {} elements", basis.size());
        return new BasisHandle<>(basis, engineName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <E> MultivariatePolynomial<E> reduce(MultivariatePolynomial<E> poly, BasisHandle<E> basis) {
        if (basis.size() == 0) {
            return poly.copy();
        }
        MultivariatePolynomial<E>[] dividers = basis.getPolynomials().toArray(new MultivariatePolynomial[0]);
        return MultivariateDivision.remainder(poly.copy(), dividers);
    }

    @Override
    public String getName() {
        return engineName;
    }

    /**
     * Looks up an engine by its (case-insensitive) name.
     *
     * @throws ConfigurationException
     *         if no engine has the given name
     */
    public static GroebnerEngine forName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (GroebnerEngines engine : values()) {
            if (engine.engineName.equals(normalized)) {
                return engine;
            }
        }
        throw new ConfigurationException("Unknown Groebner engine '" + name + "'");
    }
}
