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
package de.identlib.api.ring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import cc.redberry.rings.Rational;
import cc.redberry.rings.Rings;
import cc.redberry.rings.bigint.BigInteger;

/**
 * An assignment of integer values to every variable of a polynomial ring, shared by all generator groups and all
 * candidates of one membership query.
 */
public final class EvaluationPoint {

    private final List<BigInteger> coordinates;

    public EvaluationPoint(List<BigInteger> coordinates) {
        this.coordinates = Collections.unmodifiableList(new ArrayList<>(coordinates));
    }

    public static EvaluationPoint of(long... coordinates) {
        List<BigInteger> values = new ArrayList<>(coordinates.length);
        for (long c : coordinates) {
            values.add(BigInteger.valueOf(c));
        }
        return new EvaluationPoint(values);
    }

    public int dimension() {
        return coordinates.size();
    }

    public BigInteger get(int variable) {
        return coordinates.get(variable);
    }

    public Rational<BigInteger> rational(int variable) {
        return new Rational<>(Rings.Z, coordinates.get(variable));
    }

    public List<BigInteger> coordinates() {
        return coordinates;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationPoint)) {
            return false;
        }
        return coordinates.equals(((EvaluationPoint) o).coordinates);
    }

    @Override
    public int hashCode() {
        return coordinates.hashCode();
    }

    @Override
    public String toString() {
        return coordinates.toString();
    }
}
