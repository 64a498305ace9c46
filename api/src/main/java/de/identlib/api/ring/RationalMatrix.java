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
import java.util.List;

import cc.redberry.rings.Rational;
import cc.redberry.rings.Rings;
import cc.redberry.rings.bigint.BigInteger;

/**
 * A dense matrix over the rationals. Models hand out their Wronskians (evaluated at a generic point) in this form;
 * only the rank is of interest.
 */
public final class RationalMatrix {

    private final int rows;
    private final int columns;
    private final List<Rational<BigInteger>> entries;

    public RationalMatrix(int rows, int columns, List<Rational<BigInteger>> entries) {
        if (rows < 0 || columns < 0 || entries.size() != rows * columns) {
            throw new IllegalArgumentException(
                    "Expected " + rows + "x" + columns + " entries, got " + entries.size());
        }
        this.rows = rows;
        this.columns = columns;
        this.entries = new ArrayList<>(entries);
    }

    public static RationalMatrix of(long[][] values) {
        int rows = values.length;
        int columns = rows == 0 ? 0 : values[0].length;
        List<Rational<BigInteger>> entries = new ArrayList<>(rows * columns);
        for (long[] row : values) {
            if (row.length != columns) {
                throw new IllegalArgumentException("Ragged matrix");
            }
            for (long v : row) {
                entries.add(new Rational<>(Rings.Z, BigInteger.valueOf(v)));
            }
        }
        return new RationalMatrix(rows, columns, entries);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public Rational<BigInteger> get(int row, int column) {
        return entries.get(row * columns + column);
    }

    /**
     * Computes the rank by fraction-based Gaussian elimination.
     */
    public int rank() {
        List<Rational<BigInteger>> m = new ArrayList<>(entries);
        int rank = 0;
        for (int col = 0; col < columns && rank < rows; col++) {
            int pivotRow = -1;
            for (int r = rank; r < rows; r++) {
                if (!m.get(r * columns + col).isZero()) {
                    pivotRow = r;
                    break;
                }
            }
            if (pivotRow < 0) {
                continue;
            }
            swapRows(m, pivotRow, rank);

            Rational<BigInteger> pivot = m.get(rank * columns + col);
            for (int r = rank + 1; r < rows; r++) {
                Rational<BigInteger> entry = m.get(r * columns + col);
                if (entry.isZero()) {
                    continue;
                }
                Rational<BigInteger> factor = entry.divide(pivot);
                for (int c = col; c < columns; c++) {
                    Rational<BigInteger> reduced = factor.multiply(m.get(rank * columns + c));
                    m.set(r * columns + c, m.get(r * columns + c).subtract(reduced));
                }
            }
            rank++;
        }
        return rank;
    }

    /**
     * Number of columns minus the rank. A Wronskian of corank one is what a single experiment can produce.
     */
    public int corank() {
        return columns - rank();
    }

    private void swapRows(List<Rational<BigInteger>> m, int a, int b) {
        if (a == b) {
            return;
        }
        for (int c = 0; c < columns; c++) {
            Rational<BigInteger> tmp = m.get(a * columns + c);
            m.set(a * columns + c, m.get(b * columns + c));
            m.set(b * columns + c, tmp);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < rows; r++) {
            sb.append(entries.subList(r * columns, (r + 1) * columns)).append('\n');
        }
        return sb.toString();
    }
}
