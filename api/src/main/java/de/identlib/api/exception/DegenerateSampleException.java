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
package de.identlib.api.exception;

// Thrown when every sampled evaluation point annihilated at least one pivot polynomial.
public class DegenerateSampleException extends RuntimeException {

    private final int attempts;

    public DegenerateSampleException(int attempts) {
        super("Every one of " + attempts + " sampled points is a zero of some pivot polynomial");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
