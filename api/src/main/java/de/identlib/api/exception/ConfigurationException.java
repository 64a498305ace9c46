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

/**
 * Thrown when a computation is requested with arguments that cannot describe a valid query: a probability outside of
 * {@code (0, 1)}, an empty generator family, an empty generator group, polynomials from different rings, an unknown
 * Gröbner engine or variable name, or an unreadable configuration.
 * <p>
 * Always raised before any sampling or ideal construction takes place.
 */
public class ConfigurationException extends RuntimeException {

    /**
     * Constructor.
     *
     * @see IllegalArgumentException#IllegalArgumentException(String)
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @see IllegalArgumentException#IllegalArgumentException(String, Throwable)
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static double checkProbability(double probability) {
        if (!(probability > 0 && probability < 1)) {
            throw new ConfigurationException("Probability of correctness must lie in (0, 1), got " + probability);
        }
        return probability;
    }
}
