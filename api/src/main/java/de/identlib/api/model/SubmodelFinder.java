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

/**
 * Searches a model for submodels (subsets of states closed under the dynamics that still see an output). Used for
 * informational messages only.
 */
@FunctionalInterface
public interface SubmodelFinder {

    /**
     * @return the non-trivial submodels, empty if there are none
     */
    List<IdentifiableModel> findSubmodels(IdentifiableModel model);
}
