/*
 * Copyright 2026 Maki Bytes
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
package de.makibytes.bloomcheck.phenology;

/**
 * Thrown when too few usable observations remain to analyze a season.
 */
public class InsufficientDataException extends PhenologyException {

    private final int usablePoints;
    private final int requiredPoints;

    public InsufficientDataException(int usablePoints, int requiredPoints) {
        super("Only " + usablePoints + " usable observations, at least " + requiredPoints + " required");
        this.usablePoints = usablePoints;
        this.requiredPoints = requiredPoints;
    }

    public int getUsablePoints() {
        return usablePoints;
    }

    public int getRequiredPoints() {
        return requiredPoints;
    }
}
