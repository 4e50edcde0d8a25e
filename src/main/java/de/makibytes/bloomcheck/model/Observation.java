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
package de.makibytes.bloomcheck.model;

import java.time.LocalDate;

/**
 * A grid-aligned observation. {@code MISSING} observations carry {@link Double#NaN} as value.
 */
public record Observation(LocalDate date, double value, ObservationQuality quality) {

    public static Observation missing(LocalDate date) {
        return new Observation(date, Double.NaN, ObservationQuality.MISSING);
    }

    public boolean isUsable() {
        return quality.isUsable();
    }
}
