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
import java.util.Objects;

/**
 * One observation as delivered by the upstream source, before it is put on the analysis grid.
 * Dates may be irregular and values may be absent.
 */
public class RawObservation {

    private final LocalDate date;
    private final Double value;
    private final ObservationQuality quality;

    public RawObservation(LocalDate date, Double value, ObservationQuality quality) {
        this.date = Objects.requireNonNull(date, "date");
        this.value = value;
        this.quality = quality == null ? ObservationQuality.GOOD : quality;
    }

    public static RawObservation good(LocalDate date, double value) {
        return new RawObservation(date, value, ObservationQuality.GOOD);
    }

    public static RawObservation missing(LocalDate date) {
        return new RawObservation(date, null, ObservationQuality.MISSING);
    }

    public LocalDate getDate() {
        return date;
    }

    public Double getValue() {
        return value;
    }

    public ObservationQuality getQuality() {
        return quality;
    }

    public boolean isUsable() {
        return quality.isUsable() && value != null && Double.isFinite(value);
    }
}
