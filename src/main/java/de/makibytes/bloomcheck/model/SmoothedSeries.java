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
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Smoothed values aligned 1:1 with the observation grid they were computed from.
 * Points whose source observation was {@code MISSING} stay missing and hold {@link Double#NaN}.
 */
public class SmoothedSeries {

    private final List<LocalDate> dates;
    private final double[] values;
    private final ObservationQuality[] sourceQualities;

    public SmoothedSeries(List<Observation> observations, double[] smoothedValues) {
        if (observations.size() != smoothedValues.length) {
            throw new IllegalArgumentException("Smoothed values (" + smoothedValues.length
                    + ") do not match observations (" + observations.size() + ")");
        }
        List<LocalDate> gridDates = new ArrayList<>(observations.size());
        this.values = new double[smoothedValues.length];
        this.sourceQualities = new ObservationQuality[smoothedValues.length];
        for (int i = 0; i < smoothedValues.length; i++) {
            Observation observation = observations.get(i);
            gridDates.add(observation.date());
            sourceQualities[i] = observation.quality();
            values[i] = observation.isUsable() ? smoothedValues[i] : Double.NaN;
        }
        this.dates = List.copyOf(gridDates);
    }

    public int size() {
        return values.length;
    }

    public LocalDate getDate(int index) {
        return dates.get(index);
    }

    public double getValue(int index) {
        return values[index];
    }

    public boolean isMissing(int index) {
        return sourceQualities[index] == ObservationQuality.MISSING;
    }

    public ObservationQuality getSourceQuality(int index) {
        return sourceQualities[index];
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    /**
     * Values of all non-missing points, in grid order.
     */
    public double[] usableValues() {
        return IntStream.range(0, values.length)
                .filter(i -> !isMissing(i))
                .mapToDouble(i -> values[i])
                .toArray();
    }

    public int firstUsableIndex() {
        for (int i = 0; i < values.length; i++) {
            if (!isMissing(i)) {
                return i;
            }
        }
        return -1;
    }

    public int lastUsableIndex() {
        for (int i = values.length - 1; i >= 0; i--) {
            if (!isMissing(i)) {
                return i;
            }
        }
        return -1;
    }
}
