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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Peak day-of-year per past year, as kept by the baseline store.
 */
public class HistoricalBaseline {

    private final Map<Integer, Integer> peakDayOfYearByYear;

    public HistoricalBaseline(Map<Integer, Integer> peakDayOfYearByYear) {
        this.peakDayOfYearByYear = peakDayOfYearByYear == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(peakDayOfYearByYear));
    }

    public static HistoricalBaseline empty() {
        return new HistoricalBaseline(Map.of());
    }

    /**
     * Derives a baseline from prior years' raw series: for every year with at least one usable
     * value, the day-of-year of its highest value. Ties keep the earlier date.
     */
    public static HistoricalBaseline fromSeries(Map<Integer, List<RawObservation>> seriesByYear) {
        Map<Integer, Integer> peaks = new TreeMap<>();
        if (seriesByYear != null) {
            seriesByYear.forEach((year, observations) -> {
                RawObservation best = null;
                for (RawObservation observation : observations) {
                    if (!observation.isUsable()) {
                        continue;
                    }
                    if (best == null
                            || observation.getValue() > best.getValue()
                            || (observation.getValue().equals(best.getValue())
                                && observation.getDate().isBefore(best.getDate()))) {
                        best = observation;
                    }
                }
                if (best != null) {
                    peaks.put(year, best.getDate().getDayOfYear());
                }
            });
        }
        return new HistoricalBaseline(peaks);
    }

    public Map<Integer, Integer> getPeakDayOfYearByYear() {
        return peakDayOfYearByYear;
    }

    public boolean isEmpty() {
        return peakDayOfYearByYear.isEmpty();
    }

    /**
     * Mean peak day-of-year over all years except {@code excludedYear}; empty when no such year exists.
     */
    public OptionalDouble meanPeakDayOfYearExcluding(int excludedYear) {
        return peakDayOfYearByYear.entrySet().stream()
                .filter(entry -> entry.getKey() != excludedYear)
                .mapToInt(Map.Entry::getValue)
                .average();
    }
}
