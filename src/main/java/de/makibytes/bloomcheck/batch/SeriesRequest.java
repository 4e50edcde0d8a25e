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
package de.makibytes.bloomcheck.batch;

import java.util.List;

import de.makibytes.bloomcheck.model.HistoricalBaseline;
import de.makibytes.bloomcheck.model.RawObservation;
import de.makibytes.bloomcheck.model.WeatherSample;

/**
 * One independent unit of batch work: the season of one region.
 */
public record SeriesRequest(
    String region,
    int year,
    List<RawObservation> observations,
    HistoricalBaseline history,
    List<WeatherSample> weather
) {
    public SeriesRequest {
        observations = observations != null ? List.copyOf(observations) : List.of();
        weather = weather != null ? List.copyOf(weather) : List.of();
    }

    public SeriesRequest(String region, int year, List<RawObservation> observations) {
        this(region, year, observations, null, null);
    }
}
