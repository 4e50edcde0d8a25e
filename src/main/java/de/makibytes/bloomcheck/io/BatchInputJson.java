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
package de.makibytes.bloomcheck.io;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import de.makibytes.bloomcheck.model.ObservationQuality;

/**
 * Batch request file as handed over by the data collaborators.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchInputJson(@JsonProperty("series") List<SeriesJson> series) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeriesJson(
        @JsonProperty("region") String region,
        @JsonProperty("year") int year,
        @JsonProperty("observations") List<ObservationJson> observations,
        @JsonProperty("historical_peaks") Map<Integer, Integer> historicalPeaks,
        @JsonProperty("prior_series") Map<Integer, List<ObservationJson>> priorSeries,
        @JsonProperty("weather") List<WeatherJson> weather
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ObservationJson(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("value") Double value,
        @JsonProperty("quality") ObservationQuality quality
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WeatherJson(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("mean_temperature_c") double meanTemperatureC
    ) {
    }
}
