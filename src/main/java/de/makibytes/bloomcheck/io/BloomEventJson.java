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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import de.makibytes.bloomcheck.model.BloomEvent;
import de.makibytes.bloomcheck.model.BloomWeather;
import de.makibytes.bloomcheck.model.CandidatePeak;

/**
 * Serialized form of a {@link BloomEvent}. Field names and units (days, normalized index units,
 * day-of-year) are kept stable so results stay comparable with earlier seasons.
 */
@JsonPropertyOrder({"year", "onset_date", "peak_date", "decay_date", "duration_days", "peak_value", "baseline",
        "amplitude", "anomaly_days", "reliability", "censored", "onset_at_boundary", "supporting_peaks", "weather"})
public record BloomEventJson(
    @JsonProperty("year") int year,
    @JsonProperty("onset_date") LocalDate onsetDate,
    @JsonProperty("peak_date") LocalDate peakDate,
    @JsonProperty("decay_date") LocalDate decayDate,
    @JsonProperty("duration_days") long durationDays,
    @JsonProperty("peak_value") double peakValue,
    @JsonProperty("baseline") double baseline,
    @JsonProperty("amplitude") double amplitude,
    @JsonProperty("anomaly_days") Double anomalyDays,
    @JsonProperty("reliability") double reliability,
    @JsonProperty("censored") boolean censored,
    @JsonProperty("onset_at_boundary") boolean onsetAtBoundary,
    @JsonProperty("supporting_peaks") List<PeakJson> supportingPeaks,
    @JsonProperty("weather") WeatherJson weather
) {

    public static BloomEventJson from(BloomEvent event) {
        return new BloomEventJson(
                event.getYear(),
                event.getOnsetDate(),
                event.getPeakDate(),
                event.getDecayDate(),
                event.getDurationDays(),
                event.getPeakValue(),
                event.getBaseline(),
                event.getAmplitude(),
                event.getAnomalyDays(),
                event.getReliability(),
                event.isCensored(),
                event.isOnsetAtBoundary(),
                event.getSupportingPeaks().stream().map(PeakJson::from).toList(),
                event.getWeather() == null ? null : WeatherJson.from(event.getWeather()));
    }

    public record PeakJson(
        @JsonProperty("index") int index,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("value") double value,
        @JsonProperty("prominence") double prominence
    ) {
        static PeakJson from(CandidatePeak peak) {
            return new PeakJson(peak.index(), peak.date(), peak.value(), peak.prominence());
        }
    }

    public record WeatherJson(
        @JsonProperty("mean_temperature_c") double meanTemperatureC,
        @JsonProperty("sample_count") int sampleCount,
        @JsonProperty("impact") String impact,
        @JsonProperty("impact_description") String impactDescription,
        @JsonProperty("temperature_factor") double temperatureFactor,
        @JsonProperty("yield_outlook_percent") double yieldOutlookPercent,
        @JsonProperty("yield_category") String yieldCategory
    ) {
        static WeatherJson from(BloomWeather weather) {
            return new WeatherJson(weather.meanTemperatureC(), weather.sampleCount(), weather.impact().name(),
                    weather.impact().getDescription(), weather.temperatureFactor(), weather.yieldOutlookPercent(),
                    weather.yieldCategory().name());
        }
    }
}
