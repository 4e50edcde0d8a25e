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
package de.makibytes.bloomcheck.weather;

import java.util.List;

import org.springframework.stereotype.Component;

import de.makibytes.bloomcheck.model.BloomEvent;
import de.makibytes.bloomcheck.model.BloomWeather;
import de.makibytes.bloomcheck.model.BloomWeather.YieldCategory;
import de.makibytes.bloomcheck.model.WeatherImpact;
import de.makibytes.bloomcheck.model.WeatherSample;

@Component
public class WeatherImpactAssessor {

    // Mediterranean crops grow best in this band (°C)
    private static final double OPTIMAL_MIN_C = 18.0;
    private static final double OPTIMAL_MAX_C = 25.0;
    private static final double FULL_SEASON_DAYS = 120.0;
    private static final double UNKNOWN_DURATION_FACTOR = 0.5;

    /**
     * Attaches the weather between onset and peak to the event. Returns the event unchanged when
     * no sample falls into that window.
     */
    public BloomEvent enrich(BloomEvent event, List<WeatherSample> weather) {
        if (weather == null || weather.isEmpty()) {
            return event;
        }
        double sum = 0;
        int count = 0;
        for (WeatherSample sample : weather) {
            if (sample.date().isBefore(event.getOnsetDate()) || sample.date().isAfter(event.getPeakDate())) {
                continue;
            }
            if (!Double.isFinite(sample.meanTemperatureC())) {
                continue;
            }
            sum += sample.meanTemperatureC();
            count++;
        }
        if (count == 0) {
            return event;
        }
        double meanTemperature = sum / count;
        double temperatureFactor = temperatureFactor(meanTemperature);
        double yieldPercent = yieldOutlookPercent(event, temperatureFactor);
        BloomWeather context = new BloomWeather(meanTemperature, count, WeatherImpact.classify(meanTemperature),
                temperatureFactor, yieldPercent, YieldCategory.of(yieldPercent));
        return event.withWeather(context);
    }

    static double temperatureFactor(double meanTemperatureC) {
        if (meanTemperatureC >= OPTIMAL_MIN_C && meanTemperatureC <= OPTIMAL_MAX_C) {
            return 1.0;
        }
        if (meanTemperatureC < OPTIMAL_MIN_C) {
            return Math.max(0.0, 0.7 + 0.3 * (meanTemperatureC / OPTIMAL_MIN_C));
        }
        return Math.max(0.3, 1.0 - (meanTemperatureC - OPTIMAL_MAX_C) / 20.0);
    }

    static double yieldOutlookPercent(BloomEvent event, double temperatureFactor) {
        double durationFactor = event.getDurationDays() > 0
                ? Math.min(1.0, event.getDurationDays() / FULL_SEASON_DAYS)
                : UNKNOWN_DURATION_FACTOR;
        return event.getAmplitude() * 100.0 * temperatureFactor * durationFactor * event.getReliability();
    }
}
