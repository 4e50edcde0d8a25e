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

/**
 * Temperature regime during the rise of a bloom.
 */
public enum WeatherImpact {
    EXTREME_COLD("Extreme cold, development likely delayed"),
    COLD("Low temperatures, slow growth"),
    OPTIMAL("Optimal conditions for growth"),
    MODERATE_HEAT("Moderate heat, watch water stress"),
    HEAT_STRESS("Thermal stress, irrigation critical"),
    EXTREME_HEAT("Extreme heat, high crop risk");

    private final String description;

    WeatherImpact(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static WeatherImpact classify(double meanTemperatureC) {
        if (meanTemperatureC < 10) {
            return EXTREME_COLD;
        }
        if (meanTemperatureC < 15) {
            return COLD;
        }
        if (meanTemperatureC <= 25) {
            return OPTIMAL;
        }
        if (meanTemperatureC <= 30) {
            return MODERATE_HEAT;
        }
        if (meanTemperatureC <= 35) {
            return HEAT_STRESS;
        }
        return EXTREME_HEAT;
    }
}
