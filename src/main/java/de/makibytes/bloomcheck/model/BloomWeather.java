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
 * Weather context of one bloom: the mean temperature between onset and peak and what it implies.
 */
public record BloomWeather(double meanTemperatureC,
                           int sampleCount,
                           WeatherImpact impact,
                           double temperatureFactor,
                           double yieldOutlookPercent,
                           YieldCategory yieldCategory) {

    public enum YieldCategory {
        VERY_LOW,
        LOW,
        MEDIUM,
        GOOD,
        EXCELLENT;

        public static YieldCategory of(double percent) {
            if (percent < 15) {
                return VERY_LOW;
            }
            if (percent < 30) {
                return LOW;
            }
            if (percent < 50) {
                return MEDIUM;
            }
            if (percent < 70) {
                return GOOD;
            }
            return EXCELLENT;
        }
    }
}
