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
import java.util.List;
import java.util.Objects;

public class BloomEvent {

    private final int year;
    private final LocalDate onsetDate;
    private final LocalDate peakDate;
    private final LocalDate decayDate;
    private final long durationDays;
    private final double peakValue;
    private final double baseline;
    private final double amplitude;
    private final Double anomalyDays;
    private final double reliability;
    private final boolean censored;
    private final boolean onsetAtBoundary;
    private final List<CandidatePeak> supportingPeaks;
    private final BloomWeather weather;

    public BloomEvent(int year,
                      LocalDate onsetDate,
                      LocalDate peakDate,
                      LocalDate decayDate,
                      long durationDays,
                      double peakValue,
                      double baseline,
                      double amplitude,
                      Double anomalyDays,
                      double reliability,
                      boolean censored,
                      boolean onsetAtBoundary,
                      List<CandidatePeak> supportingPeaks,
                      BloomWeather weather) {
        Objects.requireNonNull(onsetDate, "onsetDate");
        Objects.requireNonNull(peakDate, "peakDate");
        if (peakDate.isBefore(onsetDate)) {
            throw new IllegalArgumentException("Peak " + peakDate + " precedes onset " + onsetDate);
        }
        if (onsetDate.plusDays(durationDays).isBefore(peakDate)) {
            throw new IllegalArgumentException("Peak " + peakDate + " lies after onset " + onsetDate
                    + " plus " + durationDays + " days");
        }
        if (amplitude < 0) {
            throw new IllegalArgumentException("Negative amplitude " + amplitude);
        }
        if (reliability < 0.0 || reliability > 1.0) {
            throw new IllegalArgumentException("Reliability " + reliability + " outside [0,1]");
        }
        this.year = year;
        this.onsetDate = onsetDate;
        this.peakDate = peakDate;
        this.decayDate = decayDate;
        this.durationDays = durationDays;
        this.peakValue = peakValue;
        this.baseline = baseline;
        this.amplitude = amplitude;
        this.anomalyDays = anomalyDays;
        this.reliability = reliability;
        this.censored = censored;
        this.onsetAtBoundary = onsetAtBoundary;
        this.supportingPeaks = supportingPeaks != null ? List.copyOf(supportingPeaks) : List.of();
        this.weather = weather;
    }

    public int getYear() {
        return year;
    }

    public LocalDate getOnsetDate() {
        return onsetDate;
    }

    public LocalDate getPeakDate() {
        return peakDate;
    }

    public LocalDate getDecayDate() {
        return decayDate;
    }

    public long getDurationDays() {
        return durationDays;
    }

    public double getPeakValue() {
        return peakValue;
    }

    public double getBaseline() {
        return baseline;
    }

    public double getAmplitude() {
        return amplitude;
    }

    /**
     * Days between this peak and the historical mean peak; {@code null} when no history exists.
     */
    public Double getAnomalyDays() {
        return anomalyDays;
    }

    public double getReliability() {
        return reliability;
    }

    public boolean isCensored() {
        return censored;
    }

    public boolean isOnsetAtBoundary() {
        return onsetAtBoundary;
    }

    public List<CandidatePeak> getSupportingPeaks() {
        return supportingPeaks;
    }

    public BloomWeather getWeather() {
        return weather;
    }

    public BloomEvent withWeather(BloomWeather weather) {
        return new BloomEvent(year, onsetDate, peakDate, decayDate, durationDays, peakValue, baseline,
                amplitude, anomalyDays, reliability, censored, onsetAtBoundary, supportingPeaks, weather);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BloomEvent other)) {
            return false;
        }
        return year == other.year
                && durationDays == other.durationDays
                && Double.compare(peakValue, other.peakValue) == 0
                && Double.compare(baseline, other.baseline) == 0
                && Double.compare(amplitude, other.amplitude) == 0
                && Double.compare(reliability, other.reliability) == 0
                && censored == other.censored
                && onsetAtBoundary == other.onsetAtBoundary
                && onsetDate.equals(other.onsetDate)
                && peakDate.equals(other.peakDate)
                && Objects.equals(decayDate, other.decayDate)
                && Objects.equals(anomalyDays, other.anomalyDays)
                && supportingPeaks.equals(other.supportingPeaks)
                && Objects.equals(weather, other.weather);
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, onsetDate, peakDate, decayDate, durationDays, peakValue, baseline,
                amplitude, anomalyDays, reliability, censored, onsetAtBoundary, supportingPeaks, weather);
    }

    @Override
    public String toString() {
        return "BloomEvent{year=" + year
                + ", onset=" + onsetDate
                + ", peak=" + peakDate
                + ", durationDays=" + durationDays
                + ", amplitude=" + amplitude
                + ", anomalyDays=" + anomalyDays
                + ", reliability=" + reliability + "}";
    }
}
