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
package de.makibytes.bloomcheck.phenology;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.OptionalDouble;

import org.springframework.stereotype.Component;

import de.makibytes.bloomcheck.config.PhenologyConfig;
import de.makibytes.bloomcheck.model.BloomEvent;
import de.makibytes.bloomcheck.model.CandidatePeak;
import de.makibytes.bloomcheck.model.HistoricalBaseline;
import de.makibytes.bloomcheck.model.ObservationQuality;
import de.makibytes.bloomcheck.model.PeakDetection;
import de.makibytes.bloomcheck.model.SmoothedSeries;

/**
 * Turns one accepted peak into a {@link BloomEvent}. Weak or truncated signals still produce an
 * event; they only lower its reliability.
 */
@Component
public class MetricExtractor {

    public BloomEvent extract(SmoothedSeries series,
                              CandidatePeak peak,
                              PeakDetection detection,
                              HistoricalBaseline history,
                              int year,
                              PhenologyConfig config) {
        List<CandidatePeak> supporting = detection.allCandidates().stream()
                .filter(candidate -> candidate.index() != peak.index())
                .filter(candidate -> Math.abs(candidate.index() - peak.index()) < config.getMinSeparation())
                .toList();
        return extract(series, peak, detection.baseline(), supporting, history, year, config);
    }

    public BloomEvent extract(SmoothedSeries series,
                              CandidatePeak peak,
                              double baseline,
                              List<CandidatePeak> supportingPeaks,
                              HistoricalBaseline history,
                              int year,
                              PhenologyConfig config) {
        int peakIndex = peak.index();
        if (peakIndex < 0 || peakIndex >= series.size()) {
            throw new IllegalArgumentException("Peak index " + peakIndex + " outside series of " + series.size() + " points");
        }
        if (series.isMissing(peakIndex)) {
            throw new IllegalArgumentException("Peak index " + peakIndex + " points at a missing observation");
        }
        double peakValue = series.getValue(peakIndex);

        Boundary onset = findOnset(series, peakIndex, peakValue, baseline, config);
        Boundary decay = findDecay(series, peakIndex, peakValue, baseline, config);

        LocalDate onsetDate = series.getDate(onset.index());
        LocalDate peakDate = series.getDate(peakIndex);
        LocalDate decayDate = series.getDate(decay.index());
        long durationDays = ChronoUnit.DAYS.between(onsetDate, decayDate);
        double amplitude = Math.max(0.0, peakValue - baseline);

        double reliability = reliability(series, amplitude, onset, decay, config);
        Double anomalyDays = anomalyDays(peakDate, history, year);

        return new BloomEvent(year, onsetDate, peakDate, decayDate, durationDays, peakValue, baseline,
                amplitude, anomalyDays, reliability, decay.atBoundary(), onset.atBoundary(), supportingPeaks, null);
    }

    /**
     * Walks back from the peak until the curve is back near the baseline or starts rising again
     * (a valley towards an earlier peak). Reaching the first usable point, or a gap longer than the
     * fill threshold, marks a boundary hit: the rise before it was never observed.
     */
    private Boundary findOnset(SmoothedSeries series, int peakIndex, double peakValue, double baseline, PhenologyConfig config) {
        double nearBaseline = baseline + config.getOnsetEpsilon();
        int lastVisited = peakIndex;
        double previousValue = peakValue;
        int missingRun = 0;
        for (int j = peakIndex - 1; j >= 0; j--) {
            if (series.isMissing(j)) {
                if (++missingRun > config.getGapFillThreshold()) {
                    return new Boundary(lastVisited, true);
                }
                continue;
            }
            missingRun = 0;
            double value = series.getValue(j);
            if (value <= nearBaseline) {
                return new Boundary(j, false);
            }
            if (value > previousValue + config.getSlopeTolerance()) {
                return new Boundary(lastVisited, false);
            }
            previousValue = value;
            lastVisited = j;
        }
        return new Boundary(lastVisited, true);
    }

    /**
     * Walks forward from the peak to the first point below the half-decay level. A series that
     * ends first, or breaks off in an unbridged gap, is right-censored at the last point seen.
     */
    private Boundary findDecay(SmoothedSeries series, int peakIndex, double peakValue, double baseline, PhenologyConfig config) {
        double decayLevel = baseline + config.getHalfDecayFraction() * (peakValue - baseline);
        int lastVisited = peakIndex;
        int missingRun = 0;
        for (int k = peakIndex + 1; k < series.size(); k++) {
            if (series.isMissing(k)) {
                if (++missingRun > config.getGapFillThreshold()) {
                    return new Boundary(lastVisited, true);
                }
                continue;
            }
            missingRun = 0;
            if (series.getValue(k) < decayLevel) {
                return new Boundary(k, false);
            }
            lastVisited = k;
        }
        return new Boundary(lastVisited, true);
    }

    double reliability(SmoothedSeries series, double amplitude, Boundary onset, Boundary decay, PhenologyConfig config) {
        double[] usable = series.usableValues();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : usable) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double range = max - min;
        double contrast = range > 0 ? Math.min(1.0, amplitude / range) : 0.0;
        double amplitudeScore = Math.min(1.0, amplitude / config.getFullScaleAmplitude());
        double weightSum = config.getContrastWeight() + config.getAmplitudeWeight();
        double signal = (config.getContrastWeight() * contrast + config.getAmplitudeWeight() * amplitudeScore) / weightSum;

        int boundaryHits = (onset.atBoundary() ? 1 : 0) + (decay.atBoundary() ? 1 : 0);
        double completeness = Math.max(0.0, 1.0 - config.getCensorPenalty() * boundaryHits);

        int total = 0;
        int notMeasured = 0;
        for (int i = onset.index(); i <= decay.index(); i++) {
            total++;
            if (series.getSourceQuality(i) != ObservationQuality.GOOD) {
                notMeasured++;
            }
        }
        double coverage = Math.max(0.0, 1.0 - config.getGapPenalty() * notMeasured / total);

        return Math.max(0.0, Math.min(1.0, signal * completeness * coverage));
    }

    static Double anomalyDays(LocalDate peakDate, HistoricalBaseline history, int year) {
        if (history == null) {
            return null;
        }
        OptionalDouble mean = history.meanPeakDayOfYearExcluding(year);
        if (mean.isEmpty()) {
            return null;
        }
        return peakDate.getDayOfYear() - mean.getAsDouble();
    }

    record Boundary(int index, boolean atBoundary) {
    }
}
