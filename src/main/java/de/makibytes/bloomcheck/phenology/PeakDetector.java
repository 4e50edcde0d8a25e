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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.bloomcheck.config.PhenologyConfig;
import de.makibytes.bloomcheck.model.CandidatePeak;
import de.makibytes.bloomcheck.model.PeakDetection;
import de.makibytes.bloomcheck.model.SmoothedSeries;

/**
 * Finds bloom peaks above a low-percentile baseline.
 * <p>
 * Local maxima whose height above the baseline reaches the minimum prominence are visited from the
 * highest down and accepted greedily when no stronger accepted peak lies within the minimum
 * separation. Equal heights are visited in date order. Losers are reported as suppressed so the
 * extractor can list them as supporting peaks.
 */
@Component
public class PeakDetector {
    private static final Logger logger = LoggerFactory.getLogger(PeakDetector.class);

    private static final Comparator<CandidatePeak> STRONGEST_FIRST = Comparator
            .comparingDouble(CandidatePeak::value).reversed()
            .thenComparingInt(CandidatePeak::index);

    public PeakDetection detect(SmoothedSeries series, PhenologyConfig config) {
        return detect(series, config.getBaselinePercentile(), config.getMinProminence(), config.getMinSeparation());
    }

    public PeakDetection detect(SmoothedSeries series, double baselinePercentile, double minProminence, int minSeparation) {
        if (baselinePercentile <= 0 || baselinePercentile > 100) {
            throw new ConfigurationException("Baseline percentile must be in (0, 100], got " + baselinePercentile);
        }
        if (minProminence < 0) {
            throw new ConfigurationException("Minimum prominence must not be negative, got " + minProminence);
        }
        if (minSeparation < 1) {
            throw new ConfigurationException("Minimum separation must be at least one grid step, got " + minSeparation);
        }

        double[] usable = series.usableValues();
        if (usable.length == 0) {
            return new PeakDetection(Double.NaN, List.of(), List.of());
        }
        double baseline = baseline(usable, baselinePercentile);

        List<CandidatePeak> candidates = new ArrayList<>();
        for (int index : localMaxima(series)) {
            double value = series.getValue(index);
            double prominence = value - baseline;
            if (prominence >= minProminence) {
                candidates.add(new CandidatePeak(index, series.getDate(index), value, prominence));
            }
        }
        candidates.sort(STRONGEST_FIRST);

        List<CandidatePeak> accepted = new ArrayList<>();
        List<CandidatePeak> suppressed = new ArrayList<>();
        for (CandidatePeak candidate : candidates) {
            boolean clear = accepted.stream()
                    .allMatch(peak -> Math.abs(peak.index() - candidate.index()) >= minSeparation);
            if (clear) {
                accepted.add(candidate);
            } else {
                suppressed.add(candidate);
            }
        }
        accepted.sort(Comparator.comparingInt(CandidatePeak::index));
        suppressed.sort(Comparator.comparingInt(CandidatePeak::index));

        if (accepted.isEmpty()) {
            logger.debug("No bloom peak above baseline {} (min prominence {})", baseline, minProminence);
        } else {
            logger.debug("Detected {} peak(s) above baseline {}, {} suppressed", accepted.size(), baseline, suppressed.size());
        }
        return new PeakDetection(baseline, accepted, suppressed);
    }

    static double baseline(double[] values, double percentile) {
        if (values.length == 1) {
            return values[0];
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, percentile);
    }

    /**
     * Indices of local maxima among the usable points. A plateau counts once, at its first point,
     * and only when the series falls again after it. The first and last usable points are never
     * maxima.
     */
    static List<Integer> localMaxima(SmoothedSeries series) {
        List<Integer> usable = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            if (!series.isMissing(i)) {
                usable.add(i);
            }
        }
        List<Integer> maxima = new ArrayList<>();
        for (int j = 1; j < usable.size() - 1; j++) {
            double value = series.getValue(usable.get(j));
            double previous = series.getValue(usable.get(j - 1));
            if (value <= previous) {
                continue;
            }
            int next = j + 1;
            while (next < usable.size() && series.getValue(usable.get(next)) == value) {
                next++;
            }
            if (next < usable.size() && series.getValue(usable.get(next)) < value) {
                maxima.add(usable.get(j));
            }
        }
        return maxima;
    }
}
