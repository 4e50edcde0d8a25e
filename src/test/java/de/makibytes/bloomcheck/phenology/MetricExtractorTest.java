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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static de.makibytes.bloomcheck.SeasonFixtures.gridDate;
import de.makibytes.bloomcheck.config.PhenologyConfig;
import de.makibytes.bloomcheck.model.BloomEvent;
import de.makibytes.bloomcheck.model.CandidatePeak;
import de.makibytes.bloomcheck.model.HistoricalBaseline;
import de.makibytes.bloomcheck.model.Observation;
import de.makibytes.bloomcheck.model.ObservationQuality;
import de.makibytes.bloomcheck.model.PeakDetection;
import de.makibytes.bloomcheck.model.SmoothedSeries;

@DisplayName("MetricExtractor")
class MetricExtractorTest {

    private static final double BASELINE = 0.2;
    private static final int YEAR = 2024;

    private MetricExtractor extractor;
    private PhenologyConfig config;

    @BeforeEach
    void setUp() {
        extractor = new MetricExtractor();
        config = PhenologyConfig.defaults();
    }

    private static double[] baseLevel(int points) {
        double[] values = new double[points];
        Arrays.fill(values, BASELINE);
        return values;
    }

    /** Rise from index 10, peak 0.6 at 15, half-decay crossed at 18. */
    private static double[] triangle() {
        double[] values = baseLevel(30);
        double[] shape = {0.25, 0.3, 0.4, 0.5, 0.6, 0.5, 0.42, 0.35, 0.3};
        System.arraycopy(shape, 0, values, 11, shape.length);
        return values;
    }

    private static SmoothedSeries series(double[] values, ObservationQuality[] qualities) {
        List<Observation> observations = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            ObservationQuality quality = qualities != null ? qualities[i] : ObservationQuality.GOOD;
            observations.add(quality == ObservationQuality.MISSING
                    ? Observation.missing(gridDate(i))
                    : new Observation(gridDate(i), values[i], quality));
        }
        return new SmoothedSeries(observations, values);
    }

    private static ObservationQuality[] missingAt(double[] values, int... indices) {
        ObservationQuality[] qualities = new ObservationQuality[values.length];
        Arrays.fill(qualities, ObservationQuality.GOOD);
        for (int index : indices) {
            qualities[index] = ObservationQuality.MISSING;
            values[index] = Double.NaN;
        }
        return qualities;
    }

    private static SmoothedSeries series(double[] values) {
        return series(values, null);
    }

    private static CandidatePeak peakAt(SmoothedSeries series, int index) {
        return new CandidatePeak(index, series.getDate(index), series.getValue(index), series.getValue(index) - BASELINE);
    }

    private BloomEvent extract(SmoothedSeries series, int peakIndex) {
        return extractor.extract(series, peakAt(series, peakIndex), BASELINE, List.of(), null, YEAR, config);
    }

    @Nested
    @DisplayName("Timing")
    class Timing {

        @Test
        @DisplayName("onset, peak and decay dates of a clean bloom")
        void cleanBloomTiming() {
            BloomEvent event = extract(series(triangle()), 15);

            assertEquals(LocalDate.of(2024, 3, 21), event.getOnsetDate());
            assertEquals(LocalDate.of(2024, 4, 30), event.getPeakDate());
            assertEquals(LocalDate.of(2024, 5, 24), event.getDecayDate());
            assertEquals(64, event.getDurationDays());
            assertEquals(0.6, event.getPeakValue(), 1e-12);
            assertEquals(0.4, event.getAmplitude(), 1e-12);
            assertFalse(event.isCensored());
            assertFalse(event.isOnsetAtBoundary());
            assertEquals(YEAR, event.getYear());
        }

        @Test
        @DisplayName("onset stops at the valley towards an earlier bloom")
        void onsetStopsAtValley() {
            double[] values = baseLevel(30);
            double[] shape = {0.3, 0.4, 0.45, 0.4, 0.35, 0.3, 0.35, 0.4, 0.5, 0.6, 0.5, 0.42, 0.35};
            System.arraycopy(shape, 0, values, 6, shape.length);

            BloomEvent event = extract(series(values), 15);

            assertEquals(gridDate(11), event.getOnsetDate());
            assertFalse(event.isOnsetAtBoundary());
        }

        @Test
        @DisplayName("a bloom already under way at the first point flags its onset")
        void onsetAtSeriesStart() {
            double[] values = baseLevel(20);
            values[0] = 0.5;
            values[1] = 0.55;
            values[2] = 0.6;
            values[3] = 0.5;
            values[4] = 0.3;

            BloomEvent event = extract(series(values), 2);

            assertEquals(gridDate(0), event.getOnsetDate());
            assertTrue(event.isOnsetAtBoundary());
            assertEquals(gridDate(4), event.getDecayDate());
            assertEquals(0.75, event.getReliability(), 1e-9);
        }

        @Test
        @DisplayName("a bloom still high at the last point is right-censored")
        void decayAfterSeriesEndIsCensored() {
            double[] values = baseLevel(30);
            values[26] = 0.3;
            values[27] = 0.45;
            values[28] = 0.6;
            values[29] = 0.55;

            BloomEvent event = extract(series(values), 28);

            assertTrue(event.isCensored());
            assertEquals(gridDate(29), event.getDecayDate());
            assertEquals(gridDate(25), event.getOnsetDate());
            assertEquals(0.75, event.getReliability(), 1e-9);
        }

        @Test
        @DisplayName("missing points are stepped over while walking")
        void missingPointsAreSkipped() {
            double[] values = triangle();
            ObservationQuality[] qualities = new ObservationQuality[values.length];
            Arrays.fill(qualities, ObservationQuality.GOOD);
            qualities[17] = ObservationQuality.MISSING;
            values[17] = Double.NaN;

            BloomEvent event = extract(series(values, qualities), 15);

            assertEquals(gridDate(18), event.getDecayDate());
        }

        @Test
        @DisplayName("a gap within the fill threshold does not stop the decay walk")
        void shortGapIsSteppedOver() {
            double[] values = triangle();
            ObservationQuality[] qualities = missingAt(values, 16, 17);

            BloomEvent event = extract(series(values, qualities), 15);

            assertEquals(gridDate(18), event.getDecayDate());
            assertFalse(event.isCensored());
        }

        @Test
        @DisplayName("a peak right after a long gap has its onset at the gap edge")
        void longGapBeforePeakIsOnsetBoundary() {
            double[] values = triangle();
            ObservationQuality[] qualities = missingAt(values, 12, 13, 14);

            BloomEvent event = extract(series(values, qualities), 15);

            assertTrue(event.isOnsetAtBoundary());
            assertEquals(gridDate(15), event.getOnsetDate());
            assertEquals(gridDate(18), event.getDecayDate());
            assertEquals(0.75, event.getReliability(), 1e-9);
        }

        @Test
        @DisplayName("a long gap after the peak censors the decay at the last point seen")
        void longGapAfterPeakIsCensored() {
            double[] values = triangle();
            ObservationQuality[] qualities = missingAt(values, 16, 17, 18);

            BloomEvent event = extract(series(values, qualities), 15);

            assertTrue(event.isCensored());
            assertFalse(event.isOnsetAtBoundary());
            assertEquals(gridDate(15), event.getDecayDate());
            assertEquals(gridDate(10), event.getOnsetDate());
            assertEquals(0.75, event.getReliability(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Reliability")
    class Reliability {

        @Test
        @DisplayName("a strong fully observed bloom is fully reliable")
        void cleanBloomIsFullyReliable() {
            assertEquals(1.0, extract(series(triangle()), 15).getReliability(), 1e-9);
        }

        @Test
        @DisplayName("interpolated points around the bloom lower reliability")
        void interpolatedPointsLowerReliability() {
            ObservationQuality[] qualities = new ObservationQuality[30];
            Arrays.fill(qualities, ObservationQuality.GOOD);
            qualities[13] = ObservationQuality.INTERPOLATED;
            qualities[14] = ObservationQuality.INTERPOLATED;
            qualities[16] = ObservationQuality.INTERPOLATED;

            BloomEvent event = extract(series(triangle(), qualities), 15);

            assertEquals(1.0 - 0.5 * 3.0 / 9.0, event.getReliability(), 1e-9);
        }

        @Test
        @DisplayName("a peak below the baseline has zero amplitude and zero reliability")
        void amplitudeIsNeverNegative() {
            SmoothedSeries series = series(triangle());
            CandidatePeak peak = new CandidatePeak(15, series.getDate(15), 0.6, -0.1);

            BloomEvent event = extractor.extract(series, peak, 0.7, List.of(), null, YEAR, config);

            assertEquals(0.0, event.getAmplitude());
            assertEquals(0.0, event.getReliability());
        }

        @Test
        @DisplayName("a small amplitude scores below full scale")
        void smallAmplitudeScoresLower() {
            double[] values = baseLevel(30);
            values[14] = 0.25;
            values[15] = 0.3;
            values[16] = 0.25;

            BloomEvent event = extract(series(values), 15);

            // contrast 1.0, amplitude 0.1 of 0.25 full scale
            assertEquals(0.5 * 1.0 + 0.5 * 0.4, event.getReliability(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Context")
    class Context {

        @Test
        @DisplayName("suppressed candidates near the peak are listed as supporting peaks")
        void supportingPeaksComeFromNearbyCandidates() {
            SmoothedSeries series = series(triangle());
            CandidatePeak main = peakAt(series, 15);
            CandidatePeak near = new CandidatePeak(12, series.getDate(12), 0.3, 0.1);
            CandidatePeak far = new CandidatePeak(2, series.getDate(2), 0.3, 0.1);
            PeakDetection detection = new PeakDetection(BASELINE, List.of(main), List.of(far, near));
            PhenologyConfig narrow = config.toBuilder().minSeparation(5).build();

            BloomEvent event = extractor.extract(series, main, detection, null, YEAR, narrow);

            assertEquals(List.of(near), event.getSupportingPeaks());
        }

        @Test
        @DisplayName("anomaly is the peak day offset from the mean of other years")
        void anomalyAgainstOtherYears() {
            HistoricalBaseline history = new HistoricalBaseline(Map.of(2020, 100, 2021, 110, YEAR, 300));

            assertEquals(16.0, MetricExtractor.anomalyDays(LocalDate.of(2024, 4, 30), history, YEAR), 1e-12);
        }

        @Test
        @DisplayName("anomaly is absent without history for other years")
        void anomalyAbsentWithoutHistory() {
            LocalDate peak = LocalDate.of(2024, 4, 30);
            assertNull(MetricExtractor.anomalyDays(peak, null, YEAR));
            assertNull(MetricExtractor.anomalyDays(peak, HistoricalBaseline.empty(), YEAR));
            assertNull(MetricExtractor.anomalyDays(peak, new HistoricalBaseline(Map.of(YEAR, 120)), YEAR));
        }
    }

    @Nested
    @DisplayName("Invalid peaks")
    class InvalidPeaks {

        @Test
        @DisplayName("index outside the series is rejected")
        void indexOutsideSeries() {
            SmoothedSeries series = series(triangle());
            CandidatePeak peak = new CandidatePeak(30, gridDate(30), 0.6, 0.4);

            assertThrows(IllegalArgumentException.class,
                    () -> extractor.extract(series, peak, BASELINE, List.of(), null, YEAR, config));
        }

        @Test
        @DisplayName("index on a missing observation is rejected")
        void indexOnMissingPoint() {
            double[] values = triangle();
            ObservationQuality[] qualities = new ObservationQuality[values.length];
            Arrays.fill(qualities, ObservationQuality.GOOD);
            qualities[15] = ObservationQuality.MISSING;
            SmoothedSeries series = series(values, qualities);
            CandidatePeak peak = new CandidatePeak(15, gridDate(15), 0.6, 0.4);

            assertThrows(IllegalArgumentException.class,
                    () -> extractor.extract(series, peak, BASELINE, List.of(), null, YEAR, config));
        }
    }
}
