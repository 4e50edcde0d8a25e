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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import de.makibytes.bloomcheck.config.PhenologyConfig;
import de.makibytes.bloomcheck.model.BloomEvent;
import de.makibytes.bloomcheck.model.CandidatePeak;
import de.makibytes.bloomcheck.model.HistoricalBaseline;
import de.makibytes.bloomcheck.model.Observation;
import de.makibytes.bloomcheck.model.PeakDetection;
import de.makibytes.bloomcheck.model.RawObservation;
import de.makibytes.bloomcheck.model.SmoothedSeries;
import de.makibytes.bloomcheck.model.WeatherSample;
import de.makibytes.bloomcheck.weather.WeatherImpactAssessor;

/**
 * Entry point of the pipeline: prepare, smooth, detect, extract. Holds no state between calls.
 */
@Component
public class PhenologyAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(PhenologyAnalyzer.class);

    private final SeriesPreparer preparer;
    private final SavitzkyGolaySmoother smoother;
    private final PeakDetector detector;
    private final MetricExtractor extractor;
    private final WeatherImpactAssessor weatherAssessor;

    /**
     * Standalone wiring for callers outside the Spring context.
     */
    public PhenologyAnalyzer() {
        this(new SeriesPreparer(), new SavitzkyGolaySmoother(), new PeakDetector(), new MetricExtractor(),
                new WeatherImpactAssessor());
    }

    @Autowired
    public PhenologyAnalyzer(SeriesPreparer preparer,
                             SavitzkyGolaySmoother smoother,
                             PeakDetector detector,
                             MetricExtractor extractor,
                             WeatherImpactAssessor weatherAssessor) {
        this.preparer = preparer;
        this.smoother = smoother;
        this.detector = detector;
        this.extractor = extractor;
        this.weatherAssessor = weatherAssessor;
    }

    public List<BloomEvent> analyze(List<RawObservation> raw, int year, PhenologyConfig config) {
        return analyze(raw, year, config, null, null);
    }

    public List<BloomEvent> analyze(List<RawObservation> raw, int year, PhenologyConfig config, HistoricalBaseline history) {
        return analyze(raw, year, config, history, null);
    }

    /**
     * Extracts the bloom events of one season.
     *
     * @return events ordered by peak date; empty when no bloom stands out from the baseline
     * @throws InsufficientDataException when the record is too sparse to analyze
     * @throws ConfigurationException    when the parameters do not fit the series
     */
    public List<BloomEvent> analyze(List<RawObservation> raw,
                                    int year,
                                    PhenologyConfig config,
                                    HistoricalBaseline history,
                                    List<WeatherSample> weather) {
        List<Observation> observations = preparer.prepare(raw, config);
        SmoothedSeries series = smoother.smooth(observations, config);
        PeakDetection detection = detector.detect(series, config);
        if (detection.isEmpty()) {
            logger.debug("Season {}: no bloom detected", year);
            return List.of();
        }

        List<BloomEvent> events = new ArrayList<>(detection.peaks().size());
        for (CandidatePeak peak : detection.peaks()) {
            BloomEvent event = extractor.extract(series, peak, detection, history, year, config);
            events.add(weatherAssessor.enrich(event, weather));
        }
        logger.debug("Season {}: {} bloom event(s), first peak {}", year, events.size(), events.get(0).getPeakDate());
        return List.copyOf(events);
    }
}
