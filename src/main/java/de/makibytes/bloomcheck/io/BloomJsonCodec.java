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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import de.makibytes.bloomcheck.batch.SeriesOutcome;
import de.makibytes.bloomcheck.batch.SeriesRequest;
import de.makibytes.bloomcheck.io.BatchInputJson.ObservationJson;
import de.makibytes.bloomcheck.io.BatchInputJson.SeriesJson;
import de.makibytes.bloomcheck.model.BloomEvent;
import de.makibytes.bloomcheck.model.HistoricalBaseline;
import de.makibytes.bloomcheck.model.RawObservation;
import de.makibytes.bloomcheck.model.WeatherSample;

/**
 * Reads batch request files and writes bloom results as JSON.
 */
@Component
public class BloomJsonCodec {

    private final ObjectMapper objectMapper;

    public BloomJsonCodec() {
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public List<SeriesRequest> readRequests(Path file) throws IOException {
        BatchInputJson input = objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), BatchInputJson.class);
        return toRequests(input);
    }

    List<SeriesRequest> toRequests(BatchInputJson input) {
        if (input == null || input.series() == null) {
            return List.of();
        }
        List<SeriesRequest> requests = new ArrayList<>(input.series().size());
        for (SeriesJson series : input.series()) {
            requests.add(new SeriesRequest(
                    series.region(),
                    series.year(),
                    toRaw(series.observations()),
                    toHistory(series),
                    series.weather() == null ? List.of() : series.weather().stream()
                            .map(sample -> new WeatherSample(sample.date(), sample.meanTemperatureC()))
                            .toList()));
        }
        return requests;
    }

    /**
     * Explicit historical peaks win over peaks derived from prior series of the same year.
     */
    private HistoricalBaseline toHistory(SeriesJson series) {
        Map<Integer, Integer> peaks = new LinkedHashMap<>();
        if (series.priorSeries() != null && !series.priorSeries().isEmpty()) {
            Map<Integer, List<RawObservation>> prior = new LinkedHashMap<>();
            series.priorSeries().forEach((year, observations) -> prior.put(year, toRaw(observations)));
            peaks.putAll(HistoricalBaseline.fromSeries(prior).getPeakDayOfYearByYear());
        }
        if (series.historicalPeaks() != null) {
            peaks.putAll(series.historicalPeaks());
        }
        return peaks.isEmpty() ? null : new HistoricalBaseline(peaks);
    }

    private List<RawObservation> toRaw(List<ObservationJson> observations) {
        if (observations == null) {
            return List.of();
        }
        return observations.stream()
                .map(observation -> new RawObservation(observation.date(), observation.value(), observation.quality()))
                .toList();
    }

    public String writeEvents(List<BloomEvent> events) throws IOException {
        return objectMapper.writeValueAsString(events.stream().map(BloomEventJson::from).toList());
    }

    public void writeOutcomes(Path file, List<SeriesOutcome> outcomes) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        List<OutcomeJson> results = outcomes.stream().map(OutcomeJson::from).toList();
        Files.writeString(file, objectMapper.writeValueAsString(new ResultsJson(results)), StandardCharsets.UTF_8);
    }

    record ResultsJson(@JsonProperty("results") List<OutcomeJson> results) {
    }

    @JsonPropertyOrder({"region", "year", "status", "error", "events"})
    record OutcomeJson(
        @JsonProperty("region") String region,
        @JsonProperty("year") int year,
        @JsonProperty("status") String status,
        @JsonProperty("error") String error,
        @JsonProperty("events") List<BloomEventJson> events
    ) {
        static OutcomeJson from(SeriesOutcome outcome) {
            return new OutcomeJson(
                    outcome.getRegion(),
                    outcome.getYear(),
                    outcome.isSuccess() ? "OK" : outcome.getErrorKind().name(),
                    outcome.getErrorMessage(),
                    outcome.getEvents().stream().map(BloomEventJson::from).toList());
        }
    }
}
