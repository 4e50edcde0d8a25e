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
package de.makibytes.bloomcheck.batch;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static de.makibytes.bloomcheck.SeasonFixtures.flat;
import static de.makibytes.bloomcheck.SeasonFixtures.gridDate;
import static de.makibytes.bloomcheck.SeasonFixtures.singleBloom;
import de.makibytes.bloomcheck.batch.SeriesOutcome.ErrorKind;
import de.makibytes.bloomcheck.config.BloomCheckProperties;
import de.makibytes.bloomcheck.config.PhenologyConfig;
import de.makibytes.bloomcheck.model.RawObservation;
import de.makibytes.bloomcheck.phenology.PhenologyAnalyzer;

@DisplayName("BatchAnalysisService")
class BatchAnalysisServiceTest {

    private BatchAnalysisService service;

    @BeforeEach
    void setUp() {
        BloomCheckProperties properties = new BloomCheckProperties();
        properties.getBatch().setWorkerThreads(3);
        service = new BatchAnalysisService(new PhenologyAnalyzer(), properties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private static List<RawObservation> sparse() {
        return List.of(RawObservation.good(gridDate(0), 0.2), RawObservation.good(gridDate(20), 0.4));
    }

    @Test
    @DisplayName("outcomes come back in request order")
    void outcomesKeepRequestOrder() {
        List<SeriesRequest> requests = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            requests.add(new SeriesRequest("field-" + i, 2024, singleBloom(10 + i, 0.3)));
        }

        List<SeriesOutcome> outcomes = service.analyzeAll(requests);

        assertEquals(12, outcomes.size());
        for (int i = 0; i < 12; i++) {
            SeriesOutcome outcome = outcomes.get(i);
            assertEquals("field-" + i, outcome.getRegion());
            assertTrue(outcome.isSuccess());
            assertEquals(1, outcome.getEvents().size());
            assertEquals(gridDate(10 + i), outcome.getEvents().get(0).getPeakDate());
        }
    }

    @Test
    @DisplayName("a failing series does not stop the batch")
    void failureIsIsolated() {
        List<SeriesRequest> requests = List.of(
                new SeriesRequest("good", 2024, singleBloom(22, 0.3)),
                new SeriesRequest("sparse", 2024, sparse()),
                new SeriesRequest("flat", 2024, flat(46, 0.3)));

        List<SeriesOutcome> outcomes = service.analyzeAll(requests);

        assertTrue(outcomes.get(0).isSuccess());
        assertEquals(1, outcomes.get(0).getEvents().size());

        assertFalse(outcomes.get(1).isSuccess());
        assertEquals(ErrorKind.INSUFFICIENT_DATA, outcomes.get(1).getErrorKind());
        assertTrue(outcomes.get(1).getEvents().isEmpty());

        assertTrue(outcomes.get(2).isSuccess());
        assertTrue(outcomes.get(2).getEvents().isEmpty());
        assertNull(outcomes.get(2).getErrorMessage());
    }

    @Test
    @DisplayName("parameters that do not fit a series are reported as configuration errors")
    void configurationErrorIsReported() {
        PhenologyConfig config = PhenologyConfig.builder().minUsablePoints(3).build();
        List<SeriesRequest> requests = List.of(
                new SeriesRequest("short", 2024, flat(4, 0.3)),
                new SeriesRequest("long", 2024, singleBloom(22, 0.3)));

        List<SeriesOutcome> outcomes = service.analyzeAll(requests, config);

        assertEquals(ErrorKind.CONFIGURATION, outcomes.get(0).getErrorKind());
        assertTrue(outcomes.get(0).getErrorMessage().contains("exceeds"));
        assertTrue(outcomes.get(1).isSuccess());
    }

    @Test
    @DisplayName("an empty batch yields no outcomes")
    void emptyBatch() {
        assertTrue(service.analyzeAll(List.of()).isEmpty());
    }
}
