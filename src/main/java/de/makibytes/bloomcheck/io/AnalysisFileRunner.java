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
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import de.makibytes.bloomcheck.batch.BatchAnalysisService;
import de.makibytes.bloomcheck.batch.SeriesOutcome;
import de.makibytes.bloomcheck.batch.SeriesRequest;
import de.makibytes.bloomcheck.config.BloomCheckProperties;

/**
 * Analyzes the configured batch file once at startup and writes the results next to it.
 * Enabled with {@code bloom.runner.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "bloom.runner", name = "enabled", havingValue = "true")
public class AnalysisFileRunner implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisFileRunner.class);

    private final BatchAnalysisService batchService;
    private final BloomJsonCodec codec;
    private final BloomCheckProperties properties;

    public AnalysisFileRunner(BatchAnalysisService batchService, BloomJsonCodec codec, BloomCheckProperties properties) {
        this.batchService = batchService;
        this.codec = codec;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        BloomCheckProperties.Runner runner = properties.getRunner();
        if (runner.getInputFile() == null || runner.getInputFile().isBlank()) {
            logger.warn("Runner enabled but bloom.runner.input-file is not set, nothing to analyze");
            return;
        }
        Path input = Path.of(runner.getInputFile());
        Path output = Path.of(runner.getOutputFile());
        try {
            List<SeriesRequest> requests = codec.readRequests(input);
            logger.info("Read {} series from {}", requests.size(), input);
            List<SeriesOutcome> outcomes = batchService.analyzeAll(requests);
            codec.writeOutcomes(output, outcomes);
            logger.info("Wrote {} result(s) to {}", outcomes.size(), output);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to process batch file " + input, ex);
        }
    }
}
