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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.bloomcheck.batch.SeriesOutcome.ErrorKind;
import de.makibytes.bloomcheck.config.BloomCheckProperties;
import de.makibytes.bloomcheck.config.PhenologyConfig;
import de.makibytes.bloomcheck.model.BloomEvent;
import de.makibytes.bloomcheck.phenology.ConfigurationException;
import de.makibytes.bloomcheck.phenology.InsufficientDataException;
import de.makibytes.bloomcheck.phenology.PhenologyAnalyzer;

import jakarta.annotation.PreDestroy;

/**
 * Runs independent season analyses on a fixed worker pool. Each task owns its series; a failing
 * season is reported in its outcome and never stops the others.
 */
@Component
public class BatchAnalysisService {
    private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisService.class);

    private final PhenologyAnalyzer analyzer;
    private final BloomCheckProperties properties;
    private final ExecutorService executor;

    public BatchAnalysisService(PhenologyAnalyzer analyzer, BloomCheckProperties properties) {
        this.analyzer = analyzer;
        this.properties = properties;
        int workers = Math.max(1, properties.getBatch().getWorkerThreads());
        this.executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        logger.info("Batch analysis pool started with {} worker(s)", workers);
    }

    public List<SeriesOutcome> analyzeAll(List<SeriesRequest> requests) {
        return analyzeAll(requests, properties.toPhenologyConfig());
    }

    /**
     * Analyzes all requests and returns their outcomes in request order.
     */
    public List<SeriesOutcome> analyzeAll(List<SeriesRequest> requests, PhenologyConfig config) {
        List<Future<SeriesOutcome>> futures = new ArrayList<>(requests.size());
        for (SeriesRequest request : requests) {
            futures.add(executor.submit(() -> analyzeOne(request, config)));
        }

        List<SeriesOutcome> outcomes = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            SeriesRequest request = requests.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                throw new IllegalStateException("Batch analysis interrupted", ex);
            } catch (ExecutionException ex) {
                logger.error("Analysis task for {} / {} crashed", request.region(), request.year(), ex.getCause());
                outcomes.add(SeriesOutcome.failure(request.region(), request.year(), ErrorKind.FAILED,
                        String.valueOf(ex.getCause())));
            }
        }

        long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
        int events = outcomes.stream().mapToInt(outcome -> outcome.getEvents().size()).sum();
        logger.info("Batch finished: {} series, {} failed, {} bloom event(s)", outcomes.size(), failed, events);
        return outcomes;
    }

    private SeriesOutcome analyzeOne(SeriesRequest request, PhenologyConfig config) {
        try {
            List<BloomEvent> events = analyzer.analyze(request.observations(), request.year(), config,
                    request.history(), request.weather());
            return SeriesOutcome.success(request.region(), request.year(), events);
        } catch (InsufficientDataException ex) {
            logger.warn("Skipping {} / {}: {}", request.region(), request.year(), ex.getMessage());
            return SeriesOutcome.failure(request.region(), request.year(), ErrorKind.INSUFFICIENT_DATA, ex.getMessage());
        } catch (ConfigurationException ex) {
            logger.warn("Misconfigured analysis for {} / {}: {}", request.region(), request.year(), ex.getMessage());
            return SeriesOutcome.failure(request.region(), request.year(), ErrorKind.CONFIGURATION, ex.getMessage());
        } catch (RuntimeException ex) {
            logger.warn("Analysis failed for {} / {}", request.region(), request.year(), ex);
            return SeriesOutcome.failure(request.region(), request.year(), ErrorKind.FAILED, ex.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "bloom-worker-" + sequence.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
