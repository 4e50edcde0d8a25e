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
package de.makibytes.bloomcheck.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bloom")
public class BloomCheckProperties {

    private Preparation preparation = new Preparation();
    private Smoothing smoothing = new Smoothing();
    private Detection detection = new Detection();
    private Extraction extraction = new Extraction();
    private Batch batch = new Batch();
    private Runner runner = new Runner();

    public Preparation getPreparation() {
        return preparation;
    }

    public void setPreparation(Preparation preparation) {
        this.preparation = preparation;
    }

    public Smoothing getSmoothing() {
        return smoothing;
    }

    public void setSmoothing(Smoothing smoothing) {
        this.smoothing = smoothing;
    }

    public Detection getDetection() {
        return detection;
    }

    public void setDetection(Detection detection) {
        this.detection = detection;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Runner getRunner() {
        return runner;
    }

    public void setRunner(Runner runner) {
        this.runner = runner;
    }

    /**
     * Snapshot of the bound properties as the immutable value handed to the pipeline.
     */
    public PhenologyConfig toPhenologyConfig() {
        return PhenologyConfig.builder()
                .gridStepDays(preparation.getGridStepDays())
                .gapFillThreshold(preparation.getGapFillThreshold())
                .minUsablePoints(preparation.getMinUsablePoints())
                .windowLength(smoothing.getWindowLength())
                .polynomialOrder(smoothing.getPolynomialOrder())
                .edgePadding(smoothing.getEdgePadding())
                .baselinePercentile(detection.getBaselinePercentile())
                .minProminence(detection.getMinProminence())
                .minSeparation(detection.getMinSeparation())
                .halfDecayFraction(extraction.getHalfDecayFraction())
                .onsetEpsilon(extraction.getOnsetEpsilon())
                .slopeTolerance(extraction.getSlopeTolerance())
                .contrastWeight(extraction.getContrastWeight())
                .amplitudeWeight(extraction.getAmplitudeWeight())
                .fullScaleAmplitude(extraction.getFullScaleAmplitude())
                .censorPenalty(extraction.getCensorPenalty())
                .gapPenalty(extraction.getGapPenalty())
                .build();
    }

    public static class Preparation {

        private int gridStepDays = 8;
        private int gapFillThreshold = 2;
        private int minUsablePoints = 5;

        public int getGridStepDays() {
            return gridStepDays;
        }

        public void setGridStepDays(int gridStepDays) {
            this.gridStepDays = gridStepDays;
        }

        public int getGapFillThreshold() {
            return gapFillThreshold;
        }

        public void setGapFillThreshold(int gapFillThreshold) {
            this.gapFillThreshold = gapFillThreshold;
        }

        public int getMinUsablePoints() {
            return minUsablePoints;
        }

        public void setMinUsablePoints(int minUsablePoints) {
            this.minUsablePoints = minUsablePoints;
        }
    }

    public static class Smoothing {

        private int windowLength = 5;
        private int polynomialOrder = 2;
        private EdgePadding edgePadding = EdgePadding.NEAREST;

        public int getWindowLength() {
            return windowLength;
        }

        public void setWindowLength(int windowLength) {
            this.windowLength = windowLength;
        }

        public int getPolynomialOrder() {
            return polynomialOrder;
        }

        public void setPolynomialOrder(int polynomialOrder) {
            this.polynomialOrder = polynomialOrder;
        }

        public EdgePadding getEdgePadding() {
            return edgePadding;
        }

        public void setEdgePadding(EdgePadding edgePadding) {
            this.edgePadding = edgePadding;
        }
    }

    public static class Detection {

        private double baselinePercentile = 20.0;
        private double minProminence = 0.1;
        private int minSeparation = 20;

        public double getBaselinePercentile() {
            return baselinePercentile;
        }

        public void setBaselinePercentile(double baselinePercentile) {
            this.baselinePercentile = baselinePercentile;
        }

        public double getMinProminence() {
            return minProminence;
        }

        public void setMinProminence(double minProminence) {
            this.minProminence = minProminence;
        }

        public int getMinSeparation() {
            return minSeparation;
        }

        public void setMinSeparation(int minSeparation) {
            this.minSeparation = minSeparation;
        }
    }

    public static class Extraction {

        private double halfDecayFraction = 0.5;
        private double onsetEpsilon = 0.02;
        private double slopeTolerance = 0.005;
        private double contrastWeight = 0.5;
        private double amplitudeWeight = 0.5;
        private double fullScaleAmplitude = 0.25;
        private double censorPenalty = 0.25;
        private double gapPenalty = 0.5;

        public double getHalfDecayFraction() {
            return halfDecayFraction;
        }

        public void setHalfDecayFraction(double halfDecayFraction) {
            this.halfDecayFraction = halfDecayFraction;
        }

        public double getOnsetEpsilon() {
            return onsetEpsilon;
        }

        public void setOnsetEpsilon(double onsetEpsilon) {
            this.onsetEpsilon = onsetEpsilon;
        }

        public double getSlopeTolerance() {
            return slopeTolerance;
        }

        public void setSlopeTolerance(double slopeTolerance) {
            this.slopeTolerance = slopeTolerance;
        }

        public double getContrastWeight() {
            return contrastWeight;
        }

        public void setContrastWeight(double contrastWeight) {
            this.contrastWeight = contrastWeight;
        }

        public double getAmplitudeWeight() {
            return amplitudeWeight;
        }

        public void setAmplitudeWeight(double amplitudeWeight) {
            this.amplitudeWeight = amplitudeWeight;
        }

        public double getFullScaleAmplitude() {
            return fullScaleAmplitude;
        }

        public void setFullScaleAmplitude(double fullScaleAmplitude) {
            this.fullScaleAmplitude = fullScaleAmplitude;
        }

        public double getCensorPenalty() {
            return censorPenalty;
        }

        public void setCensorPenalty(double censorPenalty) {
            this.censorPenalty = censorPenalty;
        }

        public double getGapPenalty() {
            return gapPenalty;
        }

        public void setGapPenalty(double gapPenalty) {
            this.gapPenalty = gapPenalty;
        }
    }

    public static class Batch {

        private int workerThreads = Runtime.getRuntime().availableProcessors();

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    public static class Runner {

        private boolean enabled = false;
        private String inputFile;
        private String outputFile = "./data/bloom-events.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getInputFile() {
            return inputFile;
        }

        public void setInputFile(String inputFile) {
            this.inputFile = inputFile;
        }

        public String getOutputFile() {
            return outputFile;
        }

        public void setOutputFile(String outputFile) {
            this.outputFile = outputFile;
        }
    }
}
