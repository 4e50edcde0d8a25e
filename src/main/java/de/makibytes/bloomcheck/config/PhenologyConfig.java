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

import de.makibytes.bloomcheck.phenology.ConfigurationException;

/**
 * Immutable parameter set for one analysis call. Every pipeline stage receives it explicitly,
 * so concurrent analyses with different settings never share state.
 */
public final class PhenologyConfig {

    private final int gridStepDays;
    private final int gapFillThreshold;
    private final int minUsablePoints;
    private final int windowLength;
    private final int polynomialOrder;
    private final EdgePadding edgePadding;
    private final double baselinePercentile;
    private final double minProminence;
    private final int minSeparation;
    private final double halfDecayFraction;
    private final double onsetEpsilon;
    private final double slopeTolerance;
    private final double contrastWeight;
    private final double amplitudeWeight;
    private final double fullScaleAmplitude;
    private final double censorPenalty;
    private final double gapPenalty;

    private PhenologyConfig(Builder builder) {
        this.gridStepDays = builder.gridStepDays;
        this.gapFillThreshold = builder.gapFillThreshold;
        this.minUsablePoints = builder.minUsablePoints;
        this.windowLength = builder.windowLength;
        this.polynomialOrder = builder.polynomialOrder;
        this.edgePadding = builder.edgePadding;
        this.baselinePercentile = builder.baselinePercentile;
        this.minProminence = builder.minProminence;
        this.minSeparation = builder.minSeparation;
        this.halfDecayFraction = builder.halfDecayFraction;
        this.onsetEpsilon = builder.onsetEpsilon;
        this.slopeTolerance = builder.slopeTolerance;
        this.contrastWeight = builder.contrastWeight;
        this.amplitudeWeight = builder.amplitudeWeight;
        this.fullScaleAmplitude = builder.fullScaleAmplitude;
        this.censorPenalty = builder.censorPenalty;
        this.gapPenalty = builder.gapPenalty;
    }

    public static PhenologyConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .gridStepDays(gridStepDays)
                .gapFillThreshold(gapFillThreshold)
                .minUsablePoints(minUsablePoints)
                .windowLength(windowLength)
                .polynomialOrder(polynomialOrder)
                .edgePadding(edgePadding)
                .baselinePercentile(baselinePercentile)
                .minProminence(minProminence)
                .minSeparation(minSeparation)
                .halfDecayFraction(halfDecayFraction)
                .onsetEpsilon(onsetEpsilon)
                .slopeTolerance(slopeTolerance)
                .contrastWeight(contrastWeight)
                .amplitudeWeight(amplitudeWeight)
                .fullScaleAmplitude(fullScaleAmplitude)
                .censorPenalty(censorPenalty)
                .gapPenalty(gapPenalty);
    }

    public int getGridStepDays() {
        return gridStepDays;
    }

    public int getGapFillThreshold() {
        return gapFillThreshold;
    }

    public int getMinUsablePoints() {
        return minUsablePoints;
    }

    public int getWindowLength() {
        return windowLength;
    }

    public int getPolynomialOrder() {
        return polynomialOrder;
    }

    public EdgePadding getEdgePadding() {
        return edgePadding;
    }

    public double getBaselinePercentile() {
        return baselinePercentile;
    }

    public double getMinProminence() {
        return minProminence;
    }

    public int getMinSeparation() {
        return minSeparation;
    }

    public double getHalfDecayFraction() {
        return halfDecayFraction;
    }

    public double getOnsetEpsilon() {
        return onsetEpsilon;
    }

    public double getSlopeTolerance() {
        return slopeTolerance;
    }

    public double getContrastWeight() {
        return contrastWeight;
    }

    public double getAmplitudeWeight() {
        return amplitudeWeight;
    }

    public double getFullScaleAmplitude() {
        return fullScaleAmplitude;
    }

    public double getCensorPenalty() {
        return censorPenalty;
    }

    public double getGapPenalty() {
        return gapPenalty;
    }

    public static class Builder {
        private int gridStepDays = 8;
        private int gapFillThreshold = 2;
        private int minUsablePoints = 5;
        private int windowLength = 5;
        private int polynomialOrder = 2;
        private EdgePadding edgePadding = EdgePadding.NEAREST;
        private double baselinePercentile = 20.0;
        private double minProminence = 0.1;
        private int minSeparation = 20;
        private double halfDecayFraction = 0.5;
        private double onsetEpsilon = 0.02;
        private double slopeTolerance = 0.005;
        private double contrastWeight = 0.5;
        private double amplitudeWeight = 0.5;
        private double fullScaleAmplitude = 0.25;
        private double censorPenalty = 0.25;
        private double gapPenalty = 0.5;

        public Builder gridStepDays(int gridStepDays) {
            this.gridStepDays = gridStepDays;
            return this;
        }

        public Builder gapFillThreshold(int gapFillThreshold) {
            this.gapFillThreshold = gapFillThreshold;
            return this;
        }

        public Builder minUsablePoints(int minUsablePoints) {
            this.minUsablePoints = minUsablePoints;
            return this;
        }

        public Builder windowLength(int windowLength) {
            this.windowLength = windowLength;
            return this;
        }

        public Builder polynomialOrder(int polynomialOrder) {
            this.polynomialOrder = polynomialOrder;
            return this;
        }

        public Builder edgePadding(EdgePadding edgePadding) {
            this.edgePadding = edgePadding == null ? EdgePadding.NEAREST : edgePadding;
            return this;
        }

        public Builder baselinePercentile(double baselinePercentile) {
            this.baselinePercentile = baselinePercentile;
            return this;
        }

        public Builder minProminence(double minProminence) {
            this.minProminence = minProminence;
            return this;
        }

        public Builder minSeparation(int minSeparation) {
            this.minSeparation = minSeparation;
            return this;
        }

        public Builder halfDecayFraction(double halfDecayFraction) {
            this.halfDecayFraction = halfDecayFraction;
            return this;
        }

        public Builder onsetEpsilon(double onsetEpsilon) {
            this.onsetEpsilon = onsetEpsilon;
            return this;
        }

        public Builder slopeTolerance(double slopeTolerance) {
            this.slopeTolerance = slopeTolerance;
            return this;
        }

        public Builder contrastWeight(double contrastWeight) {
            this.contrastWeight = contrastWeight;
            return this;
        }

        public Builder amplitudeWeight(double amplitudeWeight) {
            this.amplitudeWeight = amplitudeWeight;
            return this;
        }

        public Builder fullScaleAmplitude(double fullScaleAmplitude) {
            this.fullScaleAmplitude = fullScaleAmplitude;
            return this;
        }

        public Builder censorPenalty(double censorPenalty) {
            this.censorPenalty = censorPenalty;
            return this;
        }

        public Builder gapPenalty(double gapPenalty) {
            this.gapPenalty = gapPenalty;
            return this;
        }

        /**
         * @throws ConfigurationException when an extraction parameter is outside its range; grid and
         *                                window parameters are checked by the stages against the series
         */
        public PhenologyConfig build() {
            if (!(halfDecayFraction > 0 && halfDecayFraction <= 1)) {
                throw new ConfigurationException("Half-decay fraction must be in (0, 1], got " + halfDecayFraction);
            }
            requireNonNegative("Onset epsilon", onsetEpsilon);
            requireNonNegative("Slope tolerance", slopeTolerance);
            requireNonNegative("Contrast weight", contrastWeight);
            requireNonNegative("Amplitude weight", amplitudeWeight);
            if (contrastWeight + amplitudeWeight <= 0) {
                throw new ConfigurationException("Contrast and amplitude weights must not both be zero");
            }
            if (!(fullScaleAmplitude > 0)) {
                throw new ConfigurationException("Full-scale amplitude must be positive, got " + fullScaleAmplitude);
            }
            requireFraction("Censor penalty", censorPenalty);
            requireFraction("Gap penalty", gapPenalty);
            return new PhenologyConfig(this);
        }

        private static void requireNonNegative(String name, double value) {
            if (!(value >= 0)) {
                throw new ConfigurationException(name + " must not be negative, got " + value);
            }
        }

        private static void requireFraction(String name, double value) {
            if (!(value >= 0 && value <= 1)) {
                throw new ConfigurationException(name + " must be in [0, 1], got " + value);
            }
        }
    }
}
