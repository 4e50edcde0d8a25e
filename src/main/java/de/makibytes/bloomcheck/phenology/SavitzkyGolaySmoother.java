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

import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.bloomcheck.config.EdgePadding;
import de.makibytes.bloomcheck.config.PhenologyConfig;
import de.makibytes.bloomcheck.model.Observation;
import de.makibytes.bloomcheck.model.SmoothedSeries;

/**
 * Local polynomial (Savitzky-Golay) smoothing. Each point is replaced by the value, at the window
 * centre, of a least-squares polynomial fitted to the usable points of its window. With a complete
 * window this reproduces the classic convolution coefficients; missing points simply drop out of
 * the fit.
 */
@Component
public class SavitzkyGolaySmoother {
    private static final Logger logger = LoggerFactory.getLogger(SavitzkyGolaySmoother.class);

    public SmoothedSeries smooth(List<Observation> observations, PhenologyConfig config) {
        return smooth(observations, config.getWindowLength(), config.getPolynomialOrder(), config.getEdgePadding());
    }

    public SmoothedSeries smooth(List<Observation> observations, int windowLength, int polynomialOrder) {
        return smooth(observations, windowLength, polynomialOrder, EdgePadding.NEAREST);
    }

    public SmoothedSeries smooth(List<Observation> observations, int windowLength, int polynomialOrder, EdgePadding padding) {
        validate(observations.size(), windowLength, polynomialOrder);
        int size = observations.size();
        int half = windowLength / 2;
        double[] smoothed = new double[size];
        int reducedFits = 0;

        double[] offsets = new double[windowLength];
        double[] targets = new double[windowLength];
        for (int i = 0; i < size; i++) {
            if (!observations.get(i).isUsable()) {
                smoothed[i] = Double.NaN;
                continue;
            }
            int points = 0;
            for (int k = -half; k <= half; k++) {
                Observation neighbour = observations.get(padding.resolve(i + k, size));
                if (neighbour.isUsable()) {
                    offsets[points] = k;
                    targets[points] = neighbour.value();
                    points++;
                }
            }
            int degree = Math.min(polynomialOrder, points - 1);
            if (degree < polynomialOrder) {
                reducedFits++;
            }
            smoothed[i] = fitAtCentre(offsets, targets, points, degree);
        }
        if (reducedFits > 0) {
            logger.debug("Smoothing used reduced polynomial degree for {} of {} points", reducedFits, size);
        }
        return new SmoothedSeries(observations, smoothed);
    }

    private void validate(int size, int windowLength, int polynomialOrder) {
        if (polynomialOrder < 0) {
            throw new ConfigurationException("Polynomial order must not be negative, got " + polynomialOrder);
        }
        if (windowLength % 2 == 0) {
            throw new ConfigurationException("Smoothing window must be odd, got " + windowLength);
        }
        if (windowLength < polynomialOrder + 2) {
            throw new ConfigurationException("Smoothing window " + windowLength
                    + " too short for polynomial order " + polynomialOrder);
        }
        if (windowLength > size) {
            throw new ConfigurationException("Smoothing window " + windowLength
                    + " exceeds series length " + size);
        }
    }

    private double fitAtCentre(double[] offsets, double[] targets, int points, int degree) {
        if (degree == 0) {
            double sum = 0;
            for (int r = 0; r < points; r++) {
                sum += targets[r];
            }
            return sum / points;
        }
        double[][] design = new double[points][degree + 1];
        double[] values = new double[points];
        for (int r = 0; r < points; r++) {
            double power = 1.0;
            for (int p = 0; p <= degree; p++) {
                design[r][p] = power;
                power *= offsets[r];
            }
            values[r] = targets[r];
        }
        RealVector coefficients = new QRDecomposition(new Array2DRowRealMatrix(design, false))
                .getSolver()
                .solve(new ArrayRealVector(values, false));
        return coefficients.getEntry(0);
    }
}
