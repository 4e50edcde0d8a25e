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
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.bloomcheck.config.PhenologyConfig;
import de.makibytes.bloomcheck.model.Observation;
import de.makibytes.bloomcheck.model.ObservationQuality;
import de.makibytes.bloomcheck.model.RawObservation;

/**
 * Puts raw observations on a regular grid and bridges short gaps by linear interpolation.
 */
@Component
public class SeriesPreparer {
    private static final Logger logger = LoggerFactory.getLogger(SeriesPreparer.class);

    public List<Observation> prepare(List<RawObservation> raw, PhenologyConfig config) {
        return prepare(raw, config.getGridStepDays(), config.getGapFillThreshold(), config.getMinUsablePoints());
    }

    public List<Observation> prepare(List<RawObservation> raw, int gridStepDays, int gapFillThreshold) {
        return prepare(raw, gridStepDays, gapFillThreshold, PhenologyConfig.defaults().getMinUsablePoints());
    }

    public List<Observation> prepare(List<RawObservation> raw, int gridStepDays, int gapFillThreshold, int minUsablePoints) {
        if (gridStepDays <= 0) {
            throw new ConfigurationException("Grid step must be positive, got " + gridStepDays);
        }
        if (gapFillThreshold < 0) {
            throw new ConfigurationException("Gap fill threshold must not be negative, got " + gapFillThreshold);
        }
        if (raw == null || raw.isEmpty()) {
            throw new InsufficientDataException(0, minUsablePoints);
        }

        LocalDate start = raw.get(0).getDate();
        LocalDate end = start;
        for (RawObservation observation : raw) {
            if (observation.getDate().isBefore(start)) {
                start = observation.getDate();
            }
            if (observation.getDate().isAfter(end)) {
                end = observation.getDate();
            }
        }
        long spanDays = ChronoUnit.DAYS.between(start, end);
        int slots = (int) Math.round((double) spanDays / gridStepDays) + 1;

        double[] sums = new double[slots];
        int[] counts = new int[slots];
        boolean[] measured = new boolean[slots];
        for (RawObservation observation : raw) {
            if (!observation.isUsable()) {
                continue;
            }
            int slot = (int) Math.round((double) ChronoUnit.DAYS.between(start, observation.getDate()) / gridStepDays);
            sums[slot] += observation.getValue();
            counts[slot]++;
            if (observation.getQuality() == ObservationQuality.GOOD) {
                measured[slot] = true;
            }
        }

        List<Observation> grid = new ArrayList<>(slots);
        for (int i = 0; i < slots; i++) {
            LocalDate date = start.plusDays((long) i * gridStepDays);
            if (counts[i] == 0) {
                grid.add(Observation.missing(date));
            } else {
                ObservationQuality quality = measured[i] ? ObservationQuality.GOOD : ObservationQuality.INTERPOLATED;
                grid.add(new Observation(date, sums[i] / counts[i], quality));
            }
        }

        int filled = fillShortGaps(grid, gapFillThreshold);
        long usable = grid.stream().filter(Observation::isUsable).count();
        if (usable < minUsablePoints) {
            throw new InsufficientDataException((int) usable, minUsablePoints);
        }
        logger.debug("Prepared {} raw observations into {} grid points ({} usable, {} interpolated) from {} to {}",
                raw.size(), slots, usable, filled, start, grid.get(slots - 1).date());
        return List.copyOf(grid);
    }

    private int fillShortGaps(List<Observation> grid, int gapFillThreshold) {
        int filled = 0;
        int previousUsable = -1;
        for (int i = 0; i < grid.size(); i++) {
            if (!grid.get(i).isUsable()) {
                continue;
            }
            int gapLength = i - previousUsable - 1;
            if (previousUsable >= 0 && gapLength > 0 && gapLength <= gapFillThreshold) {
                double from = grid.get(previousUsable).value();
                double to = grid.get(i).value();
                for (int j = previousUsable + 1; j < i; j++) {
                    double fraction = (double) (j - previousUsable) / (i - previousUsable);
                    grid.set(j, new Observation(grid.get(j).date(), from + (to - from) * fraction,
                            ObservationQuality.INTERPOLATED));
                    filled++;
                }
            }
            previousUsable = i;
        }
        return filled;
    }
}
