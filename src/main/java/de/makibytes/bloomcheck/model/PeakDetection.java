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
package de.makibytes.bloomcheck.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Result of peak detection on one series.
 *
 * @param baseline   low-percentile reference level of the series
 * @param peaks      accepted peaks, ascending by date
 * @param suppressed candidates that passed the prominence test but lost to a stronger nearby peak,
 *                   ascending by date
 */
public record PeakDetection(double baseline, List<CandidatePeak> peaks, List<CandidatePeak> suppressed) {

    public PeakDetection {
        peaks = peaks != null ? List.copyOf(peaks) : List.of();
        suppressed = suppressed != null ? List.copyOf(suppressed) : List.of();
    }

    public boolean isEmpty() {
        return peaks.isEmpty();
    }

    /**
     * Accepted and suppressed candidates together, ascending by date.
     */
    public List<CandidatePeak> allCandidates() {
        List<CandidatePeak> all = new ArrayList<>(peaks.size() + suppressed.size());
        all.addAll(peaks);
        all.addAll(suppressed);
        all.sort(Comparator.comparingInt(CandidatePeak::index));
        return all;
    }
}
