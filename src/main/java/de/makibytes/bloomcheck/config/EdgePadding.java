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

/**
 * How the smoothing window is completed beyond the ends of a series.
 */
public enum EdgePadding {
    /** Repeat the first / last point. */
    NEAREST,
    /** Reflect around the first / last point without repeating it. */
    MIRROR;

    /**
     * Maps a possibly out-of-range index onto the series.
     */
    public int resolve(int index, int size) {
        if (size == 1) {
            return 0;
        }
        if (index >= 0 && index < size) {
            return index;
        }
        if (this == NEAREST) {
            return index < 0 ? 0 : size - 1;
        }
        int period = 2 * (size - 1);
        int folded = Math.floorMod(index, period);
        return folded < size ? folded : period - folded;
    }
}
