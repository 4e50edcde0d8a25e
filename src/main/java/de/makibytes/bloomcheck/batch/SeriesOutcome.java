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

import java.util.List;

import de.makibytes.bloomcheck.model.BloomEvent;

public class SeriesOutcome {

    public enum ErrorKind {
        INSUFFICIENT_DATA,
        CONFIGURATION,
        FAILED
    }

    private final String region;
    private final int year;
    private final List<BloomEvent> events;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private SeriesOutcome(String region, int year, List<BloomEvent> events, ErrorKind errorKind, String errorMessage) {
        this.region = region;
        this.year = year;
        this.events = events;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static SeriesOutcome success(String region, int year, List<BloomEvent> events) {
        return new SeriesOutcome(region, year, List.copyOf(events), null, null);
    }

    public static SeriesOutcome failure(String region, int year, ErrorKind errorKind, String errorMessage) {
        return new SeriesOutcome(region, year, List.of(), errorKind, errorMessage);
    }

    public String getRegion() {
        return region;
    }

    public int getYear() {
        return year;
    }

    public List<BloomEvent> getEvents() {
        return events;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public boolean isSuccess() {
        return errorKind == null;
    }
}
