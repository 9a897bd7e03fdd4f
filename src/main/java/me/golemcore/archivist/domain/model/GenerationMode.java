/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.archivist.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How much effort went into producing a file. The mode fixes the retention
 * score band a file is scored within.
 */
public enum GenerationMode {

    MINIMAL("minimal", 0.0, 4.0),
    PROFESSIONAL("professional", 3.0, 7.0),
    RESEARCH("research", 6.0, 10.0);

    private final String value;
    private final double bandLow;
    private final double bandHigh;

    GenerationMode(String value, double bandLow, double bandHigh) {
        this.value = value;
        this.bandLow = bandLow;
        this.bandHigh = bandHigh;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getBandLow() {
        return bandLow;
    }

    public double getBandHigh() {
        return bandHigh;
    }

    @JsonCreator
    public static GenerationMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (GenerationMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown generation mode: " + raw);
    }
}
