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
 * Position of a tracked file in its retention lifecycle.
 *
 * <pre>
 * ACTIVE → AGING → ARCHIVE_ELIGIBLE → ARCHIVED
 *   ↑________|____________|   (any access)
 * </pre>
 *
 * A file enters {@link #ACTIVE} on its first successful registration.
 * {@link #ARCHIVED} is terminal: the tracked file is replaced by an
 * {@link ArchiveRecord}.
 */
public enum LifecycleState {

    ACTIVE("active"),
    AGING("aging"),
    ARCHIVE_ELIGIBLE("archive_eligible"),
    ARCHIVED("archived");

    private final String value;

    LifecycleState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * State an idle file moves to next, or {@code null} when the next step is
     * not driven by idle time.
     */
    public LifecycleState next() {
        return switch (this) {
        case ACTIVE -> AGING;
        case AGING -> ARCHIVE_ELIGIBLE;
        case ARCHIVE_ELIGIBLE -> ARCHIVED;
        case ARCHIVED -> null;
        };
    }

    @JsonCreator
    public static LifecycleState fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (LifecycleState state : values()) {
            if (state.value.equals(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle state: " + raw);
    }
}
