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

import java.time.Duration;

/**
 * Output of the pattern recognizer consumed by other components.
 *
 * @param temporalWindow
 *            consolidation window to use, or {@code null} when no confident
 *            insight exists
 * @param typicalSessionMinutes
 *            median session duration, or {@code null}
 * @param confidence
 *            confidence of the timing insight the values are derived from
 */
public record TuningParameters(Duration temporalWindow, Double typicalSessionMinutes, double confidence) {

    public static TuningParameters none() {
        return new TuningParameters(null, null, 0.0);
    }
}
