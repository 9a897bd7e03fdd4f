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

package me.golemcore.archivist.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reading and writing of append-only JSONL logs. A torn or invalid line (for
 * example the tail of an interrupted append) is skipped, never fatal.
 */
@Slf4j
final class JsonlSupport {

    private JsonlSupport() {
    }

    static <T> List<T> parse(ObjectMapper objectMapper, String content, Class<T> type, String logTag) {
        List<T> entries = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return entries;
        }
        int lineNumber = 0;
        for (String line : content.split("\\R")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, type));
            } catch (IOException | RuntimeException e) {
                log.warn("[{}] Skipping invalid log line {}: {}", logTag, lineNumber, e.getMessage());
            }
        }
        return entries;
    }

    /**
     * True when the last append was cut short, so the next one must start on a
     * fresh line.
     */
    static boolean endsTorn(String content) {
        return content != null && !content.isEmpty() && !content.endsWith("\n");
    }

    static String line(ObjectMapper objectMapper, Object entry) {
        try {
            return objectMapper.writeValueAsString(entry) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + entry.getClass().getSimpleName(), e);
        }
    }
}
