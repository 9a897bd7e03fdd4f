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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes caller-supplied paths to the workspace-relative form used as
 * metadata keys.
 */
public final class WorkspacePathSupport {

    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:.*");

    private WorkspacePathSupport() {
    }

    /**
     * @throws IllegalArgumentException
     *             for blank, absolute or escaping paths and for paths inside the
     *             reserved state directory
     */
    public static String normalize(String rawPath, String stateDirectory) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("Path is required");
        }
        String path = rawPath.trim().replace('\\', '/');
        if (path.startsWith("/") || DRIVE_LETTER.matcher(path).matches()) {
            throw new IllegalArgumentException("Path must be relative to the workspace root: " + rawPath);
        }
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                throw new IllegalArgumentException("Path escapes the workspace root: " + rawPath);
            }
            segments.add(segment);
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Path is required");
        }
        if (segments.get(0).equals(stateDirectory)) {
            throw new IllegalArgumentException("Path is inside the reserved state directory: " + rawPath);
        }
        return String.join("/", segments);
    }

    public static String extension(String path) {
        String fileName = fileName(path);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    public static String baseName(String path) {
        String fileName = fileName(path);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
