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

package me.golemcore.archivist.domain.exception;

/**
 * Registration of an already tracked path with different content and without
 * an explicit update intent.
 */
public class RegistrationConflictException extends ArchivistException {

    private static final long serialVersionUID = 1L;

    public RegistrationConflictException(String path, String existingHash, String newHash) {
        super("Path already tracked with different content: " + path
                + " (tracked " + abbreviate(existingHash) + ", new " + abbreviate(newHash) + ")");
    }

    public RegistrationConflictException(String message) {
        super(message);
    }

    private static String abbreviate(String hash) {
        return hash != null && hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
