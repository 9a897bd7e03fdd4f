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
 * Merged destination failed validation. Sources are left untouched.
 */
public class ConsolidationValidationException extends ArchivistException {

    private static final long serialVersionUID = 1L;

    public ConsolidationValidationException(String message) {
        super(message);
    }

    public ConsolidationValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
