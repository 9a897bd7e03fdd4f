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

package me.golemcore.archivist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the workspace archivist.
 *
 * <p>
 * The archivist keeps bookkeeping for every file in a single workspace: it
 * scores files for retention, ages idle files through their lifecycle, archives
 * them into an append-only archive log with a rebuildable full-text index, and
 * proposes consolidation of related files.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, SweepScheduler
 * Domain Layer       → Lifecycle, Consolidation, Archive, Patterns services
 * Infrastructure     → Local storage adapter, Lucene archive index
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code archivist.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ArchivistApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArchivistApplication.class, args);
    }

}
