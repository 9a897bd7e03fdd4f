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

package me.golemcore.archivist.infrastructure.config;

import lombok.Data;
import me.golemcore.archivist.domain.model.GenerationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Centralized configuration properties for the archivist, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code archivist.*} prefix:
 * <ul>
 * <li>{@link WorkspaceProperties} - workspace root and reserved state
 * directory</li>
 * <li>{@link LifecycleProperties} - aging thresholds and protection</li>
 * <li>{@link ConsolidationProperties} - similarity weights and threshold</li>
 * <li>{@link IndexProperties} - archive index shards, ranking, retry
 * backoff</li>
 * <li>{@link PatternsProperties} - insight computation thresholds</li>
 * <li>{@link SweepsProperties} - optional in-process sweep timer</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "archivist")
@Data
public class ArchivistProperties {

    private WorkspaceProperties workspace = new WorkspaceProperties();
    private LifecycleProperties lifecycle = new LifecycleProperties();
    private ConsolidationProperties consolidation = new ConsolidationProperties();
    private IndexProperties index = new IndexProperties();
    private PatternsProperties patterns = new PatternsProperties();
    private SweepsProperties sweeps = new SweepsProperties();

    @Data
    public static class WorkspaceProperties {
        private String root = "${user.home}/.golemcore/archivist-workspace";
        private String stateDirectory = ".archivist";

        /**
         * Directory of one kind of archivist state, relative to the root.
         */
        public String stateDirectory(String child) {
            return stateDirectory + "/" + child;
        }

        public Path resolveRoot() {
            return Paths.get(root.replace("${user.home}", System.getProperty("user.home")))
                    .toAbsolutePath().normalize();
        }
    }

    @Data
    public static class LifecycleProperties {
        private Duration agingAfter = Duration.ofDays(14);
        private Duration archiveEligibleAfter = Duration.ofDays(30);
        private double protectScore = 8.5;
        private double scoreAgingStretch = 0.1;
        private GenerationMode defaultGenerationMode = GenerationMode.PROFESSIONAL;
    }

    @Data
    public static class ConsolidationProperties {
        private double similarityThreshold = 0.7;
        private double tagWeight = 0.3;
        private double temporalWeight = 0.3;
        private double topicWeight = 0.4;
        private Duration temporalWindow = Duration.ofMinutes(60);
        private Duration minTemporalWindow = Duration.ofMinutes(15);
        private Duration maxTemporalWindow = Duration.ofHours(8);
    }

    @Data
    public static class IndexProperties {
        private String directory = "index";
        private int shardCount = 4;
        private double retentionBoost = 0.25;
        private int defaultResults = 20;
        private int maxResults = 100;
        private int snippetLength = 200;
        private Duration retryInitialBackoff = Duration.ofSeconds(30);
        private Duration retryMaxBackoff = Duration.ofHours(1);
    }

    @Data
    public static class PatternsProperties {
        private int minSequenceOccurrences = 3;
        private int confidenceHalfSample = 5;
        private double tuningMinConfidence = 0.5;
    }

    @Data
    public static class SweepsProperties {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(15);
    }
}
