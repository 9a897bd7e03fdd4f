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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.exception.StorageFailureException;
import me.golemcore.archivist.domain.model.InsightGeneration;
import me.golemcore.archivist.domain.model.InsightKind;
import me.golemcore.archivist.domain.model.PatternInsight;
import me.golemcore.archivist.domain.model.SessionRecord;
import me.golemcore.archivist.domain.model.TuningParameters;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Learns from recorded working sessions.
 *
 * <p>
 * Sessions are appended to {@code patterns/sessions.jsonl}. Insights are a
 * pure function of that log: they never look at live tracked files, and the
 * generation timestamp is taken from the newest session, so the same history
 * always yields equal insights. Each refresh that sees new history appends a
 * generation to {@code patterns/insights.jsonl}; older generations are kept
 * for audit. Other components only consume {@link #currentTuning()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternRecognitionService {

    private static final String SESSIONS_FILE = "sessions.jsonl";
    private static final String INSIGHTS_FILE = "insights.jsonl";
    private static final String NO_EXTENSION = "(none)";

    private final StoragePort storagePort;
    private final ArchivistProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Appends one session to the history.
     */
    public synchronized SessionRecord recordSession(String sessionId, List<String> files, String outcome,
            double durationMinutes) {
        if (Double.isNaN(durationMinutes) || Double.isInfinite(durationMinutes) || durationMinutes < 0) {
            throw new IllegalArgumentException("Session duration must be a non-negative number of minutes");
        }
        List<String> normalizedFiles = new ArrayList<>();
        if (files != null) {
            for (String file : files) {
                if (file != null && !file.isBlank()) {
                    normalizedFiles.add(file.trim().replace('\\', '/'));
                }
            }
        }
        SessionRecord session = SessionRecord.builder()
                .sessionId(sessionId != null && !sessionId.isBlank() ? sessionId.trim()
                        : "session-" + UUID.randomUUID())
                .recordedAt(clock.instant())
                .files(normalizedFiles)
                .outcome(outcome != null && !outcome.isBlank() ? outcome.trim() : null)
                .durationMinutes(durationMinutes)
                .build();
        append(SESSIONS_FILE, session);
        log.info("[Patterns] Recorded session {} ({} files, {} min)", session.getSessionId(),
                normalizedFiles.size(), durationMinutes);
        return session;
    }

    public List<SessionRecord> history() {
        return JsonlSupport.parse(objectMapper, read(SESSIONS_FILE), SessionRecord.class, "Patterns");
    }

    public List<PatternInsight> computeInsights() {
        return computeInsights(history());
    }

    /**
     * Appends a new insight generation when the history grew since the last
     * one.
     */
    public synchronized InsightGeneration refreshInsights() {
        List<SessionRecord> sessions = history();
        Optional<InsightGeneration> latest = latestGeneration();
        if (latest.isPresent() && latest.get().getSessionCount() == sessions.size()) {
            return latest.get();
        }
        List<PatternInsight> insights = computeInsights(sessions);
        InsightGeneration generation = InsightGeneration.builder()
                .generation(latest.map(InsightGeneration::getGeneration).orElse(0) + 1)
                .sessionCount(sessions.size())
                .generatedAt(newestSession(sessions))
                .insights(insights)
                .build();
        append(INSIGHTS_FILE, generation);
        log.info("[Patterns] Insight generation {} from {} sessions ({} insights)",
                generation.getGeneration(), sessions.size(), insights.size());
        return generation;
    }

    public Optional<InsightGeneration> latestGeneration() {
        List<InsightGeneration> generations = JsonlSupport.parse(objectMapper, read(INSIGHTS_FILE),
                InsightGeneration.class, "Patterns");
        return generations.isEmpty() ? Optional.empty() : Optional.of(generations.get(generations.size() - 1));
    }

    /**
     * Tuning derived from the latest appended generation. Values are only
     * provided when the timing insight is confident enough.
     */
    public TuningParameters currentTuning() {
        Optional<PatternInsight> timing = latestGeneration()
                .flatMap(generation -> generation.getInsights().stream()
                        .filter(insight -> insight.getKind() == InsightKind.TIMING)
                        .findFirst());
        if (timing.isEmpty() || timing.get().getConfidence() < properties.getPatterns().getTuningMinConfidence()) {
            return TuningParameters.none();
        }
        ArchivistProperties.ConsolidationProperties consolidation = properties.getConsolidation();
        Duration window = Duration.ofSeconds(Math.round(timing.get().getValue() * 60.0));
        if (window.compareTo(consolidation.getMinTemporalWindow()) < 0) {
            window = consolidation.getMinTemporalWindow();
        }
        if (window.compareTo(consolidation.getMaxTemporalWindow()) > 0) {
            window = consolidation.getMaxTemporalWindow();
        }
        return new TuningParameters(window, timing.get().getValue(), timing.get().getConfidence());
    }

    List<PatternInsight> computeInsights(List<SessionRecord> sessions) {
        List<PatternInsight> insights = new ArrayList<>();
        if (sessions.isEmpty()) {
            return insights;
        }
        Instant generatedAt = newestSession(sessions);
        workflowInsight(sessions, generatedAt).ifPresent(insights::add);
        insights.add(timingInsight(sessions, generatedAt));
        contentInsight(sessions, generatedAt).ifPresent(insights::add);
        outcomeInsight(sessions, generatedAt).ifPresent(insights::add);
        return insights;
    }

    private Optional<PatternInsight> workflowInsight(List<SessionRecord> sessions, Instant generatedAt) {
        Map<String, Integer> transitions = new TreeMap<>();
        for (SessionRecord session : sessions) {
            List<String> files = session.getFiles() != null ? session.getFiles() : List.of();
            for (int i = 1; i < files.size(); i++) {
                String transition = extensionOf(files.get(i - 1)) + " -> " + extensionOf(files.get(i));
                transitions.merge(transition, 1, Integer::sum);
            }
        }
        Optional<Map.Entry<String, Integer>> top = transitions.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey().reversed()));
        if (top.isEmpty() || top.get().getValue() < properties.getPatterns().getMinSequenceOccurrences()) {
            return Optional.empty();
        }
        int occurrences = top.get().getValue();
        return Optional.of(PatternInsight.builder()
                .kind(InsightKind.WORKFLOW)
                .name("frequent_transition")
                .sampleCount(occurrences)
                .value(occurrences)
                .description(top.get().getKey())
                .confidence(confidence(occurrences))
                .generatedAt(generatedAt)
                .build());
    }

    private PatternInsight timingInsight(List<SessionRecord> sessions, Instant generatedAt) {
        List<Double> durations = sessions.stream()
                .map(SessionRecord::getDurationMinutes)
                .sorted()
                .toList();
        int size = durations.size();
        double median = size % 2 == 1
                ? durations.get(size / 2)
                : (durations.get(size / 2 - 1) + durations.get(size / 2)) / 2.0;
        median = round(median);
        return PatternInsight.builder()
                .kind(InsightKind.TIMING)
                .name("median_session_minutes")
                .sampleCount(size)
                .value(median)
                .description("median session lasts " + median + " minutes")
                .confidence(confidence(size))
                .generatedAt(generatedAt)
                .build();
    }

    private Optional<PatternInsight> contentInsight(List<SessionRecord> sessions, Instant generatedAt) {
        Map<String, Integer> extensions = new TreeMap<>();
        int totalFiles = 0;
        for (SessionRecord session : sessions) {
            List<String> files = session.getFiles() != null ? session.getFiles() : List.of();
            totalFiles += files.size();
            for (String file : files) {
                extensions.merge(extensionOf(file), 1, Integer::sum);
            }
        }
        if (totalFiles == 0) {
            return Optional.empty();
        }
        String dominant = extensions.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey().reversed()))
                .map(Map.Entry::getKey)
                .orElse(NO_EXTENSION);
        return Optional.of(PatternInsight.builder()
                .kind(InsightKind.CONTENT)
                .name("files_per_session")
                .sampleCount(sessions.size())
                .value(round((double) totalFiles / sessions.size()))
                .description("dominant file type: " + dominant)
                .confidence(confidence(sessions.size()))
                .generatedAt(generatedAt)
                .build());
    }

    private Optional<PatternInsight> outcomeInsight(List<SessionRecord> sessions, Instant generatedAt) {
        Map<String, Integer> outcomes = new TreeMap<>();
        int withOutcome = 0;
        for (SessionRecord session : sessions) {
            if (session.getOutcome() != null && !session.getOutcome().isBlank()) {
                outcomes.merge(session.getOutcome().trim().toLowerCase(Locale.ROOT), 1, Integer::sum);
                withOutcome++;
            }
        }
        if (withOutcome == 0) {
            return Optional.empty();
        }
        Map.Entry<String, Integer> dominant = outcomes.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey().reversed()))
                .orElseThrow();
        return Optional.of(PatternInsight.builder()
                .kind(InsightKind.OUTCOME)
                .name("dominant_outcome_share")
                .sampleCount(withOutcome)
                .value(round((double) dominant.getValue() / withOutcome))
                .description(dominant.getKey())
                .confidence(confidence(withOutcome))
                .generatedAt(generatedAt)
                .build());
    }

    private double confidence(int samples) {
        int halfSample = Math.max(1, properties.getPatterns().getConfidenceHalfSample());
        return round((double) samples / (samples + halfSample));
    }

    private static Instant newestSession(List<SessionRecord> sessions) {
        return sessions.stream()
                .map(SessionRecord::getRecordedAt)
                .filter(instant -> instant != null)
                .max(Comparator.naturalOrder())
                .orElse(Instant.EPOCH);
    }

    private static String extensionOf(String file) {
        String extension = WorkspacePathSupport.extension(file);
        return extension.isEmpty() ? NO_EXTENSION : extension;
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    private void append(String file, Object entry) {
        String content = read(file);
        String line = JsonlSupport.line(objectMapper, entry);
        String payload = JsonlSupport.endsTorn(content) ? "\n" + line : line;
        try {
            storagePort.appendText(directory(), file, payload).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Appending to patterns/" + file, e);
        }
    }

    private String read(String file) {
        try {
            return storagePort.getText(directory(), file).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Reading patterns/" + file, e);
        }
    }

    private String directory() {
        return properties.getWorkspace().stateDirectory("patterns");
    }
}
