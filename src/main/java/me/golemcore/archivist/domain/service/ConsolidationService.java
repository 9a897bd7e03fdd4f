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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.component.TopicSimilarityScorer;
import me.golemcore.archivist.domain.component.TopicSimilarityScorer.TopicProfile;
import me.golemcore.archivist.domain.exception.ConsolidationValidationException;
import me.golemcore.archivist.domain.exception.FileNotTrackedException;
import me.golemcore.archivist.domain.exception.RegistrationConflictException;
import me.golemcore.archivist.domain.exception.StorageFailureException;
import me.golemcore.archivist.domain.model.ConsolidationOpportunity;
import me.golemcore.archivist.domain.model.ConsolidationResult;
import me.golemcore.archivist.domain.model.GenerationMode;
import me.golemcore.archivist.domain.model.LifecycleState;
import me.golemcore.archivist.domain.model.MergeAuditEntry;
import me.golemcore.archivist.domain.model.OpportunityKind;
import me.golemcore.archivist.domain.model.RetentionHints;
import me.golemcore.archivist.domain.model.TrackedFile;
import me.golemcore.archivist.domain.model.TuningParameters;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Finds groups of related tracked files and merges them.
 *
 * <p>
 * Pairwise similarity is a weighted sum of tag overlap, temporal proximity and
 * the pluggable {@link TopicSimilarityScorer}. Files are grouped by
 * single-linkage at the configured threshold; the confidence of a group is the
 * minimum pairwise similarity inside it.
 *
 * <p>
 * Applying a merge is all-or-nothing from the caller's point of view: the
 * destination is written and validated before any source changes, the merge
 * is recorded in {@code consolidation/merges.jsonl} with every source's
 * metadata and content, and any failure after the destination write is
 * compensated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsolidationService {

    private static final String WORKSPACE = "";
    private static final String AUDIT_FILE = "merges.jsonl";
    private static final String DESTINATION_DIRECTORY = "consolidated/";
    private static final String CODE_FENCE = "```";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final MetadataStoreService metadataStore;
    private final TopicSimilarityScorer topicSimilarityScorer;
    private final SimilarityClusterer similarityClusterer;
    private final RetentionScorer retentionScorer;
    private final ContentAnalyzer contentAnalyzer;
    private final PatternRecognitionService patternRecognitionService;
    private final PathLockManager pathLockManager;
    private final StoragePort storagePort;
    private final ArchivistProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Scans all tracked files. Opportunities are not persisted; they are
     * ordered by descending confidence.
     */
    public List<ConsolidationOpportunity> identifyOpportunities() {
        List<Candidate> candidates = loadCandidates();
        if (candidates.size() < 2) {
            return List.of();
        }
        Duration window = temporalWindow();
        int size = candidates.size();
        double[][] similarity = new double[size][size];
        double[][] temporal = new double[size][size];
        double[][] topic = new double[size][size];
        for (int i = 0; i < size; i++) {
            similarity[i][i] = 1.0;
            for (int j = i + 1; j < size; j++) {
                Candidate first = candidates.get(i);
                Candidate second = candidates.get(j);
                double tagSignal = KeywordTopicSimilarityScorer.jaccard(tags(first.file()), tags(second.file()));
                double temporalSignal = temporalSimilarity(first.file(), second.file(), window);
                double topicSignal = topicSimilarityScorer.similarity(first.profile(), second.profile());
                double combined = combine(tagSignal, temporalSignal, topicSignal);
                similarity[i][j] = combined;
                similarity[j][i] = combined;
                temporal[i][j] = temporalSignal;
                temporal[j][i] = temporalSignal;
                topic[i][j] = topicSignal;
                topic[j][i] = topicSignal;
            }
        }

        double threshold = properties.getConsolidation().getSimilarityThreshold();
        Set<String> reservedDestinations = new HashSet<>();
        List<ConsolidationOpportunity> opportunities = new ArrayList<>();
        for (SimilarityClusterer.Cluster cluster : similarityClusterer.cluster(similarity, threshold)) {
            List<Candidate> members = cluster.members().stream().map(candidates::get).toList();
            double confidence = Math.floor(cluster.minSimilarity() * 10_000.0) / 10_000.0;
            OpportunityKind kind = classify(members,
                    SimilarityClusterer.minPairwise(temporal, cluster.members()),
                    SimilarityClusterer.minPairwise(topic, cluster.members()));
            opportunities.add(ConsolidationOpportunity.builder()
                    .sourcePaths(members.stream().map(member -> member.file().getPath()).sorted().toList())
                    .destinationPath(suggestDestination(members, reservedDestinations))
                    .confidence(confidence)
                    .kind(kind)
                    .rationale(rationale(members, kind, confidence))
                    .build());
        }
        opportunities.sort(Comparator.comparingDouble(ConsolidationOpportunity::getConfidence).reversed()
                .thenComparing(opportunity -> opportunity.getSourcePaths().get(0)));
        log.debug("[Consolidation] {} opportunities among {} files", opportunities.size(), size);
        return opportunities;
    }

    /**
     * Merges the sources into the destination and removes the sources.
     *
     * @throws ConsolidationValidationException
     *             if the merged content is not well-formed; nothing is changed
     * @throws FileNotTrackedException
     *             if a source is no longer tracked
     * @throws RegistrationConflictException
     *             if the destination already exists
     */
    public ConsolidationResult apply(ConsolidationOpportunity opportunity) {
        List<String> sources = normalizeSources(opportunity);
        String destination = normalizePath(opportunity.getDestinationPath());
        if (sources.contains(destination)) {
            throw new IllegalArgumentException("Destination must differ from every source: " + destination);
        }
        List<String> lockPaths = new ArrayList<>(sources);
        lockPaths.add(destination);

        try (PathLockManager.PathLock ignored = pathLockManager.lockAll(lockPaths)) {
            List<MergeAuditEntry.MergedSource> loaded = new ArrayList<>();
            for (String source : sources) {
                TrackedFile file = metadataStore.get(source);
                String content = readWorkspaceFile(source);
                if (content == null) {
                    throw new ConsolidationValidationException("Source content is missing: " + source);
                }
                loaded.add(MergeAuditEntry.MergedSource.builder().file(file).content(content).build());
            }
            if (metadataStore.contains(destination) || readWorkspaceFile(destination) != null) {
                throw new RegistrationConflictException("Consolidation destination already exists: " + destination);
            }

            String merged = merge(destination, loaded, opportunity);
            validate(destination, merged);

            String mergeId = "merge-" + UUID.randomUUID();
            TrackedFile destinationFile = writeDestination(destination, merged, loaded);
            MergeAuditEntry entry = MergeAuditEntry.builder()
                    .mergeId(mergeId)
                    .action(MergeAuditEntry.Action.MERGED)
                    .timestamp(clock.instant())
                    .destinationPath(destination)
                    .destinationHash(destinationFile.getContentHash())
                    .confidence(opportunity.getConfidence())
                    .kind(opportunity.getKind())
                    .sources(loaded)
                    .build();
            try {
                appendAudit(entry);
            } catch (StorageFailureException e) {
                discardDestination(destination);
                throw e;
            }

            removeSources(mergeId, loaded, destination);
            for (MergeAuditEntry.MergedSource source : loaded) {
                log.info("[Consolidation] {} merged {} (hash={}) into {}", mergeId, source.getFile().getPath(),
                        abbreviate(source.getFile().getContentHash()), destination);
            }
            return ConsolidationResult.builder()
                    .mergeId(mergeId)
                    .destination(destinationFile)
                    .removedSources(new ArrayList<>(sources))
                    .build();
        }
    }

    /**
     * Restores the sources of a merge from the audit log and removes the
     * destination, unless it changed since the merge.
     *
     * @return the restored source files
     */
    public List<TrackedFile> revert(String mergeId) {
        List<MergeAuditEntry> entries = auditEntries();
        MergeAuditEntry merge = entries.stream()
                .filter(entry -> mergeId.equals(entry.getMergeId())
                        && entry.getAction() == MergeAuditEntry.Action.MERGED)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown merge: " + mergeId));
        boolean reverted = entries.stream().anyMatch(entry -> mergeId.equals(entry.getMergeId())
                && entry.getAction() == MergeAuditEntry.Action.REVERTED);
        if (reverted) {
            throw new RegistrationConflictException("Merge already reverted: " + mergeId);
        }

        List<String> lockPaths = new ArrayList<>();
        merge.getSources().forEach(source -> lockPaths.add(source.getFile().getPath()));
        lockPaths.add(merge.getDestinationPath());
        try (PathLockManager.PathLock ignored = pathLockManager.lockAll(lockPaths)) {
            for (MergeAuditEntry.MergedSource source : merge.getSources()) {
                if (metadataStore.contains(source.getFile().getPath())) {
                    throw new RegistrationConflictException("Cannot revert " + mergeId + ", path is tracked again: "
                            + source.getFile().getPath());
                }
            }
            List<TrackedFile> restored = restoreSources(merge.getSources());

            Optional<TrackedFile> destination = metadataStore.find(merge.getDestinationPath());
            if (destination.isPresent() && Objects.equals(destination.get().getContentHash(),
                    merge.getDestinationHash())) {
                discardDestination(merge.getDestinationPath());
            } else if (destination.isPresent()) {
                log.warn("[Consolidation] Destination {} changed since {}, keeping it",
                        merge.getDestinationPath(), mergeId);
            }
            appendAudit(MergeAuditEntry.builder()
                    .mergeId(mergeId)
                    .action(MergeAuditEntry.Action.REVERTED)
                    .timestamp(clock.instant())
                    .destinationPath(merge.getDestinationPath())
                    .destinationHash(merge.getDestinationHash())
                    .confidence(merge.getConfidence())
                    .kind(merge.getKind())
                    .build());
            log.info("[Consolidation] Reverted {}: restored {} sources", mergeId, restored.size());
            return restored;
        }
    }

    public List<MergeAuditEntry> auditEntries() {
        String content;
        try {
            content = storagePort.getText(directory(), AUDIT_FILE).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Reading consolidation audit log", e);
        }
        return JsonlSupport.parse(objectMapper, content, MergeAuditEntry.class, "Consolidation");
    }

    double combine(double tagSignal, double temporalSignal, double topicSignal) {
        ArchivistProperties.ConsolidationProperties config = properties.getConsolidation();
        double weights = config.getTagWeight() + config.getTemporalWeight() + config.getTopicWeight();
        if (weights <= 0) {
            return 0.0;
        }
        return (config.getTagWeight() * tagSignal
                + config.getTemporalWeight() * temporalSignal
                + config.getTopicWeight() * topicSignal) / weights;
    }

    double temporalSimilarity(TrackedFile first, TrackedFile second, Duration window) {
        if (first.getSessionId() != null && first.getSessionId().equals(second.getSessionId())) {
            return 1.0;
        }
        if (first.getCreatedAt() == null || second.getCreatedAt() == null || window.isZero()) {
            return 0.0;
        }
        long distance = Math.abs(Duration.between(first.getCreatedAt(), second.getCreatedAt()).toMillis());
        long windowMillis = window.toMillis();
        if (distance >= windowMillis) {
            return 0.0;
        }
        return 1.0 - (double) distance / windowMillis;
    }

    private Duration temporalWindow() {
        TuningParameters tuning = patternRecognitionService.currentTuning();
        if (tuning.temporalWindow() != null) {
            return tuning.temporalWindow();
        }
        return properties.getConsolidation().getTemporalWindow();
    }

    private List<Candidate> loadCandidates() {
        List<Candidate> candidates = new ArrayList<>();
        for (TrackedFile file : metadataStore.listAll()) {
            if (file.getState() == LifecycleState.ARCHIVED) {
                continue;
            }
            String content;
            try {
                content = readWorkspaceFile(file.getPath());
            } catch (StorageFailureException e) {
                log.warn("[Consolidation] Skipping unreadable {}: {}", file.getPath(), e.getMessage());
                continue;
            }
            if (content == null) {
                continue;
            }
            candidates.add(new Candidate(file, content, topicSimilarityScorer.profile(content)));
        }
        return candidates;
    }

    private OpportunityKind classify(List<Candidate> members, double temporalSignal, double topicSignal) {
        for (Candidate member : members) {
            for (Candidate other : members) {
                if (member != other && mentions(member.content(), other.file().getPath())) {
                    return OpportunityKind.REFERENCE;
                }
            }
        }
        Set<String> outcomes = new HashSet<>();
        boolean allDeclared = true;
        for (Candidate member : members) {
            Optional<String> outcome = contentAnalyzer.outcome(member.content());
            if (outcome.isEmpty()) {
                allDeclared = false;
                break;
            }
            outcomes.add(outcome.get());
        }
        if (allDeclared && outcomes.size() == 1) {
            return OpportunityKind.OUTCOME;
        }
        return temporalSignal > topicSignal ? OpportunityKind.TEMPORAL : OpportunityKind.TOPIC;
    }

    private boolean mentions(String content, String path) {
        String fileName = WorkspacePathSupport.fileName(path).toLowerCase(Locale.ROOT);
        return content.toLowerCase(Locale.ROOT).contains(fileName);
    }

    private String rationale(List<Candidate> members, OpportunityKind kind, double confidence) {
        List<String> reasons = new ArrayList<>();
        Set<String> sharedTags = null;
        for (Candidate member : members) {
            Set<String> tags = tags(member.file());
            if (sharedTags == null) {
                sharedTags = new LinkedHashSet<>(tags);
            } else {
                sharedTags.retainAll(tags);
            }
        }
        if (sharedTags != null && !sharedTags.isEmpty()) {
            reasons.add("shared tags " + sharedTags);
        }
        Set<String> sessions = new HashSet<>();
        members.forEach(member -> sessions.add(member.file().getSessionId()));
        if (sessions.size() == 1 && !sessions.contains(null)) {
            reasons.add("same session " + sessions.iterator().next());
        }
        reasons.add("topic '" + dominantTopic(members) + "'");
        switch (kind) {
        case REFERENCE -> reasons.add("files reference each other");
        case OUTCOME -> reasons.add("same declared outcome");
        default -> {
            // covered by the signals above
        }
        }
        return String.format(Locale.ROOT, "%d %s files: %s (minimum pairwise similarity %.2f)",
                members.size(), kind.name().toLowerCase(Locale.ROOT), String.join(", ", reasons), confidence);
    }

    private String suggestDestination(List<Candidate> members, Set<String> reserved) {
        String extension = commonExtension(members.stream().map(member -> member.file().getPath()).toList());
        String base = DESTINATION_DIRECTORY + slug(dominantTopic(members)) + "-" + DAY.format(clock.instant());
        String candidate = base + "." + extension;
        int suffix = 2;
        while (reserved.contains(candidate) || metadataStore.contains(candidate)
                || workspaceFileExists(candidate)) {
            candidate = base + "-" + suffix + "." + extension;
            suffix++;
        }
        reserved.add(candidate);
        return candidate;
    }

    private String dominantTopic(List<Candidate> members) {
        Map<String, Integer> topics = new TreeMap<>();
        for (Candidate member : members) {
            topics.merge(member.profile().dominantTopic(), 1, Integer::sum);
        }
        return topics.entrySet().stream()
                .max(Map.Entry.<String, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey().reversed()))
                .map(Map.Entry::getKey)
                .orElse(ContentAnalyzer.GENERAL_CATEGORY);
    }

    private static String commonExtension(List<String> paths) {
        Set<String> extensions = new HashSet<>();
        for (String path : paths) {
            extensions.add(WorkspacePathSupport.extension(path));
        }
        if (extensions.size() == 1 && !extensions.contains("")) {
            return extensions.iterator().next();
        }
        return "md";
    }

    private static String slug(String value) {
        String slug = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? ContentAnalyzer.GENERAL_CATEGORY : slug;
    }

    private String merge(String destination, List<MergeAuditEntry.MergedSource> sources,
            ConsolidationOpportunity opportunity) {
        if (isJson(destination)) {
            ObjectNode merged = objectMapper.createObjectNode();
            for (MergeAuditEntry.MergedSource source : sources) {
                try {
                    JsonNode node = objectMapper.readTree(source.getContent());
                    merged.set(source.getFile().getPath(), node);
                } catch (IOException e) {
                    throw new ConsolidationValidationException(
                            "Source is not valid JSON: " + source.getFile().getPath(), e);
                }
            }
            try {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(merged) + "\n";
            } catch (JsonProcessingException e) {
                throw new ConsolidationValidationException("Merged JSON could not be written", e);
            }
        }
        StringBuilder merged = new StringBuilder();
        merged.append("# Consolidated: ").append(WorkspacePathSupport.baseName(destination)).append("\n\n");
        merged.append("Sources: ");
        merged.append(String.join(", ", sources.stream().map(source -> source.getFile().getPath()).toList()));
        merged.append("\n");
        if (opportunity.getRationale() != null && !opportunity.getRationale().isBlank()) {
            merged.append("Rationale: ").append(opportunity.getRationale().trim()).append("\n");
        }
        for (MergeAuditEntry.MergedSource source : sources) {
            merged.append("\n## ").append(source.getFile().getPath()).append("\n\n");
            merged.append(source.getContent().strip()).append("\n");
        }
        return merged.toString();
    }

    void validate(String destination, String content) {
        if (content == null || content.isBlank()) {
            throw new ConsolidationValidationException("Merged content is empty: " + destination);
        }
        if (isJson(destination)) {
            try {
                objectMapper.readTree(content);
            } catch (IOException e) {
                throw new ConsolidationValidationException("Merged content is not valid JSON: " + destination, e);
            }
            return;
        }
        int fences = 0;
        for (String line : content.split("\\R")) {
            if (line.trim().startsWith(CODE_FENCE)) {
                fences++;
            }
        }
        if (fences % 2 != 0) {
            throw new ConsolidationValidationException("Merged content has an unclosed code fence: " + destination);
        }
    }

    private TrackedFile writeDestination(String destination, String merged,
            List<MergeAuditEntry.MergedSource> sources) {
        String hash = contentAnalyzer.hash(merged);
        try {
            storagePort.putTextAtomic(WORKSPACE, destination, merged).join();
        } catch (RuntimeException e) {
            discardDestinationFile(destination);
            throw StorageFailureException.wrap("Writing consolidation destination " + destination, e);
        }
        String written = readWorkspaceFile(destination);
        if (written == null || !hash.equals(contentAnalyzer.hash(written))) {
            discardDestinationFile(destination);
            throw new ConsolidationValidationException("Destination did not verify after write: " + destination);
        }

        Instant now = clock.instant();
        RetentionHints hints = mergedHints(sources);
        GenerationMode mode = hints.getGenerationMode();
        double sourceMax = sources.stream().mapToDouble(source -> source.getFile().getRetentionScore()).max()
                .orElse(0.0);
        TrackedFile file = TrackedFile.builder()
                .path(destination)
                .contentHash(hash)
                .contentLength(merged.length())
                .createdAt(now)
                .lastAccessedAt(now)
                .lastModifiedAt(now)
                .stateChangedAt(now)
                .retentionScore(Math.max(sourceMax, retentionScorer.score(merged, mode, hints)))
                .state(LifecycleState.ACTIVE)
                .generationMode(mode)
                .tags(hints.getTags())
                .sessionId(hints.getSessionId())
                .retentionDays(hints.getRetentionDays())
                .stakeholders(hints.getStakeholders())
                .frameworks(hints.getFrameworks())
                .build();
        try {
            return metadataStore.register(file, false);
        } catch (RuntimeException e) {
            discardDestinationFile(destination);
            throw e;
        }
    }

    private RetentionHints mergedHints(List<MergeAuditEntry.MergedSource> sources) {
        Set<String> tags = new LinkedHashSet<>();
        Set<String> stakeholders = new LinkedHashSet<>();
        Set<String> frameworks = new LinkedHashSet<>();
        Set<String> sessions = new HashSet<>();
        GenerationMode mode = null;
        Integer retentionDays = null;
        for (MergeAuditEntry.MergedSource source : sources) {
            TrackedFile file = source.getFile();
            tags.addAll(tags(file));
            if (file.getStakeholders() != null) {
                stakeholders.addAll(file.getStakeholders());
            }
            if (file.getFrameworks() != null) {
                frameworks.addAll(file.getFrameworks());
            }
            sessions.add(file.getSessionId());
            if (file.getGenerationMode() != null
                    && (mode == null || file.getGenerationMode().getBandHigh() > mode.getBandHigh())) {
                mode = file.getGenerationMode();
            }
            if (file.getRetentionDays() != null
                    && (retentionDays == null || file.getRetentionDays() > retentionDays)) {
                retentionDays = file.getRetentionDays();
            }
        }
        return RetentionHints.builder()
                .tags(tags)
                .stakeholders(new ArrayList<>(stakeholders))
                .frameworks(new ArrayList<>(frameworks))
                .generationMode(mode != null ? mode : properties.getLifecycle().getDefaultGenerationMode())
                .retentionDays(retentionDays)
                .sessionId(sessions.size() == 1 ? sessions.iterator().next() : null)
                .build();
    }

    private void removeSources(String mergeId, List<MergeAuditEntry.MergedSource> sources, String destination) {
        List<MergeAuditEntry.MergedSource> removed = new ArrayList<>();
        try {
            for (MergeAuditEntry.MergedSource source : sources) {
                metadataStore.remove(source.getFile().getPath());
                removed.add(source);
            }
        } catch (StorageFailureException e) {
            log.error("[Consolidation] {} failed at {} while removing sources, restoring {} and discarding {}",
                    mergeId, clock.instant(), removed.size(), destination);
            restoreSources(removed);
            discardDestination(destination);
            appendAuditQuietly(MergeAuditEntry.builder()
                    .mergeId(mergeId)
                    .action(MergeAuditEntry.Action.REVERTED)
                    .timestamp(clock.instant())
                    .destinationPath(destination)
                    .build());
            throw e;
        }
        for (MergeAuditEntry.MergedSource source : sources) {
            try {
                storagePort.deleteObject(WORKSPACE, source.getFile().getPath()).join();
            } catch (RuntimeException e) {
                log.warn("[Consolidation] {} merged {} but its workspace file could not be deleted: {}",
                        mergeId, source.getFile().getPath(), e.getMessage());
            }
        }
    }

    private List<TrackedFile> restoreSources(List<MergeAuditEntry.MergedSource> sources) {
        List<TrackedFile> restored = new ArrayList<>();
        Instant now = clock.instant();
        for (MergeAuditEntry.MergedSource source : sources) {
            TrackedFile file = source.getFile().copy();
            file.setState(LifecycleState.ACTIVE);
            file.setLastAccessedAt(now);
            file.setStateChangedAt(now);
            try {
                storagePort.putTextAtomic(WORKSPACE, file.getPath(), source.getContent()).join();
            } catch (RuntimeException e) {
                throw StorageFailureException.wrap("Restoring " + file.getPath(), e);
            }
            restored.add(metadataStore.register(file, true));
        }
        return restored;
    }

    private void discardDestination(String destination) {
        try {
            metadataStore.remove(destination);
        } catch (StorageFailureException e) {
            log.error("[Consolidation] Failed to remove destination metadata {}: {}", destination, e.getMessage());
        }
        discardDestinationFile(destination);
    }

    private void discardDestinationFile(String destination) {
        try {
            storagePort.deleteObject(WORKSPACE, destination).join();
        } catch (RuntimeException e) {
            log.error("[Consolidation] Failed to delete destination file {}: {}", destination, e.getMessage());
        }
    }

    private void appendAudit(MergeAuditEntry entry) {
        try {
            String existing = storagePort.getText(directory(), AUDIT_FILE).join();
            String line = JsonlSupport.line(objectMapper, entry);
            String payload = JsonlSupport.endsTorn(existing) ? "\n" + line : line;
            storagePort.appendText(directory(), AUDIT_FILE, payload).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Appending consolidation audit entry " + entry.getMergeId(), e);
        }
    }

    private void appendAuditQuietly(MergeAuditEntry entry) {
        try {
            appendAudit(entry);
        } catch (StorageFailureException e) {
            log.error("[Consolidation] Failed to record revert of {}: {}", entry.getMergeId(), e.getMessage());
        }
    }

    private List<String> normalizeSources(ConsolidationOpportunity opportunity) {
        if (opportunity == null || opportunity.getSourcePaths() == null) {
            throw new IllegalArgumentException("Opportunity with source paths is required");
        }
        Set<String> sources = new LinkedHashSet<>();
        for (String source : opportunity.getSourcePaths()) {
            sources.add(normalizePath(source));
        }
        if (sources.size() < 2) {
            throw new IllegalArgumentException("A consolidation needs at least two distinct sources");
        }
        return sources.stream().sorted().toList();
    }

    private String readWorkspaceFile(String path) {
        try {
            return storagePort.getText(WORKSPACE, path).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Reading " + path, e);
        }
    }

    private boolean workspaceFileExists(String path) {
        try {
            return Boolean.TRUE.equals(storagePort.exists(WORKSPACE, path).join());
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Checking " + path, e);
        }
    }

    private static boolean isJson(String path) {
        return "json".equals(WorkspacePathSupport.extension(path));
    }

    private static Set<String> tags(TrackedFile file) {
        Set<String> tags = new LinkedHashSet<>();
        if (file.getTags() != null) {
            for (String tag : file.getTags()) {
                tags.add(tag.toLowerCase(Locale.ROOT));
            }
        }
        return tags;
    }

    private String normalizePath(String rawPath) {
        return WorkspacePathSupport.normalize(rawPath, properties.getWorkspace().getStateDirectory());
    }

    private String directory() {
        return properties.getWorkspace().stateDirectory("consolidation");
    }

    private static String abbreviate(String hash) {
        return hash != null && hash.length() > 12 ? hash.substring(0, 12) : hash;
    }

    private record Candidate(TrackedFile file, String content, TopicProfile profile) {
    }
}
