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

package me.golemcore.archivist.adapter.outbound.index;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.domain.model.ArchiveSearchQuery;
import me.golemcore.archivist.domain.model.IndexDocument;
import me.golemcore.archivist.domain.model.SearchHit;
import me.golemcore.archivist.domain.model.SearchResult;
import me.golemcore.archivist.domain.model.SegmentHealth;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.ArchiveIndexPort;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.MultiReader;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Apache Lucene implementation of {@link ArchiveIndexPort}.
 *
 * <p>
 * The index is split into {@code archivist.index.shard-count} shards under
 * {@code <state>/index/shard-<n>}; a record lives in shard
 * {@code floorMod(archiveId.hashCode(), shardCount)}. Searches run over a
 * {@link MultiReader} of the shards that open cleanly, so one corrupt shard
 * only removes its own hits and is reported as degraded.
 *
 * <p>
 * Ranking is BM25 over an analyzed catch-all field, boosted by the retention
 * score: {@code bm25 * (1 + retentionBoost * score / 10)}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LuceneArchiveIndexAdapter implements ArchiveIndexPort {

    static final String FIELD_ID = "archiveId";
    static final String FIELD_PATH = "originalPath";
    static final String FIELD_BODY = "body";
    static final String FIELD_CONTENT = "content";
    static final String FIELD_SUMMARY = "summary";
    static final String FIELD_TAG = "tag";
    static final String FIELD_CATEGORY = "category";
    static final String FIELD_ARCHIVED_AT = "archivedAt";
    static final String FIELD_SCORE = "retentionScore";

    private final ArchivistProperties properties;

    private final ReadWriteLock rebuildLock = new ReentrantReadWriteLock();
    private Analyzer analyzer;
    private Path indexRoot;
    private Object[] shardMonitors;

    @PostConstruct
    public void init() {
        ArchivistProperties.WorkspaceProperties workspace = properties.getWorkspace();
        this.indexRoot = workspace.resolveRoot()
                .resolve(workspace.getStateDirectory())
                .resolve(properties.getIndex().getDirectory());
        this.analyzer = new StandardAnalyzer();
        int shardCount = shardCount();
        this.shardMonitors = new Object[shardCount];
        for (int shard = 0; shard < shardCount; shard++) {
            shardMonitors[shard] = new Object();
            try {
                ensureShard(shard);
            } catch (IOException | RuntimeException e) {
                log.warn("[ArchiveIndex] Shard {} could not be initialized, it will be reported as degraded: {}",
                        shard, e.getMessage());
            }
        }
        log.info("[ArchiveIndex] Lucene index at {} with {} shards", indexRoot, shardCount);
    }

    @PreDestroy
    public void close() {
        if (analyzer != null) {
            analyzer.close();
        }
    }

    @Override
    public void ingest(IndexDocument document) {
        ArchiveRecord record = document.record();
        int shard = shardOf(record.getArchiveId());
        rebuildLock.readLock().lock();
        try {
            synchronized (shardMonitors[shard]) {
                try (Directory directory = FSDirectory.open(shardPath(shard));
                        IndexWriter writer = new IndexWriter(directory,
                                writerConfig(IndexWriterConfig.OpenMode.CREATE_OR_APPEND))) {
                    writer.updateDocument(new Term(FIELD_ID, record.getArchiveId()), toDocument(document));
                    writer.commit();
                }
            }
            log.debug("[ArchiveIndex] Ingested {} into shard {}", record.getArchiveId(), shard);
        } catch (IOException e) {
            throw new UncheckedIOException("Index ingestion failed for " + record.getArchiveId()
                    + " (shard " + shard + ")", e);
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    @Override
    public void delete(String archiveId) {
        int shard = shardOf(archiveId);
        rebuildLock.readLock().lock();
        try {
            synchronized (shardMonitors[shard]) {
                try (Directory directory = FSDirectory.open(shardPath(shard));
                        IndexWriter writer = new IndexWriter(directory,
                                writerConfig(IndexWriterConfig.OpenMode.CREATE_OR_APPEND))) {
                    writer.deleteDocuments(new Term(FIELD_ID, archiveId));
                    writer.commit();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Index delete failed for " + archiveId + " (shard " + shard + ")", e);
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    @Override
    public SearchResult search(ArchiveSearchQuery query) {
        rebuildLock.readLock().lock();
        List<Integer> degraded = new ArrayList<>();
        List<OpenShard> open = new ArrayList<>();
        try {
            for (int shard = 0; shard < shardCount(); shard++) {
                OpenShard openShard = openShard(shard);
                if (openShard != null) {
                    open.add(openShard);
                } else {
                    degraded.add(shard);
                }
            }

            List<String> terms = analyze(query.getText());
            Query luceneQuery = buildQuery(terms, query);
            List<SearchHit> hits = collectAcrossShards(open, luceneQuery, terms, degraded);

            hits.sort(Comparator.comparingDouble(SearchHit::getRelevance).reversed()
                    .thenComparing(SearchHit::getArchivedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(SearchHit::getArchiveId));
            int total = hits.size();
            int limit = query.getLimit() > 0 ? query.getLimit() : total;
            List<SearchHit> page = new ArrayList<>(hits.subList(0, Math.min(limit, total)));
            degraded.sort(Comparator.naturalOrder());
            return SearchResult.builder()
                    .hits(page)
                    .totalHits(total)
                    .partialResult(!degraded.isEmpty())
                    .degradedSegments(degraded)
                    .build();
        } finally {
            for (OpenShard openShard : open) {
                openShard.closeQuietly();
            }
            rebuildLock.readLock().unlock();
        }
    }

    @Override
    public int rebuild(Supplier<? extends Iterable<IndexDocument>> documents, BooleanSupplier interrupted) {
        rebuildLock.writeLock().lock();
        int shardCount = shardCount();
        List<Directory> directories = new ArrayList<>();
        List<IndexWriter> writers = new ArrayList<>();
        int indexed = 0;
        try {
            for (int shard = 0; shard < shardCount; shard++) {
                wipeShard(shard);
                Directory directory = FSDirectory.open(shardPath(shard));
                directories.add(directory);
                writers.add(new IndexWriter(directory, writerConfig(IndexWriterConfig.OpenMode.CREATE)));
            }
            for (IndexDocument document : documents.get()) {
                if (interrupted.getAsBoolean()) {
                    log.warn("[ArchiveIndex] Rebuild interrupted after {} documents", indexed);
                    break;
                }
                String archiveId = document.record().getArchiveId();
                writers.get(shardOf(archiveId)).updateDocument(new Term(FIELD_ID, archiveId), toDocument(document));
                indexed++;
            }
            for (IndexWriter writer : writers) {
                writer.commit();
            }
            log.info("[ArchiveIndex] Rebuilt {} shards with {} documents", shardCount, indexed);
            return indexed;
        } catch (IOException e) {
            throw new UncheckedIOException("Index rebuild failed after " + indexed + " documents", e);
        } finally {
            closeAll(writers, directories);
            rebuildLock.writeLock().unlock();
        }
    }

    @Override
    public List<SegmentHealth> segmentHealth() {
        rebuildLock.readLock().lock();
        try {
            List<SegmentHealth> health = new ArrayList<>();
            for (int shard = 0; shard < shardCount(); shard++) {
                try (Directory directory = FSDirectory.open(shardPath(shard));
                        DirectoryReader reader = DirectoryReader.open(directory)) {
                    health.add(new SegmentHealth(shard, true, reader.numDocs(), null));
                } catch (IOException | RuntimeException e) {
                    health.add(new SegmentHealth(shard, false, 0, e.getMessage()));
                }
            }
            return health;
        } finally {
            rebuildLock.readLock().unlock();
        }
    }

    int shardOf(String archiveId) {
        return Math.floorMod(archiveId.hashCode(), shardCount());
    }

    Path shardPath(int shard) {
        return indexRoot.resolve("shard-" + shard);
    }

    private int shardCount() {
        return Math.max(1, properties.getIndex().getShardCount());
    }

    private IndexWriterConfig writerConfig(IndexWriterConfig.OpenMode mode) {
        IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(mode);
        return config;
    }

    private void ensureShard(int shard) throws IOException {
        Path path = shardPath(shard);
        Files.createDirectories(path);
        try (Directory directory = FSDirectory.open(path)) {
            if (DirectoryReader.indexExists(directory)) {
                return;
            }
            try (IndexWriter writer = new IndexWriter(directory,
                    writerConfig(IndexWriterConfig.OpenMode.CREATE_OR_APPEND))) {
                writer.commit();
            }
        }
    }

    private void wipeShard(int shard) throws IOException {
        Path path = shardPath(shard);
        Files.createDirectories(path);
        try (Stream<Path> files = Files.list(path)) {
            for (Path file : files.toList()) {
                Files.deleteIfExists(file);
            }
        }
    }

    private OpenShard openShard(int shard) {
        Directory directory = null;
        try {
            directory = FSDirectory.open(shardPath(shard));
            DirectoryReader reader = DirectoryReader.open(directory);
            return new OpenShard(shard, directory, reader);
        } catch (IOException | RuntimeException e) {
            log.warn("[ArchiveIndex] Shard {} unreadable, searching remaining shards: {}", shard, e.getMessage());
            if (directory != null) {
                try {
                    directory.close();
                } catch (IOException closeError) {
                    log.debug("[ArchiveIndex] Failed to close shard {} directory", shard, closeError);
                }
            }
            return null;
        }
    }

    private List<SearchHit> collectAcrossShards(List<OpenShard> open, Query query, List<String> terms,
            List<Integer> degraded) {
        if (open.isEmpty()) {
            return new ArrayList<>();
        }
        IndexReader[] readers = open.stream().map(OpenShard::reader).toArray(IndexReader[]::new);
        try (MultiReader multiReader = new MultiReader(readers, false)) {
            return collect(multiReader, query, terms);
        } catch (IOException | RuntimeException e) {
            // a shard that opened can still fail while reading postings; isolate it
            log.warn("[ArchiveIndex] Combined search failed, retrying shard by shard: {}", e.getMessage());
        }
        List<SearchHit> hits = new ArrayList<>();
        for (OpenShard shard : open) {
            try {
                hits.addAll(collect(shard.reader(), query, terms));
            } catch (IOException | RuntimeException e) {
                log.warn("[ArchiveIndex] Shard {} failed during search: {}", shard.shard(), e.getMessage());
                degraded.add(shard.shard());
            }
        }
        return hits;
    }

    private List<SearchHit> collect(IndexReader reader, Query query, List<String> terms) throws IOException {
        List<SearchHit> hits = new ArrayList<>();
        if (reader.numDocs() == 0) {
            return hits;
        }
        IndexSearcher searcher = new IndexSearcher(reader);
        TopDocs topDocs = searcher.search(query, reader.numDocs());
        StoredFields storedFields = searcher.storedFields();
        for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
            Document document = storedFields.document(scoreDoc.doc);
            hits.add(toHit(document, scoreDoc.score, terms));
        }
        return hits;
    }

    private SearchHit toHit(Document document, float bm25, List<String> terms) {
        String archiveId = document.get(FIELD_ID);
        double retentionScore = numeric(document, FIELD_SCORE);
        double relevance = terms.isEmpty()
                ? retentionScore / 10.0
                : bm25 * (1.0 + properties.getIndex().getRetentionBoost() * retentionScore / 10.0);
        IndexableField archivedAtField = document.getField(FIELD_ARCHIVED_AT);
        Instant archivedAt = archivedAtField != null
                ? Instant.ofEpochMilli(archivedAtField.numericValue().longValue())
                : null;
        List<String> tags = new ArrayList<>();
        for (IndexableField tag : document.getFields(FIELD_TAG)) {
            tags.add(tag.stringValue());
        }
        return SearchHit.builder()
                .archiveId(archiveId)
                .originalPath(document.get(FIELD_PATH))
                .category(document.get(FIELD_CATEGORY))
                .tags(tags)
                .archivedAt(archivedAt)
                .retentionScore(retentionScore)
                .relevance(Math.round(relevance * 10_000.0) / 10_000.0)
                .snippet(snippet(document.get(FIELD_CONTENT), document.get(FIELD_SUMMARY), terms))
                .segment(shardOf(archiveId))
                .build();
    }

    private double numeric(Document document, String field) {
        IndexableField value = document.getField(field);
        return value != null && value.numericValue() != null ? value.numericValue().doubleValue() : 0.0;
    }

    private Query buildQuery(List<String> terms, ArchiveSearchQuery query) {
        BooleanQuery.Builder builder = new BooleanQuery.Builder();
        if (terms.isEmpty()) {
            builder.add(new MatchAllDocsQuery(), BooleanClause.Occur.MUST);
        } else {
            BooleanQuery.Builder text = new BooleanQuery.Builder();
            for (String term : terms) {
                text.add(new TermQuery(new Term(FIELD_BODY, term)), BooleanClause.Occur.SHOULD);
            }
            text.setMinimumNumberShouldMatch(1);
            builder.add(text.build(), BooleanClause.Occur.MUST);
        }
        if (query.getTags() != null) {
            for (String tag : query.getTags()) {
                if (tag != null && !tag.isBlank()) {
                    builder.add(new TermQuery(new Term(FIELD_TAG, normalizeKeyword(tag))), BooleanClause.Occur.FILTER);
                }
            }
        }
        if (query.getCategory() != null && !query.getCategory().isBlank()) {
            builder.add(new TermQuery(new Term(FIELD_CATEGORY, normalizeKeyword(query.getCategory()))),
                    BooleanClause.Occur.FILTER);
        }
        if (query.getFrom() != null || query.getTo() != null) {
            long from = query.getFrom() != null ? query.getFrom().toEpochMilli() : Long.MIN_VALUE;
            long to = query.getTo() != null ? query.getTo().toEpochMilli() : Long.MAX_VALUE;
            builder.add(LongPoint.newRangeQuery(FIELD_ARCHIVED_AT, from, to), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    private List<String> analyze(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> terms = new LinkedHashSet<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD_BODY, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                terms.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to analyze query: " + text, e);
        }
        return new ArrayList<>(terms);
    }

    private Document toDocument(IndexDocument indexDocument) {
        ArchiveRecord record = indexDocument.record();
        String content = indexDocument.content() != null ? indexDocument.content() : "";
        Document document = new Document();
        document.add(new StringField(FIELD_ID, record.getArchiveId(), Field.Store.YES));
        document.add(new StringField(FIELD_PATH, record.getOriginalPath(), Field.Store.YES));

        StringBuilder body = new StringBuilder(content.length() + 256);
        body.append(record.getOriginalPath()).append('\n');
        if (record.getSummary() != null) {
            body.append(record.getSummary()).append('\n');
        }
        if (record.getKeywords() != null) {
            body.append(String.join(" ", record.getKeywords())).append('\n');
        }
        if (record.getTags() != null) {
            body.append(String.join(" ", record.getTags())).append('\n');
        }
        body.append(content);
        document.add(new TextField(FIELD_BODY, body.toString(), Field.Store.NO));

        document.add(new StoredField(FIELD_CONTENT, content));
        if (record.getSummary() != null) {
            document.add(new StoredField(FIELD_SUMMARY, record.getSummary()));
        }
        if (record.getTags() != null) {
            for (String tag : record.getTags()) {
                document.add(new StringField(FIELD_TAG, normalizeKeyword(tag), Field.Store.YES));
            }
        }
        String category = record.getCategory() != null ? record.getCategory() : "general";
        document.add(new StringField(FIELD_CATEGORY, normalizeKeyword(category), Field.Store.YES));
        long archivedAt = record.getArchivedAt() != null ? record.getArchivedAt().toEpochMilli() : 0L;
        document.add(new LongPoint(FIELD_ARCHIVED_AT, archivedAt));
        document.add(new StoredField(FIELD_ARCHIVED_AT, archivedAt));
        document.add(new StoredField(FIELD_SCORE, record.getRetentionScore()));
        return document;
    }

    private String snippet(String content, String summary, List<String> terms) {
        int snippetLength = properties.getIndex().getSnippetLength();
        String text = content != null ? content : "";
        int best = -1;
        for (String term : terms) {
            int position = indexOfIgnoreCase(text, term);
            if (position >= 0 && (best < 0 || position < best)) {
                best = position;
            }
        }
        if (best < 0) {
            if (summary != null && !summary.isBlank()) {
                return summary;
            }
            return collapse(text.length() > snippetLength ? text.substring(0, snippetLength) + "..." : text);
        }
        int end = Math.min(text.length(), best + snippetLength);
        int start = Math.min(end, Math.max(0, best - snippetLength / 2));
        String excerpt = text.substring(start, end);
        if (start > 0) {
            excerpt = "..." + excerpt;
        }
        if (end < text.length()) {
            excerpt = excerpt + "...";
        }
        return collapse(excerpt);
    }

    // offsets stay valid for the original text; lowercasing the whole string
    // can change its length
    private static int indexOfIgnoreCase(String text, String term) {
        int last = text.length() - term.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, term, 0, term.length())) {
                return i;
            }
        }
        return -1;
    }

    private static String collapse(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }

    private static String normalizeKeyword(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private void closeAll(List<IndexWriter> writers, List<Directory> directories) {
        for (IndexWriter writer : writers) {
            try {
                writer.close();
            } catch (IOException | RuntimeException e) {
                log.warn("[ArchiveIndex] Failed to close shard writer: {}", e.getMessage());
            }
        }
        for (Directory directory : directories) {
            try {
                directory.close();
            } catch (IOException e) {
                log.warn("[ArchiveIndex] Failed to close shard directory: {}", e.getMessage());
            }
        }
    }

    private record OpenShard(int shard, Directory directory, DirectoryReader reader) {

        void closeQuietly() {
            try {
                reader.close();
                directory.close();
            } catch (IOException e) {
                log.debug("[ArchiveIndex] Failed to close shard {} reader", shard, e);
            }
        }
    }
}
