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

package me.golemcore.archivist.port.outbound;

import me.golemcore.archivist.domain.model.ArchiveSearchQuery;
import me.golemcore.archivist.domain.model.IndexDocument;
import me.golemcore.archivist.domain.model.SearchResult;
import me.golemcore.archivist.domain.model.SegmentHealth;

import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Port for the full-text index over archived content. The index is a derived
 * structure: it can always be rebuilt from the archive log, so none of its
 * failures may affect archive durability.
 */
public interface ArchiveIndexPort {

    /**
     * Add or replace the document of an archive record. Re-ingesting the same
     * archive id updates the existing document.
     *
     * @throws java.io.UncheckedIOException
     *             when the owning segment cannot be written
     */
    void ingest(IndexDocument document);

    /**
     * Search the readable segments. Unreadable segments are reported on the
     * result instead of failing the search.
     */
    SearchResult search(ArchiveSearchQuery query);

    /**
     * Remove the document of an archive record, if indexed.
     */
    void delete(String archiveId);

    /**
     * Wipe every segment and rebuild from the given documents.
     *
     * @param documents
     *            obtained once the index is locked against concurrent
     *            ingestion, so nothing ingested before the wipe is lost
     * @param interrupted
     *            checked between documents; when it returns true the rebuild
     *            stops and keeps what was indexed so far
     * @return number of documents indexed, always a prefix of the iteration
     *         order
     */
    int rebuild(Supplier<? extends Iterable<IndexDocument>> documents, BooleanSupplier interrupted);

    List<SegmentHealth> segmentHealth();
}
