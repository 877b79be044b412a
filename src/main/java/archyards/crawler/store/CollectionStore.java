/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.store;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import archyards.crawler.data.models.Article;
import archyards.crawler.data.models.CollectionName;
import archyards.crawler.exceptions.StoreUnavailableException;

/**
 * Durable storage for the raw, rewritten and published article collections.
 *
 * <p>
 * Every write replaces a collection as a whole, so a concurrent reader sees either the previous or the new state,
 * never a partial one. The pipeline orchestrator is the only writer; readers never take a lock.
 *
 * <p>
 * All methods throw {@link StoreUnavailableException} when the backing storage cannot be read or written.
 */
public interface CollectionStore {

    /**
     * Returns the collection in stored order. An absent collection is empty.
     */
    List<Article> read(CollectionName collection);

    /**
     * Returns one article by id.
     */
    Optional<Article> find(CollectionName collection, String id);

    /**
     * Upserts articles by id. Existing ids keep their position and take the new record; new ids are appended in batch
     * order. Merging the same batch twice leaves the collection as merging it once.
     *
     * @param collection
     *            {@link CollectionName#RAW} or {@link CollectionName#REWRITTEN}
     * @param articles
     *            records whose status the collection accepts
     * @throws IllegalArgumentException
     *             for {@link CollectionName#PUBLISHED} (use {@link #promoteAll(List)}), for a status the collection
     *             does not accept, or for a rewritten record with no raw counterpart
     */
    void merge(CollectionName collection, List<Article> articles);

    /**
     * Promotes one rewritten article to published.
     *
     * @return the published record
     */
    default Article promote(String id) {
        return promoteAll(List.of(id)).get(0);
    }

    /**
     * Promotes a batch of rewritten articles in one atomic write of the published collection. The batch goes ahead of
     * earlier published articles, in the given order, and the collection is trimmed to its retention limit.
     *
     * @param ids
     *            ids of articles stored in {@link CollectionName#REWRITTEN} with status {@code rewritten}
     * @return the published records, in batch order
     * @throws IllegalArgumentException
     *             if any id is not a rewritten article; nothing is promoted in that case
     */
    List<Article> promoteAll(List<String> ids);

    /**
     * Copies the current published collection into the archive under the given day.
     *
     * @return the archive file, empty when archiving is disabled or nothing is published yet
     */
    Optional<Path> archivePublished(LocalDate day);
}
