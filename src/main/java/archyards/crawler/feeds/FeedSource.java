/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.feeds;

import java.util.List;

import archyards.crawler.data.models.Candidate;
import archyards.crawler.exceptions.SourceUnavailableException;

/**
 * One external feed source, returning its current entries as normalized {@link Candidate} records.
 *
 * <p>
 * Implementations must be safe to call from a worker thread and must default missing optional fields (image absent,
 * comment and share counts 0) rather than fail.
 */
public interface FeedSource {

    /**
     * Display name of the source, also the diversity-cap key.
     */
    String name();

    /**
     * Fetches and normalizes the source's current entries.
     *
     * @return candidates in feed order, possibly empty
     * @throws SourceUnavailableException
     *             on transport or parse errors
     */
    List<Candidate> fetch();
}
