/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Published article count for one source.
 */
@Schema(
        description = "Published articles per source")
public record SourceCountType(@Schema(
        example = "ArchDaily") String source, long count) {
}
