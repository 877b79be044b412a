/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON object the text-generation model returns for one rewrite.
 *
 * @param rewrittenTitle
 *            headline in the house voice
 * @param rewrittenDescription
 *            description in the house voice, bounded in sentences
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RewriteResultType(@JsonProperty("rewritten_title") String rewrittenTitle,
        @JsonProperty("rewritten_description") String rewrittenDescription) {
}
