/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.exceptions;

/**
 * Exception thrown when a feed source cannot be fetched or parsed (transport error, non-200 response, invalid XML).
 *
 * <p>
 * Never escapes the per-source boundary: the orchestrator counts the source as zero candidates plus one recorded
 * failure and continues with the remaining sources.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
