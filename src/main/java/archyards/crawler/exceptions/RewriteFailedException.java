/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.exceptions;

/**
 * Exception thrown when one rewrite attempt returns unusable output: empty, not JSON, missing fields or over the
 * sentence limit.
 *
 * <p>
 * The attempt is retried up to the configured bound. The rewrite service converts the final failure into an article in
 * {@code rewrite_failed} status; this exception does not leave the orchestrator.
 */
public class RewriteFailedException extends RuntimeException {

    private final String articleId;

    public RewriteFailedException(String articleId, String message) {
        super(message);
        this.articleId = articleId;
    }

    public RewriteFailedException(String articleId, String message, Throwable cause) {
        super(message, cause);
        this.articleId = articleId;
    }

    public String getArticleId() {
        return articleId;
    }
}
