/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package archyards.crawler.exceptions;

/**
 * Exception thrown when the collection store cannot be read or written.
 *
 * <p>
 * Fatal to a pipeline run: the orchestrator aborts rather than risk an inconsistent promotion and reports the abort in
 * the run summary. The query service treats it as an empty published collection.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
