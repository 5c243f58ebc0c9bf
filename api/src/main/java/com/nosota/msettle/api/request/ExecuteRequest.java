package com.nosota.msettle.api.request;

import jakarta.validation.constraints.NotNull;

/**
 * Request for executing the next batch of transfers.
 *
 * @param batchSize Maximum number of transfers to execute in this call
 */
public record ExecuteRequest(
        @NotNull(message = "Batch size is required")
        Integer batchSize
) {
}
