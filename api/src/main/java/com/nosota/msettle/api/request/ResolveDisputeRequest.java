package com.nosota.msettle.api.request;

import com.nosota.msettle.api.model.DisputeOutcome;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Admin decision on a disputed settlement.
 *
 * @param outcome RESUME or FORCE_FAIL
 * @param note    Optional explanation recorded in the audit trail
 */
public record ResolveDisputeRequest(
        @NotNull(message = "Outcome is required")
        DisputeOutcome outcome,

        @Size(max = 500, message = "Note must not exceed 500 characters")
        String note
) {
}
